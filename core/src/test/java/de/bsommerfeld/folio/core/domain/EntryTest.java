package de.bsommerfeld.folio.core.domain;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class EntryTest {

    @Test
    void elementId_shouldSlugTitle() {
        Entry entry = entry("Ozark (LMS Dashboard)");
        assertEquals("entry/ozark-lms-dashboard", entry.elementId());
    }

    @Test
    void elementId_shouldCollapsePunctuationRuns() {
        assertEquals("entry/hr-management-payroll-system", entry("HR Management & Payroll System").elementId());
        assertEquals("entry/rickby-ai-voice-calling-bot", entry("Rickby (AI Voice Calling Bot)").elementId());
    }

    @Test
    void tags_shouldKeepCatalogOrder() {
        Set<String> tags = new LinkedHashSet<>(List.of("Java", "JavaFX", "MVC", "Data Viz"));
        Entry entry = new Entry("HR", "2025", "", "", tags, "Java", List.of());

        assertEquals(List.of("Java", "JavaFX", "MVC", "Data Viz"), List.copyOf(entry.tags()));
        assertThrows(UnsupportedOperationException.class, () -> entry.tags().add("Other"));
    }

    @Test
    void constructor_shouldDefaultNullCollectionsAndText() {
        Entry entry = new Entry("Bare", null, null, null, null, null, null);

        assertEquals("", entry.summary());
        assertEquals("", entry.detailsText());
        assertTrue(entry.tags().isEmpty());
        assertTrue(entry.links().isEmpty());
    }

    @Test
    void externalLinks_shouldOnlyReturnExternalKind() {
        EntryLink details = EntryLink.detail("Details");
        EntryLink github = EntryLink.external("GitHub", "https://github.com/example/repo");
        Entry entry = new Entry("Rickby", "2025", "", "", Set.of(), null, List.of(details, github));

        assertEquals(List.of(github), entry.externalLinks());
    }

    @Test
    void externalLink_shouldRequireTarget() {
        assertThrows(IllegalArgumentException.class, () -> EntryLink.external("GitHub", " "));
    }

    @Test
    void detailLink_shouldDropTarget() {
        EntryLink link = new EntryLink("Details", LinkKind.DETAIL, "ignored");
        assertNull(link.target());
    }

    @Test
    void linkKind_shouldAcceptCatalogSpellings() {
        assertEquals(LinkKind.DETAIL, LinkKind.fromCatalogName("detail"));
        assertEquals(LinkKind.DETAIL, LinkKind.fromCatalogName("modal"));
        assertEquals(LinkKind.EXTERNAL, LinkKind.fromCatalogName("External"));
        assertEquals(LinkKind.EXTERNAL, LinkKind.fromCatalogName("link"));
        assertThrows(IllegalArgumentException.class, () -> LinkKind.fromCatalogName("popup"));
        assertThrows(IllegalArgumentException.class, () -> LinkKind.fromCatalogName(null));
    }

    private static Entry entry(String title) {
        return new Entry(title, "2025", "", "", Set.of(), null, List.of());
    }
}
