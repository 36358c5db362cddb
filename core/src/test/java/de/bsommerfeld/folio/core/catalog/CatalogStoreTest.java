package de.bsommerfeld.folio.core.catalog;

import de.bsommerfeld.folio.core.domain.Entry;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CatalogStoreTest {

    @Test
    void tagIndex_shouldStartWithAllAndKeepFirstSeenOrder() {
        CatalogStore store = new CatalogStore(List.of(
                entry("A", "React", "UI/UX"),
                entry("B", "Java", "UI/UX"),
                entry("C", "Python")));

        assertEquals(List.of("All", "React", "UI/UX", "Java", "Python"), store.tagIndex().tags());
    }

    @Test
    void tagIndex_shouldContainAllForEmptyCatalog() {
        CatalogStore store = new CatalogStore(List.of());

        assertEquals(List.of(TagIndex.ALL), store.tagIndex().tags());
        assertTrue(store.tagIndex().contains(TagIndex.ALL));
    }

    @Test
    void tagIndex_shouldIgnoreCredentialTags() {
        CatalogStore store = new CatalogStore(List.of(entry("A", "React")), List.of(entry("Cert", "NLP")));

        assertFalse(store.tagIndex().contains("NLP"));
    }

    @Test
    void entries_shouldBeImmutable() {
        CatalogStore store = new CatalogStore(List.of(entry("A", "React")));
        assertThrows(UnsupportedOperationException.class, () -> store.entries().add(entry("B")));
    }

    @Test
    void constructor_shouldRejectDuplicateTitles() {
        assertThrows(CatalogException.class,
                () -> new CatalogStore(List.of(entry("Same")), List.of(entry("Same"))));
    }

    @Test
    void constructor_shouldRejectTitlesWithSameElementId() {
        CatalogException e = assertThrows(CatalogException.class,
                () -> new CatalogStore(List.of(entry("Cosmic Fusion"), entry("Cosmic-Fusion!"))));
        assertTrue(e.getMessage().contains("entry/cosmic-fusion"));
    }

    @Test
    void findByTitle_shouldSearchBothSections() {
        Entry project = entry("Project");
        Entry cert = entry("Cert");
        CatalogStore store = new CatalogStore(List.of(project), List.of(cert));

        assertEquals(project, store.findByTitle("Project").orElseThrow());
        assertEquals(cert, store.findByTitle("Cert").orElseThrow());
        assertTrue(store.findByTitle("Missing").isEmpty());
    }

    static Entry entry(String title, String... tags) {
        return new Entry(title, "2025", title + " summary", "", new LinkedHashSet<>(List.of(tags)), null, List.of());
    }
}
