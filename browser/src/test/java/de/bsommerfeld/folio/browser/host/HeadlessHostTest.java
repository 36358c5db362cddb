package de.bsommerfeld.folio.browser.host;

import de.bsommerfeld.folio.viewport.VisibilitySubscription;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HeadlessHostTest {

    private final HeadlessHost host = new HeadlessHost();

    @Test
    void supportsVisibilitySignals_shouldBeFalse() {
        assertFalse(host.supportsVisibilitySignals());
    }

    @Test
    void resolves_shouldAcceptAnyNonBlankId() {
        assertTrue(host.resolves("entry/ozark"));
        assertFalse(host.resolves(" "));
        assertFalse(host.resolves(null));
    }

    @Test
    void subscribe_shouldReturnInertSubscription() {
        VisibilitySubscription subscription = host.subscribe(List.of("home"), List.of(0.5),
                batch -> fail("no batches expected"));

        assertFalse(subscription.isActive());
        subscription.unobserve("home");
        subscription.close();
    }

    @Test
    void actions_shouldBeRecorded() {
        host.scrollTo("projects");
        host.write("someone@example.org");
        host.open("https://example.org");

        assertEquals("projects", host.getLastScrollTarget());
        assertEquals("someone@example.org", host.getClipboard());
    }
}
