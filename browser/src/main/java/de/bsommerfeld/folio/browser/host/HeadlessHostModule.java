package de.bsommerfeld.folio.browser.host;

import com.google.inject.AbstractModule;
import de.bsommerfeld.folio.viewport.VisibilityHost;

/**
 * Binds every host boundary to {@link HeadlessHost}. Rendering hosts ship
 * their own module with the same four bindings.
 */
public class HeadlessHostModule extends AbstractModule {

    @Override
    protected void configure() {
        bind(VisibilityHost.class).to(HeadlessHost.class);
        bind(ScrollAction.class).to(HeadlessHost.class);
        bind(ClipboardAction.class).to(HeadlessHost.class);
        bind(ExternalLinkAction.class).to(HeadlessHost.class);
    }
}
