package de.bsommerfeld.folio.browser.config;

import com.google.inject.AbstractModule;
import com.google.inject.Singleton;
import de.bsommerfeld.folio.core.catalog.CatalogLoader;
import de.bsommerfeld.folio.core.catalog.CatalogStore;
import de.bsommerfeld.folio.core.config.BrowserConfig;
import de.bsommerfeld.folio.core.config.ConfigLoader;
import de.bsommerfeld.folio.core.filter.FilterEngine;
import de.bsommerfeld.folio.core.util.StorageUtils;
import de.bsommerfeld.folio.viewport.timer.ExecutorTimerService;
import de.bsommerfeld.folio.viewport.timer.TimerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Guice module for the browser core. Loads configuration and catalog at
 * injector creation; host boundaries come from a separate host module such
 * as {@link de.bsommerfeld.folio.browser.host.HeadlessHostModule}.
 */
public class BrowserModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(BrowserModule.class);

    private final Path configPath;
    private final String catalogResource;

    public BrowserModule() {
        this(StorageUtils.getConfigFile(StorageUtils.APP_NAME), CatalogLoader.DEFAULT_RESOURCE);
    }

    public BrowserModule(Path configPath, String catalogResource) {
        this.configPath = configPath;
        this.catalogResource = catalogResource;
    }

    @Override
    protected void configure() {
        // Config and catalog are vital, failures propagate and abort startup
        BrowserConfig config = new ConfigLoader().load(configPath);
        bind(BrowserConfig.class).toInstance(config);

        CatalogStore catalog = new CatalogLoader().loadResource(catalogResource);
        bind(CatalogStore.class).toInstance(catalog);

        bind(FilterEngine.class).in(Singleton.class);
        bind(TimerService.class).to(ExecutorTimerService.class);

        LOG.info("Browser module configured (catalog '{}', {} landmarks)",
                catalogResource, config.getLandmarks().size());
    }
}
