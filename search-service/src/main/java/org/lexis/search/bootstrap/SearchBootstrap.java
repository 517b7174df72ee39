package org.lexis.search.bootstrap;

import org.lexis.indexing.config.IndexingConfig;
import org.lexis.indexing.service.IndexingService;
import org.lexis.indexing.storage.DirectoryDocumentCollection;
import org.lexis.indexing.text.TextNormalizer;
import org.lexis.search.config.SearchConfig;
import org.lexis.search.controller.SearchController;
import org.lexis.search.service.SearchService;
import org.lexis.search.web.SearchHttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.javalin.Javalin;

import java.io.IOException;

/**
 * Application bootstrapper for the Search Service.
 *
 * <p>Loads configuration, builds the first index snapshot, starts the HTTP API, and registers a JVM
 * shutdown hook.</p>
 */
public final class SearchBootstrap {
    private static final Logger logger = LoggerFactory.getLogger(SearchBootstrap.class);

    private SearchBootstrap() {}

    /**
     * Starts the Search Service.
     *
     * <p>On startup failure, logs the error and exits with code {@code 1}.</p>
     */
    public static void run() {
        try {
            start();
        } catch (Exception e) {
            logger.error("Failed to start Search Service", e);
            System.exit(1);
        }
    }

    private static void start() throws IOException {
        SearchConfig cfg = SearchConfig.load();
        SearchService<String> service = buildService(cfg);
        service.rebuild();
        Javalin app = startHttp(cfg, service);
        addShutdownHook(app);
        logger.info("Search Service started successfully on port {}.", cfg.serverPort());
    }

    private static SearchService<String> buildService(SearchConfig cfg) {
        IndexingConfig indexing = cfg.indexing();
        logger.info("Documents: {}/*.{}, k={}, stop words={}",
            indexing.documents().path(), indexing.documents().extension(),
            indexing.kgramSize(), indexing.normalization().stopWords().size());

        IndexingService indexingService = new IndexingService(
            new TextNormalizer(indexing.normalization()),
            indexing.kgramSize()
        );
        DirectoryDocumentCollection documents = new DirectoryDocumentCollection(
            indexing.documents().path(),
            indexing.documents().extension()
        );
        return new SearchService<>(indexingService, documents, cfg.maxResults());
    }

    private static Javalin startHttp(SearchConfig cfg, SearchService<String> service) {
        SearchController controller = new SearchController(
            service,
            cfg.defaultLimit(),
            cfg.defaultProximity(),
            cfg.suggestMaxDistance()
        );
        return SearchHttpServer.start(cfg.serverPort(), controller);
    }

    private static void addShutdownHook(Javalin app) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> shutdown(app)));
    }

    private static void shutdown(Javalin app) {
        logger.info("Shutting down Search Service...");
        app.stop();
        logger.info("Search Service stopped.");
    }
}
