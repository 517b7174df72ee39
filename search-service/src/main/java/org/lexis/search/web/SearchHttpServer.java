package org.lexis.search.web;

import com.google.gson.Gson;
import org.lexis.search.controller.SearchController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.javalin.Javalin;

import java.util.Map;

/** HTTP server wiring for the Search Service. */
public final class SearchHttpServer {
    private static final Logger logger = LoggerFactory.getLogger(SearchHttpServer.class);
    private static final String JSON = "application/json";
    private static final Gson GSON = new Gson();

    private SearchHttpServer() {}

    /**
     * Creates the Javalin app with JSON defaults, request timing and a JSON 404 body.
     *
     * @param controller controller that registers the query routes
     * @return configured, not yet started {@link Javalin} instance
     */
    public static Javalin create(SearchController controller) {
        Javalin app = Javalin.create(cfg -> {
            cfg.showJavalinBanner = false;
            cfg.http.defaultContentType = JSON;
            cfg.requestLogger.http((ctx, ms) ->
                logger.debug("{} {} -> {} in {} ms", ctx.method(), ctx.path(), ctx.statusCode(), ms));
        });
        app.error(404, ctx -> ctx.contentType(JSON).result(GSON.toJson(Map.of("error", "No route for " + ctx.path()))));
        controller.registerRoutes(app);
        return app;
    }

    /**
     * Creates the app and binds it.
     *
     * @param port port to bind
     * @param controller controller that registers routes
     * @return started {@link Javalin} instance
     */
    public static Javalin start(int port, SearchController controller) {
        Javalin app = create(controller).start(port);
        logger.info("Search HTTP API listening on port {}", port);
        return app;
    }
}
