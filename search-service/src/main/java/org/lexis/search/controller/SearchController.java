package org.lexis.search.controller;

import com.google.gson.Gson;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.lexis.indexing.model.IndexStats;
import org.lexis.search.distance.Suggestion;
import org.lexis.search.model.BooleanOperator;
import org.lexis.search.model.DistanceResponse;
import org.lexis.search.model.ProximityMatch;
import org.lexis.search.model.SearchResponse;
import org.lexis.search.model.WildcardResponse;
import org.lexis.search.service.SearchService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class SearchController {
	private static final Logger logger = LoggerFactory.getLogger(SearchController.class);
	private static final Gson gson = new Gson();
	private final SearchService<String> searchService;
	private final int defaultLimit;
	private final int defaultProximity;
	private final double defaultMaxDistance;

	public SearchController(SearchService<String> searchService, int defaultLimit, int defaultProximity,
							double defaultMaxDistance) {
		this.searchService = searchService;
		this.defaultLimit = defaultLimit;
		this.defaultProximity = defaultProximity;
		this.defaultMaxDistance = defaultMaxDistance;
	}

	/**
	 * Register all routes with the Javalin app
	 */
	public void registerRoutes(Javalin app) {
		app.get("/health", this::handleHealth);

		app.get("/search/and", ctx -> handleBoolean(ctx, BooleanOperator.AND));
		app.get("/search/or", ctx -> handleBoolean(ctx, BooleanOperator.OR));
		app.get("/search/near", this::handleNear);
		app.get("/search/wildcard", this::handleWildcard);

		app.get("/terms/suggest", this::handleSuggest);
		app.get("/distance", this::handleDistance);

		app.get("/index/stats", this::handleStats);
		app.post("/index/rebuild", this::handleRebuild);

		logger.info("Search routes registered");
	}

	/**
	 * GET /health
	 * Health check endpoint
	 */
	private void handleHealth(Context ctx) {
		Map<String, Object> health = new HashMap<>();
		health.put("service", "search-service");
		health.put("status", "running");
		health.put("timestamp", System.currentTimeMillis());
		health.put("index_loaded", searchService.isReady());

		if (searchService.isReady()) {
			IndexStats stats = searchService.getStats();
			health.put("documents", stats.documents());
			health.put("unique_terms", stats.uniqueTerms());
		}

		ctx.result(gson.toJson(health));
	}

	/**
	 * GET /search/and?terms={t1,t2,...}&limit={limit}
	 * GET /search/or?terms={t1,t2,...}&limit={limit}
	 */
	private void handleBoolean(Context ctx, BooleanOperator operator) {
		try {
			String termsParam = requireParam(ctx, "terms");
			List<String> words = Arrays.stream(termsParam.split("[,\\s]+"))
					.map(String::trim)
					.filter(s -> !s.isEmpty())
					.collect(Collectors.toList());
			int limit = intParam(ctx, "limit", defaultLimit);

			SearchResponse<String> response = searchService.search(operator, words, limit);
			ctx.status(200).result(gson.toJson(response));
			logger.info("Returned {} results for {} query", response.returnedResults(), operator);

		} catch (IllegalArgumentException e) {
			badRequest(ctx, e);
		} catch (Exception e) {
			serverError(ctx, "Search failed", e);
		}
	}

	/**
	 * GET /search/near?first={term}&second={term}&proximity={k}&limit={limit}
	 */
	private void handleNear(Context ctx) {
		try {
			String first = requireParam(ctx, "first");
			String second = requireParam(ctx, "second");
			int proximity = intParam(ctx, "proximity", defaultProximity);
			int limit = intParam(ctx, "limit", defaultLimit);

			SearchResponse<ProximityMatch<String>> response = searchService.near(first, second, proximity, limit);
			ctx.status(200).result(gson.toJson(response));
			logger.info("Returned {} proximity matches", response.returnedResults());

		} catch (IllegalArgumentException e) {
			badRequest(ctx, e);
		} catch (Exception e) {
			serverError(ctx, "Proximity search failed", e);
		}
	}

	/**
	 * GET /search/wildcard?q={pattern}&limit={limit}
	 */
	private void handleWildcard(Context ctx) {
		try {
			String pattern = requireParam(ctx, "q");
			int limit = intParam(ctx, "limit", defaultLimit);

			WildcardResponse<String> response = searchService.wildcard(pattern, limit);
			ctx.status(200).result(gson.toJson(response));
			logger.info("Wildcard '{}' matched {} terms", pattern, response.matchedTerms().size());

		} catch (IllegalArgumentException e) {
			badRequest(ctx, e);
		} catch (Exception e) {
			serverError(ctx, "Wildcard search failed", e);
		}
	}

	/**
	 * GET /terms/suggest?term={term}&max={distance}&limit={limit}
	 */
	private void handleSuggest(Context ctx) {
		try {
			String term = requireParam(ctx, "term");
			double maxDistance = doubleParam(ctx, "max", defaultMaxDistance);
			int limit = intParam(ctx, "limit", defaultLimit);

			List<Suggestion> suggestions = searchService.suggest(term, maxDistance, limit);

			Map<String, Object> response = new HashMap<>();
			response.put("term", term);
			response.put("suggestions", suggestions);
			ctx.status(200).result(gson.toJson(response));

		} catch (IllegalArgumentException e) {
			badRequest(ctx, e);
		} catch (Exception e) {
			serverError(ctx, "Suggestion failed", e);
		}
	}

	/**
	 * GET /distance?source={text}&dest={text}
	 */
	private void handleDistance(Context ctx) {
		try {
			String source = ctx.queryParam("source");
			String dest = ctx.queryParam("dest");
			if (source == null || dest == null) {
				throw new IllegalArgumentException("Query parameters 'source' and 'dest' are required.");
			}

			DistanceResponse response = searchService.distance(source, dest);
			ctx.status(200).result(gson.toJson(response));

		} catch (IllegalArgumentException e) {
			badRequest(ctx, e);
		} catch (Exception e) {
			serverError(ctx, "Distance computation failed", e);
		}
	}

	/**
	 * GET /index/stats
	 */
	private void handleStats(Context ctx) {
		try {
			IndexStats stats = searchService.getStats();
			ctx.status(200).result(gson.toJson(stats));
			logger.debug("Retrieved index statistics");

		} catch (Exception e) {
			serverError(ctx, "Failed to retrieve statistics", e);
		}
	}

	/**
	 * POST /index/rebuild
	 * Rebuild every index from the document collection and swap it in
	 */
	private void handleRebuild(Context ctx) {
		try {
			logger.info("Received index rebuild request");

			IndexStats stats = searchService.rebuild();

			Map<String, Object> response = new HashMap<>();
			response.put("status", "completed");
			response.put("stats", stats);
			ctx.status(200).result(gson.toJson(response));
			logger.info("Successfully rebuilt index with {} documents", stats.documents());

		} catch (Exception e) {
			Map<String, String> error = new HashMap<>();
			error.put("status", "failed");
			error.put("error", e.getMessage());
			ctx.status(500).result(gson.toJson(error));
			logger.error("Failed to rebuild index", e);
		}
	}

	private static String requireParam(Context ctx, String name) {
		String value = ctx.queryParam(name);
		if (value == null || value.trim().isEmpty()) {
			throw new IllegalArgumentException("Query parameter '" + name + "' is required.");
		}
		return value;
	}

	private static int intParam(Context ctx, String name, int defaultValue) {
		String value = ctx.queryParam(name);
		if (value == null || value.isEmpty()) {
			return defaultValue;
		}
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid " + name + " format. Must be an integer.", e);
		}
	}

	private static double doubleParam(Context ctx, String name, double defaultValue) {
		String value = ctx.queryParam(name);
		if (value == null || value.isEmpty()) {
			return defaultValue;
		}
		try {
			return Double.parseDouble(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid " + name + " format. Must be a number.", e);
		}
	}

	private static void badRequest(Context ctx, IllegalArgumentException e) {
		Map<String, String> error = new HashMap<>();
		error.put("error", e.getMessage());
		ctx.status(400).result(gson.toJson(error));
		logger.warn("Rejected request {}: {}", ctx.path(), e.getMessage());
	}

	private static void serverError(Context ctx, String message, Exception e) {
		Map<String, String> error = new HashMap<>();
		error.put("error", message + ": " + e.getMessage());
		ctx.status(500).result(gson.toJson(error));
		logger.error(message, e);
	}
}
