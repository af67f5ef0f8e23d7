package com.chessvision;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Asks the Stockfish online REST API for the best move of a position.
 */
public class StockfishClient implements BestMoveProvider {

    private static final Logger log = LoggerFactory.getLogger(StockfishClient.class);

    // e.g. "bestmove f6e4 ponder d2e4"
    private static final Pattern MOVE_PATTERN = Pattern.compile("bestmove\\s([a-h][1-8][a-h][1-8][qrbn]?)");

    private final String apiUrl;
    private final HttpClient client;

    public StockfishClient(String apiUrl) {
        this.apiUrl = apiUrl;
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    public StockfishClient(DetectorConfig config) {
        this(config.getEngineUrl());
    }

    @Override
    public CompletableFuture<EngineSuggestion> bestMove(String fen, int depth) {
        if (depth < 1 || depth > 15) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Depth must be 1-15: " + depth));
        }
        // Encode FEN to be URL-safe
        String encodedFen = URLEncoder.encode(fen, StandardCharsets.UTF_8);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(apiUrl + "?fen=" + encodedFen + "&depth=" + depth))
                .timeout(Duration.ofSeconds(30))
                .GET()
                .build();

        log.info("Requesting engine move at depth {} for {}", depth, fen);
        return client.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> {
                    if (response.statusCode() != 200) {
                        throw new CompletionException(new IOException("HTTP Error: " + response.statusCode()));
                    }
                    EngineSuggestion suggestion = parseResponse(response.body());
                    log.info("Engine suggests {}", suggestion);
                    return suggestion;
                });
    }

    EngineSuggestion parseResponse(String json) {
        JsonElement parsed;
        try {
            parsed = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new IllegalStateException("Engine response is not JSON: " + json, e);
        }
        if (parsed == null || !parsed.isJsonObject()) {
            throw new IllegalStateException("Engine response is not a JSON object: " + json);
        }
        JsonObject body = parsed.getAsJsonObject();
        JsonElement success = body.get("success");
        if (success != null && !success.isJsonNull() && !success.getAsBoolean()) {
            String data = body.has("data") ? body.get("data").getAsString() : "unknown error";
            throw new IllegalStateException("Engine refused the position: " + data);
        }

        JsonElement bestmove = body.get("bestmove");
        Matcher moveMatcher = MOVE_PATTERN.matcher(bestmove == null || bestmove.isJsonNull() ? "" : bestmove.getAsString());
        if (!moveMatcher.find()) {
            throw new IllegalStateException("Could not parse move from engine response: " + json);
        }

        String evaluation = "?";
        JsonElement mate = body.get("mate");
        JsonElement eval = body.get("evaluation");
        if (mate != null && !mate.isJsonNull()) {
            evaluation = "#" + mate.getAsString();
        } else if (eval != null && !eval.isJsonNull()) {
            evaluation = eval.getAsString();
        }
        return new EngineSuggestion(moveMatcher.group(1), evaluation);
    }
}
