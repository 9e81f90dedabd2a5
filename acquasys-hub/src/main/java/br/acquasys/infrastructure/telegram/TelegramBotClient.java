package br.acquasys.infrastructure.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Thin Telegram Bot API client: {@code getMe}, {@code getUpdates} and {@code sendMessage}.
 */
public class TelegramBotClient {
    private static final Logger log = LoggerFactory.getLogger(TelegramBotClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String DEFAULT_API_BASE = "https://api.telegram.org";

    private final HttpClient httpClient;
    private final String baseUrl;

    public TelegramBotClient(String botToken) {
        this(DEFAULT_API_BASE, botToken, HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build());
    }

    public TelegramBotClient(String apiBase, String botToken, HttpClient httpClient) {
        this.baseUrl = apiBase + "/bot" + botToken;
        this.httpClient = httpClient;
    }

    /**
     * @return bot display name as "first_name (@username)"
     */
    public String getMe() {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + "/getMe"))
            .timeout(Duration.ofSeconds(10))
            .GET()
            .build();
        JsonNode result = call("getMe", request);
        return result.path("first_name").asText("?") + " (@" + result.path("username").asText("?") + ")";
    }

    /**
     * Long-poll for new updates.
     *
     * @param offset         first update id to return
     * @param timeoutSeconds server-side long-poll timeout
     */
    public List<TelegramUpdate> getUpdates(long offset, int timeoutSeconds) {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + "/getUpdates?offset=" + offset + "&timeout=" + timeoutSeconds))
            .timeout(Duration.ofSeconds(timeoutSeconds + 10L))
            .GET()
            .build();

        JsonNode result = call("getUpdates", request);
        List<TelegramUpdate> updates = new ArrayList<>();
        for (JsonNode u : result) {
            JsonNode message = u.path("message");
            updates.add(new TelegramUpdate(
                u.path("update_id").asLong(),
                message.path("chat").path("id").asText(null),
                message.path("text").isTextual() ? message.path("text").asText() : null,
                message.path("from").path("first_name").asText("operator")));
        }
        return updates;
    }

    /**
     * Send an HTML-formatted message. Completes with false on any failure; never exceptionally.
     */
    public CompletableFuture<Boolean> sendMessage(String chatId, String html) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put("chat_id", chatId);
        body.put("text", html);
        body.put("parse_mode", "HTML");

        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + "/sendMessage"))
            .timeout(Duration.ofSeconds(15))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
            .build();

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
            .thenApply(response -> {
                if (response.statusCode() != 200) {
                    log.warn("[TELEGRAM] sendMessage HTTP {}: {}", response.statusCode(), response.body());
                    return false;
                }
                return true;
            })
            .exceptionally(e -> {
                log.warn("[TELEGRAM] sendMessage failed: {}", e.getMessage());
                return false;
            });
    }

    private JsonNode call(String method, HttpRequest request) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TelegramApiException(method, "Request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TelegramApiException(method, "Interrupted", e);
        }

        if (response.statusCode() != 200) {
            throw new TelegramApiException(method, response.statusCode(), response.body());
        }
        try {
            JsonNode root = MAPPER.readTree(response.body());
            if (!root.path("ok").asBoolean(false)) {
                throw new TelegramApiException(method, response.statusCode(),
                    root.path("description").asText("ok=false"));
            }
            return root.path("result");
        } catch (IOException e) {
            throw new TelegramApiException(method, "Invalid response body", e);
        }
    }
}
