package org.chessarena.agent;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.chessarena.settings.AgentSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * One-shot client for OpenAI-compatible {@code /chat/completions} endpoints
 * (OpenAI, Groq, xAI, Ollama and custom servers).
 */
public class ChatCompletionAgent implements MoveAgent {
    private static final Logger logger = LoggerFactory.getLogger(ChatCompletionAgent.class);

    private final AgentSettings settings;
    private final HttpClient httpClient;
    private final Gson gson = new Gson();

    public ChatCompletionAgent(AgentSettings settings) {
        this(settings, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build());
    }

    ChatCompletionAgent(AgentSettings settings, HttpClient httpClient) {
        this.settings = settings;
        this.httpClient = httpClient;
    }

    @Override
    public String name() {
        return settings.getName();
    }

    @Override
    public CompletableFuture<String> requestMove(String prompt) {
        HttpRequest request;
        try {
            request = buildRequest(prompt);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(
                    new AgentException("Invalid endpoint for " + name() + ": " + settings.getBaseUrl(), e));
        }

        logger.debug("Requesting move from {} ({})", name(), settings.getModel());
        CompletableFuture<HttpResponse<String>> transport =
                httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString());
        CompletableFuture<String> result = transport.thenApply(this::extractContent);
        result.whenComplete((content, error) -> {
            if (result.isCancelled()) {
                transport.cancel(true);
            }
        });
        return result;
    }

    HttpRequest buildRequest(String prompt) {
        JsonObject message = new JsonObject();
        message.addProperty("role", "user");
        message.addProperty("content", prompt);
        JsonArray messages = new JsonArray();
        messages.add(message);

        JsonObject body = new JsonObject();
        body.addProperty("model", settings.getModel());
        body.add("messages", messages);
        body.addProperty("temperature", settings.getTemperature());
        body.addProperty("top_p", settings.getTopP());
        body.addProperty("max_tokens", settings.getMaxTokens());
        body.addProperty("stream", false);

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(endpoint()))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(gson.toJson(body)));
        String apiKey = settings.getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        return builder.build();
    }

    String endpoint() {
        String base = settings.getBaseUrl() == null ? "" : settings.getBaseUrl().trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/chat/completions";
    }

    private String extractContent(HttpResponse<String> response) {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            String message = providerError(response.body());
            throw new CompletionException(new AgentException(
                    message != null ? message : "HTTP " + status + " from " + name()));
        }
        try {
            JsonObject json = JsonParser.parseString(response.body()).getAsJsonObject();
            JsonArray choices = json.getAsJsonArray("choices");
            if (choices == null || choices.isEmpty()) {
                throw new CompletionException(new AgentException("Response from " + name() + " has no choices"));
            }
            JsonObject first = choices.get(0).getAsJsonObject();
            JsonObject message = first.getAsJsonObject("message");
            JsonElement content = message == null ? null : message.get("content");
            String text = content == null || content.isJsonNull() ? "" : content.getAsString();
            logger.debug("Response from {}: {}", name(), text);
            return text;
        } catch (JsonParseException | IllegalStateException | ClassCastException e) {
            throw new CompletionException(new AgentException("Malformed response from " + name(), e));
        }
    }

    private String providerError(String body) {
        try {
            JsonElement root = JsonParser.parseString(body);
            if (!root.isJsonObject()) {
                return null;
            }
            JsonElement error = root.getAsJsonObject().get("error");
            if (error == null || error.isJsonNull()) {
                return null;
            }
            if (error.isJsonPrimitive()) {
                return error.getAsString();
            }
            JsonElement message = error.getAsJsonObject().get("message");
            return message == null || message.isJsonNull() ? null : message.getAsString();
        } catch (JsonParseException | IllegalStateException e) {
            logger.debug("Error body from {} is not JSON", name());
            return null;
        }
    }
}
