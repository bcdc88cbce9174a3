package com.nsqlexec.llm;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.nsqlexec.config.AppConfig;
import com.nsqlexec.config.ApiKeyPool;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Client for an OpenAI-compatible chat completion API, used by one worker.
 *
 * <p>Each client sends every request with a single API key. A run shares one {@link ApiKeyPool}
 * across its workers and {@link #forWorker} picks the key of each worker, so that concurrent
 * workers spread their requests over the keys.
 */
public class ChatClient {

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");

    private final OkHttpClient httpClient;
    private final String endpoint;
    private final String model;
    private final String apiKey;
    private final double temperature;
    private final int maxTokens;

    public ChatClient(String endpoint, String model, String apiKey, double temperature, int maxTokens,
                      int timeoutSeconds) {
        this.endpoint = endpoint;
        this.model = model;
        this.apiKey = apiKey;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .writeTimeout(30, TimeUnit.SECONDS)
                .build();
    }

    /**
     * Client of worker {@code workerId}, using that worker's key of {@code keys}.
     */
    public static ChatClient forWorker(AppConfig config, ApiKeyPool keys, int workerId) {
        return new ChatClient(config.getLlmEndpoint(), config.getLlmModel(), keys.keyFor(workerId),
                config.getLlmTemperature(), config.getLlmMaxTokens(), config.getLlmTimeoutSeconds());
    }

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isEmpty();
    }

    /**
     * Sends one system and one user message and returns the content of the first choice.
     */
    public String chat(String systemPrompt, String userPrompt) throws IOException, ApiException {
        if (!isConfigured()) {
            throw new ApiException("no LLM API key configured (llm.api_key, llm.api_keys or llm.api_keys_file)");
        }
        Request request = new Request.Builder()
                .url(endpoint)
                .header("Authorization", "Bearer " + apiKey)
                .post(RequestBody.create(completionRequest(systemPrompt, userPrompt).toString(), JSON))
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String text = body != null ? body.string() : "";
            if (!response.isSuccessful()) {
                throw new ApiException("chat completion failed with HTTP " + response.code() + ": " + text);
            }
            return firstChoiceContent(text);
        }
    }

    JsonObject completionRequest(String systemPrompt, String userPrompt) {
        JsonArray messages = new JsonArray();
        messages.add(message("system", systemPrompt));
        messages.add(message("user", userPrompt));

        JsonObject body = new JsonObject();
        body.addProperty("model", model);
        body.addProperty("temperature", temperature);
        body.addProperty("max_tokens", maxTokens);
        body.add("messages", messages);
        return body;
    }

    private static JsonObject message(String role, String content) {
        JsonObject message = new JsonObject();
        message.addProperty("role", role);
        message.addProperty("content", content);
        return message;
    }

    static String firstChoiceContent(String responseBody) throws ApiException {
        JsonObject response;
        try {
            JsonElement parsed = JsonParser.parseString(responseBody);
            if (!parsed.isJsonObject()) {
                throw new ApiException("chat completion response is not a JSON object");
            }
            response = parsed.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new ApiException("malformed chat completion response: " + e.getMessage(), e);
        }

        if (response.has("error") && response.get("error").isJsonObject()) {
            JsonElement message = response.getAsJsonObject("error").get("message");
            throw new ApiException("API error: " + (message != null && message.isJsonPrimitive()
                    ? message.getAsString() : "unknown error"));
        }
        JsonElement choices = response.get("choices");
        if (choices == null || !choices.isJsonArray() || choices.getAsJsonArray().isEmpty()) {
            throw new ApiException("no choices in chat completion response");
        }
        JsonElement choice = choices.getAsJsonArray().get(0);
        JsonElement message = choice.isJsonObject() ? choice.getAsJsonObject().get("message") : null;
        JsonElement content = message != null && message.isJsonObject()
                ? message.getAsJsonObject().get("content") : null;
        if (content == null || !content.isJsonPrimitive()) {
            throw new ApiException("no message content in chat completion response");
        }
        return content.getAsString();
    }

    /**
     * The API could not be reached or returned no usable answer.
     */
    public static class ApiException extends Exception {
        public ApiException(String message) {
            super(message);
        }

        public ApiException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
