package com.embedbot.embedding;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * OpenAI-compatible {@code /embeddings} endpoint over OkHttp.
 */
public class HttpEmbeddingProvider implements EmbeddingProvider {
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final int MAX_ERROR_SNIPPET = 256;

    private static final int HTTP_UNAUTHORIZED = 401;
    private static final int HTTP_FORBIDDEN = 403;
    private static final int HTTP_REQUEST_TIMEOUT = 408;
    private static final int HTTP_CONFLICT = 409;
    private static final int HTTP_TOO_EARLY = 425;
    private static final int HTTP_TOO_MANY_REQUESTS = 429;
    private static final int HTTP_INTERNAL_SERVER_ERROR = 500;

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final HttpUrl endpoint;

    public HttpEmbeddingProvider(OkHttpClient httpClient, String baseUrl) {
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        HttpUrl base = HttpUrl.parse(baseUrl);
        if (base == null) {
            throw new IllegalArgumentException("Invalid embedding base URL: " + baseUrl);
        }
        this.endpoint = base.newBuilder().addPathSegment("embeddings").build();
    }

    @Override
    public List<float[]> embed(EmbeddingRequest request, String apiKey) {
        String payload;
        try {
            payload = mapper.writeValueAsString(Map.of("model", request.model(), "input", request.inputs()));
        } catch (IOException e) {
            throw ProviderException.of(ProviderFailure.REJECTED, 0, "Unable to encode embedding request", e);
        }
        Request.Builder builder = new Request.Builder()
                .url(endpoint)
                .post(RequestBody.create(payload, JSON));
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }

        try (Response response = httpClient.newCall(builder.build()).execute()) {
            ResponseBody body = response.body();
            String text = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                int status = response.code();
                throw ProviderException.of(classify(status), status,
                        "Provider returned HTTP " + status + ": " + snippet(text, apiKey));
            }
            return parse(text, request.inputs().size());
        } catch (JsonProcessingException e) {
            throw ProviderException.of(ProviderFailure.MALFORMED_RESPONSE, 200, "Provider response is not valid JSON", e);
        } catch (InterruptedIOException e) {
            throw ProviderException.of(ProviderFailure.TIMEOUT, 0, "Provider call timed out", e);
        } catch (IOException e) {
            throw ProviderException.of(ProviderFailure.CONNECTION, 0,
                    "Provider connection failed: " + ApiKeys.redact(e.getMessage(), apiKey), e);
        }
    }

    static ProviderFailure classify(int status) {
        if (status == HTTP_UNAUTHORIZED || status == HTTP_FORBIDDEN) {
            return ProviderFailure.AUTHENTICATION;
        }
        if (status == HTTP_TOO_MANY_REQUESTS) {
            return ProviderFailure.RATE_LIMITED;
        }
        if (status == HTTP_REQUEST_TIMEOUT) {
            return ProviderFailure.TIMEOUT;
        }
        if (status == HTTP_CONFLICT || status == HTTP_TOO_EARLY || status >= HTTP_INTERNAL_SERVER_ERROR) {
            return ProviderFailure.SERVER_ERROR;
        }
        return ProviderFailure.REJECTED;
    }

    private List<float[]> parse(String text, int expected) throws IOException {
        JsonNode data = mapper.readTree(text).path("data");
        if (!data.isArray()) {
            throw ProviderException.of(ProviderFailure.MALFORMED_RESPONSE, 200, "Provider response has no data array");
        }
        List<JsonNode> entries = new ArrayList<>();
        data.forEach(entries::add);
        if (entries.size() != expected) {
            throw ProviderException.of(ProviderFailure.MALFORMED_RESPONSE, 200,
                    "Provider returned " + entries.size() + " embeddings for " + expected + " inputs");
        }
        entries.sort(Comparator.comparingInt(entry -> entry.path("index").asInt()));

        List<float[]> vectors = new ArrayList<>(entries.size());
        for (JsonNode entry : entries) {
            JsonNode vectorNode = entry.path("embedding");
            if (!vectorNode.isArray() || vectorNode.isEmpty()) {
                throw ProviderException.of(ProviderFailure.MALFORMED_RESPONSE, 200,
                        "Missing embedding for index " + entry.path("index").asInt());
            }
            float[] out = new float[vectorNode.size()];
            for (int i = 0; i < vectorNode.size(); i++) {
                out[i] = (float) vectorNode.get(i).asDouble();
            }
            vectors.add(out);
        }
        return vectors;
    }

    private static String snippet(String body, String apiKey) {
        String cleaned = ApiKeys.redact(body, apiKey).replaceAll("\\s+", " ").trim();
        if (cleaned.length() > MAX_ERROR_SNIPPET) {
            return cleaned.substring(0, MAX_ERROR_SNIPPET) + "...";
        }
        return cleaned.isEmpty() ? "no details" : cleaned;
    }
}
