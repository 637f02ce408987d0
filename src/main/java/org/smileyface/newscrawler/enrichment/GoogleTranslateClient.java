package org.smileyface.newscrawler.enrichment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
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
import java.util.Objects;

/**
 * {@link TranslationClient} for the Cloud Translation v2 REST API, authenticated with an API key.
 * Each method is a single HTTP call; retrying is left to {@link RetryExecutor}.
 */
public class GoogleTranslateClient implements TranslationClient {

    private static final Logger log = LoggerFactory.getLogger(GoogleTranslateClient.class);

    static final String DETECT_PATH = "/language/translate/v2/detect";
    static final String TRANSLATE_PATH = "/language/translate/v2";

    private final HttpClient client;
    private final ObjectMapper mapper;
    private final String baseUrl;
    private final String apiKey;
    private final Duration timeout;

    public GoogleTranslateClient(TranslationProperties properties, ObjectMapper mapper) {
        this(HttpClient.newBuilder()
                        .connectTimeout(Duration.ofMillis(Math.max(1, properties.getTimeoutMs())))
                        .version(HttpClient.Version.HTTP_1_1)
                        .build(),
                properties, mapper);
    }

    GoogleTranslateClient(HttpClient client, TranslationProperties properties, ObjectMapper mapper) {
        this.client = Objects.requireNonNull(client, "client");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        String base = Objects.requireNonNullElse(properties.getBaseUrl(), "").trim();
        this.baseUrl = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        this.apiKey = Objects.requireNonNullElse(properties.getApiKey(), "").trim();
        this.timeout = Duration.ofMillis(Math.max(1, properties.getTimeoutMs()));
    }

    @Override
    public String detectLanguage(String text) throws TranslationException {
        ObjectNode body = mapper.createObjectNode();
        body.put("q", text);
        JsonNode response = post(DETECT_PATH, body);
        JsonNode language = response.path("data").path("detections").path(0).path(0).path("language");
        if (!language.isTextual() || language.asText().isBlank()) {
            throw new TranslationException(TranslationException.Kind.UNEXPECTED,
                    "Detection response carries no language");
        }
        return language.asText();
    }

    @Override
    public String translate(String text, String sourceLanguage, String targetLanguage) throws TranslationException {
        ObjectNode body = mapper.createObjectNode();
        body.put("q", text);
        if (sourceLanguage != null && !sourceLanguage.isBlank()) {
            body.put("source", sourceLanguage);
        }
        body.put("target", targetLanguage);
        body.put("format", "text");
        JsonNode response = post(TRANSLATE_PATH, body);
        JsonNode translated = response.path("data").path("translations").path(0).path("translatedText");
        if (!translated.isTextual()) {
            throw new TranslationException(TranslationException.Kind.UNEXPECTED,
                    "Translation response carries no translatedText");
        }
        return translated.asText();
    }

    private JsonNode post(String path, ObjectNode body) throws TranslationException {
        if (apiKey.isEmpty()) {
            throw new TranslationException(TranslationException.Kind.AUTHENTICATION,
                    "No translation API key configured (translation.api-key)");
        }
        URI uri = URI.create(baseUrl + path + "?key=" + URLEncoder.encode(apiKey, StandardCharsets.UTF_8));
        HttpResponse<String> response;
        try {
            HttpRequest request = HttpRequest.newBuilder(uri)
                    .timeout(timeout)
                    .header("Content-Type", "application/json; charset=utf-8")
                    .header("Accept", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body), StandardCharsets.UTF_8))
                    .build();
            response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            throw new TranslationException(TranslationException.Kind.INVALID_INPUT, "Could not encode request", e);
        } catch (IOException e) {
            throw new TranslationException(TranslationException.Kind.UNAVAILABLE,
                    "Translation service unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TranslationException(TranslationException.Kind.UNEXPECTED, "Interrupted while calling " + path, e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            TranslationException.Kind kind = classify(status);
            log.debug("POST {} returned HTTP {} ({})", path, status, kind);
            throw new TranslationException(kind, "HTTP " + status + " from " + path, status, null);
        }
        try {
            return mapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new TranslationException(TranslationException.Kind.UNEXPECTED, "Unparseable response from " + path, e);
        }
    }

    static TranslationException.Kind classify(int status) {
        if (status == 429) return TranslationException.Kind.RATE_LIMITED;
        if (status >= 500) return TranslationException.Kind.SERVER_ERROR;
        if (status == 401 || status == 403) return TranslationException.Kind.AUTHENTICATION;
        if (status >= 400) return TranslationException.Kind.INVALID_INPUT;
        return TranslationException.Kind.UNEXPECTED;
    }
}
