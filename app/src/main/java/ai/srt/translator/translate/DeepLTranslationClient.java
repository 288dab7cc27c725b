package ai.srt.translator.translate;

import ai.srt.translator.config.ConfigStore;
import ai.srt.translator.translate.TranslationException.Failure;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client for the DeepL REST API ({@code /v2/translate} and {@code /v2/usage}).
 */
public class DeepLTranslationClient implements TranslationClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(DeepLTranslationClient.class);

    static final URI FREE_API_URL = URI.create("https://api-free.deepl.com");
    static final URI PRO_API_URL = URI.create("https://api.deepl.com");
    private static final String FREE_KEY_SUFFIX = ":fx";
    private static final Duration REQUEST_TIMEOUT = Duration.ofMinutes(2);
    private static final int STATUS_QUOTA_EXCEEDED = 456;

    private final ConfigStore configStore;
    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final Optional<URI> apiUrlOverride;

    public DeepLTranslationClient(ConfigStore configStore, Optional<URI> apiUrlOverride) {
        this(configStore, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(30)).build(), new ObjectMapper(), apiUrlOverride);
    }

    DeepLTranslationClient(ConfigStore configStore, HttpClient httpClient, ObjectMapper mapper, Optional<URI> apiUrlOverride) {
        this.configStore = Objects.requireNonNull(configStore, "configStore");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.apiUrlOverride = apiUrlOverride == null ? Optional.empty() : apiUrlOverride;
    }

    @Override
    public Optional<String> credentialKey() {
        return Optional.of(ConfigStore.DEEPL_API_KEY);
    }

    @Override
    public List<String> translateBatch(TranslationRequest request) {
        Objects.requireNonNull(request, "request");
        if (request.texts().isEmpty()) {
            return List.of();
        }
        String apiKey = requireApiKey();
        ObjectNode payload = mapper.createObjectNode();
        ArrayNode texts = payload.putArray("text");
        request.texts().forEach(texts::add);
        payload.put("target_lang", request.targetLang().trim().toUpperCase(Locale.ROOT));
        request.sourceLang().ifPresent(lang -> payload.put("source_lang", lang.trim().toUpperCase(Locale.ROOT)));
        // Line breaks inside a cue are layout, not sentence boundaries.
        payload.put("split_sentences", "nonewlines");
        payload.put("preserve_formatting", true);

        LOGGER.info("Submitting {} texts to DeepL ({} -> {})", request.size(),
                request.sourceLang().orElse("auto"), request.targetLang());
        JsonNode response = send(HttpRequest.newBuilder(endpoint(apiKey, "/v2/translate"))
                .timeout(REQUEST_TIMEOUT)
                .header("Authorization", "DeepL-Auth-Key " + apiKey)
                .header("Content-Type", "application/json; charset=utf-8")
                .POST(HttpRequest.BodyPublishers.ofString(writeJson(payload), StandardCharsets.UTF_8))
                .build());

        JsonNode translations = response.path("translations");
        if (!translations.isArray() || translations.size() != request.size()) {
            throw new TranslationException(Failure.PROVIDER_ERROR,
                    "DeepL returned " + translations.size() + " translations for " + request.size() + " texts");
        }
        List<String> result = new ArrayList<>(translations.size());
        for (JsonNode translation : translations) {
            result.add(translation.path("text").asText(""));
        }
        return result;
    }

    /**
     * Fetches character usage for the current billing period.
     */
    public ProviderUsage usage() {
        String apiKey = requireApiKey();
        JsonNode response = send(HttpRequest.newBuilder(endpoint(apiKey, "/v2/usage"))
                .timeout(REQUEST_TIMEOUT)
                .header("Authorization", "DeepL-Auth-Key " + apiKey)
                .GET()
                .build());
        return new ProviderUsage(response.path("character_count").asLong(0), response.path("character_limit").asLong(0));
    }

    static URI baseUrlFor(String apiKey) {
        return apiKey.endsWith(FREE_KEY_SUFFIX) ? FREE_API_URL : PRO_API_URL;
    }

    private String requireApiKey() {
        return configStore.get(ConfigStore.DEEPL_API_KEY)
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .orElseThrow(() -> new TranslationException(Failure.AUTHENTICATION_FAILED, "DeepL API key is not configured"));
    }

    private URI endpoint(String apiKey, String path) {
        String base = apiUrlOverride.orElseGet(() -> baseUrlFor(apiKey)).toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + path);
    }

    private JsonNode send(HttpRequest request) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new TranslationException(Failure.TRANSPORT_ERROR, "Interrupted while calling DeepL", ex);
        } catch (IOException ex) {
            throw new TranslationException(Failure.TRANSPORT_ERROR, "Failed to reach DeepL: " + ex.getMessage(), ex);
        }
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            try {
                return mapper.readTree(response.body());
            } catch (IOException ex) {
                throw new TranslationException(Failure.PROVIDER_ERROR, "DeepL returned an unreadable response", ex);
            }
        }
        throw classify(status, response.body());
    }

    private TranslationException classify(int status, String body) {
        String detail = "HTTP " + status + ": " + extractMessage(body);
        LOGGER.warn("DeepL request failed with {}", detail);
        if (status == 401 || status == 403) {
            return new TranslationException(Failure.AUTHENTICATION_FAILED, detail);
        }
        if (status == STATUS_QUOTA_EXCEEDED) {
            return new TranslationException(Failure.QUOTA_EXCEEDED_REMOTE, detail);
        }
        return new TranslationException(Failure.PROVIDER_ERROR, detail);
    }

    private String extractMessage(String body) {
        if (body == null || body.isBlank()) {
            return "(empty response)";
        }
        try {
            JsonNode node = mapper.readTree(body);
            if (node.hasNonNull("message")) {
                return node.get("message").asText();
            }
        } catch (IOException ex) {
            LOGGER.debug("DeepL error body is not JSON", ex);
        }
        return body.strip();
    }

    private String writeJson(JsonNode payload) {
        try {
            return mapper.writeValueAsString(payload);
        } catch (IOException ex) {
            throw new TranslationException(Failure.PROVIDER_ERROR, "Failed to encode DeepL request", ex);
        }
    }
}
