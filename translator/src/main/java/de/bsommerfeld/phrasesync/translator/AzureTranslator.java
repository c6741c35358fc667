package de.bsommerfeld.phrasesync.translator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.google.inject.Singleton;
import de.bsommerfeld.phrasesync.core.config.TranslatorConfig;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link TranslationOracle} backed by the Azure Translator text API (v3.0).
 *
 * <h3>Request</h3>
 * One {@code POST {endpoint}/translate?api-version=3.0&from=..&to=..} per
 * call, body {@code [{"Text": "..."}, ...]}. Authentication uses the
 * {@code Ocp-Apim-Subscription-Key} and {@code Ocp-Apim-Subscription-Region}
 * headers.
 *
 * <h3>Response</h3>
 * An array parallel to the request, each element carrying
 * {@code translations[0].text}. The array is returned as-is in order; the
 * caller checks the count.
 *
 * <h3>Status handling</h3>
 * <ul>
 * <li>2xx: parse and return</li>
 * <li>429: {@link RateLimitedException}, retried by {@link BatchTranslator}</li>
 * <li>everything else (e.g. 400036 "target language invalid"):
 * {@link OracleException}</li>
 * </ul>
 */
@Singleton
public class AzureTranslator implements TranslationOracle {

    private static final Logger LOG = LoggerFactory.getLogger(AzureTranslator.class);

    static final String API_VERSION = "3.0";
    static final int STATUS_TOO_MANY_REQUESTS = 429;

    private final TranslatorConfig config;
    private final HttpClient httpClient;

    /**
     * Jackson's {@link ObjectMapper} is thread-safe once configured, so one
     * instance serves every request.
     */
    private final ObjectMapper mapper;

    @Inject
    public AzureTranslator(TranslatorConfig config) {
        this(config, HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(config.requestTimeout())
                .build());
    }

    AzureTranslator(TranslatorConfig config, HttpClient httpClient) {
        this.config = config;
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
    }

    @Override
    public List<String> translate(String fromLocale, String toLocale, List<String> texts) throws OracleException {
        if (texts.isEmpty()) {
            return List.of();
        }
        String apiKey = config.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw new OracleException("No translator API key configured");
        }

        HttpRequest request = HttpRequest.newBuilder(buildUri(fromLocale, toLocale))
                .timeout(config.requestTimeout())
                .header("Ocp-Apim-Subscription-Key", apiKey)
                .header("Ocp-Apim-Subscription-Region", config.getRegion())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(encodeBody(texts), StandardCharsets.UTF_8))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new OracleException("Translator request failed for " + toLocale, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OracleException("Translator request interrupted for " + toLocale, e);
        }

        return handleResponse(response.statusCode(), response.body(), toLocale);
    }

    List<String> handleResponse(int statusCode, String body, String toLocale) throws OracleException {
        if (statusCode >= 200 && statusCode < 300) {
            return parseResponse(body);
        }
        if (statusCode == STATUS_TOO_MANY_REQUESTS) {
            throw new RateLimitedException("Rate limit exceeded (429)", body);
        }
        LOG.error("Translator returned {} for {}: {}", statusCode, toLocale, body);
        throw new OracleException("Translator returned status " + statusCode + " for " + toLocale);
    }

    URI buildUri(String fromLocale, String toLocale) {
        String base = config.getEndpoint().endsWith("/")
                ? config.getEndpoint().substring(0, config.getEndpoint().length() - 1)
                : config.getEndpoint();
        return URI.create(base + "/translate?api-version=" + API_VERSION
                + "&from=" + encode(fromLocale)
                + "&to=" + encode(toLocale));
    }

    String encodeBody(List<String> texts) throws OracleException {
        ArrayNode body = mapper.createArrayNode();
        for (String text : texts) {
            body.addObject().put("Text", text);
        }
        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new OracleException("Failed to encode translator request", e);
        }
    }

    /**
     * Extracts {@code translations[0].text} from every element of the response
     * array, in order.
     */
    List<String> parseResponse(String body) throws OracleException {
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new OracleException("Malformed translator response", e);
        }
        if (root == null || !root.isArray()) {
            throw new OracleException("Translator response is not an array");
        }

        List<String> result = new ArrayList<>(root.size());
        for (JsonNode item : root) {
            JsonNode text = item.path("translations").path(0).path("text");
            if (!text.isTextual()) {
                throw new OracleException("Translator response item without text: " + item);
            }
            result.add(text.asText());
        }
        return result;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
