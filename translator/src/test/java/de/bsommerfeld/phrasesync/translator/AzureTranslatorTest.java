package de.bsommerfeld.phrasesync.translator;

import com.sun.net.httpserver.HttpServer;
import de.bsommerfeld.phrasesync.core.config.TranslatorConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests AzureTranslator's request encoding, response parsing and status
 * classification. The round-trip tests run against a local
 * {@link HttpServer} standing in for the Azure endpoint.
 */
class AzureTranslatorTest {

    private TranslatorConfig config;
    private AzureTranslator translator;
    private HttpServer server;

    @BeforeEach
    void setUp() {
        config = new TranslatorConfig();
        config.setApiKey("test-key");
        translator = new AzureTranslator(config);
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    // -- Request --

    @Test
    void buildUri_shouldCarryApiVersionAndLocales() {
        URI uri = translator.buildUri("en", "zh-Hans");

        assertEquals("https://api.cognitive.microsofttranslator.com/translate"
                + "?api-version=3.0&from=en&to=zh-Hans", uri.toString());
    }

    @Test
    void buildUri_shouldTolerateTrailingSlashOnEndpoint() {
        config.setEndpoint("http://localhost:1234/");

        assertEquals("http://localhost:1234/translate?api-version=3.0&from=en&to=fr",
                translator.buildUri("en", "fr").toString());
    }

    @Test
    void encodeBody_shouldWrapEveryTextInObject() throws Exception {
        String body = translator.encodeBody(List.of("Hello", "Say \"hi\""));

        assertEquals("[{\"Text\":\"Hello\"},{\"Text\":\"Say \\\"hi\\\"\"}]", body);
    }

    // -- Response --

    @Test
    void parseResponse_shouldExtractFirstTranslationOfEachItem() throws Exception {
        String body = "[{\"translations\":[{\"text\":\"Bonjour\",\"to\":\"fr\"}]},"
                + "{\"translations\":[{\"text\":\"Au revoir\",\"to\":\"fr\"}]}]";

        assertEquals(List.of("Bonjour", "Au revoir"), translator.parseResponse(body));
    }

    @Test
    void parseResponse_shouldRejectMalformedJson() {
        assertThrows(OracleException.class, () -> translator.parseResponse("not json"));
        assertThrows(OracleException.class, () -> translator.parseResponse("{\"error\":{}}"));
        assertThrows(OracleException.class, () -> translator.parseResponse("[{\"translations\":[]}]"));
    }

    @Test
    void handleResponse_shouldClassify429AsRateLimited() {
        RateLimitedException ex = assertThrows(RateLimitedException.class,
                () -> translator.handleResponse(429, "{\"error\":{\"code\":429001}}", "fr"));
        assertTrue(ex.getResponseBody().contains("429001"));
    }

    @Test
    void handleResponse_shouldClassifyOtherErrorsAsOracleFailure() {
        OracleException ex = assertThrows(OracleException.class,
                () -> translator.handleResponse(400, "{\"error\":{\"code\":400036}}", "xx"));
        assertFalse(ex instanceof RateLimitedException);
        assertThrows(OracleException.class, () -> translator.handleResponse(503, "", "fr"));
    }

    // -- translate() --

    @Test
    void translate_shouldShortCircuitEmptyInput() throws Exception {
        config.setApiKey("");
        assertEquals(List.of(), translator.translate("en", "fr", List.of()));
    }

    @Test
    void translate_shouldFailWithoutApiKey() {
        config.setApiKey(" ");
        assertThrows(OracleException.class, () -> translator.translate("en", "fr", List.of("Hello")));
    }

    @Test
    void translate_shouldRoundTripAgainstEndpoint() throws Exception {
        AtomicReference<String> requestBody = new AtomicReference<>();
        AtomicReference<String> keyHeader = new AtomicReference<>();
        startServer(200, "[{\"translations\":[{\"text\":\"Bonjour\",\"to\":\"fr\"}]}]", requestBody, keyHeader);

        List<String> result = translator.translate("en", "fr", List.of("Hello"));

        assertEquals(List.of("Bonjour"), result);
        assertEquals("[{\"Text\":\"Hello\"}]", requestBody.get());
        assertEquals("test-key", keyHeader.get());
    }

    @Test
    void translate_shouldSignalRateLimitFromEndpoint() throws Exception {
        startServer(429, "{\"error\":{\"code\":429000}}", new AtomicReference<>(), new AtomicReference<>());

        assertThrows(RateLimitedException.class, () -> translator.translate("en", "fr", List.of("Hello")));
    }

    private void startServer(int status, String response, AtomicReference<String> requestBody,
            AtomicReference<String> keyHeader) throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/translate", exchange -> {
            requestBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            keyHeader.set(exchange.getRequestHeaders().getFirst("Ocp-Apim-Subscription-Key"));
            byte[] bytes = response.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
        config.setEndpoint("http://127.0.0.1:" + server.getAddress().getPort());
    }
}
