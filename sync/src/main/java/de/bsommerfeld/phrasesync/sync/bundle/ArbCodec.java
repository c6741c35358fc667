package de.bsommerfeld.phrasesync.sync.bundle;

import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads and writes ARB bundles: flat JSON objects mapping phrase keys to
 * text. Keys starting with {@code @} carry metadata (descriptions,
 * placeholders) and are never treated as phrases.
 */
public final class ArbCodec {

    public static final String METADATA_PREFIX = "@";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ObjectWriter WRITER = prettyWriter(MAPPER, "  ");

    private ArbCodec() {
    }

    public static boolean isMetadataKey(String key) {
        return key.startsWith(METADATA_PREFIX);
    }

    /**
     * Parses an ARB document into phrases in document order. Non-text values
     * are kept in their JSON form.
     *
     * @throws IOException if the content is not a JSON object
     */
    public static Map<String, String> decode(String json) throws IOException {
        JsonNode root = MAPPER.readTree(json);
        if (root == null || !root.isObject()) {
            throw new IOException("ARB content is not a JSON object");
        }
        Map<String, String> phrases = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (isMetadataKey(field.getKey())) {
                continue;
            }
            JsonNode value = field.getValue();
            phrases.put(field.getKey(), value.isValueNode() ? value.asText() : value.toString());
        }
        return phrases;
    }

    public static Map<String, String> read(Path file) throws IOException {
        return decode(Files.readString(file));
    }

    /**
     * Serializes phrases as a two-space indented JSON object. Metadata keys in
     * {@code phrases} are dropped.
     */
    public static String encode(Map<String, String> phrases) throws IOException {
        Map<String, String> clean = new LinkedHashMap<>();
        phrases.forEach((key, value) -> {
            if (!isMetadataKey(key)) {
                clean.put(key, value);
            }
        });
        return WRITER.writeValueAsString(clean);
    }

    public static void write(Path file, Map<String, String> phrases) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, encode(phrases) + "\n");
    }

    /**
     * Writer producing {@code "key": "value"} pairs with the given indent and
     * {@code \n} line breaks on every platform.
     */
    static ObjectWriter prettyWriter(ObjectMapper mapper, String indent) {
        DefaultIndenter indenter = new DefaultIndenter(indent, "\n");
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
                .withSeparators(Separators.createDefaultInstance()
                        .withObjectFieldValueSpacing(Separators.Spacing.AFTER));
        printer.indentObjectsWith(indenter);
        printer.indentArraysWith(indenter);
        return mapper.writer(printer);
    }
}
