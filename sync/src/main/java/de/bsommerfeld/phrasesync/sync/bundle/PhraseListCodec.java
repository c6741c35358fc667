package de.bsommerfeld.phrasesync.sync.bundle;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The source phrase list ({@code phrases.json}): a JSON array of
 * single-entry objects, e.g. {@code [{"greeting": "Hello"}, {"farewell": "Goodbye"}]}.
 *
 * <p>
 * A key occurring more than once keeps its first position and its last
 * value. Objects with several entries are accepted and read entry by entry.
 */
public final class PhraseListCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ObjectWriter WRITER = ArbCodec.prettyWriter(MAPPER, "    ");

    private PhraseListCodec() {
    }

    public static Map<String, String> decode(String json) throws IOException {
        JsonNode root = MAPPER.readTree(json);
        if (root == null || !root.isArray()) {
            throw new IOException("Phrase list is not a JSON array");
        }
        Map<String, String> phrases = new LinkedHashMap<>();
        int index = 0;
        for (JsonNode element : root) {
            if (!element.isObject()) {
                throw new IOException("Phrase list element " + index + " is not a JSON object");
            }
            Iterator<Map.Entry<String, JsonNode>> fields = element.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (ArbCodec.isMetadataKey(field.getKey())) {
                    continue;
                }
                JsonNode value = field.getValue();
                phrases.put(field.getKey(), value.isValueNode() ? value.asText() : value.toString());
            }
            index++;
        }
        return phrases;
    }

    public static Map<String, String> read(Path file) throws IOException {
        return decode(Files.readString(file));
    }

    public static String encode(Map<String, String> phrases) throws IOException {
        List<Map<String, String>> list = new ArrayList<>(phrases.size());
        phrases.forEach((key, value) -> {
            if (!ArbCodec.isMetadataKey(key)) {
                list.add(Map.of(key, value));
            }
        });
        return WRITER.writeValueAsString(list);
    }

    public static void write(Path file, Map<String, String> phrases) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, encode(phrases) + "\n");
    }

    /**
     * Turns an ARB bundle into a phrase list, e.g. to bootstrap
     * {@code phrases.json} from an existing {@code app_en.arb}.
     *
     * @return number of phrases written
     */
    public static int convertFromArb(Path arbFile, Path phraseListFile) throws IOException {
        Map<String, String> phrases = ArbCodec.read(arbFile);
        write(phraseListFile, phrases);
        return phrases.size();
    }
}
