package de.bsommerfeld.phrasesync.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Classpath access to the store's SQL.
 *
 * <ul>
 * <li>{@link #load(String)}: one statement from {@code sql/<name>.sql}, e.g.
 * {@code upsert-translation}</li>
 * <li>{@link #script(String)}: a multi-statement script such as
 * {@code schema.sql}, split into executable statements</li>
 * </ul>
 * Resources are read once per JVM.
 *
 * @see SqlPhraseStore
 */
public final class SqlLoader {

    /** Statement terminator: a semicolon at the end of a line or of the file. */
    private static final Pattern STATEMENT_END = Pattern.compile(";\\s*(\\r?\\n|$)");

    private static final Map<String, String> RESOURCES = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * @param name file stem under {@code sql/}, without extension
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static String load(String name) {
        return RESOURCES.computeIfAbsent("sql/" + name + ".sql", SqlLoader::read).trim();
    }

    /**
     * Returns the non-blank statements of a script resource, in file order and
     * without their terminators. Lines starting with {@code --} are comments.
     *
     * @param resource classpath path of the script, e.g. {@code schema.sql}
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static List<String> script(String resource) {
        String text = RESOURCES.computeIfAbsent(resource, SqlLoader::read);
        List<String> statements = new ArrayList<>();
        for (String part : STATEMENT_END.split(text)) {
            String statement = stripComments(part);
            if (!statement.isEmpty()) {
                statements.add(statement);
            }
        }
        return statements;
    }

    private static String stripComments(String part) {
        StringBuilder sb = new StringBuilder();
        for (String line : part.split("\\r?\\n")) {
            if (!line.trim().startsWith("--")) {
                sb.append(line).append('\n');
            }
        }
        return sb.toString().trim();
    }

    private static String read(String path) {
        try (InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("SQL resource not found: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL resource: " + path, e);
        }
    }
}
