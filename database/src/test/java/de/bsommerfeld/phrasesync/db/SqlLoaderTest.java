package de.bsommerfeld.phrasesync.db;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlLoaderTest {

    @Test
    void load_shouldReturnTrimmedStatement() {
        String sql = SqlLoader.load("select-locales");
        assertTrue(sql.startsWith("SELECT DISTINCT locale"));
        assertFalse(sql.endsWith("\n"));
    }

    @Test
    void load_shouldFailForMissingResource() {
        assertThrows(IllegalStateException.class, () -> SqlLoader.load("does-not-exist"));
    }

    @Test
    void script_shouldSplitSchemaIntoStatementsWithoutComments() {
        List<String> statements = SqlLoader.script("schema.sql");

        assertEquals(3, statements.size());
        assertTrue(statements.get(0).startsWith("CREATE TABLE IF NOT EXISTS source_phrases"));
        assertTrue(statements.get(1).startsWith("CREATE TABLE IF NOT EXISTS translations"));
        assertTrue(statements.get(2).startsWith("CREATE INDEX"));
        assertTrue(statements.stream().noneMatch(s -> s.endsWith(";") || s.contains("--")));
    }

    @Test
    void script_shouldFailForMissingResource() {
        assertThrows(IllegalStateException.class, () -> SqlLoader.script("missing.sql"));
    }
}
