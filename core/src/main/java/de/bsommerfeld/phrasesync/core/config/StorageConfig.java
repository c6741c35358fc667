package de.bsommerfeld.phrasesync.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

public class StorageConfig {

    /** Relative paths resolve against the application data directory. */
    @JsonProperty("database-file")
    private String databaseFile = "phrases.db";

    public String getDatabaseFile() {
        return databaseFile;
    }

    public void setDatabaseFile(String databaseFile) {
        this.databaseFile = databaseFile;
    }
}
