package de.bsommerfeld.phrasesync.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

public class SyncConfig {

    @JsonProperty("source-locale")
    private String sourceLocale = "en";

    @JsonProperty("target-locales")
    private List<String> targetLocales = new ArrayList<>(List.of("fr", "de", "es", "it", "pt", "nl"));

    @JsonProperty("input-file")
    private String inputFile = "input/phrases.json";

    @JsonProperty("output-dir")
    private String outputDir = "output";

    /** Report translations that came back identical to the source text. */
    @JsonProperty("flag-pass-through")
    private boolean flagPassThrough = true;

    public String getSourceLocale() {
        return sourceLocale;
    }

    public void setSourceLocale(String sourceLocale) {
        this.sourceLocale = sourceLocale;
    }

    public List<String> getTargetLocales() {
        return targetLocales;
    }

    public void setTargetLocales(List<String> targetLocales) {
        this.targetLocales = targetLocales;
    }

    public String getInputFile() {
        return inputFile;
    }

    public void setInputFile(String inputFile) {
        this.inputFile = inputFile;
    }

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    public boolean isFlagPassThrough() {
        return flagPassThrough;
    }

    public void setFlagPassThrough(boolean flagPassThrough) {
        this.flagPassThrough = flagPassThrough;
    }
}
