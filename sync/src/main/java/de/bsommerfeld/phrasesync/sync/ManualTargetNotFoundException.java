package de.bsommerfeld.phrasesync.sync;

/**
 * An operator tried to protect a {@code (phraseKey, locale)} pair that has no
 * translation yet. A phrase must be translated at least once before there is
 * a value worth preserving.
 */
public class ManualTargetNotFoundException extends Exception {

    private final String phraseKey;
    private final String locale;

    public ManualTargetNotFoundException(String phraseKey, String locale) {
        super("No translation for '" + phraseKey + "' in locale " + locale);
        this.phraseKey = phraseKey;
        this.locale = locale;
    }

    public String getPhraseKey() {
        return phraseKey;
    }

    public String getLocale() {
        return locale;
    }
}
