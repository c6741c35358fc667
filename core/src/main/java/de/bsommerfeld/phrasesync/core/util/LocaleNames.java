package de.bsommerfeld.phrasesync.core.util;

/**
 * File naming for per-locale artifacts. Locale tags use {@code -} as the
 * subtag separator ({@code zh-Hans}, {@code pt-PT}) while bundle file names
 * use {@code _} ({@code app_zh_Hans.arb}).
 */
public final class LocaleNames {

    private static final String PREFIX = "app_";

    private LocaleNames() {
    }

    public static String normalizeForFilename(String locale) {
        return locale.trim().replace('-', '_');
    }

    public static String bundleFileName(String locale) {
        return PREFIX + normalizeForFilename(locale) + ".arb";
    }

    public static String errorFileName(String locale) {
        return PREFIX + "errors_" + normalizeForFilename(locale) + ".txt";
    }

    /**
     * Extracts the locale tag from a bundle file name, the inverse of
     * {@link #bundleFileName}. Returns {@code null} for names that are not
     * bundles.
     */
    public static String localeFromBundleFileName(String fileName) {
        if (!fileName.startsWith(PREFIX) || !fileName.endsWith(".arb")) {
            return null;
        }
        String stem = fileName.substring(PREFIX.length(), fileName.length() - ".arb".length());
        if (stem.isEmpty()) {
            return null;
        }
        return stem.replace('_', '-');
    }
}
