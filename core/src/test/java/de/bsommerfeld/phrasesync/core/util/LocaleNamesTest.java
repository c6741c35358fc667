package de.bsommerfeld.phrasesync.core.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LocaleNamesTest {

    @Test
    void bundleFileName_shouldReplaceSubtagSeparator() {
        assertEquals("app_fr.arb", LocaleNames.bundleFileName("fr"));
        assertEquals("app_zh_Hans.arb", LocaleNames.bundleFileName("zh-Hans"));
    }

    @Test
    void errorFileName_shouldUseErrorsPrefix() {
        assertEquals("app_errors_pt_PT.txt", LocaleNames.errorFileName("pt-PT"));
    }

    @Test
    void localeFromBundleFileName_shouldInvertBundleFileName() {
        assertEquals("zh-Hans", LocaleNames.localeFromBundleFileName("app_zh_Hans.arb"));
        assertEquals("fr", LocaleNames.localeFromBundleFileName("app_fr.arb"));
    }

    @Test
    void localeFromBundleFileName_shouldRejectForeignFiles() {
        assertNull(LocaleNames.localeFromBundleFileName("phrases.json"));
        assertNull(LocaleNames.localeFromBundleFileName("app_.arb"));
    }
}
