package de.bsommerfeld.phrasesync.translator;

import java.util.List;

/**
 * External machine-translation service, treated as a black-box batch
 * function.
 *
 * <p>
 * On success the returned list must preserve the order and count of
 * {@code texts}. Callers verify the count only.
 *
 * @see AzureTranslator
 * @see EchoTranslator
 */
public interface TranslationOracle {

    /**
     * Translates {@code texts} from {@code fromLocale} into {@code toLocale}.
     *
     * @throws RateLimitedException if the provider throttled the request; the
     *                              same request may succeed later
     * @throws OracleException      for every other failure
     */
    List<String> translate(String fromLocale, String toLocale, List<String> texts) throws OracleException;
}
