package de.bsommerfeld.phrasesync.translator;

import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Offline {@link TranslationOracle} for TEST mode. Returns every text
 * prefixed with the target locale ({@code "[fr] Hello"}), so runs can be
 * exercised end to end without credentials or network access.
 */
@Singleton
public class EchoTranslator implements TranslationOracle {

    private static final Logger LOG = LoggerFactory.getLogger(EchoTranslator.class);

    public EchoTranslator() {
        LOG.warn("#######################################################");
        LOG.warn("#  TEST MODE ENABLED: translations are NOT real        #");
        LOG.warn("#######################################################");
    }

    @Override
    public List<String> translate(String fromLocale, String toLocale, List<String> texts) {
        List<String> result = new ArrayList<>(texts.size());
        for (String text : texts) {
            result.add("[" + toLocale + "] " + text);
        }
        return result;
    }
}
