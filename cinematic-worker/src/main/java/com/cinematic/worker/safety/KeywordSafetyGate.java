package com.cinematic.worker.safety;

import com.cinematic.worker.CapabilityException;
import com.cinematic.worker.storage.AssetStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Safety gate backed by a list of blocked terms.
 * Prompts are matched on whole words, case-insensitively. Image assets are
 * loaded from the asset store and their embedded text metadata is screened
 * the same way.
 */
public class KeywordSafetyGate implements SafetyGate {

    private static final Logger log = LoggerFactory.getLogger(KeywordSafetyGate.class);

    private final List<BlockedTerm> blockedTerms;
    private final AssetStore assetStore;

    private record BlockedTerm(String term, Pattern pattern) {}

    public KeywordSafetyGate(Collection<String> blockedTerms, AssetStore assetStore) {
        this.blockedTerms = blockedTerms.stream()
            .filter(t -> t != null && !t.isBlank())
            .map(t -> t.strip().toLowerCase(Locale.ROOT))
            .distinct()
            .map(t -> new BlockedTerm(t, Pattern.compile("\\b" + Pattern.quote(t) + "\\b",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)))
            .toList();
        this.assetStore = assetStore;
    }

    @Override
    public SafetyVerdict evaluate(SafetyContent content) throws CapabilityException {
        String text = switch (content.target()) {
            case PROMPT -> content.text();
            case IMAGE_ASSET -> new String(assetStore.get(content.assetKey()), StandardCharsets.UTF_8);
        };
        if (text == null) {
            return SafetyVerdict.allow();
        }

        for (BlockedTerm blocked : blockedTerms) {
            if (blocked.pattern().matcher(text).find()) {
                log.info("Safety gate rejected {} of scene {}: blocked term '{}'",
                    content.target(), content.sceneNumber(), blocked.term());
                return SafetyVerdict.reject("Content contains blocked term '" + blocked.term() + "'");
            }
        }
        return SafetyVerdict.allow();
    }

    public int blockedTermCount() {
        return blockedTerms.size();
    }
}
