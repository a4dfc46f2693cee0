package com.cmagents.orchestration.service;

import com.cmagents.config.CampaignAgentsProperties;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.text.Normalizer;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Keyword heuristics over request text. Matching ignores case, accents and repeated whitespace.
 */
@Service
public class IntentDetectionService {

    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final List<String> noTextPhrases;
    private final List<String> trendPhrases;
    private final Set<String> buildConfirmations;

    public IntentDetectionService(CampaignAgentsProperties properties) {
        CampaignAgentsProperties.IntentConfig intent = properties.getIntent();
        this.noTextPhrases = normalizeAll(intent.getNoTextPhrases());
        this.trendPhrases = normalizeAll(intent.getTrendPhrases());
        this.buildConfirmations = Set.copyOf(normalizeAll(intent.getBuildConfirmations()));
    }

    public boolean requestsNoText(@Nullable String text) {
        return containsAny(text, noTextPhrases);
    }

    public boolean requestsTrends(@Nullable String text) {
        return containsAny(text, trendPhrases);
    }

    /**
     * A confirmation is a whole message equal to one of the configured phrases, such as {@code /build} or {@code dale}.
     */
    public boolean isBuildConfirmation(@Nullable String message) {
        String normalized = normalize(message);
        return !normalized.isEmpty() && buildConfirmations.contains(normalized);
    }

    private boolean containsAny(@Nullable String text, List<String> phrases) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) {
            return false;
        }
        return phrases.stream().anyMatch(normalized::contains);
    }

    static String normalize(@Nullable String text) {
        if (text == null) {
            return "";
        }
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
        String stripped = DIACRITICS.matcher(decomposed).replaceAll("");
        return WHITESPACE.matcher(stripped.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }

    private static List<String> normalizeAll(List<String> phrases) {
        return phrases.stream()
                .map(IntentDetectionService::normalize)
                .filter(phrase -> !phrase.isEmpty())
                .distinct()
                .collect(Collectors.toList());
    }
}
