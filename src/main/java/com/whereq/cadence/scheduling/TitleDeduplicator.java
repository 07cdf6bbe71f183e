package com.whereq.cadence.scheduling;

import com.whereq.cadence.config.CadenceProperties;
import com.whereq.cadence.model.QueueItem;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Rejects queue entries whose normalized title already exists in recent queue history.
 * Artifact names derive from their source content, so regenerating unchanged content
 * must not create a second publish entry.
 */
@Component
public class TitleDeduplicator {

    private static final Pattern PUNCTUATION = Pattern.compile("\\p{P}+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final RetryManager retryManager;
    private final Duration horizon;

    @Autowired
    public TitleDeduplicator(RetryManager retryManager, CadenceProperties properties) {
        this(retryManager, properties.getDedup().getHorizon());
    }

    public TitleDeduplicator(RetryManager retryManager, Duration horizon) {
        this.retryManager = retryManager;
        this.horizon = horizon;
    }

    /**
     * Fold case, strip punctuation, collapse whitespace.
     *
     * <p>Symbols such as {@code +} or {@code $} are kept, so "C++" and "C" stay distinct. Removing
     * punctuation can bring a base letter next to a combining mark, hence the second NFKC pass.
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String folded = Normalizer.normalize(text, Normalizer.Form.NFKC).toLowerCase(Locale.ROOT);
        folded = Normalizer.normalize(folded, Normalizer.Form.NFKC);
        String stripped = PUNCTUATION.matcher(folded).replaceAll("");
        stripped = Normalizer.normalize(stripped, Normalizer.Form.NFKC).toLowerCase(Locale.ROOT);
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }

    public boolean isDuplicate(String candidateTitle, List<QueueItem> existing, Instant now) {
        String candidate = normalize(candidateTitle);
        Instant cutoff = now.minus(horizon);
        return existing.stream()
            .filter(item -> !retryManager.isPermanentlyFailed(item))
            .filter(item -> item.getAddedAt() == null || !item.getAddedAt().isBefore(cutoff))
            .anyMatch(item -> normalize(item.getTitle()).equals(candidate));
    }
}
