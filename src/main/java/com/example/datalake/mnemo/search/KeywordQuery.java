package com.example.datalake.mnemo.search;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A user message reduced to keyword phrases. Tokens starting with {@code -} are dropped so
 * that they can't act as negation operators; the survivors are OR'ed.
 */
public final class KeywordQuery {

    private final List<String> phrases;

    private KeywordQuery(List<String> phrases) {
        this.phrases = List.copyOf(phrases);
    }

    /**
     * @return empty when no usable token survives
     */
    public static Optional<KeywordQuery> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        List<String> kept = new ArrayList<>();
        for (String token : raw.trim().split("\\s+")) {
            if (token.isEmpty() || token.startsWith("-")) {
                continue;
            }
            String cleaned = token.replace("\"", "");
            if (!cleaned.isEmpty()) {
                kept.add(cleaned);
            }
        }
        return kept.isEmpty() ? Optional.empty() : Optional.of(new KeywordQuery(kept));
    }

    public List<String> phrases() {
        return phrases;
    }

    /**
     * Full-text expression form: {@code "a" OR "b"}.
     */
    public String toFtsExpression() {
        return String.join(" OR ", phrases.stream().map(p -> '"' + p + '"').toList());
    }

    @Override
    public String toString() {
        return toFtsExpression();
    }
}
