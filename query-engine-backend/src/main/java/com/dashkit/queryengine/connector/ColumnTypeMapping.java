package com.dashkit.queryengine.connector;

import com.dashkit.queryengine.model.ColumnType;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Ordered native-type to {@link ColumnType} table for one backend.
 *
 * <p>Rules are checked in declaration order and the first token contained in the
 * upper-cased native type name wins, so more specific tokens ({@code TIMESTAMP},
 * {@code INTERVAL}, {@code []}) must be declared before the generic ones they contain
 * ({@code TIME}, {@code INT}). Unmatched and blank names map to {@link ColumnType#STRING}.
 */
public final class ColumnTypeMapping {
    private final List<Rule> rules;

    private ColumnTypeMapping(List<Rule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static Builder builder() {
        return new Builder();
    }

    public ColumnType map(String nativeType) {
        if (nativeType == null || nativeType.isBlank()) {
            return ColumnType.STRING;
        }
        String upper = nativeType.trim().toUpperCase(Locale.ROOT);
        for (Rule rule : rules) {
            if (upper.contains(rule.token)) {
                return rule.type;
            }
        }
        return ColumnType.STRING;
    }

    private static final class Rule {
        private final String token;
        private final ColumnType type;

        private Rule(String token, ColumnType type) {
            this.token = token;
            this.type = type;
        }
    }

    public static final class Builder {
        private final List<Rule> rules = new ArrayList<>();

        private Builder() {
        }

        public Builder map(ColumnType type, String... tokens) {
            for (String token : tokens) {
                rules.add(new Rule(token.toUpperCase(Locale.ROOT), type));
            }
            return this;
        }

        public ColumnTypeMapping build() {
            return new ColumnTypeMapping(rules);
        }
    }
}
