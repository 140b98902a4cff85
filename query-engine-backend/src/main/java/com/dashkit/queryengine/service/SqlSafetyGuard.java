package com.dashkit.queryengine.service;

import com.dashkit.queryengine.config.QueryEngineProperties;
import com.dashkit.queryengine.exception.ValidationException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Coarse pre-filter applied to SQL before it reaches the cache or a connector.
 *
 * <p>Rejects over-long input, a write or DDL statement chained after a {@code ;}, and any SQL
 * comment. It works on raw text and does not understand string literals; it is a tripwire, not
 * a parser, and backends must still run with read-only credentials.
 */
@Component
public class SqlSafetyGuard {

    static final String UNSAFE_MESSAGE = "Potentially unsafe SQL detected";

    private static final List<Pattern> DANGEROUS_PATTERNS = List.of(
            Pattern.compile(";\\s*drop\\s+", Pattern.CASE_INSENSITIVE),
            Pattern.compile(";\\s*delete\\s+", Pattern.CASE_INSENSITIVE),
            Pattern.compile(";\\s*update\\s+.*set", Pattern.CASE_INSENSITIVE | Pattern.DOTALL),
            Pattern.compile(";\\s*insert\\s+", Pattern.CASE_INSENSITIVE),
            Pattern.compile(";\\s*create\\s+", Pattern.CASE_INSENSITIVE),
            Pattern.compile(";\\s*alter\\s+", Pattern.CASE_INSENSITIVE),
            Pattern.compile(";\\s*truncate\\s+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("--.*$", Pattern.MULTILINE),
            Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL)
    );

    private final QueryEngineProperties properties;

    public SqlSafetyGuard(QueryEngineProperties properties) {
        this.properties = properties;
    }

    /**
     * @param sql raw SQL from the caller
     * @throws ValidationException if the SQL is blank, too long or matches a dangerous pattern
     */
    public void check(String sql) {
        if (sql == null || sql.isBlank()) {
            throw new ValidationException("SQL is required");
        }
        int maxLength = properties.getMaxQueryLength();
        if (sql.length() > maxLength) {
            throw new ValidationException("Query too long. Maximum length: " + maxLength);
        }
        for (Pattern pattern : DANGEROUS_PATTERNS) {
            if (pattern.matcher(sql).find()) {
                throw new ValidationException(UNSAFE_MESSAGE);
            }
        }
    }
}
