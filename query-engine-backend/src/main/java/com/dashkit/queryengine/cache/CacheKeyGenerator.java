package com.dashkit.queryengine.cache;

import com.dashkit.queryengine.exception.CacheException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Builds cache keys of the form {@code query:<tenant>:<dataSource>:<sha256>}.
 *
 * <p>The digest covers tenant, data source, the normalized SQL (whitespace runs collapsed,
 * trimmed, lowercased) and the parameters serialized as JSON with sorted keys. Tenant and data
 * source ids are also written in clear so that invalidation can address them with a glob; the
 * characters {@code % : * ? [ ] \} are percent-encoded in those segments.
 */
public class CacheKeyGenerator {

    public static final String PREFIX = "query";
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final HexFormat HEX = HexFormat.of();

    private final ObjectMapper canonicalMapper;

    public CacheKeyGenerator(ObjectMapper objectMapper) {
        this.canonicalMapper = objectMapper.copy()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    public String generate(String tenantId, String dataSourceId, String sql, Map<String, Object> parameters) {
        String normalizedSql = normalizeSql(sql);
        String params = canonicalParameters(parameters);
        MessageDigest digest = sha256();
        update(digest, tenantId);
        update(digest, dataSourceId);
        update(digest, normalizedSql);
        update(digest, params);
        return PREFIX + ":" + segment(tenantId) + ":" + segment(dataSourceId) + ":" + HEX.formatHex(digest.digest());
    }

    /**
     * @return glob matching every key of the tenant
     */
    public String tenantPattern(String tenantId) {
        return PREFIX + ":" + segment(tenantId) + ":*";
    }

    /**
     * @return glob matching every key of the data source, across tenants
     */
    public String dataSourcePattern(String dataSourceId) {
        return PREFIX + ":*:" + segment(dataSourceId) + ":*";
    }

    static String normalizeSql(String sql) {
        if (sql == null) {
            return "";
        }
        return WHITESPACE.matcher(sql).replaceAll(" ").trim().toLowerCase(Locale.ROOT);
    }

    private String canonicalParameters(Map<String, Object> parameters) {
        try {
            return canonicalMapper.writeValueAsString(parameters != null ? parameters : Map.of());
        } catch (JsonProcessingException e) {
            throw new CacheException("Failed to serialize query parameters for cache key", e);
        }
    }

    static String segment(String id) {
        String value = id != null ? id : "";
        StringBuilder out = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '%' || c == ':' || c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                out.append('%').append(String.format("%02X", (int) c));
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    private static void update(MessageDigest digest, String part) {
        byte[] bytes = (part != null ? part : "").getBytes(StandardCharsets.UTF_8);
        digest.update(bytes);
        // field separator
        digest.update((byte) 0);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
