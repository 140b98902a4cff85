package com.dashkit.queryengine.util;

import java.io.Reader;
import java.math.BigInteger;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.SQLException;
import java.sql.SQLXML;
import java.sql.Struct;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts JDBC driver values into JSON-safe primitives before they enter a result row.
 *
 * <p>Results are cached and serialized, so driver-specific objects (DuckDB structs and lists,
 * LOB handles, java.time values) must not leak past the connector. Nested lists and maps are
 * returned read-only.
 */
public final class JdbcValues {
    private static final int MAX_LOB_CHARS = 100_000;
    private static final int MAX_BLOB_BYTES = 100_000;
    private static final int MAX_STRING_CHARS = 100_000;
    private static final int MAX_NESTED_DEPTH = 3;
    static final String UNSUPPORTED_PLACEHOLDER = "[unsupported]";

    private JdbcValues() {
    }

    /**
     * Converts an arbitrary JDBC object into a JSON-safe primitive or structure.
     *
     * @param v value read from a result set
     * @return json-safe value; {@code "[unsupported]"} when the value cannot be read
     */
    public static Object toJsonSafe(Object v) {
        try {
            return sanitize(v, 0);
        } catch (SQLException | RuntimeException e) {
            return UNSUPPORTED_PLACEHOLDER;
        }
    }

    private static Object sanitize(Object v, int depth) throws SQLException {
        if (v == null) {
            return null;
        }
        if (depth > MAX_NESTED_DEPTH) {
            return UNSUPPORTED_PLACEHOLDER;
        }

        if (v instanceof BigInteger big) {
            // HUGEINT and unsigned 64-bit columns; keep precision when it fits in a long
            return big.bitLength() < 64 ? (Object) big.longValue() : big.toString();
        }
        if (v instanceof Number || v instanceof Boolean) {
            return v;
        }
        if (v instanceof String s) {
            return truncate(s);
        }
        if (v instanceof Clob clob) {
            return readClob(clob);
        }
        if (v instanceof Blob blob) {
            return readBlobBase64(blob);
        }
        if (v instanceof SQLXML xml) {
            return truncate(xml.getString());
        }
        if (v instanceof java.util.Date || v instanceof TemporalAccessor) {
            return v.toString();
        }
        if (v instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        if (v instanceof java.util.UUID) {
            return v.toString();
        }

        if (v instanceof Struct struct) {
            Object[] attrs = struct.getAttributes();
            Object[] safe = attrs != null ? attrs : new Object[0];
            List<Object> out = new ArrayList<>(safe.length);
            for (Object attr : safe) {
                out.add(sanitize(attr, depth + 1));
            }
            return Collections.unmodifiableList(out);
        }
        if (v instanceof java.sql.Array arr) {
            Object arrayValue = arr.getArray();
            if (arrayValue instanceof Object[] objectArray) {
                List<Object> out = new ArrayList<>(objectArray.length);
                for (Object elem : objectArray) {
                    out.add(sanitize(elem, depth + 1));
                }
                return Collections.unmodifiableList(out);
            }
            return truncate(String.valueOf(arrayValue));
        }
        if (v instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                out.put(String.valueOf(entry.getKey()), sanitize(entry.getValue(), depth + 1));
            }
            return Collections.unmodifiableMap(out);
        }
        if (v instanceof Collection<?> collection) {
            List<Object> out = new ArrayList<>(collection.size());
            for (Object elem : collection) {
                out.add(sanitize(elem, depth + 1));
            }
            return Collections.unmodifiableList(out);
        }

        return truncate(String.valueOf(v));
    }

    private static String truncate(String s) {
        if (s == null || s.length() <= MAX_STRING_CHARS) {
            return s;
        }
        return s.substring(0, MAX_STRING_CHARS);
    }

    private static String readClob(Clob clob) throws SQLException {
        long length = clob.length();
        int toRead = (int) Math.min(length, MAX_LOB_CHARS);
        if (toRead <= 0) {
            return "";
        }
        try {
            return clob.getSubString(1, toRead);
        } catch (SQLException e) {
            try (Reader reader = clob.getCharacterStream()) {
                if (reader == null) {
                    return "";
                }
                char[] buf = new char[Math.min(MAX_LOB_CHARS, 8192)];
                StringBuilder sb = new StringBuilder();
                int n;
                while (sb.length() < MAX_LOB_CHARS && (n = reader.read(buf, 0, Math.min(buf.length, MAX_LOB_CHARS - sb.length()))) > 0) {
                    sb.append(buf, 0, n);
                }
                return sb.toString();
            } catch (java.io.IOException io) {
                throw new SQLException("Failed to read CLOB value", io);
            }
        }
    }

    private static String readBlobBase64(Blob blob) throws SQLException {
        long length = blob.length();
        int toRead = (int) Math.min(length, MAX_BLOB_BYTES);
        if (toRead <= 0) {
            return "";
        }
        return Base64.getEncoder().encodeToString(blob.getBytes(1, toRead));
    }
}
