package com.dashkit.queryengine.util;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

public class JdbcValuesTest {

    @Test
    public void testPrimitivesPassThrough() {
        assertNull(JdbcValues.toJsonSafe(null));
        assertEquals(42, JdbcValues.toJsonSafe(42));
        assertEquals(new BigDecimal("9.99"), JdbcValues.toJsonSafe(new BigDecimal("9.99")));
        assertEquals(true, JdbcValues.toJsonSafe(true));
        assertEquals("text", JdbcValues.toJsonSafe("text"));
    }

    @Test
    public void testHugeIntegers() {
        assertEquals(7L, JdbcValues.toJsonSafe(BigInteger.valueOf(7)));
        BigInteger huge = BigInteger.ONE.shiftLeft(100);
        assertEquals(huge.toString(), JdbcValues.toJsonSafe(huge));
    }

    @Test
    public void testTemporalAndIdentifierValuesBecomeStrings() {
        assertEquals("2024-03-01", JdbcValues.toJsonSafe(LocalDate.of(2024, 3, 1)));
        assertEquals(new Timestamp(0).toString(), JdbcValues.toJsonSafe(new Timestamp(0)));
        UUID id = UUID.randomUUID();
        assertEquals(id.toString(), JdbcValues.toJsonSafe(id));
    }

    @Test
    public void testNestedValues() {
        Map<String, Object> struct = new LinkedHashMap<>();
        struct.put("day", LocalDate.of(2024, 1, 2));
        struct.put("n", 1);

        assertEquals(Map.of("day", "2024-01-02", "n", 1), JdbcValues.toJsonSafe(struct));
        assertEquals(List.of("2024-01-02", 3), JdbcValues.toJsonSafe(List.of(LocalDate.of(2024, 1, 2), 3)));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testNestedValuesAreReadOnly() {
        List<Object> list = (List<Object>) JdbcValues.toJsonSafe(new ArrayList<>(List.of(1, 2, 3)));
        Map<String, Object> map = (Map<String, Object>) JdbcValues.toJsonSafe(new LinkedHashMap<>(Map.of("k", 1)));

        assertThrows(UnsupportedOperationException.class, list::clear);
        assertThrows(UnsupportedOperationException.class, () -> map.put("k", 2));
    }

    @Test
    public void testBytesAreBase64() {
        assertEquals("AQID", JdbcValues.toJsonSafe(new byte[]{1, 2, 3}));
    }
}
