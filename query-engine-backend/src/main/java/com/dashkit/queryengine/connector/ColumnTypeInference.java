package com.dashkit.queryengine.connector;

import com.dashkit.queryengine.model.ColumnType;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.temporal.TemporalAccessor;
import java.util.Date;

/**
 * Value-sniffing fallback used when a driver reports no type for a result column.
 *
 * <p>null is a string, an integral number is an integer, any other number is a float,
 * booleans are booleans, date/time values are timestamps, anything else is a string.
 */
public final class ColumnTypeInference {

    private ColumnTypeInference() {
    }

    public static ColumnType infer(Object value) {
        if (value == null) {
            return ColumnType.STRING;
        }
        if (value instanceof Number number) {
            return isIntegral(number) ? ColumnType.INTEGER : ColumnType.FLOAT;
        }
        if (value instanceof Boolean) {
            return ColumnType.BOOLEAN;
        }
        if (value instanceof Date || value instanceof TemporalAccessor) {
            return ColumnType.TIMESTAMP;
        }
        return ColumnType.STRING;
    }

    static boolean isIntegral(Number number) {
        if (number instanceof Integer || number instanceof Long || number instanceof Short
                || number instanceof Byte || number instanceof BigInteger) {
            return true;
        }
        if (number instanceof BigDecimal decimal) {
            return decimal.signum() == 0 || decimal.stripTrailingZeros().scale() <= 0;
        }
        double d = number.doubleValue();
        return !Double.isInfinite(d) && !Double.isNaN(d) && d == Math.rint(d);
    }
}
