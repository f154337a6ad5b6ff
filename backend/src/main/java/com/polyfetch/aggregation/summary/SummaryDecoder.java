package com.polyfetch.aggregation.summary;

import com.polyfetch.aggregation.GroupStage;
import org.bson.Document;
import org.bson.types.Decimal128;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Decodes one group result into a {@link Summary}, field by field.
 * <ul>
 *   <li>{@code _id}: required; integral numbers become Long, strings stay String.</li>
 *   <li>{@code count}: absent or null means 0.</li>
 *   <li>{@code items}: absent or null means an empty list; store order is kept as is.</li>
 * </ul>
 * A field that is present but of the wrong type fails with {@link MalformedSummaryException}.
 */
public class SummaryDecoder {

    public static final String COUNT_FIELD = "count";
    public static final String ITEMS_FIELD = "items";

    public Summary decode(Document raw) {
        Objects.requireNonNull(raw, "raw");
        return new Summary(decodeKey(raw), decodeCount(raw), decodeItems(raw));
    }

    private static Object decodeKey(Document raw) {
        Object id = raw.get(GroupStage.GROUP_KEY_FIELD);
        if (id == null) {
            throw new MalformedSummaryException("Result document has no group key; fields: " + raw.keySet());
        }
        if (id instanceof String s) {
            return s;
        }
        Long integral = toLong(id);
        if (integral == null) {
            throw new MalformedSummaryException("Unsupported group key " + id + " ("
                    + id.getClass().getSimpleName() + ")");
        }
        return integral;
    }

    private static long decodeCount(Document raw) {
        Object count = raw.get(COUNT_FIELD);
        if (count == null) {
            return 0L;
        }
        Long value = toLong(count);
        if (value == null || value < 0) {
            throw new MalformedSummaryException("Invalid " + COUNT_FIELD + " for group "
                    + raw.get(GroupStage.GROUP_KEY_FIELD) + ": " + count);
        }
        return value;
    }

    private static List<String> decodeItems(Document raw) {
        Object items = raw.get(ITEMS_FIELD);
        if (items == null) {
            return List.of();
        }
        if (!(items instanceof List<?> values)) {
            throw new MalformedSummaryException("Expected array for " + ITEMS_FIELD + " in group "
                    + raw.get(GroupStage.GROUP_KEY_FIELD) + ", got " + items.getClass().getSimpleName());
        }
        List<String> out = new ArrayList<>(values.size());
        for (Object v : values) {
            if (v != null) {
                out.add(v instanceof String s ? s : String.valueOf(v));
            }
        }
        return out;
    }

    /**
     * Integral value of a BSON number, or null if the value is not an integral number.
     */
    private static Long toLong(Object value) {
        if (value instanceof Integer || value instanceof Long) {
            return ((Number) value).longValue();
        }
        if (value instanceof Double d) {
            if (Double.isFinite(d) && d == Math.rint(d)) {
                return d.longValue();
            }
            return null;
        }
        if (value instanceof Decimal128 dec) {
            try {
                return dec.bigDecimalValue().longValueExact();
            } catch (ArithmeticException e) {
                return null;
            }
        }
        return null;
    }
}
