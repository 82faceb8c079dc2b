package com.platform.driftdetector.normalize;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Canonical forms for attribute values.
 *
 * <p>Numbers become {@link BigDecimal} without trailing zeros and never in exponent form, maps
 * become sorted unmodifiable maps, nulls are dropped. Two canonical values are equal under
 * {@link #sameValue(Object, Object)} exactly when they denote the same configuration.
 */
public final class ValueCanonicalizer {
    
    /**
     * Total, deterministic order used to sort set elements.
     */
    public static final Comparator<Object> ORDER = Comparator.comparing(ValueCanonicalizer::render);
    
    private ValueCanonicalizer() {
    }
    
    public static Object canonicalScalar(Object value) {
        if (value instanceof Number number) {
            return toBigDecimal(number);
        }
        if (value instanceof Character c) {
            return String.valueOf(c);
        }
        if (value instanceof String || value instanceof Boolean || value == null) {
            return value;
        }
        return value.toString();
    }
    
    public static Object canonicalValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            TreeMap<String, Object> sorted = new TreeMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (entry.getValue() != null) {
                    sorted.put(String.valueOf(entry.getKey()), canonicalValue(entry.getValue()));
                }
            }
            return Collections.unmodifiableSortedMap(sorted);
        }
        if (value instanceof List<?> list) {
            List<Object> elements = new ArrayList<>(list.size());
            for (Object element : list) {
                if (element != null) {
                    elements.add(canonicalValue(element));
                }
            }
            return Collections.unmodifiableList(elements);
        }
        return canonicalScalar(value);
    }
    
    /**
     * @throws NumberFormatException for NaN and infinite values
     */
    public static BigDecimal toBigDecimal(Number number) {
        BigDecimal decimal;
        if (number instanceof BigDecimal bd) {
            decimal = bd;
        } else if (number instanceof BigInteger bi) {
            decimal = new BigDecimal(bi);
        } else if (number instanceof Double || number instanceof Float) {
            decimal = new BigDecimal(number.toString());
        } else {
            decimal = BigDecimal.valueOf(number.longValue());
        }
        return canonicalNumber(decimal);
    }
    
    public static BigDecimal canonicalNumber(BigDecimal decimal) {
        BigDecimal stripped = decimal.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
    }
    
    /**
     * Reads "true"/"false", "yes"/"no" and "1"/"0" in any case; null when the text is neither.
     */
    public static Boolean parseBoolean(String text) {
        return switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "true", "yes", "1" -> Boolean.TRUE;
            case "false", "no", "0" -> Boolean.FALSE;
            default -> null;
        };
    }
    
    public static BigDecimal parseNumber(String text) {
        try {
            return canonicalNumber(new BigDecimal(text.trim()));
        } catch (NumberFormatException e) {
            return null;
        }
    }
    
    public static boolean sameValue(Object a, Object b) {
        if (a instanceof BigDecimal x && b instanceof BigDecimal y) {
            return x.compareTo(y) == 0;
        }
        if (a instanceof List<?> x && b instanceof List<?> y) {
            if (x.size() != y.size()) {
                return false;
            }
            Iterator<?> ix = x.iterator();
            Iterator<?> iy = y.iterator();
            while (ix.hasNext()) {
                if (!sameValue(ix.next(), iy.next())) {
                    return false;
                }
            }
            return true;
        }
        if (a instanceof Map<?, ?> x && b instanceof Map<?, ?> y) {
            if (!x.keySet().equals(y.keySet())) {
                return false;
            }
            for (Map.Entry<?, ?> entry : x.entrySet()) {
                if (!sameValue(entry.getValue(), y.get(entry.getKey()))) {
                    return false;
                }
            }
            return true;
        }
        return Objects.equals(a, b);
    }
    
    /**
     * Type-tagged rendering; equal canonical values render identically.
     */
    public static String render(Object value) {
        if (value == null) {
            return "n:";
        }
        if (value instanceof BigDecimal decimal) {
            return "d:" + decimal.toPlainString();
        }
        if (value instanceof Boolean bool) {
            return "b:" + bool;
        }
        if (value instanceof String text) {
            return "s:" + text;
        }
        if (value instanceof Map<?, ?> map) {
            StringBuilder sb = new StringBuilder("m:{");
            new TreeMap<>(map).forEach((k, v) -> sb.append(k).append('=').append(render(v)).append(';'));
            return sb.append('}').toString();
        }
        if (value instanceof List<?> list) {
            StringBuilder sb = new StringBuilder("l:[");
            for (Object element : list) {
                sb.append(render(element)).append(';');
            }
            return sb.append(']').toString();
        }
        return "o:" + value;
    }
}
