package io.pagecraft.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Map;

/**
 * The truthiness policy shared by all evaluators.
 *
 * <p>False: {@code null}, {@code false}, numeric zero, the empty string, empty collections, maps
 * and arrays, and their JSON counterparts (null, missing, false, 0, empty text, empty array or
 * object). Everything else is true.
 */
public final class Truthiness {

    private Truthiness() {}

    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return !isZero(n);
        }
        if (value instanceof CharSequence s) {
            return s.length() > 0;
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return !m.isEmpty();
        }
        if (value instanceof JsonNode node) {
            return isTruthy(node);
        }
        if (value.getClass().isArray()) {
            return Array.getLength(value) > 0;
        }
        return true;
    }

    private static boolean isTruthy(JsonNode node) {
        if (node.isNull() || node.isMissingNode()) {
            return false;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            return !isZero(node.numberValue());
        }
        if (node.isTextual()) {
            return !node.textValue().isEmpty();
        }
        if (node.isContainerNode()) {
            return node.size() > 0;
        }
        return true;
    }

    private static boolean isZero(Number n) {
        if (n instanceof BigDecimal d) {
            return d.signum() == 0;
        }
        if (n instanceof BigInteger i) {
            return i.signum() == 0;
        }
        if (n instanceof Double || n instanceof Float) {
            return n.doubleValue() == 0.0;
        }
        return n.longValue() == 0L;
    }
}
