package com.questrail.testkit.core;

import com.questrail.testkit.api.Describable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.StringJoiner;

/**
 * ValueDescriptions
 * -----------------------------------------------------------------------------
 * Best-effort rendering of assertion values into text before they reach a
 * reporter. Rendering never throws for a misbehaving value; the affected
 * value (or container element) renders as {@value #NOT_AVAILABLE}.
 *
 * <h2>Resolution order</h2>
 * <ol>
 *   <li>{@code null} renders as {@code "null"}</li>
 *   <li>{@link Describable} renders through {@link Describable#describe()}</li>
 *   <li>Arrays and {@link Iterable}s render as {@code "{ a, b, c }"}, each
 *       element described recursively. A container met again while it is
 *       still being rendered renders as {@value #CYCLE}.</li>
 *   <li>Any value whose {@code toString()} differs from the
 *       {@code Object} identity form renders through it</li>
 *   <li>Everything else renders as {@value #NOT_AVAILABLE}</li>
 * </ol>
 */
public final class ValueDescriptions
{
    private static final Logger log = LoggerFactory.getLogger(ValueDescriptions.class);

    /**
     * Placeholder for text that is not available: a value without a textual
     * representation, a fault without a message, an assertion without an
     * expression or a test without a file label.
     */
    public static final String NOT_AVAILABLE = "N/A";

    /** Rendering of a container nested inside itself. */
    public static final String CYCLE = "(cycle)";

    private ValueDescriptions() {}

    public static String describe(Object value) {
        return describe(value, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private static String describe(Object value, Set<Object> rendering) {
        if (value == null) {
            return "null";
        }
        try {
            if (value instanceof Describable describable) {
                return textOrPlaceholder(describable.describe());
            }
            if (value instanceof Object[] elements) {
                return describeContainer(value, Arrays.asList(elements), rendering);
            }
            List<?> primitives = primitiveElements(value);
            if (primitives != null) {
                return describeContainer(value, primitives, rendering);
            }
            if (value instanceof Iterable<?> iterable) {
                return describeContainer(value, iterable, rendering);
            }
            String text = String.valueOf(value);
            return isIdentityText(value, text) ? NOT_AVAILABLE : textOrPlaceholder(text);
        } catch (RuntimeException e) {
            Faults.propagateIfUncatchable(e);
            log.debug("Rendering {} failed; using placeholder", value.getClass().getName(), e);
            return NOT_AVAILABLE;
        }
    }

    private static String describeContainer(Object container, Iterable<?> elements, Set<Object> rendering) {
        if (!rendering.add(container)) {
            return CYCLE;
        }
        try {
            StringJoiner joiner = new StringJoiner(", ", "{ ", " }");
            joiner.setEmptyValue("{ }");
            for (Object element : elements) {
                joiner.add(describe(element, rendering));
            }
            return joiner.toString();
        } finally {
            rendering.remove(container);
        }
    }

    /** Boxed elements of a primitive array, or {@code null} for any other value. */
    private static List<?> primitiveElements(Object value) {
        if (value instanceof int[] ints) {
            return Arrays.stream(ints).boxed().toList();
        }
        if (value instanceof long[] longs) {
            return Arrays.stream(longs).boxed().toList();
        }
        if (value instanceof double[] doubles) {
            return Arrays.stream(doubles).boxed().toList();
        }
        if (value instanceof boolean[] booleans) {
            List<Boolean> boxed = new ArrayList<>(booleans.length);
            for (boolean b : booleans) {
                boxed.add(b);
            }
            return boxed;
        }
        if (value instanceof char[] chars) {
            List<Character> boxed = new ArrayList<>(chars.length);
            for (char c : chars) {
                boxed.add(c);
            }
            return boxed;
        }
        if (value instanceof byte[] bytes) {
            List<Byte> boxed = new ArrayList<>(bytes.length);
            for (byte b : bytes) {
                boxed.add(b);
            }
            return boxed;
        }
        if (value instanceof short[] shorts) {
            List<Short> boxed = new ArrayList<>(shorts.length);
            for (short s : shorts) {
                boxed.add(s);
            }
            return boxed;
        }
        if (value instanceof float[] floats) {
            List<Float> boxed = new ArrayList<>(floats.length);
            for (float f : floats) {
                boxed.add(f);
            }
            return boxed;
        }
        return null;
    }

    /** True when {@code text} is what {@code Object.toString()} would produce. */
    private static boolean isIdentityText(Object value, String text) {
        return (value.getClass().getName() + "@" + Integer.toHexString(value.hashCode())).equals(text);
    }

    private static String textOrPlaceholder(String text) {
        return text != null ? text : NOT_AVAILABLE;
    }
}
