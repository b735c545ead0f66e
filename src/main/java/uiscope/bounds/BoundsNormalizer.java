package uiscope.bounds;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonicalizes the rectangle representations found in screen dumps into
 * {@link Bounds} and answers the geometric questions the hierarchy builder asks.
 *
 * <p>Accepted inputs:
 * <ul>
 *   <li>a {@link Bounds} instance (returned as-is)</li>
 *   <li>the bracketed dump string {@code [l,t][r,b]}, whitespace tolerated</li>
 *   <li>a structured quad: a {@link Map} with numeric {@code left/top/right/bottom}</li>
 *   <li>an {@code int[]} of length 4 in {@code l,t,r,b} order</li>
 * </ul>
 *
 * <p>Every method is total: malformed input yields {@code null} (or an
 * infinite area), never an exception.
 */
public final class BoundsNormalizer {

    private static final Logger log = LoggerFactory.getLogger(BoundsNormalizer.class);

    private static final Pattern BRACKETED = Pattern.compile(
            "^\\s*\\[\\s*(-?\\d+)\\s*,\\s*(-?\\d+)\\s*]\\s*\\[\\s*(-?\\d+)\\s*,\\s*(-?\\d+)\\s*]\\s*$");

    private BoundsNormalizer() {}

    /**
     * Converts any supported representation to {@link Bounds}.
     *
     * @param raw structured or string rectangle, may be {@code null}
     * @return canonical bounds, or {@code null} if the input cannot be parsed
     */
    public static Bounds normalize(Object raw) {
        if (raw == null) return null;
        if (raw instanceof Bounds) return (Bounds) raw;
        if (raw instanceof CharSequence) return parse(raw.toString());
        if (raw instanceof Map) return fromMap((Map<?, ?>) raw);
        if (raw instanceof int[]) {
            int[] quad = (int[]) raw;
            return quad.length == 4 ? new Bounds(quad[0], quad[1], quad[2], quad[3]) : null;
        }
        log.debug("Unsupported bounds representation: {}", raw.getClass().getName());
        return null;
    }

    /**
     * Parses the Android dump notation {@code [l,t][r,b]}.
     *
     * @return parsed bounds or {@code null} when the string does not match
     */
    public static Bounds parse(String text) {
        if (text == null || text.isBlank()) return null;
        Matcher m = BRACKETED.matcher(text);
        if (!m.matches()) {
            log.debug("Unparsable bounds string: '{}'", text);
            return null;
        }
        try {
            return new Bounds(
                    Integer.parseInt(m.group(1)),
                    Integer.parseInt(m.group(2)),
                    Integer.parseInt(m.group(3)),
                    Integer.parseInt(m.group(4)));
        } catch (NumberFormatException e) {
            // digits overflow int
            log.debug("Bounds coordinates out of range: '{}'", text);
            return null;
        }
    }

    /** True iff {@code bounds} is the all-zero rectangle. {@code null} is not hidden, it is unparsable. */
    public static boolean isHidden(Bounds bounds) {
        return bounds != null && bounds.isZero();
    }

    /**
     * Area used for ordering. Unparsable bounds sort last via
     * {@link Double#POSITIVE_INFINITY}.
     */
    public static double area(Bounds bounds) {
        return bounds == null ? Double.POSITIVE_INFINITY : (double) bounds.getArea();
    }

    /**
     * True if the rectangle can take part in geometric containment:
     * it parsed and it is not hidden.
     */
    public static boolean isGeometric(Bounds bounds) {
        return bounds != null && !bounds.isZero();
    }

    /**
     * Containment test with per-edge tolerance. Either side being
     * non-geometric means "cannot relate" and yields {@code false}.
     */
    public static boolean contains(Bounds outer, Bounds inner, int tolerance) {
        if (!isGeometric(outer) || !isGeometric(inner)) return false;
        return outer.contains(inner, tolerance);
    }

    // ── Internal helpers ─────────────────────────────────────────────────

    private static Bounds fromMap(Map<?, ?> map) {
        Integer l = toInt(map.get("left"));
        Integer t = toInt(map.get("top"));
        Integer r = toInt(map.get("right"));
        Integer b = toInt(map.get("bottom"));
        if (l == null || t == null || r == null || b == null) {
            log.debug("Structured bounds missing a coordinate: {}", map);
            return null;
        }
        return new Bounds(l, t, r, b);
    }

    private static Integer toInt(Object value) {
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)
                    || d > Integer.MAX_VALUE || d < Integer.MIN_VALUE) {
                return null;
            }
            return (int) Math.round(d);
        }
        if (value instanceof CharSequence) {
            try {
                return Integer.parseInt(value.toString().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
