package uiscope.discovery;

import uiscope.model.UIElement;

import java.util.ArrayList;
import java.util.List;

/**
 * Short human-readable names for elements, used in reasons and breadcrumbs.
 */
public final class ElementLabeler {

    static final int MAX_TEXT_LENGTH = 20;

    private ElementLabeler() {}

    /**
     * {@code text @shortResourceId (ShortType)}, with any part left out when
     * absent. Content descriptions are not used. Text longer than 20 characters is cut and ended with "...". An
     * element with none of the three is labelled {@code element_<id>}.
     */
    public static String label(UIElement e) {
        List<String> parts = new ArrayList<>(3);
        if (e.hasText()) {
            String text = e.getText().trim();
            parts.add(text.length() > MAX_TEXT_LENGTH ? text.substring(0, MAX_TEXT_LENGTH) + "..." : text);
        }
        if (e.hasResourceId()) {
            parts.add("@" + afterLast(e.getResourceId(), '/'));
        }
        if (!e.getElementType().isBlank()) {
            parts.add("(" + afterLast(e.getElementType(), '.') + ")");
        }
        return parts.isEmpty() ? "element_" + e.getId() : String.join(" ", parts);
    }

    /**
     * Fraction of matching attributes between two elements. Element type and
     * clickability are always compared; resource id and text only when at least
     * one of the two has them, so two bare elements are not alike just for
     * lacking the same things.
     */
    public static double similarity(UIElement a, UIElement b) {
        int matches = 0;
        int total   = 2;
        if (a.getElementType().equals(b.getElementType())) matches++;
        if (a.isClickable() == b.isClickable())            matches++;
        if (a.hasResourceId() || b.hasResourceId()) {
            total++;
            if (a.getResourceId().equals(b.getResourceId())) matches++;
        }
        if (a.hasText() || b.hasText()) {
            total++;
            if (a.getText().equals(b.getText())) matches++;
        }
        return (double) matches / total;
    }

    private static String afterLast(String value, char separator) {
        return value.substring(value.lastIndexOf(separator) + 1);
    }
}
