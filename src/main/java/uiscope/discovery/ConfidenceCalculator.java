package uiscope.discovery;

import uiscope.model.UIElement;

/**
 * Confidence that a related element is a good automation candidate.
 *
 * <p>Starts at 0.5 and adds evidence: text, clickability, a resource id, and a
 * bonus depending on the direction of the relationship. Hidden elements that
 * carry text get extra weight because they are usually the label of an
 * icon-only button. The result is always within {@code [0,1]}.
 */
public final class ConfidenceCalculator {

    static final double BASE                 = 0.5;
    static final double TEXT_BONUS           = 0.3;
    static final double HIDDEN_TEXT_BONUS    = 0.2;
    static final double CLICKABLE_BONUS      = 0.2;
    static final double RESOURCE_ID_BONUS    = 0.1;
    static final double PARENT_BONUS         = 0.1;
    static final double CHILD_TEXT_BONUS     = 0.2;
    static final double CHILD_HIDDEN_BONUS   = 0.25;

    private ConfidenceCalculator() {}

    /**
     * Base confidence of {@code candidate} for a relationship of the given kind.
     * Ancestor callers divide this by the distance themselves.
     */
    public static double base(UIElement candidate, Relationship relationship) {
        double confidence = BASE;
        boolean hasText = candidate.hasText();
        boolean hidden  = candidate.isHidden();

        if (hasText) {
            confidence += TEXT_BONUS;
            if (hidden) confidence += HIDDEN_TEXT_BONUS;
        }
        if (candidate.isClickable())   confidence += CLICKABLE_BONUS;
        if (candidate.hasResourceId()) confidence += RESOURCE_ID_BONUS;

        if (relationship.isAncestor()) {
            confidence += PARENT_BONUS;
        } else if (relationship.isDescendant() && hasText) {
            confidence += CHILD_TEXT_BONUS;
            if (hidden) confidence += CHILD_HIDDEN_BONUS;
        }
        return clamp(confidence);
    }

    /** Ancestor confidence: base confidence divided by the number of levels up. */
    public static double forAncestor(UIElement candidate, int distance) {
        return clamp(base(candidate, Relationship.ancestorAt(distance)) / Math.max(1, distance));
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }
}
