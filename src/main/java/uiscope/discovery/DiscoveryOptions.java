package uiscope.discovery;

/**
 * Immutable knobs for one discovery call. {@link #defaults()} gives depth 3,
 * caps 20 / 15 / 5, text priority on and promotion over 3 levels.
 */
public final class DiscoveryOptions {

    public static final int     DEFAULT_MAX_DEPTH        = 3;
    public static final int     DEFAULT_DESCENDANT_CAP   = 20;
    public static final int     DEFAULT_SIBLING_CAP      = 15;
    public static final int     DEFAULT_RECOMMENDED_CAP  = 5;
    public static final boolean DEFAULT_PRIORITIZE_TEXT  = true;
    public static final int     DEFAULT_PROMOTION_LEVELS = 3;

    private final int     maxDepth;
    private final int     descendantCap;
    private final int     siblingCap;
    private final int     recommendedCap;
    private final boolean prioritizeText;
    private final int     promotionLevels;

    private DiscoveryOptions(Builder b) {
        this.maxDepth        = requireNonNegative("maxDepth", b.maxDepth);
        this.descendantCap   = requireNonNegative("descendantCap", b.descendantCap);
        this.siblingCap      = requireNonNegative("siblingCap", b.siblingCap);
        this.recommendedCap  = requireNonNegative("recommendedCap", b.recommendedCap);
        this.prioritizeText  = b.prioritizeText;
        this.promotionLevels = requireNonNegative("promotionLevels", b.promotionLevels);
    }

    private static int requireNonNegative(String name, int value) {
        if (value < 0) throw new IllegalArgumentException(name + " must be >= 0: " + value);
        return value;
    }

    public static DiscoveryOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .maxDepth(maxDepth)
                .descendantCap(descendantCap)
                .siblingCap(siblingCap)
                .recommendedCap(recommendedCap)
                .prioritizeText(prioritizeText)
                .promotionLevels(promotionLevels);
    }

    public int     getMaxDepth()        { return maxDepth; }
    public int     getDescendantCap()   { return descendantCap; }
    public int     getSiblingCap()      { return siblingCap; }
    public int     getRecommendedCap()  { return recommendedCap; }
    public boolean isPrioritizeText()   { return prioritizeText; }

    /** Ancestor levels searched for a clickable container; 0 disables promotion. */
    public int     getPromotionLevels() { return promotionLevels; }

    @Override
    public String toString() {
        return String.format("DiscoveryOptions{maxDepth=%d, caps=%d/%d/%d, prioritizeText=%s, promotionLevels=%d}",
                maxDepth, descendantCap, siblingCap, recommendedCap, prioritizeText, promotionLevels);
    }

    public static final class Builder {
        private int     maxDepth        = DEFAULT_MAX_DEPTH;
        private int     descendantCap   = DEFAULT_DESCENDANT_CAP;
        private int     siblingCap      = DEFAULT_SIBLING_CAP;
        private int     recommendedCap  = DEFAULT_RECOMMENDED_CAP;
        private boolean prioritizeText  = DEFAULT_PRIORITIZE_TEXT;
        private int     promotionLevels = DEFAULT_PROMOTION_LEVELS;

        private Builder() {}

        public Builder maxDepth(int maxDepth)               { this.maxDepth = maxDepth; return this; }
        public Builder descendantCap(int descendantCap)     { this.descendantCap = descendantCap; return this; }
        public Builder siblingCap(int siblingCap)           { this.siblingCap = siblingCap; return this; }
        public Builder recommendedCap(int recommendedCap)   { this.recommendedCap = recommendedCap; return this; }
        public Builder prioritizeText(boolean prioritize)   { this.prioritizeText = prioritize; return this; }
        public Builder promotionLevels(int promotionLevels) { this.promotionLevels = promotionLevels; return this; }

        public DiscoveryOptions build() {
            return new DiscoveryOptions(this);
        }
    }
}
