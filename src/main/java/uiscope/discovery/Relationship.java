package uiscope.discovery;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a discovered element relates to the discovery target. Every element found
 * by one discovery call gets exactly one of these, derived from tree shape alone.
 */
public enum Relationship {

    SELF("self"),
    DIRECT_PARENT("direct-parent"),
    GRANDPARENT("grandparent"),
    ANCESTOR("ancestor"),
    DIRECT_CHILD("direct-child"),
    GRANDCHILD("grandchild"),
    DESCENDANT("descendant"),
    SIBLING("sibling");

    private final String tag;

    Relationship(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() { return tag; }

    public boolean isAncestor() {
        return this == DIRECT_PARENT || this == GRANDPARENT || this == ANCESTOR;
    }

    public boolean isDescendant() {
        return this == DIRECT_CHILD || this == GRANDCHILD || this == DESCENDANT;
    }

    static Relationship ancestorAt(int distance) {
        if (distance < 1) throw new IllegalArgumentException("distance must be >= 1: " + distance);
        return distance == 1 ? DIRECT_PARENT : distance == 2 ? GRANDPARENT : ANCESTOR;
    }

    static Relationship descendantAt(int distance) {
        if (distance < 1) throw new IllegalArgumentException("distance must be >= 1: " + distance);
        return distance == 1 ? DIRECT_CHILD : distance == 2 ? GRANDCHILD : DESCENDANT;
    }

    /**
     * Display label including the level for distant relatives, e.g.
     * {@code "grandparent"} or {@code "4-level descendant"}.
     */
    static String labelFor(Relationship relationship, int distance) {
        switch (relationship) {
            case ANCESTOR:   return distance + "-level ancestor";
            case DESCENDANT: return distance + "-level descendant";
            default:         return relationship.tag;
        }
    }
}
