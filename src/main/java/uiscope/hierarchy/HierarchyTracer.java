package uiscope.hierarchy;

/**
 * Observer notified at fixed points of a hierarchy build.
 *
 * <p>All callbacks default to no-ops; implement only the ones you need.
 * {@link #NOOP} is what {@link HierarchyBuilder} uses unless told otherwise.
 */
public interface HierarchyTracer {

    HierarchyTracer NOOP = new HierarchyTracer() {};

    /** A child was placed under a parent. */
    default void nodeAttached(HierarchyNode child, HierarchyNode parent, AttachmentKind kind) {}

    /**
     * A fallback path was taken.
     *
     * @param stage  short machine-friendly stage name, e.g. {@code "rebuild"}
     * @param detail human-readable explanation
     */
    default void fallbackTriggered(String stage, String detail) {}

    /** The root was chosen from {@code candidateCount} parentless nodes. */
    default void rootSelected(HierarchyNode root, int candidateCount) {}
}
