package uiscope.hierarchy;

/**
 * How a node came to have its parent. Discovery reasons and tree validation
 * read this to tell geometric facts from heuristic guesses.
 */
public enum AttachmentKind {

    /** The chosen root; it has no parent. */
    ROOT,

    /** Parent rectangle contains the child rectangle within tolerance. */
    GEOMETRIC,

    /** Zero-area or unparsable element attached by resource-id / type heuristics. */
    SEMANTIC,

    /** Disconnected island or unmatched hidden element placed under the root so the tree stays single-rooted. */
    ADOPTED
}
