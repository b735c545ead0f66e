package uiscope.hierarchy;

import uiscope.bounds.Bounds;
import uiscope.model.UIElement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * A node in a reconstructed element tree.
 *
 * <p>Owned by the {@link HierarchyAnalysisResult} that created it. The tree
 * owns the children; the parent link is a plain back-reference. All mutators
 * are package-private and only {@link HierarchyBuilder} calls them, so a node
 * handed out by a finished result never changes.
 */
public final class HierarchyNode {

    private final UIElement element;
    private final int inputIndex;

    private HierarchyNode parent;
    private final List<HierarchyNode> children = new ArrayList<>();
    private AttachmentKind attachment;
    private int indexInParent;
    private int depth;

    HierarchyNode(UIElement element, int inputIndex) {
        this.element    = element;
        this.inputIndex = inputIndex;
    }

    // ── Accessors ─────────────────────────────────────────────────────────

    public UIElement getElement() { return element; }

    public String getId() { return element.getId(); }

    /** Parent node, or {@code null} for the root. */
    public HierarchyNode getParent() { return parent; }

    /** Children in screen-dump order; read-only. */
    public List<HierarchyNode> getChildren() { return Collections.unmodifiableList(children); }

    /** Position in the original element list; orders siblings and breaks ties. */
    public int getInputIndex() { return inputIndex; }

    public int getIndexInParent() { return indexInParent; }

    /** Distance from the root (root = 0). */
    public int getDepth() { return depth; }

    public boolean isLeaf() { return children.isEmpty(); }

    public boolean isRoot() { return parent == null; }

    /** How this node was attached to its parent; {@code null} only while a build is in progress. */
    public AttachmentKind getAttachment() { return attachment; }

    public Bounds getBounds() { return element.getBounds(); }

    // ── Builder-only mutators ─────────────────────────────────────────────

    void attachTo(HierarchyNode newParent, AttachmentKind kind) {
        this.parent = newParent;
        this.attachment = kind;
        newParent.children.add(this);
    }

    void markRoot() {
        this.parent = null;
        this.attachment = AttachmentKind.ROOT;
    }

    void reset() {
        parent = null;
        attachment = null;
        children.clear();
        indexInParent = 0;
        depth = 0;
    }

    void sortChildrenByInputOrder() {
        children.sort(Comparator.comparingInt(HierarchyNode::getInputIndex));
    }

    void setIndexInParent(int indexInParent) { this.indexInParent = indexInParent; }

    void setDepth(int depth) { this.depth = depth; }

    /** True if {@code candidate} is this node or one of its ancestors. */
    boolean hasAncestorOrSelf(HierarchyNode candidate) {
        for (HierarchyNode n = this; n != null; n = n.parent) {
            if (n == candidate) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return String.format("HierarchyNode{id='%s', depth=%d, children=%d, attachment=%s}",
                getId(), depth, children.size(), attachment);
    }
}
