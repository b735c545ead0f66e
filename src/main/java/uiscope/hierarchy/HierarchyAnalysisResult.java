package uiscope.hierarchy;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of {@link HierarchyBuilder#analyzeHierarchy}: the single root, a flat
 * id index over every node, the leaves, and the maximum depth.
 *
 * <p>Never mutated after construction. Build a new one whenever the element
 * list changes.
 */
public final class HierarchyAnalysisResult {

    private final HierarchyNode              root;
    private final Map<String, HierarchyNode> nodeMap;
    private final List<HierarchyNode>        leafNodes;
    private final int                        maxDepth;
    private final List<String>               droppedDuplicateIds;
    private final HierarchySettings          settings;
    private final boolean                    rebuilt;

    HierarchyAnalysisResult(HierarchyNode root,
                            Map<String, HierarchyNode> nodeMap,
                            List<HierarchyNode> leafNodes,
                            int maxDepth,
                            List<String> droppedDuplicateIds,
                            HierarchySettings settings,
                            boolean rebuilt) {
        this.root                = root;
        this.nodeMap             = Collections.unmodifiableMap(new LinkedHashMap<>(nodeMap));
        this.leafNodes           = List.copyOf(leafNodes);
        this.maxDepth            = maxDepth;
        this.droppedDuplicateIds = List.copyOf(droppedDuplicateIds);
        this.settings            = settings;
        this.rebuilt             = rebuilt;
    }

    /** Result for an empty element list: no root, no nodes. */
    public static HierarchyAnalysisResult empty(HierarchySettings settings) {
        return new HierarchyAnalysisResult(null, Map.of(), List.of(), 0, List.of(), settings, false);
    }

    // ── Accessors ─────────────────────────────────────────────────────────

    /** The root node, or {@code null} when the input was empty. */
    public HierarchyNode getRoot() { return root; }

    /** Every node keyed by element id, in input order. */
    public Map<String, HierarchyNode> getNodeMap() { return nodeMap; }

    /** Leaves in pre-order from the root. */
    public List<HierarchyNode> getLeafNodes() { return leafNodes; }

    public int getMaxDepth() { return maxDepth; }

    /** Ids that appeared more than once in the input; only the first occurrence was kept. */
    public List<String> getDroppedDuplicateIds() { return droppedDuplicateIds; }

    public HierarchySettings getSettings() { return settings; }

    /** True if the first pass came out flat and the tree was rebuilt with the rebuild tolerance. */
    public boolean isRebuilt() { return rebuilt; }

    /** Pixel tolerance the geometric attachments of this tree were made with. */
    public int getEffectiveTolerance() {
        return rebuilt ? settings.getRebuildTolerance() : settings.getContainmentTolerance();
    }

    public int size() { return nodeMap.size(); }

    public boolean isEmpty() { return nodeMap.isEmpty(); }

    // ── Queries ───────────────────────────────────────────────────────────

    /** O(1) lookup; {@code null} if the id is unknown. */
    public HierarchyNode findNode(String elementId) {
        return elementId == null ? null : nodeMap.get(elementId);
    }

    /** Ancestors nearest first, ending with the root. */
    public List<HierarchyNode> getAncestors(HierarchyNode node) {
        List<HierarchyNode> ancestors = new ArrayList<>();
        for (HierarchyNode cur = node.getParent(); cur != null; cur = cur.getParent()) {
            ancestors.add(cur);
        }
        return ancestors;
    }

    /** All descendants in pre-order. */
    public List<HierarchyNode> getDescendants(HierarchyNode node) {
        List<HierarchyNode> out = new ArrayList<>();
        Deque<HierarchyNode> stack = new ArrayDeque<>();
        pushChildrenReversed(stack, node);
        while (!stack.isEmpty()) {
            HierarchyNode cur = stack.pop();
            out.add(cur);
            pushChildrenReversed(stack, cur);
        }
        return out;
    }

    /** The other children of {@code node}'s parent; empty for the root. */
    public List<HierarchyNode> getSiblings(HierarchyNode node) {
        HierarchyNode parent = node.getParent();
        if (parent == null) return List.of();
        List<HierarchyNode> out = new ArrayList<>();
        for (HierarchyNode sibling : parent.getChildren()) {
            if (sibling != node) out.add(sibling);
        }
        return out;
    }

    /**
     * Element ids from the root down to {@code elementId} inclusive, i.e. the
     * nodes a tree view has to expand to reveal it. Empty if the id is unknown.
     */
    public List<String> pathTo(String elementId) {
        HierarchyNode node = findNode(elementId);
        if (node == null) return List.of();
        List<String> path = new ArrayList<>();
        for (HierarchyNode cur = node; cur != null; cur = cur.getParent()) {
            path.add(cur.getId());
        }
        Collections.reverse(path);
        return path;
    }

    public TreeStatistics statistics() {
        return TreeStatistics.of(this);
    }

    public HierarchyValidationReport validate() {
        return HierarchyValidationReport.of(this);
    }

    private static void pushChildrenReversed(Deque<HierarchyNode> stack, HierarchyNode node) {
        List<HierarchyNode> children = node.getChildren();
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(children.get(i));
        }
    }

    @Override
    public String toString() {
        return String.format("HierarchyAnalysisResult{nodes=%d, root=%s, leaves=%d, maxDepth=%d}",
                nodeMap.size(), root != null ? root.getId() : "none", leafNodes.size(), maxDepth);
    }
}
