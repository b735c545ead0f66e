package uiscope.hierarchy;

import uiscope.bounds.Bounds;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Structural self-check of a built tree.
 *
 * <p>Checks: exactly one root, root reachable for every node (no cycles, no
 * strays), parent/child back-references agree, ids unique, and every
 * {@link AttachmentKind#GEOMETRIC} edge honours containment within tolerance
 * with a strictly larger parent.
 */
public class HierarchyValidationReport {

    private final List<String> violations;
    private final int          checkedNodes;

    public HierarchyValidationReport(List<String> violations, int checkedNodes) {
        this.violations   = violations != null ? List.copyOf(violations) : List.of();
        this.checkedNodes = checkedNodes;
    }

    static HierarchyValidationReport of(HierarchyAnalysisResult result) {
        List<String> errors = new ArrayList<>();
        Map<String, HierarchyNode> nodeMap = result.getNodeMap();
        int tolerance = result.getEffectiveTolerance();

        List<HierarchyNode> roots = nodeMap.values().stream()
                .filter(HierarchyNode::isRoot)
                .collect(Collectors.toList());
        if (!nodeMap.isEmpty() && roots.size() != 1) {
            errors.add("expected exactly one root but found " + roots.size());
        }
        if (result.getRoot() != null && !result.getRoot().isRoot()) {
            errors.add("declared root " + result.getRoot().getId() + " has a parent");
        }

        Set<String> seen = new HashSet<>();
        for (Map.Entry<String, HierarchyNode> entry : nodeMap.entrySet()) {
            HierarchyNode node = entry.getValue();
            if (!entry.getKey().equals(node.getId())) {
                errors.add("node map key " + entry.getKey() + " points at node " + node.getId());
            }
            if (!seen.add(node.getId())) {
                errors.add("duplicate node id " + node.getId());
            }

            HierarchyNode parent = node.getParent();
            if (parent != null && !parent.getChildren().contains(node)) {
                errors.add("node " + node.getId() + " is missing from its parent's children");
            }
            for (HierarchyNode child : node.getChildren()) {
                if (child.getParent() != node) {
                    errors.add("child " + child.getId() + " does not point back to " + node.getId());
                }
            }

            if (!reachesRoot(node, nodeMap.size())) {
                errors.add("node " + node.getId() + " is on a cycle or detached from the root");
            }

            if (node.getAttachment() == AttachmentKind.GEOMETRIC && parent != null) {
                Bounds pb = parent.getBounds();
                Bounds cb = node.getBounds();
                if (pb == null || cb == null || !pb.contains(cb, tolerance)) {
                    errors.add("geometric edge " + parent.getId() + " -> " + node.getId()
                            + " violates containment: " + pb + " vs " + cb);
                } else if (pb.getArea() <= cb.getArea()) {
                    errors.add("geometric edge " + parent.getId() + " -> " + node.getId()
                            + " has parent area not larger than child");
                }
            }
        }
        return new HierarchyValidationReport(errors, nodeMap.size());
    }

    private static boolean reachesRoot(HierarchyNode node, int limit) {
        Map<HierarchyNode, Boolean> visited = new IdentityHashMap<>();
        HierarchyNode cur = node;
        int steps = 0;
        while (cur.getParent() != null) {
            if (visited.put(cur, Boolean.TRUE) != null || ++steps > limit) return false;
            cur = cur.getParent();
        }
        return cur.getAttachment() == AttachmentKind.ROOT;
    }

    // ── Accessors ─────────────────────────────────────────────────────────

    public List<String> getViolations()    { return violations; }
    public int          getCheckedNodes()  { return checkedNodes; }
    public boolean      isValid()          { return violations.isEmpty(); }

    /**
     * Throws when any violation was found.
     *
     * @throws AssertionError listing every violation
     */
    public HierarchyValidationReport assertValid() {
        if (!violations.isEmpty()) {
            StringBuilder sb = new StringBuilder("Hierarchy has ")
                    .append(violations.size()).append(" violation(s):\n");
            violations.forEach(v -> sb.append("  ").append(v).append('\n'));
            throw new AssertionError(sb.toString());
        }
        return this;
    }

    public String summary() {
        return String.format("Hierarchy validation: %s (%d nodes checked, %d violations)%s",
                isValid() ? "VALID" : "INVALID", checkedNodes, violations.size(),
                violations.isEmpty() ? "" : "\n" + violations.stream()
                        .map(v -> "  - " + v)
                        .collect(Collectors.joining("\n")));
    }

    @Override
    public String toString() {
        return String.format("HierarchyValidationReport{valid=%s, violations=%d}", isValid(), violations.size());
    }
}
