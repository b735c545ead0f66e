package uiscope.hierarchy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uiscope.bounds.Bounds;
import uiscope.bounds.BoundsNormalizer;
import uiscope.model.UIElement;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Rebuilds a containment tree from a flat element list using only bounding
 * rectangles, with a semantic fallback for elements that have no usable
 * rectangle.
 *
 * <h3>Passes</h3>
 * <ol>
 *   <li><b>Hidden pass</b>: zero-area and unparsable elements are attached by
 *       {@link HiddenElementResolver}.</li>
 *   <li><b>Geometric pass</b>: remaining elements, smallest area first, are attached
 *       to the smallest other element that contains them within
 *       {@link HierarchySettings#getContainmentTolerance()} and whose area is large
 *       enough that {@code area(child)/area(parent) < cutoff}.</li>
 *   <li><b>Rebuild</b>: if the geometric pass made no attachment at all although two or
 *       more elements had real rectangles, everything is reset and rerun with the
 *       rebuild tolerance and ratio.</li>
 *   <li><b>Root selection</b>: the largest parentless element becomes the root; any other
 *       parentless element is adopted by it so the tree stays single-rooted.</li>
 * </ol>
 *
 * <p>The builder keeps no state between calls and is safe to share. The same input
 * always yields the same tree: ties are broken by position in the input list.
 */
public class HierarchyBuilder {

    private static final Logger log = LoggerFactory.getLogger(HierarchyBuilder.class);

    private final HierarchySettings settings;
    private final HierarchyTracer tracer;

    public HierarchyBuilder() {
        this(HierarchySettings.defaults(), HierarchyTracer.NOOP);
    }

    public HierarchyBuilder(HierarchySettings settings) {
        this(settings, HierarchyTracer.NOOP);
    }

    public HierarchyBuilder(HierarchySettings settings, HierarchyTracer tracer) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.tracer   = tracer != null ? tracer : HierarchyTracer.NOOP;
    }

    public HierarchySettings getSettings() { return settings; }

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Builds a fresh tree for {@code elements}.
     *
     * @param elements flat screen-dump elements; order only matters for tie-breaking
     * @return a new single-rooted result; empty (no root) for an empty list
     * @throws NullPointerException if the list or any element in it is {@code null}
     */
    public HierarchyAnalysisResult analyzeHierarchy(List<UIElement> elements) {
        Objects.requireNonNull(elements, "elements must not be null");
        if (elements.isEmpty()) {
            log.debug("Empty element list, returning empty hierarchy");
            return HierarchyAnalysisResult.empty(settings);
        }

        // 1. One node per distinct id
        Map<String, HierarchyNode> nodeMap = new LinkedHashMap<>();
        List<String> duplicates = new ArrayList<>();
        int index = 0;
        for (UIElement element : elements) {
            Objects.requireNonNull(element, "elements must not contain null (index " + index + ")");
            if (nodeMap.containsKey(element.getId())) {
                log.warn("Duplicate element id '{}' at index {}, keeping first occurrence", element.getId(), index);
                duplicates.add(element.getId());
            } else {
                nodeMap.put(element.getId(), new HierarchyNode(element, index));
            }
            index++;
        }
        List<HierarchyNode> nodes = new ArrayList<>(nodeMap.values());

        // 2-3. Hidden pass then geometric pass
        int geometricCount = countGeometric(nodes);
        int attached = buildRelations(nodes, settings.getContainmentTolerance(), settings.getAreaRatioCutoff());

        // Degenerate: flat result although real rectangles were present
        boolean rebuilt = attached == 0 && geometricCount >= 2;
        if (rebuilt) {
            String detail = String.format("no containment found among %d elements, rebuilding with tolerance=%dpx ratio<%.2f",
                    geometricCount, settings.getRebuildTolerance(), settings.getRebuildAreaRatioCutoff());
            log.warn("Degenerate hierarchy: {}", detail);
            tracer.fallbackTriggered("rebuild", detail);
            nodes.forEach(HierarchyNode::reset);
            attached = buildRelations(nodes, settings.getRebuildTolerance(), settings.getRebuildAreaRatioCutoff());
            if (attached == 0) {
                tracer.fallbackTriggered("largest-root", "rebuild found no containment either, largest element becomes root");
                log.warn("Rebuild produced no containment, falling back to largest element as root");
            }
        }

        // 4. Root selection and adoption of remaining islands
        HierarchyNode root = selectRoot(nodes);

        // 5. Depth, index, leaves
        int maxDepth = assignDepthAndIndex(root);
        List<HierarchyNode> leaves = collectLeaves(root);

        HierarchyAnalysisResult result = new HierarchyAnalysisResult(
                root, nodeMap, leaves, maxDepth, duplicates, settings, rebuilt);
        log.info("Hierarchy built: {} nodes, root={}, leaves={}, maxDepth={}",
                nodeMap.size(), root.getId(), leaves.size(), maxDepth);
        return result;
    }

    // ── Passes ────────────────────────────────────────────────────────────

    /** Runs the hidden pass and the geometric pass; returns the number of geometric attachments. */
    private int buildRelations(List<HierarchyNode> nodes, int tolerance, double ratioCutoff) {
        HiddenElementResolver resolver = new HiddenElementResolver(nodes);
        for (HierarchyNode node : nodes) {
            if (!HiddenElementResolver.needsSemanticParent(node) || node.getParent() != null) continue;
            Optional<HiddenElementResolver.Resolution> resolution = resolver.resolve(node);
            if (resolution.isPresent()) {
                HierarchyNode parent = resolution.get().parent();
                attach(node, parent, AttachmentKind.SEMANTIC);
                log.debug("Hidden element {} attached to {} via {}", node.getId(), parent.getId(), resolution.get().rule());
            } else {
                log.debug("Hidden element {} has no semantic parent, left as root candidate", node.getId());
            }
        }

        List<HierarchyNode> byArea = new ArrayList<>();
        for (HierarchyNode node : nodes) {
            if (BoundsNormalizer.isGeometric(node.getBounds())) byArea.add(node);
        }
        // List.sort is stable, so equal areas keep input order
        byArea.sort(Comparator.comparingLong(n -> n.getBounds().getArea()));

        int attached = 0;
        for (HierarchyNode child : byArea) {
            if (child.getParent() != null) continue;
            HierarchyNode parent = smallestContainer(child, byArea, tolerance, ratioCutoff);
            if (parent != null) {
                attach(child, parent, AttachmentKind.GEOMETRIC);
                attached++;
            }
        }
        return attached;
    }

    /**
     * First node in ascending-area order that contains {@code child}; since the list is
     * sorted, that is the smallest container.
     */
    private static HierarchyNode smallestContainer(HierarchyNode child, List<HierarchyNode> byArea,
                                                   int tolerance, double ratioCutoff) {
        Bounds inner = child.getBounds();
        long childArea = inner.getArea();
        for (HierarchyNode candidate : byArea) {
            if (candidate == child) continue;
            long parentArea = candidate.getBounds().getArea();
            if (parentArea <= childArea) continue;
            if (!candidate.getBounds().contains(inner, tolerance)) continue;
            if ((double) childArea / (double) parentArea >= ratioCutoff) continue;
            return candidate;
        }
        return null;
    }

    private HierarchyNode selectRoot(List<HierarchyNode> nodes) {
        List<HierarchyNode> candidates = new ArrayList<>();
        for (HierarchyNode node : nodes) {
            if (node.getParent() == null) candidates.add(node);
        }

        HierarchyNode root = candidates.get(0);
        for (HierarchyNode c : candidates) {
            if (rootArea(c) > rootArea(root)) root = c;
        }
        root.markRoot();
        tracer.rootSelected(root, candidates.size());

        if (candidates.size() > 1) {
            log.warn("{} disconnected islands, selected {} (largest) as root and adopted the rest",
                    candidates.size(), root.getId());
            tracer.fallbackTriggered("adopt-islands",
                    (candidates.size() - 1) + " parentless element(s) adopted by root " + root.getId());
            for (HierarchyNode orphan : candidates) {
                if (orphan != root) attach(orphan, root, AttachmentKind.ADOPTED);
            }
        }
        return root;
    }

    /** Area for root ranking; elements without a usable rectangle never outrank real ones. */
    private static long rootArea(HierarchyNode node) {
        Bounds b = node.getBounds();
        return BoundsNormalizer.isGeometric(b) ? b.getArea() : -1L;
    }

    private void attach(HierarchyNode child, HierarchyNode parent, AttachmentKind kind) {
        child.attachTo(parent, kind);
        tracer.nodeAttached(child, parent, kind);
    }

    // ── Finishing ─────────────────────────────────────────────────────────

    private static int assignDepthAndIndex(HierarchyNode root) {
        int maxDepth = 0;
        Deque<HierarchyNode> queue = new ArrayDeque<>();
        root.setDepth(0);
        root.setIndexInParent(0);
        queue.add(root);
        while (!queue.isEmpty()) {
            HierarchyNode node = queue.poll();
            maxDepth = Math.max(maxDepth, node.getDepth());
            node.sortChildrenByInputOrder();
            List<HierarchyNode> children = node.getChildren();
            for (int i = 0; i < children.size(); i++) {
                HierarchyNode child = children.get(i);
                child.setIndexInParent(i);
                child.setDepth(node.getDepth() + 1);
                queue.add(child);
            }
        }
        return maxDepth;
    }

    private static List<HierarchyNode> collectLeaves(HierarchyNode root) {
        List<HierarchyNode> leaves = new ArrayList<>();
        Deque<HierarchyNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            HierarchyNode node = stack.pop();
            if (node.isLeaf()) {
                leaves.add(node);
                continue;
            }
            List<HierarchyNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return leaves;
    }

    private static int countGeometric(List<HierarchyNode> nodes) {
        int count = 0;
        for (HierarchyNode node : nodes) {
            if (BoundsNormalizer.isGeometric(node.getBounds())) count++;
        }
        return count;
    }
}
