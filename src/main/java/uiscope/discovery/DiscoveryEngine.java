package uiscope.discovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uiscope.hierarchy.HierarchyAnalysisResult;
import uiscope.hierarchy.HierarchyNode;
import uiscope.model.UIElement;
import uiscope.quality.QualityScorer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Answers "what is related to this element" against a built hierarchy.
 *
 * <p>For a target id the engine returns the target itself, its ancestors,
 * descendants and siblings, each tagged with a {@link Relationship}, a confidence
 * and a reason, plus a short list of recommended automation candidates. A
 * non-clickable target is first promoted to its nearest clickable ancestor
 * within {@link DiscoveryOptions#getPromotionLevels()} levels.
 *
 * <p>Stateless: the hierarchy is only read, never modified, and nothing is kept
 * between calls.
 */
public class DiscoveryEngine {

    private static final Logger log = LoggerFactory.getLogger(DiscoveryEngine.class);

    static final String PATH_SEPARATOR = " > ";

    private final DiscoveryOptions defaultOptions;
    private final QualityScorer    scorer;

    public DiscoveryEngine() {
        this(DiscoveryOptions.defaults(), new QualityScorer());
    }

    public DiscoveryEngine(DiscoveryOptions defaultOptions, QualityScorer scorer) {
        this.defaultOptions = Objects.requireNonNull(defaultOptions, "defaultOptions must not be null");
        this.scorer         = Objects.requireNonNull(scorer, "scorer must not be null");
    }

    public DiscoveryOptions getDefaultOptions() { return defaultOptions; }

    // ── Public API ────────────────────────────────────────────────────────

    public DiscoveryResult discover(HierarchyAnalysisResult hierarchy, String targetId) {
        return discover(hierarchy, targetId, defaultOptions);
    }

    /**
     * Runs discovery for {@code targetId}.
     *
     * @return the groupings; empty with a message when the hierarchy is empty or
     *         does not contain the id
     * @throws NullPointerException if any argument is {@code null}
     */
    public DiscoveryResult discover(HierarchyAnalysisResult hierarchy, String targetId, DiscoveryOptions options) {
        Objects.requireNonNull(hierarchy, "hierarchy must not be null");
        Objects.requireNonNull(targetId, "targetId must not be null");
        Objects.requireNonNull(options, "options must not be null");

        if (hierarchy.isEmpty()) {
            log.debug("Discovery for '{}' against empty hierarchy", targetId);
            return DiscoveryResult.notFound(targetId, "Hierarchy is empty, nothing to discover");
        }
        HierarchyNode requested = hierarchy.findNode(targetId);
        if (requested == null) {
            log.warn("Discovery target '{}' not found among {} nodes", targetId, hierarchy.size());
            return DiscoveryResult.notFound(targetId, "Element '" + targetId + "' not found in hierarchy");
        }

        HierarchyNode target = promote(requested, options.getPromotionLevels());
        boolean promoted = target != requested;
        if (promoted) {
            log.info("Promoted target {} to clickable ancestor {}", requested.getId(), target.getId());
        }

        DiscoveredElement self = selfEntry(requested, target, promoted);
        List<DiscoveredElement> parents     = findAncestors(target, options);
        List<DiscoveredElement> children    = findDescendants(target, options);
        List<DiscoveredElement> siblings    = findSiblings(target, options);
        List<DiscoveredElement> recommended = recommend(parents, children, options);

        String message = null;
        if (parents.isEmpty() && children.isEmpty() && siblings.isEmpty()) {
            message = "No related elements found for " + ElementLabeler.label(target.getElement());
        }

        DiscoveryResult result = new DiscoveryResult(targetId, self, promoted,
                parents, children, siblings, recommended, message);
        log.info("Discovery for {}: {} parents, {} children, {} siblings, {} recommended",
                target.getId(), parents.size(), children.size(), siblings.size(), recommended.size());
        return result;
    }

    /**
     * The element itself if clickable, else the first clickable ancestor, else
     * {@code null}. Also {@code null} for an unknown id.
     */
    public UIElement findNearestClickableAncestor(HierarchyAnalysisResult hierarchy, String elementId) {
        Objects.requireNonNull(hierarchy, "hierarchy must not be null");
        HierarchyNode node = hierarchy.findNode(elementId);
        for (HierarchyNode cur = node; cur != null; cur = cur.getParent()) {
            if (cur.getElement().isClickable()) return cur.getElement();
        }
        return null;
    }

    // ── Target promotion ──────────────────────────────────────────────────

    private static HierarchyNode promote(HierarchyNode requested, int levels) {
        if (requested.getElement().isClickable()) return requested;
        HierarchyNode cur = requested.getParent();
        for (int level = 1; cur != null && level <= levels; level++, cur = cur.getParent()) {
            if (cur.getElement().isClickable()) return cur;
        }
        return requested;
    }

    private DiscoveredElement selfEntry(HierarchyNode requested, HierarchyNode target, boolean promoted) {
        String reason = promoted
                ? "Promoted from " + ElementLabeler.label(requested.getElement()) + " to nearest clickable container"
                : "Selected element";
        return new DiscoveredElement(target.getElement(), Relationship.SELF, null, 1.0,
                reason, null, null, scorer.calculateQuality(target));
    }

    // ── Ancestors ─────────────────────────────────────────────────────────

    private List<DiscoveredElement> findAncestors(HierarchyNode target, DiscoveryOptions options) {
        List<DiscoveredElement> out = new ArrayList<>();
        HierarchyNode cur = target.getParent();
        for (int distance = 1; cur != null && distance <= options.getMaxDepth(); distance++, cur = cur.getParent()) {
            Relationship rel = Relationship.ancestorAt(distance);
            double confidence = ConfidenceCalculator.forAncestor(cur.getElement(), distance);
            out.add(new DiscoveredElement(cur.getElement(), rel, Relationship.labelFor(rel, distance),
                    confidence, reason(Relationship.labelFor(rel, distance), cur.getElement()),
                    distance, null, scorer.calculateQuality(cur)));
        }
        out.sort(Comparator.comparingInt((DiscoveredElement d) -> d.getDepth())
                .thenComparing(Comparator.comparingDouble(DiscoveredElement::getConfidence).reversed()));
        return out;
    }

    // ── Descendants ───────────────────────────────────────────────────────

    private List<DiscoveredElement> findDescendants(HierarchyNode target, DiscoveryOptions options) {
        List<DiscoveredElement> out = new ArrayList<>();
        collectDescendants(target, 1, ElementLabeler.label(target.getElement()), options.getMaxDepth(), out);
        out.sort(rankingOrder(options.isPrioritizeText()));
        return truncate(out, options.getDescendantCap());
    }

    private void collectDescendants(HierarchyNode node, int distance, String pathSoFar,
                                    int maxDepth, List<DiscoveredElement> out) {
        if (distance > maxDepth) return;
        for (HierarchyNode child : node.getChildren()) {
            UIElement e = child.getElement();
            String path = pathSoFar + PATH_SEPARATOR + ElementLabeler.label(e);
            Relationship rel = Relationship.descendantAt(distance);
            String label = Relationship.labelFor(rel, distance);
            out.add(new DiscoveredElement(e, rel, label, ConfidenceCalculator.base(e, rel),
                    reason(label, e), distance, path, scorer.calculateQuality(child)));
            collectDescendants(child, distance + 1, path, maxDepth, out);
        }
    }

    // ── Siblings ──────────────────────────────────────────────────────────

    private List<DiscoveredElement> findSiblings(HierarchyNode target, DiscoveryOptions options) {
        HierarchyNode parent = target.getParent();
        if (parent == null) return List.of();
        List<DiscoveredElement> out = new ArrayList<>();
        for (HierarchyNode sibling : parent.getChildren()) {
            if (sibling == target) continue;
            UIElement e = sibling.getElement();
            String reason = reason("sibling", e);
            double similarity = ElementLabeler.similarity(target.getElement(), e);
            if (similarity >= 0.75) {
                reason += String.format(", looks like the target (%.0f%% similar)", similarity * 100);
            }
            out.add(new DiscoveredElement(e, Relationship.SIBLING, null,
                    ConfidenceCalculator.base(e, Relationship.SIBLING), reason, null, null,
                    scorer.calculateQuality(sibling)));
        }
        out.sort(rankingOrder(options.isPrioritizeText()));
        return truncate(out, options.getSiblingCap());
    }

    // ── Recommended ───────────────────────────────────────────────────────

    private static List<DiscoveredElement> recommend(List<DiscoveredElement> parents,
                                                     List<DiscoveredElement> children,
                                                     DiscoveryOptions options) {
        Map<String, DiscoveredElement> union = new LinkedHashMap<>();
        for (DiscoveredElement d : parents)  union.putIfAbsent(d.getId(), d);
        for (DiscoveredElement d : children) union.putIfAbsent(d.getId(), d);

        List<DiscoveredElement> out = new ArrayList<>();
        for (DiscoveredElement d : union.values()) {
            if (d.hasText() || d.isClickable()) out.add(d);
        }
        out.sort(Comparator.comparingDouble(DiscoveredElement::getConfidence).reversed());
        return truncate(out, options.getRecommendedCap());
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    /** Text-bearing first when enabled, then confidence descending; stable otherwise. */
    private static Comparator<DiscoveredElement> rankingOrder(boolean prioritizeText) {
        Comparator<DiscoveredElement> byConfidence =
                Comparator.comparingDouble(DiscoveredElement::getConfidence).reversed();
        if (!prioritizeText) return byConfidence;
        Comparator<DiscoveredElement> textFirst = Comparator.comparingInt(d -> d.hasText() ? 0 : 1);
        return textFirst.thenComparing(byConfidence);
    }

    private static List<DiscoveredElement> truncate(List<DiscoveredElement> list, int cap) {
        return list.size() <= cap ? list : new ArrayList<>(list.subList(0, cap));
    }

    private static String reason(String relation, UIElement e) {
        StringBuilder sb = new StringBuilder(relation).append(": ").append(ElementLabeler.label(e));
        if (e.hasText() && e.isHidden()) sb.append(", hidden text label");
        else if (e.hasText())            sb.append(", has text");
        if (e.isClickable())             sb.append(", clickable");
        if (e.hasResourceId())           sb.append(", has resource id");
        return sb.toString();
    }
}
