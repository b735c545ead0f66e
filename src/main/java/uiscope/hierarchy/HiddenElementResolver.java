package uiscope.hierarchy;

import uiscope.bounds.BoundsNormalizer;
import uiscope.model.UIElement;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Finds a parent for elements that cannot take part in geometric containment:
 * zero-area {@code [0,0][0,0]} elements and elements whose bounds failed to parse.
 *
 * <p>Rules, tried in order:
 * <ol>
 *   <li>{@link Rule#SHARED_NAMESPACE}: a visible element from the same resource-id
 *       namespace ({@code pkg} in {@code pkg:id/name}) that is clickable or a container type</li>
 *   <li>{@link Rule#TYPE_COMPATIBLE}: for text-bearing elements, any visible container type</li>
 *   <li>{@link Rule#NESTED_CONTAINER}: another hidden element that looks like this one's
 *       container, e.g. {@code ...:id/content} under {@code ...:id/container}</li>
 * </ol>
 * Within a rule the nearest candidate in dump order wins, preceding elements
 * before following ones, since a dump lists parents before their children.
 */
final class HiddenElementResolver {

    /** Which heuristic produced a semantic attachment. */
    enum Rule { SHARED_NAMESPACE, TYPE_COMPATIBLE, NESTED_CONTAINER }

    /** A chosen parent and the rule that chose it. */
    record Resolution(HierarchyNode parent, Rule rule) {}

    private static final String ID_SEPARATOR = ":id/";

    private static final List<String> CONTAINER_TYPE_TOKENS = List.of(
            "layout", "viewgroup", "recyclerview", "listview", "gridview",
            "scrollview", "viewpager", "toolbar", "cardview", "container");

    private static final List<String> CONTAINER_ID_TOKENS = List.of(
            "container", "layout", "wrapper", "group", "panel");

    private static final List<String> CONTENT_ID_TOKENS = List.of(
            "content", "text", "label", "title");

    private final List<HierarchyNode> nodes;

    HiddenElementResolver(List<HierarchyNode> nodesInInputOrder) {
        this.nodes = nodesInInputOrder;
    }

    /** True if this node must go through semantic resolution instead of the geometric pass. */
    static boolean needsSemanticParent(HierarchyNode node) {
        return !BoundsNormalizer.isGeometric(node.getBounds());
    }

    Optional<Resolution> resolve(HierarchyNode node) {
        UIElement e = node.getElement();

        String namespace = namespaceOf(e.getResourceId());
        if (!namespace.isEmpty()) {
            Optional<HierarchyNode> match = nearest(node, c ->
                    BoundsNormalizer.isGeometric(c.getBounds())
                    && namespace.equals(namespaceOf(c.getElement().getResourceId()))
                    && (c.getElement().isClickable() || isContainerType(c.getElement().getElementType())));
            if (match.isPresent()) return Optional.of(new Resolution(match.get(), Rule.SHARED_NAMESPACE));
        }

        if (isTextBearing(e)) {
            Optional<HierarchyNode> match = nearest(node, c ->
                    BoundsNormalizer.isGeometric(c.getBounds())
                    && isContainerType(c.getElement().getElementType()));
            if (match.isPresent()) return Optional.of(new Resolution(match.get(), Rule.TYPE_COMPATIBLE));
        }

        Optional<HierarchyNode> nested = nearest(node, c ->
                c.getElement().isHidden()
                && !c.hasAncestorOrSelf(node)
                && looksLikeContainerOf(c.getElement(), e));
        return nested.map(p -> new Resolution(p, Rule.NESTED_CONTAINER));
    }

    // ── Heuristics ────────────────────────────────────────────────────────

    /** Package part of {@code pkg:id/name}; empty when there is no {@code :id/}. */
    static String namespaceOf(String resourceId) {
        if (resourceId == null) return "";
        int idx = resourceId.indexOf(ID_SEPARATOR);
        return idx > 0 ? resourceId.substring(0, idx) : "";
    }

    /** Name part of {@code pkg:id/name}, lower-cased; the whole id if there is no {@code :id/}. */
    static String localNameOf(String resourceId) {
        if (resourceId == null) return "";
        int idx = resourceId.indexOf(ID_SEPARATOR);
        String local = idx >= 0 ? resourceId.substring(idx + ID_SEPARATOR.length()) : resourceId;
        return local.toLowerCase(Locale.ROOT);
    }

    static boolean isContainerType(String elementType) {
        if (elementType == null || elementType.isBlank()) return false;
        String simple = elementType.substring(elementType.lastIndexOf('.') + 1).toLowerCase(Locale.ROOT);
        for (String token : CONTAINER_TYPE_TOKENS) {
            if (simple.contains(token)) return true;
        }
        return false;
    }

    static boolean isTextBearing(UIElement e) {
        return e.hasText() || e.hasContentDesc();
    }

    private static boolean looksLikeContainerOf(UIElement container, UIElement content) {
        String containerId = localNameOf(container.getResourceId());
        String contentId   = localNameOf(content.getResourceId());
        if (containsAny(containerId, CONTAINER_ID_TOKENS) && containsAny(contentId, CONTENT_ID_TOKENS)) {
            return true;
        }
        return isTextBearing(content) && isContainerType(container.getElementType());
    }

    private static boolean containsAny(String haystack, List<String> needles) {
        if (haystack.isEmpty()) return false;
        for (String n : needles) {
            if (haystack.contains(n)) return true;
        }
        return false;
    }

    private Optional<HierarchyNode> nearest(HierarchyNode node, Predicate<HierarchyNode> accept) {
        int origin = node.getInputIndex();
        return nodes.stream()
                .filter(c -> c != node)
                .filter(accept)
                .min(Comparator
                        .comparingInt((HierarchyNode c) -> c.getInputIndex() < origin ? 0 : 1)
                        .thenComparingInt(c -> Math.abs(c.getInputIndex() - origin)));
    }
}
