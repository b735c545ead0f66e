package uiscope.hierarchy;

import org.testng.annotations.Test;
import uiscope.bounds.Bounds;
import uiscope.model.ScreenDumpIO;
import uiscope.model.UIElement;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for {@link HierarchyBuilder}.
 * Pure in-memory element lists; no device or dump parser required.
 */
public class HierarchyBuilderTest {

    private final HierarchyBuilder builder = new HierarchyBuilder();

    private static UIElement el(String id, int l, int t, int r, int b) {
        return UIElement.builder(id).bounds(l, t, r, b).build();
    }

    private static String parentId(HierarchyAnalysisResult result, String id) {
        HierarchyNode parent = result.findNode(id).getParent();
        return parent == null ? null : parent.getId();
    }

    private static List<UIElement> loadDump(String name) throws IOException {
        try {
            return ScreenDumpIO.read(Path.of(HierarchyBuilderTest.class.getResource("/dumps/" + name).toURI()));
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    // ── Geometric containment ─────────────────────────────────────────────

    @Test(description = "Strictly nested rectangles form a chain A -> B -> C")
    public void nestedRectangles_formChain() {
        HierarchyAnalysisResult result = builder.analyzeHierarchy(List.of(
                el("A", 0, 0, 1000, 2000),
                el("B", 50, 100, 950, 800),
                el("C", 100, 200, 300, 280)));

        assertThat(result.getRoot().getId()).isEqualTo("A");
        assertThat(parentId(result, "B")).isEqualTo("A");
        assertThat(parentId(result, "C")).isEqualTo("B");
        assertThat(result.getMaxDepth()).isEqualTo(2);
        assertThat(result.getLeafNodes()).extracting(HierarchyNode::getId).containsExactly("C");
        assertThat(result.findNode("C").getAttachment()).isEqualTo(AttachmentKind.GEOMETRIC);
        assertThat(result.findNode("C").getDepth()).isEqualTo(2);
        result.validate().assertValid();
    }

    @Test(description = "Input order does not change the tree, only tie-breaking")
    public void inputOrder_doesNotChangeStructure() {
        HierarchyAnalysisResult result = builder.analyzeHierarchy(List.of(
                el("C", 100, 200, 300, 280),
                el("A", 0, 0, 1000, 2000),
                el("B", 50, 100, 950, 800)));

        assertThat(result.getRoot().getId()).isEqualTo("A");
        assertThat(parentId(result, "C")).isEqualTo("B");
        assertThat(parentId(result, "B")).isEqualTo("A");
    }

    @Test(description = "The smallest containing rectangle is the direct parent")
    public void smallestContainer_isParent() {
        HierarchyAnalysisResult result = builder.analyzeHierarchy(List.of(
                el("screen", 0, 0, 1080, 2400),
                el("list", 0, 200, 1080, 2000),
                el("row", 0, 200, 1080, 400),
                el("title", 20, 220, 600, 300)));

        assertThat(parentId(result, "title")).isEqualTo("row");
        assertThat(parentId(result, "row")).isEqualTo("list");
        assertThat(parentId(result, "list")).isEqualTo("screen");
    }

    @Test(description = "Equal-area candidate parents are resolved by input order")
    public void equalAreaTie_firstInInputWins() {
        HierarchyAnalysisResult result = builder.analyzeHierarchy(List.of(
                el("screen", 0, 0, 1080, 2400),
                el("first", 0, 0, 500, 500),
                el("second", 0, 0, 500, 500),
                el("child", 10, 10, 100, 100)));

        assertThat(parentId(result, "child")).isEqualTo("first");
        assertThat(parentId(result, "first")).isEqualTo("screen");
        assertThat(parentId(result, "second"))
                .as("identical rectangles never nest")
                .isEqualTo("screen");
    }

    @Test(description = "Edges overhanging by up to 2px still count as contained")
    public void tolerance_allowsSmallOverhang() {
        HierarchyAnalysisResult result = builder.analyzeHierarchy(List.of(
                el("parent", 100, 100, 500, 500),
                el("child", 98, 150, 502, 300)));

        assertThat(parentId(result, "child")).isEqualTo("parent");
        assertThat(result.findNode("child").getAttachment()).isEqualTo(AttachmentKind.GEOMETRIC);
    }

    // ── Near-duplicates and degenerate input ──────────────────────────────

    @Test(description = "Near-identical rectangles (area ratio 0.97) get no geometric relation")
    public void nearDuplicate_noGeometricRelation() {
        HierarchyTracer tracer = mock(HierarchyTracer.class);
        HierarchyAnalysisResult result = new HierarchyBuilder(HierarchySettings.defaults(), tracer)
                .analyzeHierarchy(List.of(
                        el("P", 0, 0, 1000, 1000),
                        el("E", 0, 0, 985, 985)));

        HierarchyNode e = result.findNode("E");
        assertThat(result.getRoot().getId()).isEqualTo("P");
        assertThat(e.getAttachment())
                .as("E only hangs under the root to keep the tree single-rooted")
                .isEqualTo(AttachmentKind.ADOPTED);

        verify(tracer).fallbackTriggered(eq("rebuild"), anyString());
        verify(tracer).fallbackTriggered(eq("largest-root"), anyString());
        verify(tracer).fallbackTriggered(eq("adopt-islands"), anyString());
        verify(tracer).rootSelected(any(HierarchyNode.class), eq(2));
        verify(tracer, never()).nodeAttached(any(), any(), eq(AttachmentKind.GEOMETRIC));
    }

    @Test(description = "Near-duplicates inside a screen container become siblings")
    public void nearDuplicate_underContainer_areSiblings() {
        HierarchyAnalysisResult result = builder.analyzeHierarchy(List.of(
                el("screen", 0, 0, 1080, 2400),
                el("P", 0, 0, 1000, 1000),
                el("E", 0, 0, 985, 985)));

        assertThat(parentId(result, "P")).isEqualTo("screen");
        assertThat(parentId(result, "E")).isEqualTo("screen");
        assertThat(result.getSiblings(result.findNode("E"))).extracting(HierarchyNode::getId).containsExactly("P");
    }

    @Test(description = "A flat first pass is rebuilt with the looser rebuild tolerance")
    public void flatFirstPass_rebuildsWithLooserTolerance() {
        HierarchyTracer tracer = mock(HierarchyTracer.class);
        HierarchyAnalysisResult result = new HierarchyBuilder(HierarchySettings.defaults(), tracer)
                .analyzeHierarchy(List.of(
                        el("outer", 100, 100, 500, 500),
                        el("inner", 97, 200, 300, 300)));

        verify(tracer).fallbackTriggered(eq("rebuild"), anyString());
        verify(tracer, never()).fallbackTriggered(eq("largest-root"), anyString());
        assertThat(parentId(result, "inner")).isEqualTo("outer");
        assertThat(result.findNode("inner").getAttachment()).isEqualTo(AttachmentKind.GEOMETRIC);
        assertThat(result.isRebuilt()).isTrue();
        assertThat(result.getEffectiveTolerance()).isEqualTo(4);
        result.validate().assertValid();
    }

    @Test(description = "Disconnected islands are adopted by the largest element")
    public void disconnectedIslands_adoptedByLargest() {
        HierarchyAnalysisResult result = builder.analyzeHierarchy(List.of(
                el("small", 2000, 2000, 2100, 2100),
                el("big", 0, 0, 1000, 1000),
                el("bigChild", 10, 10, 100, 100)));

        assertThat(result.getRoot().getId()).isEqualTo("big");
        assertThat(result.findNode("small").getAttachment()).isEqualTo(AttachmentKind.ADOPTED);
        assertThat(result.findNode("bigChild").getAttachment()).isEqualTo(AttachmentKind.GEOMETRIC);
        assertThat(result.getRoot().getChildren()).extracting(HierarchyNode::getId)
                .as("children are kept in input order")
                .containsExactly("small", "bigChild");
        result.validate().assertValid();
    }

    // ── Hidden-element fallback ───────────────────────────────────────────

    @Test(description = "Hidden text label attaches to its namespace container, not geometrically")
    public void hiddenLabel_attachesViaNamespace() {
        UIElement t = UIElement.builder("T").bounds(0, 0, 0, 0)
                .resourceId("app:id/content").text("联系人").build();
        UIElement l = UIElement.builder("L").bounds(50, 1400, 450, 1480)
                .resourceId("app:id/container").elementType("android.widget.LinearLayout").build();

        HierarchyAnalysisResult result = builder.analyzeHierarchy(List.of(t, l));

        assertThat(parentId(result, "T")).isEqualTo("L");
        assertThat(result.findNode("T").getAttachment()).isEqualTo(AttachmentKind.SEMANTIC);
        assertThat(result.getRoot().getId()).isEqualTo("L");
    }

    @Test(description = "Bottom navigation dump: hidden tab labels land under their clickable tabs")
    public void bottomNavDump_labelsUnderTabs() throws IOException {
        HierarchyAnalysisResult result = builder.analyzeHierarchy(loadDump("bottom-nav.json"));

        assertThat(result.getRoot().getId()).isEqualTo("root");
        assertThat(parentId(result, "label_home")).isEqualTo("tab_home");
        assertThat(parentId(result, "label_contacts")).isEqualTo("tab_contacts");
        assertThat(parentId(result, "label_me")).isEqualTo("tab_me");
        assertThat(parentId(result, "icon_home")).isEqualTo("tab_home");
        assertThat(parentId(result, "tab_home")).isEqualTo("nav");
        assertThat(parentId(result, "search_btn")).isEqualTo("content");
        assertThat(result.findNode("tab_home").getChildren()).extracting(HierarchyNode::getId)
                .containsExactly("icon_home", "label_home");
        assertThat(result.getMaxDepth()).isEqualTo(3);
        assertThat(result.getLeafNodes()).extracting(HierarchyNode::getId).containsExactly(
                "search_btn", "icon_home", "label_home", "icon_contacts", "label_contacts", "icon_me", "label_me");
        result.validate().assertValid();
    }

    @Test(description = "Unparsable bounds take the semantic path and never become root")
    public void unparsableBounds_semanticPath() throws IOException {
        HierarchyAnalysisResult result = builder.analyzeHierarchy(loadDump("unparsable-bounds.json"));

        assertThat(result.size()).isEqualTo(3);
        assertThat(result.getRoot().getId()).isEqualTo("screen");
        assertThat(parentId(result, "broken")).isEqualTo("screen");
        assertThat(result.findNode("broken").getAttachment()).isEqualTo(AttachmentKind.SEMANTIC);
    }

    @Test(description = "A lone hidden element with no candidate is adopted by the root")
    public void unmatchedHidden_isAdopted() {
        HierarchyAnalysisResult result = builder.analyzeHierarchy(List.of(
                el("screen", 0, 0, 1080, 2400),
                UIElement.builder("ghost").bounds(Bounds.ZERO).build()));

        assertThat(parentId(result, "ghost")).isEqualTo("screen");
        assertThat(result.findNode("ghost").getAttachment()).isEqualTo(AttachmentKind.ADOPTED);
    }

    // ── Degenerate input and contracts ────────────────────────────────────

    @Test(description = "Empty input yields an empty result without throwing")
    public void emptyInput_emptyResult() {
        HierarchyAnalysisResult result = builder.analyzeHierarchy(List.of());
        assertThat(result.isEmpty()).isTrue();
        assertThat(result.getRoot()).isNull();
        assertThat(result.getLeafNodes()).isEmpty();
        assertThat(result.getMaxDepth()).isZero();
        assertThat(result.validate().isValid()).isTrue();
    }

    @Test(description = "Single element is its own root and leaf")
    public void singleElement() {
        HierarchyAnalysisResult result = builder.analyzeHierarchy(List.of(el("only", 0, 0, 10, 10)));
        assertThat(result.getRoot().getId()).isEqualTo("only");
        assertThat(result.getRoot().getAttachment()).isEqualTo(AttachmentKind.ROOT);
        assertThat(result.getLeafNodes()).hasSize(1);
    }

    @Test(description = "Null list or null element fails fast")
    public void nullInput_failsFast() {
        assertThatThrownBy(() -> builder.analyzeHierarchy(null))
                .isInstanceOf(NullPointerException.class);
        List<UIElement> withNull = new ArrayList<>();
        withNull.add(el("a", 0, 0, 10, 10));
        withNull.add(null);
        assertThatThrownBy(() -> builder.analyzeHierarchy(withNull))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("index 1");
    }

    @Test(description = "Duplicate ids keep the first occurrence and are reported")
    public void duplicateIds_firstWins() {
        HierarchyAnalysisResult result = builder.analyzeHierarchy(List.of(
                el("screen", 0, 0, 1080, 2400),
                el("dup", 0, 0, 100, 100),
                el("dup", 500, 500, 600, 600)));

        assertThat(result.size()).isEqualTo(2);
        assertThat(result.findNode("dup").getBounds()).isEqualTo(new Bounds(0, 0, 100, 100));
        assertThat(result.getDroppedDuplicateIds()).containsExactly("dup");
    }

    // ── Properties over generated layouts ─────────────────────────────────

    @Test(description = "Generated layouts always give a valid, single-rooted, complete tree")
    public void generatedLayouts_satisfyInvariants() {
        Random random = new Random(20240611L);
        for (int round = 0; round < 50; round++) {
            List<UIElement> elements = randomLayout(random, 5 + random.nextInt(40));
            HierarchyAnalysisResult result = builder.analyzeHierarchy(elements);

            assertThat(result.size()).isEqualTo(elements.size());
            assertThat(result.getNodeMap().values().stream().filter(HierarchyNode::isRoot).count()).isEqualTo(1);
            result.validate().assertValid();

            for (HierarchyNode node : result.getNodeMap().values()) {
                if (node.getAttachment() != AttachmentKind.GEOMETRIC) continue;
                Bounds parent = node.getParent().getBounds();
                assertThat(parent.contains(node.getBounds(), HierarchySettings.DEFAULT_REBUILD_TOLERANCE)).isTrue();
                assertThat(parent.getArea()).isGreaterThan(node.getBounds().getArea());
            }
        }
    }

    @Test(description = "Building twice from the same input gives the same parent assignments")
    public void idempotent() {
        Random random = new Random(7L);
        List<UIElement> elements = randomLayout(random, 60);

        Map<String, String> first = parentMap(builder.analyzeHierarchy(elements));
        Map<String, String> second = parentMap(builder.analyzeHierarchy(new ArrayList<>(elements)));

        assertThat(second).isEqualTo(first);
    }

    private static Map<String, String> parentMap(HierarchyAnalysisResult result) {
        Map<String, String> map = new HashMap<>();
        result.getNodeMap().forEach((id, node) ->
                map.put(id, node.getParent() == null ? "<root>" : node.getParent().getId()));
        return map;
    }

    /** Screen plus random rectangles, some nested in earlier ones, some hidden. */
    private static List<UIElement> randomLayout(Random random, int count) {
        List<UIElement> out = new ArrayList<>();
        List<Bounds> placed = new ArrayList<>();
        Bounds screen = new Bounds(0, 0, 1080, 2400);
        out.add(UIElement.builder("screen").bounds(screen).elementType("android.widget.FrameLayout").build());
        placed.add(screen);
        for (int i = 1; i < count; i++) {
            UIElement.Builder b = UIElement.builder("e" + i)
                    .clickable(random.nextInt(3) == 0)
                    .resourceId(random.nextBoolean() ? "com.app:id/item_" + i : null)
                    .text(random.nextInt(4) == 0 ? "t" + i : null);
            if (random.nextInt(8) == 0) {
                b.bounds(Bounds.ZERO);
            } else {
                Bounds host = placed.get(random.nextInt(placed.size()));
                int w = Math.max(2, host.getWidth());
                int h = Math.max(2, host.getHeight());
                int l = host.getLeft() + random.nextInt(w / 2 + 1);
                int t = host.getTop() + random.nextInt(h / 2 + 1);
                int r = Math.min(host.getRight(), l + 1 + random.nextInt(w / 2 + 1));
                int bt = Math.min(host.getBottom(), t + 1 + random.nextInt(h / 2 + 1));
                Bounds bounds = new Bounds(l, t, r, bt);
                b.bounds(bounds);
                placed.add(bounds);
            }
            out.add(b.build());
        }
        return out;
    }
}
