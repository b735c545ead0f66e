package uiscope.quality;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uiscope.bounds.Bounds;
import uiscope.hierarchy.HierarchyNode;
import uiscope.model.UIElement;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Rates how reliable an element is as an automation target.
 *
 * <p>Each call looks at one element only; the tree is never traversed. Scores are
 * recomputed on every call.
 */
public class QualityScorer {

    private static final Logger log = LoggerFactory.getLogger(QualityScorer.class);

    private static final int MIN_REASONABLE_SIDE = 10;
    private static final int MAX_REASONABLE_SIDE = 2000;

    private final TextVocabulary vocabulary;

    public QualityScorer() {
        this(new TextVocabulary());
    }

    public QualityScorer(TextVocabulary vocabulary) {
        this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary must not be null");
    }

    public ElementQuality calculateQuality(HierarchyNode node) {
        Objects.requireNonNull(node, "node must not be null");
        return calculateQuality(node.getElement());
    }

    public ElementQuality calculateQuality(UIElement element) {
        Objects.requireNonNull(element, "element must not be null");
        ElementQuality quality = new ElementQuality(
                element.getId(),
                textScore(element),
                uniquenessScore(element),
                stabilityScore(element),
                matchabilityScore(element));
        log.debug("Quality {}", quality);
        return quality;
    }

    /**
     * Scores every node and returns the qualities best first. Equal totals keep
     * the iteration order of {@code nodes}.
     */
    public List<ElementQuality> rank(Collection<HierarchyNode> nodes) {
        Objects.requireNonNull(nodes, "nodes must not be null");
        List<ElementQuality> ranked = new ArrayList<>(nodes.size());
        for (HierarchyNode node : nodes) {
            ranked.add(calculateQuality(node));
        }
        ranked.sort(Comparator.comparingDouble(ElementQuality::getTotalScore).reversed());
        return ranked;
    }

    // ── Sub-scores ────────────────────────────────────────────────────────

    int textScore(UIElement e) {
        int score = 0;
        if (e.hasText()) {
            String text = e.getText().trim();
            score += 40;
            int len = text.length();
            if (len >= 2 && len <= 20)       score += 30;
            else if (len > 20 && len <= 50)  score += 20;
            else                             score += 5;
            if (TextVocabulary.isMeaningfulText(text)) score += 20;
            if (vocabulary.containsActionWord(text))   score += 10;
        }
        if (e.hasContentDesc()) score += 15;
        return Math.min(100, score);
    }

    int uniquenessScore(UIElement e) {
        int score = 0;
        if (e.hasResourceId()) {
            score += 40;
            if (TextVocabulary.isMeaningfulResourceId(e.getResourceId())) score += 20;
        }
        if (!e.getElementType().isBlank()) score += 15;
        if (e.hasText()) {
            String text = e.getText().trim();
            if ((text.length() >= 2 && text.length() <= 10) || TextVocabulary.isUniquePhrase(text)) {
                score += 25;
            }
        }
        return Math.min(100, score);
    }

    int stabilityScore(UIElement e) {
        int score = 50;
        if (e.isClickable())   score += 20;
        if (e.hasResourceId()) score += 20;
        if (vocabulary.containsActionWord(e.getText())) score += 10;
        return Math.min(100, score);
    }

    int matchabilityScore(UIElement e) {
        int attributes = 0;
        if (e.hasText())                     attributes++;
        if (e.hasResourceId())               attributes++;
        if (e.hasContentDesc())              attributes++;
        if (!e.getElementType().isBlank())   attributes++;
        int score = 20 * attributes;
        if (e.isClickable() || e.isScrollable()) score += 20;
        if (hasReasonableSize(e.getBounds()))    score += 20;
        return Math.min(100, score);
    }

    private static boolean hasReasonableSize(Bounds b) {
        if (b == null) return false;
        int w = b.getWidth();
        int h = b.getHeight();
        return w >= MIN_REASONABLE_SIDE && w <= MAX_REASONABLE_SIDE
                && h >= MIN_REASONABLE_SIDE && h <= MAX_REASONABLE_SIDE;
    }
}
