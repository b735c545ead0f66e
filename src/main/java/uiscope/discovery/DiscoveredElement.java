package uiscope.discovery;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import uiscope.model.UIElement;
import uiscope.quality.ElementQuality;

import java.util.Objects;

/**
 * One element returned by a discovery call, tagged with its relationship to the
 * target and a confidence in {@code [0,1]}.
 *
 * <p>Not part of the tree: created per call and owned by the caller.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"relationship", "label", "confidence", "reason", "hasText", "clickable",
        "depth", "path", "element", "quality"})
public final class DiscoveredElement {

    private final UIElement      element;
    private final Relationship   relationship;
    private final String         label;
    private final double         confidence;
    private final String         reason;
    private final Integer        depth;
    private final String         path;
    private final ElementQuality quality;

    DiscoveredElement(UIElement element, Relationship relationship, String label, double confidence,
                      String reason, Integer depth, String path, ElementQuality quality) {
        this.element      = Objects.requireNonNull(element, "element must not be null");
        this.relationship = Objects.requireNonNull(relationship, "relationship must not be null");
        this.label        = label != null ? label : relationship.getTag();
        this.confidence   = ConfidenceCalculator.clamp(confidence);
        this.reason       = reason != null ? reason : "";
        this.depth        = depth;
        this.path         = path;
        this.quality      = quality;
    }

    public UIElement    getElement()      { return element; }
    public Relationship getRelationship() { return relationship; }

    /** Relationship label with level, e.g. {@code "3-level ancestor"}. */
    public String       getLabel()        { return label; }

    public double       getConfidence()   { return confidence; }
    public String       getReason()       { return reason; }

    /** Distance from the target in tree levels; {@code null} for self and siblings. */
    public Integer      getDepth()        { return depth; }

    /** Breadcrumb from the target down to this element; only set for descendants. */
    public String       getPath()         { return path; }

    public ElementQuality getQuality()    { return quality; }

    @JsonProperty("hasText")
    public boolean hasText() { return element.hasText(); }

    @JsonProperty("clickable")
    public boolean isClickable() { return element.isClickable(); }

    public String getId() { return element.getId(); }

    @Override
    public String toString() {
        return String.format("DiscoveredElement{id=%s, %s, confidence=%.2f, reason='%s'}",
                element.getId(), label, confidence, reason);
    }
}
