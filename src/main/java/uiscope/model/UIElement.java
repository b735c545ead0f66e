package uiscope.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import uiscope.bounds.Bounds;
import uiscope.bounds.BoundsDeserializer;
import uiscope.bounds.BoundsNormalizer;

import java.util.Objects;

/**
 * One element of a flattened Android screen dump.
 *
 * <p>Immutable. The dump carries no parent pointers; only the bounding
 * rectangle and leaf attributes are known. Legacy attribute spellings
 * ({@code is_clickable}, {@code resource_id}, {@code class_name}, ...) are
 * folded into one canonical field each at deserialization time, so nothing
 * downstream needs to know about them.
 *
 * <p>String attributes are never {@code null}: absent values are stored as
 * the empty string.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public final class UIElement {

    private final String  id;
    private final Bounds  bounds;      // null when the dump's rectangle could not be parsed
    private final String  text;
    private final String  contentDesc;
    private final String  resourceId;
    private final String  elementType;
    private final boolean clickable;
    private final boolean scrollable;
    private final boolean enabled;
    private final boolean checkable;
    private final boolean checked;
    private final boolean selected;

    @JsonCreator
    public UIElement(
            @JsonProperty("id") String id,
            @JsonProperty("bounds") @JsonDeserialize(using = BoundsDeserializer.class) Bounds bounds,
            @JsonProperty("text") String text,
            @JsonProperty("contentDesc") @JsonAlias({"content_desc", "content-desc"}) String contentDesc,
            @JsonProperty("resourceId") @JsonAlias({"resource_id", "resource-id"}) String resourceId,
            @JsonProperty("elementType") @JsonAlias({"element_type", "class_name", "class", "className"}) String elementType,
            @JsonProperty("clickable") @JsonAlias("is_clickable") Boolean clickable,
            @JsonProperty("scrollable") @JsonAlias("is_scrollable") Boolean scrollable,
            @JsonProperty("enabled") @JsonAlias("is_enabled") Boolean enabled,
            @JsonProperty("checkable") @JsonAlias("is_checkable") Boolean checkable,
            @JsonProperty("checked") @JsonAlias("is_checked") Boolean checked,
            @JsonProperty("selected") @JsonAlias("is_selected") Boolean selected) {
        this.id          = Objects.requireNonNull(id, "element id must not be null");
        this.bounds      = bounds;
        this.text        = normalizeNull(text);
        this.contentDesc = normalizeNull(contentDesc);
        this.resourceId  = normalizeNull(resourceId);
        this.elementType = normalizeNull(elementType);
        this.clickable   = Boolean.TRUE.equals(clickable);
        this.scrollable  = Boolean.TRUE.equals(scrollable);
        this.enabled     = enabled == null || enabled;
        this.checkable   = Boolean.TRUE.equals(checkable);
        this.checked     = Boolean.TRUE.equals(checked);
        this.selected    = Boolean.TRUE.equals(selected);
    }

    private UIElement(Builder b) {
        this(b.id, b.bounds, b.text, b.contentDesc, b.resourceId, b.elementType,
                b.clickable, b.scrollable, b.enabled, b.checkable, b.checked, b.selected);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    private static String normalizeNull(String s) {
        return s == null ? "" : s;
    }

    // ── Accessors ─────────────────────────────────────────────────────────

    public String  getId()          { return id; }
    public Bounds  getBounds()      { return bounds; }
    public String  getText()        { return text; }
    public String  getContentDesc() { return contentDesc; }
    public String  getResourceId()  { return resourceId; }
    public String  getElementType() { return elementType; }
    public boolean isClickable()    { return clickable; }
    public boolean isScrollable()   { return scrollable; }
    public boolean isEnabled()      { return enabled; }
    public boolean isCheckable()    { return checkable; }
    public boolean isChecked()      { return checked; }
    public boolean isSelected()     { return selected; }

    /** True if {@code text} has non-whitespace content. */
    @JsonIgnore
    public boolean hasText() {
        return !text.isBlank();
    }

    @JsonIgnore
    public boolean hasContentDesc() {
        return !contentDesc.isBlank();
    }

    @JsonIgnore
    public boolean hasResourceId() {
        return !resourceId.isBlank();
    }

    /** Zero-area {@code [0,0][0,0]} element, typically an invisible label. */
    @JsonIgnore
    public boolean isHidden() {
        return BoundsNormalizer.isHidden(bounds);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UIElement)) return false;
        UIElement that = (UIElement) o;
        return clickable == that.clickable && scrollable == that.scrollable
                && enabled == that.enabled && checkable == that.checkable
                && checked == that.checked && selected == that.selected
                && id.equals(that.id)
                && Objects.equals(bounds, that.bounds)
                && text.equals(that.text)
                && contentDesc.equals(that.contentDesc)
                && resourceId.equals(that.resourceId)
                && elementType.equals(that.elementType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, bounds, text, contentDesc, resourceId, elementType,
                clickable, scrollable, enabled, checkable, checked, selected);
    }

    @Override
    public String toString() {
        return String.format("UIElement{id='%s', bounds=%s, type='%s', text='%s', rid='%s', clickable=%s}",
                id, bounds, elementType, text, resourceId, clickable);
    }

    // ── Builder ───────────────────────────────────────────────────────────

    /** Fluent builder, used by tests and by callers that assemble elements in code. */
    public static final class Builder {
        private final String id;
        private Bounds  bounds;
        private String  text;
        private String  contentDesc;
        private String  resourceId;
        private String  elementType;
        private boolean clickable;
        private boolean scrollable;
        private boolean enabled = true;
        private boolean checkable;
        private boolean checked;
        private boolean selected;

        private Builder(String id) {
            this.id = id;
        }

        public Builder bounds(Bounds bounds)            { this.bounds = bounds; return this; }
        public Builder bounds(int l, int t, int r, int b) { this.bounds = new Bounds(l, t, r, b); return this; }
        public Builder bounds(String dumpNotation)      { this.bounds = BoundsNormalizer.parse(dumpNotation); return this; }
        public Builder text(String text)                { this.text = text; return this; }
        public Builder contentDesc(String contentDesc)  { this.contentDesc = contentDesc; return this; }
        public Builder resourceId(String resourceId)    { this.resourceId = resourceId; return this; }
        public Builder elementType(String elementType)  { this.elementType = elementType; return this; }
        public Builder clickable(boolean clickable)     { this.clickable = clickable; return this; }
        public Builder scrollable(boolean scrollable)   { this.scrollable = scrollable; return this; }
        public Builder enabled(boolean enabled)         { this.enabled = enabled; return this; }
        public Builder checkable(boolean checkable)     { this.checkable = checkable; return this; }
        public Builder checked(boolean checked)         { this.checked = checked; return this; }
        public Builder selected(boolean selected)       { this.selected = selected; return this; }

        public UIElement build() {
            return new UIElement(this);
        }
    }
}
