package uiscope.bounds;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Axis-aligned screen rectangle of a UI element in integer pixels,
 * as reported by the screen dump ({@code left, top, right, bottom}).
 */
@JsonPropertyOrder({"left", "top", "right", "bottom"})
public final class Bounds {

    /** The all-zero rectangle that marks a hidden element. */
    public static final Bounds ZERO = new Bounds(0, 0, 0, 0);

    private final int left;
    private final int top;
    private final int right;
    private final int bottom;

    @JsonCreator
    public Bounds(@JsonProperty("left")   int left,
                  @JsonProperty("top")    int top,
                  @JsonProperty("right")  int right,
                  @JsonProperty("bottom") int bottom) {
        this.left   = left;
        this.top    = top;
        this.right  = right;
        this.bottom = bottom;
    }

    public int getLeft()   { return left; }
    public int getTop()    { return top; }
    public int getRight()  { return right; }
    public int getBottom() { return bottom; }

    @JsonIgnore
    public int getWidth()  { return right - left; }

    @JsonIgnore
    public int getHeight() { return bottom - top; }

    /** {@code max(0, width * height)}, computed in long to survive full-screen dumps. */
    @JsonIgnore
    public long getArea() {
        long area = (long) getWidth() * (long) getHeight();
        return Math.max(0L, area);
    }

    /** True when every coordinate is zero. */
    @JsonIgnore
    public boolean isZero() {
        return left == 0 && top == 0 && right == 0 && bottom == 0;
    }

    /**
     * True if {@code inner} lies inside this rectangle, each edge allowed to
     * overhang by at most {@code tolerance} pixels.
     */
    public boolean contains(Bounds inner, int tolerance) {
        if (inner == null) return false;
        return left   <= inner.left   + tolerance
            && top    <= inner.top    + tolerance
            && right  >= inner.right  - tolerance
            && bottom >= inner.bottom - tolerance;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Bounds)) return false;
        Bounds that = (Bounds) o;
        return left == that.left && top == that.top
            && right == that.right && bottom == that.bottom;
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, top, right, bottom);
    }

    /** Android dump notation, e.g. {@code [0,0][1080,1920]}. */
    @Override
    public String toString() {
        return "[" + left + "," + top + "][" + right + "," + bottom + "]";
    }
}
