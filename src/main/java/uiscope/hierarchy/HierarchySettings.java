package uiscope.hierarchy;

/**
 * Immutable tuning knobs for {@link HierarchyBuilder}.
 *
 * <p>The defaults were tuned on one application's layouts; treat them as
 * starting points, not universal constants.
 */
public final class HierarchySettings {

    public static final int    DEFAULT_CONTAINMENT_TOLERANCE = 2;
    public static final double DEFAULT_AREA_RATIO_CUTOFF     = 0.95;
    public static final int    DEFAULT_REBUILD_TOLERANCE     = 4;
    public static final double DEFAULT_REBUILD_AREA_RATIO    = 0.95;

    private final int    containmentTolerance;
    private final double areaRatioCutoff;
    private final int    rebuildTolerance;
    private final double rebuildAreaRatioCutoff;

    /**
     * @param containmentTolerance   pixels each edge may overhang its parent
     * @param areaRatioCutoff        child/parent area ratio at or above which two rectangles are treated as duplicates
     * @param rebuildTolerance       tolerance for the rebuild pass run on degenerate (flat) results
     * @param rebuildAreaRatioCutoff area-ratio cutoff for the rebuild pass
     */
    public HierarchySettings(int containmentTolerance, double areaRatioCutoff,
                             int rebuildTolerance, double rebuildAreaRatioCutoff) {
        if (containmentTolerance < 0 || rebuildTolerance < 0) {
            throw new IllegalArgumentException("tolerance must be >= 0");
        }
        if (!(areaRatioCutoff > 0.0 && areaRatioCutoff <= 1.0)
                || !(rebuildAreaRatioCutoff > 0.0 && rebuildAreaRatioCutoff <= 1.0)) {
            throw new IllegalArgumentException("area ratio cutoff must be in (0, 1]");
        }
        this.containmentTolerance   = containmentTolerance;
        this.areaRatioCutoff        = areaRatioCutoff;
        this.rebuildTolerance       = rebuildTolerance;
        this.rebuildAreaRatioCutoff = rebuildAreaRatioCutoff;
    }

    public static HierarchySettings defaults() {
        return new HierarchySettings(DEFAULT_CONTAINMENT_TOLERANCE, DEFAULT_AREA_RATIO_CUTOFF,
                DEFAULT_REBUILD_TOLERANCE, DEFAULT_REBUILD_AREA_RATIO);
    }

    public int    getContainmentTolerance()   { return containmentTolerance; }
    public double getAreaRatioCutoff()        { return areaRatioCutoff; }
    public int    getRebuildTolerance()       { return rebuildTolerance; }
    public double getRebuildAreaRatioCutoff() { return rebuildAreaRatioCutoff; }

    @Override
    public String toString() {
        return String.format("HierarchySettings{tolerance=%dpx, ratio<%.2f, rebuild=%dpx/ratio<%.2f}",
                containmentTolerance, areaRatioCutoff, rebuildTolerance, rebuildAreaRatioCutoff);
    }
}
