package uiscope.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uiscope.UiScopeException;
import uiscope.discovery.DiscoveryOptions;
import uiscope.hierarchy.HierarchySettings;
import uiscope.quality.TextVocabulary;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * Reads {@code config.properties} from the classpath and exposes the engine's
 * tunable thresholds with sensible defaults.
 *
 * <p>All values can be overridden by placing a {@code config.local.properties}
 * file on the classpath (higher priority, not committed to VCS). The engine
 * classes never read this themselves; use {@link #toHierarchySettings()},
 * {@link #toDiscoveryOptions()} and {@link #toVocabulary()}.
 */
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    private static final String CONFIG_FILE       = "config.properties";
    private static final String CONFIG_LOCAL_FILE = "config.local.properties";

    // Property keys
    static final String KEY_TOLERANCE          = "hierarchy.containment.tolerance.px";
    static final String KEY_AREA_RATIO         = "hierarchy.area.ratio.cutoff";
    static final String KEY_REBUILD_TOLERANCE  = "hierarchy.rebuild.tolerance.px";
    static final String KEY_REBUILD_AREA_RATIO = "hierarchy.rebuild.area.ratio.cutoff";
    static final String KEY_MAX_DEPTH          = "discovery.max.depth";
    static final String KEY_DESCENDANT_CAP     = "discovery.descendant.cap";
    static final String KEY_SIBLING_CAP        = "discovery.sibling.cap";
    static final String KEY_RECOMMENDED_CAP    = "discovery.recommended.cap";
    static final String KEY_PRIORITIZE_TEXT    = "discovery.prioritize.text";
    static final String KEY_PROMOTION_LEVELS   = "discovery.promotion.levels";
    static final String KEY_ACTION_WORDS       = "quality.action.words";

    private final Properties props;

    /**
     * Loads configuration from the classpath.
     * {@code config.local.properties} values override {@code config.properties}.
     *
     * @throws UiScopeException if the base config.properties cannot be loaded
     */
    public EngineConfig() {
        this(CONFIG_FILE, CONFIG_LOCAL_FILE);
    }

    /** Loads from the named classpath resources instead of the standard pair. */
    EngineConfig(String baseResource, String localResource) {
        props = new Properties();

        try (InputStream base = getClass().getClassLoader().getResourceAsStream(baseResource)) {
            if (base == null) {
                throw new IOException("Classpath resource not found: " + baseResource);
            }
            props.load(base);
            log.debug("Loaded base config from {}", baseResource);
        } catch (IOException e) {
            throw new UiScopeException("Cannot load " + baseResource, e);
        }

        try (InputStream local = getClass().getClassLoader().getResourceAsStream(localResource)) {
            if (local != null) {
                props.load(local);
                log.debug("Applied local overrides from {}", localResource);
            }
        } catch (IOException e) {
            log.warn("Failed to read {}, using base config only: {}", localResource, e.getMessage());
        }
    }

    /** For tests: accepts an already-populated {@link Properties} instance. */
    EngineConfig(Properties props) {
        this.props = props;
    }

    // ── Hierarchy ─────────────────────────────────────────────────────────

    /** Pixels each edge may overhang and still count as contained (default: 2). */
    public int getContainmentTolerancePx() {
        return getNonNegativeInt(KEY_TOLERANCE, HierarchySettings.DEFAULT_CONTAINMENT_TOLERANCE);
    }

    /** Child/parent area ratio at or above which no relation is made (default: 0.95). */
    public double getAreaRatioCutoff() {
        return getRatio(KEY_AREA_RATIO, HierarchySettings.DEFAULT_AREA_RATIO_CUTOFF);
    }

    /** Tolerance for the rebuild after a flat first pass (default: 4). */
    public int getRebuildTolerancePx() {
        return getNonNegativeInt(KEY_REBUILD_TOLERANCE, HierarchySettings.DEFAULT_REBUILD_TOLERANCE);
    }

    public double getRebuildAreaRatioCutoff() {
        return getRatio(KEY_REBUILD_AREA_RATIO, HierarchySettings.DEFAULT_REBUILD_AREA_RATIO);
    }

    // ── Discovery ─────────────────────────────────────────────────────────

    /** Ancestor/descendant levels walked from the target (default: 3). */
    public int getMaxDepth() {
        return getNonNegativeInt(KEY_MAX_DEPTH, DiscoveryOptions.DEFAULT_MAX_DEPTH);
    }

    public int getDescendantCap() {
        return getNonNegativeInt(KEY_DESCENDANT_CAP, DiscoveryOptions.DEFAULT_DESCENDANT_CAP);
    }

    public int getSiblingCap() {
        return getNonNegativeInt(KEY_SIBLING_CAP, DiscoveryOptions.DEFAULT_SIBLING_CAP);
    }

    public int getRecommendedCap() {
        return getNonNegativeInt(KEY_RECOMMENDED_CAP, DiscoveryOptions.DEFAULT_RECOMMENDED_CAP);
    }

    /** Whether text-bearing results sort first (default: true). */
    public boolean isPrioritizeText() {
        return getBool(KEY_PRIORITIZE_TEXT, DiscoveryOptions.DEFAULT_PRIORITIZE_TEXT);
    }

    public int getPromotionLevels() {
        return getNonNegativeInt(KEY_PROMOTION_LEVELS, DiscoveryOptions.DEFAULT_PROMOTION_LEVELS);
    }

    // ── Quality ───────────────────────────────────────────────────────────

    /** Comma-separated action vocabulary; the built-in list when unset. */
    public List<String> getActionWords() {
        String raw = props.getProperty(KEY_ACTION_WORDS);
        if (raw == null || raw.isBlank()) return TextVocabulary.DEFAULT_ACTION_WORDS;
        List<String> words = Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
        if (words.isEmpty()) {
            log.warn("Empty action word list for key '{}', using built-in vocabulary", KEY_ACTION_WORDS);
            return TextVocabulary.DEFAULT_ACTION_WORDS;
        }
        return words;
    }

    // ── Bridges ───────────────────────────────────────────────────────────

    public HierarchySettings toHierarchySettings() {
        return new HierarchySettings(getContainmentTolerancePx(), getAreaRatioCutoff(),
                getRebuildTolerancePx(), getRebuildAreaRatioCutoff());
    }

    public DiscoveryOptions toDiscoveryOptions() {
        return DiscoveryOptions.builder()
                .maxDepth(getMaxDepth())
                .descendantCap(getDescendantCap())
                .siblingCap(getSiblingCap())
                .recommendedCap(getRecommendedCap())
                .prioritizeText(isPrioritizeText())
                .promotionLevels(getPromotionLevels())
                .build();
    }

    public TextVocabulary toVocabulary() {
        return new TextVocabulary(getActionWords());
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private int getNonNegativeInt(String key, int defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            int value = Integer.parseInt(raw.trim());
            if (value < 0) {
                log.warn("Negative value for key '{}': {}, using default {}", key, value, defaultValue);
                return defaultValue;
            }
            return value;
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    /** Ratio in {@code (0, 1]}; anything else falls back to the default. */
    private double getRatio(String key, double defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            double value = Double.parseDouble(raw.trim());
            if (!(value > 0.0 && value <= 1.0)) {
                log.warn("Ratio for key '{}' out of range (0,1]: {}, using default {}", key, value, defaultValue);
                return defaultValue;
            }
            return value;
        } catch (NumberFormatException e) {
            log.warn("Invalid number for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private boolean getBool(String key, boolean defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        return Boolean.parseBoolean(raw.trim());
    }
}
