package uiscope.config;

import org.testng.annotations.Test;
import uiscope.UiScopeException;
import uiscope.discovery.DiscoveryOptions;
import uiscope.hierarchy.HierarchySettings;
import uiscope.quality.TextVocabulary;

import java.io.IOException;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link EngineConfig}. Uses the package-private
 * {@code EngineConfig(Properties)} constructor so no classpath file is needed.
 */
public class EngineConfigTest {

    private static EngineConfig config(String... keyValues) {
        Properties p = new Properties();
        for (int i = 0; i < keyValues.length; i += 2) {
            p.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return new EngineConfig(p);
    }

    // ── Defaults ──────────────────────────────────────────────────────────

    @Test(description = "Empty properties yield the built-in defaults")
    public void emptyProperties_defaults() {
        EngineConfig cfg = config();

        assertThat(cfg.getContainmentTolerancePx()).isEqualTo(2);
        assertThat(cfg.getAreaRatioCutoff()).isEqualTo(0.95);
        assertThat(cfg.getRebuildTolerancePx()).isEqualTo(4);
        assertThat(cfg.getMaxDepth()).isEqualTo(3);
        assertThat(cfg.getDescendantCap()).isEqualTo(20);
        assertThat(cfg.getSiblingCap()).isEqualTo(15);
        assertThat(cfg.getRecommendedCap()).isEqualTo(5);
        assertThat(cfg.isPrioritizeText()).isTrue();
        assertThat(cfg.getPromotionLevels()).isEqualTo(3);
        assertThat(cfg.getActionWords()).isEqualTo(TextVocabulary.DEFAULT_ACTION_WORDS);
    }

    @Test(description = "The classpath config.properties matches the built-in defaults")
    public void classpathConfig_matchesDefaults() {
        EngineConfig cfg = new EngineConfig();

        assertThat(cfg.getContainmentTolerancePx()).isEqualTo(HierarchySettings.DEFAULT_CONTAINMENT_TOLERANCE);
        assertThat(cfg.getAreaRatioCutoff()).isEqualTo(HierarchySettings.DEFAULT_AREA_RATIO_CUTOFF);
        assertThat(cfg.getMaxDepth()).isEqualTo(DiscoveryOptions.DEFAULT_MAX_DEPTH);
        assertThat(cfg.getActionWords()).isEqualTo(TextVocabulary.DEFAULT_ACTION_WORDS);
    }

    @Test(description = "A missing base config file is a UiScopeException naming the resource")
    public void missingBaseConfig_throws() {
        assertThatThrownBy(() -> new EngineConfig("no-such-config.properties", "no-such-local.properties"))
                .isInstanceOf(UiScopeException.class)
                .hasMessageContaining("no-such-config.properties")
                .hasCauseInstanceOf(IOException.class);
    }

    @Test(description = "A missing local override file is optional")
    public void missingLocalConfig_isIgnored() {
        EngineConfig cfg = new EngineConfig("config.properties", "no-such-local.properties");
        assertThat(cfg.getSiblingCap()).isEqualTo(DiscoveryOptions.DEFAULT_SIBLING_CAP);
    }

    // ── Overrides ─────────────────────────────────────────────────────────

    @Test
    public void overrides_areApplied() {
        EngineConfig cfg = config(
                EngineConfig.KEY_TOLERANCE, " 5 ",
                EngineConfig.KEY_AREA_RATIO, "0.9",
                EngineConfig.KEY_MAX_DEPTH, "0",
                EngineConfig.KEY_PRIORITIZE_TEXT, "false",
                EngineConfig.KEY_SIBLING_CAP, "4");

        assertThat(cfg.getContainmentTolerancePx()).isEqualTo(5);
        assertThat(cfg.getAreaRatioCutoff()).isEqualTo(0.9);
        assertThat(cfg.getMaxDepth()).isZero();
        assertThat(cfg.isPrioritizeText()).isFalse();
        assertThat(cfg.getSiblingCap()).isEqualTo(4);
    }

    @Test(description = "Unparsable, negative and out-of-range values fall back to the default")
    public void invalidValues_fallBack() {
        EngineConfig cfg = config(
                EngineConfig.KEY_TOLERANCE, "two",
                EngineConfig.KEY_DESCENDANT_CAP, "-1",
                EngineConfig.KEY_AREA_RATIO, "1.5",
                EngineConfig.KEY_REBUILD_AREA_RATIO, "0",
                EngineConfig.KEY_REBUILD_TOLERANCE, "NaN?");

        assertThat(cfg.getContainmentTolerancePx()).isEqualTo(2);
        assertThat(cfg.getDescendantCap()).isEqualTo(20);
        assertThat(cfg.getAreaRatioCutoff()).isEqualTo(0.95);
        assertThat(cfg.getRebuildAreaRatioCutoff()).isEqualTo(0.95);
        assertThat(cfg.getRebuildTolerancePx()).isEqualTo(4);
    }

    @Test(description = "Action words are split on commas, trimmed and blanks dropped")
    public void actionWords_parsed() {
        assertThat(config(EngineConfig.KEY_ACTION_WORDS, " buy, ,checkout ,").getActionWords())
                .containsExactly("buy", "checkout");
        assertThat(config(EngineConfig.KEY_ACTION_WORDS, " , ").getActionWords())
                .isEqualTo(TextVocabulary.DEFAULT_ACTION_WORDS);
    }

    // ── Bridges ───────────────────────────────────────────────────────────

    @Test
    public void bridges_carryValues() {
        EngineConfig cfg = config(
                EngineConfig.KEY_TOLERANCE, "6",
                EngineConfig.KEY_RECOMMENDED_CAP, "2",
                EngineConfig.KEY_PROMOTION_LEVELS, "1",
                EngineConfig.KEY_ACTION_WORDS, "Buy");

        HierarchySettings settings = cfg.toHierarchySettings();
        assertThat(settings.getContainmentTolerance()).isEqualTo(6);

        DiscoveryOptions options = cfg.toDiscoveryOptions();
        assertThat(options.getRecommendedCap()).isEqualTo(2);
        assertThat(options.getPromotionLevels()).isEqualTo(1);
        assertThat(options.getDescendantCap()).isEqualTo(DiscoveryOptions.DEFAULT_DESCENDANT_CAP);

        assertThat(cfg.toVocabulary().containsActionWord("buy now")).isTrue();
    }
}
