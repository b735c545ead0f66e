package uiscope.quality;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Automation-reliability score of one element. Sub-scores run 0..100; the total
 * is their weighted sum and therefore also 0..100.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ElementQuality {

    public static final double TEXT_WEIGHT         = 0.30;
    public static final double UNIQUENESS_WEIGHT   = 0.25;
    public static final double STABILITY_WEIGHT    = 0.25;
    public static final double MATCHABILITY_WEIGHT = 0.20;

    private final String elementId;
    private final int    textScore;
    private final int    uniquenessScore;
    private final int    stabilityScore;
    private final int    matchabilityScore;
    private final double totalScore;

    @JsonCreator
    public ElementQuality(@JsonProperty("elementId")         String elementId,
                          @JsonProperty("textScore")         int textScore,
                          @JsonProperty("uniquenessScore")   int uniquenessScore,
                          @JsonProperty("stabilityScore")    int stabilityScore,
                          @JsonProperty("matchabilityScore") int matchabilityScore) {
        this.elementId         = elementId;
        this.textScore         = clamp(textScore);
        this.uniquenessScore   = clamp(uniquenessScore);
        this.stabilityScore    = clamp(stabilityScore);
        this.matchabilityScore = clamp(matchabilityScore);
        this.totalScore = TEXT_WEIGHT * this.textScore
                + UNIQUENESS_WEIGHT * this.uniquenessScore
                + STABILITY_WEIGHT * this.stabilityScore
                + MATCHABILITY_WEIGHT * this.matchabilityScore;
    }

    private static int clamp(int score) {
        return Math.max(0, Math.min(100, score));
    }

    public String getElementId()         { return elementId; }
    public int    getTextScore()         { return textScore; }
    public int    getUniquenessScore()   { return uniquenessScore; }
    public int    getStabilityScore()    { return stabilityScore; }
    public int    getMatchabilityScore() { return matchabilityScore; }

    @JsonProperty("totalScore")
    public double getTotalScore()        { return totalScore; }

    @Override
    public String toString() {
        return String.format("ElementQuality{id=%s, text=%d, uniqueness=%d, stability=%d, matchability=%d, total=%.1f}",
                elementId, textScore, uniquenessScore, stabilityScore, matchabilityScore, totalScore);
    }
}
