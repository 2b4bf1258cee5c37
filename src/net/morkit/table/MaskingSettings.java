package net.morkit.table;

import java.util.logging.Logger;
import net.morkit.util.config.Configuration;

/**
 * Parameters of the RedundancyMasker.
 */
public class MaskingSettings {

    public static final String K_THRESHOLD = "morkit.mask.threshold";
    public static final String K_GROUP_FEATURE = "morkit.mask.groupFeature";
    public static final String K_SCORE_FEATURE = "morkit.mask.scoreFeature";

    public static final long DEFAULT_THRESHOLD = 10000;
    public static final String DEFAULT_GROUP_FEATURE = "scat";
    public static final String DEFAULT_SCORE_FEATURE = "comp";

    private static final Logger LOGGER = Logger.getLogger("MaskingSettings");

    private final long threshold;
    private final String groupFeature;
    private final String scoreFeature;

    public MaskingSettings(long threshold, String groupFeature,
                           String scoreFeature) {
        if (groupFeature == null || scoreFeature == null)
            throw new NullPointerException(
                "Masking features may not be null");
        this.threshold = threshold;
        this.groupFeature = groupFeature;
        this.scoreFeature = scoreFeature;
    }
    public MaskingSettings(long threshold) {
        this(threshold, DEFAULT_GROUP_FEATURE, DEFAULT_SCORE_FEATURE);
    }
    public MaskingSettings() {
        this(DEFAULT_THRESHOLD);
    }

    public String toString() {
        return String.format("%s@%h[threshold=%s,group=%s,score=%s]",
            getClass().getName(), this, threshold, groupFeature,
            scoreFeature);
    }

    /**
     * Only rows whose source line is greater than this are ever masked.
     */
    public long getThreshold() {
        return threshold;
    }

    /**
     * The category feature whose values take part in the fingerprint.
     */
    public String getGroupFeature() {
        return groupFeature;
    }

    /**
     * The category feature whose occurrences are counted by the score.
     */
    public String getScoreFeature() {
        return scoreFeature;
    }

    /**
     * Read the settings from the given configuration, using defaults for
     * the keys that are not set.
     */
    public static MaskingSettings fromConfiguration(Configuration cfg) {
        long threshold = DEFAULT_THRESHOLD;
        String rawThreshold = cfg.get(K_THRESHOLD);
        if (rawThreshold != null) {
            try {
                threshold = Long.parseLong(rawThreshold.trim());
            } catch (NumberFormatException exc) {
                throw new IllegalArgumentException("Invalid value for " +
                    K_THRESHOLD + ": " + rawThreshold, exc);
            }
        }
        String group = cfg.get(K_GROUP_FEATURE);
        String score = cfg.get(K_SCORE_FEATURE);
        MaskingSettings ret = new MaskingSettings(threshold,
            (group == null) ? DEFAULT_GROUP_FEATURE : group,
            (score == null) ? DEFAULT_SCORE_FEATURE : score);
        LOGGER.config("Masking settings: threshold " + threshold +
                      ", grouping by " + ret.getGroupFeature() +
                      ", scoring by " + ret.getScoreFeature());
        return ret;
    }
    public static MaskingSettings fromConfiguration() {
        return fromConfiguration(Configuration.DEFAULT);
    }

}
