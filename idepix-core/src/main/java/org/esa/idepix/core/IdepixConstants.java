package org.esa.idepix.core;

import org.apache.commons.lang3.ArrayUtils;

/**
 * IDEPIX constants for categorical cloud state masks
 *
 * @author Olaf Danne
 */
public class IdepixConstants {

    public static final String CLOUD_MASK_BAND_NAME = "cloud_mask";

    public static final int MISSING = 0;
    public static final int CLOUD_HIGH_CONFIDENCE = 1;
    public static final int CLOUD_LOW_CONFIDENCE = 2;
    public static final int CLEAR_LOW_CONFIDENCE = 3;
    public static final int CLEAR_HIGH_CONFIDENCE = 4;

    public static final int OBSCURED = 253;
    public static final int EDGE = 254;
    public static final int FILL = 255;

    /**
     * The categories a reconstruction may vote for, in ascending order.
     */
    public static final int[] DECIDABLE_CATEGORIES = {
            CLOUD_HIGH_CONFIDENCE,     // 1
            CLOUD_LOW_CONFIDENCE,      // 2
            CLEAR_LOW_CONFIDENCE,      // 3
            CLEAR_HIGH_CONFIDENCE      // 4
    };

    /**
     * Terminal markers set before any reconstruction. Never read as evidence, never overwritten.
     */
    public static final int[] PERMANENT_CATEGORIES = {OBSCURED, EDGE, FILL};

    public static final int MAX_DECIDABLE_CATEGORY = CLEAR_HIGH_CONFIDENCE;

    static final String MISSING_DESCR_TEXT = "Missing or unresolved pixels";
    static final String CLOUD_HIGH_CONFIDENCE_DESCR_TEXT = "Cloud with high confidence";
    static final String CLOUD_LOW_CONFIDENCE_DESCR_TEXT = "Cloud with low confidence";
    static final String CLEAR_LOW_CONFIDENCE_DESCR_TEXT = "Clear with low confidence";
    static final String CLEAR_HIGH_CONFIDENCE_DESCR_TEXT = "Clear with high confidence";
    static final String OBSCURED_DESCR_TEXT = "Pixels obscured by topography";
    static final String EDGE_DESCR_TEXT = "Pixels at the edge of the swath";
    static final String FILL_DESCR_TEXT = "Pixels outside the data extent";

    private IdepixConstants() {
    }

    public static boolean isDecidable(int category) {
        return ArrayUtils.contains(DECIDABLE_CATEGORIES, category);
    }

    public static boolean isPermanent(int category) {
        return ArrayUtils.contains(PERMANENT_CATEGORIES, category);
    }

    public static boolean isKnownCategory(int category) {
        return category == MISSING || isDecidable(category) || isPermanent(category);
    }

    /**
     * Provides a human readable description of a category value, e.g. for diagnostics.
     *
     * @param category - the category value (0..255)
     * @return the description, or null for values outside the category domain
     */
    public static String getDescription(int category) {
        switch (category) {
            case MISSING:
                return MISSING_DESCR_TEXT;
            case CLOUD_HIGH_CONFIDENCE:
                return CLOUD_HIGH_CONFIDENCE_DESCR_TEXT;
            case CLOUD_LOW_CONFIDENCE:
                return CLOUD_LOW_CONFIDENCE_DESCR_TEXT;
            case CLEAR_LOW_CONFIDENCE:
                return CLEAR_LOW_CONFIDENCE_DESCR_TEXT;
            case CLEAR_HIGH_CONFIDENCE:
                return CLEAR_HIGH_CONFIDENCE_DESCR_TEXT;
            case OBSCURED:
                return OBSCURED_DESCR_TEXT;
            case EDGE:
                return EDGE_DESCR_TEXT;
            case FILL:
                return FILL_DESCR_TEXT;
            default:
                return null;
        }
    }
}
