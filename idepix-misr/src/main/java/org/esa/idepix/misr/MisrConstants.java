package org.esa.idepix.misr;

/**
 * IDEPIX MISR constants
 *
 * @author Olaf Danne
 */
public class MisrConstants {

    /**
     * Samples per line of a MISR block at 1.1 km resolution.
     */
    public static final int BLOCK_WIDTH = 512;
    /**
     * Lines of a MISR block at 1.1 km resolution.
     */
    public static final int BLOCK_HEIGHT = 128;

    public static final int NUM_CAMERAS = 9;

    public static final String LOGGER_NAME = "idepix";

    public static final String CONFIG_FILE_NAME = "idepix-misr.properties";

    public static final String PROPERTY_KEY_SCHEDULE = "idepix.misr.schedule";
    public static final String PROPERTY_KEY_PARALLELISM = "idepix.misr.parallelism";
    public static final String PROPERTY_KEY_DIAGNOSTICS = "idepix.misr.diagnostics";

    private MisrConstants() {
    }
}
