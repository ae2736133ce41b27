/*
 * Copyright (c) 2026.  Brockmann Consult GmbH (info@brockmann-consult.de)
 *
 * This program is free software; you can redistribute it and/or modify it
 * under the terms of the GNU General Public License as published by the Free
 * Software Foundation; either version 3 of the License, or (at your option)
 * any later version.
 * This program is distributed in the hope that it will be useful, but WITHOUT
 * ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or
 * FITNESS FOR A PARTICULAR PURPOSE. See the GNU General Public License for
 * more details.
 *
 * You should have received a copy of the GNU General Public License along
 * with this program; if not, see http://www.gnu.org/licenses/
 *
 */

package org.esa.idepix.misr;

import org.esa.idepix.core.IdepixException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Settings of the MISR cloud mask reconstruction, read from {@code idepix-misr.properties}
 * and overridable by JVM system properties.
 *
 * @author Olaf Danne
 */
public class MisrGapFillConfig {

    static final String DEFAULT_SCHEDULE_NAME = "production";

    private final String scheduleName;
    private final int parallelism;
    private final boolean diagnostics;

    public MisrGapFillConfig(String scheduleName, int parallelism, boolean diagnostics) {
        if (scheduleName == null || scheduleName.trim().isEmpty()) {
            throw new IdepixException("No stage schedule name given");
        }
        if (parallelism < 1) {
            throw new IdepixException("Parallelism must be >= 1, was " + parallelism);
        }
        this.scheduleName = scheduleName.trim();
        this.parallelism = Math.min(parallelism, MisrConstants.NUM_CAMERAS);
        this.diagnostics = diagnostics;
    }

    /**
     * Loads the configuration resource and applies system property overrides.
     */
    public static MisrGapFillConfig load() {
        final Properties properties = new Properties();
        try (InputStream inputStream = MisrGapFillConfig.class.getResourceAsStream(MisrConstants.CONFIG_FILE_NAME)) {
            if (inputStream != null) {
                properties.load(inputStream);
            }
        } catch (IOException e) {
            throw new IdepixException("Failed to read " + MisrConstants.CONFIG_FILE_NAME + ": " + e.getMessage(), e);
        }
        for (String key : new String[]{MisrConstants.PROPERTY_KEY_SCHEDULE,
                MisrConstants.PROPERTY_KEY_PARALLELISM,
                MisrConstants.PROPERTY_KEY_DIAGNOSTICS}) {
            final String value = System.getProperty(key);
            if (value != null) {
                properties.setProperty(key, value);
            }
        }
        return fromProperties(properties);
    }

    public static MisrGapFillConfig fromProperties(Properties properties) {
        final String scheduleName = properties.getProperty(MisrConstants.PROPERTY_KEY_SCHEDULE, DEFAULT_SCHEDULE_NAME);
        final String parallelismValue = properties.getProperty(MisrConstants.PROPERTY_KEY_PARALLELISM);
        int parallelism = Runtime.getRuntime().availableProcessors();
        if (parallelismValue != null) {
            try {
                parallelism = Integer.parseInt(parallelismValue.trim());
            } catch (NumberFormatException e) {
                throw new IdepixException("Invalid value for " + MisrConstants.PROPERTY_KEY_PARALLELISM + ": '" +
                                                  parallelismValue + "'", e);
            }
        }
        final boolean diagnostics = Boolean.parseBoolean(
                properties.getProperty(MisrConstants.PROPERTY_KEY_DIAGNOSTICS, "true").trim());
        return new MisrGapFillConfig(scheduleName, parallelism, diagnostics);
    }

    public String getScheduleName() {
        return scheduleName;
    }

    public int getParallelism() {
        return parallelism;
    }

    public boolean isDiagnostics() {
        return diagnostics;
    }

    @Override
    public String toString() {
        return "schedule=" + scheduleName + ", parallelism=" + parallelism + ", diagnostics=" + diagnostics;
    }
}
