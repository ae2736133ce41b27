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

package org.esa.idepix.misr.gapfill;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An ordered sequence of reconstruction stages, applied one after the other to the same grid.
 * Each stage is iterated to its fixpoint, or until the optional pass limit is reached.
 *
 * @author Olaf Danne
 */
public final class StageSchedule {

    public static final int UNLIMITED_ITERATIONS = 0;

    private final String name;
    private final List<StageParameters> stages;
    private final int maxIterations;

    public StageSchedule(String name, List<StageParameters> stages) {
        this(name, stages, UNLIMITED_ITERATIONS);
    }

    /**
     * @param name          - schedule name
     * @param stages        - the stages in execution order, must not be empty
     * @param maxIterations - maximum number of passes per stage, or {@link #UNLIMITED_ITERATIONS}
     */
    public StageSchedule(String name, List<StageParameters> stages, int maxIterations) {
        Objects.requireNonNull(name, "name");
        if (stages == null || stages.isEmpty()) {
            throw new IllegalArgumentException("Schedule '" + name + "' has no stages");
        }
        if (maxIterations < 0) {
            throw new IllegalArgumentException("Schedule '" + name + "': maxIterations must be >= 0");
        }
        this.name = name;
        this.stages = Collections.unmodifiableList(new ArrayList<>(stages));
        this.maxIterations = maxIterations;
    }

    public String getName() {
        return name;
    }

    public List<StageParameters> getStages() {
        return stages;
    }

    public int getNumStages() {
        return stages.size();
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public boolean isIterationLimited() {
        return maxIterations != UNLIMITED_ITERATIONS;
    }

    @Override
    public String toString() {
        return "StageSchedule '" + name + "' " + stages +
                (isIterationLimited() ? " (max " + maxIterations + " passes per stage)" : "");
    }
}
