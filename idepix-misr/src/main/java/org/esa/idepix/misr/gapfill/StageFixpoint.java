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

import org.esa.idepix.core.ClassificationGrid;
import org.esa.idepix.core.IdepixException;

import java.util.ArrayList;
import java.util.List;

/**
 * Repeats {@link PassScanner} passes with one parameter set until a pass resolves nothing.
 * The number of missing pixels never increases from pass to pass, so the loop terminates
 * without a limit; an optional pass limit is honoured for iteration limited schedules.
 *
 * @author Olaf Danne
 */
public class StageFixpoint {

    private StageFixpoint() {
    }

    public static StageReport run(ClassificationGrid grid, StageParameters stage) {
        return run(grid, 1, stage, StageSchedule.UNLIMITED_ITERATIONS);
    }

    /**
     * @param grid          - the grid, modified in place
     * @param stageIndex    - 1-based position of the stage in its schedule, for reporting
     * @param stage         - the stage parameters
     * @param maxIterations - maximum number of passes, or {@link StageSchedule#UNLIMITED_ITERATIONS}
     * @return the stage report, holding the number of pixels still missing
     */
    public static StageReport run(ClassificationGrid grid, int stageIndex, StageParameters stage, int maxIterations) {
        final int missingBefore = grid.countMissing();
        final List<Integer> resolvedPerPass = new ArrayList<>();
        boolean iterationLimitReached = false;

        while (true) {
            if (maxIterations > 0 && resolvedPerPass.size() >= maxIterations) {
                iterationLimitReached = true;
                break;
            }
            if (Thread.currentThread().isInterrupted()) {
                throw new IdepixException("Stage " + stageIndex + " interrupted after " +
                                                  resolvedPerPass.size() + " passes");
            }
            final int numResolved = PassScanner.scan(grid, stage);
            resolvedPerPass.add(numResolved);
            if (numResolved == 0) {
                break;
            }
        }

        return new StageReport(stageIndex, stage, missingBefore, grid.countMissing(),
                               resolvedPerPass, iterationLimitReached);
    }
}
