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

import java.util.Collections;
import java.util.List;

/**
 * Diagnostics of one stage run on one grid.
 *
 * @author Olaf Danne
 */
public final class StageReport {

    private final int stageIndex;
    private final StageParameters parameters;
    private final int missingBefore;
    private final int remaining;
    private final List<Integer> resolvedPerPass;
    private final boolean iterationLimitReached;

    StageReport(int stageIndex, StageParameters parameters, int missingBefore, int remaining,
                List<Integer> resolvedPerPass, boolean iterationLimitReached) {
        this.stageIndex = stageIndex;
        this.parameters = parameters;
        this.missingBefore = missingBefore;
        this.remaining = remaining;
        this.resolvedPerPass = Collections.unmodifiableList(resolvedPerPass);
        this.iterationLimitReached = iterationLimitReached;
    }

    public int getStageIndex() {
        return stageIndex;
    }

    public StageParameters getParameters() {
        return parameters;
    }

    public int getMissingBefore() {
        return missingBefore;
    }

    public int getRemaining() {
        return remaining;
    }

    public int getNumResolved() {
        return missingBefore - remaining;
    }

    public int getNumPasses() {
        return resolvedPerPass.size();
    }

    public List<Integer> getResolvedPerPass() {
        return resolvedPerPass;
    }

    public boolean isIterationLimitReached() {
        return iterationLimitReached;
    }

    @Override
    public String toString() {
        return "stage " + stageIndex + " (" + parameters + "): " + getNumPasses() + " passes, " +
                getNumResolved() + " resolved, " + remaining + " remaining" +
                (iterationLimitReached ? ", pass limit reached" : "");
    }
}
