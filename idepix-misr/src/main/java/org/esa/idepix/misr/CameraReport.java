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

import org.esa.idepix.misr.gapfill.StageReport;

import java.util.Collections;
import java.util.List;

/**
 * Diagnostics of the reconstruction of one camera grid.
 *
 * @author Olaf Danne
 */
public final class CameraReport {

    private final MisrCamera camera;
    private final int missingBefore;
    private final int remaining;
    private final List<StageReport> stageReports;

    CameraReport(MisrCamera camera, int missingBefore, int remaining, List<StageReport> stageReports) {
        this.camera = camera;
        this.missingBefore = missingBefore;
        this.remaining = remaining;
        this.stageReports = Collections.unmodifiableList(stageReports);
    }

    static CameraReport skipped(MisrCamera camera) {
        return new CameraReport(camera, 0, 0, Collections.<StageReport>emptyList());
    }

    public MisrCamera getCamera() {
        return camera;
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

    /**
     * @return true if the grid had no missing pixels and no stage was run
     */
    public boolean isSkipped() {
        return stageReports.isEmpty();
    }

    public List<StageReport> getStageReports() {
        return stageReports;
    }

    @Override
    public String toString() {
        return "camera " + camera + ": " + missingBefore + " missing, " + getNumResolved() + " resolved, " +
                remaining + " remaining";
    }
}
