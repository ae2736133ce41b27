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

import java.util.Collections;
import java.util.List;

/**
 * Outcome of a camera stack reconstruction: the (in place modified) stack and the number of
 * pixels left missing per camera, in camera order.
 *
 * @author Olaf Danne
 */
public final class ReconstructionResult {

    private final CameraStack cameraStack;
    private final List<CameraReport> cameraReports;

    ReconstructionResult(CameraStack cameraStack, List<CameraReport> cameraReports) {
        this.cameraStack = cameraStack;
        this.cameraReports = Collections.unmodifiableList(cameraReports);
    }

    public CameraStack getCameraStack() {
        return cameraStack;
    }

    /**
     * @return the remaining missing pixel counts, index aligned with {@link MisrCamera} order
     */
    public int[] getRemainingMissingCounts() {
        final int[] counts = new int[cameraReports.size()];
        for (int i = 0; i < counts.length; i++) {
            counts[i] = cameraReports.get(i).getRemaining();
        }
        return counts;
    }

    public int getRemainingMissingCount(MisrCamera camera) {
        return cameraReports.get(camera.ordinal()).getRemaining();
    }

    public int getTotalRemainingMissingCount() {
        int total = 0;
        for (CameraReport report : cameraReports) {
            total += report.getRemaining();
        }
        return total;
    }

    public List<CameraReport> getCameraReports() {
        return cameraReports;
    }

    public CameraReport getCameraReport(MisrCamera camera) {
        return cameraReports.get(camera.ordinal());
    }
}
