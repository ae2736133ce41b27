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

import java.util.Objects;

/**
 * Parameters of one reconstruction stage: window radius, minimum number of decidable
 * neighbours and acceptance mode.
 *
 * @author Olaf Danne
 */
public final class StageParameters {

    private final int radius;
    private final int minEvidence;
    private final VoteMode mode;

    public StageParameters(int radius, int minEvidence, VoteMode mode) {
        if (radius < 1) {
            throw new IllegalArgumentException("Window radius must be >= 1, was " + radius);
        }
        if (minEvidence < 0) {
            throw new IllegalArgumentException("Minimum evidence must be >= 0, was " + minEvidence);
        }
        this.radius = radius;
        this.minEvidence = minEvidence;
        this.mode = Objects.requireNonNull(mode, "mode");
    }

    public int getRadius() {
        return radius;
    }

    /**
     * @return the edge length of the (unclipped) square window, 2 * radius + 1
     */
    public int getWindowSize() {
        return 2 * radius + 1;
    }

    public int getMinEvidence() {
        return minEvidence;
    }

    public VoteMode getMode() {
        return mode;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        StageParameters that = (StageParameters) o;
        return radius == that.radius && minEvidence == that.minEvidence && mode == that.mode;
    }

    @Override
    public int hashCode() {
        return Objects.hash(radius, minEvidence, mode);
    }

    @Override
    public String toString() {
        final int size = getWindowSize();
        return size + "x" + size + ", min evidence " + minEvidence + ", " + mode;
    }
}
