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
import org.esa.idepix.core.IdepixConstants;

/**
 * One pass over the missing pixels of a grid.
 * <p>
 * The missing pixels are collected once at the start of the pass and visited in ascending data index
 * order, i.e. line by line and sample by sample within a line. A resolved pixel is written to the grid
 * immediately, so votes later in the same pass see it as evidence.
 *
 * @author Olaf Danne
 */
public class PassScanner {

    private PassScanner() {
    }

    /**
     * @return the number of pixels resolved by this pass
     */
    public static int scan(ClassificationGrid grid, StageParameters stage) {
        final int width = grid.getWidth();
        final int[] missingIndices = grid.getMissingIndices();

        int numResolved = 0;
        for (final int index : missingIndices) {
            final int x = index % width;
            final int y = index / width;
            final int category = NeighbourhoodVote.vote(grid, x, y, stage);
            if (category != IdepixConstants.MISSING) {
                grid.setSample(x, y, category);
                numResolved++;
            }
        }
        return numResolved;
    }
}
