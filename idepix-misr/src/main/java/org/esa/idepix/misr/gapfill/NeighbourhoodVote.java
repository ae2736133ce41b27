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
 * Neighbourhood vote for a single missing pixel.
 * <p>
 * The window is the square of the given radius around the pixel, clipped at the grid borders.
 * Only decidable categories (1..4) count as evidence; missing, obscured, edge and fill pixels
 * are ignored, as is the centre pixel itself.
 *
 * @author Olaf Danne
 */
public class NeighbourhoodVote {

    private NeighbourhoodVote() {
    }

    /**
     * Votes for a replacement category of the missing pixel (x, y).
     *
     * @param grid        - the current grid state
     * @param x           - sample index of the missing pixel
     * @param y           - line index of the missing pixel
     * @param radius      - window half width, >= 1
     * @param minEvidence - minimum number of decidable neighbours
     * @param mode        - acceptance rule
     * @return the replacement category, or {@link IdepixConstants#MISSING} if no decision can be made
     * @throws IllegalArgumentException if (x, y) is outside the grid or not missing, or the window parameters are invalid
     */
    public static int vote(ClassificationGrid grid, int x, int y, int radius, int minEvidence, VoteMode mode) {
        if (!grid.contains(x, y)) {
            throw new IllegalArgumentException("Pixel (" + x + ", " + y + ") is outside of " + grid);
        }
        if (grid.getSample(x, y) != IdepixConstants.MISSING) {
            throw new IllegalArgumentException("Pixel (" + x + ", " + y + ") is not missing but has category " +
                                                       grid.getSample(x, y));
        }
        if (radius < 1) {
            throw new IllegalArgumentException("Window radius must be >= 1, was " + radius);
        }
        if (minEvidence < 0) {
            throw new IllegalArgumentException("Minimum evidence must be >= 0, was " + minEvidence);
        }
        final int[] histogram = computeHistogram(grid, x, y, radius);
        return decide(histogram, minEvidence, mode);
    }

    public static int vote(ClassificationGrid grid, int x, int y, StageParameters stage) {
        return vote(grid, x, y, stage.getRadius(), stage.getMinEvidence(), stage.getMode());
    }

    /**
     * @return the category frequencies of the decidable neighbours, indexed by category value
     */
    static int[] computeHistogram(ClassificationGrid grid, int x, int y, int radius) {
        final int[] histogram = new int[IdepixConstants.MAX_DECIDABLE_CATEGORY + 1];

        int LEFT_BORDER = Math.max(x - radius, 0);
        int RIGHT_BORDER = Math.min(x + radius, grid.getWidth() - 1);
        int TOP_BORDER = Math.max(y - radius, 0);
        int BOTTOM_BORDER = Math.min(y + radius, grid.getHeight() - 1);

        for (int j = TOP_BORDER; j <= BOTTOM_BORDER; j++) {
            for (int i = LEFT_BORDER; i <= RIGHT_BORDER; i++) {
                if (i == x && j == y) {
                    continue;
                }
                final int category = grid.getSample(i, j);
                if (IdepixConstants.isDecidable(category)) {
                    histogram[category]++;
                }
            }
        }
        return histogram;
    }

    static int decide(int[] histogram, int minEvidence, VoteMode mode) {
        int total = 0;
        int numDistinct = 0;
        int majorityCategory = IdepixConstants.MISSING;
        int majorityCount = 0;
        for (int category : IdepixConstants.DECIDABLE_CATEGORIES) {
            final int count = histogram[category];
            total += count;
            if (count > 0) {
                numDistinct++;
            }
            // strictly greater: ties go to the lower category
            if (count > majorityCount) {
                majorityCount = count;
                majorityCategory = category;
            }
        }

        if (total == 0 || total < minEvidence) {
            return IdepixConstants.MISSING;
        }
        if (mode == VoteMode.STRICT) {
            return numDistinct == 1 ? majorityCategory : IdepixConstants.MISSING;
        }
        return majorityCategory;
    }
}
