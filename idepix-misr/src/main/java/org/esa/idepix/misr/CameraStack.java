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

import org.esa.idepix.core.ClassificationGrid;
import org.esa.idepix.core.IdepixException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The per-camera cloud masks of one MISR block: nine 512 x 128 grids in {@link MisrCamera} order.
 * The grids are held by reference and modified in place by the reconstruction.
 *
 * @author Olaf Danne
 */
public class CameraStack {

    private final List<ClassificationGrid> grids;

    /**
     * @param grids - one grid per camera, in {@link MisrCamera} order
     * @throws IdepixException if the number of grids or their size is wrong
     */
    public CameraStack(List<ClassificationGrid> grids) {
        validate(grids);
        this.grids = Collections.unmodifiableList(new ArrayList<>(grids));
    }

    /**
     * Creates a stack of new grids, all pixels set to the given category.
     */
    public static CameraStack createFilled(int category) {
        final List<ClassificationGrid> grids = new ArrayList<>();
        for (int i = 0; i < MisrConstants.NUM_CAMERAS; i++) {
            final ClassificationGrid grid = new ClassificationGrid(MisrConstants.BLOCK_WIDTH, MisrConstants.BLOCK_HEIGHT);
            grid.fill(category);
            grids.add(grid);
        }
        return new CameraStack(grids);
    }

    public ClassificationGrid getGrid(MisrCamera camera) {
        return grids.get(camera.ordinal());
    }

    public ClassificationGrid getGrid(int cameraIndex) {
        return grids.get(cameraIndex);
    }

    public List<ClassificationGrid> getGrids() {
        return grids;
    }

    public int getNumCameras() {
        return grids.size();
    }

    public int countMissing() {
        int count = 0;
        for (ClassificationGrid grid : grids) {
            count += grid.countMissing();
        }
        return count;
    }

    /**
     * @return a deep copy of this stack
     */
    public CameraStack copy() {
        final List<ClassificationGrid> copies = new ArrayList<>();
        for (ClassificationGrid grid : grids) {
            copies.add(grid.copy());
        }
        return new CameraStack(copies);
    }

    static void validate(List<ClassificationGrid> grids) {
        if (grids == null) {
            throw new IdepixException("No camera grids given");
        }
        if (grids.size() != MisrConstants.NUM_CAMERAS) {
            throw new IdepixException("Expected " + MisrConstants.NUM_CAMERAS + " camera grids but got " +
                                              grids.size());
        }
        final MisrCamera[] cameras = MisrCamera.values();
        for (int i = 0; i < grids.size(); i++) {
            final ClassificationGrid grid = grids.get(i);
            if (grid == null) {
                throw new IdepixException("Grid of camera " + cameras[i] + " is missing");
            }
            if (grid.getWidth() != MisrConstants.BLOCK_WIDTH || grid.getHeight() != MisrConstants.BLOCK_HEIGHT) {
                throw new IdepixException("Grid of camera " + cameras[i] + " has size " + grid.getWidth() + " x " +
                                                  grid.getHeight() + ", expected " + MisrConstants.BLOCK_WIDTH +
                                                  " x " + MisrConstants.BLOCK_HEIGHT);
            }
        }
    }

    @Override
    public String toString() {
        return "CameraStack[" + grids.size() + " cameras, " + countMissing() + " missing pixels]";
    }
}
