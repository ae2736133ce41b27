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

package org.esa.idepix.core;

import java.util.Arrays;

/**
 * A categorical raster holding one unsigned byte per pixel.
 * Samples are stored line by line, i.e. the data index of pixel (x, y) is {@code y * width + x}.
 *
 * @author Olaf Danne
 */
public class ClassificationGrid {

    private final int width;
    private final int height;
    private final byte[] data;

    public ClassificationGrid(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IdepixException("Invalid grid size " + width + " x " + height);
        }
        this.width = width;
        this.height = height;
        this.data = new byte[width * height];
    }

    /**
     * Wraps the given line-major sample array. The array is not copied.
     *
     * @param width  - number of samples per line
     * @param height - number of lines
     * @param data   - the samples
     */
    public ClassificationGrid(int width, int height, byte[] data) {
        if (width <= 0 || height <= 0) {
            throw new IdepixException("Invalid grid size " + width + " x " + height);
        }
        if (data == null || data.length != width * height) {
            throw new IdepixException("Sample array does not match grid size " + width + " x " + height);
        }
        this.width = width;
        this.height = height;
        this.data = data;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public boolean contains(int x, int y) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    public int getSample(int x, int y) {
        return data[y * width + x] & 0xFF;
    }

    public void setSample(int x, int y, int category) {
        if (category < 0 || category > 255) {
            throw new IllegalArgumentException("Category out of byte range: " + category);
        }
        data[y * width + x] = (byte) category;
    }

    public int getSampleAt(int index) {
        return data[index] & 0xFF;
    }

    public void fill(int category) {
        Arrays.fill(data, (byte) category);
    }

    /**
     * Sets all pixels of the rectangle [x0, x0 + w) x [y0, y0 + h), clipped to the grid.
     */
    public void fillRectangle(int x0, int y0, int w, int h, int category) {
        final int xStart = Math.max(x0, 0);
        final int xEnd = Math.min(x0 + w, width);
        final int yStart = Math.max(y0, 0);
        final int yEnd = Math.min(y0 + h, height);
        for (int y = yStart; y < yEnd; y++) {
            for (int x = xStart; x < xEnd; x++) {
                setSample(x, y, category);
            }
        }
    }

    public int countCategory(int category) {
        int count = 0;
        for (byte b : data) {
            if ((b & 0xFF) == category) {
                count++;
            }
        }
        return count;
    }

    public int countMissing() {
        return countCategory(IdepixConstants.MISSING);
    }

    /**
     * @return the data indices of all missing pixels, in ascending order
     */
    public int[] getMissingIndices() {
        final int[] indices = new int[countMissing()];
        int n = 0;
        for (int i = 0; i < data.length; i++) {
            if ((data[i] & 0xFF) == IdepixConstants.MISSING) {
                indices[n++] = i;
            }
        }
        return indices;
    }

    public ClassificationGrid copy() {
        return new ClassificationGrid(width, height, data.clone());
    }

    /**
     * @return a copy of the line-major samples
     */
    public byte[] getSamples() {
        return data.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ClassificationGrid that = (ClassificationGrid) o;
        return width == that.width && height == that.height && Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        int result = 31 * width + height;
        return 31 * result + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "ClassificationGrid[" + width + " x " + height + "]";
    }
}
