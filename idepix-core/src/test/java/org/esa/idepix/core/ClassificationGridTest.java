package org.esa.idepix.core;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class ClassificationGridTest {

    private ClassificationGrid grid;

    @Before
    public void setUp() {
        grid = new ClassificationGrid(5, 3);
    }

    @Test
    public void testNewGridIsMissingEverywhere() {
        assertEquals(5, grid.getWidth());
        assertEquals(3, grid.getHeight());
        assertEquals(15, grid.countMissing());
    }

    @Test
    public void testSamplesAreUnsigned() {
        grid.setSample(4, 2, IdepixConstants.FILL);
        grid.setSample(0, 1, IdepixConstants.OBSCURED);
        assertEquals(255, grid.getSample(4, 2));
        assertEquals(253, grid.getSample(0, 1));
        assertEquals(255, grid.getSampleAt(2 * 5 + 4));
    }

    @Test
    public void testLineMajorLayout() {
        byte[] data = new byte[15];
        data[7] = 3;   // x = 2, y = 1
        ClassificationGrid wrapped = new ClassificationGrid(5, 3, data);
        assertEquals(3, wrapped.getSample(2, 1));
        assertEquals(0, wrapped.getSample(1, 2));
    }

    @Test
    public void testGetMissingIndices() {
        grid.fill(IdepixConstants.CLEAR_HIGH_CONFIDENCE);
        grid.setSample(3, 0, IdepixConstants.MISSING);
        grid.setSample(1, 2, IdepixConstants.MISSING);
        assertArrayEquals(new int[]{3, 11}, grid.getMissingIndices());
    }

    @Test
    public void testFillRectangleIsClipped() {
        grid.fill(IdepixConstants.FILL);
        grid.fillRectangle(-1, -1, 3, 3, IdepixConstants.CLOUD_LOW_CONFIDENCE);
        assertEquals(4, grid.countCategory(IdepixConstants.CLOUD_LOW_CONFIDENCE));
        assertEquals(2, grid.getSample(1, 1));
        assertEquals(255, grid.getSample(2, 1));
    }

    @Test
    public void testCopyIsIndependent() {
        ClassificationGrid copy = grid.copy();
        assertEquals(grid, copy);
        copy.setSample(0, 0, IdepixConstants.CLOUD_HIGH_CONFIDENCE);
        assertNotEquals(grid, copy);
        assertEquals(0, grid.getSample(0, 0));
    }

    @Test
    public void testContains() {
        assertTrue(grid.contains(0, 0));
        assertTrue(grid.contains(4, 2));
        assertFalse(grid.contains(5, 0));
        assertFalse(grid.contains(0, -1));
    }

    @Test(expected = IdepixException.class)
    public void testWrongSampleArrayLength() {
        new ClassificationGrid(5, 3, new byte[14]);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testCategoryOutOfByteRange() {
        grid.setSample(0, 0, 256);
    }
}
