package org.esa.idepix.misr;

import org.esa.idepix.core.ClassificationGrid;
import org.esa.idepix.core.IdepixConstants;
import org.esa.idepix.core.IdepixException;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

public class CameraStackTest {

    @Test
    public void testCreateFilled() {
        final CameraStack stack = CameraStack.createFilled(IdepixConstants.MISSING);
        assertEquals(9, stack.getNumCameras());
        assertEquals(9 * 512 * 128, stack.countMissing());
        assertSame(stack.getGrid(4), stack.getGrid(MisrCamera.AN));
    }

    @Test
    public void testGridsAreHeldByReference() {
        final List<ClassificationGrid> grids = createGrids(9, 512, 128);
        final CameraStack stack = new CameraStack(grids);
        grids.get(8).setSample(3, 3, IdepixConstants.MISSING);
        assertEquals(1, stack.getGrid(MisrCamera.DA).countMissing());
    }

    @Test
    public void testCopyIsDeep() {
        final CameraStack stack = CameraStack.createFilled(IdepixConstants.FILL);
        final CameraStack copy = stack.copy();
        copy.getGrid(MisrCamera.DF).setSample(0, 0, IdepixConstants.MISSING);
        assertEquals(0, stack.countMissing());
        assertEquals(1, copy.countMissing());
    }

    @Test
    public void testWrongNumberOfCameras() {
        try {
            new CameraStack(createGrids(8, 512, 128));
            fail("IdepixException expected");
        } catch (IdepixException expected) {
            assertEquals("Expected 9 camera grids but got 8", expected.getMessage());
        }
    }

    @Test
    public void testWrongGridSize() {
        final List<ClassificationGrid> grids = createGrids(9, 512, 128);
        grids.set(2, new ClassificationGrid(128, 512));
        try {
            new CameraStack(grids);
            fail("IdepixException expected");
        } catch (IdepixException expected) {
            assertTrue(expected.getMessage().startsWith("Grid of camera BF has size 128 x 512"));
        }
    }

    @Test(expected = IdepixException.class)
    public void testNullGrid() {
        final List<ClassificationGrid> grids = createGrids(9, 512, 128);
        grids.set(0, null);
        new CameraStack(grids);
    }

    @Test(expected = IdepixException.class)
    public void testNullGridList() {
        new CameraStack(null);
    }

    @Test(expected = IdepixException.class)
    public void testEmptyGridList() {
        new CameraStack(Collections.<ClassificationGrid>emptyList());
    }

    @Test
    public void testCameraOrder() {
        final MisrCamera[] cameras = MisrCamera.values();
        assertEquals(9, cameras.length);
        assertEquals(MisrCamera.DF, cameras[0]);
        assertEquals(MisrCamera.AN, cameras[4]);
        assertEquals(MisrCamera.DA, cameras[8]);
        assertTrue(MisrCamera.BF.isForward());
        assertTrue(MisrCamera.CA.isAftward());
        assertFalse(MisrCamera.AN.isForward());
        assertEquals(MisrCamera.AF.getNominalViewZenith(), MisrCamera.AA.getNominalViewZenith(), 0.0);
    }

    private static List<ClassificationGrid> createGrids(int numGrids, int width, int height) {
        final List<ClassificationGrid> grids = new ArrayList<>();
        for (int i = 0; i < numGrids; i++) {
            final ClassificationGrid grid = new ClassificationGrid(width, height);
            grid.fill(IdepixConstants.FILL);
            grids.add(grid);
        }
        return grids;
    }
}
