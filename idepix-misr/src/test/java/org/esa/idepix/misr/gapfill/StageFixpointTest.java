package org.esa.idepix.misr.gapfill;

import org.esa.idepix.core.ClassificationGrid;
import org.junit.Test;

import java.util.Arrays;

import static org.esa.idepix.core.IdepixConstants.*;
import static org.esa.idepix.misr.gapfill.PassScannerTest.assertLine;
import static org.esa.idepix.misr.gapfill.PassScannerTest.createLine;
import static org.junit.Assert.*;

public class StageFixpointTest {

    private static final StageParameters ANY_NEIGHBOUR_RELAXED = new StageParameters(1, 1, VoteMode.RELAXED);

    @Test
    public void testIteratesUntilPassResolvesNothing() {
        // the only evidence is at the right end, so each pass resolves one pixel more to the left
        ClassificationGrid grid = createLine(MISSING, MISSING, MISSING, MISSING, CLEAR_HIGH_CONFIDENCE);

        final StageReport report = StageFixpoint.run(grid, ANY_NEIGHBOUR_RELAXED);

        assertEquals(Arrays.asList(1, 1, 1, 1, 0), report.getResolvedPerPass());
        assertEquals(5, report.getNumPasses());
        assertEquals(4, report.getMissingBefore());
        assertEquals(4, report.getNumResolved());
        assertEquals(0, report.getRemaining());
        assertFalse(report.isIterationLimitReached());
        assertLine(grid, 4, 4, 4, 4, 4);
    }

    @Test
    public void testStopsAtPassLimit() {
        ClassificationGrid grid = createLine(MISSING, MISSING, MISSING, MISSING, CLEAR_HIGH_CONFIDENCE);

        final StageReport report = StageFixpoint.run(grid, 2, ANY_NEIGHBOUR_RELAXED, 2);

        assertEquals(2, report.getStageIndex());
        assertEquals(2, report.getNumPasses());
        assertEquals(2, report.getRemaining());
        assertTrue(report.isIterationLimitReached());
        assertLine(grid, MISSING, MISSING, 4, 4, 4);
    }

    @Test
    public void testPassLimitNotReachedWhenFixpointComesFirst() {
        ClassificationGrid grid = createLine(MISSING, CLEAR_HIGH_CONFIDENCE);

        final StageReport report = StageFixpoint.run(grid, 1, ANY_NEIGHBOUR_RELAXED, 2);

        assertEquals(Arrays.asList(1, 0), report.getResolvedPerPass());
        assertFalse(report.isIterationLimitReached());
    }

    @Test
    public void testUnresolvablePixelsRemain() {
        ClassificationGrid grid = createLine(FILL, MISSING, FILL, MISSING, CLOUD_HIGH_CONFIDENCE);

        final StageReport report = StageFixpoint.run(grid, ANY_NEIGHBOUR_RELAXED);

        assertEquals(Arrays.asList(1, 0), report.getResolvedPerPass());
        assertEquals(1, report.getRemaining());
        assertLine(grid, FILL, MISSING, FILL, CLOUD_HIGH_CONFIDENCE, CLOUD_HIGH_CONFIDENCE);
    }

    @Test
    public void testGridWithoutMissingPixelsNeedsOnePass() {
        ClassificationGrid grid = createLine(CLOUD_HIGH_CONFIDENCE, CLEAR_HIGH_CONFIDENCE);

        final StageReport report = StageFixpoint.run(grid, ANY_NEIGHBOUR_RELAXED);

        assertEquals(1, report.getNumPasses());
        assertEquals(0, report.getNumResolved());
    }

    @Test
    public void testMissingBlockIsFilledWithinOnePassOfTheRelaxedFiveByFiveStage() {
        ClassificationGrid grid = new ClassificationGrid(512, 128);
        for (int y = 0; y < grid.getHeight(); y++) {
            for (int x = 0; x < grid.getWidth(); x++) {
                grid.setSample(x, y, 1 + (x + 2 * y) % 3);
            }
        }
        grid.fillRectangle(100, 50, 5, 5, MISSING);

        final StageReport report = StageFixpoint.run(grid, new StageParameters(2, 12, VoteMode.RELAXED));

        // the block centre has no evidence of its own: it is resolved from the pixels written earlier in the pass
        assertEquals(Arrays.asList(25, 0), report.getResolvedPerPass());
        assertEquals(0, report.getRemaining());
        for (int y = 50; y < 55; y++) {
            for (int x = 100; x < 105; x++) {
                final int category = grid.getSample(x, y);
                assertTrue(category >= CLOUD_HIGH_CONFIDENCE && category <= CLEAR_LOW_CONFIDENCE);
            }
        }
    }

    @Test
    public void testStrictThreeByThreeStageCannotResolveMixedSurrounding() {
        ClassificationGrid grid = new ClassificationGrid(512, 128);
        for (int y = 0; y < grid.getHeight(); y++) {
            for (int x = 0; x < grid.getWidth(); x++) {
                grid.setSample(x, y, 1 + (x + 2 * y) % 3);
            }
        }
        grid.fillRectangle(100, 50, 5, 5, MISSING);

        final StageReport report = StageFixpoint.run(grid, new StageParameters(1, 4, VoteMode.STRICT));

        assertEquals(0, report.getNumResolved());
        assertEquals(25, report.getRemaining());
    }
}
