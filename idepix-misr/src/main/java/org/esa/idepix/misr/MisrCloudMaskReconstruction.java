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
import org.esa.idepix.misr.gapfill.StageFixpoint;
import org.esa.idepix.misr.gapfill.StageParameters;
import org.esa.idepix.misr.gapfill.StageReport;
import org.esa.idepix.misr.gapfill.StageSchedule;
import org.esa.idepix.misr.gapfill.StageScheduleAuxdata;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reconstructs missing pixels (category 0) in the nine per-camera cloud masks of a MISR block.
 * <p>
 * Every camera grid is processed independently: the stages of the schedule are run in order, each one
 * iterated to its fixpoint, on the grid state left by the previous stage. Grids without missing pixels
 * are skipped. With a parallelism greater than one the cameras are reconstructed concurrently.
 * <p>
 * A failure in any camera aborts the whole reconstruction. Grids already modified are not restored.
 *
 * @author Olaf Danne
 */
public class MisrCloudMaskReconstruction {

    private static final Logger logger = Logger.getLogger(MisrConstants.LOGGER_NAME);

    private final StageSchedule schedule;
    private final int parallelism;
    private final boolean diagnostics;

    public MisrCloudMaskReconstruction(StageSchedule schedule) {
        this(schedule, 1, false);
    }

    public MisrCloudMaskReconstruction(StageSchedule schedule, int parallelism, boolean diagnostics) {
        this.schedule = Objects.requireNonNull(schedule, "schedule");
        if (parallelism < 1) {
            throw new IdepixException("Parallelism must be >= 1, was " + parallelism);
        }
        this.parallelism = parallelism;
        this.diagnostics = diagnostics;
    }

    public static MisrCloudMaskReconstruction create(MisrGapFillConfig config) {
        final StageSchedule schedule = StageScheduleAuxdata.getInstance().getSchedule(config.getScheduleName());
        return new MisrCloudMaskReconstruction(schedule, config.getParallelism(), config.isDiagnostics());
    }

    public static MisrCloudMaskReconstruction createDefault() {
        return create(MisrGapFillConfig.load());
    }

    public StageSchedule getSchedule() {
        return schedule;
    }

    public int getParallelism() {
        return parallelism;
    }

    /**
     * Reconstructs the given camera stack in place.
     *
     * @param cameraStack - the nine camera grids
     * @return the stack together with the remaining missing pixel count per camera
     * @throws IdepixException          if the input is malformed or the reconstruction is interrupted
     * @throws IllegalArgumentException if a neighbourhood vote is called against its contract
     */
    public ReconstructionResult reconstruct(CameraStack cameraStack) {
        if (cameraStack == null) {
            throw new IdepixException("No camera stack given");
        }
        CameraStack.validate(cameraStack.getGrids());

        final CameraReport[] reports;
        if (parallelism <= 1) {
            reports = reconstructSerially(cameraStack);
        } else {
            reports = reconstructConcurrently(cameraStack);
        }

        final ReconstructionResult result = new ReconstructionResult(cameraStack, Arrays.asList(reports));
        logger.log(diagnostics ? Level.INFO : Level.FINE,
                   "Cloud mask reconstruction with schedule '" + schedule.getName() + "' done, " +
                           result.getTotalRemainingMissingCount() + " pixels remaining: " +
                           Arrays.toString(result.getRemainingMissingCounts()));
        return result;
    }

    /**
     * Runs all stages of the schedule on a single camera grid.
     */
    CameraReport reconstructCamera(MisrCamera camera, ClassificationGrid grid) {
        final int missingBefore = grid.countMissing();
        if (missingBefore == 0) {
            logger.fine("Camera " + camera + ": no missing pixels, skipped");
            return CameraReport.skipped(camera);
        }

        final List<StageParameters> stages = schedule.getStages();
        final List<StageReport> stageReports = new ArrayList<>(stages.size());
        for (int i = 0; i < stages.size(); i++) {
            final StageReport stageReport = StageFixpoint.run(grid, i + 1, stages.get(i), schedule.getMaxIterations());
            stageReports.add(stageReport);
            logStageReport(camera, stageReport);
        }
        return new CameraReport(camera, missingBefore, grid.countMissing(), stageReports);
    }

    private CameraReport[] reconstructSerially(CameraStack cameraStack) {
        final MisrCamera[] cameras = MisrCamera.values();
        final CameraReport[] reports = new CameraReport[cameras.length];
        for (MisrCamera camera : cameras) {
            reports[camera.ordinal()] = reconstructCamera(camera, cameraStack.getGrid(camera));
        }
        return reports;
    }

    private CameraReport[] reconstructConcurrently(CameraStack cameraStack) {
        final MisrCamera[] cameras = MisrCamera.values();
        final CameraReport[] reports = new CameraReport[cameras.length];
        final ExecutorService executorService =
                Executors.newFixedThreadPool(Math.min(parallelism, cameras.length));
        final CompletionService<CameraReport> completionService = new ExecutorCompletionService<>(executorService);

        final List<Future<CameraReport>> futures = new ArrayList<>(cameras.length);
        try {
            for (MisrCamera camera : cameras) {
                final ClassificationGrid grid = cameraStack.getGrid(camera);
                futures.add(completionService.submit(() -> reconstructCamera(camera, grid)));
            }
            for (int i = 0; i < cameras.length; i++) {
                final CameraReport report = completionService.take().get();
                reports[report.getCamera().ordinal()] = report;
            }
        } catch (ExecutionException e) {
            cancelAll(futures);
            final Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IdepixException("Cloud mask reconstruction failed", cause);
        } catch (InterruptedException e) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new IdepixException("Cloud mask reconstruction interrupted", e);
        } finally {
            executorService.shutdownNow();
        }
        return reports;
    }

    private static void cancelAll(List<Future<CameraReport>> futures) {
        for (Future<CameraReport> future : futures) {
            future.cancel(true);
        }
    }

    private void logStageReport(MisrCamera camera, StageReport stageReport) {
        if (stageReport.isIterationLimitReached()) {
            logger.warning("Camera " + camera + ", stage " + stageReport.getStageIndex() + ": pass limit of " +
                                   schedule.getMaxIterations() + " reached with " +
                                   stageReport.getRemaining() + " pixels still missing");
        }
        final StageParameters parameters = stageReport.getParameters();
        final int windowSize = parameters.getWindowSize();
        logger.log(diagnostics ? Level.INFO : Level.FINE,
                   "Camera " + camera + ", stage " + stageReport.getStageIndex() +
                           ": window " + windowSize + "x" + windowSize +
                           ", min evidence " + parameters.getMinEvidence() +
                           ", mode " + parameters.getMode() +
                           ", passes " + stageReport.getNumPasses() +
                           ", resolved " + stageReport.getNumResolved() +
                           ", remaining " + stageReport.getRemaining());
    }
}
