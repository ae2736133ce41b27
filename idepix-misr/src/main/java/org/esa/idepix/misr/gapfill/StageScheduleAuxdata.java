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

import org.esa.idepix.core.IdepixException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringTokenizer;

/**
 * Stage schedule auxiliary data utility class.
 * Reads the tab separated schedule table shipped with this module.
 *
 * @author olafd
 */
public class StageScheduleAuxdata {

    public static final String PRODUCTION_SCHEDULE_NAME = "production";
    public static final String LEGACY_SCHEDULE_NAME = "legacy";

    static final String SCHEDULE_FILE_NAME = "stage_schedules.txt";

    private static final int NUM_COLUMNS = 6;

    private static StageScheduleAuxdata instance;

    private final Map<String, StageSchedule> schedules;

    private StageScheduleAuxdata(Map<String, StageSchedule> schedules) {
        this.schedules = schedules;
    }

    public static synchronized StageScheduleAuxdata getInstance() {
        if (instance == null) {
            final InputStream inputStream = StageScheduleAuxdata.class.getResourceAsStream(SCHEDULE_FILE_NAME);
            if (inputStream == null) {
                throw new IdepixException("Stage schedule table '" + SCHEDULE_FILE_NAME + "' not found");
            }
            try {
                instance = new StageScheduleAuxdata(readSchedules(inputStream));
            } catch (IOException e) {
                throw new IdepixException("Failed to load stage schedules: \n" + e.getMessage(), e);
            }
        }
        return instance;
    }

    public StageSchedule getSchedule(String name) {
        final StageSchedule schedule = schedules.get(name);
        if (schedule == null) {
            throw new IdepixException("Unknown stage schedule '" + name + "'. Available schedules: " +
                                              schedules.keySet());
        }
        return schedule;
    }

    public StageSchedule getProductionSchedule() {
        return getSchedule(PRODUCTION_SCHEDULE_NAME);
    }

    public Set<String> getScheduleNames() {
        return Collections.unmodifiableSet(schedules.keySet());
    }

    static Map<String, StageSchedule> readSchedules(InputStream inputStream) throws IOException {
        final Map<String, List<StageParameters>> stagesByName = new LinkedHashMap<>();
        final Map<String, Integer> maxIterationsByName = new LinkedHashMap<>();

        BufferedReader bufferedReader = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8));
        StringTokenizer st;
        int lineNumber = 0;
        try {
            String line;
            while ((line = bufferedReader.readLine()) != null) {
                lineNumber++;
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) {
                    continue;
                }
                st = new StringTokenizer(line, "\t", false);
                if (st.countTokens() != NUM_COLUMNS) {
                    throw new IdepixException("Line " + lineNumber + ": expected " + NUM_COLUMNS +
                                                      " columns but found " + st.countTokens());
                }
                final String name = st.nextToken().trim();
                final int stageIndex = Integer.parseInt(st.nextToken().trim());
                final int radius = Integer.parseInt(st.nextToken().trim());
                final int minEvidence = Integer.parseInt(st.nextToken().trim());
                final VoteMode mode = VoteMode.valueOf(st.nextToken().trim());
                final int maxIterations = Integer.parseInt(st.nextToken().trim());

                final List<StageParameters> stages = stagesByName.computeIfAbsent(name, k -> new ArrayList<>());
                if (stageIndex != stages.size() + 1) {
                    throw new IdepixException("Line " + lineNumber + ": schedule '" + name + "' expects stage " +
                                                      (stages.size() + 1) + " but found stage " + stageIndex);
                }
                final Integer previousMaxIterations = maxIterationsByName.putIfAbsent(name, maxIterations);
                if (previousMaxIterations != null && previousMaxIterations != maxIterations) {
                    throw new IdepixException("Line " + lineNumber + ": schedule '" + name +
                                                      "' uses different pass limits per stage");
                }
                stages.add(new StageParameters(radius, minEvidence, mode));
            }
        } catch (IllegalArgumentException e) {
            // also covers NumberFormatException and unknown vote modes
            throw new IdepixException("Failed to parse stage schedules at line " + lineNumber + ": \n" +
                                              e.getMessage(), e);
        } finally {
            inputStream.close();
        }

        final Map<String, StageSchedule> schedules = new LinkedHashMap<>();
        for (Map.Entry<String, List<StageParameters>> entry : stagesByName.entrySet()) {
            final String name = entry.getKey();
            schedules.put(name, new StageSchedule(name, entry.getValue(), maxIterationsByName.get(name)));
        }
        return schedules;
    }
}
