/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.ahu;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.jimfs.Configuration;
import com.google.common.jimfs.Jimfs;
import com.powsybl.openahu.network.StatePoint;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Open AHU developers
 */
class AhuSolverResultTest {

    private FileSystem fileSystem;

    private AhuSolverResult result;

    @BeforeEach
    void setUp() {
        fileSystem = Jimfs.newFileSystem(Configuration.unix());
        result = AhuScenario.createDefault().solve(new AhuSolver());
    }

    @AfterEach
    void tearDown() throws IOException {
        fileSystem.close();
    }

    private static void assertDefaultResult(JsonNode root) {
        assertEquals(3.5, root.path("parameters").path("supplyMassFlow").asDouble(), 0);
        assertEquals(3.15, root.path("flows").path("treated").asDouble(), 1e-12);
        JsonNode states = root.path("statePoints");
        assertEquals(StatePoint.values().length, states.size());
        JsonNode zone = states.get(StatePoint.ZONE.getNum());
        assertEquals("ZONE", zone.path("name").asText());
        assertEquals("I", zone.path("label").asText());
        assertEquals(24, zone.path("temperature").asDouble(), 1e-5);
        assertEquals(-52054.7, root.path("heatFlows").path("coilTotal").asDouble(), 0.1);
        assertEquals("WET", root.path("coil").path("humidityMode").asText());
        assertEquals("CONTROLLED", root.path("coil").path("temperatureMode").asText());
        assertEquals(2, root.path("solver").path("saturationIterations").asInt());
        assertEquals(0, root.path("solver").path("outerLoopIterations").asInt());
    }

    @Test
    void testToJson() throws IOException {
        assertDefaultResult(new ObjectMapper().readTree(result.toJson()));
    }

    @Test
    void testWriteJsonFile() throws IOException {
        Path file = fileSystem.getPath("/result.json");
        result.writeJson(file);
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            assertDefaultResult(new ObjectMapper().readTree(reader));
        }
    }

    @Test
    void testAccessors() {
        assertEquals(result.getState(StatePoint.ZONE).temperature(), result.getZoneTemperature(), 0);
        assertEquals(result.getState(StatePoint.SUPPLY).temperature(), result.getSupplyTemperature(), 0);
        assertEquals(0.6, result.getState(StatePoint.ZONE).relativeHumidity(), 0.05);
        assertEquals(result.getCoilSensibleHeat() + result.getCoilLatentHeat(), result.getCoilTotalHeat(), 1e-6);
        assertThrows(UnsupportedOperationException.class, () -> result.getStates().clear());
        assertTrue(result.toString().startsWith("AhuSolverResult(zoneTemperature="));
    }
}
