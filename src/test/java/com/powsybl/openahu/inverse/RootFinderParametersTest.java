/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.inverse;

import com.google.common.jimfs.Configuration;
import com.google.common.jimfs.Jimfs;
import com.powsybl.commons.config.InMemoryPlatformConfig;
import com.powsybl.commons.config.MapModuleConfig;
import com.powsybl.openahu.InvalidParameterException;
import com.powsybl.openahu.ahu.AhuSolverParameters;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.FileSystem;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Open AHU developers
 */
class RootFinderParametersTest {

    private InMemoryPlatformConfig platformConfig;

    private FileSystem fileSystem;

    @BeforeEach
    void setUp() {
        fileSystem = Jimfs.newFileSystem(Configuration.unix());
        platformConfig = new InMemoryPlatformConfig(fileSystem);
    }

    @AfterEach
    void tearDown() throws IOException {
        fileSystem.close();
    }

    @Test
    void testDefaultConfig() {
        RootFinderParameters parameters = RootFinderParameters.load(platformConfig);
        assertEquals(1e-7, parameters.getAbsoluteTolerance(), 0);
        assertEquals(1e-12, parameters.getFunctionTolerance(), 0);
        assertEquals(100, parameters.getMaxIterations());
        assertEquals(100, parameters.getMaxSupplyMassFlow(), 0);
        assertEquals(10, parameters.getBracketScanIntervals());
        assertEquals(1, parameters.getThreadCount());
    }

    @Test
    void testConfig() {
        MapModuleConfig moduleConfig = platformConfig.createModuleConfig(AhuSolverParameters.MODULE_NAME);
        moduleConfig.setStringProperty("rootFinderAbsoluteTolerance", "1e-9");
        moduleConfig.setStringProperty("rootFinderFunctionTolerance", "0");
        moduleConfig.setStringProperty("rootFinderMaxIterations", "40");
        moduleConfig.setStringProperty("maxSupplyMassFlow", "20");
        moduleConfig.setStringProperty("bracketScanIntervals", "4");
        moduleConfig.setStringProperty("threadCount", "2");
        // direct solver parameters share the module
        moduleConfig.setStringProperty("maxSaturationIterations", "12");

        RootFinderParameters parameters = RootFinderParameters.load(platformConfig);
        assertEquals(1e-9, parameters.getAbsoluteTolerance(), 0);
        assertEquals(0, parameters.getFunctionTolerance(), 0);
        assertEquals(40, parameters.getMaxIterations());
        assertEquals(20, parameters.getMaxSupplyMassFlow(), 0);
        assertEquals(4, parameters.getBracketScanIntervals());
        assertEquals(2, parameters.getThreadCount());
        assertEquals(12, AhuSolverParameters.load(platformConfig).getMaxSaturationIterations());
    }

    @Test
    void testInvalidParameters() {
        RootFinderParameters parameters = new RootFinderParameters();
        assertThrows(InvalidParameterException.class, () -> parameters.setAbsoluteTolerance(0));
        assertThrows(InvalidParameterException.class, () -> parameters.setFunctionTolerance(-1));
        assertThrows(InvalidParameterException.class, () -> parameters.setMaxIterations(0));
        assertThrows(InvalidParameterException.class, () -> parameters.setMaxSupplyMassFlow(Double.POSITIVE_INFINITY));
        assertThrows(InvalidParameterException.class, () -> parameters.setBracketScanIntervals(0));
        assertThrows(InvalidParameterException.class, () -> parameters.setThreadCount(0));

        MapModuleConfig moduleConfig = platformConfig.createModuleConfig(AhuSolverParameters.MODULE_NAME);
        moduleConfig.setStringProperty("threadCount", "-2");
        assertThrows(InvalidParameterException.class, () -> RootFinderParameters.load(platformConfig));
    }
}
