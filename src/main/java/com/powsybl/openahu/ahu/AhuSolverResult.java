/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.ahu;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.powsybl.openahu.network.AhuInputs;
import com.powsybl.openahu.network.AhuNetwork;
import com.powsybl.openahu.network.AhuParameters;
import com.powsybl.openahu.network.CoilHumidityMode;
import com.powsybl.openahu.network.CoilTemperatureMode;
import com.powsybl.openahu.network.FlowSplit;
import com.powsybl.openahu.network.StatePoint;
import com.powsybl.openahu.psychro.PsychrometricProperties;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable outcome of a direct solve: air state at every point, heat flows in W and coil operating modes.
 *
 * @author Open AHU developers
 */
public final class AhuSolverResult {

    private final AhuParameters parameters;

    private final AhuInputs inputs;

    private final FlowSplit flowSplit;

    private final Map<StatePoint, AirState> states;

    private final double coilTotalHeat;

    private final double coilSensibleHeat;

    private final double coilLatentHeat;

    private final double heatingCoilHeat;

    private final double zoneSensibleLoad;

    private final double zoneLatentLoad;

    private final CoilHumidityMode coilHumidityMode;

    private final CoilTemperatureMode coilTemperatureMode;

    private final int saturationIterations;

    private final int outerLoopIterations;

    private final double conditionNumber;

    private AhuSolverResult(AhuNetwork network, int saturationIterations, int outerLoopIterations, double conditionNumber) {
        parameters = network.getParameters();
        inputs = network.getInputs();
        flowSplit = network.getFlowSplit();
        PsychrometricProperties psychrometricProperties = network.getPsychrometricProperties();
        Map<StatePoint, AirState> statesByPoint = new EnumMap<>(StatePoint.class);
        for (StatePoint point : StatePoint.values()) {
            double temperature = network.getTemperature(point);
            double humidityRatio = network.getHumidityRatio(point);
            statesByPoint.put(point, new AirState(temperature, humidityRatio, psychrometricProperties.relativeHumidity(temperature, humidityRatio)));
        }
        states = Collections.unmodifiableMap(statesByPoint);
        coilTotalHeat = network.getCoilTotalHeat();
        coilSensibleHeat = network.getCoilSensibleHeat();
        coilLatentHeat = network.getCoilLatentHeat();
        heatingCoilHeat = network.getHeatingCoilHeat();
        zoneSensibleLoad = network.getZoneSensibleLoad();
        zoneLatentLoad = network.getZoneLatentLoad();
        coilHumidityMode = network.getCoolingCoil().getHumidityMode();
        coilTemperatureMode = network.getCoolingCoil().getTemperatureMode();
        this.saturationIterations = saturationIterations;
        this.outerLoopIterations = outerLoopIterations;
        this.conditionNumber = conditionNumber;
    }

    public static AhuSolverResult create(AhuNetwork network, int saturationIterations, int outerLoopIterations, double conditionNumber) {
        return new AhuSolverResult(Objects.requireNonNull(network), saturationIterations, outerLoopIterations, conditionNumber);
    }

    public AhuParameters getParameters() {
        return parameters;
    }

    public AhuInputs getInputs() {
        return inputs;
    }

    public FlowSplit getFlowSplit() {
        return flowSplit;
    }

    public Map<StatePoint, AirState> getStates() {
        return states;
    }

    public AirState getState(StatePoint point) {
        return states.get(Objects.requireNonNull(point));
    }

    public double getZoneTemperature() {
        return getState(StatePoint.ZONE).temperature();
    }

    public double getZoneHumidityRatio() {
        return getState(StatePoint.ZONE).humidityRatio();
    }

    public double getSupplyTemperature() {
        return getState(StatePoint.SUPPLY).temperature();
    }

    public double getCoilTotalHeat() {
        return coilTotalHeat;
    }

    public double getCoilSensibleHeat() {
        return coilSensibleHeat;
    }

    public double getCoilLatentHeat() {
        return coilLatentHeat;
    }

    public double getHeatingCoilHeat() {
        return heatingCoilHeat;
    }

    public double getZoneSensibleLoad() {
        return zoneSensibleLoad;
    }

    public double getZoneLatentLoad() {
        return zoneLatentLoad;
    }

    public CoilHumidityMode getCoilHumidityMode() {
        return coilHumidityMode;
    }

    public CoilTemperatureMode getCoilTemperatureMode() {
        return coilTemperatureMode;
    }

    public int getSaturationIterations() {
        return saturationIterations;
    }

    public int getOuterLoopIterations() {
        return outerLoopIterations;
    }

    public double getConditionNumber() {
        return conditionNumber;
    }

    private static void writeFlowSplit(JsonGenerator generator, FlowSplit flowSplit) throws IOException {
        generator.writeObjectFieldStart("flows");
        generator.writeNumberField("supply", flowSplit.getSupplyFlow());
        generator.writeNumberField("outdoor", flowSplit.getOutdoorFlow());
        generator.writeNumberField("recycled", flowSplit.getRecycledFlow());
        generator.writeNumberField("bypass", flowSplit.getBypassFlow());
        generator.writeNumberField("treated", flowSplit.getTreatedFlow());
        generator.writeEndObject();
    }

    private void writeStates(JsonGenerator generator) throws IOException {
        generator.writeArrayFieldStart("statePoints");
        for (Map.Entry<StatePoint, AirState> e : states.entrySet()) {
            StatePoint point = e.getKey();
            AirState state = e.getValue();
            generator.writeStartObject();
            generator.writeNumberField("num", point.getNum());
            generator.writeStringField("name", point.name());
            generator.writeStringField("label", point.getLabel());
            generator.writeNumberField("temperature", state.temperature());
            generator.writeNumberField("humidityRatio", state.humidityRatio());
            generator.writeNumberField("relativeHumidity", state.relativeHumidity());
            generator.writeEndObject();
        }
        generator.writeEndArray();
    }

    private void writeHeatFlows(JsonGenerator generator) throws IOException {
        generator.writeObjectFieldStart("heatFlows");
        generator.writeNumberField("coilTotal", coilTotalHeat);
        generator.writeNumberField("coilSensible", coilSensibleHeat);
        generator.writeNumberField("coilLatent", coilLatentHeat);
        generator.writeNumberField("heatingCoilSensible", heatingCoilHeat);
        generator.writeNumberField("zoneSensible", zoneSensibleLoad);
        generator.writeNumberField("zoneLatent", zoneLatentLoad);
        generator.writeEndObject();
    }

    public void writeJson(Writer writer) {
        Objects.requireNonNull(writer);
        try (JsonGenerator generator = new JsonFactory().createGenerator(writer)) {
            generator.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
            generator.useDefaultPrettyPrinter();
            generator.writeStartObject();
            generator.writeObjectFieldStart("parameters");
            generator.writeNumberField("supplyMassFlow", parameters.getSupplyMassFlow());
            generator.writeNumberField("outdoorMassFlow", parameters.getOutdoorMassFlow());
            generator.writeNumberField("bypassFraction", parameters.getBypassFraction());
            generator.writeEndObject();
            writeFlowSplit(generator, flowSplit);
            writeStates(generator);
            writeHeatFlows(generator);
            generator.writeObjectFieldStart("coil");
            generator.writeStringField("humidityMode", coilHumidityMode.name());
            generator.writeStringField("temperatureMode", coilTemperatureMode.name());
            generator.writeEndObject();
            generator.writeObjectFieldStart("solver");
            generator.writeNumberField("saturationIterations", saturationIterations);
            generator.writeNumberField("outerLoopIterations", outerLoopIterations);
            generator.writeNumberField("conditionNumber", conditionNumber);
            generator.writeEndObject();
            generator.writeEndObject();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public void writeJson(Path file) {
        Objects.requireNonNull(file);
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writeJson(writer);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public String toJson() {
        StringWriter writer = new StringWriter();
        writeJson(writer);
        return writer.toString();
    }

    @Override
    public String toString() {
        return "AhuSolverResult(zoneTemperature=" + getZoneTemperature()
                + ", zoneHumidityRatio=" + getZoneHumidityRatio()
                + ", coilTotalHeat=" + coilTotalHeat
                + ", coilHumidityMode=" + coilHumidityMode
                + ", coilTemperatureMode=" + coilTemperatureMode
                + ")";
    }
}
