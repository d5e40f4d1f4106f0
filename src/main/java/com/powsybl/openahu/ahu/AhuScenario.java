/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.ahu;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.powsybl.openahu.InvalidParameterException;
import com.powsybl.openahu.network.AhuInputs;
import com.powsybl.openahu.network.AhuParameters;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A named pair of design parameters and inputs, the unit of exchange with the callers driving the solver.
 *
 * @author Open AHU developers
 */
public final class AhuScenario {

    private final String name;

    private final AhuParameters parameters;

    private final AhuInputs inputs;

    public AhuScenario(String name, AhuParameters parameters, AhuInputs inputs) {
        this.name = Objects.requireNonNull(name);
        this.parameters = Objects.requireNonNull(parameters);
        this.inputs = Objects.requireNonNull(inputs);
    }

    public static AhuScenario createDefault() {
        return new AhuScenario("default", AhuParameters.createDefault(), AhuInputs.createDefault());
    }

    public String getName() {
        return name;
    }

    public AhuParameters getParameters() {
        return parameters;
    }

    public AhuInputs getInputs() {
        return inputs;
    }

    public AhuSolverResult solve(AhuSolver solver) {
        return Objects.requireNonNull(solver).solve(parameters, inputs);
    }

    private static ObjectMapper createObjectMapper() {
        SimpleModule module = new SimpleModule("ahu-scenario");
        module.addSerializer(AhuScenario.class, new AhuScenarioJsonSerializer());
        module.addDeserializer(AhuScenario.class, new AhuScenarioJsonDeserializer());
        return JsonMapper.builder()
                .addModule(module)
                .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(StreamWriteFeature.AUTO_CLOSE_TARGET)
                .build();
    }

    public static AhuScenario read(InputStream is) {
        Objects.requireNonNull(is);
        try {
            return createObjectMapper().readValue(is, AhuScenario.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static AhuScenario read(Path file) {
        Objects.requireNonNull(file);
        try (InputStream is = Files.newInputStream(file)) {
            return read(is);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public void write(OutputStream os) {
        Objects.requireNonNull(os);
        try {
            createObjectMapper().writeValue(os, this);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public void write(Path file) {
        Objects.requireNonNull(file);
        try (OutputStream os = Files.newOutputStream(file)) {
            write(os);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static void writeJson(JsonGenerator jsonGenerator, AhuScenario scenario) throws IOException {
        jsonGenerator.writeStartObject();
        jsonGenerator.writeStringField("name", scenario.getName());

        AhuParameters parameters = scenario.getParameters();
        jsonGenerator.writeObjectFieldStart("parameters");
        jsonGenerator.writeNumberField("supplyMassFlow", parameters.getSupplyMassFlow());
        jsonGenerator.writeNumberField("outdoorMassFlow", parameters.getOutdoorMassFlow());
        jsonGenerator.writeNumberField("bypassFraction", parameters.getBypassFraction());
        jsonGenerator.writeNumberField("temperatureControllerGain", parameters.getTemperatureControllerGain());
        jsonGenerator.writeNumberField("humidityControllerGain", parameters.getHumidityControllerGain());
        jsonGenerator.writeNumberField("coilMinOutletTemperature", parameters.getCoilMinOutletTemperature());
        jsonGenerator.writeEndObject();

        AhuInputs inputs = scenario.getInputs();
        jsonGenerator.writeObjectFieldStart("inputs");
        jsonGenerator.writeNumberField("outdoorTemperature", inputs.getOutdoorTemperature());
        jsonGenerator.writeNumberField("outdoorRelativeHumidity", inputs.getOutdoorRelativeHumidity());
        jsonGenerator.writeNumberField("zoneTemperatureSetpoint", inputs.getZoneTemperatureSetpoint());
        jsonGenerator.writeNumberField("zoneRelativeHumiditySetpoint", inputs.getZoneRelativeHumiditySetpoint());
        jsonGenerator.writeNumberField("infiltrationMassFlow", inputs.getInfiltrationMassFlow());
        jsonGenerator.writeNumberField("buildingConductance", inputs.getBuildingConductance());
        jsonGenerator.writeNumberField("auxiliarySensibleLoad", inputs.getAuxiliarySensibleLoad());
        jsonGenerator.writeNumberField("auxiliaryLatentLoad", inputs.getAuxiliaryLatentLoad());
        jsonGenerator.writeEndObject();

        jsonGenerator.writeEndObject();
    }

    private static double nextDouble(JsonParser parser) throws IOException {
        JsonToken token = parser.nextToken();
        if (token == JsonToken.VALUE_NUMBER_FLOAT || token == JsonToken.VALUE_NUMBER_INT) {
            return parser.getDoubleValue();
        }
        if (token == JsonToken.VALUE_STRING) {
            // non finite numbers are written as strings
            try {
                return Double.parseDouble(parser.getText());
            } catch (NumberFormatException e) {
                throw new InvalidParameterException("Invalid number '" + parser.getText() + "' for field '" + parser.currentName() + "'");
            }
        }
        throw new InvalidParameterException("Number expected for field '" + parser.currentName() + "'");
    }

    private static void checkStartObject(JsonParser parser, String fieldName) throws IOException {
        if (parser.nextToken() != JsonToken.START_OBJECT) {
            throw new InvalidParameterException("Object expected for field '" + fieldName + "'");
        }
    }

    private static AhuParameters parseParameters(JsonParser parser) throws IOException {
        checkStartObject(parser, "parameters");
        AhuParameters defaults = AhuParameters.createDefault();
        double supplyMassFlow = defaults.getSupplyMassFlow();
        double outdoorMassFlow = defaults.getOutdoorMassFlow();
        double bypassFraction = defaults.getBypassFraction();
        double temperatureControllerGain = defaults.getTemperatureControllerGain();
        double humidityControllerGain = defaults.getHumidityControllerGain();
        double coilMinOutletTemperature = defaults.getCoilMinOutletTemperature();
        while (parser.nextToken() == JsonToken.FIELD_NAME) {
            String fieldName = parser.currentName();
            switch (fieldName) {
                case "supplyMassFlow" -> supplyMassFlow = nextDouble(parser);
                case "outdoorMassFlow" -> outdoorMassFlow = nextDouble(parser);
                case "bypassFraction" -> bypassFraction = nextDouble(parser);
                case "temperatureControllerGain" -> temperatureControllerGain = nextDouble(parser);
                case "humidityControllerGain" -> humidityControllerGain = nextDouble(parser);
                case "coilMinOutletTemperature" -> coilMinOutletTemperature = nextDouble(parser);
                default -> throw new InvalidParameterException("Unexpected parameter field: " + fieldName);
            }
        }
        return new AhuParameters(supplyMassFlow, outdoorMassFlow, bypassFraction, temperatureControllerGain,
                                 humidityControllerGain, coilMinOutletTemperature);
    }

    private static AhuInputs parseInputs(JsonParser parser) throws IOException {
        checkStartObject(parser, "inputs");
        AhuInputs.Builder builder = AhuInputs.builder();
        while (parser.nextToken() == JsonToken.FIELD_NAME) {
            String fieldName = parser.currentName();
            switch (fieldName) {
                case "outdoorTemperature" -> builder.setOutdoorTemperature(nextDouble(parser));
                case "outdoorRelativeHumidity" -> builder.setOutdoorRelativeHumidity(nextDouble(parser));
                case "zoneTemperatureSetpoint" -> builder.setZoneTemperatureSetpoint(nextDouble(parser));
                case "zoneRelativeHumiditySetpoint" -> builder.setZoneRelativeHumiditySetpoint(nextDouble(parser));
                case "infiltrationMassFlow" -> builder.setInfiltrationMassFlow(nextDouble(parser));
                case "buildingConductance" -> builder.setBuildingConductance(nextDouble(parser));
                case "auxiliarySensibleLoad" -> builder.setAuxiliarySensibleLoad(nextDouble(parser));
                case "auxiliaryLatentLoad" -> builder.setAuxiliaryLatentLoad(nextDouble(parser));
                default -> throw new InvalidParameterException("Unexpected input field: " + fieldName);
            }
        }
        return builder.build();
    }

    static AhuScenario parseJson(JsonParser parser) throws IOException {
        Objects.requireNonNull(parser);
        JsonToken token = parser.currentToken();
        if (token != JsonToken.START_OBJECT) {
            throw new InvalidParameterException("Scenario object expected");
        }
        String name = "unnamed";
        AhuParameters parameters = AhuParameters.createDefault();
        AhuInputs inputs = AhuInputs.createDefault();
        while (parser.nextToken() == JsonToken.FIELD_NAME) {
            String fieldName = parser.currentName();
            switch (fieldName) {
                case "name" -> name = parser.nextTextValue();
                case "parameters" -> parameters = parseParameters(parser);
                case "inputs" -> inputs = parseInputs(parser);
                default -> throw new InvalidParameterException("Unexpected scenario field: " + fieldName);
            }
        }
        return new AhuScenario(name, parameters, inputs);
    }

    @Override
    public String toString() {
        return "AhuScenario(name=" + name + ", " + parameters + ", " + inputs + ")";
    }
}
