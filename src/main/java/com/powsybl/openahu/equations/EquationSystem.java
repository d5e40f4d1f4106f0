/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.equations;

import org.apache.commons.lang3.tuple.Pair;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.*;

/**
 * @author Open AHU developers
 */
public class EquationSystem<V extends Enum<V> & Quantity, E extends Enum<E> & Quantity> {

    private final Map<Pair<Integer, E>, Equation<V, E>> equations = new HashMap<>();

    private final List<EquationSystemListener<V, E>> listeners = new ArrayList<>();

    private final VariableSet<V> variableSet;

    private final StateVector stateVector = new StateVector();

    private final EquationSystemIndex<V, E> index;

    public EquationSystem() {
        this(new VariableSet<>());
    }

    public EquationSystem(VariableSet<V> variableSet) {
        this.variableSet = Objects.requireNonNull(variableSet);
        index = new EquationSystemIndex<>(this);
    }

    public VariableSet<V> getVariableSet() {
        return variableSet;
    }

    public Variable<V> getVariable(int elementNum, V type) {
        return variableSet.getVariable(elementNum, type);
    }

    public StateVector getStateVector() {
        return stateVector;
    }

    public EquationSystemIndex<V, E> getIndex() {
        return index;
    }

    public Collection<Equation<V, E>> getEquations() {
        return equations.values();
    }

    public Equation<V, E> createEquation(int num, E type) {
        Objects.requireNonNull(type);
        Pair<Integer, E> p = Pair.of(num, type);
        Equation<V, E> equation = equations.get(p);
        if (equation == null) {
            equation = new Equation<>(num, type, this);
            equations.put(p, equation);
            notifyEquationChange(equation, EquationEventType.EQUATION_CREATED);
        }
        return equation;
    }

    public Optional<Equation<V, E>> getEquation(int num, E type) {
        return Optional.ofNullable(equations.get(Pair.of(num, type)));
    }

    public boolean hasEquation(int num, E type) {
        return equations.containsKey(Pair.of(num, type));
    }

    /**
     * Value of a variable in the last solved state, NaN if the variable is not part of the solved system.
     */
    public double getValue(Variable<V> variable) {
        Objects.requireNonNull(variable);
        if (variable.getRow() == -1 || stateVector.get() == null) {
            return Double.NaN;
        }
        return stateVector.get(variable.getRow());
    }

    void notifyEquationChange(Equation<V, E> equation, EquationEventType eventType) {
        Objects.requireNonNull(equation);
        Objects.requireNonNull(eventType);
        listeners.forEach(listener -> listener.onEquationChange(equation, eventType));
    }

    void notifyEquationTermChange(EquationTerm<V, E> term, EquationEventType eventType) {
        Objects.requireNonNull(term);
        Objects.requireNonNull(eventType);
        listeners.forEach(listener -> listener.onEquationTermChange(term, eventType));
    }

    public void addListener(EquationSystemListener<V, E> listener) {
        Objects.requireNonNull(listener);
        listeners.add(listener);
    }

    public void removeListener(EquationSystemListener<V, E> listener) {
        listeners.remove(listener);
    }

    public void write(Writer writer, boolean writeInactiveEquations) {
        try {
            for (Equation<V, E> equation : equations.values().stream().sorted().toList()) {
                if (writeInactiveEquations || equation.isActive()) {
                    if (!equation.isActive()) {
                        writer.write("(inactive) ");
                    }
                    equation.write(writer);
                }
            }
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public String writeToString(boolean writeInactiveEquations) {
        try (StringWriter writer = new StringWriter()) {
            write(writer, writeInactiveEquations);
            writer.flush();
            return writer.toString();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public String writeToString() {
        return writeToString(false);
    }
}
