/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.equations;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Sorted active equations (matrix columns) and the variables they reference (matrix rows). The index is lazily
 * rebuilt after any structural change of the equation system.
 *
 * @author Open AHU developers
 */
public class EquationSystemIndex<V extends Enum<V> & Quantity, E extends Enum<E> & Quantity>
        implements EquationSystemListener<V, E> {

    private static final Logger LOGGER = LoggerFactory.getLogger(EquationSystemIndex.class);

    private final EquationSystem<V, E> equationSystem;

    private List<Equation<V, E>> sortedEquationsToSolve = Collections.emptyList();

    private List<Variable<V>> sortedVariablesToFind = Collections.emptyList();

    private boolean valid = false;

    EquationSystemIndex(EquationSystem<V, E> equationSystem) {
        this.equationSystem = Objects.requireNonNull(equationSystem);
        equationSystem.addListener(this);
    }

    private void update() {
        if (valid) {
            return;
        }

        for (Equation<V, E> equation : equationSystem.getEquations()) {
            equation.setColumn(-1);
        }
        for (Variable<V> variable : equationSystem.getVariableSet().getVariables()) {
            variable.setRow(-1);
        }

        sortedEquationsToSolve = equationSystem.getEquations().stream()
                .filter(Equation::isActive)
                .sorted()
                .toList();
        int columnCount = 0;
        for (Equation<V, E> equation : sortedEquationsToSolve) {
            equation.setColumn(columnCount++);
        }

        Set<Variable<V>> variablesToFind = new TreeSet<>();
        for (Equation<V, E> equation : sortedEquationsToSolve) {
            for (EquationTerm<V, E> term : equation.getTerms()) {
                if (term.isActive()) {
                    variablesToFind.addAll(term.getVariables());
                }
            }
        }
        sortedVariablesToFind = new ArrayList<>(variablesToFind);
        int rowCount = 0;
        for (Variable<V> variable : sortedVariablesToFind) {
            variable.setRow(rowCount++);
        }

        valid = true;
        LOGGER.debug("Equation system index updated ({} columns, {} rows)", columnCount, rowCount);
    }

    public List<Equation<V, E>> getSortedEquationsToSolve() {
        update();
        return sortedEquationsToSolve;
    }

    public List<Variable<V>> getSortedVariablesToFind() {
        update();
        return sortedVariablesToFind;
    }

    public int getColumnCount() {
        return getSortedEquationsToSolve().size();
    }

    public int getRowCount() {
        return getSortedVariablesToFind().size();
    }

    @Override
    public void onEquationChange(Equation<V, E> equation, EquationEventType eventType) {
        valid = false;
    }

    @Override
    public void onEquationTermChange(EquationTerm<V, E> term, EquationEventType eventType) {
        valid = false;
    }
}
