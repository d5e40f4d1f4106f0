/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.equations;

import com.powsybl.commons.PowsyblException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Open AHU developers
 */
class EquationSystemTest {

    private EquationSystem<SimpleVariableType, SimpleEquationType> equationSystem;

    private Variable<SimpleVariableType> x0;

    private Variable<SimpleVariableType> x1;

    @BeforeEach
    void setUp() {
        equationSystem = new EquationSystem<>();
        x0 = equationSystem.getVariable(0, SimpleVariableType.X);
        x1 = equationSystem.getVariable(1, SimpleVariableType.X);
    }

    @Test
    void testVariableSet() {
        assertSame(x0, equationSystem.getVariable(0, SimpleVariableType.X));
        assertEquals(0, x0.getNum());
        assertEquals(1, x1.getNum());
        assertEquals(2, equationSystem.getVariableSet().getVariables().size());
        assertEquals(-1, x0.getRow());
    }

    @Test
    void testIndex() {
        Equation<SimpleVariableType, SimpleEquationType> eq1 = equationSystem.createEquation(1, SimpleEquationType.BALANCE)
                .addTerm(x1.createTerm());
        Equation<SimpleVariableType, SimpleEquationType> eq0 = equationSystem.createEquation(0, SimpleEquationType.BALANCE)
                .addTerm(x0.createTerm())
                .addTerm(x1.<SimpleEquationType>createTerm().minus());

        EquationSystemIndex<SimpleVariableType, SimpleEquationType> index = equationSystem.getIndex();
        assertEquals(List.of(eq0, eq1), index.getSortedEquationsToSolve());
        assertEquals(List.of(x0, x1), index.getSortedVariablesToFind());
        assertEquals(0, eq0.getColumn());
        assertEquals(1, eq1.getColumn());

        eq0.setActive(false);
        assertEquals(List.of(eq1), index.getSortedEquationsToSolve());
        assertEquals(List.of(x1), index.getSortedVariablesToFind());
        assertEquals(-1, eq0.getColumn());
        assertEquals(-1, x0.getRow());
        assertEquals(0, x1.getRow());
    }

    @Test
    void testEvalAndDer() {
        Equation<SimpleVariableType, SimpleEquationType> eq = equationSystem.createEquation(0, SimpleEquationType.BALANCE)
                .addTerm(x0.<SimpleEquationType>createTerm().multiply(2))
                .addTerm(x1.<SimpleEquationType>createTerm().minus());
        equationSystem.createEquation(1, SimpleEquationType.BALANCE)
                .addTerm(x1.createTerm());
        equationSystem.getIndex().getSortedVariablesToFind();
        equationSystem.getStateVector().set(new double[] {3, 4});

        assertEquals(2, eq.eval(), 0);
        assertEquals(3, equationSystem.getValue(x0), 0);

        List<Double> derivatives = new ArrayList<>();
        eq.der((variable, value) -> derivatives.add(value));
        assertEquals(List.of(2d, -1d), derivatives);
    }

    @Test
    void testDuplicateEquationAndTerm() {
        Equation<SimpleVariableType, SimpleEquationType> eq = equationSystem.createEquation(0, SimpleEquationType.BALANCE);
        assertSame(eq, equationSystem.createEquation(0, SimpleEquationType.BALANCE));
        assertTrue(equationSystem.hasEquation(0, SimpleEquationType.BALANCE));
        assertFalse(equationSystem.getEquation(0, SimpleEquationType.CONTROL).isPresent());

        EquationTerm<SimpleVariableType, SimpleEquationType> term = x0.createTerm();
        eq.addTerm(term);
        Equation<SimpleVariableType, SimpleEquationType> other = equationSystem.createEquation(1, SimpleEquationType.BALANCE);
        assertThrows(PowsyblException.class, () -> other.addTerm(term));
    }

    @Test
    void testListener() {
        List<EquationEventType> events = new ArrayList<>();
        equationSystem.addListener(new EquationSystemListener<>() {
            @Override
            public void onEquationChange(Equation<SimpleVariableType, SimpleEquationType> equation, EquationEventType eventType) {
                events.add(eventType);
            }

            @Override
            public void onEquationTermChange(EquationTerm<SimpleVariableType, SimpleEquationType> term, EquationEventType eventType) {
                events.add(eventType);
            }
        });
        Equation<SimpleVariableType, SimpleEquationType> eq = equationSystem.createEquation(0, SimpleEquationType.BALANCE);
        EquationTerm<SimpleVariableType, SimpleEquationType> term = x0.createTerm();
        eq.addTerm(term);
        term.setActive(false);
        eq.setActive(false);
        eq.setActive(false);
        assertEquals(List.of(EquationEventType.EQUATION_CREATED, EquationEventType.EQUATION_TERM_ADDED,
                EquationEventType.EQUATION_TERM_DEACTIVATED, EquationEventType.EQUATION_DEACTIVATED), events);
    }

    @Test
    void testWrite() {
        equationSystem.createEquation(0, SimpleEquationType.BALANCE)
                .addTerm(x0.createTerm())
                .addTerm(x1.<SimpleEquationType>createTerm().multiply(2));
        equationSystem.createEquation(1, SimpleEquationType.CONTROL)
                .addTerm(x1.createTerm())
                .setActive(false);

        String ls = System.lineSeparator();
        assertEquals("b0 = x0 + 2.0 * x1" + ls, equationSystem.writeToString());
        assertEquals("b0 = x0 + 2.0 * x1" + ls + "(inactive) ctl1 = x1" + ls, equationSystem.writeToString(true));
    }
}
