/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.equations;

import com.powsybl.commons.PowsyblException;

import java.io.IOException;
import java.io.Writer;
import java.util.*;

/**
 * A linear equation: the sum of its active terms is equal to a target computed outside of the equation.
 *
 * @author Open AHU developers
 */
public class Equation<V extends Enum<V> & Quantity, E extends Enum<E> & Quantity> implements Comparable<Equation<V, E>> {

    @FunctionalInterface
    public interface DerHandler<V extends Enum<V> & Quantity> {

        void onDer(Variable<V> variable, double value);
    }

    private final int elementNum;

    private final E type;

    private final EquationSystem<V, E> equationSystem;

    private int column = -1;

    /**
     * true if this equation is part of the system to solve, false otherwise
     */
    private boolean active = true;

    private final List<EquationTerm<V, E>> terms = new ArrayList<>();

    private final Map<Variable<V>, List<EquationTerm<V, E>>> termsByVariable = new TreeMap<>();

    Equation(int elementNum, E type, EquationSystem<V, E> equationSystem) {
        this.elementNum = elementNum;
        this.type = Objects.requireNonNull(type);
        this.equationSystem = Objects.requireNonNull(equationSystem);
    }

    public int getElementNum() {
        return elementNum;
    }

    public E getType() {
        return type;
    }

    public EquationSystem<V, E> getEquationSystem() {
        return equationSystem;
    }

    public int getColumn() {
        return column;
    }

    void setColumn(int column) {
        this.column = column;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        if (active != this.active) {
            this.active = active;
            equationSystem.notifyEquationChange(this, active ? EquationEventType.EQUATION_ACTIVATED : EquationEventType.EQUATION_DEACTIVATED);
        }
    }

    public Equation<V, E> addTerm(EquationTerm<V, E> term) {
        Objects.requireNonNull(term);
        if (term.getEquation() != null) {
            throw new PowsyblException("Equation term already added to another equation: " + term.getEquation());
        }
        term.setEquation(this);
        terms.add(term);
        for (Variable<V> v : term.getVariables()) {
            termsByVariable.computeIfAbsent(v, k -> new ArrayList<>())
                    .add(term);
        }
        equationSystem.notifyEquationTermChange(term, EquationEventType.EQUATION_TERM_ADDED);
        return this;
    }

    public Equation<V, E> addTerms(List<EquationTerm<V, E>> terms) {
        Objects.requireNonNull(terms);
        for (EquationTerm<V, E> term : terms) {
            addTerm(term);
        }
        return this;
    }

    public List<EquationTerm<V, E>> getTerms() {
        return terms;
    }

    public Set<Variable<V>> getVariables() {
        return termsByVariable.keySet();
    }

    public double eval() {
        double value = 0;
        for (EquationTerm<V, E> term : terms) {
            if (term.isActive()) {
                value += term.eval();
            }
        }
        return value;
    }

    /**
     * Calls the handler once per variable with the sum of the coefficients of the active terms, in variable order.
     */
    public void der(DerHandler<V> handler) {
        Objects.requireNonNull(handler);
        for (Map.Entry<Variable<V>, List<EquationTerm<V, E>>> e : termsByVariable.entrySet()) {
            Variable<V> variable = e.getKey();
            if (variable.getRow() != -1) {
                double value = 0;
                for (EquationTerm<V, E> term : e.getValue()) {
                    if (term.isActive()) {
                        value += term.der(variable);
                    }
                }
                handler.onDer(variable, value);
            }
        }
    }

    @Override
    public int hashCode() {
        return elementNum + type.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj instanceof Equation<?, ?> equation) {
            return elementNum == equation.elementNum && type == equation.type;
        }
        return false;
    }

    @Override
    public int compareTo(Equation<V, E> o) {
        if (o == this) {
            return 0;
        }
        int c = elementNum - o.elementNum;
        if (c == 0) {
            c = type.ordinal() - o.type.ordinal();
        }
        return c;
    }

    public void write(Writer writer) throws IOException {
        writer.write(type.getSymbol());
        writer.write(Integer.toString(elementNum));
        writer.write(" = ");
        boolean first = true;
        for (EquationTerm<V, E> term : terms) {
            if (term.isActive()) {
                if (!first) {
                    writer.write(" + ");
                }
                term.write(writer);
                first = false;
            }
        }
        writer.write(System.lineSeparator());
    }

    @Override
    public String toString() {
        return "Equation(elementNum=" + elementNum + ", type=" + type + ", column=" + column + ")";
    }
}
