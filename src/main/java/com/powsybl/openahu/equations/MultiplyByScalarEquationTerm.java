/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.equations;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Objects;
import java.util.function.DoubleSupplier;

/**
 * Scales a term by a coefficient read at each evaluation, so that an assembled system can be updated without being
 * rebuilt.
 *
 * @author Open AHU developers
 */
public class MultiplyByScalarEquationTerm<V extends Enum<V> & Quantity, E extends Enum<E> & Quantity> extends AbstractEquationTerm<V, E> {

    private final EquationTerm<V, E> term;

    private final DoubleSupplier scalarSupplier;

    MultiplyByScalarEquationTerm(EquationTerm<V, E> term, DoubleSupplier scalarSupplier) {
        this.term = Objects.requireNonNull(term);
        this.scalarSupplier = Objects.requireNonNull(scalarSupplier);
    }

    @Override
    public void setEquation(Equation<V, E> equation) {
        super.setEquation(equation);
        term.setEquation(equation);
    }

    @Override
    public List<Variable<V>> getVariables() {
        return term.getVariables();
    }

    @Override
    public double eval() {
        return scalarSupplier.getAsDouble() * term.eval();
    }

    @Override
    public double der(Variable<V> variable) {
        return scalarSupplier.getAsDouble() * term.der(variable);
    }

    @Override
    public void write(Writer writer) throws IOException {
        writer.write(Double.toString(scalarSupplier.getAsDouble()));
        writer.write(" * ");
        term.write(writer);
    }
}
