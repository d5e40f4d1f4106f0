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
import java.util.function.DoubleSupplier;

/**
 * A term of a linear equation: a sum of variables weighted by coefficients that may change between two solves.
 *
 * @author Open AHU developers
 */
public interface EquationTerm<V extends Enum<V> & Quantity, E extends Enum<E> & Quantity> {

    boolean isActive();

    void setActive(boolean active);

    Equation<V, E> getEquation();

    void setEquation(Equation<V, E> equation);

    /**
     * Get the list of variable this equation term depends on.
     * @return the list of variable this equation term depends on.
     */
    List<Variable<V>> getVariables();

    /**
     * Evaluate the term with the values of the state vector.
     */
    double eval();

    /**
     * Coefficient of the given variable in this term.
     */
    double der(Variable<V> variable);

    void write(Writer writer) throws IOException;

    default EquationTerm<V, E> multiply(DoubleSupplier scalarSupplier) {
        return new MultiplyByScalarEquationTerm<>(this, scalarSupplier);
    }

    default EquationTerm<V, E> multiply(double scalar) {
        return multiply(() -> scalar);
    }

    default EquationTerm<V, E> minus() {
        return multiply(-1);
    }
}
