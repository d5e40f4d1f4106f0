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

/**
 * @author Open AHU developers
 */
public class VariableEquationTerm<V extends Enum<V> & Quantity, E extends Enum<E> & Quantity> extends AbstractEquationTerm<V, E> {

    private final List<Variable<V>> variables;

    VariableEquationTerm(Variable<V> variable) {
        this.variables = List.of(Objects.requireNonNull(variable));
    }

    public Variable<V> getVariable() {
        return variables.get(0);
    }

    @Override
    public List<Variable<V>> getVariables() {
        return variables;
    }

    @Override
    public double eval() {
        return sv.get(getVariable().getRow());
    }

    @Override
    public double der(Variable<V> variable) {
        return variable.equals(getVariable()) ? 1 : 0;
    }

    @Override
    public void write(Writer writer) throws IOException {
        getVariable().write(writer);
    }
}
