/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openahu.equations;

import java.util.Objects;

/**
 * @author Open AHU developers
 */
public abstract class AbstractEquationTerm<V extends Enum<V> & Quantity, E extends Enum<E> & Quantity> implements EquationTerm<V, E> {

    private Equation<V, E> equation;

    private boolean active = true;

    protected StateVector sv;

    @Override
    public Equation<V, E> getEquation() {
        return equation;
    }

    @Override
    public void setEquation(Equation<V, E> equation) {
        this.equation = Objects.requireNonNull(equation);
        setStateVector(equation.getEquationSystem().getStateVector());
    }

    protected void setStateVector(StateVector sv) {
        this.sv = Objects.requireNonNull(sv);
    }

    @Override
    public boolean isActive() {
        return active;
    }

    @Override
    public void setActive(boolean active) {
        if (this.active != active) {
            this.active = active;
            if (equation != null) {
                equation.getEquationSystem().notifyEquationTermChange(this, active ? EquationEventType.EQUATION_TERM_ACTIVATED
                                                                                        : EquationEventType.EQUATION_TERM_DEACTIVATED);
            }
        }
    }
}
