/*
 *
 * Copyright (c) 2024, RapidSynth Contributors.
 * All rights reserved.
 *
 * This file is part of RapidSynth.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */
package com.rapidsynth.synth;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.rapidsynth.netlist.Instance;
import com.rapidsynth.netlist.Net;
import com.rapidsynth.netlist.SourceLocation;

/**
 * A signal or variable being assigned. The gate is the storage placeholder
 * whose output is the previous value; the inference accumulates the values
 * the wire is continuously assigned, which {@link WireTable} later connects
 * to the gate.
 */
public class WireId {

    private final String name;

    private final Instance gate;

    private final List<ConcurrentAssignment> assigns = new ArrayList<>();

    private boolean finalized;

    public WireId(String name, Instance gate) {
        if (!gate.getKind().isSignal()) {
            throw new IllegalArgumentException("ERROR: Gate of wire " + name + " must be a signal, found " + gate);
        }
        this.name = name;
        this.gate = gate;
    }

    public String getName() {
        return name;
    }

    public Instance getGate() {
        return gate;
    }

    public int getWidth() {
        return getPreviousValue().getWidth();
    }

    public Net getPreviousValue() {
        return gate.getOutput(0);
    }

    /**
     * Records that bits [offset, offset + width of value) of the wire are
     * driven by value.
     */
    public void addConcurrentAssignment(Net value, int offset, SourceLocation loc) {
        if (finalized) {
            throw new RuntimeException("ERROR: Wire " + name + " is already finalized");
        }
        if (offset < 0 || offset + value.getWidth() > getWidth()) {
            throw SynthesisException.unsupported(loc, "Assignment of " + value.getWidth() + " bits at offset "
                    + offset + " is out of the bounds of " + name + " (" + getWidth() + " bits)");
        }
        assigns.add(new ConcurrentAssignment(value, offset, loc));
    }

    /**
     * @return The assignments, in the order they were recorded.
     */
    public List<ConcurrentAssignment> getConcurrentAssignments() {
        return Collections.unmodifiableList(assigns);
    }

    public boolean isFinalized() {
        return finalized;
    }

    void markFinalized() {
        finalized = true;
    }

    @Override
    public String toString() {
        return name;
    }
}
