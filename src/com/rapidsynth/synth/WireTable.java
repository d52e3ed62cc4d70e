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
import java.util.Comparator;
import java.util.List;

import com.rapidsynth.netlist.Instance;
import com.rapidsynth.netlist.Net;
import com.rapidsynth.netlist.NetlistBuilder;
import com.rapidsynth.netlist.NetlistCleanup;
import com.rapidsynth.util.MessageGenerator;
import com.rapidsynth.util.Params;

/**
 * Allocates the wires of a design and, once every assignment went through
 * the inference, connects their accumulated values to their gates.
 */
public class WireTable {

    private final NetlistBuilder builder;

    private final List<WireId> wires = new ArrayList<>();

    private boolean removeUnusedInstances = Params.RS_REMOVE_UNUSED_INSTANCES;

    private boolean verbose = Params.RS_VERBOSE_INFERENCE;

    public WireTable(NetlistBuilder builder) {
        this.builder = builder;
    }

    public WireId allocSignal(String name, int width) {
        return add(new WireId(name, builder.buildSignal(name, width)));
    }

    /**
     * Allocates a signal with an initial value.
     */
    public WireId allocSignal(String name, Net init) {
        return add(new WireId(name, builder.buildIsignal(name, init)));
    }

    public WireId allocOutput(String name, int width) {
        return add(new WireId(name, builder.buildOutput(name, width)));
    }

    private WireId add(WireId wire) {
        wires.add(wire);
        return wire;
    }

    /**
     * @return Wires in allocation order.
     */
    public List<WireId> getWires() {
        return Collections.unmodifiableList(wires);
    }

    public void setRemoveUnusedInstances(boolean removeUnusedInstances) {
        this.removeUnusedInstances = removeUnusedInstances;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    /**
     * Connects the final value of a wire to its gate. Assignments are sorted
     * by offset and must not overlap; bits no assignment drives are undefined.
     * This can only be done once per wire.
     * @param wire The wire to finalize.
     */
    public void finalizeAssignments(WireId wire) {
        if (wire.isFinalized()) {
            throw new RuntimeException("ERROR: Wire " + wire.getName() + " is already finalized");
        }
        wire.markFinalized();
        List<ConcurrentAssignment> assigns = new ArrayList<>(wire.getConcurrentAssignments());
        if (assigns.isEmpty()) {
            if (verbose && wire.getPreviousValue().isConnected()) {
                MessageGenerator.briefError("WARNING: " + wire.getName() + " is read but never assigned");
            }
            return;
        }
        assigns.sort(Comparator.comparingInt(ConcurrentAssignment::getOffset));

        Instance gate = wire.getGate();
        builder.setLocation(gate.getLocation());
        int width = wire.getWidth();
        Net value;
        if (assigns.size() == 1 && assigns.get(0).getWidth() == width) {
            value = assigns.get(0).getValue();
        } else {
            List<Net> pieces = new ArrayList<>();
            int expected = 0;
            ConcurrentAssignment prev = null;
            for (ConcurrentAssignment a : assigns) {
                if (a.getOffset() < expected) {
                    throw new SynthesisException(SynthesisException.Kind.OVERLAPPING_ASSIGNMENT, a.getLocation(),
                            "Assignment " + a + " of " + wire.getName() + " overlaps " + prev);
                }
                if (a.getOffset() > expected) {
                    pieces.add(builder.buildConstX(a.getOffset() - expected));
                }
                pieces.add(a.getValue());
                expected = a.getEnd();
                prev = a;
            }
            if (expected < width) {
                pieces.add(builder.buildConstX(width - expected));
            }
            value = builder.buildConcat(pieces.toArray(new Net[0]));
        }
        builder.getNetlist().connect(gate.getInput(0), value);
    }

    /**
     * Finalizes every wire not finalized yet, in allocation order, then
     * removes the instances left unused if enabled.
     */
    public void finalizeAll() {
        for (WireId wire : wires) {
            if (!wire.isFinalized()) {
                finalizeAssignments(wire);
            }
        }
        if (removeUnusedInstances) {
            int removed = NetlistCleanup.removeUnusedInstances(builder.getNetlist());
            if (verbose) {
                MessageGenerator.briefMessage("INFO: Removed " + removed + " unused instances from "
                        + builder.getNetlist().getName());
            }
        }
    }
}
