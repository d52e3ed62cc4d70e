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

import com.rapidsynth.netlist.InputPin;
import com.rapidsynth.netlist.Instance;
import com.rapidsynth.netlist.ModuleKind;
import com.rapidsynth.netlist.Net;
import com.rapidsynth.netlist.Netlist;
import com.rapidsynth.netlist.NetlistBuilder;
import com.rapidsynth.netlist.NetlistTools;
import com.rapidsynth.netlist.SourceLocation;
import com.rapidsynth.util.Pair;
import com.rapidsynth.util.UniqueWorklist;

/**
 * Turns the muxes following a loop-closing mux into asynchronous reset
 * conditions. The muxes must form a linear chain: each link has exactly one
 * reader, a mux whose data branch continues the chain while the other branch
 * is the value forced by the reset. The chain ends at a link that is not read
 * or is read by something other than a mux. A chain that comes back to one
 * of its own muxes is rejected.
 *
 * The first mux of the chain is removed, its condition and value go to the
 * dedicated reset pins of the flip-flop. Later muxes are folded by OR-ing
 * their condition into the reset and taking their value as the reset value,
 * so the reset value of simultaneous resets is the one of the last mux in
 * the chain. The later muxes themselves are left in place.
 */
public class ResetChainCollapser {

    private final NetlistBuilder builder;

    private int lastResetCount;

    public ResetChainCollapser(NetlistBuilder builder) {
        this.builder = builder;
    }

    /**
     * @return The number of reset muxes folded by the last call to {@link #collapse}.
     */
    public int getLastResetCount() {
        return lastResetCount;
    }

    /**
     * Walks the chain starting at the output of the loop-closing mux.
     * @param out Output of the loop-closing mux, the future flip-flop output.
     * @param loc Location of the assignment, for diagnostics.
     * @return The reset condition and the reset value, or null if the chain is empty.
     */
    public Pair<Net, Net> collapse(Net out, SourceLocation loc) {
        Netlist netlist = builder.getNetlist();
        Net rst = null;
        Net rstVal = null;
        Net last = out;
        UniqueWorklist<Instance> chain = new UniqueWorklist<>();
        lastResetCount = 0;
        while (last.isConnected()) {
            if (!last.hasOneConnection()) {
                throw SynthesisException.unsupported(loc, "Net " + last + " has " + last.getSinkCount()
                        + " readers inside an asynchronous reset chain");
            }
            InputPin sink = last.getFirstSink();
            Instance mux = sink.getInstance();
            if (mux.getKind() != ModuleKind.MUX2) {
                // End of the chain, the value is read by the rest of the design
                break;
            }
            if (!chain.add(mux)) {
                throw SynthesisException.unsupported(loc, "Mux " + mux.getName()
                        + " is reached twice inside an asynchronous reset chain");
            }
            InputPin selPin = NetlistTools.getMux2Sel(mux);
            InputPin i0 = NetlistTools.getMux2I0(mux);
            InputPin i1 = NetlistTools.getMux2I1(mux);
            Net sel = selPin.getDriver();
            if (sel == null) {
                throw SynthesisException.unsupported(loc, "Mux " + mux.getName() + " has no select");
            }
            Net muxRst;
            Net muxRstVal;
            if (sink == i0) {
                muxRst = sel;
                muxRstVal = i1.getDriver();
            } else if (sink == i1) {
                // Reset is active low
                muxRst = builder.buildMonadic(ModuleKind.NOT, sel);
                muxRst.getParentInstance().copyLocation(mux);
                muxRstVal = i0.getDriver();
            } else {
                throw SynthesisException.unsupported(loc, "Net " + last + " is the select of " + mux
                        + " inside an asynchronous reset chain");
            }
            if (muxRstVal == null) {
                throw SynthesisException.unsupported(loc, "Mux " + mux.getName() + " has no reset value");
            }
            lastResetCount++;

            Net muxOut = mux.getOutput(0);
            if (rst == null) {
                // Dedicated pins of the flip-flop replace this mux
                netlist.disconnect(selPin);
                netlist.disconnect(i0);
                netlist.disconnect(i1);
                netlist.redirectInputs(muxOut, out);
                netlist.freeInstance(mux);
                rst = muxRst;
                rstVal = muxRstVal;
                last = out;
            } else {
                rst = builder.buildDyadic(ModuleKind.OR, muxRst, rst);
                rst.getParentInstance().copyLocation(mux);
                rstVal = muxRstVal;
                last = muxOut;
            }
        }
        return rst == null ? null : new Pair<>(rst, rstVal);
    }
}
