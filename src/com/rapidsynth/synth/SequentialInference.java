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

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Map.Entry;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import com.rapidsynth.netlist.InputPin;
import com.rapidsynth.netlist.Instance;
import com.rapidsynth.netlist.ModuleKind;
import com.rapidsynth.netlist.Net;
import com.rapidsynth.netlist.Netlist;
import com.rapidsynth.netlist.NetlistBuilder;
import com.rapidsynth.netlist.NetlistChecker;
import com.rapidsynth.netlist.NetlistTools;
import com.rapidsynth.netlist.SourceLocation;
import com.rapidsynth.util.MessageGenerator;
import com.rapidsynth.util.Pair;
import com.rapidsynth.util.Params;

/**
 * Infers memory elements from the mux chains the front end builds for
 * sequential assignments.
 *
 * The front end calls {@link #infer} once per assignment of a wire with the
 * proposed new value and the previous value of the wire. Depending on the
 * shape of the new value, the assignment becomes a plain concurrent
 * assignment, a flip-flop (possibly with enable, initial value and
 * asynchronous reset) or, for a loop that is never observed, an assignment
 * whose feedback is cut with an undefined value. Anything else, latches in
 * particular, is reported as a {@link SynthesisException}.
 *
 * The netlist is modified in place. This class is not thread safe.
 */
public class SequentialInference {

    public enum Outcome {
        PLAIN_ASSIGNMENT,
        FALSE_LOOP,
        DFF,
        IDFF,
        ADFF,
        IADFF,
    }

    private final NetlistBuilder builder;

    private final ResetChainCollapser resetCollapser;

    private final Map<Outcome, Integer> stats = new EnumMap<>(Outcome.class);

    private boolean verbose = Params.RS_VERBOSE_INFERENCE;

    private boolean checkNetlist = Params.RS_CHECK_NETLIST;

    public SequentialInference(NetlistBuilder builder) {
        this.builder = builder;
        this.resetCollapser = new ResetChainCollapser(builder);
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    public void setCheckNetlist(boolean checkNetlist) {
        this.checkNetlist = checkNetlist;
    }

    /**
     * Classifies and rewrites one assignment.
     * @param wire The wire assigned.
     * @param offset Offset of the assigned bits in the wire.
     * @param val The new value of the assigned bits.
     * @param prevVal The previous value of the wire.
     * @param loc Location of the assignment.
     */
    public void infer(@NotNull WireId wire, int offset, @NotNull Net val, @NotNull Net prevVal,
            @NotNull SourceLocation loc) {
        builder.setLocation(loc);
        LoopInfo loop;
        if (!prevVal.isConnected()) {
            // An unread previous value cannot be part of a loop
            loop = LoopInfo.NO_LOOP;
        } else {
            loop = LoopLocator.findLongestLoop(val, prevVal);
        }

        if (!loop.hasLoop()) {
            wire.addConcurrentAssignment(val, offset, loc);
            count(Outcome.PLAIN_ASSIGNMENT);
            return;
        }

        Instance lastMux = loop.getMux();
        Pair<Net, Net> clock = ClockExtractor.extractClock(NetlistTools.getMux2Sel(lastMux).getDriver());
        if (clock.getFirst() == null) {
            inferLatch(wire, offset, val, prevVal, loc);
        } else {
            inferFF(wire, offset, prevVal, lastMux, clock.getFirst(), clock.getSecond(), loc);
        }
    }

    /**
     * Handles a loop without clock. Only false loops are supported: every
     * reader of the previous value is redirected to an undefined constant,
     * which cuts the loop, and the new value becomes a plain assignment.
     */
    void inferLatch(WireId wire, int offset, Net val, Net prevVal, SourceLocation loc) {
        if (!FalseLoopDetector.isFalseLoop(prevVal)) {
            if (prevVal.getParentInstance().getKind() == ModuleKind.OUTPUT) {
                throw SynthesisException.unsupported(loc, "Latch inferred for output " + wire.getName());
            }
            throw SynthesisException.unsupported(loc, "Latch or combinational loop inferred for "
                    + wire.getName());
        }
        Net x = builder.buildConstX(prevVal.getWidth());
        builder.getNetlist().redirectInputs(prevVal, x);
        wire.addConcurrentAssignment(val, offset, loc);
        count(Outcome.FALSE_LOOP);
        if (verbose) {
            MessageGenerator.briefMessage("INFO: " + loc + ": false loop on " + wire.getName() + " cut with "
                    + x.getParentInstance().getName());
        }
    }

    /**
     * Replaces the loop-closing mux with a flip-flop.
     */
    void inferFF(WireId wire, int offset, Net prevVal, Instance lastMux, @NotNull Net clk,
            @Nullable Net enable, SourceLocation loc) {
        Netlist netlist = builder.getNetlist();
        Net out = lastMux.getOutput(0);

        // 1. Remove the mux that creates the loop. There must be no else
        //    branch for the clock condition.
        InputPin selPin = NetlistTools.getMux2Sel(lastMux);
        InputPin i0 = NetlistTools.getMux2I0(lastMux);
        InputPin i1 = NetlistTools.getMux2I1(lastMux);
        Net prevSlice = i0.getDriver();
        if (prevSlice == null || skipExtract(prevSlice, offset) != prevVal) {
            throw SynthesisException.unsupported(loc, "Clocked assignment of " + wire.getName()
                    + " has an else branch (mux " + lastMux.getName() + " does not keep the previous value)");
        }
        netlist.disconnect(selPin);
        netlist.disconnect(i0);
        Net data = netlist.disconnect(i1);
        if (data == null) {
            throw SynthesisException.unsupported(loc, "Mux " + lastMux.getName() + " has no data input");
        }

        // 2. Initial value of the signal, if any.
        Net init = null;
        Instance sig = prevVal.getParentInstance();
        if (sig.getKind() == ModuleKind.ISIGNAL) {
            init = builder.buildExtractIfNeeded(sig.getInputNet(1), offset, out.getWidth());
        }

        // 3. Asynchronous set/reset are muxes after the loop mux.
        Pair<Net, Net> reset = resetCollapser.collapse(out, loc);

        if (enable != null) {
            data = builder.buildMux2(enable, prevSlice, data);
        }

        ModuleKind kind = ModuleKind.getFlipFlop(init != null, reset != null);
        Net res;
        switch (kind) {
            case DFF:
                res = builder.buildDff(clk, data);
                break;
            case IDFF:
                res = builder.buildIdff(clk, data, init);
                break;
            case ADFF:
                res = builder.buildAdff(clk, data, reset.getFirst(), reset.getSecond());
                break;
            default:
                res = builder.buildIadff(clk, data, reset.getFirst(), reset.getSecond(), init);
                break;
        }
        Instance ff = res.getParentInstance();
        ff.copyLocation(lastMux);

        // The output may already be read (if the target is a variable).
        netlist.redirectInputs(out, res);
        netlist.freeInstance(lastMux);

        wire.addConcurrentAssignment(res, offset, loc);
        count(Outcome.valueOf(kind.name()));
        if (verbose) {
            MessageGenerator.briefMessage("INFO: " + loc + ": inferred " + kind + " " + ff.getName() + " for "
                    + wire.getName() + "[" + (offset + res.getWidth() - 1) + ":" + offset + "]"
                    + (enable != null ? " with enable" : "")
                    + (reset != null ? " with " + resetCollapser.getLastResetCount() + " reset(s)" : ""));
        }
        if (checkNetlist) {
            NetlistChecker.assertValid(netlist);
        }
    }

    /**
     * Strips a slice of the previous value taken at the assignment offset.
     */
    static Net skipExtract(Net n, int offset) {
        Instance inst = n.getParentInstance();
        if (inst.getKind() == ModuleKind.EXTRACT && inst.getParam(Instance.PARAM_OFFSET) == offset) {
            Net input = inst.getInputNet(0);
            return input == null ? n : input;
        }
        return n;
    }

    private void count(Outcome outcome) {
        stats.merge(outcome, 1, Integer::sum);
    }

    /**
     * @return Number of assignments per outcome since this object was created.
     */
    public Map<Outcome, Integer> getStatistics() {
        return Collections.unmodifiableMap(stats);
    }

    public int getCount(Outcome outcome) {
        return stats.getOrDefault(outcome, 0);
    }

    public void printStatistics() {
        MessageGenerator.printHeader("Sequential Inference");
        for (Entry<Outcome, Integer> e : stats.entrySet()) {
            MessageGenerator.briefMessage(String.format("%-20s : %6d", e.getKey(), e.getValue()));
        }
    }
}
