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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Map;

import com.rapidsynth.netlist.Instance;
import com.rapidsynth.netlist.ModuleKind;
import com.rapidsynth.netlist.Net;
import com.rapidsynth.netlist.NetlistTools;

/**
 * Finds the longest chain of muxes leading from the new value of a signal
 * back to its previous value. Such a chain means the signal memorizes its
 * value. The walk uses an explicit stack, mux chains of nested conditions can
 * be arbitrarily deep.
 */
public class LoopLocator {

    /**
     * Walks the mux tree driving val.
     *
     * A mux whose select carries a clock closes the loop by itself, the walk
     * does not go past it. Otherwise both branches are measured and the
     * longer one wins; input 1 is only preferred when its chain is strictly
     * longer.
     *
     * @param val The new value of the signal.
     * @param prevVal The previous value of the signal.
     * @return The loop-closing mux and the chain length, see {@link LoopInfo}.
     */
    public static LoopInfo findLongestLoop(Net val, Net prevVal) {
        Map<Net, LoopInfo> done = new IdentityHashMap<>();
        Map<Net, Boolean> onStack = new IdentityHashMap<>();
        Deque<Net> stack = new ArrayDeque<>();
        stack.push(val);
        while (!stack.isEmpty()) {
            Net n = stack.peek();
            if (done.containsKey(n)) {
                stack.pop();
                continue;
            }
            Instance inst = n.getParentInstance();
            if (inst.getKind() != ModuleKind.MUX2) {
                done.put(n, n == prevVal ? LoopInfo.SELF_ASSIGNMENT : LoopInfo.NO_LOOP);
                stack.pop();
                continue;
            }
            Net sel = NetlistTools.getMux2Sel(inst).getDriver();
            Net i0 = NetlistTools.getMux2I0(inst).getDriver();
            Net i1 = NetlistTools.getMux2I1(inst).getDriver();
            if (sel == null || i0 == null || i1 == null) {
                throw SynthesisException.unsupported(inst.getLocation(), "Mux " + inst.getName()
                        + " has an unconnected input");
            }
            if (ClockExtractor.hasClock(sel)) {
                done.put(n, new LoopInfo(inst, 1));
                stack.pop();
                continue;
            }
            LoopInfo r0 = done.get(i0);
            LoopInfo r1 = done.get(i1);
            if (r0 == null || r1 == null) {
                if (onStack.put(n, Boolean.TRUE) != null) {
                    throw SynthesisException.unsupported(inst.getLocation(), "Mux " + inst.getName()
                            + " is part of a combinational cycle");
                }
                if (r1 == null) stack.push(i1);
                if (r0 == null) stack.push(i0);
                continue;
            }
            onStack.remove(n);
            done.put(n, combine(inst, r0, r1));
            stack.pop();
        }
        return done.get(val);
    }

    /**
     * Merges the results of both branches of a mux.
     * Input 1 has a higher priority than input 0 in case the selector is a
     * clock.
     */
    static LoopInfo combine(Instance mux, LoopInfo r0, LoopInfo r1) {
        if (r1.getDistance() > r0.getDistance()) {
            return new LoopInfo(r1.getDistance() > 0 ? r1.getMux() : mux, r1.getDistance() + 1);
        }
        if (r0.getDistance() >= 0) {
            return new LoopInfo(r0.getDistance() > 0 ? r0.getMux() : mux, r0.getDistance() + 1);
        }
        return LoopInfo.NO_LOOP;
    }
}
