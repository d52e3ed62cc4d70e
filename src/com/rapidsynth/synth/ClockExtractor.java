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

import com.rapidsynth.netlist.Instance;
import com.rapidsynth.netlist.ModuleKind;
import com.rapidsynth.netlist.Net;
import com.rapidsynth.util.Pair;

/**
 * Recognizes clock conditions. Conditions are assumed canonicalized: a clock
 * condition is the output of an {@link ModuleKind#EDGE} gate, or an AND whose
 * clock operand comes first. No further boolean simplification is done.
 */
public class ClockExtractor {

    /**
     * Checks if a condition carries a clock edge.
     * @param cond The condition net, may be null.
     * @return True if cond is an edge, or an AND whose first operand (recursively) is one.
     */
    public static boolean hasClock(Net cond) {
        Net n = cond;
        while (n != null) {
            Instance inst = n.getParentInstance();
            switch (inst.getKind()) {
                case EDGE:
                    return true;
                case AND:
                    n = inst.getInputNet(0);
                    break;
                default:
                    return false;
            }
        }
        return false;
    }

    /**
     * Splits a condition into a clock and an enable.
     *
     * For an AND condition, the AND gate is left in place even though it is
     * no longer needed by the flip-flop: its output may still be read, and
     * unused gates are removed later by {@link com.rapidsynth.netlist.NetlistCleanup}.
     *
     * @param cond The select of a loop-closing mux.
     * @return The clock (the signal the edge gate samples) and the enable,
     *         which is null for a bare edge. Both are null if cond has
     *         another shape.
     */
    public static Pair<Net, Net> extractClock(Net cond) {
        Instance inst = cond.getParentInstance();
        switch (inst.getKind()) {
            case EDGE:
                return new Pair<>(inst.getInputNet(0), null);
            case AND: {
                Net left = inst.getInputNet(0);
                Net right = inst.getInputNet(1);
                if (isEdge(left)) {
                    return new Pair<>(left.getParentInstance().getInputNet(0), right);
                }
                if (isEdge(right)) {
                    return new Pair<>(right.getParentInstance().getInputNet(0), left);
                }
                break;
            }
            default:
                break;
        }
        return new Pair<>(null, null);
    }

    private static boolean isEdge(Net n) {
        return n != null && n.getParentInstance().isKind(ModuleKind.EDGE);
    }
}
