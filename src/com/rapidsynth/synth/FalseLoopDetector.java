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
import com.rapidsynth.util.UniqueWorklist;

/**
 * Decides whether an unclocked loop is an artifact of partial assignments.
 * The loop is false when the previous value only flows through muxes: it is
 * then never observed outside the mux fan that shadows it.
 */
public class FalseLoopDetector {

    /**
     * Computes the closure of mux readers starting from the previous value.
     * @param prevVal The previous value of the signal.
     * @return True if every reader of prevVal, and every reader of the outputs
     *         of those readers (transitively), is a mux.
     */
    public static boolean isFalseLoop(Net prevVal) {
        UniqueWorklist<Instance> muxes = new UniqueWorklist<>();
        if (!addReaders(prevVal, muxes)) {
            return false;
        }
        for (int i = 0; i < muxes.size(); i++) {
            if (!addReaders(muxes.get(i).getOutput(0), muxes)) {
                return false;
            }
        }
        return true;
    }

    private static boolean addReaders(Net net, UniqueWorklist<Instance> muxes) {
        for (InputPin pin : net.getSinks()) {
            Instance reader = pin.getInstance();
            if (reader.getKind() != ModuleKind.MUX2) {
                return false;
            }
            muxes.add(reader);
        }
        return true;
    }
}
