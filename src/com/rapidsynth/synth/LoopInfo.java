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

/**
 * Result of {@link LoopLocator#findLongestLoop}. A negative distance means
 * the new value does not depend on the previous one, zero means the new
 * value is the previous one. A positive distance is the length of the mux
 * chain and {@link #getMux()} is the mux closing the loop.
 */
public class LoopInfo {

    public static final LoopInfo NO_LOOP = new LoopInfo(null, -1);

    public static final LoopInfo SELF_ASSIGNMENT = new LoopInfo(null, 0);

    private final Instance mux;

    private final int distance;

    public LoopInfo(Instance mux, int distance) {
        this.mux = mux;
        this.distance = distance;
    }

    /**
     * @return The loop-closing mux, null unless {@link #hasLoop()}.
     */
    public Instance getMux() {
        return mux;
    }

    public int getDistance() {
        return distance;
    }

    public boolean hasLoop() {
        return distance > 0;
    }

    public boolean isSelfAssignment() {
        return distance == 0;
    }

    @Override
    public String toString() {
        if (distance < 0) return "no loop";
        if (distance == 0) return "self assignment";
        return "loop of " + distance + " closed by " + mux;
    }
}
