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
package com.rapidsynth.netlist;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Dead-code elimination. Instances whose outputs are not read are freed,
 * and so on transitively through their drivers. Signals, outputs and
 * {@link ModuleKind#OTHER} gates are never removed.
 */
public class NetlistCleanup {

    public static boolean isRemovable(Instance inst) {
        ModuleKind kind = inst.getKind();
        return !kind.isSignal() && kind != ModuleKind.OTHER;
    }

    private static boolean isUnused(Instance inst) {
        for (Net out : inst.getOutputs()) {
            if (out.isConnected()) return false;
        }
        return true;
    }

    /**
     * Frees every removable instance that does not contribute to a root.
     * @param netlist The netlist to clean.
     * @return The number of freed instances.
     */
    public static int removeUnusedInstances(Netlist netlist) {
        Deque<Instance> queue = new ArrayDeque<>();
        for (Instance inst : netlist.getInstances()) {
            if (isRemovable(inst) && isUnused(inst)) {
                queue.add(inst);
            }
        }
        int count = 0;
        while (!queue.isEmpty()) {
            Instance inst = queue.poll();
            if (inst.isFreed()) continue;
            for (InputPin pin : inst.getInputs()) {
                Net driver = netlist.disconnect(pin);
                if (driver == null) continue;
                Instance src = driver.getParentInstance();
                if (isRemovable(src) && isUnused(src)) {
                    queue.add(src);
                }
            }
            netlist.freeInstance(inst);
            count++;
        }
        return count;
    }
}
