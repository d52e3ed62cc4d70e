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

import java.util.ArrayList;
import java.util.List;

/**
 * Static query helpers over a {@link Netlist}.
 */
public class NetlistTools {

    public static final int MUX2_SEL = 0;

    public static final int MUX2_I0 = 1;

    public static final int MUX2_I1 = 2;

    public static InputPin getMux2Sel(Instance mux) {
        checkKind(mux, ModuleKind.MUX2);
        return mux.getInput(MUX2_SEL);
    }

    public static InputPin getMux2I0(Instance mux) {
        checkKind(mux, ModuleKind.MUX2);
        return mux.getInput(MUX2_I0);
    }

    public static InputPin getMux2I1(Instance mux) {
        checkKind(mux, ModuleKind.MUX2);
        return mux.getInput(MUX2_I1);
    }

    /**
     * Checks if the net is the output of an instance of the provided kind.
     * @param net The net to check.
     * @param kind The expected kind of the driver.
     * @return True if the driver of net is of the provided kind.
     */
    public static boolean isDrivenBy(Net net, ModuleKind kind) {
        return net != null && net.getParentInstance().getKind() == kind;
    }

    public static boolean isConstNet(Net net) {
        ModuleKind kind = net.getParentInstance().getKind();
        return kind == ModuleKind.CONST || kind == ModuleKind.CONST_X;
    }

    /**
     * Gets the instances reading a net, one entry per sink (an instance
     * reading the net on several pins appears several times).
     * @param net The net.
     * @return Readers in connection order.
     */
    public static List<Instance> getReaders(Net net) {
        List<Instance> readers = new ArrayList<>(net.getSinkCount());
        for (InputPin pin : net.getSinks()) {
            readers.add(pin.getInstance());
        }
        return readers;
    }

    /**
     * Gets the pins of an instance driven by the provided net.
     * @param inst The reading instance.
     * @param net The driving net.
     * @return The list of pins of inst connected to net, possibly empty.
     */
    public static List<InputPin> getPinsDrivenBy(Instance inst, Net net) {
        List<InputPin> pins = new ArrayList<>(1);
        for (InputPin pin : inst.getInputs()) {
            if (pin.getDriver() == net) pins.add(pin);
        }
        return pins;
    }

    private static void checkKind(Instance inst, ModuleKind kind) {
        if (inst.getKind() != kind) {
            throw new NetlistException("ERROR: Expected a " + kind + " instance, found " + inst);
        }
    }
}
