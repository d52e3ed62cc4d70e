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
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * The output of an {@link Instance}. A net has exactly one driver, the
 * instance that owns it, and is read by zero or more {@link InputPin}s.
 * Its width is fixed at creation.
 */
public class Net extends NetlistObject {

    private final Instance parentInst;

    private final int width;

    private List<InputPin> sinks;

    protected Net(int id, Instance parentInst, int outputIdx, int width) {
        super(id, parentInst.getName() + "." + parentInst.getKind().getOutputName()
                + (outputIdx == 0 ? "" : Integer.toString(outputIdx)));
        if (width <= 0) {
            throw new NetlistException("ERROR: Invalid width " + width + " for output of instance "
                    + parentInst.getName());
        }
        this.parentInst = parentInst;
        this.width = width;
    }

    /**
     * @return The instance driving this net.
     */
    public Instance getParentInstance() {
        return parentInst;
    }

    public int getWidth() {
        return width;
    }

    /**
     * Gets the input pins reading this net, in connection order.
     * @return An unmodifiable view of the sinks.
     */
    public Collection<InputPin> getSinks() {
        return sinks == null ? Collections.emptyList() : Collections.unmodifiableList(sinks);
    }

    /**
     * @return The first input pin connected to this net or null if it is not read.
     */
    public InputPin getFirstSink() {
        return sinks == null || sinks.isEmpty() ? null : sinks.get(0);
    }

    public int getSinkCount() {
        return sinks == null ? 0 : sinks.size();
    }

    public boolean isConnected() {
        return getSinkCount() > 0;
    }

    public boolean hasOneConnection() {
        return getSinkCount() == 1;
    }

    protected void addSink(InputPin pin) {
        if (sinks == null) sinks = new ArrayList<>(2);
        sinks.add(pin);
    }

    protected boolean removeSink(InputPin pin) {
        if (sinks == null) return false;
        for (int i = 0; i < sinks.size(); i++) {
            if (sinks.get(i) == pin) {
                sinks.remove(i);
                return true;
            }
        }
        return false;
    }

    /**
     * Detaches all sinks from this net, used by {@link Netlist#redirectInputs(Net, Net)}.
     * @return The former sinks.
     */
    protected List<InputPin> takeSinks() {
        List<InputPin> old = sinks == null ? Collections.emptyList() : sinks;
        sinks = null;
        return old;
    }
}
