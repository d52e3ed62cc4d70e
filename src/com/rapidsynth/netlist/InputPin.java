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

/**
 * An input slot of an {@link Instance}. It refers to at most one driving
 * {@link Net}, the reference is non-owning: disconnecting the pin leaves both
 * the net and the instance alive.
 */
public class InputPin {

    private final Instance inst;

    private final int index;

    private final int expectedWidth;

    private Net driver;

    protected InputPin(Instance inst, int index, int expectedWidth) {
        this.inst = inst;
        this.index = index;
        this.expectedWidth = expectedWidth;
    }

    /**
     * @return The instance owning this pin.
     */
    public Instance getInstance() {
        return inst;
    }

    public int getIndex() {
        return index;
    }

    public String getName() {
        return inst.getKind().getInputName(index);
    }

    /**
     * @return The width a net must have to be connected to this pin, or -1
     *         if any width is accepted.
     */
    public int getExpectedWidth() {
        return expectedWidth;
    }

    /**
     * @return The net driving this pin or null if the pin is not connected.
     */
    public Net getDriver() {
        return driver;
    }

    public boolean isConnected() {
        return driver != null;
    }

    protected void setDriver(Net driver) {
        this.driver = driver;
    }

    public String getFullName() {
        return inst.getName() + "/" + getName();
    }

    @Override
    public String toString() {
        return getFullName();
    }
}
