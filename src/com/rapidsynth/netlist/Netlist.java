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

import org.jetbrains.annotations.NotNull;

/**
 * Arena of instances and nets. Instances are addressed by their id, which is
 * their index in the arena; freeing an instance clears its slot. All edits of
 * the connectivity go through this class so the bookkeeping on both ends of
 * an edge stays consistent.
 */
public class Netlist {

    private final String name;

    private final List<Instance> instances = new ArrayList<>();

    private int netCount;

    private int liveCount;

    public Netlist(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * Allocates a new instance with one output net.
     * @param instName Name of the instance, used in messages only.
     * @param kind Kind of the gate.
     * @param outputWidth Width of the output net.
     * @param inputWidths Width accepted by each input, -1 for any width.
     * @return The new, unconnected instance.
     */
    public Instance createInstance(String instName, ModuleKind kind, int outputWidth, int... inputWidths) {
        Instance inst = new Instance(this, instances.size(), instName, kind, inputWidths);
        inst.setOutputs(new Net[] {new Net(netCount++, inst, 0, outputWidth)});
        instances.add(inst);
        liveCount++;
        return inst;
    }

    /**
     * Gets the live instance with the provided id.
     * @param id Id of the instance.
     * @return The instance or null if it was freed or never allocated.
     */
    public Instance getInstance(int id) {
        if (id < 0 || id >= instances.size()) return null;
        return instances.get(id);
    }

    /**
     * @return Live instances in creation order.
     */
    public List<Instance> getInstances() {
        List<Instance> live = new ArrayList<>(liveCount);
        for (Instance inst : instances) {
            if (inst != null) live.add(inst);
        }
        return live;
    }

    public int getInstanceCount() {
        return liveCount;
    }

    public boolean contains(Instance inst) {
        return inst.getNetlist() == this && getInstance(inst.getId()) == inst;
    }

    /**
     * Connects an unconnected input pin to a net.
     * @param pin The pin to drive.
     * @param net The driver.
     */
    public void connect(@NotNull InputPin pin, @NotNull Net net) {
        checkLive(pin.getInstance());
        checkLive(net.getParentInstance());
        if (pin.getDriver() != null) {
            throw new NetlistException("ERROR: Input " + pin + " is already driven by " + pin.getDriver());
        }
        if (pin.getExpectedWidth() >= 0 && pin.getExpectedWidth() != net.getWidth()) {
            throw new NetlistException("ERROR: Width mismatch connecting " + net + " (" + net.getWidth()
                    + " bits) to " + pin + " (" + pin.getExpectedWidth() + " bits)");
        }
        pin.setDriver(net);
        net.addSink(pin);
    }

    /**
     * Clears the driver of an input pin. Neither the pin's instance nor the
     * driving net are destroyed.
     * @param pin The pin to disconnect.
     * @return The former driver, or null if the pin was not connected.
     */
    public Net disconnect(@NotNull InputPin pin) {
        checkLive(pin.getInstance());
        Net driver = pin.getDriver();
        if (driver == null) return null;
        boolean removed = driver.removeSink(pin);
        assert(removed);
        pin.setDriver(null);
        return driver;
    }

    /**
     * Moves every sink of a net to another net.
     * @param from The net losing its readers.
     * @param to The net gaining them.
     */
    public void redirectInputs(@NotNull Net from, @NotNull Net to) {
        if (from == to) return;
        checkLive(to.getParentInstance());
        if (from.getWidth() != to.getWidth()) {
            throw new NetlistException("ERROR: Cannot redirect readers of " + from + " (" + from.getWidth()
                    + " bits) to " + to + " (" + to.getWidth() + " bits)");
        }
        for (InputPin pin : from.takeSinks()) {
            pin.setDriver(to);
            to.addSink(pin);
        }
    }

    /**
     * Releases an instance. It must be fully disconnected: none of its inputs
     * is driven and none of its outputs is read.
     * @param inst The instance to free.
     */
    public void freeInstance(@NotNull Instance inst) {
        checkLive(inst);
        for (InputPin pin : inst.getInputs()) {
            if (pin.isConnected()) {
                throw new NetlistException("ERROR: Cannot free " + inst + ", input " + pin.getName()
                        + " is still driven by " + pin.getDriver());
            }
        }
        for (Net out : inst.getOutputs()) {
            if (out.isConnected()) {
                throw new NetlistException("ERROR: Cannot free " + inst + ", output " + out + " is read by "
                        + out.getFirstSink());
            }
        }
        instances.set(inst.getId(), null);
        inst.markFreed();
        liveCount--;
    }

    /**
     * Disconnects all inputs of an instance and frees it. Its outputs must
     * already be unread.
     * @param inst The instance to remove.
     */
    public void disconnectAndFree(@NotNull Instance inst) {
        for (InputPin pin : inst.getInputs()) {
            disconnect(pin);
        }
        freeInstance(inst);
    }

    private void checkLive(Instance inst) {
        if (inst.isFreed() || inst.getNetlist() != this) {
            throw new NetlistException("ERROR: Instance " + inst + " does not belong to netlist " + name
                    + " or was freed");
        }
    }

    @Override
    public String toString() {
        return name;
    }
}
