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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.jetbrains.annotations.NotNull;

/**
 * An occurrence of a gate of some {@link ModuleKind} inside a {@link Netlist}.
 * It owns its input pins and its output nets. Once freed through
 * {@link Netlist#freeInstance(Instance)} the instance must not be used anymore.
 */
public class Instance extends NetlistObject {

    /** Bit offset of an {@link ModuleKind#EXTRACT} */
    public static final String PARAM_OFFSET = "OFFSET";

    /** Value of a {@link ModuleKind#CONST} */
    public static final String PARAM_VALUE = "VALUE";

    private final Netlist netlist;

    private final ModuleKind kind;

    private final InputPin[] inputs;

    private Net[] outputs;

    private Map<String, Long> params;

    private SourceLocation location = SourceLocation.UNKNOWN;

    private boolean freed;

    protected Instance(Netlist netlist, int id, String name, ModuleKind kind, int[] inputWidths) {
        super(id, name);
        this.netlist = netlist;
        this.kind = kind;
        int count = kind.isVariadic() ? inputWidths.length : kind.getInputCount();
        if (inputWidths.length != count) {
            throw new NetlistException("ERROR: " + kind + " instance " + name + " expects " + count
                    + " inputs, got " + inputWidths.length);
        }
        this.inputs = new InputPin[count];
        for (int i = 0; i < count; i++) {
            inputs[i] = new InputPin(this, i, inputWidths[i]);
        }
    }

    protected void setOutputs(Net[] outputs) {
        this.outputs = outputs;
    }

    public Netlist getNetlist() {
        return netlist;
    }

    public ModuleKind getKind() {
        return kind;
    }

    public boolean isKind(ModuleKind k) {
        return kind == k;
    }

    public int getInputCount() {
        return inputs.length;
    }

    public InputPin getInput(int idx) {
        return inputs[idx];
    }

    public List<InputPin> getInputs() {
        return Collections.unmodifiableList(Arrays.asList(inputs));
    }

    /**
     * Gets the net driving the input at the provided index.
     * @param idx Index of the input.
     * @return The driver, or null if the input is not connected.
     */
    public Net getInputNet(int idx) {
        return inputs[idx].getDriver();
    }

    public int getOutputCount() {
        return outputs.length;
    }

    public Net getOutput(int idx) {
        return outputs[idx];
    }

    public List<Net> getOutputs() {
        return Collections.unmodifiableList(Arrays.asList(outputs));
    }

    public long getParam(String key) {
        Long value = params == null ? null : params.get(key);
        if (value == null) {
            throw new NetlistException("ERROR: Instance " + getName() + " has no parameter " + key);
        }
        return value;
    }

    public boolean hasParam(String key) {
        return params != null && params.containsKey(key);
    }

    public void setParam(String key, long value) {
        if (params == null) params = new TreeMap<>();
        params.put(key, value);
    }

    public Map<String, Long> getParams() {
        return params == null ? Collections.emptyMap() : Collections.unmodifiableMap(params);
    }

    @NotNull
    public SourceLocation getLocation() {
        return location;
    }

    public void setLocation(@NotNull SourceLocation location) {
        this.location = location;
    }

    /**
     * Associates this newly built instance with the source construct of the
     * original one, for diagnostics.
     * @param orig The instance this one replaces.
     */
    public void copyLocation(Instance orig) {
        this.location = orig.location;
    }

    public boolean isFreed() {
        return freed;
    }

    protected void markFreed() {
        this.freed = true;
    }

    @Override
    public String toString() {
        return getName() + "(" + kind + ")";
    }
}
