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
/**
 *
 */
package com.rapidsynth.netlist;

/**
 * Enumerates the gate kinds an {@link Instance} can be. Only the kinds the
 * sequential inference depends on are named individually, anything else is
 * an {@link #OTHER} gate.
 *
 * Each kind carries the names of its input pins. {@link #CONCAT} and
 * {@link #OTHER} take a variable number of inputs named I0..In-1; for
 * {@link #CONCAT} I0 is the least significant piece.
 */
public enum ModuleKind {
    /** 2-way multiplexer, O = S ? I1 : I0 */
    MUX2("O", "S", "I0", "I1"),
    /** Rising edge detector of a clock */
    EDGE("O", "I"),
    AND("O", "A", "B"),
    OR("O", "A", "B"),
    NOT("O", "I"),
    /** Slice of the input, parameterized by {@link Instance#PARAM_OFFSET} */
    EXTRACT("O", "I"),
    CONCAT("O"),
    /** Constant, parameterized by {@link Instance#PARAM_VALUE} */
    CONST("O"),
    /** Undefined value */
    CONST_X("O"),
    DFF("Q", "CLK", "D"),
    IDFF("Q", "CLK", "D", "INIT"),
    ADFF("Q", "CLK", "D", "RST", "RST_VAL"),
    IADFF("Q", "CLK", "D", "RST", "RST_VAL", "INIT"),
    /** Storage placeholder of a signal, its output is the previous value */
    SIGNAL("O", "I"),
    /** Same as {@link #SIGNAL} with an initial value */
    ISIGNAL("O", "I", "INIT"),
    OUTPUT("O", "I"),
    OTHER("O");

    private final String outputName;

    private final String[] inputNames;

    ModuleKind(String outputName, String... inputNames) {
        this.outputName = outputName;
        this.inputNames = inputNames;
    }

    public String getOutputName() {
        return outputName;
    }

    /**
     * Gets the number of inputs of this kind.
     * @return The number of inputs, or -1 if the kind has a variable number of inputs.
     */
    public int getInputCount() {
        return isVariadic() ? -1 : inputNames.length;
    }

    public boolean isVariadic() {
        return this == CONCAT || this == OTHER;
    }

    /**
     * Gets the name of the input pin at the provided index.
     * @param idx Index of the input.
     * @return Name of the pin, for variadic kinds it is I&lt;idx&gt;.
     */
    public String getInputName(int idx) {
        if (isVariadic()) {
            return "I" + idx;
        }
        return inputNames[idx];
    }

    public boolean isFlipFlop() {
        return this == DFF || this == IDFF || this == ADFF || this == IADFF;
    }

    public boolean isSignal() {
        return this == SIGNAL || this == ISIGNAL || this == OUTPUT;
    }

    /**
     * Selects the narrowest flip-flop kind that provides the requested
     * features.
     * @param hasInit If the flip-flop has a power-up value.
     * @param hasReset If the flip-flop has an asynchronous reset.
     * @return One of {@link #DFF}, {@link #IDFF}, {@link #ADFF} or {@link #IADFF}.
     */
    public static ModuleKind getFlipFlop(boolean hasInit, boolean hasReset) {
        if (hasReset) {
            return hasInit ? IADFF : ADFF;
        }
        return hasInit ? IDFF : DFF;
    }
}
