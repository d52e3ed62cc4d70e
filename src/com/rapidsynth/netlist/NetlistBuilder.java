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

import org.jetbrains.annotations.NotNull;

/**
 * Gate constructors. Every built instance is connected to its operands and
 * stamped with the builder's current {@link SourceLocation}. Instance names
 * are generated from the gate kind and a per-builder counter.
 */
public class NetlistBuilder {

    private final Netlist netlist;

    private SourceLocation location = SourceLocation.UNKNOWN;

    private int nameCount;

    public NetlistBuilder(Netlist netlist) {
        this.netlist = netlist;
    }

    public Netlist getNetlist() {
        return netlist;
    }

    public SourceLocation getLocation() {
        return location;
    }

    /**
     * Sets the location stamped on the instances built from now on.
     * @param location Source location of the construct being elaborated.
     */
    public void setLocation(@NotNull SourceLocation location) {
        this.location = location;
    }

    private String newName(ModuleKind kind) {
        return kind.name().toLowerCase() + "_" + nameCount++;
    }

    private Instance create(String name, ModuleKind kind, int width, int[] inputWidths, Net... operands) {
        Instance inst = netlist.createInstance(name, kind, width, inputWidths);
        inst.setLocation(location);
        for (int i = 0; i < operands.length; i++) {
            if (operands[i] != null) {
                netlist.connect(inst.getInput(i), operands[i]);
            }
        }
        return inst;
    }

    private Net build(ModuleKind kind, int width, int[] inputWidths, Net... operands) {
        return create(newName(kind), kind, width, inputWidths, operands).getOutput(0);
    }

    /**
     * Builds a 2-way multiplexer: the result is i1 when sel is 1, i0 otherwise.
     */
    public Net buildMux2(@NotNull Net sel, @NotNull Net i0, @NotNull Net i1) {
        int w = i0.getWidth();
        return build(ModuleKind.MUX2, w, new int[] {1, w, w}, sel, i0, i1);
    }

    public Net buildEdge(@NotNull Net clk) {
        return build(ModuleKind.EDGE, 1, new int[] {1}, clk);
    }

    /**
     * @param kind Only {@link ModuleKind#NOT} is monadic.
     */
    public Net buildMonadic(ModuleKind kind, @NotNull Net operand) {
        if (kind != ModuleKind.NOT) {
            throw new NetlistException("ERROR: " + kind + " is not a monadic gate");
        }
        int w = operand.getWidth();
        return build(kind, w, new int[] {w}, operand);
    }

    /**
     * @param kind {@link ModuleKind#AND} or {@link ModuleKind#OR}.
     */
    public Net buildDyadic(ModuleKind kind, @NotNull Net left, @NotNull Net right) {
        if (kind != ModuleKind.AND && kind != ModuleKind.OR) {
            throw new NetlistException("ERROR: " + kind + " is not a dyadic gate");
        }
        int w = left.getWidth();
        return build(kind, w, new int[] {w, w}, left, right);
    }

    /**
     * Builds a slice of width bits starting at bit offset of the input.
     */
    public Net buildExtract(@NotNull Net input, int offset, int width) {
        if (offset < 0 || offset + width > input.getWidth()) {
            throw new NetlistException("ERROR: Cannot extract [" + (offset + width - 1) + ":" + offset
                    + "] from " + input + " of width " + input.getWidth());
        }
        Instance inst = create(newName(ModuleKind.EXTRACT), ModuleKind.EXTRACT, width,
                new int[] {input.getWidth()}, input);
        inst.setParam(Instance.PARAM_OFFSET, offset);
        return inst.getOutput(0);
    }

    /**
     * Same as {@link #buildExtract(Net, int, int)}, but returns input itself
     * when the slice covers it entirely.
     */
    public Net buildExtractIfNeeded(@NotNull Net input, int offset, int width) {
        if (offset == 0 && width == input.getWidth()) {
            return input;
        }
        return buildExtract(input, offset, width);
    }

    /**
     * Concatenates pieces, the first piece being the least significant one.
     */
    public Net buildConcat(@NotNull Net... pieces) {
        if (pieces.length == 0) {
            throw new NetlistException("ERROR: Cannot concatenate zero nets");
        }
        int[] widths = new int[pieces.length];
        int w = 0;
        for (int i = 0; i < pieces.length; i++) {
            widths[i] = pieces[i].getWidth();
            w += widths[i];
        }
        return build(ModuleKind.CONCAT, w, widths, pieces);
    }

    public Net buildConst(long value, int width) {
        if (width > Long.SIZE) {
            throw new NetlistException("ERROR: Constant of width " + width + " is too wide");
        }
        Instance inst = create(newName(ModuleKind.CONST), ModuleKind.CONST, width, new int[0]);
        inst.setParam(Instance.PARAM_VALUE, value);
        return inst.getOutput(0);
    }

    /**
     * Builds an undefined constant.
     */
    public Net buildConstX(int width) {
        return build(ModuleKind.CONST_X, width, new int[0]);
    }

    public Net buildDff(@NotNull Net clk, @NotNull Net d) {
        int w = d.getWidth();
        return build(ModuleKind.DFF, w, new int[] {1, w}, clk, d);
    }

    public Net buildIdff(@NotNull Net clk, @NotNull Net d, @NotNull Net init) {
        int w = d.getWidth();
        return build(ModuleKind.IDFF, w, new int[] {1, w, w}, clk, d, init);
    }

    public Net buildAdff(@NotNull Net clk, @NotNull Net d, @NotNull Net rst, @NotNull Net rstVal) {
        int w = d.getWidth();
        return build(ModuleKind.ADFF, w, new int[] {1, w, 1, w}, clk, d, rst, rstVal);
    }

    public Net buildIadff(@NotNull Net clk, @NotNull Net d, @NotNull Net rst, @NotNull Net rstVal,
            @NotNull Net init) {
        int w = d.getWidth();
        return build(ModuleKind.IADFF, w, new int[] {1, w, 1, w, w}, clk, d, rst, rstVal, init);
    }

    /**
     * Builds the storage placeholder of a signal. Its input is left
     * unconnected, it receives the final value of the signal.
     */
    public Instance buildSignal(String name, int width) {
        return create(name, ModuleKind.SIGNAL, width, new int[] {width});
    }

    public Instance buildIsignal(String name, @NotNull Net init) {
        int w = init.getWidth();
        return create(name, ModuleKind.ISIGNAL, w, new int[] {w, w}, null, init);
    }

    public Instance buildOutput(String name, int width) {
        return create(name, ModuleKind.OUTPUT, width, new int[] {width});
    }

    /**
     * Builds a gate unknown to the inference, inputs accept any width.
     * @param name Name of the instance.
     * @param width Width of the output.
     * @param operands Inputs of the gate.
     */
    public Net buildGate(String name, int width, @NotNull Net... operands) {
        int[] widths = new int[operands.length];
        for (int i = 0; i < operands.length; i++) {
            widths[i] = -1;
        }
        return create(name, ModuleKind.OTHER, width, widths, operands).getOutput(0);
    }
}
