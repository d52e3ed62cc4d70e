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

import static com.rapidsynth.support.NetlistTestSupport.input;
import static com.rapidsynth.support.NetlistTestSupport.reader;

import com.rapidsynth.netlist.Instance;
import com.rapidsynth.netlist.ModuleKind;
import com.rapidsynth.netlist.Net;
import com.rapidsynth.netlist.Netlist;
import com.rapidsynth.netlist.NetlistBuilder;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class TestFalseLoopDetector {

    private Netlist netlist;
    private NetlistBuilder b;
    private Net prev;
    private Net x;

    @BeforeEach
    public void setup() {
        netlist = new Netlist("top");
        b = new NetlistBuilder(netlist);
        prev = b.buildSignal("v", 2).getOutput(0);
        x = input(b, "x", 2);
    }

    @Test
    public void testUnread() {
        Assertions.assertTrue(FalseLoopDetector.isFalseLoop(prev));
    }

    @Test
    public void testOnlyMuxReaders() {
        Net m1 = b.buildMux2(input(b, "c1", 1), prev, x);
        b.buildMux2(input(b, "c2", 1), m1, x);
        Assertions.assertTrue(FalseLoopDetector.isFalseLoop(prev));
    }

    @Test
    public void testDirectNonMuxReader() {
        b.buildMux2(input(b, "c1", 1), prev, x);
        b.buildMonadic(ModuleKind.NOT, prev);
        Assertions.assertFalse(FalseLoopDetector.isFalseLoop(prev));
    }

    @Test
    public void testTransitiveNonMuxReader() {
        Net m1 = b.buildMux2(input(b, "c1", 1), prev, x);
        Net m2 = b.buildMux2(input(b, "c2", 1), x, m1);
        reader(b, "use", m2);
        Assertions.assertFalse(FalseLoopDetector.isFalseLoop(prev));
    }

    @Test
    public void testSliceReader() {
        Net bit = b.buildExtract(prev, 0, 1);
        b.buildMux2(bit, x, x);
        Assertions.assertFalse(FalseLoopDetector.isFalseLoop(prev));
    }

    @Test
    public void testDiamond() {
        Net m1 = b.buildMux2(input(b, "c1", 1), prev, x);
        Net m2 = b.buildMux2(input(b, "c2", 1), x, prev);
        b.buildMux2(input(b, "c3", 1), m1, m2);
        Assertions.assertTrue(FalseLoopDetector.isFalseLoop(prev));
    }

    @Test
    public void testMuxCycleTerminates() {
        Instance m1 = netlist.createInstance("m1", ModuleKind.MUX2, 2, 1, 2, 2);
        Instance m2 = netlist.createInstance("m2", ModuleKind.MUX2, 2, 1, 2, 2);
        netlist.connect(m1.getInput(1), prev);
        netlist.connect(m1.getInput(2), m2.getOutput(0));
        netlist.connect(m2.getInput(1), m1.getOutput(0));
        Assertions.assertTrue(FalseLoopDetector.isFalseLoop(prev));
    }
}
