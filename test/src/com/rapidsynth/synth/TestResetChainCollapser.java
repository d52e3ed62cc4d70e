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

import static com.rapidsynth.support.NetlistTestSupport.LOC;
import static com.rapidsynth.support.NetlistTestSupport.input;
import static com.rapidsynth.support.NetlistTestSupport.isKind;
import static com.rapidsynth.support.NetlistTestSupport.parent;
import static com.rapidsynth.support.NetlistTestSupport.reader;

import java.time.Duration;

import com.rapidsynth.netlist.Instance;
import com.rapidsynth.netlist.ModuleKind;
import com.rapidsynth.netlist.Net;
import com.rapidsynth.netlist.Netlist;
import com.rapidsynth.netlist.NetlistBuilder;
import com.rapidsynth.netlist.NetlistTools;
import com.rapidsynth.util.Pair;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class TestResetChainCollapser {

    private Netlist netlist;
    private NetlistBuilder b;
    private ResetChainCollapser collapser;
    /** Output of the loop-closing mux */
    private Net loop;

    @BeforeEach
    public void setup() {
        netlist = new Netlist("top");
        b = new NetlistBuilder(netlist);
        collapser = new ResetChainCollapser(b);
        Net prev = b.buildSignal("r", 1).getOutput(0);
        loop = b.buildMux2(b.buildEdge(input(b, "clk", 1)), prev, input(b, "d", 1));
    }

    @Test
    public void testEmptyChain() {
        Assertions.assertNull(collapser.collapse(loop, LOC));
        Assertions.assertEquals(0, collapser.getLastResetCount());
    }

    @Test
    public void testActiveHighReset() {
        Net rst = input(b, "rst", 1);
        Net v = input(b, "v", 1);
        Net r = b.buildMux2(rst, loop, v);
        Instance use = reader(b, "use", r);

        Pair<Net, Net> res = collapser.collapse(loop, LOC);
        Assertions.assertSame(rst, res.getFirst());
        Assertions.assertSame(v, res.getSecond());
        Assertions.assertEquals(1, collapser.getLastResetCount());
        Assertions.assertTrue(parent(r).isFreed());
        Assertions.assertSame(loop, use.getInputNet(0));
        // Condition and value now only read by the caller
        Assertions.assertFalse(rst.isConnected());
        Assertions.assertFalse(v.isConnected());
    }

    @Test
    public void testActiveLowReset() {
        Net rstN = input(b, "rst_n", 1);
        Net v = input(b, "v", 1);
        Net r = b.buildMux2(rstN, v, loop);

        Pair<Net, Net> res = collapser.collapse(loop, LOC);
        Assertions.assertTrue(isKind(res.getFirst(), ModuleKind.NOT));
        Assertions.assertSame(rstN, parent(res.getFirst()).getInputNet(0));
        Assertions.assertSame(v, res.getSecond());
        Assertions.assertTrue(parent(r).isFreed());
    }

    @Test
    public void testChainOfThree() {
        Net r1 = input(b, "r1", 1);
        Net r2 = input(b, "r2", 1);
        Net r3 = input(b, "r3", 1);
        Net v1 = input(b, "v1", 1);
        Net v2 = input(b, "v2", 1);
        Net v3 = input(b, "v3", 1);
        Net m1 = b.buildMux2(r1, loop, v1);
        Net m2 = b.buildMux2(r2, m1, v2);
        Net m3 = b.buildMux2(r3, m2, v3);

        Pair<Net, Net> res = collapser.collapse(loop, LOC);
        Assertions.assertEquals(3, collapser.getLastResetCount());
        Assertions.assertSame(v3, res.getSecond());

        // OR(r3, OR(r2, r1))
        Net rst = res.getFirst();
        Assertions.assertTrue(isKind(rst, ModuleKind.OR));
        Assertions.assertSame(r3, parent(rst).getInputNet(0));
        Net inner = parent(rst).getInputNet(1);
        Assertions.assertTrue(isKind(inner, ModuleKind.OR));
        Assertions.assertSame(r2, parent(inner).getInputNet(0));
        Assertions.assertSame(r1, parent(inner).getInputNet(1));

        Assertions.assertTrue(parent(m1).isFreed());
        Assertions.assertFalse(parent(m2).isFreed());
        Assertions.assertFalse(parent(m3).isFreed());
        Assertions.assertSame(loop, NetlistTools.getMux2I0(parent(m2)).getDriver());
    }

    @Test
    public void testNonMuxReaderEndsChain() {
        Instance use = reader(b, "use", loop);
        Assertions.assertNull(collapser.collapse(loop, LOC));
        Assertions.assertSame(loop, use.getInputNet(0));
    }

    @Test
    public void testSeveralReaders() {
        b.buildMux2(input(b, "r1", 1), loop, input(b, "v1", 1));
        b.buildMux2(input(b, "r2", 1), loop, input(b, "v2", 1));
        SynthesisException ex = Assertions.assertThrows(SynthesisException.class,
                () -> collapser.collapse(loop, LOC));
        Assertions.assertEquals(SynthesisException.Kind.UNSUPPORTED_CONSTRUCT, ex.getKind());
        Assertions.assertEquals(LOC, ex.getLocation());
    }

    @Test
    public void testSelectReader() {
        b.buildMux2(loop, input(b, "a", 1), input(b, "c", 1));
        Assertions.assertThrows(SynthesisException.class, () -> collapser.collapse(loop, LOC));
    }

    @Test
    public void testChainFeedingItself() {
        Net r1 = input(b, "r1", 1);
        Net m1 = b.buildMux2(r1, loop, input(b, "v1", 1));
        // Second reset mux reads its own output as reset value
        Instance m2 = netlist.createInstance("m2", ModuleKind.MUX2, 1, 1, 1, 1);
        netlist.connect(m2.getInput(0), input(b, "r2", 1));
        netlist.connect(m2.getInput(1), m1);
        netlist.connect(m2.getInput(2), m2.getOutput(0));

        SynthesisException ex = Assertions.assertTimeoutPreemptively(Duration.ofSeconds(5),
                () -> Assertions.assertThrows(SynthesisException.class, () -> collapser.collapse(loop, LOC)));
        Assertions.assertEquals(SynthesisException.Kind.UNSUPPORTED_CONSTRUCT, ex.getKind());
        Assertions.assertTrue(ex.getMessage().contains("m2"));
    }
}
