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

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

import com.rapidsynth.netlist.Instance;
import com.rapidsynth.netlist.ModuleKind;
import com.rapidsynth.netlist.Net;
import com.rapidsynth.netlist.Netlist;
import com.rapidsynth.netlist.NetlistBuilder;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class TestWireTable {

    private Netlist netlist;
    private NetlistBuilder b;
    private WireTable wires;

    @BeforeEach
    public void setup() {
        netlist = new Netlist("top");
        b = new NetlistBuilder(netlist);
        wires = new WireTable(b);
    }

    @Test
    public void testSingleAssignment() {
        WireId w = wires.allocSignal("w", 4);
        Net a = input(b, "a", 4);
        w.addConcurrentAssignment(a, 0, LOC);
        wires.finalizeAssignments(w);
        Assertions.assertSame(a, w.getGate().getInputNet(0));
        Assertions.assertTrue(w.isFinalized());
    }

    @Test
    public void testPiecesAndHoles() {
        WireId w = wires.allocOutput("w", 8);
        Net hi = input(b, "hi", 2);
        Net lo = input(b, "lo", 3);
        w.addConcurrentAssignment(hi, 5, LOC);
        w.addConcurrentAssignment(lo, 0, LOC);
        wires.finalizeAssignments(w);

        Net value = w.getGate().getInputNet(0);
        Assertions.assertTrue(isKind(value, ModuleKind.CONCAT));
        Instance cat = parent(value);
        Assertions.assertEquals(4, cat.getInputCount());
        Assertions.assertSame(lo, cat.getInputNet(0));
        Assertions.assertTrue(isKind(cat.getInputNet(1), ModuleKind.CONST_X));
        Assertions.assertEquals(2, cat.getInputNet(1).getWidth());
        Assertions.assertSame(hi, cat.getInputNet(2));
        Assertions.assertEquals(1, cat.getInputNet(3).getWidth());
    }

    @Test
    public void testOverlap() {
        WireId w = wires.allocSignal("w", 4);
        w.addConcurrentAssignment(input(b, "a", 3), 0, LOC);
        w.addConcurrentAssignment(input(b, "c", 2), 2, LOC);
        SynthesisException ex = Assertions.assertThrows(SynthesisException.class,
                () -> wires.finalizeAssignments(w));
        Assertions.assertEquals(SynthesisException.Kind.OVERLAPPING_ASSIGNMENT, ex.getKind());
    }

    @Test
    public void testOutOfBounds() {
        WireId w = wires.allocSignal("w", 4);
        Net a = input(b, "a", 2);
        Assertions.assertThrows(SynthesisException.class, () -> w.addConcurrentAssignment(a, 3, LOC));
        Assertions.assertThrows(SynthesisException.class, () -> w.addConcurrentAssignment(a, -1, LOC));
    }

    @Test
    public void testFinalizeTwice() {
        WireId w = wires.allocSignal("w", 1);
        wires.finalizeAssignments(w);
        Assertions.assertFalse(w.getGate().getInput(0).isConnected());
        Assertions.assertThrows(RuntimeException.class, () -> wires.finalizeAssignments(w));
        Assertions.assertThrows(RuntimeException.class,
                () -> w.addConcurrentAssignment(input(b, "a", 1), 0, LOC));
    }

    @Test
    public void testWireMustBeSignal() {
        Instance gate = parent(input(b, "a", 1));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new WireId("a", gate));
    }

    @Test
    public void testFinalizeAll() {
        WireId w = wires.allocSignal("w", 1);
        WireId unassigned = wires.allocSignal("u", 1);
        Net a = input(b, "a", 1);
        Net dead = b.buildMonadic(ModuleKind.NOT, a);
        w.addConcurrentAssignment(b.buildMonadic(ModuleKind.NOT, a), 0, LOC);

        wires.setRemoveUnusedInstances(true);
        wires.finalizeAll();
        Assertions.assertEquals(2, wires.getWires().size());
        Assertions.assertTrue(w.isFinalized());
        Assertions.assertTrue(unassigned.isFinalized());
        Assertions.assertTrue(parent(dead).isFreed());
        Assertions.assertTrue(isKind(w.getGate().getInputNet(0), ModuleKind.NOT));
    }

    @Test
    public void testFinalizeAllKeepsUnused() {
        Net dead = b.buildMonadic(ModuleKind.NOT, input(b, "a", 1));
        wires.setRemoveUnusedInstances(false);
        wires.finalizeAll();
        Assertions.assertFalse(parent(dead).isFreed());
    }

    @Test
    public void testUnassignedWarning() {
        WireId w = wires.allocSignal("w", 1);
        reader(b, "use", w.getPreviousValue());
        WireId unread = wires.allocSignal("unread", 1);
        wires.setRemoveUnusedInstances(false);

        PrintStream err = System.err;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        System.setErr(new PrintStream(buffer, true));
        try {
            wires.setVerbose(true);
            wires.finalizeAll();
        } finally {
            System.setErr(err);
        }
        String output = buffer.toString();
        Assertions.assertTrue(output.contains("WARNING: w is read but never assigned"));
        Assertions.assertFalse(output.contains(unread.getName()));
    }

    @Test
    public void testNoWarningWhenQuiet() {
        WireId w = wires.allocSignal("w", 1);
        reader(b, "use", w.getPreviousValue());

        PrintStream err = System.err;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        System.setErr(new PrintStream(buffer, true));
        try {
            wires.setVerbose(false);
            wires.finalizeAll();
        } finally {
            System.setErr(err);
        }
        Assertions.assertEquals("", buffer.toString());
    }
}
