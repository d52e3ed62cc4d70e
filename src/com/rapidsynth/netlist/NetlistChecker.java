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
import java.util.Set;

import org.jgrapht.Graph;
import org.jgrapht.alg.cycle.CycleDetector;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;

/**
 * Checks the structural well-formedness of a {@link Netlist}: connections are
 * recorded on both ends, every driver is alive, widths agree and no
 * combinational cycle exists. Flip-flops and {@link ModuleKind#OTHER} gates
 * break cycles, every other kind is considered transparent.
 */
public class NetlistChecker {

    /**
     * Runs all the checks.
     * @param netlist The netlist to check.
     * @return A description of every violation found, empty if the netlist is well-formed.
     */
    public static List<String> check(Netlist netlist) {
        List<String> violations = new ArrayList<>();
        for (Instance inst : netlist.getInstances()) {
            for (InputPin pin : inst.getInputs()) {
                Net driver = pin.getDriver();
                if (driver == null) continue;
                Instance src = driver.getParentInstance();
                if (src.isFreed() || !netlist.contains(src)) {
                    violations.add("Input " + pin + " is driven by " + driver + " whose instance is not alive");
                }
                if (!driver.getSinks().contains(pin)) {
                    violations.add("Input " + pin + " is not recorded as a sink of " + driver);
                }
                if (pin.getExpectedWidth() >= 0 && pin.getExpectedWidth() != driver.getWidth()) {
                    violations.add("Input " + pin + " expects " + pin.getExpectedWidth() + " bits but "
                            + driver + " has " + driver.getWidth());
                }
            }
            for (Net out : inst.getOutputs()) {
                for (InputPin sink : out.getSinks()) {
                    if (sink.getDriver() != out) {
                        violations.add("Net " + out + " lists " + sink + " as a sink but it is driven by "
                                + sink.getDriver());
                    }
                    if (sink.getInstance().isFreed()) {
                        violations.add("Net " + out + " is read by freed instance " + sink.getInstance());
                    }
                }
            }
        }
        Instance cycle = findCombinationalCycle(netlist);
        if (cycle != null) {
            violations.add("Combinational cycle through " + cycle);
        }
        return violations;
    }

    /**
     * Throws if {@link #check(Netlist)} reports any violation.
     * @param netlist The netlist to check.
     */
    public static void assertValid(Netlist netlist) {
        List<String> violations = check(netlist);
        if (!violations.isEmpty()) {
            throw new NetlistException("ERROR: Netlist " + netlist.getName() + " is malformed:\n    "
                    + String.join("\n    ", violations));
        }
    }

    public static boolean isCombinational(ModuleKind kind) {
        return !kind.isFlipFlop() && kind != ModuleKind.OTHER;
    }

    /**
     * Builds the graph of combinational instances, with an edge from each
     * instance to every combinational instance reading its output.
     * @param netlist The netlist.
     * @return The directed graph, instances being vertices.
     */
    public static Graph<Instance, DefaultEdge> getCombinationalGraph(Netlist netlist) {
        Graph<Instance, DefaultEdge> graph = new DefaultDirectedGraph<>(DefaultEdge.class);
        List<Instance> insts = netlist.getInstances();
        for (Instance inst : insts) {
            if (isCombinational(inst.getKind())) {
                graph.addVertex(inst);
            }
        }
        for (Instance inst : insts) {
            if (!isCombinational(inst.getKind())) continue;
            for (InputPin sink : inst.getOutput(0).getSinks()) {
                Instance reader = sink.getInstance();
                if (graph.containsVertex(reader)) {
                    graph.addEdge(inst, reader);
                }
            }
        }
        return graph;
    }

    /**
     * Looks for a cycle made of combinational instances only.
     * @param netlist The netlist to search.
     * @return The first instance (in creation order) on a cycle, or null if there is none.
     */
    public static Instance findCombinationalCycle(Netlist netlist) {
        CycleDetector<Instance, DefaultEdge> cycleDetector = new CycleDetector<>(getCombinationalGraph(netlist));
        if (!cycleDetector.detectCycles()) {
            return null;
        }
        Set<Instance> onCycle = cycleDetector.findCycles();
        for (Instance inst : netlist.getInstances()) {
            if (onCycle.contains(inst)) return inst;
        }
        return null;
    }
}
