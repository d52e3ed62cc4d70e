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
 * Common ancestor of the objects allocated by a {@link Netlist}. Each object
 * has a small integer id that is unique among objects of the same class
 * within its netlist and stable for the object's lifetime.
 */
public abstract class NetlistObject implements Comparable<NetlistObject> {

    private final int id;

    private final String name;

    protected NetlistObject(int id, String name) {
        this.id = id;
        this.name = name;
    }

    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    @Override
    public int compareTo(NetlistObject o) {
        return Integer.compare(id, o.id);
    }

    @Override
    public String toString() {
        return name;
    }
}
