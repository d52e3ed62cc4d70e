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

import com.rapidsynth.netlist.Net;
import com.rapidsynth.netlist.SourceLocation;

/**
 * A value driving bits [offset, offset + width) of a wire.
 */
public class ConcurrentAssignment {

    private final Net value;

    private final int offset;

    private final SourceLocation location;

    public ConcurrentAssignment(Net value, int offset, SourceLocation location) {
        this.value = value;
        this.offset = offset;
        this.location = location;
    }

    public Net getValue() {
        return value;
    }

    public int getOffset() {
        return offset;
    }

    public int getWidth() {
        return value.getWidth();
    }

    /**
     * @return Offset of the first bit after this assignment.
     */
    public int getEnd() {
        return offset + value.getWidth();
    }

    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public String toString() {
        return "[" + (getEnd() - 1) + ":" + offset + "] <= " + value;
    }
}
