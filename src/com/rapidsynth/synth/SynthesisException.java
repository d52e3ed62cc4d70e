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

import com.rapidsynth.netlist.SourceLocation;

/**
 * Thrown when the inference meets a netlist shape it cannot transform. It is
 * fatal for the synthesis run: the caller decides how to report it, nothing
 * in this package catches it.
 */
public class SynthesisException extends RuntimeException {

    private static final long serialVersionUID = 2715340598741205128L;

    public enum Kind {
        /** The netlist violates a shape the inference depends on, or describes a latch */
        UNSUPPORTED_CONSTRUCT,
        /** Two concurrent assignments of a wire drive the same bits */
        OVERLAPPING_ASSIGNMENT,
    }

    private final Kind kind;

    private final SourceLocation location;

    public SynthesisException(Kind kind, SourceLocation location, String message) {
        super("ERROR: " + (location == null || location.isUnknown() ? "" : location + ": ") + message);
        this.kind = kind;
        this.location = location == null ? SourceLocation.UNKNOWN : location;
    }

    public static SynthesisException unsupported(SourceLocation location, String message) {
        return new SynthesisException(Kind.UNSUPPORTED_CONSTRUCT, location, message);
    }

    public Kind getKind() {
        return kind;
    }

    public SourceLocation getLocation() {
        return location;
    }
}
