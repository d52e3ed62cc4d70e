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
 * Thrown when an operation would break the structural contract of a
 * {@link Netlist}: connecting an already driven pin, freeing an instance that
 * is still connected, mixing widths or touching a freed instance.
 */
public class NetlistException extends RuntimeException {

    private static final long serialVersionUID = -6392184532981741015L;

    public NetlistException(String message) {
        super(message);
    }
}
