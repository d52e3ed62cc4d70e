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

import java.util.Objects;

/**
 * Position of the source construct an instance was elaborated from. Only
 * used to report diagnostics, it never influences the netlist.
 */
public class SourceLocation {

    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", 0, 0);

    private final String fileName;

    private final int line;

    private final int column;

    public SourceLocation(String fileName, int line, int column) {
        this.fileName = fileName;
        this.line = line;
        this.column = column;
    }

    public String getFileName() {
        return fileName;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean isUnknown() {
        return this == UNKNOWN;
    }

    @Override
    public int hashCode() {
        return Objects.hash(fileName, line, column);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        SourceLocation other = (SourceLocation) obj;
        return line == other.line && column == other.column && fileName.equals(other.fileName);
    }

    @Override
    public String toString() {
        return fileName + ":" + line + ":" + column;
    }
}
