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
package com.rapidsynth.util;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deduplicating, insertion-ordered collection keyed by object identity.
 * Elements can be added while the list is being walked by index, which makes
 * it usable as the worklist of a closure computation.
 *
 * @param <T> Type of the elements
 */
public class UniqueWorklist<T> {

    private final Map<T, Boolean> index = new IdentityHashMap<>();

    private final List<T> elements = new ArrayList<>();

    /**
     * Adds the element if it is not already present.
     * @param e The element.
     * @return True if the element was added, false if it was already present.
     */
    public boolean add(T e) {
        if (index.containsKey(e)) {
            return false;
        }
        index.put(e, Boolean.TRUE);
        elements.add(e);
        return true;
    }

    public boolean contains(T e) {
        return index.containsKey(e);
    }

    public T get(int idx) {
        return elements.get(idx);
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public List<T> toList() {
        return new ArrayList<>(elements);
    }
}
