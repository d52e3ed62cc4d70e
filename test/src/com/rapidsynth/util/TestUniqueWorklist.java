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

import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class TestUniqueWorklist {

    @Test
    public void testAddOnce() {
        UniqueWorklist<String> list = new UniqueWorklist<>();
        Assertions.assertTrue(list.isEmpty());
        String a = "a";
        Assertions.assertTrue(list.add(a));
        Assertions.assertFalse(list.add(a));
        Assertions.assertTrue(list.add("b"));
        Assertions.assertEquals(2, list.size());
        Assertions.assertTrue(list.contains(a));
        Assertions.assertEquals(List.of("a", "b"), list.toList());
    }

    @Test
    public void testIdentity() {
        UniqueWorklist<String> list = new UniqueWorklist<>();
        String a = new String("x");
        String b = new String("x");
        Assertions.assertTrue(list.add(a));
        Assertions.assertTrue(list.add(b));
        Assertions.assertSame(b, list.get(1));
    }

    @Test
    public void testGrowWhileIterating() {
        UniqueWorklist<Integer> list = new UniqueWorklist<>();
        Integer[] values = new Integer[10];
        for (int i = 0; i < values.length; i++) {
            values[i] = i;
        }
        list.add(values[0]);
        for (int i = 0; i < list.size(); i++) {
            int next = list.get(i) + 1;
            if (next < values.length) {
                list.add(values[next]);
                list.add(values[list.get(i)]);
            }
        }
        Assertions.assertEquals(values.length, list.size());
    }
}
