/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements. See the NOTICE file distributed with this
 * work for additional information regarding copyright ownership. The ASF
 * licenses this file to You under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */

package org.graphbulk.unit.serializer;

import java.util.List;

import org.graphbulk.exception.UnsupportedTypeException;
import org.graphbulk.serializer.PropertyColumn;
import org.graphbulk.serializer.TypeInference;
import org.graphbulk.type.PropertyType;
import org.apache.hugegraph.testutil.Assert;
import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

public class TypeInferenceTest {

    private static PropertyType infer(Object... values) {
        TypeInference inference = new TypeInference();
        for (Object value : values) {
            inference.observe("k", value);
        }
        List<PropertyColumn> columns = inference.columns();
        Assert.assertEquals(1, columns.size());
        return columns.get(0).type();
    }

    @Test
    public void testSameType() {
        Assert.assertEquals(PropertyType.INT, infer(1, 2L, (short) 3));
        Assert.assertEquals(PropertyType.BOOLEAN, infer(true, false));
        Assert.assertEquals(PropertyType.STRING_LIST,
                            infer(ImmutableList.of("a"), new String[]{"b"}));
    }

    @Test
    public void testWidening() {
        Assert.assertEquals(PropertyType.FLOAT, infer(5, 5.5));
        Assert.assertEquals(PropertyType.FLOAT, infer(5.5, 5));
        Assert.assertEquals(PropertyType.STRING, infer(5, "five"));
        Assert.assertEquals(PropertyType.STRING, infer(true, 1));
        Assert.assertEquals(PropertyType.STRING, infer(5, 5.5, true));
        Assert.assertEquals(PropertyType.STRING, infer(true, 5, 5.5));

        Assert.assertEquals(PropertyType.FLOAT_LIST,
                            infer(new int[]{1}, new double[]{1.5}));
        Assert.assertEquals(PropertyType.STRING_LIST,
                            infer(new int[]{1}, new boolean[]{true}));
        Assert.assertEquals(PropertyType.STRING,
                            infer(1, ImmutableList.of(1)));
        Assert.assertEquals(PropertyType.STRING,
                            infer(ImmutableList.of(1), 1));
    }

    @Test
    public void testEmptyArrayAndNull() {
        Assert.assertEquals(PropertyType.INT_LIST,
                            infer(ImmutableList.of(), new int[]{1}));
        Assert.assertEquals(PropertyType.INT_LIST,
                            infer(new int[]{1}, ImmutableList.of()));
        Assert.assertEquals(PropertyType.STRING_LIST,
                            infer(ImmutableList.of()));
        Assert.assertEquals(PropertyType.STRING,
                            infer(ImmutableList.of(), 7));
        Assert.assertEquals(PropertyType.STRING, infer((Object) null));
        Assert.assertEquals(PropertyType.INT, infer(null, 7, null));
    }

    @Test
    public void testColumnOrder() {
        TypeInference inference = new TypeInference();
        Assert.assertTrue(inference.isEmpty());
        inference.observe(ImmutableMap.of("name", "a", "age", 1));
        inference.observe(ImmutableMap.of("city", "x", "name", "b"));
        Assert.assertFalse(inference.isEmpty());

        Assert.assertEquals(ImmutableList.of(
                            new PropertyColumn("name", PropertyType.STRING),
                            new PropertyColumn("age", PropertyType.INT),
                            new PropertyColumn("city", PropertyType.STRING)),
                            inference.columns());
        Assert.assertEquals(ImmutableList.of(
                            new PropertyColumn("age", PropertyType.INT),
                            new PropertyColumn("city", PropertyType.STRING),
                            new PropertyColumn("name", PropertyType.STRING)),
                            inference.columns(true));
    }

    @Test
    public void testInvalidKey() {
        TypeInference inference = new TypeInference();
        Assert.assertThrows(IllegalArgumentException.class, () -> {
            inference.observe(":ID", 1);
        }, e -> {
            Assert.assertContains("Invalid property key ':ID'",
                                  e.getMessage());
        });
        Assert.assertThrows(IllegalArgumentException.class, () -> {
            inference.observe("", 1);
        });
        Assert.assertThrows(IllegalArgumentException.class, () -> {
            inference.observe(" name", 1);
        }, e -> {
            Assert.assertContains("can't start or end with whitespace",
                                  e.getMessage());
        });
        Assert.assertThrows(IllegalArgumentException.class, () -> {
            inference.observe("name\t", 1);
        });
        Assert.assertThrows(UnsupportedTypeException.class, () -> {
            inference.observe("when", new Object());
        });
    }
}
