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

package org.graphbulk.unit.type;

import org.graphbulk.exception.MalformedHeaderException;
import org.graphbulk.type.PropertyType;
import org.graphbulk.type.define.Cardinality;
import org.graphbulk.type.define.DataType;
import org.apache.hugegraph.testutil.Assert;
import org.junit.Test;

public class PropertyTypeTest {

    @Test
    public void testString() {
        Assert.assertEquals("boolean", PropertyType.BOOLEAN.string());
        Assert.assertEquals("int", PropertyType.INT.string());
        Assert.assertEquals("float", PropertyType.FLOAT.string());
        Assert.assertEquals("string", PropertyType.STRING.string());
        Assert.assertEquals("boolean[]", PropertyType.BOOLEAN_LIST.string());
        Assert.assertEquals("int[]", PropertyType.INT_LIST.string());
        Assert.assertEquals("float[]", PropertyType.FLOAT_LIST.string());
        Assert.assertEquals("string[]", PropertyType.STRING_LIST.string());
        Assert.assertEquals("int[]", PropertyType.INT_LIST.toString());
    }

    @Test
    public void testParse() {
        Assert.assertEquals(PropertyType.INT, PropertyType.parse("int"));
        Assert.assertEquals(PropertyType.INT, PropertyType.parse("Long"));
        Assert.assertEquals(PropertyType.INT, PropertyType.parse("integer"));
        Assert.assertEquals(PropertyType.INT, PropertyType.parse("short"));
        Assert.assertEquals(PropertyType.INT, PropertyType.parse("BYTE"));
        Assert.assertEquals(PropertyType.FLOAT, PropertyType.parse("double"));
        Assert.assertEquals(PropertyType.BOOLEAN, PropertyType.parse("Bool"));
        Assert.assertEquals(PropertyType.STRING, PropertyType.parse("String"));
        Assert.assertEquals(PropertyType.FLOAT_LIST,
                            PropertyType.parse("Double[]"));
        Assert.assertEquals(PropertyType.STRING_LIST,
                            PropertyType.parse(" string[] "));

        Assert.assertThrows(MalformedHeaderException.class, () -> {
            PropertyType.parse("date");
        }, e -> {
            Assert.assertContains("Unknown type tag 'date'", e.getMessage());
        });
        Assert.assertThrows(MalformedHeaderException.class, () -> {
            PropertyType.parse("int[][]");
        }, e -> {
            Assert.assertContains("Unknown type tag", e.getMessage());
        });
        Assert.assertThrows(MalformedHeaderException.class, () -> {
            PropertyType.parse("");
        });
    }

    @Test
    public void testWiden() {
        Assert.assertEquals(PropertyType.INT,
                            PropertyType.INT.widen(PropertyType.INT));
        Assert.assertEquals(PropertyType.FLOAT,
                            PropertyType.INT.widen(PropertyType.FLOAT));
        Assert.assertEquals(PropertyType.FLOAT,
                            PropertyType.FLOAT.widen(PropertyType.INT));
        Assert.assertEquals(PropertyType.STRING,
                            PropertyType.INT.widen(PropertyType.BOOLEAN));
        Assert.assertEquals(PropertyType.STRING,
                            PropertyType.BOOLEAN.widen(PropertyType.STRING));

        Assert.assertEquals(PropertyType.FLOAT_LIST,
                            PropertyType.INT_LIST.widen(
                            PropertyType.FLOAT_LIST));
        Assert.assertEquals(PropertyType.STRING_LIST,
                            PropertyType.INT_LIST.widen(
                            PropertyType.BOOLEAN_LIST));

        // Scalars never mix with arrays
        Assert.assertEquals(PropertyType.STRING,
                            PropertyType.INT.widen(PropertyType.INT_LIST));
        Assert.assertEquals(PropertyType.STRING,
                            PropertyType.STRING_LIST.widen(
                            PropertyType.STRING));
    }

    @Test
    public void testDataType() {
        Assert.assertEquals(DataType.INT, DataType.fromName("LONG"));
        Assert.assertNull(DataType.fromName("text"));
        Assert.assertNull(DataType.fromName(null));

        Assert.assertTrue(DataType.INT.isNumber());
        Assert.assertTrue(DataType.FLOAT.isNumber());
        Assert.assertFalse(DataType.BOOLEAN.isNumber());
        Assert.assertTrue(DataType.STRING.isText());

        Assert.assertEquals(DataType.FLOAT, DataType.INT.widen(DataType.FLOAT));
        Assert.assertEquals(DataType.STRING,
                            DataType.FLOAT.widen(DataType.BOOLEAN));
    }

    @Test
    public void testCardinality() {
        Assert.assertEquals(Cardinality.SINGLE,
                            PropertyType.INT.cardinality());
        Assert.assertEquals(Cardinality.LIST,
                            PropertyType.INT_LIST.cardinality());
        Assert.assertTrue(Cardinality.SINGLE.single());
        Assert.assertTrue(Cardinality.LIST.multiple());
        Assert.assertEquals("[]", Cardinality.LIST.suffix());
        Assert.assertEquals("", Cardinality.SINGLE.suffix());
    }
}
