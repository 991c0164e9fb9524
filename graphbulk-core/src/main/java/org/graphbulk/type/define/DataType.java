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

package org.graphbulk.type.define;

import java.util.Locale;

import com.google.common.collect.ImmutableMap;

/**
 * The scalar data types a column can declare. Each one has a canonical
 * header name used when writing, plus the aliases accepted when reading
 * headers produced by other OpenCypher exporters.
 */
public enum DataType {

    BOOLEAN("boolean"),
    INT("int"),
    FLOAT("float"),
    STRING("string");

    private static final ImmutableMap<String, DataType> ALIASES =
            ImmutableMap.<String, DataType>builder()
                        .put("boolean", BOOLEAN)
                        .put("bool", BOOLEAN)
                        .put("int", INT)
                        .put("integer", INT)
                        .put("long", INT)
                        .put("short", INT)
                        .put("byte", INT)
                        .put("float", FLOAT)
                        .put("double", FLOAT)
                        .put("string", STRING)
                        .build();

    private final String name;

    DataType(String name) {
        this.name = name;
    }

    public String string() {
        return this.name;
    }

    public boolean isNumber() {
        return this == INT || this == FLOAT;
    }

    public boolean isText() {
        return this == STRING;
    }

    /**
     * Widen two data types seen in the same column: numbers widen to FLOAT,
     * any other conflict falls back to STRING.
     */
    public DataType widen(DataType other) {
        if (this == other) {
            return this;
        }
        if (this.isNumber() && other.isNumber()) {
            return FLOAT;
        }
        return STRING;
    }

    /**
     * @return the data type for a header tag name, or null if unknown
     */
    public static DataType fromName(String name) {
        if (name == null) {
            return null;
        }
        return ALIASES.get(name.trim().toLowerCase(Locale.ROOT));
    }
}
