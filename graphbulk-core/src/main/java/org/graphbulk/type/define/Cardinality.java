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

/**
 * The cardinality of the values stored in one cell.
 */
public enum Cardinality {

    /**
     * A single scalar value.
     */
    SINGLE("single", ""),

    /**
     * An ordered sequence of scalars of the same data type, duplicates
     * allowed.
     */
    LIST("list", "[]");

    private final String name;
    private final String suffix;

    Cardinality(String name, String suffix) {
        this.name = name;
        this.suffix = suffix;
    }

    public String string() {
        return this.name;
    }

    /**
     * @return the suffix appended to a data type name in a header tag
     */
    public String suffix() {
        return this.suffix;
    }

    public boolean single() {
        return this == SINGLE;
    }

    public boolean multiple() {
        return this == LIST;
    }
}
