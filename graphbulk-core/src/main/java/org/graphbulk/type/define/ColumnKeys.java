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

public enum ColumnKeys {

    /* Structural columns of the vertex table */
    ID(":ID", TableType.VERTEX, true),
    LABEL(":LABEL", TableType.VERTEX, false),

    /* Structural columns of the edge table */
    START_ID(":START_ID", TableType.EDGE, true),
    END_ID(":END_ID", TableType.EDGE, true),
    TYPE(":TYPE", TableType.EDGE, false);

    public static final char RESERVED_PREFIX = ':';

    private final String name;
    private final TableType table;
    private final boolean mandatory;

    ColumnKeys(String name, TableType table, boolean mandatory) {
        this.name = name;
        this.table = table;
        this.mandatory = mandatory;
    }

    public String string() {
        return this.name;
    }

    public TableType table() {
        return this.table;
    }

    public boolean mandatory() {
        return this.mandatory;
    }

    public static ColumnKeys fromName(String name) {
        for (ColumnKeys key : ColumnKeys.values()) {
            if (key.name.equalsIgnoreCase(name)) {
                return key;
            }
        }
        return null;
    }

    public static boolean reserved(String name) {
        return !name.isEmpty() && name.charAt(0) == RESERVED_PREFIX;
    }
}
