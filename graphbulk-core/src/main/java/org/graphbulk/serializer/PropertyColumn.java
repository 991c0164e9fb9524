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

package org.graphbulk.serializer;

import java.util.Objects;

import org.graphbulk.type.PropertyType;
import org.apache.hugegraph.util.E;

public class PropertyColumn {

    public static final char TAG_SEPARATOR = ':';

    private final String name;
    private final PropertyType type;

    public PropertyColumn(String name, PropertyType type) {
        E.checkArgument(name != null && !name.isEmpty(),
                        "The property column name can't be empty");
        E.checkNotNull(type, "type");
        this.name = name;
        this.type = type;
    }

    public String name() {
        return this.name;
    }

    public PropertyType type() {
        return this.type;
    }

    /**
     * @return the header cell, e.g. {@code age:int}
     */
    public String string() {
        return this.name + TAG_SEPARATOR + this.type.string();
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof PropertyColumn)) {
            return false;
        }
        PropertyColumn other = (PropertyColumn) obj;
        return this.name.equals(other.name) && this.type.equals(other.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.name, this.type);
    }

    @Override
    public String toString() {
        return this.string();
    }
}
