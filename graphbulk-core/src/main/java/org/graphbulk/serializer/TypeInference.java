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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import org.graphbulk.type.PropertyType;
import org.graphbulk.type.define.ColumnKeys;
import org.apache.hugegraph.util.E;
import org.apache.hugegraph.util.InsertionOrderUtil;

/**
 * The scan phase of encoding: observes every property value of one table
 * and settles a single type tag per key. Once {@link #columns()} is called
 * the result is final, nothing is written before that.
 */
public class TypeInference {

    private final Map<String, Observed> observed;

    public TypeInference() {
        this.observed = InsertionOrderUtil.newMap();
    }

    public void observe(Map<String, ?> properties) {
        for (Map.Entry<String, ?> e : properties.entrySet()) {
            this.observe(e.getKey(), e.getValue());
        }
    }

    public void observe(String key, Object value) {
        E.checkArgument(key != null && !key.isEmpty() &&
                        !ColumnKeys.reserved(key),
                        "Invalid property key '%s', it can't be empty or " +
                        "start with '%s'", key, ColumnKeys.RESERVED_PREFIX);
        // Header cells are trimmed when read back
        E.checkArgument(key.equals(key.trim()),
                        "Invalid property key '%s', it can't start or end " +
                        "with whitespace", key);
        Observed column = this.observed.get(key);
        if (column == null) {
            column = new Observed();
            this.observed.put(key, column);
        }
        if (value == null) {
            return;
        }
        PropertyType type = TypeCodec.infer(key, value);
        if (type == null) {
            // An empty array fits any array type
            column.emptyArray = true;
        } else {
            column.type = column.type == null ? type : column.type.widen(type);
        }
    }

    public boolean isEmpty() {
        return this.observed.isEmpty();
    }

    /**
     * @return the finalized property columns in first-seen key order
     */
    public List<PropertyColumn> columns() {
        return this.columns(false);
    }

    public List<PropertyColumn> columns(boolean sortByName) {
        List<PropertyColumn> columns = new ArrayList<>(this.observed.size());
        for (Map.Entry<String, Observed> e : this.observed.entrySet()) {
            columns.add(new PropertyColumn(e.getKey(), e.getValue().finish()));
        }
        if (sortByName) {
            columns.sort(Comparator.comparing(PropertyColumn::name));
        }
        return columns;
    }

    private static class Observed {

        private PropertyType type;
        private boolean emptyArray;

        public PropertyType finish() {
            if (this.type == null) {
                return this.emptyArray ? PropertyType.STRING_LIST :
                                         PropertyType.STRING;
            }
            if (this.emptyArray && !this.type.isList()) {
                return PropertyType.STRING;
            }
            return this.type;
        }
    }
}
