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
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.graphbulk.exception.MalformedHeaderException;
import org.graphbulk.type.PropertyType;
import org.graphbulk.type.define.ColumnKeys;
import org.graphbulk.type.define.DataType;
import org.graphbulk.type.define.TableType;
import org.apache.hugegraph.util.E;
import org.apache.hugegraph.util.InsertionOrderUtil;

import com.google.common.collect.ImmutableList;

/**
 * The ordered columns of a vertex or edge table. Each position holds
 * either a structural column ({@link ColumnKeys}) or a typed property
 * column.
 */
public class TableHeader {

    private final TableType table;
    private final List<ColumnKeys> keys;
    private final List<PropertyColumn> properties;
    private final Map<ColumnKeys, Integer> positions;

    private TableHeader(TableType table, List<ColumnKeys> keys,
                        List<PropertyColumn> properties) {
        assert keys.size() == properties.size();
        this.table = table;
        this.keys = keys;
        this.properties = properties;
        this.positions = new EnumMap<>(ColumnKeys.class);
        for (int i = 0; i < keys.size(); i++) {
            if (keys.get(i) != null) {
                this.positions.put(keys.get(i), i);
            }
        }
    }

    public static TableHeader vertex(List<PropertyColumn> properties,
                                     boolean withLabel) {
        List<ColumnKeys> keys = new ArrayList<>();
        List<PropertyColumn> props = new ArrayList<>();
        keys.add(ColumnKeys.ID);
        props.add(null);
        for (PropertyColumn property : properties) {
            keys.add(null);
            props.add(property);
        }
        if (withLabel) {
            keys.add(ColumnKeys.LABEL);
            props.add(null);
        }
        return new TableHeader(TableType.VERTEX, keys, props);
    }

    public static TableHeader edge(List<PropertyColumn> properties,
                                   boolean withType) {
        List<ColumnKeys> keys = new ArrayList<>();
        List<PropertyColumn> props = new ArrayList<>();
        keys.add(ColumnKeys.START_ID);
        props.add(null);
        keys.add(ColumnKeys.END_ID);
        props.add(null);
        if (withType) {
            keys.add(ColumnKeys.TYPE);
            props.add(null);
        }
        for (PropertyColumn property : properties) {
            keys.add(null);
            props.add(property);
        }
        return new TableHeader(TableType.EDGE, keys, props);
    }

    /**
     * Parse and validate the header cells of a table.
     *
     * @throws MalformedHeaderException if a mandatory structural column is
     *         missing, a type tag is unknown or a column is repeated
     */
    public static TableHeader parse(TableType table, List<String> cells) {
        E.checkNotNull(table, "table");
        if (cells == null || cells.isEmpty() ||
            (cells.size() == 1 && StringUtils.isBlank(cells.get(0)))) {
            throw new MalformedHeaderException("The %s table has no header",
                                               table.string());
        }

        List<ColumnKeys> keys = new ArrayList<>(cells.size());
        List<PropertyColumn> props = new ArrayList<>(cells.size());
        Set<String> names = InsertionOrderUtil.newSet();
        for (String raw : cells) {
            String cell = raw.trim();
            if (cell.isEmpty()) {
                throw new MalformedHeaderException(
                          "Empty column name in %s table header %s",
                          table.string(), cells);
            }
            if (ColumnKeys.reserved(cell)) {
                ColumnKeys key = parseReserved(table, cell);
                if (!names.add(key.string())) {
                    throw new MalformedHeaderException(
                              "Duplicate column '%s' in %s table header",
                              key.string(), table.string());
                }
                keys.add(key);
                props.add(null);
            } else {
                PropertyColumn property = parseProperty(cell);
                if (!names.add(property.name())) {
                    throw new MalformedHeaderException(
                              "Duplicate column '%s' in %s table header",
                              property.name(), table.string());
                }
                keys.add(null);
                props.add(property);
            }
        }

        TableHeader header = new TableHeader(table, keys, props);
        for (ColumnKeys key : ColumnKeys.values()) {
            if (key.table() == table && key.mandatory() && !header.has(key)) {
                throw new MalformedHeaderException(
                          "The %s table header %s misses mandatory " +
                          "column '%s'", table.string(), cells, key.string());
            }
        }
        if (table == TableType.EDGE &&
            header.position(ColumnKeys.START_ID) >
            header.position(ColumnKeys.END_ID)) {
            throw new MalformedHeaderException(
                      "Column '%s' must precede '%s' in edge table header",
                      ColumnKeys.START_ID.string(), ColumnKeys.END_ID.string());
        }
        return header;
    }

    private static ColumnKeys parseReserved(TableType table, String cell) {
        int separator = cell.indexOf(PropertyColumn.TAG_SEPARATOR, 1);
        String name = separator < 0 ? cell : cell.substring(0, separator);
        String tag = separator < 0 ? null : cell.substring(separator + 1);

        ColumnKeys key = ColumnKeys.fromName(name);
        if (key == null) {
            throw new MalformedHeaderException("Unknown reserved column '%s'",
                                               cell);
        }
        if (key.table() != table) {
            throw new MalformedHeaderException(
                      "Column '%s' is not allowed in %s table header",
                      key.string(), table.string());
        }
        if (tag != null) {
            PropertyType type = PropertyType.parse(tag);
            if (key != ColumnKeys.LABEL ||
                type.dataType() != DataType.STRING) {
                throw new MalformedHeaderException(
                          "Invalid type tag '%s' of column '%s'",
                          tag, key.string());
            }
        }
        return key;
    }

    private static PropertyColumn parseProperty(String cell) {
        int separator = cell.lastIndexOf(PropertyColumn.TAG_SEPARATOR);
        if (separator < 0) {
            // An untagged property column holds strings
            return new PropertyColumn(cell, PropertyType.STRING);
        }
        String name = cell.substring(0, separator).trim();
        String tag = cell.substring(separator + 1);
        if (name.isEmpty()) {
            throw new MalformedHeaderException("Empty property name in " +
                                               "column '%s'", cell);
        }
        return new PropertyColumn(name, PropertyType.parse(tag));
    }

    public TableType table() {
        return this.table;
    }

    public int size() {
        return this.keys.size();
    }

    public boolean has(ColumnKeys key) {
        return this.positions.containsKey(key);
    }

    /**
     * @return the position of a structural column, or -1 if absent
     */
    public int position(ColumnKeys key) {
        Integer position = this.positions.get(key);
        return position == null ? -1 : position;
    }

    /**
     * @return the structural column at a position, or null for a property
     */
    public ColumnKeys key(int position) {
        return this.keys.get(position);
    }

    /**
     * @return the property column at a position, or null for a structural
     *         column
     */
    public PropertyColumn property(int position) {
        return this.properties.get(position);
    }

    public List<PropertyColumn> properties() {
        ImmutableList.Builder<PropertyColumn> builder = ImmutableList.builder();
        for (PropertyColumn property : this.properties) {
            if (property != null) {
                builder.add(property);
            }
        }
        return builder.build();
    }

    public String name(int position) {
        ColumnKeys key = this.keys.get(position);
        return key != null ? key.string() : this.properties.get(position).name();
    }

    /**
     * @return the header cells as written to the table
     */
    public List<String> cells() {
        List<String> cells = new ArrayList<>(this.size());
        for (int i = 0; i < this.size(); i++) {
            ColumnKeys key = this.keys.get(i);
            if (key == ColumnKeys.LABEL) {
                cells.add(key.string() + PropertyColumn.TAG_SEPARATOR +
                          PropertyType.STRING_LIST.string());
            } else if (key != null) {
                cells.add(key.string());
            } else {
                cells.add(this.properties.get(i).string());
            }
        }
        return cells;
    }

    @Override
    public String toString() {
        return String.format("%s%s", this.table.string(), this.cells());
    }
}
