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

package org.graphbulk.type;

import java.util.Objects;

import org.graphbulk.exception.MalformedHeaderException;
import org.graphbulk.type.define.Cardinality;
import org.graphbulk.type.define.DataType;
import org.apache.hugegraph.util.E;

/**
 * The type tag of a column: a scalar data type plus a cardinality, written
 * in headers as e.g. {@code int}, {@code string[]}.
 */
public final class PropertyType {

    public static final PropertyType BOOLEAN = of(DataType.BOOLEAN);
    public static final PropertyType INT = of(DataType.INT);
    public static final PropertyType FLOAT = of(DataType.FLOAT);
    public static final PropertyType STRING = of(DataType.STRING);
    public static final PropertyType BOOLEAN_LIST = listOf(DataType.BOOLEAN);
    public static final PropertyType INT_LIST = listOf(DataType.INT);
    public static final PropertyType FLOAT_LIST = listOf(DataType.FLOAT);
    public static final PropertyType STRING_LIST = listOf(DataType.STRING);

    private final DataType dataType;
    private final Cardinality cardinality;

    private PropertyType(DataType dataType, Cardinality cardinality) {
        E.checkNotNull(dataType, "dataType");
        E.checkNotNull(cardinality, "cardinality");
        this.dataType = dataType;
        this.cardinality = cardinality;
    }

    public static PropertyType of(DataType dataType) {
        return new PropertyType(dataType, Cardinality.SINGLE);
    }

    public static PropertyType listOf(DataType dataType) {
        return new PropertyType(dataType, Cardinality.LIST);
    }

    public DataType dataType() {
        return this.dataType;
    }

    public Cardinality cardinality() {
        return this.cardinality;
    }

    public boolean isList() {
        return this.cardinality.multiple();
    }

    /**
     * Widen two column types seen for the same key. Scalars and arrays
     * never mix, such a conflict collapses to a plain string column.
     */
    public PropertyType widen(PropertyType other) {
        if (this.equals(other)) {
            return this;
        }
        if (this.cardinality != other.cardinality) {
            return STRING;
        }
        return new PropertyType(this.dataType.widen(other.dataType),
                                this.cardinality);
    }

    public String string() {
        return this.dataType.string() + this.cardinality.suffix();
    }

    /**
     * Parse a header tag like {@code Long}, {@code float[]} or
     * {@code string}, matching data type aliases case-insensitively.
     */
    public static PropertyType parse(String tag) {
        E.checkNotNull(tag, "tag");
        String name = tag.trim();
        Cardinality cardinality = Cardinality.SINGLE;
        String suffix = Cardinality.LIST.suffix();
        if (name.endsWith(suffix)) {
            name = name.substring(0, name.length() - suffix.length());
            cardinality = Cardinality.LIST;
        }
        DataType dataType = DataType.fromName(name);
        if (dataType == null) {
            throw new MalformedHeaderException("Unknown type tag '%s'", tag);
        }
        return new PropertyType(dataType, cardinality);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof PropertyType)) {
            return false;
        }
        PropertyType other = (PropertyType) obj;
        return this.dataType == other.dataType &&
               this.cardinality == other.cardinality;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.dataType, this.cardinality);
    }

    @Override
    public String toString() {
        return this.string();
    }
}
