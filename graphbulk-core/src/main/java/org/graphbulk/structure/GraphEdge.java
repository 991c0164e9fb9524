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

package org.graphbulk.structure;

import java.util.Objects;

import org.apache.commons.lang3.StringUtils;
import org.apache.hugegraph.util.E;

/**
 * A directed edge between two vertex ids. Edges have no identity of their
 * own, an optional relationship type is written to the {@code :TYPE} column.
 */
public class GraphEdge extends GraphElement {

    private final Object sourceId;
    private final Object targetId;
    private String type;

    public GraphEdge(Object sourceId, Object targetId) {
        this(sourceId, targetId, null);
    }

    public GraphEdge(Object sourceId, Object targetId, String type) {
        E.checkArgumentNotNull(sourceId, "The source id can't be null");
        E.checkArgumentNotNull(targetId, "The target id can't be null");
        this.sourceId = sourceId;
        this.targetId = targetId;
        this.type = type;
    }

    public Object sourceId() {
        return this.sourceId;
    }

    public Object targetId() {
        return this.targetId;
    }

    public String type() {
        return this.type;
    }

    public void type(String type) {
        this.type = type;
    }

    public boolean hasType() {
        return StringUtils.isNotEmpty(this.type);
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof GraphEdge)) {
            return false;
        }
        GraphEdge other = (GraphEdge) obj;
        return this.sourceId.equals(other.sourceId) &&
               this.targetId.equals(other.targetId) &&
               Objects.equals(this.type, other.type) &&
               this.properties().equals(other.properties());
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.sourceId, this.targetId, this.type,
                            this.properties());
    }

    @Override
    public String toString() {
        return String.format("e[%s->%s]%s%s", this.sourceId, this.targetId,
                             this.type == null ? "" : ":" + this.type,
                             this.properties());
    }
}
