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

import java.util.List;
import java.util.Objects;

import org.apache.hugegraph.util.E;

import com.google.common.collect.ImmutableList;

/**
 * A vertex: an opaque identifier, a property map and an ordered list of
 * labels. An empty label list means the vertex carries no labels.
 */
public class GraphVertex extends GraphElement {

    private final Object id;
    private List<String> labels;

    public GraphVertex(Object id) {
        E.checkArgumentNotNull(id, "The vertex id can't be null");
        this.id = id;
        this.labels = ImmutableList.of();
    }

    public Object id() {
        return this.id;
    }

    public List<String> labels() {
        return this.labels;
    }

    public void labels(List<String> labels) {
        if (labels == null) {
            this.labels = ImmutableList.of();
            return;
        }
        for (String label : labels) {
            E.checkArgumentNotNull(label, "The labels of vertex '%s' " +
                                   "can't contain null", this.id);
        }
        this.labels = ImmutableList.copyOf(labels);
    }

    public boolean hasLabels() {
        return !this.labels.isEmpty();
    }

    /**
     * A vertex created only because an edge referenced it carries neither
     * properties nor labels.
     */
    public boolean bare() {
        return !this.hasProperties() && !this.hasLabels();
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof GraphVertex)) {
            return false;
        }
        GraphVertex other = (GraphVertex) obj;
        return this.id.equals(other.id) &&
               this.labels.equals(other.labels) &&
               this.properties().equals(other.properties());
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.id, this.labels, this.properties());
    }

    @Override
    public String toString() {
        return String.format("v[%s]%s%s", this.id, this.labels,
                             this.properties());
    }
}
