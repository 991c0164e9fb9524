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

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import org.apache.hugegraph.util.E;
import org.apache.hugegraph.util.InsertionOrderUtil;

import com.google.common.collect.ImmutableList;

/**
 * An insertion-ordered, in-memory directed graph. By default it keeps every
 * edge that is added (a multigraph), {@link #simple()} creates a graph that
 * keeps at most one edge per (source, target) pair and merges the
 * properties of repeated edges into it.
 */
public class MemoryGraph implements BulkGraph {

    private final boolean multiEdges;
    private final Map<Object, GraphVertex> vertices;
    private final List<GraphEdge> edges;
    private final Map<List<Object>, GraphEdge> edgeIndex;

    public MemoryGraph() {
        this(true);
    }

    public MemoryGraph(boolean multiEdges) {
        this.multiEdges = multiEdges;
        this.vertices = InsertionOrderUtil.newMap();
        this.edges = InsertionOrderUtil.newList();
        this.edgeIndex = multiEdges ? null : InsertionOrderUtil.newMap();
    }

    public static MemoryGraph simple() {
        return new MemoryGraph(false);
    }

    public boolean multiEdges() {
        return this.multiEdges;
    }

    @Override
    public Iterator<GraphVertex> vertices() {
        return Collections.unmodifiableCollection(this.vertices.values())
                          .iterator();
    }

    @Override
    public Iterator<GraphEdge> edges() {
        return Collections.unmodifiableList(this.edges).iterator();
    }

    public List<GraphEdge> edges(Object sourceId, Object targetId) {
        ImmutableList.Builder<GraphEdge> builder = ImmutableList.builder();
        for (GraphEdge edge : this.edges) {
            if (edge.sourceId().equals(sourceId) &&
                edge.targetId().equals(targetId)) {
                builder.add(edge);
            }
        }
        return builder.build();
    }

    @Override
    public GraphVertex vertex(Object id) {
        return this.vertices.get(id);
    }

    @Override
    public GraphVertex addVertex(Object id, Map<String, ?> properties) {
        GraphVertex vertex = this.vertices.get(id);
        if (vertex == null) {
            vertex = new GraphVertex(id);
            this.vertices.put(id, vertex);
        }
        vertex.properties(properties);
        return vertex;
    }

    public GraphVertex addVertex(Object id, Map<String, ?> properties,
                                 List<String> labels) {
        GraphVertex vertex = this.addVertex(id, properties);
        vertex.labels(labels);
        return vertex;
    }

    @Override
    public GraphEdge addEdge(Object sourceId, Object targetId, String type,
                             Map<String, ?> properties) {
        this.ensureVertex(sourceId);
        this.ensureVertex(targetId);

        if (!this.multiEdges) {
            List<Object> key = ImmutableList.of(sourceId, targetId);
            GraphEdge existed = this.edgeIndex.get(key);
            if (existed != null) {
                if (type != null) {
                    existed.type(type);
                }
                existed.properties(properties);
                return existed;
            }
            GraphEdge edge = this.newEdge(sourceId, targetId, type, properties);
            this.edgeIndex.put(key, edge);
            return edge;
        }
        return this.newEdge(sourceId, targetId, type, properties);
    }

    private GraphEdge newEdge(Object sourceId, Object targetId, String type,
                              Map<String, ?> properties) {
        GraphEdge edge = new GraphEdge(sourceId, targetId, type);
        edge.properties(properties);
        this.edges.add(edge);
        return edge;
    }

    private void ensureVertex(Object id) {
        E.checkArgumentNotNull(id, "The edge endpoint id can't be null");
        if (!this.vertices.containsKey(id)) {
            this.vertices.put(id, new GraphVertex(id));
        }
    }

    @Override
    public List<String> labels(Object id) {
        return this.existedVertex(id).labels();
    }

    @Override
    public void labels(Object id, List<String> labels) {
        this.existedVertex(id).labels(labels);
    }

    private GraphVertex existedVertex(Object id) {
        GraphVertex vertex = this.vertices.get(id);
        E.checkArgument(vertex != null, "Vertex '%s' does not exist", id);
        return vertex;
    }

    @Override
    public long vertexCount() {
        return this.vertices.size();
    }

    @Override
    public long edgeCount() {
        return this.edges.size();
    }

    @Override
    public String toString() {
        return String.format("MemoryGraph{vertices=%s, edges=%s}",
                             this.vertices.size(), this.edges.size());
    }
}
