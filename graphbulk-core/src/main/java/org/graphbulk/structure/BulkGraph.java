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

import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * The operations the codec needs from a directed graph. Adapt any graph
 * library by implementing this interface, {@link MemoryGraph} is the
 * built-in implementation.
 */
public interface BulkGraph {

    /**
     * Iterate vertices in a stable order, the encoder writes rows in the
     * same order.
     */
    Iterator<GraphVertex> vertices();

    /**
     * Iterate edges in a stable order.
     */
    Iterator<GraphEdge> edges();

    /**
     * @return the vertex with the given id, or null if absent
     */
    GraphVertex vertex(Object id);

    /**
     * Add a vertex or merge the given properties into an existing one,
     * later values overwrite earlier ones key by key.
     */
    GraphVertex addVertex(Object id, Map<String, ?> properties);

    /**
     * Add an edge, creating either endpoint as a vertex without properties
     * or labels if it doesn't exist yet.
     */
    GraphEdge addEdge(Object sourceId, Object targetId, String type,
                      Map<String, ?> properties);

    default GraphEdge addEdge(Object sourceId, Object targetId,
                              Map<String, ?> properties) {
        return this.addEdge(sourceId, targetId, null, properties);
    }

    /**
     * @return the labels of an existing vertex, empty if it has none
     */
    List<String> labels(Object id);

    /**
     * Replace the labels of an existing vertex.
     */
    void labels(Object id, List<String> labels);

    long vertexCount();

    long edgeCount();
}
