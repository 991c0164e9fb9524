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

package org.graphbulk.unit;

import org.graphbulk.structure.MemoryGraph;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

public final class FakeGraphs {

    private FakeGraphs() {
    }

    /**
     * Alice and Bob, Bob's age unknown, one edge with an int property.
     */
    public static MemoryGraph people() {
        MemoryGraph graph = new MemoryGraph();
        graph.addVertex(1, ImmutableMap.of("name", "Alice", "age", 30));
        graph.addVertex(2, ImmutableMap.of("name", "Bob"));
        graph.addEdge(1, 2, ImmutableMap.of("since", 2020));
        return graph;
    }

    /**
     * A graph using every column type, labels and edge types.
     */
    public static MemoryGraph modern() {
        MemoryGraph graph = new MemoryGraph();
        graph.addVertex("marko", ImmutableMap.of(
                        "name", "marko", "age", 29, "weight", 60.5,
                        "active", true,
                        "tags", ImmutableList.of("java", "graph; db")),
                        ImmutableList.of("Person", "Employee"));
        graph.addVertex("vadas", ImmutableMap.of(
                        "name", "vadas", "age", 27, "active", false,
                        "scores", new int[]{3, 5, 8}),
                        ImmutableList.of("Person"));
        graph.addVertex("lop", ImmutableMap.of(
                        "name", "lop", "lang", "java, \"jdk\""),
                        ImmutableList.of("Software"));
        graph.addEdge("marko", "vadas", "knows",
                      ImmutableMap.of("weight", 0.5));
        graph.addEdge("marko", "lop", "created",
                      ImmutableMap.of("weight", 0.4, "year", 2009));
        graph.addEdge("vadas", "ripple", null, ImmutableMap.of());
        return graph;
    }
}
