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

import org.apache.hugegraph.util.E;

/**
 * The pair of tables produced by the encoder.
 */
public class OpenCypherBuffers {

    private final String vertices;
    private final String edges;

    public OpenCypherBuffers(String vertices, String edges) {
        E.checkNotNull(vertices, "vertices");
        E.checkNotNull(edges, "edges");
        this.vertices = vertices;
        this.edges = edges;
    }

    public String vertices() {
        return this.vertices;
    }

    public String edges() {
        return this.edges;
    }

    @Override
    public String toString() {
        return String.format("OpenCypherBuffers{vertices=%s chars, " +
                             "edges=%s chars}",
                             this.vertices.length(), this.edges.length());
    }
}
