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

import java.io.StringWriter;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import org.graphbulk.config.GraphBulkOptions;
import org.graphbulk.structure.BulkGraph;
import org.graphbulk.structure.GraphEdge;
import org.graphbulk.structure.GraphElement;
import org.graphbulk.structure.GraphVertex;
import org.graphbulk.type.PropertyType;
import org.graphbulk.type.define.ColumnKeys;
import org.graphbulk.type.define.TableType;
import org.apache.hugegraph.config.HugeConfig;
import org.apache.hugegraph.util.E;
import org.apache.hugegraph.util.Log;
import org.slf4j.Logger;

import com.google.common.collect.ImmutableList;

/**
 * Writes a graph as an OpenCypher vertex table and edge table.
 *
 * Each table is produced in two strictly separate passes over the graph:
 * a scan pass that settles one type tag per property key, then an emit
 * pass that writes the header and one row per element in iteration order.
 * The graph is only read.
 */
public class OpenCypherEncoder {

    private static final Logger LOG = Log.logger(OpenCypherEncoder.class);

    private final String defaultVertexLabel;
    private final String defaultEdgeType;
    private final boolean sortColumns;

    public OpenCypherEncoder(HugeConfig config) {
        E.checkNotNull(config, "config");
        this.defaultVertexLabel = config.get(
                                  GraphBulkOptions.DEFAULT_VERTEX_LABEL);
        this.defaultEdgeType = config.get(GraphBulkOptions.DEFAULT_EDGE_TYPE);
        this.sortColumns = config.get(GraphBulkOptions.SORT_PROPERTY_COLUMNS);
    }

    public OpenCypherBuffers encode(BulkGraph graph) {
        StringWriter vertices = new StringWriter();
        StringWriter edges = new StringWriter();
        this.encode(graph, vertices, edges);
        return new OpenCypherBuffers(vertices.toString(), edges.toString());
    }

    /**
     * Write the vertex table and the edge table to the given writers.
     * The writers are flushed but not closed.
     */
    public void encode(BulkGraph graph, Writer vertexOut, Writer edgeOut) {
        E.checkNotNull(graph, "graph");
        E.checkNotNull(vertexOut, "vertex writer");
        E.checkNotNull(edgeOut, "edge writer");

        long vertices = this.encodeVertices(graph, vertexOut);
        long edges = this.encodeEdges(graph, edgeOut);
        LOG.info("Encoded graph with {} vertices and {} edges",
                 vertices, edges);
    }

    public TableHeader vertexHeader(BulkGraph graph) {
        TypeInference inference = new TypeInference();
        boolean withLabel = !this.defaultVertexLabel.isEmpty();
        Iterator<GraphVertex> iter = graph.vertices();
        while (iter.hasNext()) {
            GraphVertex vertex = iter.next();
            inference.observe(vertex.properties());
            withLabel |= vertex.hasLabels();
        }
        return TableHeader.vertex(inference.columns(this.sortColumns),
                                  withLabel);
    }

    public TableHeader edgeHeader(BulkGraph graph) {
        TypeInference inference = new TypeInference();
        boolean withType = !this.defaultEdgeType.isEmpty();
        Iterator<GraphEdge> iter = graph.edges();
        while (iter.hasNext()) {
            GraphEdge edge = iter.next();
            inference.observe(edge.properties());
            withType |= edge.hasType();
        }
        return TableHeader.edge(inference.columns(this.sortColumns), withType);
    }

    private long encodeVertices(BulkGraph graph, Writer out) {
        TableHeader header = this.vertexHeader(graph);
        LOG.debug("Vertex table header: {}", header);

        TableWriter writer = new TableWriter(TableType.VERTEX, out);
        writer.writeRow(header.cells());
        Iterator<GraphVertex> iter = graph.vertices();
        while (iter.hasNext()) {
            writer.writeRow(this.vertexRow(header, iter.next()));
        }
        writer.flush();
        return writer.rows() - 1L;
    }

    private long encodeEdges(BulkGraph graph, Writer out) {
        TableHeader header = this.edgeHeader(graph);
        LOG.debug("Edge table header: {}", header);

        TableWriter writer = new TableWriter(TableType.EDGE, out);
        writer.writeRow(header.cells());
        Iterator<GraphEdge> iter = graph.edges();
        while (iter.hasNext()) {
            writer.writeRow(this.edgeRow(header, iter.next()));
        }
        writer.flush();
        return writer.rows() - 1L;
    }

    private List<String> vertexRow(TableHeader header, GraphVertex vertex) {
        List<String> cells = new ArrayList<>(header.size());
        for (int i = 0; i < header.size(); i++) {
            ColumnKeys key = header.key(i);
            if (key == ColumnKeys.ID) {
                cells.add(idText(vertex.id()));
            } else if (key == ColumnKeys.LABEL) {
                cells.add(this.labelText(vertex));
            } else {
                assert key == null : key;
                cells.add(propertyText(vertex, header.property(i)));
            }
        }
        return cells;
    }

    private List<String> edgeRow(TableHeader header, GraphEdge edge) {
        List<String> cells = new ArrayList<>(header.size());
        for (int i = 0; i < header.size(); i++) {
            ColumnKeys key = header.key(i);
            if (key == ColumnKeys.START_ID) {
                cells.add(idText(edge.sourceId()));
            } else if (key == ColumnKeys.END_ID) {
                cells.add(idText(edge.targetId()));
            } else if (key == ColumnKeys.TYPE) {
                cells.add(edge.hasType() ? edge.type() : this.defaultEdgeType);
            } else {
                assert key == null : key;
                cells.add(propertyText(edge, header.property(i)));
            }
        }
        return cells;
    }

    private String labelText(GraphVertex vertex) {
        List<String> labels = vertex.labels();
        if (labels.isEmpty()) {
            if (this.defaultVertexLabel.isEmpty()) {
                return "";
            }
            labels = ImmutableList.of(this.defaultVertexLabel);
        }
        return TypeCodec.encode(ColumnKeys.LABEL.string(), labels,
                                PropertyType.STRING_LIST);
    }

    private static String propertyText(GraphElement element,
                                       PropertyColumn column) {
        Object value = element.property(column.name());
        return TypeCodec.encode(column.name(), value, column.type());
    }

    private static String idText(Object id) {
        String text = String.valueOf(id);
        E.checkArgument(!text.isEmpty(),
                        "The id of a vertex can't be an empty string");
        return text;
    }
}
