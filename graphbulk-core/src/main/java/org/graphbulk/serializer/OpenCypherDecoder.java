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

import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.graphbulk.config.GraphBulkOptions;
import org.graphbulk.exception.MalformedHeaderException;
import org.graphbulk.exception.MalformedRowException;
import org.graphbulk.exception.MalformedValueException;
import org.graphbulk.structure.BulkGraph;
import org.graphbulk.structure.MemoryGraph;
import org.graphbulk.type.PropertyType;
import org.graphbulk.type.define.ColumnKeys;
import org.graphbulk.type.define.TableType;
import org.apache.hugegraph.config.HugeConfig;
import org.apache.hugegraph.util.E;
import org.apache.hugegraph.util.InsertionOrderUtil;
import org.apache.hugegraph.util.Log;
import org.slf4j.Logger;

import com.google.common.collect.ImmutableList;

/**
 * Rebuilds a graph from an OpenCypher vertex table and edge table.
 *
 * Decoding runs in three steps: every header is parsed and validated, then
 * every row is decoded into a record, and only then the graph is touched.
 * Edges are added before vertices so that an edge creates any endpoint the
 * vertex table doesn't mention; vertex rows are then merged into the graph,
 * a repeated vertex id overwrites earlier values key by key.
 *
 * Readers are consumed but not closed.
 */
public class OpenCypherDecoder {

    private static final Logger LOG = Log.logger(OpenCypherDecoder.class);

    private final boolean multiEdges;
    private final boolean headerCheck;

    public OpenCypherDecoder(HugeConfig config) {
        E.checkNotNull(config, "config");
        this.multiEdges = config.get(GraphBulkOptions.MULTI_EDGES);
        this.headerCheck = config.get(GraphBulkOptions.HEADER_CHECK);
    }

    public MemoryGraph decode(String vertices, String edges) {
        E.checkNotNull(vertices, "vertex table");
        E.checkNotNull(edges, "edge table");
        return this.decode(new StringReader(vertices), new StringReader(edges));
    }

    public MemoryGraph decode(Reader vertexBuffer, Reader edgeBuffer) {
        return this.decode(ImmutableList.of(vertexBuffer),
                           ImmutableList.of(edgeBuffer),
                           new MemoryGraph(this.multiEdges));
    }

    /**
     * Decode several vertex buffers and several edge buffers into a target
     * graph. Later buffers of a table may repeat the header of the first
     * one or start directly with data rows.
     *
     * The target is left untouched if any header or row is malformed.
     */
    public <G extends BulkGraph> G decode(List<? extends Reader> vertexBuffers,
                                          List<? extends Reader> edgeBuffers,
                                          G target) {
        E.checkArgument(vertexBuffers != null && !vertexBuffers.isEmpty(),
                        "At least one vertex buffer is required");
        E.checkArgument(edgeBuffers != null && !edgeBuffers.isEmpty(),
                        "At least one edge buffer is required");
        E.checkNotNull(target, "target graph");

        // Headers first, fail before any row is read
        Table edgeTable = this.openTable(TableType.EDGE, edgeBuffers);
        Table vertexTable = this.openTable(TableType.VERTEX, vertexBuffers);
        LOG.debug("Edge table header: {}, vertex table header: {}",
                  edgeTable.header, vertexTable.header);

        List<EdgeRecord> edges = this.readEdges(edgeTable);
        List<VertexRecord> vertices = this.readVertices(vertexTable);

        for (EdgeRecord edge : edges) {
            target.addEdge(edge.sourceId, edge.targetId, edge.type,
                           edge.properties);
        }
        LOG.debug("Added {} edges, {} vertices exist before reading the " +
                  "vertex table", edges.size(), target.vertexCount());
        Set<String> ids = InsertionOrderUtil.newSet();
        for (VertexRecord vertex : vertices) {
            if (!ids.add(vertex.id)) {
                LOG.warn("Vertex '{}' appears more than once in the vertex " +
                         "table, the last row wins", vertex.id);
            }
            target.addVertex(vertex.id, vertex.properties);
            if (vertex.labels != null) {
                target.labels(vertex.id, vertex.labels);
            }
        }

        LOG.info("Decoded {} vertex rows and {} edge rows into graph with " +
                 "{} vertices", vertices.size(), edges.size(),
                 target.vertexCount());
        return target;
    }

    private Table openTable(TableType type, List<? extends Reader> buffers) {
        List<TableReader> readers = new ArrayList<>(buffers.size());
        for (Reader buffer : buffers) {
            E.checkNotNull(buffer, "buffer");
            readers.add(new TableReader(type, buffer));
        }

        List<String> cells = readHeader(readers.get(0));
        if (cells == null) {
            throw new MalformedHeaderException("The %s table has no header",
                                               type.string());
        }
        TableHeader header = TableHeader.parse(type, cells);

        Table table = new Table(header, readers);
        for (int i = 1; i < readers.size(); i++) {
            List<String> first = readHeader(readers.get(i));
            if (first == null || sameHeader(cells, first)) {
                continue;
            }
            if (this.headerCheck && looksLikeHeader(first)) {
                throw new MalformedHeaderException(
                          "The header %s of %s buffer %s differs from the " +
                          "first header %s", first, type.string(), i, cells);
            }
            // No header, the first record is a data row
            table.pending[i] = first;
        }
        return table;
    }

    private List<EdgeRecord> readEdges(Table table) {
        TableHeader header = table.header;
        List<EdgeRecord> records = new ArrayList<>();
        long row = 0L;
        for (int i = 0; i < table.readers.size(); i++) {
            TableReader reader = table.readers.get(i);
            List<String> cells = table.pending[i];
            if (cells == null) {
                cells = this.nextRecord(reader, row + 1L);
            }
            while (cells != null) {
                row++;
                checkColumnCount(header, cells, row);

                EdgeRecord record = new EdgeRecord();
                record.properties = InsertionOrderUtil.newMap();
                for (int c = 0; c < cells.size(); c++) {
                    ColumnKeys key = header.key(c);
                    String cell = cells.get(c);
                    if (key == ColumnKeys.START_ID) {
                        record.sourceId = checkId(header, cell, key, row);
                    } else if (key == ColumnKeys.END_ID) {
                        record.targetId = checkId(header, cell, key, row);
                    } else if (key == ColumnKeys.TYPE) {
                        record.type = cell.isEmpty() ? null : cell;
                    } else {
                        decodeProperty(header, header.property(c), cell,
                                       row, record.properties);
                    }
                }
                records.add(record);
                cells = this.nextRecord(reader, row + 1L);
            }
        }
        return records;
    }

    private List<VertexRecord> readVertices(Table table) {
        TableHeader header = table.header;
        List<VertexRecord> records = new ArrayList<>();
        long row = 0L;
        for (int i = 0; i < table.readers.size(); i++) {
            TableReader reader = table.readers.get(i);
            List<String> cells = table.pending[i];
            if (cells == null) {
                cells = this.nextRecord(reader, row + 1L);
            }
            while (cells != null) {
                row++;
                checkColumnCount(header, cells, row);

                VertexRecord record = new VertexRecord();
                record.properties = InsertionOrderUtil.newMap();
                for (int c = 0; c < cells.size(); c++) {
                    ColumnKeys key = header.key(c);
                    String cell = cells.get(c);
                    if (key == ColumnKeys.ID) {
                        record.id = checkId(header, cell, key, row);
                    } else if (key == ColumnKeys.LABEL) {
                        record.labels = decodeLabels(header, cell, row);
                    } else {
                        decodeProperty(header, header.property(c), cell,
                                       row, record.properties);
                    }
                }
                records.add(record);
                cells = this.nextRecord(reader, row + 1L);
            }
        }
        return records;
    }

    private static List<String> readHeader(TableReader reader) {
        try {
            return reader.next();
        } catch (IllegalArgumentException e) {
            throw new MalformedHeaderException("Invalid %s table header: %s",
                                               reader.table().string(),
                                               e.getMessage());
        }
    }

    private List<String> nextRecord(TableReader reader, long row) {
        try {
            return reader.next();
        } catch (IllegalArgumentException e) {
            throw new MalformedRowException(reader.table().string(), row,
                                            "%s", e.getMessage());
        }
    }

    private static void checkColumnCount(TableHeader header,
                                         List<String> cells, long row) {
        if (cells.size() != header.size()) {
            throw new MalformedRowException(
                      header.table().string(), row,
                      "expect %s columns as the header, but got %s",
                      header.size(), cells.size());
        }
    }

    private static String checkId(TableHeader header, String cell,
                                  ColumnKeys key, long row) {
        if (cell.isEmpty()) {
            throw new MalformedRowException(header.table().string(), row,
                                            "the value of column '%s' " +
                                            "can't be empty", key.string());
        }
        return cell;
    }

    private static void decodeProperty(TableHeader header,
                                       PropertyColumn column, String cell,
                                       long row, Map<String, Object> props) {
        Object value;
        try {
            value = TypeCodec.decode(cell, column.type());
        } catch (IllegalArgumentException e) {
            throw new MalformedValueException(header.table().string(), row,
                                              column.name(), e);
        }
        if (value != null) {
            props.put(column.name(), value);
        }
    }

    private static List<String> decodeLabels(TableHeader header, String cell,
                                             long row) {
        Object value;
        try {
            value = TypeCodec.decode(cell, PropertyType.STRING_LIST);
        } catch (IllegalArgumentException e) {
            throw new MalformedValueException(header.table().string(), row,
                                              ColumnKeys.LABEL.string(), e);
        }
        if (value == null) {
            return null;
        }
        ImmutableList.Builder<String> labels = ImmutableList.builder();
        for (Object label : (List<?>) value) {
            labels.add((String) label);
        }
        return labels.build();
    }

    private static boolean sameHeader(List<String> header,
                                      List<String> cells) {
        if (header.size() != cells.size()) {
            return false;
        }
        for (int i = 0; i < header.size(); i++) {
            if (!header.get(i).trim().equals(cells.get(i).trim())) {
                return false;
            }
        }
        return true;
    }

    private static boolean looksLikeHeader(List<String> cells) {
        for (String cell : cells) {
            String name = cell.trim();
            int separator = name.indexOf(PropertyColumn.TAG_SEPARATOR, 1);
            if (separator > 0) {
                name = name.substring(0, separator);
            }
            if (ColumnKeys.reserved(name) &&
                ColumnKeys.fromName(name) != null) {
                return true;
            }
        }
        return false;
    }

    private static class Table {

        private final TableHeader header;
        private final List<TableReader> readers;
        private final List<String>[] pending;

        @SuppressWarnings("unchecked")
        public Table(TableHeader header, List<TableReader> readers) {
            this.header = header;
            this.readers = readers;
            this.pending = new List[readers.size()];
        }
    }

    private static class EdgeRecord {

        private String sourceId;
        private String targetId;
        private String type;
        private Map<String, Object> properties;
    }

    private static class VertexRecord {

        private String id;
        private List<String> labels;
        private Map<String, Object> properties;
    }
}
