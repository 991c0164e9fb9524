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

import java.io.IOException;
import java.io.Writer;
import java.util.List;

import org.graphbulk.GraphBulkException;
import org.graphbulk.type.define.TableType;
import org.apache.hugegraph.util.E;

/**
 * Writes rows of a comma separated table, one row per line. A field that
 * contains the delimiter, a quote or a line break is wrapped in double
 * quotes with inner quotes doubled.
 */
public class TableWriter {

    public static final char FIELD_DELIMITER = ',';
    public static final char QUOTE = '"';
    public static final char LINE_SEPARATOR = '\n';

    private final TableType table;
    private final Writer writer;
    private long rows;

    public TableWriter(TableType table, Writer writer) {
        E.checkNotNull(table, "table");
        E.checkNotNull(writer, "writer");
        this.table = table;
        this.writer = writer;
        this.rows = 0L;
    }

    public void writeRow(List<String> cells) {
        StringBuilder sb = new StringBuilder(16 * cells.size());
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) {
                sb.append(FIELD_DELIMITER);
            }
            appendField(sb, cells.get(i));
        }
        sb.append(LINE_SEPARATOR);
        try {
            this.writer.write(sb.toString());
        } catch (IOException e) {
            throw new GraphBulkException("Failed to write row %s of %s table",
                                         e, this.rows, this.table.string());
        }
        this.rows++;
    }

    public void flush() {
        try {
            this.writer.flush();
        } catch (IOException e) {
            throw new GraphBulkException("Failed to flush %s table",
                                         e, this.table.string());
        }
    }

    /**
     * @return the number of rows written, the header included
     */
    public long rows() {
        return this.rows;
    }

    private static void appendField(StringBuilder sb, String field) {
        if (field == null || field.isEmpty()) {
            return;
        }
        if (!needQuote(field)) {
            sb.append(field);
            return;
        }
        sb.append(QUOTE);
        for (int i = 0; i < field.length(); i++) {
            char c = field.charAt(i);
            if (c == QUOTE) {
                sb.append(QUOTE);
            }
            sb.append(c);
        }
        sb.append(QUOTE);
    }

    private static boolean needQuote(String field) {
        for (int i = 0; i < field.length(); i++) {
            char c = field.charAt(i);
            if (c == FIELD_DELIMITER || c == QUOTE ||
                c == '\n' || c == '\r') {
                return true;
            }
        }
        return false;
    }
}
