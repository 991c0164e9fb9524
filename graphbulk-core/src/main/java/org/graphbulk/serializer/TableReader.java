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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

import org.graphbulk.GraphBulkException;
import org.graphbulk.type.define.TableType;
import org.apache.hugegraph.util.E;

/**
 * Reads the records of a comma separated table written by
 * {@link TableWriter}. Quoted fields may span lines, both LF and CRLF line
 * endings are accepted. Line breaks at the end of input are ignored, a blank
 * line followed by more data is a record with one empty field.
 */
public class TableReader {

    private static final int EOF = -1;

    private final TableType table;
    private final Reader reader;
    private int peeked;
    private boolean hasPeeked;
    private int blankLines;

    public TableReader(TableType table, Reader reader) {
        E.checkNotNull(table, "table");
        E.checkNotNull(reader, "reader");
        this.table = table;
        this.reader = reader instanceof BufferedReader ?
                      reader : new BufferedReader(reader);
        this.hasPeeked = false;
        this.blankLines = 0;
    }

    public TableType table() {
        return this.table;
    }

    /**
     * @return the fields of the next record, or null at the end of input
     * @throws IllegalArgumentException if a quoted field is malformed
     */
    public List<String> next() {
        if (this.blankLines > 0) {
            this.blankLines--;
            return blankRecord();
        }
        int blanks = 0;
        int c = this.peek();
        while (c == '\n' || c == '\r') {
            this.read();
            this.skipLineFeed(c);
            blanks++;
            c = this.peek();
        }
        if (c == EOF) {
            return null;
        }
        if (blanks > 0) {
            this.blankLines = blanks - 1;
            return blankRecord();
        }
        return this.readRecord();
    }

    private static List<String> blankRecord() {
        List<String> fields = new ArrayList<>(1);
        fields.add("");
        return fields;
    }

    private List<String> readRecord() {
        List<String> fields = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean quoted = false;
        boolean fieldStart = true;
        while (true) {
            int c = this.read();
            if (quoted) {
                if (c == EOF) {
                    throw new IllegalArgumentException(
                              "Unterminated quoted field: " + field);
                }
                if (c != TableWriter.QUOTE) {
                    field.append((char) c);
                } else if (this.peek() == TableWriter.QUOTE) {
                    field.append(TableWriter.QUOTE);
                    this.read();
                } else {
                    quoted = false;
                    int next = this.peek();
                    if (next != TableWriter.FIELD_DELIMITER &&
                        next != '\n' && next != '\r' && next != EOF) {
                        throw new IllegalArgumentException(String.format(
                                  "Unexpected character '%s' after quoted " +
                                  "field: %s", (char) next, field));
                    }
                }
                continue;
            }
            if (c == TableWriter.QUOTE && fieldStart) {
                quoted = true;
                fieldStart = false;
            } else if (c == TableWriter.FIELD_DELIMITER) {
                fields.add(field.toString());
                field.setLength(0);
                fieldStart = true;
            } else if (c == '\n' || c == '\r' || c == EOF) {
                this.skipLineFeed(c);
                fields.add(field.toString());
                return fields;
            } else {
                field.append((char) c);
                fieldStart = false;
            }
        }
    }

    private void skipLineFeed(int c) {
        if (c == '\r' && this.peek() == '\n') {
            this.read();
        }
    }

    private int peek() {
        if (!this.hasPeeked) {
            this.peeked = this.readChar();
            this.hasPeeked = true;
        }
        return this.peeked;
    }

    private int read() {
        if (this.hasPeeked) {
            this.hasPeeked = false;
            return this.peeked;
        }
        return this.readChar();
    }

    private int readChar() {
        try {
            return this.reader.read();
        } catch (IOException e) {
            throw new GraphBulkException("Failed to read %s table",
                                         e, this.table.string());
        }
    }
}
