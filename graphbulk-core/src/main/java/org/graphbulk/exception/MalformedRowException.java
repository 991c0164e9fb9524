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

package org.graphbulk.exception;

import org.graphbulk.GraphBulkException;

/**
 * A data row that can't be turned into a vertex or an edge. The row index
 * counts data rows from 1 within the table (the header is not counted).
 */
public class MalformedRowException extends GraphBulkException {

    private static final long serialVersionUID = 8890745236128419457L;

    private final String table;
    private final long rowIndex;

    public MalformedRowException(String table, long rowIndex,
                                 String message, Object... args) {
        super(String.format("Invalid %s row %s: %s", table, rowIndex,
                            String.format(message, args)));
        this.table = table;
        this.rowIndex = rowIndex;
    }

    protected MalformedRowException(String table, long rowIndex,
                                    String message, Throwable cause) {
        super(String.format("Invalid %s row %s: %s", table, rowIndex,
                            message), cause);
        this.table = table;
        this.rowIndex = rowIndex;
    }

    public String table() {
        return this.table;
    }

    public long rowIndex() {
        return this.rowIndex;
    }
}
