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

/**
 * A cell whose text doesn't parse as the type declared by its column.
 */
public class MalformedValueException extends MalformedRowException {

    private static final long serialVersionUID = -7048113590241958820L;

    private final String column;

    public MalformedValueException(String table, long rowIndex, String column,
                                   IllegalArgumentException cause) {
        super(table, rowIndex,
              String.format("can't read column '%s': %s",
                            column, cause.getMessage()),
              cause);
        this.column = column;
    }

    public String column() {
        return this.column;
    }
}
