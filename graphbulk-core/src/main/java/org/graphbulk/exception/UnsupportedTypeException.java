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
 * A property value whose runtime type can't be mapped to any type tag,
 * e.g. a nested map or an array mixing element types.
 */
public class UnsupportedTypeException extends GraphBulkException {

    private static final long serialVersionUID = 5137905427519380246L;

    private final String key;
    private final transient Object value;

    public UnsupportedTypeException(String key, Object value, String reason) {
        super("Unsupported value of property '%s': %s (%s)",
              key, value, reason);
        this.key = key;
        this.value = value;
    }

    public String key() {
        return this.key;
    }

    public Object value() {
        return this.value;
    }
}
