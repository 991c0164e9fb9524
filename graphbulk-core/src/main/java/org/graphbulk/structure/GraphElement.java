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

import java.util.Collections;
import java.util.Map;

import org.apache.hugegraph.util.E;
import org.apache.hugegraph.util.InsertionOrderUtil;

/* Only as basic data container, the graph owns identity and linking */
public abstract class GraphElement {

    private final Map<String, Object> properties;

    public GraphElement() {
        this.properties = InsertionOrderUtil.newMap();
    }

    public Map<String, Object> properties() {
        return Collections.unmodifiableMap(this.properties);
    }

    public boolean hasProperties() {
        return !this.properties.isEmpty();
    }

    public boolean hasProperty(String key) {
        return this.properties.containsKey(key);
    }

    @SuppressWarnings("unchecked")
    public <V> V property(String key) {
        return (V) this.properties.get(key);
    }

    /**
     * Set a property, a null value removes the key so that an element never
     * holds null values.
     */
    public void property(String key, Object value) {
        E.checkArgumentNotNull(key, "The property key can't be null");
        if (value == null) {
            this.properties.remove(key);
        } else {
            this.properties.put(key, value);
        }
    }

    public void properties(Map<String, ?> properties) {
        if (properties == null) {
            return;
        }
        for (Map.Entry<String, ?> e : properties.entrySet()) {
            this.property(e.getKey(), e.getValue());
        }
    }
}
