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

package org.graphbulk.config;

import static org.apache.hugegraph.config.OptionChecker.disallowEmpty;

import org.apache.hugegraph.config.ConfigOption;
import org.apache.hugegraph.config.OptionHolder;

public class GraphBulkOptions extends OptionHolder {

    private GraphBulkOptions() {
        super();
    }

    private static volatile GraphBulkOptions instance;

    public static synchronized GraphBulkOptions instance() {
        if (instance == null) {
            instance = new GraphBulkOptions();
            // Should initialize all static members first, then register.
            instance.registerOptions();
        }
        return instance;
    }

    public static final ConfigOption<String> DEFAULT_VERTEX_LABEL =
            new ConfigOption<>(
                    "graphbulk.default_vertex_label",
                    "The label written for vertices without any label, " +
                    "empty value means no label is written.",
                    null,
                    ""
            );

    public static final ConfigOption<String> DEFAULT_EDGE_TYPE =
            new ConfigOption<>(
                    "graphbulk.default_edge_type",
                    "The relationship type written for edges without a " +
                    "type, empty value means no type is written.",
                    null,
                    ""
            );

    public static final ConfigOption<Boolean> SORT_PROPERTY_COLUMNS =
            new ConfigOption<>(
                    "graphbulk.sort_property_columns",
                    "Whether to sort property columns by name instead of " +
                    "the order in which keys are first seen.",
                    disallowEmpty(),
                    false
            );

    public static final ConfigOption<Boolean> MULTI_EDGES =
            new ConfigOption<>(
                    "graphbulk.multi_edges",
                    "Whether the decoded graph keeps repeated edges between " +
                    "the same pair of vertices, otherwise their properties " +
                    "are merged into one edge.",
                    disallowEmpty(),
                    true
            );

    public static final ConfigOption<Boolean> HEADER_CHECK =
            new ConfigOption<>(
                    "graphbulk.header_check",
                    "Whether a later buffer of a table whose first record " +
                    "looks like a header different from the first buffer's " +
                    "header is rejected, otherwise the record is read as data.",
                    disallowEmpty(),
                    true
            );
}
