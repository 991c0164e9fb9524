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

package org.graphbulk;

import java.util.Map;

import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.lang3.StringUtils;
import org.graphbulk.config.GraphBulkOptions;
import org.graphbulk.serializer.OpenCypherDecoder;
import org.graphbulk.serializer.OpenCypherEncoder;
import org.apache.hugegraph.config.HugeConfig;
import org.apache.hugegraph.config.OptionSpace;
import org.apache.hugegraph.util.E;

public final class GraphBulkFactory {

    public static final String MODULE = "graphbulk";

    static {
        OptionSpace.register(MODULE, GraphBulkOptions.class.getName());
    }

    private GraphBulkFactory() {
    }

    public static HugeConfig newConfig() {
        return new HugeConfig(new PropertiesConfiguration());
    }

    /**
     * Load options from a properties file.
     */
    public static HugeConfig newConfig(String path) {
        E.checkArgument(StringUtils.isNotEmpty(path),
                        "The config path can't be null or empty");
        return new HugeConfig(path);
    }

    public static HugeConfig newConfig(Configuration config) {
        E.checkNotNull(config, "config");
        return new HugeConfig(config);
    }

    public static HugeConfig newConfig(Map<String, ?> options) {
        E.checkNotNull(options, "options");
        PropertiesConfiguration config = new PropertiesConfiguration();
        for (Map.Entry<String, ?> option : options.entrySet()) {
            config.addProperty(option.getKey(), option.getValue());
        }
        return new HugeConfig(config);
    }

    public static OpenCypherEncoder encoder() {
        return encoder(newConfig());
    }

    public static OpenCypherEncoder encoder(HugeConfig config) {
        return new OpenCypherEncoder(config);
    }

    public static OpenCypherDecoder decoder() {
        return decoder(newConfig());
    }

    public static OpenCypherDecoder decoder(HugeConfig config) {
        return new OpenCypherDecoder(config);
    }
}
