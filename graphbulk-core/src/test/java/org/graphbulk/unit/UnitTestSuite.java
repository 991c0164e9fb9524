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

package org.graphbulk.unit;

import org.graphbulk.unit.config.GraphBulkOptionsTest;
import org.graphbulk.unit.serializer.OpenCypherDecoderTest;
import org.graphbulk.unit.serializer.OpenCypherEncoderTest;
import org.graphbulk.unit.serializer.RoundTripTest;
import org.graphbulk.unit.serializer.TableHeaderTest;
import org.graphbulk.unit.serializer.TableReaderTest;
import org.graphbulk.unit.serializer.TableWriterTest;
import org.graphbulk.unit.serializer.TypeCodecTest;
import org.graphbulk.unit.serializer.TypeInferenceTest;
import org.graphbulk.unit.structure.MemoryGraphTest;
import org.graphbulk.unit.type.PropertyTypeTest;
import org.junit.runner.RunWith;
import org.junit.runners.Suite;

@RunWith(Suite.class)
@Suite.SuiteClasses({
    PropertyTypeTest.class,
    MemoryGraphTest.class,
    GraphBulkOptionsTest.class,

    TypeCodecTest.class,
    TypeInferenceTest.class,
    TableHeaderTest.class,
    TableReaderTest.class,
    TableWriterTest.class,

    OpenCypherEncoderTest.class,
    OpenCypherDecoderTest.class,
    RoundTripTest.class
})
public class UnitTestSuite {
}
