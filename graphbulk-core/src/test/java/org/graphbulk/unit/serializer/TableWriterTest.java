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

package org.graphbulk.unit.serializer;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.Writer;
import java.util.Arrays;
import java.util.List;

import org.graphbulk.GraphBulkException;
import org.graphbulk.serializer.TableReader;
import org.graphbulk.serializer.TableWriter;
import org.graphbulk.type.define.TableType;
import org.apache.hugegraph.testutil.Assert;
import org.junit.Test;
import org.mockito.Mockito;

import com.google.common.collect.ImmutableList;

public class TableWriterTest {

    @Test
    public void testWriteRows() {
        StringWriter out = new StringWriter();
        TableWriter writer = new TableWriter(TableType.VERTEX, out);
        writer.writeRow(ImmutableList.of(":ID", "name:string"));
        writer.writeRow(ImmutableList.of("1", "Alice"));
        writer.writeRow(Arrays.asList("2", null));
        writer.writeRow(ImmutableList.of("3", ""));
        writer.flush();

        Assert.assertEquals(4L, writer.rows());
        Assert.assertEquals(":ID,name:string\n1,Alice\n2,\n3,\n",
                            out.toString());
    }

    @Test
    public void testWriteQuotedFields() {
        StringWriter out = new StringWriter();
        TableWriter writer = new TableWriter(TableType.EDGE, out);
        writer.writeRow(ImmutableList.of("a,b", "say \"hi\"", "x\ny", "p\rq",
                                         "plain;text"));
        Assert.assertEquals("\"a,b\",\"say \"\"hi\"\"\",\"x\ny\",\"p\rq\"," +
                            "plain;text\n", out.toString());
    }

    @Test
    public void testWrittenFieldsReadBack() {
        List<String> row = ImmutableList.of("a,b", "\"", "", "line1\r\nline2",
                                            "a\"b\"c", "  spaced  ");
        StringWriter out = new StringWriter();
        new TableWriter(TableType.VERTEX, out).writeRow(row);

        TableReader reader = new TableReader(TableType.VERTEX,
                                             new StringReader(out.toString()));
        Assert.assertEquals(row, reader.next());
        Assert.assertNull(reader.next());
    }

    @Test
    public void testWriteFailure() throws IOException {
        Writer failing = Mockito.mock(Writer.class);
        Mockito.doThrow(new IOException("disk full"))
               .when(failing).write(Mockito.anyString());
        Mockito.doThrow(new IOException("closed"))
               .when(failing).flush();

        TableWriter writer = new TableWriter(TableType.EDGE, failing);
        Assert.assertThrows(GraphBulkException.class, () -> {
            writer.writeRow(ImmutableList.of("1", "2"));
        }, e -> {
            Assert.assertContains("Failed to write row 0 of edge table",
                                  e.getMessage());
            Assert.assertInstanceOf(IOException.class, e.getCause());
        });
        Assert.assertEquals(0L, writer.rows());

        Assert.assertThrows(GraphBulkException.class, writer::flush, e -> {
            Assert.assertContains("Failed to flush edge table",
                                  e.getMessage());
        });
    }
}
