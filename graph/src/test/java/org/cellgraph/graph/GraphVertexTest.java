/*
 * Copyright 2010 - 2023 JetBrains s.r.o.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.cellgraph.graph;

import org.cellgraph.ErrorKind;
import org.cellgraph.Outcome;
import org.cellgraph.TestUtil;
import org.cellgraph.cell.CellId;
import org.cellgraph.schema.Field;
import org.cellgraph.schema.FieldType;
import org.cellgraph.schema.Schema;
import org.cellgraph.schema.SchemaDescriptor;
import org.junit.Assert;
import org.junit.Test;

import java.util.Map;

public class GraphVertexTest extends GraphTestsBase {

    @Test
    public void createThenReadHidesAdjacency() {
        final Map<String, Object> data = data("name", "alice", "age", 30);
        final Vertex created = TestUtil.assertOk(graph.newVertex(person, data));
        final Vertex read = TestUtil.assertOk(graph.readVertex(created.getId()));
        Assert.assertEquals(data, read.getData());
        Assert.assertTrue(read.getAdjacency().isEmpty());
        final CellId bob = newPerson("bob");
        link(knows, created.getId(), bob);
        final Vertex linked = TestUtil.assertOk(graph.readVertex(created.getId()));
        Assert.assertEquals(data, linked.getData());
        Assert.assertFalse(linked.getAdjacency().get(Direction.OUTBOUND).isUnit());
        Assert.assertTrue(linked.getAdjacency().get(Direction.INBOUND).isUnit());
        for (final String field : linked.getData().keySet()) {
            Assert.assertFalse(GraphSchemas.isReserved(field));
        }
    }

    @Test
    public void createInTransaction() {
        final Map<String, Object> data = data("name", "carol");
        final Vertex created = inTransaction(txn -> txn.newVertex(person, data));
        Assert.assertEquals(data, TestUtil.assertOk(graph.getVertex(person, "carol")).getData());
        Assert.assertEquals(created.getId(), graph.getStore().encodeKey(person, "carol"));
        Assert.assertEquals(created, inTransaction(txn -> txn.readVertex(created.getId())));
    }

    @Test
    public void duplicateKey() {
        newPerson("alice");
        TestUtil.assertFatal(ErrorKind.CELL_ALREADY_EXISTS, graph.newVertex(person, data("name", "alice", "age", 1)));
    }

    @Test
    public void validation() {
        TestUtil.assertFatal(ErrorKind.SCHEMA_NOT_FOUND, graph.newVertex(9999, data("name", "x")));
        TestUtil.assertFatal(ErrorKind.SCHEMA_NOT_VERTEX, graph.newVertex(knows, data("name", "x")));
        TestUtil.assertFatal(ErrorKind.RESERVED_FIELD, graph.newVertex(person, data("name", "x", "_inbound", CellId.random())));
        TestUtil.assertFatal(ErrorKind.DATA_NOT_MATCH_SCHEMA, graph.newVertex(person, data("name", "x", "age", "old")));
        TestUtil.assertFatal(ErrorKind.DATA_NOT_MATCH_SCHEMA, graph.newVertex(person, data("age", 1)));
    }

    @Test
    public void readAbsent() {
        Assert.assertNull(TestUtil.assertOk(graph.readVertex(CellId.random())));
        Assert.assertNull(TestUtil.assertOk(graph.getVertex(person, "nobody")));
    }

    @Test
    public void readNonVertexCell() {
        final Edge edge = link(rated, newPerson("alice"), newPerson("bob"), data("stars", 4));
        TestUtil.assertFatal(ErrorKind.SCHEMA_NOT_VERTEX, graph.readVertex(edge.getBodyId()));
    }

    @Test
    public void update() {
        final CellId alice = newPerson("alice");
        final Vertex updated = TestUtil.assertOk(graph.updateVertex(alice, v -> v.with("age", 31)));
        Assert.assertEquals(31, updated.get("age"));
        Assert.assertEquals(31, TestUtil.assertOk(graph.getVertex(person, "alice")).get("age"));
        final Vertex byKey = TestUtil.assertOk(graph.updateVertexByKey(person, "alice", v -> v.with("age", 32L)));
        Assert.assertEquals(32L, byKey.get("age"));
    }

    @Test
    public void updateReturningNullIsNoOp() {
        final CellId alice = newPerson("alice");
        final Vertex before = TestUtil.assertOk(graph.readVertex(alice));
        final Outcome<Vertex> result = graph.updateVertex(alice, v -> null);
        Assert.assertEquals(before, TestUtil.assertOk(result));
        Assert.assertEquals(before, TestUtil.assertOk(graph.readVertex(alice)));
    }

    @Test
    public void updateErrors() {
        final CellId alice = newPerson("alice");
        TestUtil.assertFatal(ErrorKind.KEY_FIELD_CHANGED, graph.updateVertex(alice, v -> v.with("name", "alicia")));
        TestUtil.assertFatal(ErrorKind.DATA_NOT_MATCH_SCHEMA, graph.updateVertex(alice, v -> v.with("age", "old")));
        TestUtil.assertFatal(ErrorKind.RESERVED_FIELD, graph.updateVertex(alice, v -> v.with("_outbound", CellId.random())));
        TestUtil.assertFatal(ErrorKind.DATA_NOT_MATCH_SCHEMA, graph.updateVertex(alice, v -> Vertex.create(knows, v.getData())));
        TestUtil.assertFatal(ErrorKind.VERTEX_NOT_FOUND, graph.updateVertex(CellId.random(), v -> v));
        Assert.assertEquals(data("name", "alice"), TestUtil.assertOk(graph.readVertex(alice)).getData());
    }

    @Test
    public void updateKeepsAdjacency() {
        final CellId alice = newPerson("alice");
        final CellId bob = newPerson("bob");
        link(knows, alice, bob);
        TestUtil.assertOk(graph.updateVertex(alice, v -> v.withData(data("name", "alice", "age", 40))));
        Assert.assertEquals(1, neighbourhoods(alice, knows, Direction.OUTBOUND).size());
        Assert.assertFalse(TestUtil.assertOk(graph.readVertex(alice)).getAdjacency().isEmpty());
    }

    @Test
    public void removeByKeyThenGetIsNotFound() {
        newPerson("alice");
        TestUtil.assertOk(graph.removeVertexByKey(person, "alice"));
        final Outcome<Vertex> read = graph.getVertex(person, "alice");
        Assert.assertTrue(read.isOk());
        Assert.assertNull(read.get());
        TestUtil.assertFatal(ErrorKind.VERTEX_NOT_FOUND, graph.removeVertexByKey(person, "alice"));
        newPerson("alice");
    }

    @Test
    public void definedSchemasCarryHiddenFields() {
        final Schema vertexSchema = catalog.getSchema(person);
        for (final Direction direction : Direction.values()) {
            Assert.assertNotNull(vertexSchema.getField(direction.getFieldName()));
        }
        Assert.assertNotNull(catalog.getSchema(rated).getField(GraphSchemas.EDGE_VERTEX_A_FIELD));
        Assert.assertNull(catalog.getSchema(knows).getField(GraphSchemas.EDGE_VERTEX_A_FIELD));
        TestUtil.assertFatal(ErrorKind.RESERVED_FIELD,
                graph.defineVertexSchema(new SchemaDescriptor("bad").addField(new Field("_secret", FieldType.STRING))));
        TestUtil.assertFatal(ErrorKind.SCHEMA_ALREADY_EXISTS, graph.defineVertexSchema(new SchemaDescriptor("person")));
        Assert.assertNull(catalog.getSchemaByName("bad"));
    }
}
