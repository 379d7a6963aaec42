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
import org.cellgraph.schema.EdgeAttributes;
import org.cellgraph.schema.EdgeType;
import org.cellgraph.schema.Field;
import org.cellgraph.schema.FieldType;
import org.cellgraph.schema.SchemaDescriptor;
import org.cellgraph.store.TransactionFinishedException;
import org.junit.Assert;
import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class GraphEdgeTest extends GraphTestsBase {

    @Test
    public void preconditionsDontTouchStore() {
        final CellId alice = newPerson("alice");
        final CellId bob = newPerson("bob");
        store.resetOperations();
        TestUtil.assertFatal(ErrorKind.BODY_REQUIRED, graph.transaction(txn -> txn.link(rated, alice, bob)));
        TestUtil.assertFatal(ErrorKind.BODY_SHOULD_NOT_EXIST, graph.transaction(txn -> txn.link(knows, alice, bob, data("stars", 1))));
        TestUtil.assertFatal(ErrorKind.DATA_NOT_MATCH_SCHEMA, graph.transaction(txn -> txn.link(rated, alice, bob, data("stars", "five"))));
        TestUtil.assertFatal(ErrorKind.RESERVED_FIELD, graph.transaction(txn -> txn.link(rated, alice, bob, data("stars", 1, "_vertex_a", alice))));
        TestUtil.assertFatal(ErrorKind.SCHEMA_NOT_FOUND, graph.transaction(txn -> txn.link(9999, alice, bob)));
        TestUtil.assertFatal(ErrorKind.SCHEMA_NOT_EDGE, graph.transaction(txn -> txn.link(person, alice, bob)));
        Assert.assertEquals(0, store.getOperations());
    }

    @Test
    public void neighbourhoodsOfUnknownSchema() {
        final CellId alice = newPerson("alice");
        TestUtil.assertFatal(ErrorKind.SCHEMA_NOT_EDGE, graph.transaction(txn -> txn.neighbourhoods(alice, person, Direction.OUTBOUND)));
        TestUtil.assertFatal(ErrorKind.SCHEMA_NOT_FOUND, graph.transaction(txn -> txn.degree(alice, 9999, Direction.OUTBOUND)));
    }

    @Test
    public void directed() {
        final CellId alice = newPerson("alice");
        final CellId bob = newPerson("bob");
        final Edge edge = link(knows, alice, bob);
        Assert.assertTrue(edge instanceof DirectedEdge);
        Assert.assertFalse(edge.hasBody());
        Assert.assertNull(edge.getBody());

        final List<Edge> outbound = neighbourhoods(alice, knows, Direction.OUTBOUND);
        Assert.assertEquals(1, outbound.size());
        Assert.assertEquals(edge, outbound.get(0));
        Assert.assertEquals(alice, ((DirectedEdge) outbound.get(0)).getStart());
        Assert.assertEquals(bob, ((DirectedEdge) outbound.get(0)).getEnd());

        final List<Edge> inbound = neighbourhoods(bob, knows, Direction.INBOUND);
        Assert.assertEquals(1, inbound.size());
        Assert.assertEquals(edge, inbound.get(0));

        Assert.assertTrue(neighbourhoods(alice, knows, Direction.INBOUND).isEmpty());
        Assert.assertTrue(neighbourhoods(bob, knows, Direction.OUTBOUND).isEmpty());
        Assert.assertTrue(neighbourhoods(alice, friend, Direction.UNDIRECTED).isEmpty());
    }

    @Test
    public void undirected() {
        final CellId alice = newPerson("alice");
        final CellId bob = newPerson("bob");
        final Edge edge = link(friend, alice, bob);
        Assert.assertEquals(EdgeType.UNDIRECTED, edge.getEdgeType());
        final List<Edge> fromAlice = neighbourhoods(alice, friend, Direction.UNDIRECTED);
        final List<Edge> fromBob = neighbourhoods(bob, friend, Direction.UNDIRECTED);
        Assert.assertEquals(1, fromAlice.size());
        Assert.assertEquals(1, fromBob.size());
        Assert.assertEquals(bob, fromAlice.get(0).opposite(alice));
        Assert.assertEquals(alice, fromBob.get(0).opposite(bob));
        Assert.assertTrue(neighbourhoods(alice, friend, Direction.OUTBOUND).isEmpty());
    }

    @Test
    public void withBody() {
        final CellId alice = newPerson("alice");
        final CellId bob = newPerson("bob");
        final Edge rating = link(rated, alice, bob, data("stars", 5));
        Assert.assertTrue(rating.hasBody());
        Assert.assertEquals(data("stars", 5), rating.getBody());
        Assert.assertNotNull(TestUtil.assertOk(store.read(rating.getBodyId())));

        final Edge read = neighbourhoods(bob, rated, Direction.INBOUND).get(0);
        Assert.assertEquals(rating, read);
        Assert.assertEquals(data("stars", 5), read.getBody());
        Assert.assertEquals(alice, ((DirectedEdge) read).getStart());

        final Edge marriage = link(married, alice, bob, data("since", 2001));
        final Edge fromBob = neighbourhoods(bob, married, Direction.UNDIRECTED).get(0);
        Assert.assertEquals(marriage.getBodyId(), fromBob.getBodyId());
        Assert.assertEquals(alice, fromBob.opposite(bob));
        Assert.assertEquals(data("since", 2001), fromBob.getBody());
    }

    @Test
    public void parallelEdges() {
        final CellId alice = newPerson("alice");
        final CellId bob = newPerson("bob");
        link(knows, alice, bob);
        link(knows, alice, bob);
        link(rated, alice, bob, data("stars", 1));
        link(rated, alice, bob, data("stars", 2));
        Assert.assertEquals(2, degree(alice, knows, Direction.OUTBOUND));
        final List<Edge> ratings = neighbourhoods(alice, rated, Direction.OUTBOUND);
        Assert.assertEquals(2, ratings.size());
        Assert.assertNotEquals(ratings.get(0).getBodyId(), ratings.get(1).getBodyId());
        Assert.assertEquals(1, ratings.get(0).getBody().get("stars"));
        Assert.assertEquals(2, ratings.get(1).getBody().get("stars"));
    }

    @Test
    public void selfLoops() {
        final CellId alice = newPerson("alice");
        link(knows, alice, alice);
        link(friend, alice, alice);
        Assert.assertEquals(1, degree(alice, knows, Direction.OUTBOUND));
        Assert.assertEquals(1, degree(alice, knows, Direction.INBOUND));
        Assert.assertEquals(1, degree(alice, friend, Direction.UNDIRECTED));
        Assert.assertEquals(3, degree(alice));
        final Edge loop = neighbourhoods(alice, friend, Direction.UNDIRECTED).get(0);
        Assert.assertTrue(((UndirectedEdge) loop).isSelfLoop());
        Assert.assertEquals(alice, loop.opposite(alice));
        Assert.assertEquals(3, inTransaction(txn -> txn.neighbourhoods(alice)).size());
    }

    @Test
    public void missingVertex() {
        final CellId alice = newPerson("alice");
        TestUtil.assertFatal(ErrorKind.VERTEX_NOT_FOUND, graph.transaction(txn -> txn.link(knows, alice, CellId.random())));
        TestUtil.assertFatal(ErrorKind.VERTEX_NOT_FOUND, graph.transaction(txn -> txn.link(rated, CellId.random(), alice, data("stars", 3))));
        Assert.assertEquals(0, degree(alice));
    }

    @Test
    public void allSchemasAndDegree() {
        final CellId alice = newPerson("alice");
        final CellId bob = newPerson("bob");
        final CellId carol = newPerson("carol");
        link(knows, alice, bob);
        link(knows, carol, alice);
        link(friend, alice, carol);
        link(rated, alice, carol, data("stars", 4));
        link(married, bob, alice, data("since", 1999));

        final List<Edge> outbound = inTransaction(txn -> txn.neighbourhoods(alice, Direction.OUTBOUND));
        Assert.assertEquals(2, outbound.size());
        Assert.assertEquals(knows, outbound.get(0).getSchemaId());
        Assert.assertEquals(rated, outbound.get(1).getSchemaId());

        Assert.assertEquals(1, inTransaction(txn -> txn.neighbourhoods(alice, Direction.INBOUND)).size());
        Assert.assertEquals(2, inTransaction(txn -> txn.neighbourhoods(alice, Direction.UNDIRECTED)).size());
        Assert.assertEquals(5, inTransaction(txn -> txn.neighbourhoods(alice)).size());
        Assert.assertEquals(5, degree(alice));
        Assert.assertEquals(2, degree(bob));
        Assert.assertEquals(3, degree(carol));
        Assert.assertEquals(0, degree(CellId.random()));
    }

    @Test
    public void unlink() {
        final CellId alice = newPerson("alice");
        final CellId bob = newPerson("bob");
        link(knows, alice, bob);
        final Edge rating = link(rated, alice, bob, data("stars", 2));

        final Edge removed = inTransaction(txn -> txn.unlink(rated, alice, bob));
        Assert.assertEquals(rating, removed);
        Assert.assertNull(TestUtil.assertOk(store.read(rating.getBodyId())));
        Assert.assertTrue(neighbourhoods(bob, rated, Direction.INBOUND).isEmpty());
        Assert.assertEquals(1, degree(alice, knows, Direction.OUTBOUND));

        TestUtil.assertFatal(ErrorKind.EDGE_NOT_FOUND, graph.transaction(txn -> txn.unlink(rated, alice, bob)));
        TestUtil.assertFatal(ErrorKind.EDGE_NOT_FOUND, graph.transaction(txn -> txn.unlink(knows, bob, alice)));
        inTransaction(txn -> txn.unlink(knows, alice, bob));
        Assert.assertEquals(0, degree(alice));
        Assert.assertEquals(0, degree(bob));
    }

    @Test
    public void unlinkUndirectedFromEitherSide() {
        final CellId alice = newPerson("alice");
        final CellId bob = newPerson("bob");
        link(friend, alice, bob);
        link(married, alice, bob, data("since", 2010));
        inTransaction(txn -> txn.unlink(friend, bob, alice));
        inTransaction(txn -> txn.unlink(married, bob, alice));
        Assert.assertEquals(0, degree(alice));
        Assert.assertEquals(0, degree(bob));
    }

    @Test
    public void removedOnlyFirstOccurrence() {
        final CellId alice = newPerson("alice");
        final CellId bob = newPerson("bob");
        final CellId carol = newPerson("carol");
        link(knows, alice, bob);
        link(knows, alice, carol);
        link(knows, alice, bob);
        inTransaction(txn -> txn.unlink(knows, alice, bob));
        final List<CellId> ends = new ArrayList<>();
        for (final Edge edge : neighbourhoods(alice, knows, Direction.OUTBOUND)) {
            ends.add(((DirectedEdge) edge).getEnd());
        }
        Assert.assertEquals(Arrays.asList(carol, bob), ends);
    }

    @Test
    public void edgeSchemaShape() {
        TestUtil.assertFatal(ErrorKind.INVALID_SCHEMA, graph.defineEdgeSchema(new SchemaDescriptor("likes")
                .addField(new Field("weight", FieldType.INT)), EdgeAttributes.directed(false)));
        TestUtil.assertFatal(ErrorKind.INVALID_SCHEMA, graph.defineEdgeSchema(new SchemaDescriptor("follows")
                .setDynamic(true), EdgeAttributes.undirected(false)));
        TestUtil.assertFatal(ErrorKind.INVALID_SCHEMA, graph.defineEdgeSchema(new SchemaDescriptor("reviewed")
                .addField(new Field("title", FieldType.STRING))
                .setKeyField("title"), EdgeAttributes.directed(true)));
        Assert.assertNull(catalog.getSchemaByName("likes"));
        Assert.assertNull(catalog.getSchemaByName("follows"));
        Assert.assertNull(catalog.getSchemaByName("reviewed"));
        TestUtil.assertOk(graph.defineEdgeSchema(new SchemaDescriptor("reviewed")
                .addField(new Field("title", FieldType.STRING)), EdgeAttributes.directed(true)));
    }

    @Test
    public void unlinkIsLogged() {
        final CellId alice = newPerson("alice");
        final CellId bob = newPerson("bob");
        link(knows, alice, bob);
        link(married, alice, bob, data("since", 2020));
        final PrintStream err = System.err;
        final ByteArrayOutputStream captured = new ByteArrayOutputStream();
        System.setErr(new PrintStream(captured, true));
        try {
            inTransaction(txn -> txn.unlink(knows, alice, bob));
            inTransaction(txn -> txn.unlink(married, bob, alice));
        } finally {
            System.setErr(err);
        }
        final String log = captured.toString();
        Assert.assertTrue(log, log.contains("Unlinked DirectedEdge"));
        Assert.assertTrue(log, log.contains("Unlinked UndirectedEdge"));
    }

    @Test
    public void handleIsInvalidatedAfterTransaction() {
        final CellId alice = newPerson("alice");
        final GraphTransaction[] handle = new GraphTransaction[1];
        inTransaction(txn -> {
            handle[0] = txn;
            Assert.assertFalse(txn.isFinished());
            return Outcome.done();
        });
        Assert.assertTrue(handle[0].isFinished());
        TestUtil.runWithExpectedException(() -> handle[0].neighbourhoods(alice, knows, Direction.OUTBOUND),
                TransactionFinishedException.class);
        TestUtil.runWithExpectedException(() -> handle[0].link(knows, alice, alice), TransactionFinishedException.class);
        TestUtil.runWithExpectedException(() -> handle[0].readVertex(alice), TransactionFinishedException.class);
    }

    @Test
    public void fatalAbortsWholeClosure() {
        final CellId alice = newPerson("alice");
        final CellId bob = newPerson("bob");
        final Outcome<Edge> result = graph.transaction(txn -> {
            final Outcome<Edge> first = txn.link(knows, alice, bob);
            if (!first.isOk()) {
                return first;
            }
            Assert.assertEquals(1, (int) TestUtil.assertOk(txn.degree(alice, knows, Direction.OUTBOUND)));
            return txn.link(knows, alice, CellId.random());
        });
        TestUtil.assertFatal(ErrorKind.VERTEX_NOT_FOUND, result);
        Assert.assertEquals(0, degree(alice));
        Assert.assertEquals(0, degree(bob));
        Assert.assertTrue(TestUtil.assertOk(graph.readVertex(alice)).getAdjacency().isEmpty());
    }
}
