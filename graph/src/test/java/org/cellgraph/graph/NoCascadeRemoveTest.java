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
import org.cellgraph.TestUtil;
import org.cellgraph.cell.CellId;
import org.cellgraph.graph.adjacency.IdList;
import org.cellgraph.graph.adjacency.TypeList;
import org.junit.Assert;
import org.junit.Test;

public class NoCascadeRemoveTest extends GraphTestsBase {

    @Override
    protected GraphConfig createConfig() {
        return super.createConfig().setVertexCascadeRemove(false);
    }

    @Test
    public void vertexWithEdgesIsKept() {
        final CellId alice = newPerson("alice");
        final CellId bob = newPerson("bob");
        link(friend, bob, alice);
        TestUtil.assertFatal(ErrorKind.VERTEX_HAS_EDGES, graph.removeVertex(alice));
        TestUtil.assertFatal(ErrorKind.VERTEX_HAS_EDGES, graph.removeVertex(bob));
        Assert.assertNotNull(TestUtil.assertOk(graph.readVertex(alice)));
        Assert.assertEquals(1, degree(bob));
    }

    @Test
    public void vertexWithUnlinkedEdgesIsRemoved() {
        final CellId alice = newPerson("alice");
        final CellId bob = newPerson("bob");
        link(knows, alice, bob);
        inTransaction(txn -> txn.unlink(knows, alice, bob));
        TestUtil.assertOk(graph.removeVertex(alice));
        Assert.assertNull(TestUtil.assertOk(store.read(IdList.headIdFor(alice, Direction.OUTBOUND, knows))));
        Assert.assertNull(TestUtil.assertOk(store.read(TypeList.idFor(alice, Direction.OUTBOUND))));
        TestUtil.assertOk(graph.removeVertex(bob));
    }
}
