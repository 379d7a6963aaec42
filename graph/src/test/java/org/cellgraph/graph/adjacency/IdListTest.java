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
package org.cellgraph.graph.adjacency;

import org.cellgraph.ErrorKind;
import org.cellgraph.Outcome;
import org.cellgraph.TestUtil;
import org.cellgraph.cell.Cell;
import org.cellgraph.cell.CellHeader;
import org.cellgraph.cell.CellId;
import org.cellgraph.graph.Direction;
import org.cellgraph.store.CellStores;
import org.cellgraph.store.CellTransaction;
import org.cellgraph.store.CellTransactionalComputable;
import org.cellgraph.store.MemoryCellStore;
import org.jetbrains.annotations.NotNull;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class IdListTest {

    private static final int SCHEMA_ID = 1024;

    private MemoryCellStore store;
    private SegmentChain chain;
    private CellId owner;

    @Before
    public void setUp() {
        store = CellStores.newInstance();
        chain = new SegmentChain(3, true);
        owner = CellId.random();
    }

    @After
    public void tearDown() {
        Assert.assertEquals(0, store.getActiveTransactionCount());
    }

    @Test
    public void absentListIsEmpty() {
        Assert.assertEquals(Collections.emptyList(), inTransaction(txn -> open(txn).all()));
        Assert.assertEquals(0, (int) inTransaction(txn -> open(txn).size()));
        Assert.assertFalse(inTransaction(txn -> TypeList.load(txn, owner, Direction.OUTBOUND)).isStored());
    }

    @Test
    public void appendChainsSegments() {
        final List<CellId> members = appendRandom(10);
        Assert.assertEquals(members, inTransaction(txn -> open(txn).all()));
        Assert.assertEquals(10, (int) inTransaction(txn -> open(txn).size()));
        final List<Segment> segments = segments();
        Assert.assertEquals(4, segments.size());
        Assert.assertEquals(IdList.headIdFor(owner, Direction.OUTBOUND, SCHEMA_ID), segments.get(0).getId());
        final List<Integer> sizes = new ArrayList<>();
        for (final Segment segment : segments) {
            sizes.add(segment.size());
        }
        Assert.assertEquals(Arrays.asList(3, 3, 3, 1), sizes);
        Assert.assertTrue(segments.get(3).isTail());
    }

    @Test
    public void duplicateMembersAllowed() {
        final CellId member = CellId.random();
        inTransaction(txn -> open(txn).append(member));
        inTransaction(txn -> open(txn).append(member));
        Assert.assertEquals(Arrays.asList(member, member), inTransaction(txn -> open(txn).all()));
    }

    @Test
    public void removeFirstOccurrence() {
        final List<CellId> members = appendRandom(4);
        final CellId repeated = members.get(1);
        inTransaction(txn -> open(txn).append(repeated));
        inTransaction(txn -> open(txn).remove(repeated));
        final List<CellId> expected = new ArrayList<>(members);
        expected.remove(1);
        expected.add(repeated);
        Assert.assertEquals(expected, inTransaction(txn -> open(txn).all()));
    }

    @Test
    public void removeAbsentMember() {
        appendRandom(2);
        TestUtil.assertFatal(ErrorKind.LIST_MEMBER_NOT_FOUND, store.computeInTransaction(txn -> open(txn).remove(CellId.random())));
        TestUtil.assertFatal(ErrorKind.LIST_MEMBER_NOT_FOUND,
                store.computeInTransaction(txn -> IdList.open(txn, chain, owner, Direction.INBOUND, SCHEMA_ID).remove(CellId.random())));
    }

    @Test
    public void reclaimEmptySegment() {
        final List<CellId> members = appendRandom(7);
        final CellId middle = segments().get(1).getId();
        for (final CellId member : members.subList(3, 6)) {
            inTransaction(txn -> open(txn).remove(member));
        }
        final List<Segment> segments = segments();
        Assert.assertEquals(2, segments.size());
        Assert.assertEquals(segments.get(1).getId(), segments.get(0).getNext());
        Assert.assertNull(TestUtil.assertOk(store.read(middle)));
        final List<CellId> expected = new ArrayList<>(members.subList(0, 3));
        expected.add(members.get(6));
        Assert.assertEquals(expected, inTransaction(txn -> open(txn).all()));
    }

    @Test
    public void headSegmentIsKept() {
        final List<CellId> members = appendRandom(2);
        for (final CellId member : members) {
            inTransaction(txn -> open(txn).remove(member));
        }
        final List<Segment> segments = segments();
        Assert.assertEquals(1, segments.size());
        Assert.assertEquals(0, segments.get(0).size());
    }

    @Test
    public void keepEmptySegments() {
        chain = new SegmentChain(3, false);
        final List<CellId> members = appendRandom(7);
        for (final CellId member : members.subList(3, 6)) {
            inTransaction(txn -> open(txn).remove(member));
        }
        final List<Segment> segments = segments();
        Assert.assertEquals(3, segments.size());
        Assert.assertEquals(0, segments.get(1).size());
        Assert.assertEquals(4, (int) inTransaction(txn -> open(txn).size()));
    }

    @Test
    public void typeListRegistration() {
        appendRandom(1);
        final CellId headId = IdList.headIdFor(owner, Direction.OUTBOUND, SCHEMA_ID);
        inTransaction(txn -> IdList.open(txn, chain, owner, Direction.OUTBOUND, SCHEMA_ID + 1).append(CellId.random()));
        final TypeList types = inTransaction(txn -> TypeList.load(txn, owner, Direction.OUTBOUND));
        Assert.assertTrue(types.isStored());
        Assert.assertEquals(2, types.getSchemaIds().size());
        Assert.assertEquals(SCHEMA_ID, types.getSchemaIds().getInt(0));
        Assert.assertEquals(headId, types.getHead(SCHEMA_ID));
        Assert.assertEquals(TypeList.idFor(owner, Direction.OUTBOUND), types.getId());
        Assert.assertTrue(inTransaction(txn -> TypeList.load(txn, owner, Direction.INBOUND)).isEmpty());
    }

    @Test
    public void delete() {
        appendRandom(5);
        final List<Segment> segments = segments();
        inTransaction(txn -> open(txn).delete());
        for (final Segment segment : segments) {
            Assert.assertNull(TestUtil.assertOk(store.read(segment.getId())));
        }
        Assert.assertNull(TestUtil.assertOk(store.read(TypeList.idFor(owner, Direction.OUTBOUND))));
        Assert.assertTrue(inTransaction(txn -> open(txn).all()).isEmpty());
    }

    @Test
    public void missingSegment() {
        final CellId headId = IdList.headIdFor(owner, Direction.OUTBOUND, SCHEMA_ID);
        TestUtil.assertOk(store.write(new Segment(headId, Collections.singletonList(CellId.random()), CellId.random()).toCell()));
        TestUtil.assertFatal(ErrorKind.LIST_CORRUPTED, store.computeInTransaction(txn -> open(txn).all()));
        TestUtil.assertFatal(ErrorKind.LIST_CORRUPTED, store.computeInTransaction(txn -> open(txn).append(CellId.random())));
    }

    @Test
    public void cyclicChain() {
        final CellId headId = IdList.headIdFor(owner, Direction.OUTBOUND, SCHEMA_ID);
        final CellId other = CellId.random();
        TestUtil.assertOk(store.write(new Segment(headId, Collections.singletonList(CellId.random()), other).toCell()));
        TestUtil.assertOk(store.write(new Segment(other, Collections.singletonList(CellId.random()), headId).toCell()));
        TestUtil.assertFatal(ErrorKind.LIST_CORRUPTED, store.computeInTransaction(txn -> open(txn).size()));
    }

    @Test
    public void foreignCell() {
        final CellId headId = IdList.headIdFor(owner, Direction.OUTBOUND, SCHEMA_ID);
        TestUtil.assertOk(store.write(new Cell(new CellHeader(SCHEMA_ID, headId), Collections.singletonMap("value", 1))));
        TestUtil.assertFatal(ErrorKind.LIST_CORRUPTED, store.computeInTransaction(txn -> open(txn).all()));
    }

    @NotNull
    private IdList open(@NotNull final CellTransaction txn) {
        return IdList.open(txn, chain, owner, Direction.OUTBOUND, SCHEMA_ID);
    }

    @NotNull
    private List<CellId> appendRandom(final int count) {
        final List<CellId> result = new ArrayList<>();
        for (int i = 0; i < count; ++i) {
            final CellId member = CellId.random();
            inTransaction(txn -> open(txn).append(member));
            result.add(member);
        }
        return result;
    }

    @NotNull
    private List<Segment> segments() {
        return inTransaction(txn -> chain.segments(txn, IdList.headIdFor(owner, Direction.OUTBOUND, SCHEMA_ID)));
    }

    private <T> T inTransaction(@NotNull final CellTransactionalComputable<T> computable) {
        final Outcome<T> result = store.computeInTransaction(computable);
        return TestUtil.assertOk(result);
    }
}
