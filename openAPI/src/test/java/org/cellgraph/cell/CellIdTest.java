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
package org.cellgraph.cell;

import org.junit.Assert;
import org.junit.Test;

public class CellIdTest {

    @Test
    public void encodeKeyIsDeterministic() {
        Assert.assertEquals(CellId.encodeKey(1024, "alice"), CellId.encodeKey(1024, "alice"));
        Assert.assertNotEquals(CellId.encodeKey(1024, "alice"), CellId.encodeKey(1024, "bob"));
        Assert.assertNotEquals(CellId.encodeKey(1024, "alice"), CellId.encodeKey(1025, "alice"));
        Assert.assertEquals(1024L, CellId.encodeKey(1024, "alice").getHigher());
    }

    @Test
    public void integralKeysAreNormalized() {
        Assert.assertEquals(CellId.encodeKey(7, 42), CellId.encodeKey(7, 42L));
        Assert.assertNotEquals(CellId.encodeKey(7, 42), CellId.encodeKey(7, "42"));
        Assert.assertNotEquals(CellId.encodeKey(7, 42), CellId.encodeKey(7, 42.0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void unsupportedKey() {
        CellId.encodeKey(7, new Object());
    }

    @Test
    public void hashDependsOnDiscriminators() {
        final CellId base = CellId.encodeKey(7, "owner");
        Assert.assertEquals(CellId.hash(base, 1), CellId.hash(base, 1));
        Assert.assertNotEquals(CellId.hash(base, 1), CellId.hash(base, 2));
        Assert.assertNotEquals(CellId.hash(base, 1), CellId.hash(base, 1, 100));
        Assert.assertNotEquals(base, CellId.hash(base));
    }

    @Test
    public void unit() {
        Assert.assertTrue(CellId.UNIT.isUnit());
        Assert.assertTrue(new CellId(0, 0).isUnit());
        Assert.assertFalse(CellId.random().isUnit());
        Assert.assertNotEquals(CellId.random(), CellId.random());
    }

    @Test
    public void stringRepresentation() {
        final CellId id = new CellId(-1L, 0x1234L);
        Assert.assertEquals("ffffffffffffffff-1234", id.toString());
        Assert.assertEquals(id, CellId.fromString(id.toString()));
    }

    @Test(expected = IllegalArgumentException.class)
    public void malformedString() {
        CellId.fromString("12-34-56");
    }

    @Test
    public void unsignedOrder() {
        Assert.assertTrue(new CellId(1, 0).compareTo(new CellId(-1L, 0)) < 0);
        Assert.assertTrue(new CellId(1, 1).compareTo(new CellId(1, 2)) < 0);
        Assert.assertEquals(0, new CellId(3, 4).compareTo(new CellId(3, 4)));
    }
}
