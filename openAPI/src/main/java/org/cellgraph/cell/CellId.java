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

import net.jpountz.xxhash.XXHash64;
import net.jpountz.xxhash.XXHashFactory;
import org.jetbrains.annotations.NotNull;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Pattern;

/**
 * 128-bit identifier of a {@linkplain Cell cell}. Identifiers of keyed cells are derived deterministically from
 * schema id and key, see {@linkplain #encodeKey(int, Object)}. {@linkplain #UNIT} is the null identifier.
 */
public final class CellId implements Comparable<CellId> {

    @NotNull
    public static final CellId UNIT = new CellId(0, 0);

    private static final long XX_HASH_SEED = 0xADEF1279AL;
    private static final long XX_HASH_HIGHER_SEED = 0x5BD1E995L;
    private static final XXHash64 xxHash = XXHashFactory.fastestJavaInstance().hash64();

    private static final byte NULL_TAG = 0;
    private static final byte STRING_TAG = 1;
    private static final byte INTEGRAL_TAG = 2;
    private static final byte DOUBLE_TAG = 3;
    private static final byte BOOLEAN_TAG = 4;
    private static final byte ID_TAG = 5;

    private static final Pattern ID_SPLIT_PATTERN = Pattern.compile("-");

    private final long higher;
    private final long lower;

    public CellId(final long higher, final long lower) {
        this.higher = higher;
        this.lower = lower;
    }

    public long getHigher() {
        return higher;
    }

    public long getLower() {
        return lower;
    }

    public boolean isUnit() {
        return higher == 0 && lower == 0;
    }

    /**
     * Encodes the key of a cell of specified schema to the cell identifier. The same key always results in the same
     * identifier. Integral numbers of different boxed types are encoded equally.
     *
     * @param schemaId schema id
     * @param key      key value: string, number, boolean or {@code CellId}
     * @return cell identifier
     */
    @NotNull
    public static CellId encodeKey(final int schemaId, @NotNull final Object key) {
        final byte[] bytes = keyToBytes(key);
        return new CellId(Integer.toUnsignedLong(schemaId), xxHash.hash(bytes, 0, bytes.length, XX_HASH_SEED));
    }

    /**
     * Derives new identifier from specified base identifier and discriminators.
     */
    @NotNull
    public static CellId hash(@NotNull final CellId base, final int... discriminators) {
        final ByteBuffer buffer = ByteBuffer.allocate(16 + discriminators.length * 4);
        buffer.putLong(base.higher).putLong(base.lower);
        for (final int discriminator : discriminators) {
            buffer.putInt(discriminator);
        }
        final byte[] bytes = buffer.array();
        return new CellId(
                xxHash.hash(bytes, 0, bytes.length, XX_HASH_HIGHER_SEED),
                xxHash.hash(bytes, 0, bytes.length, XX_HASH_SEED));
    }

    @NotNull
    public static CellId random() {
        final ThreadLocalRandom random = ThreadLocalRandom.current();
        long higher;
        long lower;
        do {
            higher = random.nextLong();
            lower = random.nextLong();
        } while (higher == 0 && lower == 0);
        return new CellId(higher, lower);
    }

    @NotNull
    public static CellId fromString(@NotNull final CharSequence representation) {
        final String[] idParts = ID_SPLIT_PATTERN.split(representation);
        if (idParts.length != 2) {
            throw new IllegalArgumentException("Invalid structure of cell id: " + representation);
        }
        return new CellId(Long.parseUnsignedLong(idParts[0], 16), Long.parseUnsignedLong(idParts[1], 16));
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof CellId)) {
            return false;
        }
        final CellId that = (CellId) obj;
        return higher == that.higher && lower == that.lower;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(higher * 31 + lower);
    }

    @Override
    public int compareTo(@NotNull final CellId o) {
        final int result = Long.compareUnsigned(higher, o.higher);
        return result != 0 ? result : Long.compareUnsigned(lower, o.lower);
    }

    @Override
    public String toString() {
        return Long.toHexString(higher) + '-' + Long.toHexString(lower);
    }

    private static byte[] keyToBytes(@NotNull final Object key) {
        final ByteBuffer buffer;
        if (key instanceof String) {
            final byte[] utf8 = ((String) key).getBytes(StandardCharsets.UTF_8);
            buffer = ByteBuffer.allocate(1 + utf8.length).put(STRING_TAG).put(utf8);
        } else if (key instanceof Long || key instanceof Integer || key instanceof Short || key instanceof Byte) {
            buffer = ByteBuffer.allocate(9).put(INTEGRAL_TAG).putLong(((Number) key).longValue());
        } else if (key instanceof Double || key instanceof Float) {
            buffer = ByteBuffer.allocate(9).put(DOUBLE_TAG).putDouble(((Number) key).doubleValue());
        } else if (key instanceof Boolean) {
            buffer = ByteBuffer.allocate(2).put(BOOLEAN_TAG).put((byte) ((Boolean) key ? 1 : 0));
        } else if (key instanceof CellId) {
            final CellId id = (CellId) key;
            buffer = ByteBuffer.allocate(17).put(ID_TAG).putLong(id.higher).putLong(id.lower);
        } else {
            throw new IllegalArgumentException("Unsupported key type: " + key.getClass().getName());
        }
        return buffer.array();
    }
}
