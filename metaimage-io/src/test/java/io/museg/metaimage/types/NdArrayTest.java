package io.museg.metaimage.types;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.museg.metaimage.errors.ShapeMismatchException;
import io.museg.metaimage.errors.UnsupportedTypeException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.ByteOrder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NdArrayTest {

    @Nested
    @DisplayName("wrapping primitive arrays")
    class Wrapping {

        @Test
        void usesSignedKindOfCarrier() {
            NdArray array = NdArray.wrap(new short[]{1, 2, 3, 4, 5, 6}, 2, 3);
            assertThat(array.kind()).isEqualTo(ElementKind.INT16);
            assertThat(array.shape()).containsExactly(2, 3);
            assertThat(array.size()).isEqualTo(6);
            assertThat(array.byteOrder()).isEqualTo(NdArray.DEFAULT_ORDER);
        }

        @Test
        void defaultsToOneDimension() {
            NdArray array = NdArray.wrap(new double[]{1.5, 2.5});
            assertThat(array.shape()).containsExactly(2);
        }

        @Test
        void readsUnsignedValues() {
            NdArray array = NdArray.wrap(ElementKind.UINT16, new short[]{-1, 7});
            assertThat(array.getLong(0)).isEqualTo(65535L);
            assertThat(array.getLong(1)).isEqualTo(7L);

            NdArray big = NdArray.wrap(ElementKind.UINT64, new long[]{-1L});
            assertThat(big.getDouble(0)).isEqualTo(1.8446744073709552E19);
        }

        @Test
        void rejectsUnsupportedCarrier() {
            assertThatThrownBy(() -> NdArray.wrap(new char[]{'a'}))
                .isInstanceOf(UnsupportedTypeException.class);
        }

        @Test
        void rejectsCarrierOfAnotherKind() {
            assertThatThrownBy(() -> NdArray.wrap(ElementKind.UINT16, new int[]{1}))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void rejectsShapeOfWrongSize() {
            assertThatThrownBy(() -> NdArray.wrap(new byte[5], 2, 3))
                .isInstanceOf(ShapeMismatchException.class);
        }

        @Test
        void copiesTheValues() {
            int[] values = {1, 2, 3};
            NdArray array = NdArray.wrap(values);
            values[0] = 99;
            assertThat(array.getLong(0)).isEqualTo(1L);
            assertThat((int[]) array.toArray()).containsExactly(1, 2, 3);
        }
    }

    @Test
    void indexesRowMajor() {
        NdArray array = NdArray.wrap(new int[]{0, 1, 2, 3, 4, 5}, 2, 3);
        assertThat(array.flatIndex(1, 2)).isEqualTo(5);
        assertThat(array.getLong(array.flatIndex(1, 0))).isEqualTo(3L);
        assertThat(array.dim(-1)).isEqualTo(3);
        assertThatThrownBy(() -> array.flatIndex(2, 0)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void reshapeKeepsValues() {
        NdArray array = NdArray.wrap(new int[]{0, 1, 2, 3, 4, 5}, 2, 3);
        NdArray reshaped = array.reshape(3, 2);
        assertThat(reshaped.shape()).containsExactly(3, 2);
        assertThat((int[]) reshaped.toArray()).containsExactly(0, 1, 2, 3, 4, 5);
    }

    @Test
    void reshapeToOtherSizeFails() {
        NdArray array = NdArray.zeros(ElementKind.UINT8, 2, 3);
        assertThatThrownBy(() -> array.reshape(4, 2))
            .isInstanceOf(ShapeMismatchException.class)
            .satisfies(e -> assertThat(((ShapeMismatchException) e).getTagName()).isEqualTo("DimSize"));
    }

    @Test
    void astypeTruncatesTowardZero() {
        NdArray array = NdArray.wrap(new double[]{2.7, -2.7, 0.0});
        NdArray converted = array.astype(ElementKind.INT16);
        assertThat(converted.kind()).isEqualTo(ElementKind.INT16);
        assertThat((short[]) converted.toArray()).containsExactly((short) 2, (short) -2, (short) 0);
        assertThat((boolean[]) array.astype(ElementKind.BOOL).toArray()).containsExactly(true, true, false);
    }

    @Test
    void byteOrderChangesBytesNotValues() {
        NdArray little = NdArray.wrap(ElementKind.UINT16, new short[]{0x0102});
        NdArray big = little.withByteOrder(ByteOrder.BIG_ENDIAN);

        assertThat(little.rawBytes()).containsExactly(0x02, 0x01);
        assertThat(big.rawBytes()).containsExactly(0x01, 0x02);
        assertThat(big.getLong(0)).isEqualTo(0x0102L);
        assertThat(big).isEqualTo(little);
        assertThat(big.hashCode()).isEqualTo(little.hashCode());
        assertThat(big.rawBytes(ByteOrder.LITTLE_ENDIAN)).containsExactly(0x02, 0x01);
    }

    @Test
    void fromBytesChecksLength() {
        NdArray array = NdArray.fromBytes(ElementKind.INT32, ByteOrder.BIG_ENDIAN, new byte[]{0, 0, 1, 0}, 1);
        assertThat(array.getLong(0)).isEqualTo(256L);
        assertThatThrownBy(() -> NdArray.fromBytes(ElementKind.INT32, ByteOrder.BIG_ENDIAN, new byte[6], 1))
            .isInstanceOf(ShapeMismatchException.class);
    }

    @Test
    void minAndMax() {
        NdArray array = NdArray.wrap(new float[]{3f, -1.5f, 8f});
        assertThat(array.min()).isEqualTo(-1.5);
        assertThat(array.max()).isEqualTo(8.0);
        assertThat(NdArray.zeros(ElementKind.UINT8, 0).min()).isNaN();
    }

    @Test
    void equalityComparesKindShapeAndValues() {
        NdArray a = NdArray.wrap(new byte[]{1, 2, 3, 4}, 2, 2);
        assertThat(a).isEqualTo(NdArray.wrap(new byte[]{1, 2, 3, 4}, 2, 2));
        assertThat(a).isNotEqualTo(NdArray.wrap(new byte[]{1, 2, 3, 4}, 4));
        assertThat(a).isNotEqualTo(NdArray.wrap(ElementKind.UINT8, new byte[]{1, 2, 3, 4}, 2, 2));
    }
}
