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

import io.museg.metaimage.errors.UnknownElementTypeException;
import io.museg.metaimage.errors.UnsupportedTypeException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ElementTypesTest {

    @ParameterizedTest
    @CsvSource({
        "FLOAT32, MET_FLOAT",
        "FLOAT64, MET_DOUBLE",
        "UINT8, MET_UCHAR",
        "INT8, MET_CHAR",
        "UINT16, MET_USHORT",
        "INT16, MET_SHORT",
        "UINT32, MET_UINT",
        "INT32, MET_INT",
        "UINT64, MET_ULONG",
        "INT64, MET_LONG"
    })
    void mapsBothWays(ElementKind kind, String token) {
        assertThat(ElementTypes.toDiskToken(kind)).isEqualTo(token);
        assertThat(ElementTypes.fromDiskToken(token)).isEqualTo(kind);
    }

    @Test
    void boolIsStoredAsUnsignedChar() {
        assertThat(ElementTypes.toDiskToken(ElementKind.BOOL)).isEqualTo("MET_UCHAR");
        assertThat(ElementTypes.fromDiskToken("MET_UCHAR")).isEqualTo(ElementKind.UINT8);
    }

    @Test
    void acceptsLegacyLongLong() {
        assertThat(ElementTypes.fromDiskToken("MET_LONG_LONG")).isEqualTo(ElementKind.INT64);
        assertThat(ElementTypes.diskTokens()).contains("MET_LONG_LONG", "MET_USHORT");
    }

    @Test
    void rejectsUnknownToken() {
        assertThatThrownBy(() -> ElementTypes.fromDiskToken("MET_COMPLEX"))
            .isInstanceOf(UnknownElementTypeException.class)
            .satisfies(e -> assertThat(((UnknownElementTypeException) e).getToken()).isEqualTo("MET_COMPLEX"));
    }

    @Test
    void rejectsMissingKind() {
        assertThatThrownBy(() -> ElementTypes.toDiskToken(null))
            .isInstanceOf(UnsupportedTypeException.class);
    }
}
