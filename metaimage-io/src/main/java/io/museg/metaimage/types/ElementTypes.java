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

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/// Bidirectional mapping between MetaImage {@code ElementType} tokens and {@link ElementKind}s.
///
/// | kind    | token        |
/// |---------|--------------|
/// | FLOAT32 | MET_FLOAT    |
/// | FLOAT64 | MET_DOUBLE   |
/// | UINT8   | MET_UCHAR    |
/// | INT8    | MET_CHAR     |
/// | UINT16  | MET_USHORT   |
/// | INT16   | MET_SHORT    |
/// | UINT32  | MET_UINT     |
/// | INT32   | MET_INT      |
/// | UINT64  | MET_ULONG    |
/// | INT64   | MET_LONG     |
/// | BOOL    | MET_UCHAR    |
///
/// On input, {@code MET_LONG_LONG} is accepted as a legacy spelling of {@code MET_LONG}.
public final class ElementTypes {

    private static final Map<ElementKind, String> TO_DISK = new EnumMap<>(ElementKind.class);
    private static final Map<String, ElementKind> FROM_DISK = new LinkedHashMap<>();

    static {
        TO_DISK.put(ElementKind.FLOAT32, "MET_FLOAT");
        TO_DISK.put(ElementKind.FLOAT64, "MET_DOUBLE");
        TO_DISK.put(ElementKind.UINT8, "MET_UCHAR");
        TO_DISK.put(ElementKind.INT8, "MET_CHAR");
        TO_DISK.put(ElementKind.UINT16, "MET_USHORT");
        TO_DISK.put(ElementKind.INT16, "MET_SHORT");
        TO_DISK.put(ElementKind.UINT32, "MET_UINT");
        TO_DISK.put(ElementKind.INT32, "MET_INT");
        TO_DISK.put(ElementKind.UINT64, "MET_ULONG");
        TO_DISK.put(ElementKind.INT64, "MET_LONG");
        TO_DISK.put(ElementKind.BOOL, "MET_UCHAR");

        FROM_DISK.put("MET_FLOAT", ElementKind.FLOAT32);
        FROM_DISK.put("MET_DOUBLE", ElementKind.FLOAT64);
        FROM_DISK.put("MET_UCHAR", ElementKind.UINT8);
        FROM_DISK.put("MET_CHAR", ElementKind.INT8);
        FROM_DISK.put("MET_USHORT", ElementKind.UINT16);
        FROM_DISK.put("MET_SHORT", ElementKind.INT16);
        FROM_DISK.put("MET_UINT", ElementKind.UINT32);
        FROM_DISK.put("MET_INT", ElementKind.INT32);
        FROM_DISK.put("MET_ULONG", ElementKind.UINT64);
        FROM_DISK.put("MET_LONG", ElementKind.INT64);
        FROM_DISK.put("MET_LONG_LONG", ElementKind.INT64);
    }

    private ElementTypes() {
    }

    /// @param kind an element kind
    /// @return the canonical on-disk token for the kind
    /// @throws UnsupportedTypeException if the kind has no on-disk token
    public static String toDiskToken(ElementKind kind) {
        String token = kind == null ? null : TO_DISK.get(kind);
        if (token == null) {
            throw new UnsupportedTypeException(String.valueOf(kind));
        }
        return token;
    }

    /// @param token an {@code ElementType} tag value
    /// @return the element kind the token denotes
    /// @throws UnknownElementTypeException if the token is not recognized
    public static ElementKind fromDiskToken(String token) {
        ElementKind kind = token == null ? null : FROM_DISK.get(token);
        if (kind == null) {
            throw new UnknownElementTypeException(token);
        }
        return kind;
    }

    /// @return every token accepted on input, legacy spellings included
    public static Set<String> diskTokens() {
        return Collections.unmodifiableSet(FROM_DISK.keySet());
    }
}
