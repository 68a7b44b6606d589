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

import io.museg.metaimage.errors.UnsupportedTypeException;

/// The in-memory numeric element kinds an {@link NdArray} can hold.
///
/// Each kind has a fixed byte width and a Java primitive array type that carries its values.
/// Unsigned kinds share the carrier of the signed kind of the same width; their values are
/// reinterpreted on access.
public enum ElementKind {
    INT8(1, byte[].class, false, false),
    UINT8(1, byte[].class, true, false),
    INT16(2, short[].class, false, false),
    UINT16(2, short[].class, true, false),
    INT32(4, int[].class, false, false),
    UINT32(4, int[].class, true, false),
    INT64(8, long[].class, false, false),
    UINT64(8, long[].class, true, false),
    FLOAT32(4, float[].class, false, true),
    FLOAT64(8, double[].class, false, true),
    /// one byte per element, 0 or 1
    BOOL(1, boolean[].class, true, false);

    private final int width;
    private final Class<?> carrier;
    private final boolean unsigned;
    private final boolean floatingPoint;

    ElementKind(int width, Class<?> carrier, boolean unsigned, boolean floatingPoint) {
        this.width = width;
        this.carrier = carrier;
        this.unsigned = unsigned;
        this.floatingPoint = floatingPoint;
    }

    /// @return the number of bytes one element occupies
    public int width() {
        return width;
    }

    /// @return the primitive array class used to pass values of this kind in and out of an {@link NdArray}
    public Class<?> carrier() {
        return carrier;
    }

    public boolean isUnsigned() {
        return unsigned;
    }

    public boolean isFloatingPoint() {
        return floatingPoint;
    }

    /// Find the default (signed, for integers) element kind carried by a primitive array class.
    /// @param carrier a primitive array class such as {@code short[].class}
    /// @return the matching element kind
    /// @throws UnsupportedTypeException if no element kind is carried by that class
    public static ElementKind forCarrier(Class<?> carrier) {
        if (carrier == byte[].class) {
            return INT8;
        } else if (carrier == short[].class) {
            return INT16;
        } else if (carrier == int[].class) {
            return INT32;
        } else if (carrier == long[].class) {
            return INT64;
        } else if (carrier == float[].class) {
            return FLOAT32;
        } else if (carrier == double[].class) {
            return FLOAT64;
        } else if (carrier == boolean[].class) {
            return BOOL;
        }
        throw new UnsupportedTypeException(carrier == null ? "null" : carrier.getSimpleName());
    }
}
