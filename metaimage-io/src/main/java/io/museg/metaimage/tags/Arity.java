package io.museg.metaimage.tags;

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

/// How many values a tag holds.
///
/// @param kind singleton, fixed-length or variable-length
/// @param length the required value count for {@link Kind#FIXED}, otherwise 0
public record Arity(Kind kind, int length) {

    public enum Kind {
        SINGLETON,
        FIXED,
        VARIABLE
    }

    private static final Arity SINGLETON = new Arity(Kind.SINGLETON, 0);
    private static final Arity VARIABLE = new Arity(Kind.VARIABLE, 0);

    public Arity {
        if (kind == null) {
            throw new IllegalArgumentException("Arity kind cannot be null");
        }
        if (kind == Kind.FIXED && length <= 0) {
            throw new IllegalArgumentException("Fixed arity must have a positive length, got " + length);
        }
        if (kind != Kind.FIXED && length != 0) {
            throw new IllegalArgumentException(kind + " arity takes no length");
        }
    }

    /// @return exactly one value, held as a scalar
    public static Arity singleton() {
        return SINGLETON;
    }

    /// @param length the required number of values
    /// @return exactly {@code length} values, held as a list
    public static Arity fixed(int length) {
        return new Arity(Kind.FIXED, length);
    }

    /// @return any number of values, held as a list
    public static Arity variable() {
        return VARIABLE;
    }

    public boolean isSingleton() {
        return kind == Kind.SINGLETON;
    }

    /// @param count a number of values
    /// @return whether a tag of this arity may hold that many values
    public boolean accepts(int count) {
        return switch (kind) {
            case SINGLETON -> count == 1;
            case FIXED -> count == length;
            case VARIABLE -> count >= 0;
        };
    }

    /// @return a phrase naming the accepted value count, for error messages
    public String describe() {
        return switch (kind) {
            case SINGLETON -> "a singleton";
            case FIXED -> "a sequence of length " + length;
            case VARIABLE -> "a sequence";
        };
    }
}
