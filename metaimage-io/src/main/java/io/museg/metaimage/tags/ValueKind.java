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

/// The type of each value held by a tag.
public enum ValueKind {
    /// whole numbers, held as {@link Long}
    INTEGER,
    /// real numbers, held as {@link Double}
    FLOAT,
    /// free text without whitespace, held as {@link String}
    STRING,
    /// the whole trimmed value as one {@link String}, inner whitespace kept
    TEXT,
    /// the literal tokens {@code True} and {@code False}, held as {@link Boolean}
    BOOLEAN,
    /// one of a closed set of strings
    CHOICE
}
