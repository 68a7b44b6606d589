package io.museg.metaimage.errors;

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

/// The array shape disagrees with the dimensionality or size tags, or a payload holds the wrong
/// number of bytes for them.
public class ShapeMismatchException extends MetaImageException {

    public ShapeMismatchException(String tagName, String message) {
        super(tagName, message);
    }

    public ShapeMismatchException(String tagName, String message, Throwable cause) {
        super(tagName, message, cause);
    }
}
