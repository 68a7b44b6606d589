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

/// A tag value that could not be coerced to the type its trait declares.
public class InvalidTagValueException extends MetaImageException {

    private final Object value;

    public InvalidTagValueException(String tagName, Object value, String message) {
        super(tagName, message);
        this.value = value;
    }

    public InvalidTagValueException(String tagName, Object value, String message, Throwable cause) {
        super(tagName, message, cause);
        this.value = value;
    }

    /// @return the raw value as it was given, before any coercion
    public Object getValue() {
        return value;
    }
}
