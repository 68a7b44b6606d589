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

/// Base type for every failure raised by the MetaImage codec.
///
/// Each failure carries the name of the tag (or source attribute) it is about, when there is one,
/// so that callers can react to the offending field without parsing the message.
public class MetaImageException extends RuntimeException {

    private final String tagName;

    public MetaImageException(String tagName, String message) {
        super(message);
        this.tagName = tagName;
    }

    public MetaImageException(String tagName, String message, Throwable cause) {
        super(message, cause);
        this.tagName = tagName;
    }

    /// @return the canonical tag or attribute name this failure refers to, or null if none applies
    public String getTagName() {
        return tagName;
    }
}
