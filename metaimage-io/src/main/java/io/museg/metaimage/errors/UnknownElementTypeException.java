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

/// An on-disk element type token that is not in the type table.
public class UnknownElementTypeException extends MetaImageException {

    private final String token;

    public UnknownElementTypeException(String token) {
        super("ElementType", "Unknown element type: " + token);
        this.token = token;
    }

    public String getToken() {
        return token;
    }
}
