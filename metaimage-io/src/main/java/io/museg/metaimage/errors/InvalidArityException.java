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

/// The number of values given for a tag does not match the arity of its trait.
public class InvalidArityException extends InvalidTagValueException {

    private final int actualCount;

    public InvalidArityException(String tagName, Object value, String expected, int actualCount) {
        super(tagName, value,
            "Tag " + tagName + " must be " + expected + ", got " + actualCount + " value(s): " + value);
        this.actualCount = actualCount;
    }

    public int getActualCount() {
        return actualCount;
    }
}
