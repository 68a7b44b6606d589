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

import java.util.Set;

public class InvalidChoiceException extends InvalidTagValueException {

    private final Set<String> choices;

    public InvalidChoiceException(String tagName, Object value, Set<String> choices) {
        super(tagName, value, "Invalid value for tag '" + tagName + "': " + value + ", expected one of " + choices);
        this.choices = choices;
    }

    public Set<String> getChoices() {
        return choices;
    }
}
