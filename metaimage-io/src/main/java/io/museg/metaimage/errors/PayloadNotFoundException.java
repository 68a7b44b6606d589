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

import java.nio.file.Path;

/// The external data file referenced by a header does not exist.
public class PayloadNotFoundException extends MetaImageException {

    private final Path payloadPath;

    public PayloadNotFoundException(Path payloadPath, Throwable cause) {
        super("ElementDataFile", "Could not find data file: " + payloadPath, cause);
        this.payloadPath = payloadPath;
    }

    public Path getPayloadPath() {
        return payloadPath;
    }
}
