package io.museg.metaimage;

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
import java.util.Locale;
import java.util.Objects;

/// Where the payload of a MetaImage file lives, as recorded by the {@code ElementDataFile} tag.
public sealed interface PayloadLocation permits PayloadLocation.Local, PayloadLocation.External {

    /// The tag value marking a payload stored right after the header.
    String LOCAL = "LOCAL";

    /// Single-file extension: header and payload in one file.
    String MHA_EXTENSION = ".mha";
    /// Split-header extension: the payload lives in a sibling file.
    String MHD_EXTENSION = ".mhd";
    String RAW_EXTENSION = ".raw";
    String COMPRESSED_RAW_EXTENSION = ".zraw";

    /// @return the {@code ElementDataFile} tag value
    String tagValue();

    /// @param tagValue an {@code ElementDataFile} tag value
    /// @return the location it denotes
    static PayloadLocation parse(String tagValue) {
        if (tagValue == null || LOCAL.equals(tagValue)) {
            return new Local();
        }
        return new External(tagValue);
    }

    /// Choose where to store a payload from the extension of the requested header file.
    ///
    /// {@code .mha} stores the payload inline; {@code .mhd} stores it in {@code <base>.raw}, or
    /// {@code <base>.zraw} when compressed; any other or missing extension gets {@code .mha}
    /// appended.
    ///
    /// @param requested the path the caller asked to write
    /// @param compressed whether the payload is compressed
    /// @return the header path to write and the payload location
    static Destination destinationFor(Path requested, boolean compressed) {
        String fileName = Objects.requireNonNull(requested.getFileName(), "path has no file name").toString();
        String lower = fileName.toLowerCase(Locale.ROOT);
        if (lower.endsWith(MHA_EXTENSION)) {
            return new Destination(requested, new Local());
        }
        if (lower.endsWith(MHD_EXTENSION)) {
            String base = fileName.substring(0, fileName.length() - MHD_EXTENSION.length());
            String suffix = compressed ? COMPRESSED_RAW_EXTENSION : RAW_EXTENSION;
            return new Destination(requested, new External(base + suffix));
        }
        return new Destination(requested.resolveSibling(fileName + MHA_EXTENSION), new Local());
    }

    /// Payload bytes follow the {@code ElementDataFile} line of the header.
    record Local() implements PayloadLocation {
        @Override
        public String tagValue() {
            return LOCAL;
        }
    }

    /// Payload bytes live in a file beside the header.
    /// @param fileName the data file name, relative to the header's directory
    record External(String fileName) implements PayloadLocation {
        public External {
            Objects.requireNonNull(fileName, "fileName cannot be null");
        }

        @Override
        public String tagValue() {
            return fileName;
        }

        /// @param headerPath the header file referencing this payload
        /// @return the data file path
        public Path resolve(Path headerPath) {
            Path parent = headerPath.toAbsolutePath().getParent();
            return parent == null ? Path.of(fileName) : parent.resolve(fileName);
        }
    }

    /// @param headerPath the header file to write
    /// @param location where its payload goes
    record Destination(Path headerPath, PayloadLocation location) {
    }
}
