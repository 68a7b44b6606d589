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

import io.museg.metaimage.errors.MalformedHeaderException;
import io.museg.metaimage.tags.MetaImageTags;
import io.museg.metaimage.tags.TagNames;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/// Reads and writes the text header of a MetaImage file.
///
/// A header is a sequence of {@code Name = value} lines ending with the {@code ElementDataFile}
/// line. Reading consumes the stream up to and including that line, so a local payload can be read
/// from the same stream afterwards.
public final class MetaImageHeader {

    private static final int MAX_LINE_LENGTH = 1 << 20;

    private MetaImageHeader() {
    }

    /// Read header lines up to and including the {@code ElementDataFile} line.
    ///
    /// Empty lines are skipped. Each line is split on its first {@code =}, and names and values are
    /// trimmed. A repeated name keeps its last value.
    ///
    /// @param in the stream, positioned at the start of the header
    /// @return the raw tags in file order
    /// @throws MalformedHeaderException if a line has no {@code =}
    /// @throws IOException if the stream cannot be read
    public static Map<String, String> read(InputStream in) throws IOException {
        Map<String, String> raw = new LinkedHashMap<>();
        int lineNumber = 0;
        String line;
        while ((line = readLine(in)) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            int separator = line.indexOf('=');
            if (separator < 0) {
                throw new MalformedHeaderException(lineNumber, line);
            }
            String name = line.substring(0, separator).trim();
            String value = line.substring(separator + 1).trim();
            raw.remove(name);
            raw.put(name, value);
            if (TagNames.ELEMENT_DATA_FILE.equals(name)) {
                break;
            }
        }
        return raw;
    }

    /// @param out the destination stream
    /// @param tags the tags to write, in registry order
    /// @throws IOException if the stream cannot be written
    public static void write(OutputStream out, MetaImageTags tags) throws IOException {
        out.write(tags.toText().getBytes(StandardCharsets.UTF_8));
    }

    private static String readLine(InputStream in) throws IOException {
        ByteArrayOutputStream line = new ByteArrayOutputStream(80);
        int b;
        while ((b = in.read()) != -1) {
            if (b == '\n') {
                return decode(line);
            }
            if (line.size() >= MAX_LINE_LENGTH) {
                throw new IOException("Header line exceeds " + MAX_LINE_LENGTH + " bytes");
            }
            line.write(b);
        }
        return line.size() == 0 ? null : decode(line);
    }

    private static String decode(ByteArrayOutputStream line) {
        String text = line.toString(StandardCharsets.UTF_8);
        return text.endsWith("\r") ? text.substring(0, text.length() - 1) : text;
    }
}
