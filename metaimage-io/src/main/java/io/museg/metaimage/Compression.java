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

import io.museg.metaimage.errors.UnknownCompressionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;
import java.util.zip.Inflater;
import java.util.zip.ZipException;

/// Whole-buffer payload compression schemes.
///
/// {@link #ZLIB} is what MetaImage writers produce; {@link #GZIP} is accepted on input as a legacy
/// fallback.
public enum Compression {

    ZLIB {
        @Override
        public byte[] compress(byte[] raw) {
            Deflater deflater = new Deflater();
            try {
                deflater.setInput(raw);
                deflater.finish();
                ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, raw.length / 2));
                byte[] buffer = new byte[BUFFER_SIZE];
                while (!deflater.finished()) {
                    int count = deflater.deflate(buffer);
                    out.write(buffer, 0, count);
                }
                return out.toByteArray();
            } finally {
                deflater.end();
            }
        }

        @Override
        public byte[] decompress(byte[] compressed) throws IOException {
            Inflater inflater = new Inflater();
            try {
                inflater.setInput(compressed);
                ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, compressed.length * 2));
                byte[] buffer = new byte[BUFFER_SIZE];
                while (!inflater.finished()) {
                    int count = inflater.inflate(buffer);
                    if (count == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                        throw new ZipException("Truncated zlib stream");
                    }
                    out.write(buffer, 0, count);
                }
                return out.toByteArray();
            } catch (DataFormatException e) {
                throw new ZipException("Invalid zlib stream: " + e.getMessage());
            } finally {
                inflater.end();
            }
        }
    },

    GZIP {
        @Override
        public byte[] compress(byte[] raw) {
            ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, raw.length / 2));
            try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
                gzip.write(raw);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to gzip payload", e);
            }
            return out.toByteArray();
        }

        @Override
        public byte[] decompress(byte[] compressed) throws IOException {
            try (GZIPInputStream gzip = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
                return gzip.readAllBytes();
            }
        }
    };

    private static final Logger logger = LogManager.getLogger(Compression.class);
    private static final int BUFFER_SIZE = 64 * 1024;

    /// @param raw uncompressed bytes
    /// @return the compressed bytes
    public abstract byte[] compress(byte[] raw);

    /// @param compressed compressed bytes
    /// @return the uncompressed bytes
    /// @throws IOException if the bytes are not a valid stream of this scheme
    public abstract byte[] decompress(byte[] compressed) throws IOException;

    /// Decompress with zlib, falling back to gzip.
    /// @param compressed a compressed payload
    /// @return the uncompressed bytes
    /// @throws UnknownCompressionException if neither scheme accepts the payload
    public static byte[] decompressAny(byte[] compressed) {
        try {
            return ZLIB.decompress(compressed);
        } catch (IOException zlibFailure) {
            logger.debug("zlib decompression failed ({}), trying gzip", zlibFailure.getMessage());
            try {
                return GZIP.decompress(compressed);
            } catch (IOException gzipFailure) {
                gzipFailure.addSuppressed(zlibFailure);
                throw new UnknownCompressionException("Unknown compression type", gzipFailure);
            }
        }
    }
}
