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

import io.museg.metaimage.errors.InvalidTagValueException;
import io.museg.metaimage.errors.MissingRequiredTagException;
import io.museg.metaimage.errors.PayloadNotFoundException;
import io.museg.metaimage.errors.ShapeMismatchException;
import io.museg.metaimage.tags.MetaImageTags;
import io.museg.metaimage.tags.TagTraitRegistry;
import io.museg.metaimage.types.ElementKind;
import io.museg.metaimage.types.ElementTypes;
import io.museg.metaimage.types.NdArray;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import static io.museg.metaimage.tags.TagNames.*;

/// Loads and saves MetaImage files ({@code .mha} with an inline payload, {@code .mhd} with a
/// separate {@code .raw} or {@code .zraw} payload).
///
/// Payloads are read fully into memory. Every call opens its files with try-with-resources and
/// shares no state with other calls.
public final class MetaImageIO {

    private static final Logger logger = LogManager.getLogger(MetaImageIO.class);

    private MetaImageIO() {
    }

    /// Load a file leniently: missing geometric tags are tolerated and geometric lengths are not
    /// checked. Shape and type are always checked.
    ///
    /// @param path the header file
    /// @return the image
    /// @throws IOException if a file cannot be read
    public static MetaImage read(Path path) throws IOException {
        return load(path, true);
    }

    /// @param path the header file
    /// @param ignoreErrors tolerate missing required tags and skip geometric checks
    /// @return the image
    /// @throws IOException if a file cannot be read
    /// @throws PayloadNotFoundException if an external payload file does not exist
    /// @throws io.museg.metaimage.errors.UnknownCompressionException if a compressed payload cannot be
    ///     decompressed
    /// @throws ShapeMismatchException if the payload size disagrees with the header
    public static MetaImage load(Path path, boolean ignoreErrors) throws IOException {
        logger.debug("Load metaimage {}", path);
        try (InputStream in = new BufferedInputStream(Files.newInputStream(path))) {
            MetaImageTags tags = parseTags(MetaImageHeader.read(in), ignoreErrors);
            PayloadLocation location = PayloadLocation.parse(tags.getString(ELEMENT_DATA_FILE));
            byte[] payload;
            if (location instanceof PayloadLocation.External external) {
                payload = readExternal(external.resolve(path));
            } else {
                payload = in.readAllBytes();
            }
            logger.debug("Read {} payload bytes from {}", payload.length, location.tagValue());

            NdArray array = decode(payload, tags);
            return MetaImage.create(ImageSource.of(array, tags.getInt(ELEMENT_NUMBER_OF_CHANNELS, 1) > 1),
                tags.asMap(), ignoreErrors);
        }
    }

    /// Read only the header of a file.
    /// @param path the header file
    /// @param ignoreErrors tolerate missing required tags
    /// @return the parsed tags
    /// @throws IOException if the file cannot be read
    public static MetaImageTags readTags(Path path, boolean ignoreErrors) throws IOException {
        try (InputStream in = new BufferedInputStream(Files.newInputStream(path))) {
            return parseTags(MetaImageHeader.read(in), ignoreErrors);
        }
    }

    /// @param path the requested destination
    /// @param array voxel values without a channel axis
    /// @return the header path actually written
    /// @throws IOException if a file cannot be written
    /// @see #save(Path, MetaImage, Map)
    public static Path write(Path path, NdArray array) throws IOException {
        return save(path, MetaImage.of(array));
    }

    /// @param path the requested destination
    /// @param array voxel values
    /// @param tags tag overrides applied on top of the tags derived from the array
    /// @return the header path actually written
    /// @throws IOException if a file cannot be written
    /// @see #save(Path, MetaImage, Map)
    public static Path write(Path path, NdArray array, Map<String, ?> tags) throws IOException {
        return save(path, MetaImage.of(array, tags));
    }

    /// @param path the requested destination
    /// @param image the image to write
    /// @return the header path actually written
    /// @throws IOException if a file cannot be written
    public static Path save(Path path, MetaImage image) throws IOException {
        return save(path, image, Map.of());
    }

    /// Write an image.
    ///
    /// The overrides are applied to a copy of the image, so the caller's image is unchanged.
    /// {@code HeaderSize} is dropped, and {@code CompressedDataSize} is recomputed when
    /// {@code CompressedData = True}. The file extension picks the payload location: {@code .mha}
    /// stores it inline, {@code .mhd} in a sibling {@code .raw} or {@code .zraw} file, and any other
    /// name gets {@code .mha} appended. The image is checked strictly before anything is written.
    ///
    /// @param path the requested destination
    /// @param image the image to write
    /// @param overrides tag names (canonical or alias) to values
    /// @return the header path actually written
    /// @throws IOException if a file cannot be written
    public static Path save(Path path, MetaImage image, Map<String, ?> overrides) throws IOException {
        MetaImage target = MetaImage.create(ImageSource.copyOf(image), overrides, false);
        MetaImageTags tags = target.tags().without(HEADER_SIZE, COMPRESSED_DATA_SIZE);
        boolean compressed = tags.getBoolean(COMPRESSED_DATA);

        byte[] payload = encode(target.array(), tags);
        if (compressed) {
            payload = Compression.ZLIB.compress(payload);
            tags = tags.update(Map.of(COMPRESSED_DATA_SIZE, payload.length), false);
        }

        PayloadLocation.Destination destination = PayloadLocation.destinationFor(path, compressed);
        tags = tags.update(Map.of(ELEMENT_DATA_FILE, destination.location().tagValue()), false);
        MetaImage.check(target.array(), tags, false);
        logger.debug("Save metaimage {} with payload {}", destination.headerPath(), destination.location().tagValue());

        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(destination.headerPath()))) {
            MetaImageHeader.write(out, tags);
            if (destination.location() instanceof PayloadLocation.Local) {
                out.write(payload);
            }
        }
        if (destination.location() instanceof PayloadLocation.External external) {
            try (OutputStream out = new BufferedOutputStream(
                Files.newOutputStream(external.resolve(destination.headerPath())))) {
                out.write(payload);
            }
        }
        return destination.headerPath();
    }

    /// Turn payload bytes into an array in the in-memory axis convention.
    ///
    /// @param payload the payload as stored, possibly compressed and with a leading header
    /// @param tags the header tags
    /// @return the array, shaped {@code reverse(DimSize)} plus a channel axis if multi-channel
    /// @throws ShapeMismatchException if the payload size disagrees with {@code DimSize}
    public static NdArray decode(byte[] payload, MetaImageTags tags) {
        ElementKind kind = ElementTypes.fromDiskToken(tags.getString(ELEMENT_TYPE));
        ByteOrder order = tags.getBoolean(BINARY_DATA_BYTE_ORDER_MSB) ? ByteOrder.BIG_ENDIAN : ByteOrder.LITTLE_ENDIAN;
        int channels = tags.getInt(ELEMENT_NUMBER_OF_CHANNELS, 1);
        long[] dimSize = tags.getLongs(DIM_SIZE);
        if (dimSize == null) {
            throw new MissingRequiredTagException(DIM_SIZE);
        }
        int[] shape = MetaImage.memoryShape(dimSize, channels);
        long expected = (long) kind.width();
        try {
            for (int extent : shape) {
                expected = Math.multiplyExact(expected, extent);
            }
        } catch (ArithmeticException e) {
            throw new ShapeMismatchException(DIM_SIZE, "DimSize " + Arrays.toString(dimSize) + " with "
                + channels + " channel(s) of " + kind + " overflows the payload size", e);
        }

        long headerSize = tags.contains(HEADER_SIZE) ? tags.getLong(HEADER_SIZE) : 0L;
        if (headerSize > 0) {
            if (headerSize > payload.length) {
                throw new InvalidTagValueException(HEADER_SIZE, headerSize,
                    "HeaderSize " + headerSize + " exceeds the " + payload.length + " payload bytes");
            }
            payload = Arrays.copyOfRange(payload, (int) headerSize, payload.length);
        }

        if (tags.getBoolean(COMPRESSED_DATA)) {
            if (tags.contains(COMPRESSED_DATA_SIZE) && tags.getLong(COMPRESSED_DATA_SIZE) != payload.length) {
                logger.warn("CompressedDataSize {} does not match the {} compressed payload bytes",
                    tags.getLong(COMPRESSED_DATA_SIZE), payload.length);
            }
            if (headerSize == -1) {
                logger.warn("HeaderSize -1 is ignored for a compressed payload");
            }
            payload = Compression.decompressAny(payload);
        } else if (headerSize == -1 && payload.length > expected) {
            payload = Arrays.copyOfRange(payload, (int) (payload.length - expected), payload.length);
        }

        if (payload.length != expected) {
            throw new ShapeMismatchException(DIM_SIZE, "Payload holds " + payload.length + " bytes, DimSize "
                + Arrays.toString(dimSize) + " with " + channels + " channel(s) of " + kind + " needs " + expected);
        }
        return NdArray.fromBytes(kind, order, payload, shape);
    }

    /// @param array the array to serialise
    /// @param tags the header tags; {@code BinaryDataByteOrderMSB} picks the byte order
    /// @return the uncompressed payload bytes
    public static byte[] encode(NdArray array, MetaImageTags tags) {
        ByteOrder order = tags.getBoolean(BINARY_DATA_BYTE_ORDER_MSB) ? ByteOrder.BIG_ENDIAN : ByteOrder.LITTLE_ENDIAN;
        return array.rawBytes(order);
    }

    private static MetaImageTags parseTags(Map<String, String> header, boolean ignoreErrors) {
        Map<String, String> raw = new LinkedHashMap<>(header);
        if (!raw.containsKey(BINARY_DATA_BYTE_ORDER_MSB) && raw.containsKey(ELEMENT_BYTE_ORDER_MSB)) {
            raw.put(BINARY_DATA_BYTE_ORDER_MSB, raw.get(ELEMENT_BYTE_ORDER_MSB));
        }
        String elementType = raw.get(ELEMENT_TYPE);
        if (elementType != null && ElementTypes.diskTokens().contains(elementType)) {
            raw.put(ELEMENT_TYPE, ElementTypes.toDiskToken(ElementTypes.fromDiskToken(elementType)));
        }
        return MetaImageTags.build(TagTraitRegistry.standard(), raw, ignoreErrors);
    }

    private static byte[] readExternal(Path payloadPath) throws IOException {
        try (InputStream in = Files.newInputStream(payloadPath)) {
            return in.readAllBytes();
        } catch (NoSuchFileException e) {
            throw new PayloadNotFoundException(payloadPath, e);
        }
    }
}
