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

import io.museg.metaimage.errors.InvalidGeometryException;
import io.museg.metaimage.errors.MissingRequiredTagException;
import io.museg.metaimage.errors.ShapeMismatchException;
import io.museg.metaimage.errors.TypeMismatchException;
import io.museg.metaimage.tags.MetaImageTags;
import io.museg.metaimage.tags.TagTrait;
import io.museg.metaimage.tags.TagTraitRegistry;
import io.museg.metaimage.types.ElementTypes;
import io.museg.metaimage.types.NdArray;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static io.museg.metaimage.tags.TagNames.*;

/// A numeric array coupled with the MetaImage header tags that describe it.
///
/// The array uses the in-memory axis convention: its shape is {@code DimSize} reversed, followed by
/// a trailing channel axis when {@code ElementNumberOfChannels > 1}. Its row-major element order is
/// therefore the on-disk payload order.
///
/// An image is only changed through {@link #update}, which reshapes or converts the array as the
/// new tags require and commits array and tags together once they pass {@link #check}.
public class MetaImage implements Volume {

    private static final Logger logger = LogManager.getLogger(MetaImage.class);

    static final String DEFAULT_ORIENTATION = "RAI";
    static final String UNKNOWN_ORIENTATION = "???";

    private NdArray array;
    private MetaImageTags tags;

    private MetaImage(NdArray array, MetaImageTags tags) {
        this.array = array;
        this.tags = tags;
    }

    /// @param array voxel values without a channel axis
    /// @return an image with tags derived from the array
    public static MetaImage of(NdArray array) {
        return create(ImageSource.of(array), Map.of(), false);
    }

    /// @param array voxel values
    /// @param tags tag overrides applied after deriving tags from the array
    /// @return the image
    public static MetaImage of(NdArray array, Map<String, ?> tags) {
        return create(ImageSource.of(array), tags, false);
    }

    /// Create an image from any supported source, then apply tag overrides.
    ///
    /// When the source gives no channel hint but the overrides set {@code ElementNumberOfChannels}
    /// to the extent of the array's last axis (and leave {@code NDims} and {@code DimSize} alone),
    /// that axis is taken as the channel axis.
    ///
    /// @param source the array, volume or image to start from
    /// @param tagOverrides tag names (canonical or alias) to values
    /// @param ignoreErrors skip geometric checks and missing required tags
    /// @return the image
    public static MetaImage create(ImageSource source, Map<String, ?> tagOverrides, boolean ignoreErrors) {
        Objects.requireNonNull(source, "source cannot be null");
        Objects.requireNonNull(tagOverrides, "tagOverrides cannot be null");
        logger.debug("Init metaimage from {}", source.getClass().getSimpleName());

        MetaImage image;
        if (source instanceof ImageSource.ImageCopy copy) {
            image = new MetaImage(copy.image().array(), copy.image().tags());
        } else if (source instanceof ImageSource.VolumeSource volumeSource) {
            Volume volume = volumeSource.volume();
            NdArray array = requireAttribute(volume.array(), "array");
            Map<String, Object> geometry = new LinkedHashMap<>();
            geometry.put(OFFSET, requireAttribute(volume.origin(), "origin"));
            geometry.put(ELEMENT_SPACING, requireAttribute(volume.spacing(), "spacing"));
            geometry.put(TRANSFORM_MATRIX, requireAttribute(volume.direction(), "direction"));
            image = fromArray(array, volumeSource.vector() || impliesChannelAxis(array, tagOverrides), geometry);
        } else {
            ImageSource.ArraySource arraySource = (ImageSource.ArraySource) source;
            NdArray array = arraySource.array();
            image = fromArray(array, arraySource.vector() || impliesChannelAxis(array, tagOverrides), Map.of());
        }

        image.update(tagOverrides, ignoreErrors);
        check(image.array, image.tags, ignoreErrors);
        return image;
    }

    private static MetaImage fromArray(NdArray array, boolean vector, Map<String, Object> geometry) {
        if (vector && array.ndim() >= 2 && array.dim(-1) == 1) {
            array = array.reshape(Arrays.copyOf(array.shape(), array.ndim() - 1));
            vector = false;
        }
        Map<String, Object> raw = deriveTags(array, vector);
        raw.putAll(geometry);
        return new MetaImage(array, MetaImageTags.build(TagTraitRegistry.standard(), raw, false));
    }

    /// Derive the tags describing an array: dimensionality, per-axis sizes (reversed to on-disk
    /// order), channel count, element type, byte order and identity geometry.
    ///
    /// @param array voxel values
    /// @param vector whether the last axis holds the channels of each voxel
    /// @return the validated tag collection, defaults applied
    /// @throws io.museg.metaimage.errors.UnsupportedTypeException if the array kind has no disk token
    public static MetaImageTags tagsFor(NdArray array, boolean vector) {
        return MetaImageTags.build(TagTraitRegistry.standard(), deriveTags(array, vector), false);
    }

    private static Map<String, Object> deriveTags(NdArray array, boolean vector) {
        int[] shape = array.shape();
        int spatialRank = shape.length;
        Map<String, Object> raw = new LinkedHashMap<>();
        if (vector) {
            if (shape.length < 2) {
                throw new ShapeMismatchException(ELEMENT_NUMBER_OF_CHANNELS,
                    "A multi-channel array needs at least one spatial axis and a channel axis, got shape "
                        + Arrays.toString(shape));
            }
            spatialRank = shape.length - 1;
            raw.put(ELEMENT_NUMBER_OF_CHANNELS, shape[shape.length - 1]);
        }

        long[] dimSize = new long[spatialRank];
        for (int axis = 0; axis < spatialRank; axis++) {
            dimSize[axis] = shape[spatialRank - 1 - axis];
        }
        raw.put(NDIMS, spatialRank);
        raw.put(DIM_SIZE, dimSize);
        raw.put(ELEMENT_TYPE, ElementTypes.toDiskToken(array.kind()));
        raw.put(BINARY_DATA_BYTE_ORDER_MSB, array.byteOrder() == ByteOrder.BIG_ENDIAN);
        if (spatialRank > 3) {
            raw.put(ANATOMICAL_ORIENTATION, UNKNOWN_ORIENTATION);
        }

        double[] direction = new double[spatialRank * spatialRank];
        for (int axis = 0; axis < spatialRank; axis++) {
            direction[axis * (spatialRank + 1)] = 1.0;
        }
        double[] spacing = new double[spatialRank];
        Arrays.fill(spacing, 1.0);
        raw.put(OFFSET, new double[spatialRank]);
        raw.put(ELEMENT_SPACING, spacing);
        raw.put(TRANSFORM_MATRIX, direction);
        return raw;
    }

    private static boolean impliesChannelAxis(NdArray array, Map<String, ?> overrides) {
        if (overrides.containsKey(NDIMS) || overrides.containsKey(DIM_SIZE) || array.ndim() < 2) {
            return false;
        }
        Object channels = given(TagTraitRegistry.standard(), overrides, ELEMENT_NUMBER_OF_CHANNELS);
        return channels != null && (Long) channels > 1 && array.dim(-1) == (Long) channels;
    }

    public NdArray array() {
        return array;
    }

    public MetaImageTags tags() {
        return tags;
    }

    /// @return the number of values per voxel
    public int channels() {
        return tags.getInt(ELEMENT_NUMBER_OF_CHANNELS, 1);
    }

    @Override
    public double[] origin() {
        return tags.getDoubles(OFFSET);
    }

    @Override
    public double[] spacing() {
        return tags.getDoubles(ELEMENT_SPACING);
    }

    @Override
    public double[] direction() {
        return tags.getDoubles(TRANSFORM_MATRIX);
    }

    /// @param raw tag names (canonical or alias) to values
    /// @see #update(Map, boolean)
    public void update(Map<String, ?> raw) {
        update(raw, false);
    }

    /// Apply new tag values, bringing the array in line with them.
    ///
    /// Shape tags are applied first: if {@code DimSize} or {@code ElementNumberOfChannels} is given,
    /// the array is reshaped to the new shape. A given {@code ElementType} converts the array, and a
    /// given {@code BinaryDataByteOrderMSB} re-orders it; when absent, both tags are derived from the
    /// array. Array and tags are replaced together only if the result passes {@link #check}, so a
    /// failed update leaves the image unchanged.
    ///
    /// @param raw tag names (canonical or alias) to values
    /// @param ignoreErrors skip geometric checks and missing required tags
    public void update(Map<String, ?> raw, boolean ignoreErrors) {
        if (raw == null || raw.isEmpty()) {
            return;
        }
        logger.debug("Update metaimage with {}", raw.keySet());
        TagTraitRegistry registry = tags.registry();

        Long givenNDims = (Long) given(registry, raw, NDIMS);
        List<?> givenDimSize = (List<?>) given(registry, raw, DIM_SIZE);
        Long givenChannels = (Long) given(registry, raw, ELEMENT_NUMBER_OF_CHANNELS);

        int ndims;
        if (givenNDims != null) {
            ndims = Math.toIntExact(givenNDims);
        } else if (tags.contains(NDIMS)) {
            ndims = Math.toIntExact(tags.getLong(NDIMS));
        } else {
            ndims = array.ndim() - (channels() > 1 ? 1 : 0);
        }
        int channels = givenChannels != null ? Math.toIntExact(givenChannels) : channels();

        NdArray next = array;
        if (givenDimSize != null || givenChannels != null) {
            long[] dimSize = givenDimSize != null ? toLongs(givenDimSize) : tags.getLongs(DIM_SIZE);
            if (dimSize == null) {
                throw new MissingRequiredTagException(DIM_SIZE);
            }
            if (givenDimSize == null && dimSize.length > ndims) {
                dimSize = Arrays.copyOf(dimSize, ndims);
            }
            next = next.reshape(memoryShape(dimSize, channels));
        }

        Map<String, Object> merged = new LinkedHashMap<>(raw);
        String elementType = (String) given(registry, raw, ELEMENT_TYPE);
        if (elementType != null) {
            next = next.astype(ElementTypes.fromDiskToken(elementType));
        }
        merged.put(ELEMENT_TYPE, ElementTypes.toDiskToken(next.kind()));

        Boolean msb = (Boolean) given(registry, raw, BINARY_DATA_BYTE_ORDER_MSB);
        if (msb != null) {
            next = next.withByteOrder(msb ? ByteOrder.BIG_ENDIAN : ByteOrder.LITTLE_ENDIAN);
        } else {
            merged.put(BINARY_DATA_BYTE_ORDER_MSB, next.byteOrder() == ByteOrder.BIG_ENDIAN);
        }

        String orientation = (String) given(registry, raw, ANATOMICAL_ORIENTATION);
        if (orientation == null) {
            orientation = Objects.requireNonNullElse(tags.getString(ANATOMICAL_ORIENTATION), DEFAULT_ORIENTATION);
        }
        merged.put(ANATOMICAL_ORIENTATION, ndims > 3 ? UNKNOWN_ORIENTATION : orientation);

        MetaImageTags candidate = tags.update(merged, ignoreErrors);
        check(next, candidate, ignoreErrors);
        this.array = next;
        this.tags = candidate;
    }

    /// Verify that an array and a tag collection describe each other.
    ///
    /// Dimensionality, per-axis sizes and element type are always checked, since decoding a payload
    /// relies on them. The lengths of the geometric tags are checked unless errors are ignored.
    ///
    /// @param array the voxel values
    /// @param tags the header tags
    /// @param ignoreErrors skip the geometric checks
    /// @throws ShapeMismatchException if {@code NDims} or {@code DimSize} disagree with the array shape
    /// @throws TypeMismatchException if {@code ElementType} disagrees with the array kind
    /// @throws InvalidGeometryException if a geometric tag has the wrong length
    public static void check(NdArray array, MetaImageTags tags, boolean ignoreErrors) {
        logger.debug("Check metaimage data {}", array);
        int channels = tags.getInt(ELEMENT_NUMBER_OF_CHANNELS, 1);
        if (!tags.contains(NDIMS)) {
            throw new MissingRequiredTagException(NDIMS);
        }
        long ndims = tags.getLong(NDIMS);
        if (array.ndim() != ndims + (channels > 1 ? 1 : 0)) {
            throw new ShapeMismatchException(NDIMS, "Invalid NDims: " + ndims + " for an array of shape "
                + Arrays.toString(array.shape()) + " with " + channels + " channel(s)");
        }

        long[] dimSize = tags.getLongs(DIM_SIZE);
        if (dimSize == null) {
            throw new MissingRequiredTagException(DIM_SIZE);
        }
        if (!Arrays.equals(memoryShape(dimSize, channels), array.shape())) {
            throw new ShapeMismatchException(DIM_SIZE, "Invalid DimSize: " + Arrays.toString(dimSize)
                + " for an array of shape " + Arrays.toString(array.shape()) + " with " + channels + " channel(s)");
        }

        String token = ElementTypes.toDiskToken(array.kind());
        if (!token.equals(tags.getString(ELEMENT_TYPE))) {
            throw new TypeMismatchException(ELEMENT_TYPE,
                "Invalid data type: " + tags.getString(ELEMENT_TYPE) + ", array holds " + token);
        }

        if (ignoreErrors) {
            return;
        }
        checkLength(tags, OFFSET, ndims);
        checkLength(tags, ELEMENT_SPACING, ndims);
        checkLength(tags, TRANSFORM_MATRIX, ndims * ndims);
        checkLength(tags, CENTER_OF_ROTATION, ndims);
        checkLength(tags, ELEMENT_SIZE, ndims);
    }

    private static void checkLength(MetaImageTags tags, String name, long expected) {
        if (tags.contains(name) && tags.lengthOf(name) != expected) {
            throw new InvalidGeometryException(name, "Invalid " + name + " tag: " + TagTrait.format(tags.get(name))
                + ", expected " + expected + " value(s)");
        }
    }

    /// @param dimSize per-axis sizes in on-disk order
    /// @param channels values per voxel
    /// @return the in-memory shape: sizes reversed, then the channel count if above one
    static int[] memoryShape(long[] dimSize, int channels) {
        int rank = dimSize.length + (channels > 1 ? 1 : 0);
        int[] shape = new int[rank];
        for (int axis = 0; axis < dimSize.length; axis++) {
            long extent = dimSize[dimSize.length - 1 - axis];
            if (extent < 0 || extent > Integer.MAX_VALUE) {
                throw new ShapeMismatchException(DIM_SIZE, "Invalid DimSize: " + Arrays.toString(dimSize));
            }
            shape[axis] = (int) extent;
        }
        if (channels > 1) {
            shape[rank - 1] = channels;
        }
        return shape;
    }

    private static Object given(TagTraitRegistry registry, Map<String, ?> raw, String canonical) {
        TagTrait trait = registry.trait(canonical);
        for (String name : trait.names()) {
            Object value = raw.get(name);
            if (value != null) {
                return trait.cast(value);
            }
        }
        return null;
    }

    private static long[] toLongs(List<?> values) {
        long[] out = new long[values.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = ((Number) values.get(i)).longValue();
        }
        return out;
    }

    private static <T> T requireAttribute(T value, String attribute) {
        if (value == null) {
            throw new MissingRequiredTagException(attribute, "Missing argument or attribute: " + attribute);
        }
        return value;
    }

    @Override
    public String toString() {
        return "MetaImage{array=" + array + ", tags=" + tags.asMap() + "}";
    }
}
