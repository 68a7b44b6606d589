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

import io.museg.metaimage.types.NdArray;

import java.util.Objects;

/// The closed set of values a {@link MetaImage} can be created from.
public sealed interface ImageSource permits ImageSource.ArraySource, ImageSource.VolumeSource,
    ImageSource.ImageCopy {

    /// @param array voxel values with no channel axis
    /// @return a source deriving all tags from the array
    static ImageSource of(NdArray array) {
        return new ArraySource(array, false);
    }

    /// @param array voxel values
    /// @param vector whether the last axis of the array holds the channels of each voxel
    /// @return a source deriving all tags from the array
    static ImageSource of(NdArray array, boolean vector) {
        return new ArraySource(array, vector);
    }

    /// @param volume an array with geometry
    /// @return a source deriving shape and type tags from the array and geometry tags from the volume
    static ImageSource of(Volume volume) {
        return new VolumeSource(volume, false);
    }

    /// @param volume an array with geometry
    /// @param vector whether the last axis of the array holds the channels of each voxel
    /// @return a source deriving shape and type tags from the array and geometry tags from the volume
    static ImageSource of(Volume volume, boolean vector) {
        return new VolumeSource(volume, vector);
    }

    /// @param image an existing image
    /// @return a source copying the array and every tag of the image
    static ImageSource copyOf(MetaImage image) {
        return new ImageCopy(image);
    }

    /// A bare array; tags are derived with identity geometry.
    record ArraySource(NdArray array, boolean vector) implements ImageSource {
        public ArraySource {
            Objects.requireNonNull(array, "array cannot be null");
        }
    }

    /// An array with origin, spacing and direction taken from the volume accessors.
    record VolumeSource(Volume volume, boolean vector) implements ImageSource {
        public VolumeSource {
            Objects.requireNonNull(volume, "volume cannot be null");
        }
    }

    /// Another image, array and tags included.
    record ImageCopy(MetaImage image) implements ImageSource {
        public ImageCopy {
            Objects.requireNonNull(image, "image cannot be null");
        }
    }
}
