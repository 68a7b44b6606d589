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

/// A voxel array with its placement in physical space.
///
/// Any value exposing these accessors can seed a {@link MetaImage}; see
/// {@link ImageSource#of(Volume)}. Geometry vectors are listed in on-disk axis order (x first).
public interface Volume {

    /// @return the voxel values, in-memory axis order
    NdArray array();

    /// @return the physical position of the first voxel, one value per spatial axis
    double[] origin();

    /// @return the distance between voxel centers, one value per spatial axis
    double[] spacing();

    /// @return the row-major direction cosine matrix, {@code ndims * ndims} values
    double[] direction();
}
