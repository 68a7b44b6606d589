/// Reading and writing MetaImage ({@code .mha}/{@code .mhd}) files.
///
/// {@link io.museg.metaimage.MetaImageIO} is the entry point. A {@link io.museg.metaimage.MetaImage}
/// couples an {@link io.museg.metaimage.types.NdArray} with its validated
/// {@link io.museg.metaimage.tags.MetaImageTags}.
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
