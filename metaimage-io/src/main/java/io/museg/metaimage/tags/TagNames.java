package io.museg.metaimage.tags;

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

/// Canonical names of the standard MetaImage header tags.
public final class TagNames {

    public static final String OBJECT_TYPE = "ObjectType";
    public static final String NDIMS = "NDims";
    public static final String BINARY_DATA = "BinaryData";
    public static final String BINARY_DATA_BYTE_ORDER_MSB = "BinaryDataByteOrderMSB";
    public static final String COMPRESSED_DATA = "CompressedData";
    public static final String ANATOMICAL_ORIENTATION = "AnatomicalOrientation";
    public static final String OFFSET = "Offset";
    public static final String TRANSFORM_MATRIX = "TransformMatrix";
    public static final String ELEMENT_SPACING = "ElementSpacing";
    public static final String CENTER_OF_ROTATION = "CenterOfRotation";
    public static final String HEADER_SIZE = "HeaderSize";
    public static final String COMPRESSED_DATA_SIZE = "CompressedDataSize";
    public static final String COMMENT = "Comment";
    public static final String OBJECT_SUB_TYPE = "ObjectSubType";
    public static final String TRANSFORM_TYPE = "TransformType";
    public static final String NAME = "Name";
    public static final String ID = "ID";
    public static final String PARENT_ID = "ParentID";
    public static final String COLOR = "Color";
    public static final String MODALITY = "Modality";
    public static final String SEQUENCE_ID = "SequenceID";
    public static final String ELEMENT_BYTE_ORDER_MSB = "ElementByteOrderMSB";
    public static final String ELEMENT_MIN = "ElementMin";
    public static final String ELEMENT_MAX = "ElementMax";
    public static final String ELEMENT_NUMBER_OF_CHANNELS = "ElementNumberOfChannels";
    public static final String DIM_SIZE = "DimSize";
    public static final String ELEMENT_SIZE = "ElementSize";
    public static final String ELEMENT_TYPE = "ElementType";
    public static final String ELEMENT_DATA_FILE = "ElementDataFile";

    private TagNames() {
    }
}
