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
import io.museg.metaimage.errors.MetaImageException;
import io.museg.metaimage.errors.MissingRequiredTagException;
import io.museg.metaimage.errors.ShapeMismatchException;
import io.museg.metaimage.errors.TypeMismatchException;
import io.museg.metaimage.tags.MetaImageTags;
import io.museg.metaimage.types.ElementKind;
import io.museg.metaimage.types.NdArray;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.ByteOrder;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MetaImageTest {

    private static String tagOf(Throwable e) {
        return ((MetaImageException) e).getTagName();
    }

    @Nested
    @DisplayName("creating images")
    class Creating {

        @Test
        void derivesTagsFromArray() {
            MetaImage image = MetaImage.of(NdArray.zeros(ElementKind.UINT16, 10, 20, 30));
            MetaImageTags tags = image.tags();

            assertThat(tags.getLong("NDims")).isEqualTo(3L);
            assertThat(tags.getLongs("DimSize")).containsExactly(30L, 20L, 10L);
            assertThat(tags.getString("ElementType")).isEqualTo("MET_USHORT");
            assertThat(tags.contains("ElementNumberOfChannels")).isFalse();
            assertThat(image.origin()).containsExactly(0.0, 0.0, 0.0);
            assertThat(image.spacing()).containsExactly(1.0, 1.0, 1.0);
            assertThat(image.direction()).containsExactly(1, 0, 0, 0, 1, 0, 0, 0, 1);
            assertThat(image.channels()).isEqualTo(1);
        }

        @Test
        void vectorHintMakesLastAxisChannels() {
            MetaImage image = MetaImage.create(ImageSource.of(NdArray.zeros(ElementKind.UINT8, 5, 5, 2), true),
                Map.of(), false);
            assertThat(image.channels()).isEqualTo(2);
            assertThat(image.tags().getLong("NDims")).isEqualTo(2L);
            assertThat(image.tags().getLongs("DimSize")).containsExactly(5L, 5L);
            assertThat(image.array().shape()).containsExactly(5, 5, 2);
        }

        @Test
        void channelTagMatchingLastAxisImpliesChannels() {
            MetaImage image = MetaImage.of(NdArray.zeros(ElementKind.FLOAT32, 4, 3, 3),
                Map.of("ElementNumberOfChannels", 3));
            assertThat(image.channels()).isEqualTo(3);
            assertThat(image.tags().getLongs("DimSize")).containsExactly(3L, 4L);
        }

        @Test
        void singleChannelAxisIsDropped() {
            MetaImage image = MetaImage.create(ImageSource.of(NdArray.zeros(ElementKind.UINT8, 4, 3, 1), true),
                Map.of(), false);
            assertThat(image.array().shape()).containsExactly(4, 3);
            assertThat(image.tags().contains("ElementNumberOfChannels")).isFalse();
        }

        @Test
        void volumeSuppliesGeometry() {
            NdArray array = NdArray.zeros(ElementKind.INT16, 3, 4);
            Volume volume = new TestVolume(array, new double[]{1, 2}, new double[]{0.5, 0.25},
                new double[]{0, 1, 1, 0});
            MetaImage image = MetaImage.create(ImageSource.of(volume), Map.of(), false);

            assertThat(image.origin()).containsExactly(1.0, 2.0);
            assertThat(image.spacing()).containsExactly(0.5, 0.25);
            assertThat(image.direction()).containsExactly(0.0, 1.0, 1.0, 0.0);
        }

        @Test
        void volumeMissingAccessorIsNamed() {
            Volume volume = new TestVolume(NdArray.zeros(ElementKind.INT16, 3, 4), null, new double[]{1, 1},
                new double[]{1, 0, 0, 1});
            assertThatThrownBy(() -> MetaImage.create(ImageSource.of(volume), Map.of(), false))
                .isInstanceOf(MissingRequiredTagException.class)
                .satisfies(e -> assertThat(tagOf(e)).isEqualTo("origin"));
        }

        @Test
        void copyKeepsArrayAndTags() {
            MetaImage image = MetaImage.of(NdArray.zeros(ElementKind.UINT8, 2, 2), Map.of("Comment", "copy"));
            MetaImage copy = MetaImage.create(ImageSource.copyOf(image), Map.of(), false);
            assertThat(copy.array()).isEqualTo(image.array());
            assertThat(copy.tags()).isEqualTo(image.tags());
        }

        @Test
        void fourDimensionsHaveUnknownOrientation() {
            MetaImage image = MetaImage.of(NdArray.zeros(ElementKind.UINT8, 2, 2, 2, 2));
            assertThat(image.tags().getString("AnatomicalOrientation")).isEqualTo("???");
            assertThat(MetaImage.of(NdArray.zeros(ElementKind.UINT8, 2, 2)).tags().getString("AnatomicalOrientation"))
                .isEqualTo("RAI");
        }
    }

    @Nested
    @DisplayName("updating images")
    class Updating {

        @Test
        void channelChangeLeavesConsistentState() {
            MetaImage image = MetaImage.of(NdArray.zeros(ElementKind.UINT8, 4, 6));
            image.update(Map.of("ElementNumberOfChannels", 2, "DimSize", "3 4"));

            assertThat(image.array().shape()).containsExactly(4, 3, 2);
            assertThat(image.channels()).isEqualTo(2);
            assertThat(image.tags().getLong("NDims")).isEqualTo(2L);
            assertThatCode(() -> MetaImage.check(image.array(), image.tags(), false)).doesNotThrowAnyException();
        }

        @Test
        void failedUpdateChangesNothing() {
            MetaImage image = MetaImage.of(NdArray.zeros(ElementKind.UINT8, 4, 6));
            MetaImageTags before = image.tags();

            assertThatThrownBy(() -> image.update(Map.of("DimSize", "5 5")))
                .isInstanceOf(ShapeMismatchException.class);
            assertThat(image.array().shape()).containsExactly(4, 6);
            assertThat(image.tags()).isEqualTo(before);
        }

        @Test
        void elementTypeConvertsArray() {
            MetaImage image = MetaImage.of(NdArray.wrap(new short[]{1, 2, 3, 4}, 2, 2));
            image.update(Map.of("ElementType", "MET_FLOAT"));
            assertThat(image.array().kind()).isEqualTo(ElementKind.FLOAT32);
            assertThat((float[]) image.array().toArray()).containsExactly(1f, 2f, 3f, 4f);
        }

        @Test
        void byteOrderFlagReordersArray() {
            MetaImage image = MetaImage.of(NdArray.wrap(new int[]{1, 2}));
            image.update(Map.of("BinaryDataByteOrderMSB", "True"));
            assertThat(image.array().byteOrder()).isEqualTo(ByteOrder.BIG_ENDIAN);
            assertThat(image.array()).isEqualTo(NdArray.wrap(new int[]{1, 2}));
        }

        @Test
        void wrongGeometryLengthFails() {
            MetaImage image = MetaImage.of(NdArray.zeros(ElementKind.UINT8, 4, 6));
            assertThatThrownBy(() -> image.update(Map.of("Offset", "0 0 0")))
                .isInstanceOf(InvalidGeometryException.class)
                .satisfies(e -> assertThat(tagOf(e)).isEqualTo("Offset"));

            image.update(Map.of("Offset", "0 0 0"), true);
            assertThat(image.origin()).hasSize(3);
        }
    }

    @Nested
    @DisplayName("checking array against tags")
    class Checking {

        @Test
        void dimSizeMismatch() {
            MetaImageTags tags = MetaImage.tagsFor(NdArray.zeros(ElementKind.UINT8, 3, 2), false);
            assertThatThrownBy(() -> MetaImage.check(NdArray.zeros(ElementKind.UINT8, 2, 3), tags, true))
                .isInstanceOf(ShapeMismatchException.class)
                .satisfies(e -> assertThat(tagOf(e)).isEqualTo("DimSize"));
        }

        @Test
        void nDimsMismatch() {
            MetaImageTags tags = MetaImage.tagsFor(NdArray.zeros(ElementKind.UINT8, 2, 2, 2), false);
            assertThatThrownBy(() -> MetaImage.check(NdArray.zeros(ElementKind.UINT8, 2, 4), tags, true))
                .isInstanceOf(ShapeMismatchException.class)
                .satisfies(e -> assertThat(tagOf(e)).isEqualTo("NDims"));
        }

        @Test
        void elementTypeMismatchIsNeverIgnored() {
            MetaImageTags tags = MetaImage.tagsFor(NdArray.zeros(ElementKind.UINT16, 2, 3), false);
            assertThatThrownBy(() -> MetaImage.check(NdArray.zeros(ElementKind.UINT8, 2, 3), tags, true))
                .isInstanceOf(TypeMismatchException.class)
                .satisfies(e -> assertThat(tagOf(e)).isEqualTo("ElementType"));
        }

        @Test
        void transformMatrixNeedsSquareLength() {
            NdArray array = NdArray.zeros(ElementKind.UINT8, 2, 3);
            MetaImageTags tags = MetaImage.tagsFor(array, false).update(Map.of("TransformMatrix", "1 0 0"), false);
            assertThatThrownBy(() -> MetaImage.check(array, tags, false))
                .isInstanceOf(InvalidGeometryException.class)
                .satisfies(e -> assertThat(tagOf(e)).isEqualTo("TransformMatrix"));
            assertThatCode(() -> MetaImage.check(array, tags, true)).doesNotThrowAnyException();
        }
    }

    private record TestVolume(NdArray array, double[] origin, double[] spacing, double[] direction)
        implements Volume {
    }
}
