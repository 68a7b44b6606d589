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

import io.museg.metaimage.errors.InvalidArityException;
import io.museg.metaimage.errors.InvalidBooleanException;
import io.museg.metaimage.errors.InvalidChoiceException;
import io.museg.metaimage.errors.InvalidTagValueException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TagTraitTest {

    private final TagTrait singleInt = TagTrait.builder("Count").type(ValueKind.INTEGER).build();
    private final TagTrait triple = TagTrait.builder("Triple").type(ValueKind.INTEGER).arity(Arity.fixed(3)).build();
    private final TagTrait vector = TagTrait.builder("Vector").type(ValueKind.FLOAT).arity(Arity.variable()).build();

    @Test
    void singletonReturnsScalar() {
        assertThat(singleInt.cast("5")).isEqualTo(5L);
        assertThat(singleInt.cast(7)).isEqualTo(7L);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "1 2", "1 2 3"})
    void singletonRejectsOtherCounts(String raw) {
        assertThatThrownBy(() -> singleInt.cast(raw)).isInstanceOf(InvalidArityException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"1", "1 2", "1 2 3 4"})
    void fixedArityRejectsOtherCounts(String raw) {
        assertThatThrownBy(() -> triple.cast(raw))
            .isInstanceOf(InvalidArityException.class)
            .satisfies(e -> assertThat(((InvalidArityException) e).getTagName()).isEqualTo("Triple"));
    }

    @Test
    void fixedArityCollapsesWhitespace() {
        assertThat(triple.cast("  1   2\t3 ")).isEqualTo(List.of(1L, 2L, 3L));
    }

    @Test
    void variableArityAcceptsAnyCount() {
        assertThat(vector.cast("")).isEqualTo(List.of());
        assertThat(vector.cast("1.5")).isEqualTo(List.of(1.5));
        assertThat(vector.cast(new double[]{1, 2, 3, 4, 5})).isEqualTo(List.of(1.0, 2.0, 3.0, 4.0, 5.0));
        assertThat(vector.cast(List.of(1, 2))).isEqualTo(List.of(1.0, 2.0));
    }

    @Test
    void textKeepsInnerWhitespace() {
        TagTrait file = TagTrait.builder("File").type(ValueKind.TEXT).build();
        assertThat(file.cast("  my  scan.raw ")).isEqualTo("my  scan.raw");
        assertThatThrownBy(() -> file.cast("  ")).isInstanceOf(InvalidArityException.class);
        assertThatThrownBy(() -> TagTrait.builder("Word").build().cast("my scan.raw"))
            .isInstanceOf(InvalidArityException.class);
    }

    @Test
    void booleansAreCaseSensitive() {
        TagTrait flag = TagTrait.builder("Flag").type(ValueKind.BOOLEAN).build();
        assertThat(flag.cast("True")).isEqualTo(true);
        assertThat(flag.cast("False")).isEqualTo(false);
        assertThat(flag.cast(Boolean.TRUE)).isEqualTo(true);
        assertThatThrownBy(() -> flag.cast("true")).isInstanceOf(InvalidBooleanException.class);
        assertThatThrownBy(() -> flag.cast("1")).isInstanceOf(InvalidBooleanException.class);
    }

    @Test
    void choicesMustBeListed() {
        TagTrait kind = TagTrait.builder("Kind").choices("Image", "Mesh").build();
        assertThat(kind.valueKind()).isEqualTo(ValueKind.CHOICE);
        assertThat(kind.cast("Mesh")).isEqualTo("Mesh");
        assertThatThrownBy(() -> kind.cast("Tube"))
            .isInstanceOf(InvalidChoiceException.class)
            .satisfies(e -> assertThat(((InvalidChoiceException) e).getChoices()).containsExactly("Image", "Mesh"));
    }

    @Test
    void numbersMustParse() {
        assertThatThrownBy(() -> singleInt.cast("abc"))
            .isInstanceOf(InvalidTagValueException.class)
            .satisfies(e -> assertThat(((InvalidTagValueException) e).getValue()).isEqualTo("abc"));
        assertThatThrownBy(() -> singleInt.cast("2.5")).isInstanceOf(InvalidTagValueException.class);
        assertThatThrownBy(() -> vector.cast("1 x")).isInstanceOf(InvalidTagValueException.class);
    }

    @Test
    void defaultIsCastOnBuild() {
        TagTrait flag = TagTrait.builder("Flag").type(ValueKind.BOOLEAN).defaultValue("True").build();
        assertThat(flag.defaultValue()).isEqualTo(true);
        assertThatThrownBy(() -> TagTrait.builder("Flag").type(ValueKind.BOOLEAN).defaultValue("yes").build())
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void variableArityCannotHaveDefault() {
        assertThatThrownBy(() -> TagTrait.builder("Vector").arity(Arity.variable()).defaultValue("1").build())
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void formatsHeaderValues() {
        assertThat(TagTrait.format(List.of(1.0, 2.5))).isEqualTo("1.0 2.5");
        assertThat(TagTrait.format(List.of(30L, 20L, 10L))).isEqualTo("30 20 10");
        assertThat(TagTrait.format(true)).isEqualTo("True");
        assertThat(TagTrait.format("LOCAL")).isEqualTo("LOCAL");
    }

    @Test
    void fixedArityNeedsPositiveLength() {
        assertThatThrownBy(() -> Arity.fixed(0)).isInstanceOf(IllegalArgumentException.class);
        assertThat(Arity.fixed(4).accepts(4)).isTrue();
        assertThat(Arity.variable().accepts(0)).isTrue();
        assertThat(Arity.singleton().accepts(0)).isFalse();
    }
}
