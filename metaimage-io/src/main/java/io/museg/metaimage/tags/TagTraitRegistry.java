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

import io.museg.metaimage.errors.UnknownTagException;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static io.museg.metaimage.tags.TagNames.*;

/// An ordered, immutable list of {@link TagTrait}s with a lookup from every accepted name to its
/// owning trait.
///
/// Declaration order is significant: tag collections are resolved and serialized in this order, so
/// the element type and the data file location, which describe the payload, come last.
///
/// The registry is immutable after construction and may be shared freely between threads.
public final class TagTraitRegistry {

    private static final TagTraitRegistry STANDARD = new TagTraitRegistry(List.of(
        TagTrait.builder(OBJECT_TYPE).choices("Image").defaultValue("Image").build(),
        TagTrait.builder(NDIMS).type(ValueKind.INTEGER).optional().build(),
        TagTrait.builder(BINARY_DATA).type(ValueKind.BOOLEAN).defaultValue("True").build(),
        TagTrait.builder(BINARY_DATA_BYTE_ORDER_MSB).type(ValueKind.BOOLEAN).defaultValue("False").build(),
        TagTrait.builder(COMPRESSED_DATA).type(ValueKind.BOOLEAN).defaultValue("False").build(),
        TagTrait.builder(ANATOMICAL_ORIENTATION).defaultValue("RAI").build(),
        TagTrait.builder(OFFSET, "Position", "Origin").type(ValueKind.FLOAT).arity(Arity.variable()).build(),
        TagTrait.builder(TRANSFORM_MATRIX, "Rotation", "Orientation").type(ValueKind.FLOAT)
            .arity(Arity.variable()).build(),
        TagTrait.builder(ELEMENT_SPACING).type(ValueKind.FLOAT).arity(Arity.variable()).build(),
        // optional
        TagTrait.builder(CENTER_OF_ROTATION).type(ValueKind.FLOAT).arity(Arity.variable()).optional().build(),
        TagTrait.builder(HEADER_SIZE).type(ValueKind.INTEGER).optional().build(),
        TagTrait.builder(COMPRESSED_DATA_SIZE).type(ValueKind.INTEGER).optional().build(),
        TagTrait.builder(COMMENT).optional().build(),
        TagTrait.builder(OBJECT_SUB_TYPE).optional().build(),
        TagTrait.builder(TRANSFORM_TYPE).optional().build(),
        TagTrait.builder(NAME).optional().build(),
        TagTrait.builder(ID).type(ValueKind.INTEGER).optional().build(),
        TagTrait.builder(PARENT_ID).type(ValueKind.INTEGER).optional().build(),
        TagTrait.builder(COLOR).type(ValueKind.FLOAT).arity(Arity.fixed(4)).optional().build(),
        TagTrait.builder(MODALITY).optional().build(),
        TagTrait.builder(SEQUENCE_ID).type(ValueKind.INTEGER).arity(Arity.fixed(4)).optional().build(),
        TagTrait.builder(ELEMENT_BYTE_ORDER_MSB).optional().build(),
        TagTrait.builder(ELEMENT_MIN).type(ValueKind.FLOAT).optional().build(),
        TagTrait.builder(ELEMENT_MAX).type(ValueKind.FLOAT).optional().build(),
        TagTrait.builder(ELEMENT_NUMBER_OF_CHANNELS).type(ValueKind.INTEGER).optional().build(),
        TagTrait.builder(DIM_SIZE).type(ValueKind.INTEGER).arity(Arity.variable()).build(),
        TagTrait.builder(ELEMENT_SIZE).type(ValueKind.FLOAT).arity(Arity.variable()).optional().build(),
        // last
        TagTrait.builder(ELEMENT_TYPE).defaultValue("MET_USHORT").optional().build(),
        TagTrait.builder(ELEMENT_DATA_FILE).type(ValueKind.TEXT).defaultValue("LOCAL").optional().build()
    ));

    private final List<TagTrait> traits;
    private final Map<String, TagTrait> byName;

    /// @param traits the traits in declaration order
    /// @throws IllegalArgumentException if two traits share a name or alias
    public TagTraitRegistry(List<TagTrait> traits) {
        this.traits = List.copyOf(traits);
        Map<String, TagTrait> names = new HashMap<>();
        for (TagTrait trait : this.traits) {
            for (String name : trait.names()) {
                TagTrait previous = names.putIfAbsent(name, trait);
                if (previous != null) {
                    throw new IllegalArgumentException(
                        "Tag name " + name + " is claimed by both " + previous.name() + " and " + trait.name());
                }
            }
        }
        this.byName = Collections.unmodifiableMap(names);
    }

    /// @return the registry of standard MetaImage header tags
    public static TagTraitRegistry standard() {
        return STANDARD;
    }

    /// @return the traits in declaration order
    public List<TagTrait> traits() {
        return traits;
    }

    /// @param rawName a canonical tag name or alias
    /// @return the owning trait, if any
    public Optional<TagTrait> find(String rawName) {
        return Optional.ofNullable(byName.get(rawName));
    }

    /// @param rawName a canonical tag name or alias
    /// @return the owning trait
    /// @throws UnknownTagException if no trait owns that name
    public TagTrait trait(String rawName) {
        TagTrait trait = byName.get(rawName);
        if (trait == null) {
            throw new UnknownTagException(rawName);
        }
        return trait;
    }

    /// @param rawName a canonical tag name or alias
    /// @return the canonical name
    /// @throws UnknownTagException if no trait owns that name
    public String resolve(String rawName) {
        return trait(rawName).name();
    }
}
