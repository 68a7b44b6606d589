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

import io.museg.metaimage.errors.InvalidTagValueException;
import io.museg.metaimage.errors.MissingRequiredTagException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// An ordered, validated collection of MetaImage header tags.
///
/// Keys are always canonical tag names and iteration follows the registry declaration order, not
/// the order values were supplied in. Instances are immutable: {@link #update} and
/// {@link #without} return new collections.
///
/// Raw input is resolved trait by trait: the first of a trait's names present in the input wins;
/// otherwise an existing value is kept, then the trait default is applied, and a missing required
/// tag fails unless errors are ignored. Names no trait owns are logged and dropped.
public final class MetaImageTags {

    private static final Logger logger = LogManager.getLogger(MetaImageTags.class);

    private final TagTraitRegistry registry;
    private final Map<String, Object> values;

    private MetaImageTags(TagTraitRegistry registry, Map<String, Object> values) {
        this.registry = registry;
        this.values = Collections.unmodifiableMap(values);
    }

    /// Build a collection from raw tags against the standard registry, failing on missing required tags.
    /// @param raw tag names (canonical or alias) to header text or native values
    /// @return the validated collection
    public static MetaImageTags build(Map<String, ?> raw) {
        return build(TagTraitRegistry.standard(), raw, false);
    }

    /// @param registry the trait registry to validate against
    /// @param raw tag names (canonical or alias) to header text or native values
    /// @param ignoreErrors skip missing required tags instead of failing
    /// @return the validated collection
    /// @throws MissingRequiredTagException if a required tag is missing and errors are not ignored
    /// @throws InvalidTagValueException if a value fails its trait
    public static MetaImageTags build(TagTraitRegistry registry, Map<String, ?> raw, boolean ignoreErrors) {
        return resolve(Objects.requireNonNull(registry, "registry cannot be null"), Map.of(), raw, ignoreErrors);
    }

    /// @param raw tag names (canonical or alias) to header text or native values
    /// @param ignoreErrors skip missing required tags instead of failing
    /// @return a new collection with the given values replacing existing ones
    public MetaImageTags update(Map<String, ?> raw, boolean ignoreErrors) {
        if (raw.isEmpty()) {
            return this;
        }
        return resolve(registry, values, raw, ignoreErrors);
    }

    /// @param names canonical tag names or aliases
    /// @return a new collection without those tags; defaults are not re-applied
    public MetaImageTags without(String... names) {
        Set<String> dropped = new HashSet<>();
        for (String name : names) {
            registry.find(name).ifPresent(trait -> dropped.add(trait.name()));
        }
        Map<String, Object> kept = new LinkedHashMap<>(values);
        kept.keySet().removeAll(dropped);
        return new MetaImageTags(registry, kept);
    }

    private static MetaImageTags resolve(
        TagTraitRegistry registry,
        Map<String, Object> existing,
        Map<String, ?> raw,
        boolean ignoreErrors
    ) {
        Map<String, Object> pending = new LinkedHashMap<>(raw);
        Map<String, Object> resolved = new LinkedHashMap<>();

        for (TagTrait trait : registry.traits()) {
            Object value = null;
            String givenAs = null;
            for (String name : trait.names()) {
                if (!pending.containsKey(name)) {
                    continue;
                }
                Object candidate = pending.remove(name);
                if (givenAs == null && candidate != null) {
                    value = candidate;
                    givenAs = name;
                } else if (givenAs != null) {
                    logger.warn("Tag {} given as both {} and {}, keeping {}", trait.name(), givenAs, name, givenAs);
                }
            }

            if (value == null) {
                if (existing.containsKey(trait.name())) {
                    value = existing.get(trait.name());
                } else if (trait.defaultValue() != null) {
                    value = trait.defaultValue();
                } else if (trait.isRequired() && !ignoreErrors) {
                    throw new MissingRequiredTagException(trait.name());
                } else {
                    continue;
                }
            }
            resolved.put(trait.name(), trait.cast(value));
        }

        for (String unknown : pending.keySet()) {
            logger.info("Unknown tag: {}", unknown);
        }
        return new MetaImageTags(registry, resolved);
    }

    public TagTraitRegistry registry() {
        return registry;
    }

    /// @param name a canonical tag name or alias
    /// @return whether the tag has a value
    public boolean contains(String name) {
        return registry.find(name).map(trait -> values.containsKey(trait.name())).orElse(false);
    }

    /// @param name a canonical tag name or alias
    /// @return the typed value, or null if the tag is absent or unknown
    public Object get(String name) {
        return registry.find(name).map(trait -> values.get(trait.name())).orElse(null);
    }

    /// @param name a singleton integer tag
    /// @param fallback value returned when the tag is absent
    /// @return the tag value, narrowed to int
    public int getInt(String name, int fallback) {
        Object value = get(name);
        return value == null ? fallback : Math.toIntExact((Long) value);
    }

    /// @param name a singleton integer tag
    /// @return the tag value
    /// @throws MissingRequiredTagException if the tag is absent
    public long getLong(String name) {
        return (Long) require(name);
    }

    /// @param name a singleton boolean tag
    /// @return the tag value, or false if absent
    public boolean getBoolean(String name) {
        return Boolean.TRUE.equals(get(name));
    }

    /// @param name a singleton string or choice tag
    /// @return the tag value, or null if absent
    public String getString(String name) {
        Object value = get(name);
        return value == null ? null : value.toString();
    }

    /// @param name a float sequence tag
    /// @return a copy of the values, or null if absent
    public double[] getDoubles(String name) {
        Object value = get(name);
        if (value == null) {
            return null;
        }
        List<?> list = (List<?>) value;
        double[] out = new double[list.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = ((Number) list.get(i)).doubleValue();
        }
        return out;
    }

    /// @param name an integer sequence tag
    /// @return a copy of the values, or null if absent
    public long[] getLongs(String name) {
        Object value = get(name);
        if (value == null) {
            return null;
        }
        List<?> list = (List<?>) value;
        long[] out = new long[list.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = ((Number) list.get(i)).longValue();
        }
        return out;
    }

    /// @param name a tag name
    /// @return the number of values the tag holds: 1 for a singleton, 0 if absent
    public int lengthOf(String name) {
        Object value = get(name);
        if (value == null) {
            return 0;
        }
        return value instanceof List<?> list ? list.size() : 1;
    }

    /// @return the tags in registry order, canonical name to typed value
    public Map<String, Object> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    /// Serialize as header text, one {@code name = value1 value2 ...} line per present tag, in
    /// registry order.
    /// @return the header text, each line terminated by a newline
    public String toText() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            sb.append(entry.getKey()).append(" = ").append(TagTrait.format(entry.getValue())).append('\n');
        }
        return sb.toString();
    }

    private Object require(String name) {
        Object value = get(name);
        if (value == null) {
            throw new MissingRequiredTagException(registry.find(name).map(TagTrait::name).orElse(name));
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MetaImageTags)) {
            return false;
        }
        MetaImageTags other = (MetaImageTags) o;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "MetaImageTags" + Arrays.toString(values.entrySet().toArray());
    }
}
