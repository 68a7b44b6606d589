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

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/// Immutable schema entry for one header tag: its names, arity, value type, default and
/// requiredness.
///
/// The first name is the canonical one; the others are aliases accepted on input. A trait
/// validates and casts raw values with {@link #cast(Object)}: text is split on whitespace into
/// tokens, except for {@link ValueKind#TEXT} tags which keep it whole; other values are taken as a single token or, for collections and primitive arrays, as
/// one token per element.
public final class TagTrait {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final List<String> names;
    private final Arity arity;
    private final ValueKind valueKind;
    private final Set<String> choices;
    private final boolean required;
    private final Object defaultValue;

    private TagTrait(Builder builder) {
        this.names = List.copyOf(builder.names);
        this.arity = builder.arity;
        this.valueKind = builder.valueKind;
        this.choices = Collections.unmodifiableSet(new LinkedHashSet<>(builder.choices));
        this.required = builder.required;

        if (valueKind == ValueKind.CHOICE && choices.isEmpty()) {
            throw new IllegalArgumentException("Tag " + name() + " is a choice without choices");
        }
        if (builder.defaultValue != null && arity.kind() == Arity.Kind.VARIABLE) {
            throw new IllegalArgumentException("Tag " + name() + ": cannot set default with unknown size");
        }
        try {
            this.defaultValue = builder.defaultValue == null ? null : cast(builder.defaultValue);
        } catch (InvalidTagValueException e) {
            throw new IllegalArgumentException("Tag " + name() + ": invalid default " + builder.defaultValue, e);
        }
    }

    /// @param name the canonical tag name
    /// @param aliases further names accepted on input
    /// @return a builder for a required singleton string tag, to be refined
    public static Builder builder(String name, String... aliases) {
        return new Builder(name, aliases);
    }

    /// @return the canonical name
    public String name() {
        return names.get(0);
    }

    /// @return the canonical name followed by its aliases
    public List<String> names() {
        return names;
    }

    public Arity arity() {
        return arity;
    }

    public ValueKind valueKind() {
        return valueKind;
    }

    public Set<String> choices() {
        return choices;
    }

    public boolean isRequired() {
        return required;
    }

    /// @return the typed default value, or null if the tag has none
    public Object defaultValue() {
        return defaultValue;
    }

    /// Validate a raw value against this trait and cast it to its typed form.
    ///
    /// @param raw header text, a scalar, a collection or a primitive array
    /// @return a {@link Long}, {@link Double}, {@link String} or {@link Boolean} for singleton tags,
    ///     otherwise an unmodifiable list of those in token order
    /// @throws InvalidArityException if the number of tokens does not match the arity
    /// @throws InvalidBooleanException if a boolean token is not {@code True} or {@code False}
    /// @throws InvalidChoiceException if a token is outside the choice set
    /// @throws InvalidTagValueException if a numeric token cannot be parsed
    public Object cast(Object raw) {
        Objects.requireNonNull(raw, "value for tag " + name() + " cannot be null");
        List<Object> tokens = tokenize(raw);
        if (!arity.accepts(tokens.size())) {
            throw new InvalidArityException(name(), raw, arity.describe(), tokens.size());
        }

        List<Object> values = new ArrayList<>(tokens.size());
        for (Object token : tokens) {
            values.add(castToken(token, raw));
        }
        if (arity.isSingleton()) {
            return values.get(0);
        }
        return Collections.unmodifiableList(values);
    }

    /// Format a typed value the way it is written in a header.
    /// @param value a value previously returned by {@link #cast(Object)}
    /// @return the value tokens separated by single spaces
    public static String format(Object value) {
        if (value instanceof List<?> list) {
            StringBuilder sb = new StringBuilder();
            for (Object element : list) {
                if (sb.length() > 0) {
                    sb.append(' ');
                }
                sb.append(formatScalar(element));
            }
            return sb.toString();
        }
        return formatScalar(value);
    }

    private static String formatScalar(Object value) {
        if (value instanceof Boolean bool) {
            return bool ? "True" : "False";
        }
        return String.valueOf(value);
    }

    private List<Object> tokenize(Object raw) {
        if (raw instanceof CharSequence text) {
            String collapsed = text.toString().trim();
            if (collapsed.isEmpty()) {
                return List.of();
            }
            if (valueKind == ValueKind.TEXT) {
                return List.of(collapsed);
            }
            return Arrays.asList((Object[]) WHITESPACE.split(collapsed));
        }
        if (raw instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        if (raw.getClass().isArray()) {
            int length = Array.getLength(raw);
            List<Object> tokens = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                tokens.add(Array.get(raw, i));
            }
            return tokens;
        }
        return List.of(raw);
    }

    private Object castToken(Object token, Object raw) {
        if (token == null) {
            throw new InvalidTagValueException(name(), raw, "Null value for tag '" + name() + "': " + raw);
        }
        return switch (valueKind) {
            case BOOLEAN -> castBoolean(token, raw);
            case INTEGER -> castInteger(token, raw);
            case FLOAT -> castFloat(token, raw);
            case STRING, TEXT -> formatScalar(token);
            case CHOICE -> {
                String choice = formatScalar(token);
                if (!choices.contains(choice)) {
                    throw new InvalidChoiceException(name(), raw, choices);
                }
                yield choice;
            }
        };
    }

    private Boolean castBoolean(Object token, Object raw) {
        if (token instanceof Boolean bool) {
            return bool;
        }
        if ("True".equals(token)) {
            return Boolean.TRUE;
        }
        if ("False".equals(token)) {
            return Boolean.FALSE;
        }
        throw new InvalidBooleanException(name(), raw);
    }

    private Long castInteger(Object token, Object raw) {
        if (token instanceof Long || token instanceof Integer || token instanceof Short || token instanceof Byte) {
            return ((Number) token).longValue();
        }
        if (token instanceof Double || token instanceof Float) {
            double value = ((Number) token).doubleValue();
            if (value == Math.rint(value) && !Double.isInfinite(value)) {
                return (long) value;
            }
        } else if (token instanceof String text) {
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException e) {
                throw new InvalidTagValueException(name(), raw,
                    "Invalid value type for tag '" + name() + "': " + raw, e);
            }
        }
        throw new InvalidTagValueException(name(), raw, "Invalid value type for tag '" + name() + "': " + raw);
    }

    private Double castFloat(Object token, Object raw) {
        if (token instanceof Number number) {
            return number.doubleValue();
        }
        if (token instanceof String text) {
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException e) {
                throw new InvalidTagValueException(name(), raw,
                    "Invalid value type for tag '" + name() + "': " + raw, e);
            }
        }
        throw new InvalidTagValueException(name(), raw, "Invalid value type for tag '" + name() + "': " + raw);
    }

    @Override
    public String toString() {
        return name() + " (default=" + (defaultValue == null ? "None" : format(defaultValue)) + ")";
    }

    /// Builder for {@link TagTrait}. Defaults to a required singleton string tag without default.
    public static final class Builder {
        private final List<String> names = new ArrayList<>();
        private Arity arity = Arity.singleton();
        private ValueKind valueKind = ValueKind.STRING;
        private final Set<String> choices = new LinkedHashSet<>();
        private boolean required = true;
        private Object defaultValue;

        private Builder(String name, String... aliases) {
            names.add(Objects.requireNonNull(name, "name cannot be null"));
            names.addAll(Arrays.asList(aliases));
        }

        public Builder type(ValueKind valueKind) {
            this.valueKind = Objects.requireNonNull(valueKind);
            return this;
        }

        /// Restrict values to a closed set of strings; implies {@link ValueKind#CHOICE}.
        public Builder choices(String... choices) {
            this.valueKind = ValueKind.CHOICE;
            this.choices.addAll(Arrays.asList(choices));
            return this;
        }

        public Builder arity(Arity arity) {
            this.arity = Objects.requireNonNull(arity);
            return this;
        }

        public Builder defaultValue(Object defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        public Builder optional() {
            this.required = false;
            return this;
        }

        public TagTrait build() {
            return new TagTrait(this);
        }
    }
}
