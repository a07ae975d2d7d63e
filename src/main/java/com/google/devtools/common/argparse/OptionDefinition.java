// Copyright 2026 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package com.google.devtools.common.argparse;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.devtools.common.argparse.OptionsResolver.ConstructionException;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.function.Supplier;
import javax.annotation.Nullable;

/**
 * Everything the {@link OptionsResolver} needs to know about how an option is defined.
 *
 * <p>Definitions are immutable and may be shared between resolutions, including concurrent ones.
 * They are created with {@link #single} or {@link #array}:
 *
 * <pre>
 * OptionDefinition&lt;Integer&gt; jobs =
 *     OptionDefinition.single("jobs", new Converters.IntegerConverter())
 *         .name(NameSpecification.shortAndLong())
 *         .defaultValue(4)
 *         .build();
 * OptionDefinition&lt;String&gt; files =
 *     OptionDefinition.array("files", new Converters.StringConverter())
 *         .parsing(ArrayParsingStrategy.UP_TO_NEXT_OPTION)
 *         .build();
 * </pre>
 *
 * @param <T> the type of a single converted value. Array options bind a list of {@code T}.
 */
public final class OptionDefinition<T> {

  private final String key;
  private final ImmutableList<OptionName> names;
  private final Arity arity;
  @Nullable private final SingleValueParsingStrategy singleValueParsingStrategy;
  @Nullable private final ArrayParsingStrategy arrayParsingStrategy;
  private final Converter<T> converter;
  @Nullable private final Supplier<? extends T> defaultProvider;
  private final boolean required;
  private final boolean absorbsUnrecognizedOptions;
  private final String helpText;
  @Nullable private final String valueName;

  private OptionDefinition(Builder<T> builder, ImmutableList<OptionName> names) {
    this.key = builder.key;
    this.names = names;
    this.arity = builder.arity;
    this.singleValueParsingStrategy = builder.singleValueParsingStrategy;
    this.arrayParsingStrategy = builder.arrayParsingStrategy;
    this.converter = builder.converter;
    this.defaultProvider = builder.defaultProvider;
    this.required = builder.required;
    this.absorbsUnrecognizedOptions = builder.absorbsUnrecognizedOptions;
    this.helpText = builder.helpText;
    this.valueName = builder.valueName;
  }

  /** Starts the definition of an option that binds one value. */
  public static <T> Builder<T> single(String key, Converter<T> converter) {
    return new Builder<>(key, Arity.SINGLE, converter);
  }

  /** Starts the definition of an option that binds a list of values; it defaults to empty. */
  public static <T> Builder<T> array(String key, Converter<T> converter) {
    return new Builder<>(key, Arity.ARRAY, converter);
  }

  /** Returns the identifier under which the resolved value is stored. */
  public String getKey() {
    return key;
  }

  /** Returns the accepted spellings, in declaration order. Never empty. */
  public ImmutableList<OptionName> getNames() {
    return names;
  }

  /** Returns the spellings as they appear on the command line, e.g. {@code [-v, --verbose]}. */
  public ImmutableList<String> getSynopsisNames() {
    return names.stream().map(OptionName::getSynopsisString).collect(toImmutableList());
  }

  /** The name used when referring to the option in messages: its first long name, if any. */
  public String getPreferredName() {
    for (OptionName name : names) {
      if (name.getKind() == OptionName.Kind.LONG) {
        return name.getSynopsisString();
      }
    }
    return names.get(0).getSynopsisString();
  }

  public Arity getArity() {
    return arity;
  }

  /** Returns the strategy of a {@link Arity#SINGLE} option, or {@code null} for arrays. */
  @Nullable
  public SingleValueParsingStrategy getSingleValueParsingStrategy() {
    return singleValueParsingStrategy;
  }

  /** Returns the strategy of an {@link Arity#ARRAY} option, or {@code null} for single options. */
  @Nullable
  public ArrayParsingStrategy getArrayParsingStrategy() {
    return arrayParsingStrategy;
  }

  ParsingStrategy getParsingStrategy() {
    return arity == Arity.SINGLE
        ? singleValueParsingStrategy.toParsingStrategy()
        : arrayParsingStrategy.toParsingStrategy();
  }

  public Converter<T> getConverter() {
    return converter;
  }

  /** Returns a short description of the expected type of this option. */
  public String getValueTypeHelpText() {
    return converter.getTypeDescription();
  }

  /**
   * Whether an absent option still gets a value: single options with a default provider, and all
   * array options (which default to the empty list).
   */
  public boolean hasDefaultValue() {
    return arity == Arity.ARRAY || defaultProvider != null;
  }

  /**
   * Returns the evaluated default value for this option, or {@code null} if there is none. Array
   * options default to an empty list and have no default element.
   */
  @Nullable
  public T getDefaultValue() {
    return defaultProvider == null ? null : defaultProvider.get();
  }

  /** Whether the option has to be present when it has no default. */
  public boolean isRequired() {
    return required;
  }

  /** Whether unrecognized option-like tokens are collected into this (array) option. */
  public boolean absorbsUnrecognizedOptions() {
    return absorbsUnrecognizedOptions;
  }

  public String getHelpText() {
    return helpText;
  }

  /** The placeholder for the value in usage text, e.g. {@code <jobs>}. */
  public String getValueName() {
    return valueName != null ? valueName : "<" + key + ">";
  }

  @Override
  public String toString() {
    return String.format("option '%s'", getPreferredName());
  }

  /** Builder for {@link OptionDefinition}. */
  public static final class Builder<T> {
    private final String key;
    private final Arity arity;
    private final Converter<T> converter;
    private NameSpecification nameSpecification = NameSpecification.longName();
    @Nullable private SingleValueParsingStrategy singleValueParsingStrategy;
    @Nullable private ArrayParsingStrategy arrayParsingStrategy;
    @Nullable private Supplier<? extends T> defaultProvider;
    private boolean required = false;
    private boolean absorbsUnrecognizedOptions = false;
    private String helpText = "";
    @Nullable private String valueName;

    private Builder(String key, Arity arity, Converter<T> converter) {
      this.key = Preconditions.checkNotNull(key);
      this.arity = arity;
      this.converter = Preconditions.checkNotNull(converter);
      if (arity == Arity.SINGLE) {
        singleValueParsingStrategy = SingleValueParsingStrategy.NEXT;
      } else {
        arrayParsingStrategy = ArrayParsingStrategy.SINGLE_VALUE;
      }
    }

    @CanIgnoreReturnValue
    public Builder<T> name(NameSpecification nameSpecification) {
      this.nameSpecification = Preconditions.checkNotNull(nameSpecification);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder<T> parsing(SingleValueParsingStrategy strategy) {
      this.singleValueParsingStrategy = Preconditions.checkNotNull(strategy);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder<T> parsing(ArrayParsingStrategy strategy) {
      this.arrayParsingStrategy = Preconditions.checkNotNull(strategy);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder<T> defaultValue(T value) {
      Preconditions.checkNotNull(value, "Use no default instead of a null default");
      return defaultProvider(() -> value);
    }

    /** The provider is invoked once per resolution in which the option is absent. */
    @CanIgnoreReturnValue
    public Builder<T> defaultProvider(Supplier<? extends T> defaultProvider) {
      this.defaultProvider = Preconditions.checkNotNull(defaultProvider);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder<T> required() {
      this.required = true;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder<T> absorbsUnrecognizedOptions() {
      this.absorbsUnrecognizedOptions = true;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder<T> help(String helpText) {
      this.helpText = Preconditions.checkNotNull(helpText);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder<T> valueName(String valueName) {
      this.valueName = Preconditions.checkNotNull(valueName);
      return this;
    }

    /**
     * Creates the definition.
     *
     * @throws ConstructionException if the settings contradict each other
     */
    public OptionDefinition<T> build() {
      if (key.isEmpty()) {
        throw new ConstructionException("Option keys must not be empty");
      }
      if (arity == Arity.SINGLE) {
        if (arrayParsingStrategy != null) {
          throw new ConstructionException(
              "Option '" + key + "' binds a single value and can't use " + arrayParsingStrategy);
        }
        if (absorbsUnrecognizedOptions) {
          throw new ConstructionException(
              "Option '" + key + "' binds a single value and can't collect unrecognized options");
        }
      } else {
        if (singleValueParsingStrategy != null) {
          throw new ConstructionException(
              "Option '" + key + "' binds a list and can't use " + singleValueParsingStrategy);
        }
        if (defaultProvider != null) {
          throw new ConstructionException(
              "Option '" + key + "' binds a list; its default is always the empty list");
        }
        if (required) {
          throw new ConstructionException(
              "Option '" + key + "' binds a list and always has a value");
        }
      }
      ImmutableList<OptionName> names;
      try {
        names = nameSpecification.makeNames(key);
      } catch (IllegalArgumentException e) {
        throw new ConstructionException("Invalid name for option '" + key + "'", e);
      }
      if (names.isEmpty()) {
        throw new ConstructionException("Option '" + key + "' has no names");
      }
      return new OptionDefinition<>(this, names);
    }
  }
}
