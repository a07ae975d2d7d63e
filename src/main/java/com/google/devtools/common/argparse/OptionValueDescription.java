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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * The raw value(s) of one option during a resolution.
 *
 * <p>This takes care of tracking the effective instances as multiple occurrences of an option are
 * parsed. Values stay unconverted until all tokens have been handled.
 */
abstract class OptionValueDescription {

  protected final OptionDefinition<?> optionDefinition;
  private OptionInstanceOrigin origin = OptionInstanceOrigin.DEFAULT;

  OptionValueDescription(OptionDefinition<?> optionDefinition) {
    this.optionDefinition = optionDefinition;
  }

  OptionDefinition<?> getOptionDefinition() {
    return optionDefinition;
  }

  /** Returns the tokens that produced the current value. */
  OptionInstanceOrigin getOrigin() {
    return origin;
  }

  /** Extends the origin without adding a value, e.g. for an option given with no values. */
  final void addOrigin(OptionInstanceOrigin additional) {
    origin = origin.union(additional);
  }

  final void replaceOrigin(OptionInstanceOrigin replacement) {
    origin = replacement;
  }

  /** Returns the instances that make up the current value, in command-line order. */
  abstract ImmutableList<ParsedOptionInstance> getEffectiveInstances();

  /**
   * Add an instance of the option to this value. Each kind of value is in charge of deciding how
   * the new instance combines with earlier ones.
   */
  abstract void addOptionInstance(ParsedOptionInstance parsedOption, Set<String> warnings);

  /** For the given option, returns the correct type of OptionValueDescription. */
  static OptionValueDescription createOptionValueDescription(OptionDefinition<?> option) {
    switch (option.getArity()) {
      case SINGLE:
        return new SingleOptionValueDescription(option);
      case ARRAY:
        return new RepeatableOptionValueDescription(option);
    }
    throw new AssertionError(option.getArity());
  }

  /** A value that a later instance overwrites. */
  private static final class SingleOptionValueDescription extends OptionValueDescription {
    @Nullable private ParsedOptionInstance effectiveOptionInstance;

    private SingleOptionValueDescription(OptionDefinition<?> optionDefinition) {
      super(optionDefinition);
    }

    @Override
    ImmutableList<ParsedOptionInstance> getEffectiveInstances() {
      return effectiveOptionInstance == null
          ? ImmutableList.of()
          : ImmutableList.of(effectiveOptionInstance);
    }

    @Override
    void addOptionInstance(ParsedOptionInstance parsedOption, Set<String> warnings) {
      if (effectiveOptionInstance != null
          && !effectiveOptionInstance
              .getUnconvertedValue()
              .equals(parsedOption.getUnconvertedValue())) {
        warnings.add(
            String.format(
                "%s was given more than once; '%s' overrides '%s'",
                optionDefinition,
                parsedOption.getCommandLineForm(),
                effectiveOptionInstance.getCommandLineForm()));
      }
      effectiveOptionInstance = parsedOption;
      // The value now comes from this instance alone.
      replaceOrigin(parsedOption.getOrigin());
    }
  }

  /** A value that accumulates every instance, in the order they were parsed. */
  private static final class RepeatableOptionValueDescription extends OptionValueDescription {
    private final List<ParsedOptionInstance> parsedOptions = new ArrayList<>();

    private RepeatableOptionValueDescription(OptionDefinition<?> optionDefinition) {
      super(optionDefinition);
    }

    @Override
    ImmutableList<ParsedOptionInstance> getEffectiveInstances() {
      return ImmutableList.copyOf(parsedOptions);
    }

    @Override
    void addOptionInstance(ParsedOptionInstance parsedOption, Set<String> warnings) {
      parsedOptions.add(parsedOption);
      addOrigin(parsedOption.getOrigin());
    }
  }
}
