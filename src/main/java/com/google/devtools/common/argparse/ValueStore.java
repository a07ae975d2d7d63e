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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * The raw values claimed so far in one resolution, keyed by option key.
 *
 * <p>Single options are {@link #set}, which overwrites; array options are {@link #update}d, which
 * appends in first-seen order. Not thread-safe; owned by a single resolution.
 */
final class ValueStore {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final Map<String, OptionValueDescription> optionValues = new HashMap<>();
  private final Set<String> warnings = new LinkedHashSet<>();

  /** Records the value of a single option, replacing any earlier value. */
  void set(ParsedOptionInstance parsedOption) {
    OptionDefinition<?> definition = parsedOption.getOptionDefinition();
    Preconditions.checkArgument(
        definition.getArity() == Arity.SINGLE, "Can't set a value of array %s", definition);
    logger.atFine().log("Setting %s", parsedOption);
    entryFor(definition).addOptionInstance(parsedOption, warnings);
  }

  /** Appends a value to an array option. */
  void update(ParsedOptionInstance parsedOption) {
    OptionDefinition<?> definition = parsedOption.getOptionDefinition();
    Preconditions.checkArgument(
        definition.getArity() == Arity.ARRAY, "Can't append to single-valued %s", definition);
    logger.atFine().log("Appending %s", parsedOption);
    entryFor(definition).addOptionInstance(parsedOption, warnings);
  }

  /**
   * Records that an array option was given, without values. The option then resolves to an empty
   * list whose origin is the option's name.
   */
  void markPresent(OptionDefinition<?> definition, OptionInstanceOrigin origin) {
    Preconditions.checkArgument(
        definition.getArity() == Arity.ARRAY, "Single-valued %s needs a value", definition);
    entryFor(definition).addOrigin(origin);
  }

  boolean contains(String key) {
    return optionValues.containsKey(key);
  }

  @Nullable
  OptionValueDescription get(String key) {
    return optionValues.get(key);
  }

  ImmutableList<String> getWarnings() {
    return ImmutableList.copyOf(warnings);
  }

  private OptionValueDescription entryFor(OptionDefinition<?> definition) {
    return optionValues.computeIfAbsent(
        definition.getKey(),
        unused -> OptionValueDescription.createOptionValueDescription(definition));
  }
}
