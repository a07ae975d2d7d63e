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
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.GoogleLogger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns the raw values of a {@link ValueStore} into final values once all tokens are handled:
 * converts what was given, and fills in defaults for what was not.
 *
 * <p>Options are visited in declaration order, so conversion and missing-option errors are
 * reported in that order. Conversion failures do not stop the pass; every failing value is
 * reported.
 */
final class DefaultsApplier {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final ValueStore store;
  private final List<ResolutionError> errors;
  private final Set<String> keysWithErrors;

  private final Map<String, Object> values = new LinkedHashMap<>();
  private final Map<String, OptionInstanceOrigin> origins = new LinkedHashMap<>();

  DefaultsApplier(ValueStore store, List<ResolutionError> errors, Set<String> keysWithErrors) {
    this.store = store;
    this.errors = errors;
    this.keysWithErrors = keysWithErrors;
  }

  void applyAll(Iterable<OptionDefinition<?>> definitions) {
    for (OptionDefinition<?> definition : definitions) {
      apply(definition);
    }
  }

  private void apply(OptionDefinition<?> definition) {
    OptionValueDescription entry = store.get(definition.getKey());
    if (entry == null) {
      applyDefault(definition);
      return;
    }
    ImmutableList.Builder<Object> converted = ImmutableList.builder();
    boolean failed = false;
    for (ParsedOptionInstance parsedOption : entry.getEffectiveInstances()) {
      try {
        converted.add(parsedOption.getConvertedValue());
      } catch (OptionsParsingException e) {
        logger.atFine().withCause(e).log("Conversion failed for %s", parsedOption);
        errors.add(ResolutionError.invalidValue(parsedOption, e));
        failed = true;
      }
    }
    if (failed) {
      keysWithErrors.add(definition.getKey());
      return;
    }
    ImmutableList<Object> convertedValues = converted.build();
    if (definition.getArity() == Arity.ARRAY) {
      bind(definition, convertedValues, entry.getOrigin());
    } else if (!convertedValues.isEmpty()) {
      bind(definition, convertedValues.get(0), entry.getOrigin());
    }
  }

  private void applyDefault(OptionDefinition<?> definition) {
    if (definition.getArity() == Arity.ARRAY) {
      bind(definition, ImmutableList.of(), OptionInstanceOrigin.DEFAULT);
      return;
    }
    Object defaultValue = definition.getDefaultValue();
    if (defaultValue != null) {
      logger.atFine().log("Using default value of %s", definition);
      bind(definition, defaultValue, OptionInstanceOrigin.DEFAULT);
    } else if (definition.isRequired() && !keysWithErrors.contains(definition.getKey())) {
      errors.add(ResolutionError.missingOption(definition));
      keysWithErrors.add(definition.getKey());
    }
  }

  private void bind(OptionDefinition<?> definition, Object value, OptionInstanceOrigin origin) {
    values.put(definition.getKey(), value);
    origins.put(definition.getKey(), origin);
  }

  ImmutableMap<String, Object> getValues() {
    return ImmutableMap.copyOf(values);
  }

  ImmutableMap<String, OptionInstanceOrigin> getOrigins() {
    return ImmutableMap.copyOf(origins);
  }
}
