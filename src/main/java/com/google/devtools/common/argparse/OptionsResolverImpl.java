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
import com.google.common.flogger.GoogleLogger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * The state of one {@link OptionsResolver#resolve} call. Instances are used once and thrown away.
 */
final class OptionsResolverImpl {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final ImmutableList<OptionDefinition<?>> optionDefinitions;
  private final NameMatcher nameMatcher;
  @Nullable private final OptionDefinition<?> passthroughOption;
  private final boolean allowResidue;

  private final ArgumentList arguments;
  private final ValueStore values = new ValueStore();
  private final List<ResolutionError> errors = new ArrayList<>();
  // Options that already have an error; they are not also reported as missing.
  private final Set<String> keysWithErrors = new HashSet<>();
  private final List<String> residue = new ArrayList<>();

  OptionsResolverImpl(
      ImmutableList<OptionDefinition<?>> optionDefinitions,
      NameMatcher nameMatcher,
      @Nullable OptionDefinition<?> passthroughOption,
      boolean allowResidue,
      List<String> args) {
    this.optionDefinitions = optionDefinitions;
    this.nameMatcher = nameMatcher;
    this.passthroughOption = passthroughOption;
    this.allowResidue = allowResidue;
    this.arguments = new ArgumentList(args);
  }

  ResolutionOutcome resolve() {
    StrategyResolver strategyResolver =
        new StrategyResolver(nameMatcher, arguments, values, errors, keysWithErrors);
    while (arguments.hasMore()) {
      Token token = arguments.consume();
      NameMatcher.Match match = nameMatcher.classify(token);
      switch (match.getKind()) {
        case TERMINATOR:
          for (Token afterTerminator : arguments.consumeAll()) {
            addResidue(afterTerminator);
          }
          break;
        case VALUE:
          addResidue(token);
          break;
        case UNRECOGNIZED_OPTION:
          if (passthroughOption != null) {
            values.update(ParsedOptionInstance.passthrough(passthroughOption, token));
          } else {
            errors.add(ResolutionError.unrecognizedOption(token));
          }
          break;
        case OPTION:
          strategyResolver.resolve(match, token);
          break;
      }
    }

    DefaultsApplier defaultsApplier = new DefaultsApplier(values, errors, keysWithErrors);
    defaultsApplier.applyAll(optionDefinitions);

    if (!errors.isEmpty()) {
      logger.atFine().log("Resolution failed with %d error(s)", errors.size());
      return ResolutionOutcome.failure(ImmutableList.copyOf(errors), values.getWarnings());
    }
    return ResolutionOutcome.success(
        ResolvedOptions.create(
            defaultsApplier.getValues(),
            defaultsApplier.getOrigins(),
            ImmutableList.copyOf(residue)),
        values.getWarnings());
  }

  private void addResidue(Token token) {
    if (allowResidue) {
      residue.add(token.getValue());
    } else {
      errors.add(ResolutionError.unexpectedArgument(token));
    }
  }
}
