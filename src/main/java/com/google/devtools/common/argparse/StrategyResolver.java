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
import com.google.common.flogger.GoogleLogger;
import java.util.List;
import java.util.Set;

/**
 * Claims the value tokens of one option occurrence, according to the option's {@link
 * ParsingStrategy}, and records them in the {@link ValueStore}.
 *
 * <p>An inline value ({@code --name=value}) is used as is and never triggers a look-ahead; for
 * {@link ParsingStrategy#UP_TO_NEXT_OPTION} and {@link ParsingStrategy#ALL_REMAINING} it is
 * recorded first, and the following tokens are claimed after it.
 */
final class StrategyResolver {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final NameMatcher nameMatcher;
  private final ArgumentList arguments;
  private final ValueStore values;
  private final List<ResolutionError> errors;
  private final Set<String> keysWithErrors;

  StrategyResolver(
      NameMatcher nameMatcher,
      ArgumentList arguments,
      ValueStore values,
      List<ResolutionError> errors,
      Set<String> keysWithErrors) {
    this.nameMatcher = nameMatcher;
    this.arguments = arguments;
    this.values = values;
    this.errors = errors;
    this.keysWithErrors = keysWithErrors;
  }

  /**
   * Resolves the occurrence of an option whose name token has already been consumed. The tokens
   * after it are still in the argument list.
   */
  void resolve(NameMatcher.Match match, Token nameToken) {
    Preconditions.checkArgument(match.getKind() == NameMatcher.Kind.OPTION, match);
    OptionDefinition<?> definition = match.getDefinition();
    logger.atFine().log("Matched %s at argument %d", definition, nameToken.getIndex());
    switch (definition.getParsingStrategy()) {
      case NEXT:
      case UNCONDITIONAL:
        resolveNext(definition, match, nameToken);
        return;
      case SCANNING_FOR_VALUE:
        resolveScanningForValue(definition, match, nameToken);
        return;
      case UP_TO_NEXT_OPTION:
        resolveUpToNextOption(definition, match, nameToken);
        return;
      case ALL_REMAINING:
        resolveAllRemaining(definition, match, nameToken);
        return;
    }
    throw new AssertionError(definition.getParsingStrategy());
  }

  /** Takes the token right after the name, whatever it looks like. */
  private void resolveNext(
      OptionDefinition<?> definition, NameMatcher.Match match, Token nameToken) {
    if (match.hasInlineValue()) {
      record(ParsedOptionInstance.inline(definition, nameToken, match.getInlineValue()));
      return;
    }
    if (!arguments.hasMore()) {
      reportMissingValue(definition, nameToken);
      return;
    }
    record(ParsedOptionInstance.separate(definition, nameToken, arguments.consume()));
  }

  /**
   * Takes the first plain value after the name. Option-like tokens in between are skipped and
   * stay where they are. The scan does not cross the {@code --} terminator.
   */
  private void resolveScanningForValue(
      OptionDefinition<?> definition, NameMatcher.Match match, Token nameToken) {
    if (match.hasInlineValue()) {
      record(ParsedOptionInstance.inline(definition, nameToken, match.getInlineValue()));
      return;
    }
    for (int offset = 0; offset < arguments.size(); offset++) {
      Token candidate = arguments.peek(offset);
      if (candidate.getValue().equals(NameMatcher.TERMINATOR)) {
        break;
      }
      if (nameMatcher.isPlainValue(candidate)) {
        arguments.remove(offset);
        if (offset > 0) {
          logger.atFine().log(
              "%s skipped %d option-like argument(s) to claim %s", definition, offset, candidate);
        }
        record(ParsedOptionInstance.separate(definition, nameToken, candidate));
        return;
      }
    }
    reportMissingValue(definition, nameToken);
  }

  /** Takes every plain value after the name, up to the next option-like token. */
  private void resolveUpToNextOption(
      OptionDefinition<?> definition, NameMatcher.Match match, Token nameToken) {
    values.markPresent(definition, OptionInstanceOrigin.forTokens(nameToken));
    if (match.hasInlineValue()) {
      record(ParsedOptionInstance.inline(definition, nameToken, match.getInlineValue()));
    }
    Token value;
    while ((value = arguments.consumeIf(nameMatcher::isPlainValue)) != null) {
      record(ParsedOptionInstance.separate(definition, nameToken, value));
    }
  }

  /** Takes every remaining token verbatim. Nothing is left to match afterwards. */
  private void resolveAllRemaining(
      OptionDefinition<?> definition, NameMatcher.Match match, Token nameToken) {
    values.markPresent(definition, OptionInstanceOrigin.forTokens(nameToken));
    if (match.hasInlineValue()) {
      record(ParsedOptionInstance.inline(definition, nameToken, match.getInlineValue()));
    }
    for (Token value : arguments.consumeAll()) {
      record(ParsedOptionInstance.separate(definition, nameToken, value));
    }
  }

  private void record(ParsedOptionInstance parsedOption) {
    if (parsedOption.getOptionDefinition().getArity() == Arity.SINGLE) {
      values.set(parsedOption);
    } else {
      values.update(parsedOption);
    }
  }

  private void reportMissingValue(OptionDefinition<?> definition, Token nameToken) {
    logger.atFine().log("No value for %s at argument %d", definition, nameToken.getIndex());
    errors.add(ResolutionError.missingValue(definition, nameToken));
    keysWithErrors.add(definition.getKey());
  }
}
