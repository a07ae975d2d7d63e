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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;

/**
 * A problem found while resolving a command line. Errors are values: a resolution collects all the
 * errors it can find and reports them together in its {@link ResolutionOutcome}.
 */
@AutoValue
public abstract class ResolutionError {

  /** The kinds of errors. */
  public enum Kind {
    /** An option's name was found, but no token could be claimed as its value. */
    MISSING_VALUE,
    /** A token looks like an option, but no declared option has that name. */
    UNRECOGNIZED_OPTION,
    /** A value was found, but the option's converter rejected it. */
    INVALID_VALUE,
    /**
     * Two options could claim the same token. Reserved: the current strategies resolve such
     * conflicts by occurrence order, and the option that loses reports {@link #MISSING_VALUE}.
     */
    AMBIGUOUS_CONSUMPTION,
    /** A required option without a default did not appear. */
    MISSING_OPTION,
    /** A plain value was found where no residue is allowed. */
    UNEXPECTED_ARGUMENT
  }

  public abstract Kind getKind();

  /** The key of the option concerned, or {@code null} if the token matched no option. */
  @Nullable
  public abstract String getKey();

  /** The spellings of the option concerned; empty if the token matched no option. */
  public abstract ImmutableList<String> getOptionNames();

  /** The offending raw token or value, if there is one. */
  @Nullable
  public abstract String getToken();

  /**
   * The 0-based position of the offending token in the argument list. For {@link
   * Kind#MISSING_VALUE} this is the position where the value was expected.
   */
  @Nullable
  public abstract Integer getPosition();

  /** A human-readable description of the error. */
  public abstract String getMessage();

  /** The converter's own explanation, for {@link Kind#INVALID_VALUE}. */
  @Nullable
  public abstract String getReason();

  @Override
  public final String toString() {
    return getMessage();
  }

  static ResolutionError missingValue(OptionDefinition<?> definition, Token nameToken) {
    return create(
        Kind.MISSING_VALUE,
        definition,
        nameToken.getValue(),
        nameToken.getIndex() + 1,
        String.format("Expected value after %s", nameToken.getValue()),
        null);
  }

  static ResolutionError unrecognizedOption(Token token) {
    return new AutoValue_ResolutionError(
        Kind.UNRECOGNIZED_OPTION,
        null,
        ImmutableList.of(),
        token.getValue(),
        token.getIndex(),
        "Unrecognized option: " + token.getValue(),
        null);
  }

  static ResolutionError invalidValue(
      ParsedOptionInstance parsedOption, OptionsParsingException e) {
    Throwable cause = e.getCause();
    return create(
        Kind.INVALID_VALUE,
        parsedOption.getOptionDefinition(),
        parsedOption.getUnconvertedValue(),
        parsedOption.getValueToken().getIndex(),
        e.getMessage(),
        cause != null && cause.getMessage() != null ? cause.getMessage() : e.getMessage());
  }

  static ResolutionError missingOption(OptionDefinition<?> definition) {
    return create(
        Kind.MISSING_OPTION,
        definition,
        null,
        null,
        String.format("Missing expected %s %s", definition, definition.getValueName()),
        null);
  }

  static ResolutionError unexpectedArgument(Token token) {
    return new AutoValue_ResolutionError(
        Kind.UNEXPECTED_ARGUMENT,
        null,
        ImmutableList.of(),
        token.getValue(),
        token.getIndex(),
        "Unexpected argument: " + token.getValue(),
        null);
  }

  private static ResolutionError create(
      Kind kind,
      OptionDefinition<?> definition,
      @Nullable String token,
      @Nullable Integer position,
      String message,
      @Nullable String reason) {
    return new AutoValue_ResolutionError(
        kind,
        definition.getKey(),
        definition.getSynopsisNames(),
        token,
        position,
        message,
        reason);
  }
}
