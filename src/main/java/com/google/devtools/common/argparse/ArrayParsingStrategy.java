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

/** The strategy to use when parsing multiple values for an option into a list. */
public enum ArrayParsingStrategy {
  /**
   * Parse one value per occurrence of the option, joining multiple occurrences into a list.
   *
   * <p>The input {@code --read foo --read bar} yields {@code [foo, bar]}, and so does {@code
   * --read=foo --read=bar}. The value is the next token that is not option-like, so {@code --read
   * --name Foo Bar} puts {@code Foo} into {@code read}.
   *
   * <p>This is the default behavior.
   */
  SINGLE_VALUE(ParsingStrategy.SCANNING_FOR_VALUE),

  /**
   * Parse the token immediately after each occurrence, even if it looks like an option.
   *
   * <p>The input {@code --read --name Foo Bar --read baz} yields {@code [--name, baz]}.
   */
  UNCONDITIONAL_SINGLE_VALUE(ParsingStrategy.UNCONDITIONAL),

  /**
   * Parse all values up to the next option-like token.
   *
   * <p>{@code --files foo bar --verbose} yields {@code [foo, bar]} and leaves {@code --verbose} to
   * be parsed on its own.
   */
  UP_TO_NEXT_OPTION(ParsingStrategy.UP_TO_NEXT_OPTION),

  /**
   * Parse all remaining tokens into the list, without looking at them.
   *
   * <p>{@code --passthrough --foo 1 --bar 2 -xvf} yields {@code [--foo, 1, --bar, 2, -xvf]}. No
   * other option is matched after this one.
   */
  REMAINING(ParsingStrategy.ALL_REMAINING);

  private final ParsingStrategy parsingStrategy;

  ArrayParsingStrategy(ParsingStrategy parsingStrategy) {
    this.parsingStrategy = parsingStrategy;
  }

  ParsingStrategy toParsingStrategy() {
    return parsingStrategy;
  }
}
