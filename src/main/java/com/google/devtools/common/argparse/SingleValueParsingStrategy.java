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

/**
 * The strategy to use when parsing a single value for an option.
 *
 * @see ArrayParsingStrategy
 */
public enum SingleValueParsingStrategy {
  /**
   * Parse the input after the option as its value.
   *
   * <p>For input such as {@code --foo foo} this would parse {@code foo} as the value. The
   * following token is taken as it is; if there is none, the option is missing its value.
   *
   * <p>This is the default behavior.
   */
  NEXT(ParsingStrategy.NEXT),

  /**
   * Parse the next input, even if it could be interpreted as an option or flag.
   *
   * <p>For input such as {@code --foo --bar baz}, this reads {@code --bar} as the value for {@code
   * foo}. Options declared this way advertise that they accept values with a leading dash, such as
   * negative numbers.
   */
  UNCONDITIONAL(ParsingStrategy.UNCONDITIONAL),

  /**
   * Parse the next input that can't be interpreted as an option or flag.
   *
   * <p>This skips other options and reads ahead to find the next available value: if {@code --foo}
   * takes a value, the input {@code --foo --bar bar} gives {@code foo} the value {@code bar}, and
   * {@code --bar} is left in place.
   */
  SCANNING_FOR_VALUE(ParsingStrategy.SCANNING_FOR_VALUE);

  private final ParsingStrategy parsingStrategy;

  SingleValueParsingStrategy(ParsingStrategy parsingStrategy) {
    this.parsingStrategy = parsingStrategy;
  }

  ParsingStrategy toParsingStrategy() {
    return parsingStrategy;
  }
}
