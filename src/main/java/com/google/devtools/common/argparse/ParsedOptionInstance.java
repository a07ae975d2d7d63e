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

/**
 * One raw value claimed for an option, before conversion.
 *
 * <p>An option instance is distinct from the final value of an option, as multiple instances may
 * be overridden or combined.
 */
final class ParsedOptionInstance {

  private final OptionDefinition<?> optionDefinition;
  private final String commandLineForm;
  private final String unconvertedValue;
  private final Token valueToken;
  private final OptionInstanceOrigin origin;

  private ParsedOptionInstance(
      OptionDefinition<?> optionDefinition,
      String commandLineForm,
      String unconvertedValue,
      Token valueToken,
      OptionInstanceOrigin origin) {
    this.optionDefinition = Preconditions.checkNotNull(optionDefinition);
    this.commandLineForm = Preconditions.checkNotNull(commandLineForm);
    this.unconvertedValue = Preconditions.checkNotNull(unconvertedValue);
    this.valueToken = Preconditions.checkNotNull(valueToken);
    this.origin = Preconditions.checkNotNull(origin);
  }

  /** A value given inline, as in {@code --name=value}. */
  static ParsedOptionInstance inline(
      OptionDefinition<?> optionDefinition, Token nameToken, String inlineValue) {
    return new ParsedOptionInstance(
        optionDefinition,
        nameToken.getValue(),
        inlineValue,
        nameToken,
        OptionInstanceOrigin.forTokens(nameToken));
  }

  /** A value taken from its own token, as in {@code --name value}. */
  static ParsedOptionInstance separate(
      OptionDefinition<?> optionDefinition, Token nameToken, Token valueToken) {
    return new ParsedOptionInstance(
        optionDefinition,
        nameToken.getValue() + " " + valueToken.getValue(),
        valueToken.getValue(),
        valueToken,
        OptionInstanceOrigin.forTokens(nameToken, valueToken));
  }

  /** An unrecognized option-like token collected verbatim by a passthrough option. */
  static ParsedOptionInstance passthrough(OptionDefinition<?> optionDefinition, Token token) {
    return new ParsedOptionInstance(
        optionDefinition,
        token.getValue(),
        token.getValue(),
        token,
        OptionInstanceOrigin.forTokens(token));
  }

  OptionDefinition<?> getOptionDefinition() {
    return optionDefinition;
  }

  /** The way this instance was written on the command line, e.g. {@code --jobs 4}. */
  String getCommandLineForm() {
    return commandLineForm;
  }

  String getUnconvertedValue() {
    return unconvertedValue;
  }

  /** The token the raw value was read from; the name token itself for inline values. */
  Token getValueToken() {
    return valueToken;
  }

  OptionInstanceOrigin getOrigin() {
    return origin;
  }

  /**
   * Converts the raw value with the option's converter.
   *
   * @throws OptionsParsingException naming the option, if the converter rejects the value
   */
  Object getConvertedValue() throws OptionsParsingException {
    Converter<?> converter = optionDefinition.getConverter();
    Object converted;
    try {
      converted = converter.convert(unconvertedValue);
    } catch (OptionsParsingException | RuntimeException e) {
      // The converter doesn't know the option name, so we supply it here by re-throwing:
      throw new OptionsParsingException(
          String.format("While parsing option %s: %s", commandLineForm, e.getMessage()),
          unconvertedValue,
          e);
    }
    if (converted == null) {
      throw new OptionsParsingException(
          String.format("While parsing option %s: no value produced", commandLineForm),
          unconvertedValue);
    }
    return converted;
  }

  @Override
  public String toString() {
    return String.format("option '%s' (%s)", commandLineForm, origin);
  }
}
