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

import com.google.common.base.Ascii;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.time.Duration;
import java.util.Iterator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Some convenient converters for common option value types. */
public final class Converters {

  private static final ImmutableList<String> ENABLED_REPS =
      ImmutableList.of("true", "1", "yes", "t", "y");

  private static final ImmutableList<String> DISABLED_REPS =
      ImmutableList.of("false", "0", "no", "f", "n");

  private Converters() {}

  /** Standard converter for booleans. Accepts common shorthands/synonyms. */
  public static class BooleanConverter implements Converter<Boolean> {
    @Override
    public Boolean convert(String input) throws OptionsParsingException {
      String lowered = Ascii.toLowerCase(input);
      if (ENABLED_REPS.contains(lowered)) {
        return true;
      }
      if (DISABLED_REPS.contains(lowered)) {
        return false;
      }
      throw new OptionsParsingException("'" + input + "' is not a boolean", input);
    }

    @Override
    public String getTypeDescription() {
      return "a boolean";
    }
  }

  /** Standard converter for Strings. */
  public static class StringConverter implements Converter<String> {
    @Override
    public String convert(String input) {
      return input;
    }

    @Override
    public String getTypeDescription() {
      return "a string";
    }
  }

  /** Standard converter for integers. */
  public static class IntegerConverter implements Converter<Integer> {
    @Override
    public Integer convert(String input) throws OptionsParsingException {
      try {
        return Integer.decode(input);
      } catch (NumberFormatException e) {
        throw new OptionsParsingException("'" + input + "' is not an int", input, e);
      }
    }

    @Override
    public String getTypeDescription() {
      return "an integer";
    }
  }

  /** Standard converter for longs. */
  public static class LongConverter implements Converter<Long> {
    @Override
    public Long convert(String input) throws OptionsParsingException {
      try {
        return Long.decode(input);
      } catch (NumberFormatException e) {
        throw new OptionsParsingException("'" + input + "' is not a long", input, e);
      }
    }

    @Override
    public String getTypeDescription() {
      return "a long integer";
    }
  }

  /** Standard converter for doubles. */
  public static class DoubleConverter implements Converter<Double> {
    @Override
    public Double convert(String input) throws OptionsParsingException {
      try {
        return Double.parseDouble(input);
      } catch (NumberFormatException e) {
        throw new OptionsParsingException("'" + input + "' is not a double", input, e);
      }
    }

    @Override
    public String getTypeDescription() {
      return "a double";
    }
  }

  /** Standard converter for the {@link java.time.Duration} type. */
  public static class DurationConverter implements Converter<Duration> {
    private static final Pattern DURATION_REGEX = Pattern.compile("^([0-9]+)(d|h|m|s|ms)$");

    @Override
    public Duration convert(String input) throws OptionsParsingException {
      // '0' doesn't need a unit.
      if ("0".equals(input)) {
        return Duration.ZERO;
      }
      Matcher m = DURATION_REGEX.matcher(input);
      if (!m.matches()) {
        throw new OptionsParsingException("Illegal duration '" + input + "'.", input);
      }
      long duration;
      try {
        duration = Long.parseLong(m.group(1));
      } catch (NumberFormatException e) {
        throw new OptionsParsingException("Illegal duration '" + input + "'.", input, e);
      }
      String unit = m.group(2);
      try {
        switch (unit) {
          case "d":
            return Duration.ofDays(duration);
          case "h":
            return Duration.ofHours(duration);
          case "m":
            return Duration.ofMinutes(duration);
          case "s":
            return Duration.ofSeconds(duration);
          case "ms":
            return Duration.ofMillis(duration);
          default:
            throw new IllegalStateException(
                "This must not happen. Did you update the regex without the switch case?");
        }
      } catch (ArithmeticException e) {
        throw new OptionsParsingException("Illegal duration '" + input + "'.", input, e);
      }
    }

    @Override
    public String getTypeDescription() {
      return "An immutable length of time.";
    }
  }

  /**
   * A transform from a raw string to a typed value. May throw {@link OptionsParsingException}, or
   * any {@link RuntimeException} such as {@link NumberFormatException} or {@link
   * java.time.format.DateTimeParseException}; all of them are reported as invalid values.
   */
  @FunctionalInterface
  public interface ConversionFunction<T> {
    T apply(String input) throws OptionsParsingException;
  }

  /** Wraps a transform closure into a {@link Converter} with the given type description. */
  public static <T> Converter<T> fromFunction(
      String typeDescription, ConversionFunction<? extends T> function) {
    Preconditions.checkNotNull(typeDescription);
    Preconditions.checkNotNull(function);
    return new Converter<T>() {
      @Override
      public T convert(String input) throws OptionsParsingException {
        return function.apply(input);
      }

      @Override
      public String getTypeDescription() {
        return typeDescription;
      }
    };
  }

  /**
   * Join a list of words as in English. Examples: "nothing" "one" "one or two" "one, two or
   * three". The toString method of each element is used.
   */
  static String joinEnglishList(Iterable<?> choices) {
    StringBuilder buf = new StringBuilder();
    for (Iterator<?> ii = choices.iterator(); ii.hasNext(); ) {
      Object choice = ii.next();
      if (buf.length() > 0) {
        buf.append(ii.hasNext() ? ", " : " or ");
      }
      buf.append(choice);
    }
    return buf.length() == 0 ? "nothing" : buf.toString();
  }
}
