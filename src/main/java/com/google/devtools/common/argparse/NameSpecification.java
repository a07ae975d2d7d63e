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
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Function;

/**
 * Describes which spellings an option accepts. Spellings may be derived from the option's key
 * ({@link #longName()}, {@link #shortName()}) or given explicitly.
 *
 * <p>Specifications are combined with {@link #and}; the resulting names keep the order in which
 * they were specified, with duplicates removed.
 */
public final class NameSpecification {

  private final ImmutableList<Function<String, OptionName>> elements;

  private NameSpecification(ImmutableList<Function<String, OptionName>> elements) {
    this.elements = elements;
  }

  /** {@code --key}, with a camelCase key converted to kebab-case: {@code maxCount -> max-count}. */
  public static NameSpecification longName() {
    return new NameSpecification(
        ImmutableList.of(key -> OptionName.longName(convertCamelCaseToKebabCase(key))));
  }

  /** {@code -k}, using the first character of the key. */
  public static NameSpecification shortName() {
    return new NameSpecification(ImmutableList.of(key -> OptionName.shortName(key.charAt(0))));
  }

  /** Both {@link #shortName()} and {@link #longName()}. */
  public static NameSpecification shortAndLong() {
    return shortName().and(longName());
  }

  public static NameSpecification customLong(String name) {
    OptionName optionName = OptionName.longName(name);
    return new NameSpecification(ImmutableList.of(key -> optionName));
  }

  public static NameSpecification customLongWithSingleDash(String name) {
    OptionName optionName = OptionName.longNameWithSingleDash(name);
    return new NameSpecification(ImmutableList.of(key -> optionName));
  }

  public static NameSpecification customShort(char name) {
    OptionName optionName = OptionName.shortName(name);
    return new NameSpecification(ImmutableList.of(key -> optionName));
  }

  /** Returns a specification accepting the names of this one followed by those of {@code other}. */
  public NameSpecification and(NameSpecification other) {
    return new NameSpecification(
        ImmutableList.<Function<String, OptionName>>builder()
            .addAll(elements)
            .addAll(other.elements)
            .build());
  }

  /** Creates the names for an option with the given key. */
  ImmutableList<OptionName> makeNames(String key) {
    Preconditions.checkArgument(!key.isEmpty(), "Option keys must not be empty");
    Set<OptionName> names = new LinkedHashSet<>();
    for (Function<String, OptionName> element : elements) {
      names.add(element.apply(key));
    }
    return ImmutableList.copyOf(names);
  }

  static String convertCamelCaseToKebabCase(String key) {
    StringBuilder result = new StringBuilder(key.length() + 4);
    for (int i = 0; i < key.length(); i++) {
      char c = key.charAt(i);
      if (Ascii.isUpperCase(c)) {
        // Runs of capitals stay together: "maxURLCount" -> "max-url-count".
        boolean previousIsLower = i > 0 && !Ascii.isUpperCase(key.charAt(i - 1));
        boolean nextIsLower = i + 1 < key.length() && Ascii.isLowerCase(key.charAt(i + 1));
        boolean previousIsUpper = i > 0 && Ascii.isUpperCase(key.charAt(i - 1));
        if (i > 0 && (previousIsLower || (previousIsUpper && nextIsLower))) {
          result.append('-');
        }
        result.append(Ascii.toLowerCase(c));
      } else if (c == '_') {
        result.append('-');
      } else {
        result.append(c);
      }
    }
    return result.toString();
  }
}
