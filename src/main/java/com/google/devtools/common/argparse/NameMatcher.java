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
import com.google.common.collect.ImmutableMap;
import com.google.devtools.common.argparse.OptionsResolver.ConstructionException;
import java.util.HashMap;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Classifies command-line tokens against the declared option names.
 *
 * <p>Matching is exact: a token (or the part of it before the first {@code =}) must equal one of
 * the spellings of a declared option. There is no prefix or fuzzy matching.
 */
final class NameMatcher {

  static final String TERMINATOR = "--";

  /** What a token turned out to be. */
  enum Kind {
    /** A declared option name, possibly with an inline {@code =value}. */
    OPTION,
    /** Shaped like an option, but no declared option owns the name. */
    UNRECOGNIZED_OPTION,
    /** The {@code --} marker that ends option matching. */
    TERMINATOR,
    /** Anything else. */
    VALUE
  }

  /** The result of {@link #classify}. */
  @AutoValue
  abstract static class Match {
    abstract Kind getKind();

    /** The matched option, for {@link Kind#OPTION}. */
    @Nullable
    abstract OptionDefinition<?> getDefinition();

    /** The spelling that matched, for {@link Kind#OPTION}. */
    @Nullable
    abstract OptionName getName();

    /** The part after {@code =} in {@code --name=value} form. */
    @Nullable
    abstract String getInlineValue();

    boolean hasInlineValue() {
      return getInlineValue() != null;
    }

    private static Match of(Kind kind) {
      return new AutoValue_NameMatcher_Match(kind, null, null, null);
    }

    private static Match option(
        OptionDefinition<?> definition, OptionName name, @Nullable String inlineValue) {
      return new AutoValue_NameMatcher_Match(Kind.OPTION, definition, name, inlineValue);
    }
  }

  private static final Match UNRECOGNIZED = Match.of(Kind.UNRECOGNIZED_OPTION);
  private static final Match TERMINATOR_MATCH = Match.of(Kind.TERMINATOR);
  private static final Match VALUE = Match.of(Kind.VALUE);

  private final ImmutableMap<String, OptionDefinition<?>> definitionsBySpelling;
  private final ImmutableMap<String, OptionName> namesBySpelling;

  NameMatcher(Iterable<OptionDefinition<?>> definitions) {
    Map<String, OptionDefinition<?>> bySpelling = new HashMap<>();
    ImmutableMap.Builder<String, OptionName> names = ImmutableMap.builder();
    for (OptionDefinition<?> definition : definitions) {
      for (OptionName name : definition.getNames()) {
        String spelling = name.getSynopsisString();
        OptionDefinition<?> previous = bySpelling.put(spelling, definition);
        if (previous != null) {
          throw new ConstructionException(
              String.format(
                  "Duplicate option name %s, used by options '%s' and '%s'",
                  spelling, previous.getKey(), definition.getKey()));
        }
        names.put(spelling, name);
      }
    }
    this.definitionsBySpelling = ImmutableMap.copyOf(bySpelling);
    this.namesBySpelling = names.buildOrThrow();
  }

  /** Whether the token looks like an option or flag: a dash followed by at least one character. */
  static boolean isOptionLike(String token) {
    return token.length() > 1 && token.charAt(0) == '-';
  }

  /** Whether the token may be claimed as a value by a strategy that skips option-like tokens. */
  boolean isPlainValue(Token token) {
    return !isOptionLike(token.getValue());
  }

  Match classify(Token token) {
    String arg = token.getValue();
    if (arg.equals(TERMINATOR)) {
      return TERMINATOR_MATCH;
    }
    if (!isOptionLike(arg)) {
      return VALUE;
    }
    OptionDefinition<?> definition = definitionsBySpelling.get(arg);
    if (definition != null) {
      return Match.option(definition, namesBySpelling.get(arg), null);
    }
    int equalsAt = arg.indexOf('=');
    if (equalsAt != -1) {
      String spelling = arg.substring(0, equalsAt);
      definition = definitionsBySpelling.get(spelling);
      if (definition != null) {
        return Match.option(
            definition, namesBySpelling.get(spelling), arg.substring(equalsAt + 1));
      }
    }
    return UNRECOGNIZED;
  }
}
