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
import com.google.common.base.Preconditions;

/** One accepted spelling of an option on the command line, e.g. {@code --verbose} or {@code -v}. */
@AutoValue
public abstract class OptionName {

  /** The shape of a name, which decides the prefix it is spelled with. */
  public enum Kind {
    /** {@code --name} */
    LONG("--"),
    /** {@code -name}, a multi-character name with a single dash. */
    LONG_WITH_SINGLE_DASH("-"),
    /** {@code -n} */
    SHORT("-");

    private final String prefix;

    Kind(String prefix) {
      this.prefix = prefix;
    }

    public String getPrefix() {
      return prefix;
    }
  }

  public static OptionName longName(String name) {
    return create(Kind.LONG, name);
  }

  public static OptionName longNameWithSingleDash(String name) {
    return create(Kind.LONG_WITH_SINGLE_DASH, name);
  }

  public static OptionName shortName(char name) {
    return create(Kind.SHORT, String.valueOf(name));
  }

  private static OptionName create(Kind kind, String name) {
    Preconditions.checkArgument(!name.isEmpty(), "Option names must not be empty");
    Preconditions.checkArgument(
        name.indexOf('=') == -1 && !name.startsWith("-"),
        "Option name '%s' must not start with '-' or contain '='",
        name);
    Preconditions.checkArgument(
        kind != Kind.SHORT || name.length() == 1, "Short names have exactly one character");
    return new AutoValue_OptionName(kind, name);
  }

  public abstract Kind getKind();

  /** The name without its dashes. */
  public abstract String getName();

  /** The name as it is spelled on the command line, including its dashes. */
  public String getSynopsisString() {
    return getKind().getPrefix() + getName();
  }

  @Override
  public final String toString() {
    return getSynopsisString();
  }
}
