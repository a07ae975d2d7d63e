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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Objects;

/**
 * Records which command-line tokens an option value came from. Origins are used for diagnostics
 * only; a value's origin never changes how it is resolved.
 */
public final class OptionInstanceOrigin {

  /** The origin of values that were not on the command line, such as defaults. */
  public static final OptionInstanceOrigin DEFAULT =
      new OptionInstanceOrigin(ImmutableSortedSet.of());

  private final ImmutableSortedSet<Integer> tokenIndices;

  private OptionInstanceOrigin(ImmutableSortedSet<Integer> tokenIndices) {
    this.tokenIndices = tokenIndices;
  }

  static OptionInstanceOrigin forTokens(Token... tokens) {
    ImmutableSortedSet.Builder<Integer> indices = ImmutableSortedSet.naturalOrder();
    for (Token token : tokens) {
      indices.add(token.getIndex());
    }
    return new OptionInstanceOrigin(indices.build());
  }

  /** Returns an origin covering the tokens of both this origin and {@code other}. */
  OptionInstanceOrigin union(OptionInstanceOrigin other) {
    if (other.tokenIndices.isEmpty()) {
      return this;
    }
    if (tokenIndices.isEmpty()) {
      return other;
    }
    return new OptionInstanceOrigin(
        ImmutableSortedSet.<Integer>naturalOrder()
            .addAll(tokenIndices)
            .addAll(other.tokenIndices)
            .build());
  }

  /** The 0-based positions of the tokens in the original argument list, in ascending order. */
  public ImmutableSortedSet<Integer> getTokenIndices() {
    return tokenIndices;
  }

  /** Whether no command-line token contributed to the value. */
  public boolean isDefault() {
    return tokenIndices.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof OptionInstanceOrigin)) {
      return false;
    }
    return tokenIndices.equals(((OptionInstanceOrigin) o).tokenIndices);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(tokenIndices);
  }

  @Override
  public String toString() {
    return isDefault() ? "default" : "argument " + Joiner.on(", ").join(tokenIndices);
  }
}
