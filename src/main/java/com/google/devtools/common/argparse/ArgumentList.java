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
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import javax.annotation.Nullable;

/**
 * The unconsumed command-line tokens of one resolution.
 *
 * <p>The cursor is always the first unconsumed token; offsets passed to {@link #peek} and {@link
 * #remove} are relative to it. Consuming a token is permanent. Removing a token other than the
 * first one keeps the relative order of all other unconsumed tokens.
 *
 * <p>Not thread-safe; owned by a single resolution.
 */
final class ArgumentList {
  private final List<Token> remaining;

  ArgumentList(List<String> arguments) {
    remaining = new ArrayList<>(arguments.size());
    for (int i = 0; i < arguments.size(); i++) {
      remaining.add(Token.create(i, Preconditions.checkNotNull(arguments.get(i))));
    }
  }

  boolean hasMore() {
    return !remaining.isEmpty();
  }

  /** The number of unconsumed tokens. */
  int size() {
    return remaining.size();
  }

  /** Returns the token {@code offset} positions after the cursor, or {@code null} at the end. */
  @Nullable
  Token peek(int offset) {
    Preconditions.checkArgument(offset >= 0, "Negative offset %s", offset);
    return offset < remaining.size() ? remaining.get(offset) : null;
  }

  /** Removes and returns the token at the cursor. */
  @CanIgnoreReturnValue
  Token consume() {
    Preconditions.checkState(hasMore(), "No more arguments");
    return remaining.remove(0);
  }

  /** Consumes the token at the cursor if it satisfies {@code predicate}. */
  @Nullable
  Token consumeIf(Predicate<Token> predicate) {
    if (hasMore() && predicate.test(remaining.get(0))) {
      return remaining.remove(0);
    }
    return null;
  }

  /** Removes and returns the token {@code offset} positions after the cursor. */
  @CanIgnoreReturnValue
  Token remove(int offset) {
    Preconditions.checkElementIndex(offset, remaining.size(), "offset");
    return remaining.remove(offset);
  }

  /** Consumes every remaining token, in order. */
  ImmutableList<Token> consumeAll() {
    ImmutableList<Token> all = ImmutableList.copyOf(remaining);
    remaining.clear();
    return all;
  }
}
