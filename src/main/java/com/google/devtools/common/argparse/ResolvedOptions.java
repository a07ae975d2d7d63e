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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import javax.annotation.Nullable;

/**
 * The converted values of a successful resolution.
 *
 * <p>Instances only exist once resolution has completed without errors, so every value read from
 * them is final. Options without a value (absent, no default) are simply not contained.
 */
@AutoValue
public abstract class ResolvedOptions {

  static ResolvedOptions create(
      ImmutableMap<String, Object> values,
      ImmutableMap<String, OptionInstanceOrigin> origins,
      ImmutableList<String> residue) {
    return new AutoValue_ResolvedOptions(values, origins, residue);
  }

  /**
   * Returns the converted values by option key, in declaration order. Array options map to an
   * {@link ImmutableList}.
   */
  public abstract ImmutableMap<String, Object> asMap();

  abstract ImmutableMap<String, OptionInstanceOrigin> origins();

  /** Returns the plain values that no option claimed, in command-line order. */
  public abstract ImmutableList<String> getResidue();

  public boolean contains(String key) {
    return asMap().containsKey(key);
  }

  /** Returns the value bound to {@code key}, or {@code null} if there is none. */
  @Nullable
  public Object getValue(String key) {
    return asMap().get(key);
  }

  /** Returns the value of a single option, or {@code null} if it was absent and has no default. */
  @Nullable
  @SuppressWarnings("unchecked") // The converter of the definition produced the value.
  public <T> T getValue(OptionDefinition<T> definition) {
    Preconditions.checkArgument(
        definition.getArity() == Arity.SINGLE, "%s binds a list; use getValues()", definition);
    return (T) asMap().get(definition.getKey());
  }

  /** Returns the values of an array option, in the order they were given. */
  @SuppressWarnings("unchecked") // The converter of the definition produced the values.
  public <T> ImmutableList<T> getValues(OptionDefinition<T> definition) {
    Preconditions.checkArgument(
        definition.getArity() == Arity.ARRAY,
        "%s binds a single value; use getValue()",
        definition);
    Object values = asMap().get(definition.getKey());
    Preconditions.checkArgument(values != null, "%s was not part of this resolution", definition);
    return (ImmutableList<T>) values;
  }

  /**
   * Returns the tokens the value of {@code key} came from; {@link OptionInstanceOrigin#DEFAULT}
   * for defaults.
   *
   * @throws IllegalArgumentException if no value is bound to {@code key}
   */
  public OptionInstanceOrigin getOrigin(String key) {
    OptionInstanceOrigin origin = origins().get(key);
    Preconditions.checkArgument(origin != null, "No value for option key '%s'", key);
    return origin;
  }
}
