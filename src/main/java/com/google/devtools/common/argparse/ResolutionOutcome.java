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
import java.util.Optional;

/**
 * The result of {@link OptionsResolver#resolve}: either the resolved options, or the non-empty list
 * of errors that prevented resolution. A failed outcome carries no values at all.
 */
@AutoValue
public abstract class ResolutionOutcome {

  static ResolutionOutcome success(
      ResolvedOptions resolvedOptions, ImmutableList<String> warnings) {
    return new AutoValue_ResolutionOutcome(
        Optional.of(resolvedOptions), ImmutableList.of(), warnings);
  }

  static ResolutionOutcome failure(
      ImmutableList<ResolutionError> errors, ImmutableList<String> warnings) {
    Preconditions.checkArgument(!errors.isEmpty(), "A failed resolution has errors");
    return new AutoValue_ResolutionOutcome(Optional.empty(), errors, warnings);
  }

  /** Returns the resolved options; empty if the resolution failed. */
  public abstract Optional<ResolvedOptions> getResolvedOptions();

  /** Returns the errors in the order they were found; empty if the resolution succeeded. */
  public abstract ImmutableList<ResolutionError> getErrors();

  /** Returns non-fatal remarks, such as a single-valued option being given twice. */
  public abstract ImmutableList<String> getWarnings();

  public boolean succeeded() {
    return getResolvedOptions().isPresent();
  }

  /**
   * Returns the resolved options.
   *
   * @throws OptionsResolutionException carrying all errors, if the resolution failed
   */
  public ResolvedOptions getResolvedOptionsOrThrow() throws OptionsResolutionException {
    if (!succeeded()) {
      throw new OptionsResolutionException(getErrors());
    }
    return getResolvedOptions().get();
  }
}
