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
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/** Thrown by {@link ResolutionOutcome#getResolvedOptionsOrThrow()} for a failed resolution. */
public class OptionsResolutionException extends OptionsParsingException {
  private final ImmutableList<ResolutionError> errors;

  public OptionsResolutionException(ImmutableList<ResolutionError> errors) {
    super(
        Joiner.on('\n').join(Preconditions.checkNotNull(errors)),
        errors.isEmpty() ? null : errors.get(0).getToken());
    Preconditions.checkArgument(!errors.isEmpty(), "A failed resolution has errors");
    this.errors = errors;
  }

  /** Returns all errors of the resolution, in the order they were found. */
  public ImmutableList<ResolutionError> getErrors() {
    return errors;
  }
}
