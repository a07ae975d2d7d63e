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

/** How many tokens an occurrence of an option claims, independent of its arity. */
enum ParsingStrategy {
  /** The token right after the name. */
  NEXT,
  /** The token right after the name; same mechanics as {@link #NEXT}. */
  UNCONDITIONAL,
  /** The first plain value after the name, skipping over option-like tokens. */
  SCANNING_FOR_VALUE,
  /** Every plain value after the name, up to the first option-like token. */
  UP_TO_NEXT_OPTION,
  /** Every remaining token. */
  ALL_REMAINING
}
