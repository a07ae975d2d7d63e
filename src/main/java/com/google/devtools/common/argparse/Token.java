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

/** A command-line argument together with its 0-based position in the original argument list. */
@AutoValue
abstract class Token {

  static Token create(int index, String value) {
    return new AutoValue_Token(index, value);
  }

  abstract int getIndex();

  abstract String getValue();

  @Override
  public final String toString() {
    return String.format("'%s' (argument %d)", getValue(), getIndex());
  }
}
