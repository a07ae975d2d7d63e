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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link NameSpecification} and {@link OptionName}. */
@RunWith(JUnit4.class)
public class NameSpecificationTest {

  @Test
  public void longNameIsKebabCase() {
    assertThat(NameSpecification.longName().makeNames("maxCount"))
        .containsExactly(OptionName.longName("max-count"));
  }

  @Test
  public void camelCaseConversion() {
    assertThat(NameSpecification.convertCamelCaseToKebabCase("verbose")).isEqualTo("verbose");
    assertThat(NameSpecification.convertCamelCaseToKebabCase("maxURLCount"))
        .isEqualTo("max-url-count");
    assertThat(NameSpecification.convertCamelCaseToKebabCase("dry_run")).isEqualTo("dry-run");
    assertThat(NameSpecification.convertCamelCaseToKebabCase("URL")).isEqualTo("url");
  }

  @Test
  public void shortAndLongKeepsOrder() {
    assertThat(NameSpecification.shortAndLong().makeNames("verbose"))
        .containsExactly(OptionName.shortName('v'), OptionName.longName("verbose"))
        .inOrder();
  }

  @Test
  public void combinedSpecificationsDropDuplicates() {
    NameSpecification specification =
        NameSpecification.longName()
            .and(NameSpecification.customLong("verbose"))
            .and(NameSpecification.customLongWithSingleDash("verb"));

    assertThat(specification.makeNames("verbose"))
        .containsExactly(OptionName.longName("verbose"), OptionName.longNameWithSingleDash("verb"))
        .inOrder();
  }

  @Test
  public void synopsisStrings() {
    assertThat(OptionName.longName("out").getSynopsisString()).isEqualTo("--out");
    assertThat(OptionName.longNameWithSingleDash("out").getSynopsisString()).isEqualTo("-out");
    assertThat(OptionName.shortName('o').toString()).isEqualTo("-o");
  }

  @Test
  public void invalidNames() {
    assertThrows(IllegalArgumentException.class, () -> OptionName.longName(""));
    assertThrows(IllegalArgumentException.class, () -> OptionName.longName("-x"));
    assertThrows(IllegalArgumentException.class, () -> OptionName.longName("a=b"));
    assertThrows(IllegalArgumentException.class, () -> NameSpecification.customShort('-'));
  }
}
