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

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * Resolves command lines against a fixed set of {@link OptionDefinition}s.
 *
 * <p>A resolver is immutable. Each call to {@link #resolve} works on its own copy of the arguments
 * and its own value store, so one resolver may be used any number of times, from any number of
 * threads, and resolving the same arguments twice gives equal outcomes.
 *
 * <pre>
 * OptionsResolver resolver =
 *     OptionsResolver.builder().addOption(jobs).addOption(files).build();
 * ResolvedOptions options = resolver.resolve(args).getResolvedOptionsOrThrow();
 * int jobCount = options.getValue(jobs);
 * </pre>
 *
 * <p>Arguments are handled in a single forward pass. Plain values that no option claims are
 * residue, and everything after {@code --} is residue. Errors don't stop the pass: the outcome
 * reports every error that could be found.
 */
public final class OptionsResolver {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  /**
   * An unchecked exception thrown when the option definitions are inconsistent. This is a
   * programming error in the code that declares the options, not a problem with the command line.
   */
  public static class ConstructionException extends RuntimeException {
    public ConstructionException(String message) {
      super(message);
    }

    public ConstructionException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** A helper class to create new instances of {@link OptionsResolver}. */
  public static final class Builder {
    private final ImmutableList.Builder<OptionDefinition<?>> definitions = ImmutableList.builder();
    private boolean allowResidue = true;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder addOption(OptionDefinition<?> definition) {
      definitions.add(definition);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addOptions(Iterable<? extends OptionDefinition<?>> definitions) {
      for (OptionDefinition<?> definition : definitions) {
        addOption(definition);
      }
      return this;
    }

    /**
     * Indicates whether or not the resolver will allow a non-empty residue; that is, plain values
     * that no option claims. If not, each of them is reported as an error. The default is true.
     */
    @CanIgnoreReturnValue
    public Builder allowResidue(boolean allowResidue) {
      this.allowResidue = allowResidue;
      return this;
    }

    /**
     * Returns a new {@link OptionsResolver}.
     *
     * @throws ConstructionException if two options share a key or a spelling, or more than one
     *     option collects unrecognized options
     */
    public OptionsResolver build() {
      ImmutableList<OptionDefinition<?>> options = definitions.build();
      Set<String> keys = new HashSet<>();
      OptionDefinition<?> passthroughOption = null;
      for (OptionDefinition<?> option : options) {
        if (!keys.add(option.getKey())) {
          throw new ConstructionException("Duplicate option key '" + option.getKey() + "'");
        }
        if (option.absorbsUnrecognizedOptions()) {
          if (passthroughOption != null) {
            throw new ConstructionException(
                String.format(
                    "Only one option may collect unrecognized options, but both '%s' and '%s' do",
                    passthroughOption.getKey(), option.getKey()));
          }
          passthroughOption = option;
        }
      }
      return new OptionsResolver(
          options, new NameMatcher(options), passthroughOption, allowResidue);
    }
  }

  /** Returns a new {@link Builder} to create {@link OptionsResolver} instances. */
  public static Builder builder() {
    return new Builder();
  }

  private final ImmutableList<OptionDefinition<?>> optionDefinitions;
  private final NameMatcher nameMatcher;
  @Nullable private final OptionDefinition<?> passthroughOption;
  private final boolean allowResidue;

  private OptionsResolver(
      ImmutableList<OptionDefinition<?>> optionDefinitions,
      NameMatcher nameMatcher,
      @Nullable OptionDefinition<?> passthroughOption,
      boolean allowResidue) {
    this.optionDefinitions = optionDefinitions;
    this.nameMatcher = nameMatcher;
    this.passthroughOption = passthroughOption;
    this.allowResidue = allowResidue;
  }

  /** Returns the options this resolver knows about, in declaration order. */
  public ImmutableList<OptionDefinition<?>> getOptionDefinitions() {
    return optionDefinitions;
  }

  /**
   * Resolves {@code args}, which must not include the program name.
   *
   * @return the outcome, which holds either all values or all errors; never both
   */
  public ResolutionOutcome resolve(List<String> args) {
    logger.atFine().log(
        "Resolving %d argument(s) against %d option(s)", args.size(), optionDefinitions.size());
    return new OptionsResolverImpl(
            optionDefinitions, nameMatcher, passthroughOption, allowResidue, args)
        .resolve();
  }

  /** Resolves {@code args}, which must not include the program name. */
  public ResolutionOutcome resolve(String... args) {
    return resolve(Arrays.asList(args));
  }
}
