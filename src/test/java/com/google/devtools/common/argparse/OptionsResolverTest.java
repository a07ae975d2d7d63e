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
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.devtools.common.argparse.OptionsResolver.ConstructionException;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.function.Supplier;
import org.junit.Test;
import org.junit.runner.RunWith;

/** Tests for {@link OptionsResolver}. */
@RunWith(TestParameterInjector.class)
public class OptionsResolverTest {

  private static final OptionDefinition<String> OPT =
      OptionDefinition.single("opt", new Converters.StringConverter()).build();
  private static final OptionDefinition<String> SCAN =
      OptionDefinition.single("scan", new Converters.StringConverter())
          .parsing(SingleValueParsingStrategy.SCANNING_FOR_VALUE)
          .build();
  private static final OptionDefinition<Integer> JOBS =
      OptionDefinition.single("jobs", new Converters.IntegerConverter())
          .name(NameSpecification.shortAndLong())
          .defaultValue(4)
          .build();
  private static final OptionDefinition<String> READ =
      OptionDefinition.array("read", new Converters.StringConverter()).build();
  private static final OptionDefinition<String> FILES =
      OptionDefinition.array("files", new Converters.StringConverter())
          .parsing(ArrayParsingStrategy.UP_TO_NEXT_OPTION)
          .build();
  private static final OptionDefinition<String> PASSTHROUGH =
      OptionDefinition.array("passthrough", new Converters.StringConverter())
          .parsing(ArrayParsingStrategy.REMAINING)
          .build();
  private static final OptionDefinition<Integer> NUMS =
      OptionDefinition.array("nums", new Converters.IntegerConverter()).build();
  private static final OptionDefinition<String> REQUIRED =
      OptionDefinition.single("req", new Converters.StringConverter()).required().build();
  private static final OptionDefinition<String> REST =
      OptionDefinition.array("rest", new Converters.StringConverter())
          .absorbsUnrecognizedOptions()
          .build();
  private static final OptionDefinition<String> VERBOSE = flag("verbose");

  /** An option that takes no value: it resolves to an empty list when given. */
  private static OptionDefinition<String> flag(String key) {
    return OptionDefinition.array(key, new Converters.StringConverter())
        .name(NameSpecification.shortAndLong())
        .parsing(ArrayParsingStrategy.UP_TO_NEXT_OPTION)
        .build();
  }

  private static OptionsResolver resolver(OptionDefinition<?>... definitions) {
    return OptionsResolver.builder().addOptions(Arrays.asList(definitions)).build();
  }

  private static ResolvedOptions resolveOrFail(OptionsResolver resolver, String... args)
      throws OptionsResolutionException {
    ResolutionOutcome outcome = resolver.resolve(args);
    return outcome.getResolvedOptionsOrThrow();
  }

  @Test
  public void nextBindsTheFollowingToken() throws Exception {
    ResolvedOptions options = resolveOrFail(resolver(OPT), "--opt", "X", "rest");

    assertThat(options.getValue(OPT)).isEqualTo("X");
    assertThat(options.getResidue()).containsExactly("rest");
    assertThat(options.getOrigin("opt").getTokenIndices()).containsExactly(0, 1).inOrder();
  }

  @Test
  public void nextAndUnconditionalTakeTheFollowingTokenWhateverItLooksLike(
      @TestParameter({"NEXT", "UNCONDITIONAL"}) SingleValueParsingStrategy strategy)
      throws Exception {
    OptionDefinition<Integer> offset =
        OptionDefinition.single("offset", new Converters.IntegerConverter())
            .parsing(strategy)
            .build();

    ResolvedOptions options =
        resolveOrFail(resolver(offset, OPT), "--offset", "-5", "--opt", "--offset");

    assertThat(options.getValue(offset)).isEqualTo(-5);
    assertThat(options.getValue(OPT)).isEqualTo("--offset");
  }

  @Test
  public void scanningForValueSkipsOptionLikeTokens() throws Exception {
    OptionDefinition<String> other = flag("other");

    ResolvedOptions options =
        resolveOrFail(resolver(SCAN, other, VERBOSE), "--scan", "--other", "-v", "X");

    assertThat(options.getValue(SCAN)).isEqualTo("X");
    assertThat(options.getOrigin("scan").getTokenIndices()).containsExactly(0, 3).inOrder();
    // The skipped options are still resolved on their own.
    assertThat(options.getValues(other)).isEmpty();
    assertThat(options.getOrigin("other").getTokenIndices()).containsExactly(1);
    assertThat(options.getValues(VERBOSE)).isEmpty();
    assertThat(options.getResidue()).isEmpty();
  }

  @Test
  public void scanningForValueDoesNotCrossTheTerminator() {
    ResolutionOutcome outcome = resolver(SCAN).resolve("--scan", "--", "x");

    assertThat(outcome.succeeded()).isFalse();
    assertThat(outcome.getErrors()).hasSize(1);
    assertThat(outcome.getErrors().get(0).getKind()).isEqualTo(ResolutionError.Kind.MISSING_VALUE);
  }

  @Test
  public void competingScansAreWonByTheEarlierOccurrence() throws Exception {
    OptionDefinition<String> other =
        OptionDefinition.single("other", new Converters.StringConverter())
            .parsing(SingleValueParsingStrategy.SCANNING_FOR_VALUE)
            .build();

    ResolvedOptions options = resolveOrFail(resolver(other, SCAN), "--scan", "--other", "x", "y");

    assertThat(options.getValue(SCAN)).isEqualTo("x");
    assertThat(options.getValue(other)).isEqualTo("y");
  }

  @Test
  public void singleValueArrayAccumulatesInOrder() throws Exception {
    OptionsResolver resolver = resolver(READ);

    ResolvedOptions separate = resolveOrFail(resolver, "--read", "foo", "--read", "bar");
    ResolvedOptions inline = resolveOrFail(resolver, "--read=foo", "--read=bar");

    assertThat(separate.getValues(READ)).containsExactly("foo", "bar").inOrder();
    assertThat(inline.getValues(READ)).isEqualTo(separate.getValues(READ));
    assertThat(inline.getOrigin("read").getTokenIndices()).containsExactly(0, 1).inOrder();
  }

  @Test
  public void unconditionalSingleValueArrayTakesOptionLikeValues() throws Exception {
    OptionDefinition<Integer> deltas =
        OptionDefinition.array("delta", new Converters.IntegerConverter())
            .parsing(ArrayParsingStrategy.UNCONDITIONAL_SINGLE_VALUE)
            .build();

    ResolvedOptions options = resolveOrFail(resolver(deltas), "--delta", "-1", "--delta", "2");

    assertThat(options.getValues(deltas)).containsExactly(-1, 2).inOrder();
  }

  @Test
  public void upToNextOptionStopsAtTheNextOption() throws Exception {
    ResolvedOptions options =
        resolveOrFail(resolver(FILES, VERBOSE), "--files", "a", "b", "--verbose");

    assertThat(options.getValues(FILES)).containsExactly("a", "b").inOrder();
    assertThat(options.getValues(VERBOSE)).isEmpty();
    assertThat(options.getOrigin("verbose").getTokenIndices()).containsExactly(3);
  }

  @Test
  public void upToNextOptionRepeatsAndKeepsInlineValueFirst() throws Exception {
    ResolvedOptions options =
        resolveOrFail(
            resolver(FILES, VERBOSE), "--files=a", "b", "-v", "--files", "c", "--", "d");

    assertThat(options.getValues(FILES)).containsExactly("a", "b", "c").inOrder();
    assertThat(options.getResidue()).containsExactly("d");
  }

  @Test
  public void upToNextOptionWithoutValuesIsPresentAndEmpty() throws Exception {
    ResolvedOptions options = resolveOrFail(resolver(FILES), "--files");

    assertThat(options.getValues(FILES)).isEmpty();
    assertThat(options.getOrigin("files").isDefault()).isFalse();
  }

  @Test
  public void remainingClaimsEverythingAfterIt() throws Exception {
    OptionDefinition<String> foo =
        OptionDefinition.single("foo", new Converters.StringConverter()).build();

    ResolvedOptions options =
        resolveOrFail(resolver(PASSTHROUGH, foo), "--passthrough", "--foo", "1", "-xvf");

    assertThat(options.getValues(PASSTHROUGH)).containsExactly("--foo", "1", "-xvf").inOrder();
    assertThat(options.contains("foo")).isFalse();
    assertThat(options.getResidue()).isEmpty();
  }

  @Test
  public void remainingTakesTheTerminatorVerbatim() throws Exception {
    ResolvedOptions options =
        resolveOrFail(resolver(PASSTHROUGH), "--passthrough=a", "b", "--", "c");

    assertThat(options.getValues(PASSTHROUGH)).containsExactly("a", "b", "--", "c").inOrder();
  }

  @Test
  public void resolvingTwiceGivesEqualOutcomes() {
    OptionsResolver resolver = resolver(OPT, JOBS, READ, FILES, VERBOSE);
    String[] good = {"pos", "--opt", "a", "--read", "x", "--opt", "b", "-j", "2", "--files"};
    String[] bad = {"--opt", "a", "--jobs", "many", "--unknown", "--read"};

    assertThat(resolver.resolve(good)).isEqualTo(resolver.resolve(good));
    assertThat(resolver.resolve(bad)).isEqualTo(resolver.resolve(bad));
    assertThat(resolver.resolve(good).succeeded()).isTrue();
    assertThat(resolver.resolve(bad).succeeded()).isFalse();
  }

  @Test
  public void missingValueIsTheOnlyError() {
    ResolutionOutcome outcome = resolver(OPT, JOBS).resolve("--opt");

    assertThat(outcome.succeeded()).isFalse();
    assertThat(outcome.getResolvedOptions().isPresent()).isFalse();
    ResolutionError error = outcome.getErrors().get(0);
    assertThat(outcome.getErrors()).containsExactly(error);
    assertThat(error.getKind()).isEqualTo(ResolutionError.Kind.MISSING_VALUE);
    assertThat(error.getKey()).isEqualTo("opt");
    assertThat(error.getOptionNames()).containsExactly("--opt");
    assertThat(error.getPosition()).isEqualTo(1);
    assertThat(error.getMessage()).isEqualTo("Expected value after --opt");
  }

  @Test
  public void failedOutcomeThrowsWithAllErrors() {
    ResolutionOutcome outcome = resolver(OPT).resolve("--nope", "--opt");

    OptionsResolutionException e =
        assertThrows(OptionsResolutionException.class, outcome::getResolvedOptionsOrThrow);
    assertThat(e.getErrors()).isEqualTo(outcome.getErrors());
    assertThat(e)
        .hasMessageThat()
        .isEqualTo("Unrecognized option: --nope\nExpected value after --opt");
  }

  @Test
  public void absentOptionGetsItsDefault() throws Exception {
    ResolutionOutcome outcome = resolver(JOBS, READ).resolve();

    ResolvedOptions options = outcome.getResolvedOptionsOrThrow();
    assertThat(options.getValue(JOBS)).isEqualTo(4);
    assertThat(options.getOrigin("jobs")).isEqualTo(OptionInstanceOrigin.DEFAULT);
    assertThat(options.getValues(READ)).isEmpty();
    assertThat(outcome.getErrors()).isEmpty();
    assertThat(outcome.getWarnings()).isEmpty();
  }

  @Test
  public void defaultProviderIsOnlyCalledForAbsentOptions() throws Exception {
    @SuppressWarnings("unchecked")
    Supplier<Integer> provider = mock(Supplier.class);
    when(provider.get()).thenReturn(8);
    OptionDefinition<Integer> threads =
        OptionDefinition.single("threads", new Converters.IntegerConverter())
            .defaultProvider(provider)
            .build();
    OptionsResolver resolver = resolver(threads);

    assertThat(resolveOrFail(resolver, "--threads", "2").getValue(threads)).isEqualTo(2);
    verify(provider, never()).get();

    assertThat(resolveOrFail(resolver).getValue(threads)).isEqualTo(8);
    verify(provider).get();
  }

  @Test
  public void absentOptionWithoutDefaultHasNoValue() throws Exception {
    ResolvedOptions options = resolveOrFail(resolver(OPT));

    assertThat(options.contains("opt")).isFalse();
    assertThat(options.getValue(OPT)).isNull();
    assertThrows(IllegalArgumentException.class, () -> options.getOrigin("opt"));
  }

  @Test
  public void valuesAreInDeclarationOrder() throws Exception {
    ResolvedOptions options = resolveOrFail(resolver(READ, OPT, JOBS), "--opt", "o", "--read", "r");

    assertThat(options.asMap().keySet()).containsExactly("read", "opt", "jobs").inOrder();
  }

  @Test
  public void terminatorEndsOptionMatching() throws Exception {
    ResolvedOptions options =
        resolveOrFail(resolver(OPT), "first", "--opt", "a", "--", "--opt", "b", "-");

    assertThat(options.getValue(OPT)).isEqualTo("a");
    assertThat(options.getResidue()).containsExactly("first", "--opt", "b", "-").inOrder();
  }

  @Test
  public void residueIsAnErrorWhenNotAllowed() {
    OptionsResolver resolver = OptionsResolver.builder().addOption(OPT).allowResidue(false).build();

    ResolutionOutcome outcome = resolver.resolve("a", "--opt", "x", "b");

    assertThat(outcome.getErrors()).hasSize(2);
    assertThat(outcome.getErrors().get(0).getKind())
        .isEqualTo(ResolutionError.Kind.UNEXPECTED_ARGUMENT);
    assertThat(outcome.getErrors().get(0).getToken()).isEqualTo("a");
    assertThat(outcome.getErrors().get(0).getPosition()).isEqualTo(0);
    assertThat(outcome.getErrors().get(1).getToken()).isEqualTo("b");
    assertThat(outcome.getErrors().get(1).getPosition()).isEqualTo(3);
  }

  @Test
  public void unrecognizedOptionIsReported() {
    ResolutionOutcome outcome = resolver(OPT).resolve("--opt", "x", "--nope=1");

    ResolutionError error = outcome.getErrors().get(0);
    assertThat(outcome.getErrors()).containsExactly(error);
    assertThat(error.getKind()).isEqualTo(ResolutionError.Kind.UNRECOGNIZED_OPTION);
    assertThat(error.getKey()).isNull();
    assertThat(error.getOptionNames()).isEmpty();
    assertThat(error.getToken()).isEqualTo("--nope=1");
    assertThat(error.getPosition()).isEqualTo(2);
  }

  @Test
  public void passthroughOptionCollectsUnrecognizedOptions() throws Exception {
    ResolvedOptions options =
        resolveOrFail(resolver(OPT, REST), "--nope=1", "--opt", "x", "-z", "--rest", "y");

    assertThat(options.getValues(REST)).containsExactly("--nope=1", "-z", "y").inOrder();
    assertThat(options.getValue(OPT)).isEqualTo("x");
  }

  @Test
  public void onlyOnePassthroughOptionIsAllowed() {
    OptionDefinition<String> more =
        OptionDefinition.array("more", new Converters.StringConverter())
            .absorbsUnrecognizedOptions()
            .build();

    assertThrows(ConstructionException.class, () -> resolver(REST, more));
  }

  @Test
  public void duplicateKeysAreRejected() {
    OptionDefinition<Integer> otherOpt =
        OptionDefinition.single("opt", new Converters.IntegerConverter())
            .name(NameSpecification.customLong("other"))
            .build();

    ConstructionException e =
        assertThrows(ConstructionException.class, () -> resolver(OPT, otherOpt));
    assertThat(e).hasMessageThat().isEqualTo("Duplicate option key 'opt'");
  }

  @Test
  public void requiredOptionMustBeGiven() throws Exception {
    OptionsResolver resolver = resolver(REQUIRED);

    ResolutionOutcome outcome = resolver.resolve();

    assertThat(outcome.getErrors()).hasSize(1);
    ResolutionError error = outcome.getErrors().get(0);
    assertThat(error.getKind()).isEqualTo(ResolutionError.Kind.MISSING_OPTION);
    assertThat(error.getKey()).isEqualTo("req");
    assertThat(error.getPosition()).isNull();
    assertThat(error.getMessage()).isEqualTo("Missing expected option '--req' <req>");
    assertThat(resolveOrFail(resolver, "--req", "r").getValue(REQUIRED)).isEqualTo("r");
  }

  @Test
  public void requiredOptionWithMissingValueIsReportedOnce() {
    ResolutionOutcome outcome = resolver(REQUIRED).resolve("--req");

    assertThat(outcome.getErrors()).hasSize(1);
    assertThat(outcome.getErrors().get(0).getKind())
        .isEqualTo(ResolutionError.Kind.MISSING_VALUE);
  }

  @Test
  public void allConversionErrorsAreReported() {
    ResolutionOutcome outcome =
        resolver(JOBS, NUMS)
            .resolve("--nums", "1", "--jobs", "x", "--nums", "y", "--nums", "z", "--unknown");

    assertThat(outcome.getErrors()).hasSize(4);
    // Scan errors come first, then conversion errors in declaration order.
    assertThat(outcome.getErrors().get(0).getKind())
        .isEqualTo(ResolutionError.Kind.UNRECOGNIZED_OPTION);
    ResolutionError jobsError = outcome.getErrors().get(1);
    assertThat(jobsError.getKind()).isEqualTo(ResolutionError.Kind.INVALID_VALUE);
    assertThat(jobsError.getKey()).isEqualTo("jobs");
    assertThat(jobsError.getOptionNames()).containsExactly("-j", "--jobs").inOrder();
    assertThat(jobsError.getToken()).isEqualTo("x");
    assertThat(jobsError.getPosition()).isEqualTo(3);
    assertThat(jobsError.getMessage())
        .isEqualTo("While parsing option --jobs x: 'x' is not an int");
    assertThat(jobsError.getReason()).isEqualTo("'x' is not an int");
    assertThat(outcome.getErrors().get(2).getToken()).isEqualTo("y");
    assertThat(outcome.getErrors().get(3).getToken()).isEqualTo("z");
  }

  @Test
  public void illegalArgumentFromConversionFunctionIsAnInvalidValue() {
    OptionDefinition<Integer> port =
        OptionDefinition.single("port", Converters.fromFunction("a port", Integer::parseInt))
            .build();

    ResolutionOutcome outcome = resolver(port).resolve("--port=http");

    ResolutionError error = outcome.getErrors().get(0);
    assertThat(error.getKind()).isEqualTo(ResolutionError.Kind.INVALID_VALUE);
    assertThat(error.getToken()).isEqualTo("http");
    assertThat(error.getPosition()).isEqualTo(0);
    assertThat(error.getMessage()).startsWith("While parsing option --port=http: ");
  }

  @Test
  public void anyRuntimeExceptionFromConversionIsAnInvalidValue() {
    OptionDefinition<LocalDate> date =
        OptionDefinition.single("date", Converters.fromFunction("a date", LocalDate::parse))
            .build();
    OptionDefinition<Duration> timeout =
        OptionDefinition.single("timeout", new Converters.DurationConverter()).build();

    ResolutionOutcome outcome =
        resolver(date, timeout, JOBS)
            .resolve("--date", "yesterday", "--timeout", "999999999999999999d", "-j", "x");

    assertThat(outcome.getErrors()).hasSize(3);
    ResolutionError dateError = outcome.getErrors().get(0);
    assertThat(dateError.getKind()).isEqualTo(ResolutionError.Kind.INVALID_VALUE);
    assertThat(dateError.getKey()).isEqualTo("date");
    assertThat(dateError.getToken()).isEqualTo("yesterday");
    assertThat(dateError.getMessage()).startsWith("While parsing option --date yesterday: ");
    ResolutionError timeoutError = outcome.getErrors().get(1);
    assertThat(timeoutError.getKind()).isEqualTo(ResolutionError.Kind.INVALID_VALUE);
    assertThat(timeoutError.getKey()).isEqualTo("timeout");
    assertThat(outcome.getErrors().get(2).getKey()).isEqualTo("jobs");
  }

  @Test
  public void repeatedSingleOptionKeepsLastValueWithWarning() throws Exception {
    ResolutionOutcome outcome = resolver(OPT).resolve("--opt", "a", "--opt", "b");

    ResolvedOptions options = outcome.getResolvedOptionsOrThrow();
    assertThat(options.getValue(OPT)).isEqualTo("b");
    assertThat(options.getOrigin("opt").getTokenIndices()).containsExactly(2, 3).inOrder();
    assertThat(outcome.getWarnings())
        .containsExactly("option '--opt' was given more than once; '--opt b' overrides '--opt a'");
  }

  @Test
  public void shortAndLongSpellingsBindTheSameKey() throws Exception {
    ResolvedOptions options = resolveOrFail(resolver(JOBS), "-j=3");

    assertThat(options.getValue(JOBS)).isEqualTo(3);
    assertThat(options.getValue("jobs")).isEqualTo(3);
  }

  @Test
  public void arityIsCheckedOnLookup() throws Exception {
    ResolvedOptions options = resolveOrFail(resolver(OPT, READ));

    assertThrows(IllegalArgumentException.class, () -> options.getValues(OPT));
    assertThrows(IllegalArgumentException.class, () -> options.getValue(READ));
  }

  @Test
  public void resolverKeepsDeclarationOrder() {
    assertThat(resolver(OPT, READ, JOBS).getOptionDefinitions())
        .containsExactly(OPT, READ, JOBS)
        .inOrder();
  }
}
