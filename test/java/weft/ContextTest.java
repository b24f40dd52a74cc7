package weft;

import clojure.lang.Cons;
import clojure.lang.Keyword;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static weft.TestSupport.context;
import static weft.TestSupport.lines;

class ContextTest {
  private static final Keyword EXPR = Keyword.intern("expr");

  @Test
  void emit_recordsNormalizedEventsAsOneChunk() {
    Context ctx = context().emit(Event.write("a\nb"));

    assertThat(ctx.log.length()).isEqualTo(3);
    assertThat(ctx.log.chunks().count()).isEqualTo(1);
    assertThat(lines(ctx)).containsExactly("a", "b");
    assertThat(ctx.column()).isEqualTo(1);
  }

  @Test
  void emit_leavesReceiverUntouched() {
    Context before = context().emit(Event.write("abc"));
    Context after = before.emit(Event.BREAK_LINE).emit(Event.write("d"));

    assertThat(lines(before)).containsExactly("abc");
    assertThat(before.log.length()).isEqualTo(1);
    assertThat(lines(after)).containsExactly("abc", "d");
  }

  @Test
  void measurement_startsPaddedToCurrentColumn() {
    Context ctx = context().emit(Event.write("abc"));
    Accumulator measured = Measure.run(Steps.write("de"), true, ctx);

    assertThat(lines(measured)).containsExactly("   de");
    assertThat(measured.column).isEqualTo(5);
    assertThat(measured.mode.isMeasurement()).isTrue();
  }

  @Test
  void measurement_neverAltersTheMeasuredContext() {
    Context ctx = context().emit(Event.write("let x =")).emit(Event.deferUntilBreak(" // c"));
    List<String> linesBefore = lines(ctx);
    int columnBefore = ctx.column();
    int logBefore = ctx.log.length();

    Measure.run(Steps.write(" 1").then(Separators.NLN).then(Steps.write("2")), false, ctx);
    Measure.futureNlnCheck(Separators.NLN, ctx);
    Measure.exceedsWidth(1, Steps.write("long"), ctx);

    assertThat(lines(ctx)).isEqualTo(linesBefore);
    assertThat(ctx.column()).isEqualTo(columnBefore);
    assertThat(ctx.log.length()).isEqualTo(logBefore);
    assertThat(ctx.accumulator.pendingSuffix).isEqualTo(" // c");
  }

  @Test
  void measurement_withoutKeepPageWidthIsUnbounded() {
    Context ctx = context(TestSupport.pageWidth(10));

    assertThat(ctx.withMeasurement(false).config.pageWidth).isEqualTo(Integer.MAX_VALUE);
    assertThat(ctx.withMeasurement(true).config.pageWidth).isEqualTo(10);
  }

  @Test
  void dump_dropsLeadingBlankLinesUnlessSelection() {
    Context ctx = Step.seq(Separators.NLN, Separators.NLN, Steps.write("a  ")).apply(context());

    assertThat(ctx.dump()).isEqualTo("a");
    assertThat(ctx.dump(true)).isEqualTo("\n\na");
  }

  @Test
  void dump_flushesPendingSuffix() {
    Context ctx = context().emit(Event.write("x")).emit(Event.deferUntilBreak(" // end"));

    assertThat(ctx.dump()).isEqualTo("x // end");
  }

  @Test
  void dump_usesConfiguredLineEnding() {
    LayoutConfig config = LayoutConfig.DEFAULTS.with(LayoutConfig.END_OF_LINE, LayoutConfig.CRLF);
    Context ctx = Step.seq(Steps.write("a"), Separators.NLN, Steps.write("b")).apply(context(config));

    assertThat(ctx.dump()).isEqualTo("a\r\nb");
  }

  @Test
  void dump_failsOnLeakedTrial() {
    Context ctx = context().withTrial(10).emit(Event.write("a"));

    assertThatThrownBy(ctx::dump).isInstanceOf(LayoutException.class);
  }

  @Test
  void create_partitionsTriviaByPlacementAndType() {
    Range range = Range.of(1, 0, 1, 5);
    Context ctx = Context.create(LayoutConfig.DEFAULTS, List.of(
        new TriviaInstruction(EXPR, range, TriviaContent.NEWLINE, true),
        new TriviaInstruction(EXPR, range, TriviaContent.lineCommentAfterSource("// c"), false)), null);

    assertThat(ctx.hasContentBefore(EXPR, range)).isTrue();
    assertThat(ctx.hasContentAfter(EXPR, range)).isTrue();
    assertThat(ctx.hasContentBefore(EXPR, Range.of(1, 0, 1, 4))).isFalse();
    assertThat(ctx.hasContentBefore(Keyword.intern("pat"), range)).isFalse();
  }

  @Test
  void fromSourceText_slicesRanges() {
    SourceText source = SourceText.of("let x = 1\r\nlet y = 2");
    Context ctx = Context.create(LayoutConfig.DEFAULTS, List.of(), source);

    assertThat(ctx.fromSourceText(Range.of(2, 4, 2, 5))).isEqualTo("y");
    assertThat(ctx.fromSourceText(Range.of(1, 4, 2, 3))).isEqualTo("x = 1\nlet");
    assertThat(context().fromSourceText(Range.of(1, 0, 1, 1))).isNull();
  }

  @Test
  void isTrialFailed_seesBudgetsExceededAtCurrentColumn() {
    Context ctx = context()
        .withMode(WriterMode.trial(new Cons(new TrialBudget(3, 0, false), null)))
        .emit(Event.write("abcd"));

    assertThat(ctx.hasConfirmedOverflow()).isFalse();
    assertThat(ctx.isTrialFailed()).isTrue();
  }
}
