package weft;

import clojure.lang.Cons;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static weft.TestSupport.fold;
import static weft.TestSupport.lines;

class AccumulatorTest {
  private static final int WIDTH = 80;

  private static Accumulator inTrial(int maxWidth, int startColumn) {
    return Accumulator.INITIAL.withMode(WriterMode.trial(new Cons(new TrialBudget(maxWidth, startColumn, false), null)));
  }

  @Test
  void breakLine_trimsFinishedLineAndIndentsNext() {
    Accumulator acc = fold(Accumulator.INITIAL, WIDTH,
        Event.write("let a = "), Event.indentBy(4), Event.BREAK_LINE, Event.write("1"));

    assertThat(lines(acc)).containsExactly("let a =", "    1");
    assertThat(acc.column).isEqualTo(5);
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "a", "hello world", "a,b,c;d", "    indented  "})
  void column_isSumOfWritesWithoutBreaks(String text) {
    Accumulator acc = fold(Accumulator.INITIAL, WIDTH, Event.write("ab"));
    int start = acc.column;
    for (String part : text.split(",")) {
      acc = fold(acc, WIDTH, Event.write(part), Event.indentBy(2), Event.setAlignColumn(7));
    }
    int expected = start + text.replace(",", "").length();

    assertThat(acc.column).isEqualTo(expected);
    assertThat(acc.currentLine()).hasSize(acc.column);
  }

  @Test
  void indentThenUnindent_restoresIndent() {
    Accumulator acc = fold(Accumulator.INITIAL, WIDTH, Event.setIndent(4), Event.setAlignColumn(2));
    Accumulator after = fold(acc, WIDTH, Event.indentBy(3), Event.unindentBy(3));

    assertThat(after.indent).isEqualTo(4);
  }

  @Test
  void indentBy_deeperAlignColumnWins() {
    Accumulator acc = fold(Accumulator.INITIAL, WIDTH, Event.setAlignColumn(6), Event.indentBy(4));

    assertThat(acc.indent).isEqualTo(10);
  }

  @Test
  void unindentBy_neverGoesBelowAlignColumn() {
    Accumulator acc = fold(Accumulator.INITIAL, WIDTH, Event.setIndent(8), Event.setAlignColumn(6), Event.unindentBy(4));

    assertThat(acc.indent).isEqualTo(6);
  }

  @Test
  void breakLine_usesAlignColumnAsFloor() {
    Accumulator acc = fold(Accumulator.INITIAL, WIDTH,
        Event.write("foo("), Event.setAlignColumn(4), Event.BREAK_LINE, Event.write("x"));

    assertThat(lines(acc)).containsExactly("foo(", "    x");
    assertThat(acc.indent).isEqualTo(4);
  }

  @Test
  void pendingSuffix_isFlushedOnBreak() {
    Accumulator acc = fold(Accumulator.INITIAL, WIDTH,
        Event.write("x"), Event.deferUntilBreak(" // first"), Event.deferUntilBreak(" // second"),
        Event.BREAK_LINE, Event.write("y"));

    assertThat(lines(acc)).containsExactly("x // second", "y");
    assertThat(acc.pendingSuffix).isEmpty();
  }

  @Test
  void stringLiteralBreak_keepsLineVerbatim() {
    Accumulator acc = fold(Accumulator.INITIAL, WIDTH,
        Event.setIndent(4), Event.write("\"a  "), Event.BREAK_LINE_IN_STRING_LITERAL, Event.write("b\""));

    assertThat(lines(acc)).containsExactly("\"a  ", "b\"");
    assertThat(acc.column).isEqualTo(2);
  }

  @Test
  void triviaBreak_trimsLineAndStartsAtColumnZero() {
    Accumulator acc = fold(Accumulator.INITIAL, WIDTH,
        Event.setIndent(4), Event.write("(* a  "), Event.BREAK_LINE_IN_TRIVIA, Event.write("b *)"));

    assertThat(lines(acc)).containsExactly("(* a", "b *)");
  }

  @Test
  void trial_stopsApplyingOnceBudgetIsExceeded() {
    Accumulator acc = fold(inTrial(5, 0), WIDTH, Event.write("abcdef"), Event.write("x"), Event.write("y"));

    assertThat(lines(acc)).containsExactly("abcdef");
    assertThat(acc.mode.hasConfirmedOverflow()).isTrue();
  }

  @Test
  void trial_breakConfirmsOverflowWithoutApplyingIt() {
    Accumulator acc = fold(inTrial(50, 0), WIDTH, Event.write("a"), Event.BREAK_LINE);

    assertThat(lines(acc)).containsExactly("a");
    assertThat(acc.mode.hasConfirmedOverflow()).isTrue();
  }

  @Test
  void trial_writeAfterPendingSuffixConfirmsOverflow() {
    Accumulator acc = fold(inTrial(50, 0), WIDTH, Event.write("a"), Event.deferUntilBreak(" // c"), Event.write("b"));

    assertThat(lines(acc)).containsExactly("a");
    assertThat(acc.mode.hasConfirmedOverflow()).isTrue();
  }

  @Test
  void trial_checksPageWidthToo() {
    Accumulator acc = fold(inTrial(100, 0), 4, Event.write("abcde"), Event.write("f"));

    assertThat(lines(acc)).containsExactly("abcde");
    assertThat(acc.mode.hasConfirmedOverflow()).isTrue();
  }

  @Test
  void trial_confirmsEveryBudgetOnTheStack() {
    WriterMode mode = WriterMode.trial(new Cons(new TrialBudget(100, 0, false), null))
        .push(new TrialBudget(2, 0, false));
    Accumulator acc = fold(Accumulator.INITIAL.withMode(mode), WIDTH, Event.write("abc"), Event.BREAK_LINE);

    for (Object budget : (Iterable<?>) acc.mode.budgets) {
      assertThat(((TrialBudget) budget).confirmedOverflow).isTrue();
    }
  }

  @Test
  void pushingAnEqualBudgetKeepsTheStack() {
    WriterMode mode = WriterMode.NORMAL.push(new TrialBudget(10, 0, false));

    assertThat(mode.push(new TrialBudget(10, 0, false))).isSameAs(mode);
  }
}
