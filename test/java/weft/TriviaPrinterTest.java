package weft;

import clojure.lang.Keyword;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static weft.Separators.NLN;
import static weft.Steps.write;

class TriviaPrinterTest {
  private static final Keyword BINDING = Keyword.intern("binding");
  private static final Range RANGE = Range.of(3, 4, 3, 13);

  private static Context withTrivia(TriviaContent content, boolean before) {
    return Context.create(LayoutConfig.DEFAULTS, List.of(new TriviaInstruction(BINDING, RANGE, content, before)), null);
  }

  @Test
  void trailingComment_isDeferredUntilBreak() {
    Context ctx = withTrivia(TriviaContent.lineCommentAfterSource("// hi"), false);
    Step layout = write("x").then(TriviaPrinter.leaveNode(BINDING, RANGE)).then(write(" + 1")).then(NLN).then(write("y"));

    assertThat(layout.apply(ctx).dump()).isEqualTo("x + 1 // hi\ny");
  }

  @Test
  void trailingComment_noExtraSpaceAfterWhitespace() {
    Context ctx = withTrivia(TriviaContent.lineCommentAfterSource("// hi"), false);

    assertThat(write("x ").then(TriviaPrinter.leaveNode(BINDING, RANGE)).apply(ctx).dump()).isEqualTo("x // hi");
  }

  @Test
  void blankLineMarker_dependsOnCurrentLine() {
    Context ctx = withTrivia(TriviaContent.NEWLINE, true);
    Step node = TriviaPrinter.genTrivia(BINDING, RANGE, write("b"));

    assertThat(write("a").then(node).apply(ctx).dump()).isEqualTo("a\n\nb");
    assertThat(write("a").then(NLN).then(node).apply(ctx).dump()).isEqualTo("a\n\nb");
  }

  @Test
  void directive_startsOnItsOwnLine() {
    Context ctx = withTrivia(TriviaContent.directive("#if DEBUG"), true);

    assertThat(write("a").then(TriviaPrinter.enterNode(BINDING, RANGE)).then(write("b")).apply(ctx).dump())
        .isEqualTo("a\n#if DEBUG\nb");
  }

  @Test
  void blockComment_breaksOnlyWhenAsked() {
    Context before = withTrivia(TriviaContent.blockComment("(* c *)", true, false), true);
    Context after = withTrivia(TriviaContent.blockComment("(* c *)", false, true), true);
    Step layout = write("a").then(TriviaPrinter.enterNode(BINDING, RANGE)).then(write("b"));

    assertThat(layout.apply(before).dump()).isEqualTo("a\n(* c *) b");
    assertThat(layout.apply(after).dump()).isEqualTo("a (* c *)\nb");
  }

  @Test
  void unmatchedTrivia_isIgnored() {
    Context ctx = withTrivia(TriviaContent.commentOnSingleLine("// lost"), true);
    Step layout = TriviaPrinter.genTrivia(BINDING, Range.of(3, 4, 3, 12), write("b"))
        .then(TriviaPrinter.enterNode(Keyword.intern("pattern"), RANGE));

    assertThat(layout.apply(ctx).dump()).isEqualTo("b");
  }

  @Test
  void sepNlnConsideringTriviaContentBefore_skipsBreakWhenTriviaPrintsOne() {
    Context ctx = withTrivia(TriviaContent.commentOnSingleLine("// about b"), true);
    Step layout = write("a")
        .then(TriviaPrinter.sepNlnConsideringTriviaContentBeforeFor(BINDING, RANGE))
        .then(TriviaPrinter.genTrivia(BINDING, RANGE, write("b")));

    assertThat(layout.apply(ctx).dump()).isEqualTo("a\n// about b\nb");
  }

  @Test
  void breaksFromTriviaAreTaggedSeparately() {
    Context ctx = withTrivia(TriviaContent.commentOnSingleLine("// c"), true);
    Context printed = write("a").then(TriviaPrinter.enterNode(BINDING, RANGE)).apply(ctx);

    assertThat(TestSupport.events(printed)).containsExactly(
        Event.write("a"),
        Event.BREAK_LINE_DUE_TO_TRIVIA,
        Event.write("// c"),
        Event.BREAK_LINE_DUE_TO_TRIVIA);
  }
}
