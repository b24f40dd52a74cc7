package weft;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static weft.Separators.NLN;
import static weft.Steps.write;
import static weft.TestSupport.context;

class MultilineItemsTest {

  private static MultilineItem item(String... lines) {
    List<Step> steps = new ArrayList<>();
    for (String line : lines) {
      steps.add(write(line));
    }
    return new MultilineItem(Steps.col(NLN, steps, s -> s), NLN);
  }

  private static String join(List<MultilineItem> items) {
    return MultilineItems.join(items).apply(context()).dump();
  }

  @Test
  void singleLineItems_haveNoBlankLines() {
    assertThat(join(List.of(item("A"), item("B"), item("C")))).isEqualTo("A\nB\nC");
  }

  @Test
  void multilineItem_isSurroundedByBlankLines() {
    assertThat(join(List.of(item("A"), item("B1", "B2"), item("C")))).isEqualTo("A\n\nB1\nB2\n\nC");
  }

  @Test
  void firstItem_neverGetsLeadingBlankLine() {
    assertThat(join(List.of(item("A1", "A2"), item("B"), item("C")))).isEqualTo("A1\nA2\n\nB\nC");
  }

  @Test
  void consecutiveMultilineItems_shareOneBlankLine() {
    assertThat(join(List.of(item("A1", "A2"), item("B1", "B2")))).isEqualTo("A1\nA2\n\nB1\nB2");
  }

  @Test
  void leadingCommentDoesNotMakeItemMultiline() {
    MultilineItem commented = new MultilineItem(write("// note").then(NLN).then(write("B")), NLN);

    assertThat(join(List.of(item("A"), commented, item("C")))).isEqualTo("A\n// note\nB\nC");
  }

  @Test
  void emptyAndSingletonLists() {
    assertThat(join(List.of())).isEmpty();
    assertThat(join(List.of(item("A1", "A2")))).isEqualTo("A1\nA2");
  }

  @Test
  void replay_rendersSingleLineItemAgain() {
    AtomicInteger renders = new AtomicInteger();
    Step counted = ctx -> {
      renders.incrementAndGet();
      return ctx.emit(Event.write("B"));
    };

    String text = join(List.of(item("A"), new MultilineItem(counted, NLN)));

    assertThat(text).isEqualTo("A\nB");
    assertThat(renders.get()).isEqualTo(2);
  }

  @Test
  void joinUsingConfig_canDisableBlankLines() {
    LayoutConfig off = LayoutConfig.DEFAULTS.with(LayoutConfig.BLANK_LINES_AROUND_NESTED_MULTILINE, false);
    List<MultilineItem> items = List.of(item("A"), item("B1", "B2"), item("C"));

    assertThat(MultilineItems.joinUsingConfig(items).apply(context(off)).dump()).isEqualTo("A\nB1\nB2\nC");
    assertThat(MultilineItems.joinUsingConfig(items).apply(context()).dump()).isEqualTo("A\n\nB1\nB2\n\nC");
  }

  @Test
  void addExtraNewlineIfLeadingWasMultiline_addsBlankLineAfterMultilineLeading() {
    Step multi = MultilineItems.addExtraNewlineIfLeadingWasMultiline(
        write("a").then(NLN).then(write("b")), NLN, write("c"));
    Step single = MultilineItems.addExtraNewlineIfLeadingWasMultiline(write("a"), NLN, write("c"));

    assertThat(multi.apply(context()).dump()).isEqualTo("a\nb\n\nc");
    assertThat(single.apply(context()).dump()).isEqualTo("a\nc");
  }
}
