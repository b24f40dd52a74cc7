package weft;

import clojure.lang.PersistentVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Function;

import static weft.Separators.NLN;

/**
 * Lays out a sequence of items one per line, with a blank line around every
 * item that spans several lines. The first item never gets a blank line in
 * front of it.
 *
 * <pre>
 * let a = AAAA
 *
 * let b =
 *     BBBB
 *     BBBB
 *
 * let c = CCCC
 * </pre>
 */
public class MultilineItems {
  private static final Logger log = LoggerFactory.getLogger(MultilineItems.class);

  public static Step join(List<MultilineItem> items) {
    return ctx -> {
      if (items.isEmpty()) {
        return ctx;
      }
      Context c = ctx;
      boolean lastWasMultiline = false;
      for (int i = 0; i < items.size(); i++) {
        MultilineItem item = items.get(i);
        if (i == 0) {
          int before = c.log.length();
          c = item.render.apply(c);
          lastWasMultiline = isMultiline(c, before);
          continue;
        }
        // Assume a blank line is needed; replaying the item is cheaper than
        // rendering everything twice up front.
        Context afterBlank = c.log.blankLineAtEnd() ? c : NLN.apply(c);
        Context withSeparator = item.separator.apply(afterBlank);
        int before = withSeparator.log.length();
        Context rendered = item.render.apply(withSeparator);
        boolean multiline = isMultiline(rendered, before);
        if (!multiline && !lastWasMultiline) {
          log.trace("Items {} and {} are single line, replaying without blank line", i - 1, i);
          rendered = item.separator.then(item.render).apply(c);
        }
        c = rendered;
        lastWasMultiline = multiline;
      }
      return c;
    };
  }

  /** {@link #join} when blank lines around multiline items are enabled, plain breaks otherwise. */
  public static Step joinUsingConfig(List<MultilineItem> items) {
    return ctx -> ctx.config.blankLinesAroundNestedMultiline
        ? join(items).apply(ctx)
        : Steps.col(NLN, items, item -> item.render).apply(ctx);
  }

  /**
   * Writes {@code leading}, a break, an extra break via
   * {@code sepNlnConsideringTriviaBefore} when {@code leading} was multiline,
   * and then {@code continuation}.
   */
  public static Step addExtraNewlineIfLeadingWasMultiline(Step leading, Step sepNlnConsideringTriviaBefore, Step continuation) {
    Function<Boolean, Step> rest = multiline ->
        NLN.then(Steps.onlyIf(multiline, sepNlnConsideringTriviaBefore)).then(continuation);
    return Measure.leadingExpressionIsMultiline(leading, rest);
  }

  /**
   * True when the events after {@code eventsBefore} break a line of the
   * item's own. Leading chunks that start with a comment or a break are
   * trivia and do not count.
   */
  static boolean isMultiline(Context ctx, int eventsBefore) {
    return ctx.log.skipExists(
        eventsBefore,
        e -> e.type == EventType.BREAK_LINE || e.type == EventType.BREAK_LINE_IN_STRING_LITERAL,
        MultilineItems::startsWithTrivia);
  }

  private static boolean startsWithTrivia(PersistentVector chunk) {
    if (chunk.count() == 0) {
      return false;
    }
    Event head = (Event) chunk.nth(0);
    return head.isCommentOrDirective()
        || head.type == EventType.BREAK_LINE
        || head.type == EventType.BREAK_LINE_DUE_TO_TRIVIA;
  }
}
