package weft;

import clojure.lang.PersistentVector;

import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Lookahead without side effects: steps are run against an independent
 * measurement context whose result is inspected and then dropped.
 */
public class Measure {

  /** Runs {@code step} on a measurement copy of {@code ctx}; {@code ctx} itself is not affected. */
  public static Context measured(Step step, boolean keepPageWidth, Context ctx) {
    return step.apply(ctx.withMeasurement(keepPageWidth));
  }

  public static Accumulator run(Step step, boolean keepPageWidth, Context ctx) {
    return measured(step, keepPageWidth, ctx).accumulator;
  }

  /**
   * True when {@code step} would break a line or run past the page width.
   * Always false while already measuring.
   */
  public static boolean futureNlnCheck(Step step, Context ctx) {
    if (ctx.isMeasuring()) {
      return false;
    }
    Context after = measured(step, true, ctx);
    return Events.isMultiline(after.log.events()) || after.column() > ctx.config.pageWidth;
  }

  /** True when {@code step} would add a line, or grow the line by more than {@code maxWidth}. */
  public static boolean exceedsWidth(int maxWidth, Step step, Context ctx) {
    Context before = ctx.withMeasurement(true);
    int linesBefore = before.accumulator.lineCount();
    int columnBefore = before.column();
    Context after = step.apply(before);
    return after.accumulator.lineCount() > linesBefore
        || after.column() - columnBefore > maxWidth
        || columnBefore > ctx.config.pageWidth;
  }

  /** Line and column before and after a leading step. */
  public static final class Position {
    public final int lineCount;
    public final int column;

    Position(Context ctx) {
      this.lineCount = ctx.accumulator.lineCount();
      this.column = ctx.column();
    }
  }

  /** Runs {@code leading}, then the continuation built from the positions before and after it. */
  public static Step leadingExpressionResult(Step leading, BiFunction<Position, Position, Step> continuation) {
    return ctx -> {
      Position before = new Position(ctx);
      Context afterLeading = leading.apply(ctx);
      return continuation.apply(before, new Position(afterLeading)).apply(afterLeading);
    };
  }

  /** Tells the continuation whether {@code leading} broke a line or grew the line by more than {@code threshold}. */
  public static Step leadingExpressionLong(int threshold, Step leading, Function<Boolean, Step> continuation) {
    return leadingExpressionResult(leading, (before, after) ->
        continuation.apply(after.lineCount > before.lineCount || after.column - before.column > threshold));
  }

  /**
   * Tells the continuation whether {@code leading} broke a line of its own.
   * Breaks that belong to a comment or blank line in front of it do not count.
   */
  public static Step leadingExpressionIsMultiline(Step leading, Function<Boolean, Step> continuation) {
    return ctx -> {
      int eventsBefore = ctx.log.length();
      Context afterLeading = leading.apply(ctx);
      boolean multiline = afterLeading.log.skipExists(
          eventsBefore,
          e -> e.type == EventType.BREAK_LINE,
          Measure::isTriviaOnlyChunk);
      return continuation.apply(multiline).apply(afterLeading);
    };
  }

  private static boolean isTriviaOnlyChunk(PersistentVector chunk) {
    if (chunk.count() == 1) {
      Event e = (Event) chunk.nth(0);
      return e.isCommentOrDirective() || e.type == EventType.BREAK_LINE || e.isEmptyWrite();
    }
    return isEmptyDirectiveBlock(chunk);
  }

  /** {@code #if FOO}, nothing but blank lines, {@code #endif}. */
  private static boolean isEmptyDirectiveBlock(PersistentVector chunk) {
    int n = chunk.count();
    if (n < 2 || !((Event) chunk.nth(0)).isCommentOrDirective() || !((Event) chunk.nth(n - 1)).isCommentOrDirective()) {
      return false;
    }
    for (int i = 1; i < n - 1; i++) {
      Event e = (Event) chunk.nth(i);
      if (e.type != EventType.BREAK_LINE_IN_STRING_LITERAL && !e.isEmptyWrite()) {
        return false;
      }
    }
    return true;
  }
}
