package weft;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.IntFunction;
import java.util.function.Predicate;

/**
 * Basic layout steps and the ways to combine them.
 */
public class Steps {
  private static final Logger log = LoggerFactory.getLogger(Steps.class);

  public static Step emit(Event event) {
    return ctx -> ctx.emit(event);
  }

  public static Step write(String text) {
    return ctx -> ctx.emit(Event.write(text));
  }

  public static Step str(Object o) {
    return write(String.valueOf(o));
  }

  public static final Step INDENT = ctx -> ctx.emit(Event.indentBy(ctx.config.indentSize));

  public static final Step UNINDENT = ctx -> ctx.emit(Event.unindentBy(ctx.config.indentSize));

  public static Step incrIndent(int amount) {
    return emit(Event.indentBy(amount));
  }

  public static Step decrIndent(int amount) {
    return emit(Event.unindentBy(amount));
  }

  /** Writes the text, starting a new line first unless the current one is still blank. */
  public static Step writeOnFreshLine(String text) {
    return ctx -> {
      Context c = ctx.log.allCharsOnLastLine(Character::isWhitespace) ? ctx : ctx.emit(Event.BREAK_LINE);
      return c.emit(Event.write(text));
    };
  }

  //
  // Indentation scopes
  //

  /**
   * Runs {@code body} with the alignment floor (and optionally the indent) at
   * an absolute column, then restores both. The restores are emitted even if
   * {@code body} ran into an overflowing trial.
   */
  public static Step atIndentLevel(boolean alsoSetIndent, int level, Step body) {
    if (level < 0) {
      throw new IllegalArgumentException("The indent level cannot be negative: " + level);
    }
    return ctx -> {
      int oldIndent = ctx.accumulator.indent;
      int oldAlignColumn = ctx.accumulator.alignColumn;
      Context c = ctx.emit(Event.setAlignColumn(level));
      if (alsoSetIndent) {
        c = c.emit(Event.setIndent(level));
      }
      c = body.apply(c);
      return c.emit(Event.restoreAlignColumn(oldAlignColumn)).emit(Event.restoreIndent(oldIndent));
    };
  }

  /** Next lines inside {@code body} start at least at the current column. */
  public static Step atCurrentColumn(Step body) {
    return ctx -> atIndentLevel(false, ctx.column(), body).apply(ctx);
  }

  /** Like {@link #atCurrentColumn} but indents relative to the current column. */
  public static Step atCurrentColumnIndent(Step body) {
    return ctx -> atIndentLevel(true, ctx.column(), body).apply(ctx);
  }

  /** Aligns {@code body} at the column where {@code prepend} started. */
  public static Step atCurrentColumnWithPrepend(Step prepend, Step body) {
    return ctx -> {
      int column = ctx.column();
      return prepend.then(atIndentLevel(false, column, body)).apply(ctx);
    };
  }

  public static Step indentSepNlnUnindent(Step body) {
    return INDENT.then(Separators.NLN).then(body).then(UNINDENT);
  }

  /**
   * Keeps an application argument right of the alignment floor. When the
   * current column has not passed the floor, the separator is replaced by
   * enough spaces to reach one indent past it.
   */
  public static Step indentIfNeeded(Step separator) {
    return ctx -> {
      int savedColumn = ctx.accumulator.alignColumn;
      if (savedColumn >= ctx.column()) {
        int missingSpaces = (savedColumn - ctx.finalizeModel().column()) + ctx.config.indentSize;
        return atIndentLevel(true, savedColumn, write(Util.spaces(missingSpaces))).apply(ctx);
      }
      return separator.apply(ctx);
    };
  }

  /** Pads with spaces up to the target column, whatever the line holds. */
  public static Step addFixedSpaces(int targetColumn) {
    return ctx -> {
      int delta = targetColumn - ctx.column();
      return delta > 0 ? rep(delta, write(" ")).apply(ctx) : ctx;
    };
  }

  //
  // Conditionals
  //

  public static Step ifElse(boolean condition, Step whenTrue, Step whenFalse) {
    return condition ? whenTrue : whenFalse;
  }

  public static Step ifElseCtx(Predicate<Context> condition, Step whenTrue, Step whenFalse) {
    return ctx -> condition.test(ctx) ? whenTrue.apply(ctx) : whenFalse.apply(ctx);
  }

  public static Step onlyIf(boolean condition, Step step) {
    return condition ? step : Step.IDENTITY;
  }

  public static Step onlyIfCtx(Predicate<Context> condition, Step step) {
    return ctx -> condition.test(ctx) ? step.apply(ctx) : ctx;
  }

  public static Step onlyIfNot(boolean condition, Step step) {
    return onlyIf(!condition, step);
  }

  public static Step whenShortIndent(Step step) {
    return ctx -> ctx.config.indentSize < 3 ? step.apply(ctx) : ctx;
  }

  public static Step ifStroustrupElse(Step whenStroustrup, Step otherwise) {
    return ifElseCtx(ctx -> ctx.config.stroustrupStyle, whenStroustrup, otherwise);
  }

  public static Step ifStroustrup(Step step) {
    return ifElseCtx(ctx -> ctx.config.stroustrupStyle, step, Step.IDENTITY);
  }

  public static Step ifAlignBrackets(Step aligned, Step otherwise) {
    return ifElseCtx(ctx -> ctx.config.alignMultilineBrackets, aligned, otherwise);
  }

  public static Step rep(int n, Step step) {
    return ctx -> {
      Context c = ctx;
      for (int i = 0; i < n; i++) {
        c = step.apply(c);
      }
      return c;
    };
  }

  //
  // Collections
  //

  /** Applies {@code f} to every item, with {@code separator} between consecutive items. */
  public static <T> Step col(Step separator, Iterable<T> items, Function<T, Step> f) {
    return coli(separator, items, (i, item) -> f.apply(item));
  }

  public static <T> Step coli(Step separator, Iterable<T> items, BiFunction<Integer, T, Step> f) {
    return colii(i -> separator, items, f);
  }

  /** Like {@link #coli}, the separator also gets the index of the item that follows it. */
  public static <T> Step colii(IntFunction<Step> separator, Iterable<T> items, BiFunction<Integer, T, Step> f) {
    return ctx -> {
      Context c = ctx;
      int i = 0;
      for (T item : items) {
        if (i > 0) {
          c = separator.apply(i).apply(c);
        }
        c = f.apply(i, item).apply(c);
        i++;
      }
      return c;
    };
  }

  /** Like {@link #col}, the separator also gets the item that follows it. */
  public static <T> Step colEx(Function<T, Step> separator, Iterable<T> items, Function<T, Step> f) {
    return ctx -> {
      Context c = ctx;
      boolean first = true;
      for (T item : items) {
        if (!first) {
          c = separator.apply(item).apply(c);
        }
        first = false;
        c = f.apply(item).apply(c);
      }
      return c;
    };
  }

  public static <T> Step colPost(Step post, Step separator, Iterable<T> items, Function<T, Step> f) {
    return isEmpty(items) ? Step.IDENTITY : ctx -> post.apply(col(separator, items, f).apply(ctx));
  }

  public static <T> Step colPre(Step pre, Step separator, Iterable<T> items, Function<T, Step> f) {
    return isEmpty(items) ? Step.IDENTITY : ctx -> col(separator, items, f).apply(pre.apply(ctx));
  }

  public static <T> Step colPreEx(Step pre, Function<T, Step> separator, Iterable<T> items, Function<T, Step> f) {
    return isEmpty(items) ? Step.IDENTITY : ctx -> colEx(separator, items, f).apply(pre.apply(ctx));
  }

  /** Like {@link #col}, surrounded by {@code start} and {@code end} when there is more than one item. */
  public static <T> Step colSurr(Step start, Step end, Step separator, List<T> items, Function<T, Step> f) {
    if (items.isEmpty()) {
      return Step.IDENTITY;
    }
    Step body = col(separator, items, f);
    return items.size() > 1 ? start.then(body).then(end) : body;
  }

  private static boolean isEmpty(Iterable<?> items) {
    return !items.iterator().hasNext();
  }

  //
  // Optional values
  //

  /** When {@code value} is non-null, applies {@code f} to it followed by {@code after}. */
  public static <T> Step opt(Step after, T value, Function<T, Step> f) {
    return value == null ? Step.IDENTITY : ctx -> after.apply(f.apply(value).apply(ctx));
  }

  public static <T> Step optSingle(Function<T, Step> f, T value) {
    return value == null ? Step.IDENTITY : f.apply(value);
  }

  public static <T> Step optPre(Step before, Step after, T value, Function<T, Step> f) {
    return value == null ? Step.IDENTITY : ctx -> after.apply(f.apply(value).apply(before.apply(ctx)));
  }

  //
  // Debugging
  //

  /** Logs the text laid out so far at debug level and passes the context on. */
  public static final Step DUMP_AND_CONTINUE = ctx -> {
    if (log.isDebugEnabled()) {
      StringBuilder sb = new StringBuilder();
      for (Object line : ctx.finalizeModel().accumulator.lines) {
        if (sb.length() > 0) {
          sb.append('\n');
        }
        sb.append(line);
      }
      log.debug("Current layout ({}): {}", ctx.mode().inspect(), Util.stringify(sb.toString()));
    }
    return ctx;
  };
}
