package weft;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;

import static weft.Separators.NLN;
import static weft.Separators.NONE;
import static weft.Separators.SPACE;
import static weft.Steps.INDENT;
import static weft.Steps.UNINDENT;

/**
 * Speculative layout: render a compact form under a width budget and fall
 * back to an expanded form when the compact one breaks a line or runs past
 * the budget or the page.
 */
public class Trials {
  private static final Logger log = LoggerFactory.getLogger(Trials.class);

  /**
   * Renders {@code shortForm} under a budget of {@code maxWidth} columns from
   * {@code startColumn} (the current column when null). If the budget or the
   * page width is exceeded at any point, the short rendering is dropped and
   * {@code longForm} runs against the untouched context instead.
   *
   * <p>Inside a trial that has already failed this returns the context as is.
   */
  public static Step tryCompact(int maxWidth, Integer startColumn, Step shortForm, Step longForm) {
    return ctx -> {
      int pageWidth = ctx.config.pageWidth;
      WriterMode mode = ctx.mode();
      if (mode.isTrial() && mode.hasFailed(pageWidth, ctx.column())) {
        return ctx;
      }
      Context trialCtx = startColumn == null ? ctx.withTrial(maxWidth) : ctx.withTrial(maxWidth, startColumn);
      Context result = shortForm.apply(trialCtx);
      WriterMode resultMode = result.mode();
      if (!resultMode.isTrial() || resultMode.hasFailed(pageWidth, result.column())) {
        if (log.isTraceEnabled()) {
          log.trace("Short form did not fit in {} columns from {}, using long form", maxWidth, trialCtx.mode());
        }
        return longForm.apply(ctx);
      }
      return result.withMode(mode);
    };
  }

  public static Step isShortExpression(int maxWidth, Step shortExpression, Step fallback) {
    return tryCompact(maxWidth, null, shortExpression, fallback);
  }

  public static Step isShortExpressionOrAddIndentAndNewline(int maxWidth, Step expr) {
    return tryCompact(maxWidth, null, expr, Steps.indentSepNlnUnindent(expr));
  }

  public static Step sepSpaceIfShortExpressionOrAddIndentAndNewline(int maxWidth, Step expr) {
    return tryCompact(maxWidth, null, SPACE.then(expr), Steps.indentSepNlnUnindent(expr));
  }

  /** Fits when the expression stays on the current line within the page width. */
  public static Step expressionFitsOnRestOfLine(Step expr, Step fallback) {
    return ctx -> tryCompact(ctx.config.pageWidth, 0, expr, fallback).apply(ctx);
  }

  public static Step isSmallExpression(Size size, Step smallExpression, Step fallback) {
    if (size.isCharacterWidth()) {
      return isShortExpression(size.maxWidth, smallExpression, fallback);
    }
    if (size.items > size.maxItems) {
      return fallback;
    }
    return expressionFitsOnRestOfLine(smallExpression, fallback);
  }

  /**
   * Wraps {@code expr} in the short or long surroundings depending on whether
   * it fits on the rest of the line. Inside a live trial the short form is
   * written directly; the enclosing trial decides.
   */
  public static Step expressionExceedsPageWidth(Step beforeShort, Step afterShort, Step beforeLong, Step afterLong, Step expr) {
    Step shortForm = beforeShort.then(expr).then(afterShort);
    Step longForm = beforeLong.then(expr).then(afterLong);
    return ctx -> {
      WriterMode mode = ctx.mode();
      if (mode.isTrial()) {
        return mode.hasFailed(ctx.config.pageWidth, ctx.column()) ? ctx : shortForm.apply(ctx);
      }
      return tryCompact(ctx.config.pageWidth, 0, shortForm, longForm).apply(ctx);
    };
  }

  public static Step autoIndentAndNlnIfExpressionExceedsPageWidth(Step expr) {
    return expressionExceedsPageWidth(NONE, NONE, INDENT.then(NLN), UNINDENT, expr);
  }

  public static Step sepSpaceOrIndentAndNlnIfExpressionExceedsPageWidth(Step expr) {
    return expressionExceedsPageWidth(SPACE, NONE, INDENT.then(NLN), UNINDENT, expr);
  }

  public static Step sepSpaceOrDoubleIndentAndNlnIfExpressionExceedsPageWidth(Step expr) {
    return expressionExceedsPageWidth(SPACE, NONE, INDENT.then(INDENT).then(NLN), UNINDENT.then(UNINDENT), expr);
  }

  public static Step sepSpaceWhenOrIndentAndNlnIfExpressionExceedsPageWidth(Predicate<Context> addSpace, Step expr) {
    return expressionExceedsPageWidth(Steps.ifElseCtx(addSpace, SPACE, NONE), NONE, INDENT.then(NLN), UNINDENT, expr);
  }

  public static Step autoNlnIfExpressionExceedsPageWidth(Step expr) {
    return expressionExceedsPageWidth(NONE, NONE, NLN, NONE, expr);
  }

  public static Step autoNlnConsideringTriviaIfExpressionExceedsPageWidth(Step sepNlnConsideringTrivia, Step expr) {
    return expressionExceedsPageWidth(NONE, NONE, sepNlnConsideringTrivia, NONE, expr);
  }

  public static Step autoParenthesisIfExpressionExceedsPageWidth(Step expr) {
    return expressionFitsOnRestOfLine(expr, Separators.OPEN_TUPLE.then(expr).then(Separators.CLOSE_TUPLE));
  }

  /** Like {@link Steps#coli}, every item but the first moves to a new line if it does not fit. */
  public static <T> Step colAutoNlnSkip0i(Step separator, Iterable<T> items, BiFunction<Integer, T, Step> f) {
    return Steps.coli(separator, items, (i, item) ->
        i == 0 ? f.apply(i, item) : autoNlnIfExpressionExceedsPageWidth(f.apply(i, item)));
  }

  public static <T> Step colAutoNlnSkip0(Step separator, Iterable<T> items, Function<T, Step> f) {
    return colAutoNlnSkip0i(separator, items, (i, item) -> f.apply(item));
  }

  /** Moves {@code body} to an indented new line unless it uses Stroustrup layout. */
  public static Step autoIndentAndNlnUnlessStroustrup(boolean stroustrupCandidate, Step body) {
    return ctx -> ctx.config.stroustrupStyle && stroustrupCandidate
        ? body.apply(ctx)
        : Steps.indentSepNlnUnindent(body).apply(ctx);
  }

  public static Step autoIndentAndNlnIfExpressionExceedsPageWidthUnlessStroustrup(boolean stroustrupCandidate, Step body) {
    return ctx -> ctx.config.stroustrupStyle && stroustrupCandidate
        ? body.apply(ctx)
        : autoIndentAndNlnIfExpressionExceedsPageWidth(body).apply(ctx);
  }
}
