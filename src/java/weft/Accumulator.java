package weft;

import clojure.lang.*;

import java.util.Map;

/**
 * Folds layout events into lines of text. Instances are immutable and every
 * update shares the untouched lines with its predecessor, so a speculative
 * rendering can be dropped simply by forgetting the value.
 */
public final class Accumulator {
  private static final Keyword LINES = Keyword.intern("lines");
  private static final Keyword INDENT = Keyword.intern("indent");
  private static final Keyword ALIGN_COLUMN = Keyword.intern("align-column");
  private static final Keyword PENDING_SUFFIX = Keyword.intern("pending-suffix");
  private static final Keyword MODE = Keyword.intern("mode");
  private static final Keyword COLUMN = Keyword.intern("column");

  public static final Accumulator INITIAL =
      new Accumulator(PersistentVector.create(""), 0, 0, "", WriterMode.NORMAL, 0);

  /** Newest line last. */
  public final PersistentVector lines;
  public final int indent;
  public final int alignColumn;
  public final String pendingSuffix;
  public final WriterMode mode;
  public final int column;

  Accumulator(PersistentVector lines, int indent, int alignColumn, String pendingSuffix, WriterMode mode, int column) {
    this.lines = lines;
    this.indent = indent;
    this.alignColumn = alignColumn;
    this.pendingSuffix = pendingSuffix;
    this.mode = mode;
    this.column = column;
  }

  public String currentLine() {
    return (String) lines.nth(lines.count() - 1);
  }

  public int lineCount() {
    return lines.count();
  }

  public boolean hasPendingSuffix() {
    return !pendingSuffix.isEmpty();
  }

  public Accumulator withMode(WriterMode mode) {
    return mode == this.mode ? this : new Accumulator(lines, indent, alignColumn, pendingSuffix, mode, column);
  }

  /**
   * A fresh measurement accumulator: same indentation, a single line padded
   * to the current column and nothing pending.
   */
  public Accumulator forMeasurement() {
    return new Accumulator(PersistentVector.create(Util.spaces(column)), indent, alignColumn, "", WriterMode.MEASUREMENT, column);
  }

  public Accumulator apply(int pageWidth, Event event) {
    if (!mode.isTrial()) {
      return update(event);
    }
    if (mode.hasConfirmedOverflow()) {
      return this;
    }
    boolean forcesMultiline = event.forcesMultiline() || (event.isWrite() && hasPendingSuffix());
    WriterMode next = mode.confirmAll(pageWidth, column, forcesMultiline);
    if (next.hasConfirmedOverflow()) {
      return withMode(next);
    }
    return update(event);
  }

  private Accumulator update(Event event) {
    switch (event.type) {
      case BREAK_LINE:
      case BREAK_LINE_DUE_TO_TRIVIA:
        return breakLine();
      case BREAK_LINE_IN_STRING_LITERAL:
        return new Accumulator(lines.cons(""), indent, alignColumn, pendingSuffix, mode, 0);
      case BREAK_LINE_IN_TRIVIA: {
        PersistentVector trimmed = replaceCurrentLine(currentLine().stripTrailing());
        return new Accumulator(trimmed.cons(""), indent, alignColumn, pendingSuffix, mode, 0);
      }
      case WRITE:
        return new Accumulator(replaceCurrentLine(currentLine() + event.text), indent, alignColumn, pendingSuffix, mode,
            column + event.text.length());
      case DEFER_UNTIL_BREAK:
        return new Accumulator(lines, indent, alignColumn, event.text, mode, column);
      case INDENT_BY: {
        int x = event.amount;
        int nextIndent = alignColumn >= indent + x ? alignColumn + x : indent + x;
        return new Accumulator(lines, nextIndent, alignColumn, pendingSuffix, mode, column);
      }
      case UNINDENT_BY:
        return new Accumulator(lines, Math.max(alignColumn, indent - event.amount), alignColumn, pendingSuffix, mode, column);
      case SET_INDENT:
      case RESTORE_INDENT:
        return new Accumulator(lines, event.amount, alignColumn, pendingSuffix, mode, column);
      case SET_ALIGN_COLUMN:
      case RESTORE_ALIGN_COLUMN:
        return new Accumulator(lines, indent, event.amount, pendingSuffix, mode, column);
      default:
        throw new IllegalArgumentException("Unknown event: " + event);
    }
  }

  private Accumulator breakLine() {
    int nextIndent = Math.max(indent, alignColumn);
    PersistentVector finished = replaceCurrentLine((currentLine() + pendingSuffix).stripTrailing());
    return new Accumulator(finished.cons(Util.spaces(nextIndent)), nextIndent, alignColumn, "", mode, nextIndent);
  }

  private PersistentVector replaceCurrentLine(String line) {
    return lines.assocN(lines.count() - 1, line);
  }

  public IPersistentMap inspect() {
    return PersistentArrayMap.create(Map.of(
        LINES, lines,
        INDENT, indent,
        ALIGN_COLUMN, alignColumn,
        PENDING_SUFFIX, pendingSuffix,
        MODE, mode.inspect(),
        COLUMN, column
    ));
  }

  @Override
  public String toString() {
    return inspect().toString();
  }
}
