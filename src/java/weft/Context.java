package weft;

import clojure.lang.*;

import java.util.List;

/**
 * Layout state of one document. Every operation returns a new context and
 * leaves the receiver untouched.
 */
public final class Context {

  public static Context create(LayoutConfig config) {
    return new Context(config, Accumulator.INITIAL, EventLog.EMPTY, PersistentArrayMap.EMPTY, PersistentArrayMap.EMPTY, null);
  }

  public static Context create(LayoutConfig config, List<TriviaInstruction> trivia, SourceText sourceText) {
    IPersistentMap before = PersistentArrayMap.EMPTY;
    IPersistentMap after = PersistentArrayMap.EMPTY;
    for (TriviaInstruction instruction : trivia) {
      if (instruction.before) {
        before = conjByType(before, instruction);
      } else {
        after = conjByType(after, instruction);
      }
    }
    return new Context(config, Accumulator.INITIAL, EventLog.EMPTY, before, after, sourceText);
  }

  private static IPersistentMap conjByType(IPersistentMap byType, TriviaInstruction instruction) {
    IPersistentVector existing = (IPersistentVector) byType.valAt(instruction.nodeType, PersistentVector.EMPTY);
    return byType.assoc(instruction.nodeType, existing.cons(instruction));
  }

  //
  //

  public final LayoutConfig config;
  public final Accumulator accumulator;
  public final EventLog log;
  public final IPersistentMap triviaBefore;
  public final IPersistentMap triviaAfter;
  public final SourceText sourceText;

  private Context(LayoutConfig config,
                  Accumulator accumulator,
                  EventLog log,
                  IPersistentMap triviaBefore,
                  IPersistentMap triviaAfter,
                  SourceText sourceText) {
    this.config = config;
    this.accumulator = accumulator;
    this.log = log;
    this.triviaBefore = triviaBefore;
    this.triviaAfter = triviaAfter;
    this.sourceText = sourceText;
  }

  public int column() {
    return accumulator.column;
  }

  public WriterMode mode() {
    return accumulator.mode;
  }

  public boolean isMeasuring() {
    return accumulator.mode.isMeasurement();
  }

  public boolean hasPendingSuffix() {
    return accumulator.hasPendingSuffix();
  }

  /** True once any outstanding trial budget has confirmed an overflow. */
  public boolean hasConfirmedOverflow() {
    return accumulator.mode.hasConfirmedOverflow();
  }

  /** True when any outstanding trial budget is confirmed or already exceeded here. */
  public boolean isTrialFailed() {
    return accumulator.mode.hasFailed(config.pageWidth, accumulator.column);
  }

  public Context emit(Event event) {
    PersistentVector events = Events.normalize(event);
    Accumulator acc = accumulator;
    for (Object e : events) {
      acc = acc.apply(config.pageWidth, (Event) e);
    }
    return new Context(config, acc, log.append(events), triviaBefore, triviaAfter, sourceText);
  }

  public Context withAccumulator(Accumulator accumulator) {
    return new Context(config, accumulator, log, triviaBefore, triviaAfter, sourceText);
  }

  public Context withMode(WriterMode mode) {
    return withAccumulator(accumulator.withMode(mode));
  }

  /**
   * Independent context for measuring a rendering: a single line padded to
   * the current column, an empty log and, unless {@code keepPageWidth}, an
   * unbounded page width.
   */
  public Context withMeasurement(boolean keepPageWidth) {
    LayoutConfig measureConfig = keepPageWidth ? config : config.withUnlimitedPageWidth();
    return new Context(measureConfig, accumulator.forMeasurement(), EventLog.EMPTY, triviaBefore, triviaAfter, sourceText);
  }

  public Context withTrial(int maxWidth, int startColumn) {
    return withMode(accumulator.mode.push(new TrialBudget(maxWidth, startColumn, false)));
  }

  public Context withTrial(int maxWidth) {
    return withTrial(maxWidth, accumulator.column);
  }

  public boolean hasContentBefore(Object nodeType, Range range) {
    return !triviaFor(triviaBefore, nodeType, range).isEmpty();
  }

  public boolean hasContentAfter(Object nodeType, Range range) {
    return !triviaFor(triviaAfter, nodeType, range).isEmpty();
  }

  static PersistentVector triviaFor(IPersistentMap byType, Object nodeType, Range range) {
    IPersistentVector all = (IPersistentVector) byType.valAt(nodeType);
    if (all == null) {
      return PersistentVector.EMPTY;
    }
    PersistentVector matching = PersistentVector.EMPTY;
    for (ISeq s = all.seq(); s != null; s = s.next()) {
      TriviaInstruction instruction = (TriviaInstruction) s.first();
      if (instruction.range.equals(range)) {
        matching = matching.cons(instruction);
      }
    }
    return matching;
  }

  /** Source text covered by the range, or null when no source is attached. */
  public String fromSourceText(Range range) {
    return sourceText == null ? null : sourceText.contentAt(range);
  }

  /** Writes out a still pending suffix. */
  public Context finalizeModel() {
    return hasPendingSuffix() ? emit(Event.write(accumulator.pendingSuffix)) : this;
  }

  /**
   * Final text of the document. Leading blank lines are dropped unless a
   * selection is being formatted.
   */
  public String dump(boolean isSelection) {
    if (accumulator.mode.isTrial()) {
      throw new LayoutException("Trial still outstanding when the document was finalized", accumulator.mode);
    }
    Context ctx = finalizeModel();
    PersistentVector lines = ctx.accumulator.lines;
    int last = lines.count() - 1;
    lines = lines.assocN(last, ((String) lines.nth(last)).stripTrailing());
    int first = 0;
    if (!isSelection) {
      while (first < last && ((String) lines.nth(first)).isEmpty()) {
        first++;
      }
    }
    StringBuilder sb = new StringBuilder();
    for (int i = first; i <= last; i++) {
      if (i > first) {
        sb.append(config.newline);
      }
      sb.append((String) lines.nth(i));
    }
    return sb.toString();
  }

  public String dump() {
    return dump(false);
  }

  @Override
  public String toString() {
    return accumulator.toString();
  }
}
