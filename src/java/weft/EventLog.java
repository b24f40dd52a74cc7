package weft;

import clojure.lang.ITransientCollection;
import clojure.lang.PersistentVector;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntPredicate;
import java.util.function.Predicate;

/**
 * Append-only record of every emitted instruction. Each instruction is kept
 * as one chunk holding its normalized events, so queries can tell which
 * events were produced together.
 */
public final class EventLog {
  public static final EventLog EMPTY = new EventLog(PersistentVector.EMPTY, 0);

  private final PersistentVector _chunks;
  private final int _length;

  private EventLog(PersistentVector chunks, int length) {
    _chunks = chunks;
    _length = length;
  }

  public EventLog append(PersistentVector chunk) {
    if (chunk.count() == 0) {
      return this;
    }
    return new EventLog(_chunks.cons(chunk), _length + chunk.count());
  }

  /** Number of events, not chunks. */
  public int length() {
    return _length;
  }

  public PersistentVector chunks() {
    return _chunks;
  }

  public PersistentVector events() {
    ITransientCollection output = PersistentVector.EMPTY.asTransient();
    for (Object chunk : _chunks) {
      for (Object e : (PersistentVector) chunk) {
        output = output.conj(e);
      }
    }
    return (PersistentVector) output.persistent();
  }

  /** Non-empty writes after the most recent break, newest first. */
  public List<String> writesOnLastLine() {
    List<String> writes = new ArrayList<>();
    for (int c = _chunks.count() - 1; c >= 0; c--) {
      PersistentVector chunk = (PersistentVector) _chunks.nth(c);
      for (int i = chunk.count() - 1; i >= 0; i--) {
        Event e = (Event) chunk.nth(i);
        if (e.forcesMultiline()) {
          return writes;
        }
        if (e.isWrite() && !e.text.isEmpty()) {
          writes.add(e.text);
        }
      }
    }
    return writes;
  }

  public String lastWriteOnLastLine() {
    List<String> writes = writesOnLastLine();
    return writes.isEmpty() ? null : writes.get(0);
  }

  public boolean allCharsOnLastLine(IntPredicate predicate) {
    for (String w : writesOnLastLine()) {
      if (!w.chars().allMatch(predicate)) {
        return false;
      }
    }
    return true;
  }

  /**
   * True when the newest meaningful event is a line break. Restores,
   * unindents and empty writes are looked through.
   */
  public boolean lastEventIsBreak() {
    for (int c = _chunks.count() - 1; c >= 0; c--) {
      PersistentVector chunk = (PersistentVector) _chunks.nth(c);
      for (int i = chunk.count() - 1; i >= 0; i--) {
        Event e = (Event) chunk.nth(i);
        switch (e.type) {
          case RESTORE_INDENT:
          case RESTORE_ALIGN_COLUMN:
          case UNINDENT_BY:
            continue;
          case WRITE:
            if (e.text.isEmpty()) {
              continue;
            }
            return false;
          case BREAK_LINE:
          case BREAK_LINE_DUE_TO_TRIVIA:
            return true;
          default:
            return false;
        }
      }
    }
    return false;
  }

  /** True when the log ends in a complete blank line. */
  public boolean blankLineAtEnd() {
    int breaks = 0;
    for (int c = _chunks.count() - 1; c >= 0; c--) {
      PersistentVector chunk = (PersistentVector) _chunks.nth(c);
      for (int i = chunk.count() - 1; i >= 0; i--) {
        Event e = (Event) chunk.nth(i);
        switch (e.type) {
          case BREAK_LINE:
            breaks++;
            continue;
          case INDENT_BY:
          case UNINDENT_BY:
          case SET_INDENT:
          case RESTORE_INDENT:
          case SET_ALIGN_COLUMN:
          case RESTORE_ALIGN_COLUMN:
            continue;
          case WRITE:
            if (e.text.isEmpty()) {
              continue;
            }
            return breaks > 1;
          default:
            return breaks > 1;
        }
      }
    }
    return breaks > 1;
  }

  /**
   * Looks at the events after the first {@code skip} ones, ignores leading
   * chunks accepted by {@code skipChunk} and reports whether any remaining
   * event matches {@code predicate}.
   */
  public boolean skipExists(int skip, Predicate<Event> predicate, Predicate<PersistentVector> skipChunk) {
    if (skip >= _length) {
      return false;
    }
    int seen = 0;
    boolean skipping = true;
    for (Object o : _chunks) {
      PersistentVector chunk = (PersistentVector) o;
      int count = chunk.count();
      if (seen + count <= skip) {
        seen += count;
        continue;
      }
      if (seen < skip) {
        chunk = PersistentVector.create(chunk.subList(skip - seen, count));
      }
      seen += count;
      if (skipping && skipChunk.test(chunk)) {
        continue;
      }
      skipping = false;
      for (Object e : chunk) {
        if (predicate.test((Event) e)) {
          return true;
        }
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return events().toString();
  }
}
