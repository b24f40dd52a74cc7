package weft;

import clojure.lang.IPersistentVector;
import clojure.lang.PersistentVector;

import java.util.Objects;

public final class Event {
  public static final Event BREAK_LINE = new Event(EventType.BREAK_LINE, null, 0);
  public static final Event BREAK_LINE_IN_STRING_LITERAL = new Event(EventType.BREAK_LINE_IN_STRING_LITERAL, null, 0);
  public static final Event BREAK_LINE_IN_TRIVIA = new Event(EventType.BREAK_LINE_IN_TRIVIA, null, 0);
  public static final Event BREAK_LINE_DUE_TO_TRIVIA = new Event(EventType.BREAK_LINE_DUE_TO_TRIVIA, null, 0);

  private static final String[] COMMENT_OR_DIRECTIVE_PREFIXES = {"//", "#if", "#else", "#endif", "(*"};

  public static Event write(String text) {
    return new Event(EventType.WRITE, Objects.requireNonNull(text), 0);
  }

  public static Event deferUntilBreak(String text) {
    return new Event(EventType.DEFER_UNTIL_BREAK, Objects.requireNonNull(text), 0);
  }

  public static Event indentBy(int amount) {
    return new Event(EventType.INDENT_BY, null, amount);
  }

  public static Event unindentBy(int amount) {
    return new Event(EventType.UNINDENT_BY, null, amount);
  }

  public static Event setIndent(int level) {
    return new Event(EventType.SET_INDENT, null, level);
  }

  public static Event restoreIndent(int level) {
    return new Event(EventType.RESTORE_INDENT, null, level);
  }

  public static Event setAlignColumn(int column) {
    return new Event(EventType.SET_ALIGN_COLUMN, null, column);
  }

  public static Event restoreAlignColumn(int column) {
    return new Event(EventType.RESTORE_ALIGN_COLUMN, null, column);
  }

  //
  //

  public final EventType type;
  public final String text;
  public final int amount;

  private Event(EventType type, String text, int amount) {
    this.type = type;
    this.text = text;
    this.amount = amount;
  }

  public boolean isWrite() {
    return type == EventType.WRITE;
  }

  /**
   * True for every event that ends the current line, regardless of how the
   * finished line is trimmed.
   */
  public boolean isBreak() {
    switch (type) {
      case BREAK_LINE:
      case BREAK_LINE_DUE_TO_TRIVIA:
      case BREAK_LINE_IN_STRING_LITERAL:
      case BREAK_LINE_IN_TRIVIA:
        return true;
      default:
        return false;
    }
  }

  /**
   * Breaks that a speculative rendering treats as "this no longer fits on one
   * line". Breaks inside trivia only re-flow text that was already multiline.
   */
  public boolean forcesMultiline() {
    switch (type) {
      case BREAK_LINE:
      case BREAK_LINE_DUE_TO_TRIVIA:
      case BREAK_LINE_IN_STRING_LITERAL:
        return true;
      default:
        return false;
    }
  }

  public boolean isCommentOrDirective() {
    if (type != EventType.WRITE) {
      return false;
    }
    for (String prefix : COMMENT_OR_DIRECTIVE_PREFIXES) {
      if (text.startsWith(prefix)) {
        return true;
      }
    }
    return false;
  }

  public boolean isEmptyWrite() {
    return type == EventType.WRITE && text.isEmpty();
  }

  public IPersistentVector inspect() {
    if (type.hasText()) {
      return PersistentVector.create(type.keyword, text);
    } else if (type.hasAmount()) {
      return PersistentVector.create(type.keyword, amount);
    } else {
      return PersistentVector.create(type.keyword);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Event)) {
      return false;
    }
    Event other = (Event) o;
    return type == other.type && amount == other.amount && Objects.equals(text, other.text);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, text, amount);
  }

  @Override
  public String toString() {
    return inspect().toString();
  }
}
