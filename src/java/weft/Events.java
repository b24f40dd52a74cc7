package weft;

import clojure.lang.ITransientCollection;
import clojure.lang.PersistentVector;

public class Events {

  /**
   * Splits a write that contains line breaks into primitive writes separated
   * by break events. Any other event is returned as a singleton.
   */
  public static PersistentVector normalize(Event event) {
    if (!event.isWrite() || event.text.indexOf('\n') < 0) {
      return PersistentVector.create(event);
    }
    Event lineBreak = event.isCommentOrDirective()
        ? Event.BREAK_LINE_IN_TRIVIA
        : Event.BREAK_LINE_IN_STRING_LITERAL;
    String[] parts = event.text.replace("\r", "").split("\n", -1);
    ITransientCollection output = PersistentVector.EMPTY.asTransient();
    for (int i = 0; i < parts.length; i++) {
      if (i > 0) {
        output = output.conj(lineBreak);
      }
      output = output.conj(Event.write(parts[i]));
    }
    return (PersistentVector) output.persistent();
  }

  public static boolean isMultiline(Iterable<?> events) {
    for (Object e : events) {
      EventType type = ((Event) e).type;
      if (type == EventType.BREAK_LINE || type == EventType.BREAK_LINE_DUE_TO_TRIVIA) {
        return true;
      }
    }
    return false;
  }
}
