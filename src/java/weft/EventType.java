package weft;

import clojure.lang.Keyword;

public enum EventType {
  WRITE(Keywords.WRITE),
  BREAK_LINE(Keywords.BREAK_LINE),
  BREAK_LINE_IN_STRING_LITERAL(Keywords.BREAK_LINE_IN_STRING_LITERAL),
  BREAK_LINE_IN_TRIVIA(Keywords.BREAK_LINE_IN_TRIVIA),
  DEFER_UNTIL_BREAK(Keywords.DEFER_UNTIL_BREAK),
  BREAK_LINE_DUE_TO_TRIVIA(Keywords.BREAK_LINE_DUE_TO_TRIVIA),
  INDENT_BY(Keywords.INDENT_BY),
  UNINDENT_BY(Keywords.UNINDENT_BY),
  SET_INDENT(Keywords.SET_INDENT),
  RESTORE_INDENT(Keywords.RESTORE_INDENT),
  SET_ALIGN_COLUMN(Keywords.SET_ALIGN_COLUMN),
  RESTORE_ALIGN_COLUMN(Keywords.RESTORE_ALIGN_COLUMN);

  public final Keyword keyword;

  EventType(Keyword keyword) {
    this.keyword = keyword;
  }

  public boolean hasText() {
    return this == WRITE || this == DEFER_UNTIL_BREAK;
  }

  public boolean hasAmount() {
    return ordinal() >= INDENT_BY.ordinal();
  }
}
