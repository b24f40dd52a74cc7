package weft;

import clojure.lang.Keyword;

public interface Keywords {
  /** Event kinds **/
  Keyword WRITE = Keyword.intern("write");
  Keyword BREAK_LINE = Keyword.intern("break-line");
  Keyword BREAK_LINE_IN_STRING_LITERAL = Keyword.intern("break-line-in-string-literal");
  Keyword BREAK_LINE_IN_TRIVIA = Keyword.intern("break-line-in-trivia");
  Keyword DEFER_UNTIL_BREAK = Keyword.intern("defer-until-break");
  Keyword BREAK_LINE_DUE_TO_TRIVIA = Keyword.intern("break-line-due-to-trivia");
  Keyword INDENT_BY = Keyword.intern("indent-by");
  Keyword UNINDENT_BY = Keyword.intern("unindent-by");
  Keyword SET_INDENT = Keyword.intern("set-indent");
  Keyword RESTORE_INDENT = Keyword.intern("restore-indent");
  Keyword SET_ALIGN_COLUMN = Keyword.intern("set-align-column");
  Keyword RESTORE_ALIGN_COLUMN = Keyword.intern("restore-align-column");

  /** Writer modes **/
  Keyword NORMAL = Keyword.intern("normal");
  Keyword MEASUREMENT = Keyword.intern("measurement");
  Keyword TRIAL = Keyword.intern("trial");

  /** Trivia kinds **/
  Keyword LINE_COMMENT_AFTER_SOURCE = Keyword.intern("line-comment-after-source");
  Keyword BLOCK_COMMENT = Keyword.intern("block-comment");
  Keyword COMMENT_ON_SINGLE_LINE = Keyword.intern("comment-on-single-line");
  Keyword NEWLINE = Keyword.intern("newline");
  Keyword DIRECTIVE = Keyword.intern("directive");

  /** Inspection keys **/
  Keyword MAX_WIDTH = Keyword.intern("max-width");
  Keyword START_COLUMN = Keyword.intern("start-column");
  Keyword CONFIRMED_OVERFLOW = Keyword.intern("confirmed-overflow");
}
