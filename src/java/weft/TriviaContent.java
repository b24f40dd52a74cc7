package weft;

import clojure.lang.*;

/**
 * Payload of a trivia instruction: a comment, a directive or a blank line
 * marker taken from the original source.
 */
public final class TriviaContent {
  public static final TriviaContent NEWLINE = new TriviaContent(Keywords.NEWLINE, "", false, false);

  public static TriviaContent lineCommentAfterSource(String comment) {
    return new TriviaContent(Keywords.LINE_COMMENT_AFTER_SOURCE, comment, false, false);
  }

  public static TriviaContent blockComment(String comment, boolean newlineBefore, boolean newlineAfter) {
    return new TriviaContent(Keywords.BLOCK_COMMENT, comment, newlineBefore, newlineAfter);
  }

  public static TriviaContent commentOnSingleLine(String comment) {
    return new TriviaContent(Keywords.COMMENT_ON_SINGLE_LINE, comment, false, false);
  }

  public static TriviaContent directive(String directive) {
    return new TriviaContent(Keywords.DIRECTIVE, directive, false, false);
  }

  public final Keyword kind;
  public final String text;
  public final boolean newlineBefore;
  public final boolean newlineAfter;

  private TriviaContent(Keyword kind, String text, boolean newlineBefore, boolean newlineAfter) {
    this.kind = kind;
    this.text = text;
    this.newlineBefore = newlineBefore;
    this.newlineAfter = newlineAfter;
  }

  public IPersistentVector inspect() {
    if (kind == Keywords.BLOCK_COMMENT) {
      return PersistentVector.create(kind, text, newlineBefore, newlineAfter);
    }
    return kind == Keywords.NEWLINE ? PersistentVector.create(kind) : PersistentVector.create(kind, text);
  }

  @Override
  public String toString() {
    return inspect().toString();
  }
}
