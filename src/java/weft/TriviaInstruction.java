package weft;

import clojure.lang.Keyword;

/**
 * Trivia attached to the node with the given type tag and range, printed when
 * the layout enters ({@code before}) or leaves that node.
 */
public final class TriviaInstruction {
  public final Keyword nodeType;
  public final Range range;
  public final TriviaContent content;
  public final boolean before;

  public TriviaInstruction(Keyword nodeType, Range range, TriviaContent content, boolean before) {
    this.nodeType = nodeType;
    this.range = range;
    this.content = content;
    this.before = before;
  }

  @Override
  public String toString() {
    return (before ? "before " : "after ") + nodeType + range + " " + content;
  }
}
