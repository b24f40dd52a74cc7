package weft;

import clojure.lang.Keyword;
import clojure.lang.PersistentVector;

import static weft.Separators.NLN_FOR_TRIVIA;
import static weft.Separators.NONE;
import static weft.Separators.SPACE;
import static weft.Steps.ifElse;
import static weft.Steps.write;

/**
 * Splices comments, directives and blank lines from the original source into
 * the layout when a node is entered or left. Trivia whose range matches no
 * laid out node is never looked up and so is dropped.
 */
public class TriviaPrinter {

  public static Step print(TriviaContent content) {
    return ctx -> {
      String currentLine = ctx.accumulator.currentLine();
      boolean addNewline = !Util.isBlank(currentLine);
      boolean addSpace = !currentLine.isEmpty() && currentLine.charAt(currentLine.length() - 1) != ' ';
      Keyword kind = content.kind;
      if (kind == Keywords.LINE_COMMENT_AFTER_SOURCE) {
        return ctx.emit(Event.deferUntilBreak(addSpace ? " " + content.text : content.text));
      } else if (kind == Keywords.BLOCK_COMMENT) {
        return ifElse(content.newlineBefore && addNewline, NLN_FOR_TRIVIA, NONE)
            .then(SPACE)
            .then(write(content.text))
            .then(SPACE)
            .then(ifElse(content.newlineAfter, NLN_FOR_TRIVIA, NONE))
            .apply(ctx);
      } else if (kind == Keywords.NEWLINE) {
        return ifElse(addNewline, NLN_FOR_TRIVIA.then(NLN_FOR_TRIVIA), NLN_FOR_TRIVIA).apply(ctx);
      } else if (kind == Keywords.DIRECTIVE || kind == Keywords.COMMENT_ON_SINGLE_LINE) {
        return ifElse(addNewline, NLN_FOR_TRIVIA, NONE)
            .then(write(content.text))
            .then(NLN_FOR_TRIVIA)
            .apply(ctx);
      } else {
        throw new IllegalArgumentException("Invalid trivia: " + content);
      }
    };
  }

  public static Step printInstructions(Iterable<?> instructions) {
    return Steps.col(NONE, instructions, instruction -> print(((TriviaInstruction) instruction).content));
  }

  /** Prints the trivia recorded in front of the node with this type and range. */
  public static Step enterNode(Keyword nodeType, Range range) {
    return ctx -> {
      PersistentVector matching = Context.triviaFor(ctx.triviaBefore, nodeType, range);
      return matching.count() == 0 ? ctx : printInstructions(matching).apply(ctx);
    };
  }

  /** Prints the trivia recorded after the node with this type and range. */
  public static Step leaveNode(Keyword nodeType, Range range) {
    return ctx -> {
      PersistentVector matching = Context.triviaFor(ctx.triviaAfter, nodeType, range);
      return matching.count() == 0 ? ctx : printInstructions(matching).apply(ctx);
    };
  }

  /** Wraps a node's layout between its leading and trailing trivia. */
  public static Step genTrivia(Keyword nodeType, Range range, Step body) {
    return enterNode(nodeType, range).then(body).then(leaveNode(nodeType, range));
  }

  /** Runs {@code separator} unless the node already has trivia in front of it. */
  public static Step sepConsideringTriviaContentBefore(Step separator, Keyword nodeType, Range range) {
    return ctx -> ctx.hasContentBefore(nodeType, range) ? ctx : separator.apply(ctx);
  }

  public static Step sepNlnConsideringTriviaContentBeforeFor(Keyword nodeType, Range range) {
    return sepConsideringTriviaContentBefore(Separators.NLN, nodeType, range);
  }
}
