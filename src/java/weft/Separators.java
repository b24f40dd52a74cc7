package weft;

import static weft.Steps.str;
import static weft.Steps.write;

/**
 * Separator and bracket tokens. None of them makes layout decisions beyond
 * reading the spacing options and looking at the current line.
 */
public class Separators {
  public static final Step NONE = Step.IDENTITY;
  public static final Step DOT = write(".");

  /** A space, unless the line is empty or already ends in whitespace. */
  public static final Step SPACE = ctx -> {
    if (ctx.isMeasuring()) {
      return ctx.emit(Event.write(" "));
    }
    String last = ctx.log.lastWriteOnLastLine();
    if (last == null || last.endsWith(" ") || last.endsWith("\n")) {
      return ctx;
    }
    return ctx.emit(Event.write(" "));
  };

  public static final Step NLN = Steps.emit(Event.BREAK_LINE);

  /** A break introduced by trivia rather than by the laid out code itself. */
  public static final Step NLN_FOR_TRIVIA = Steps.emit(Event.BREAK_LINE_DUE_TO_TRIVIA);

  public static final Step NLN_UNLESS_LAST_EVENT_IS_NEWLINE = ctx ->
      ctx.log.lastEventIsBreak() ? ctx : NLN.apply(ctx);

  public static final Step NLN_UNLESS_LAST_EVENT_IS_NEWLINE_OR_STROUSTRUP = ctx ->
      ctx.log.lastEventIsBreak() || ctx.config.stroustrupStyle ? ctx : NLN.apply(ctx);

  public static final Step STAR = SPACE.then(write("* "));
  public static final Step STAR_FIXED = write("* ");
  public static final Step EQ = write(" =");
  public static final Step EQ_FIXED = write("=");
  public static final Step ARROW = write(" -> ");
  public static final Step ARROW_FIXED = write("->");
  public static final Step ARROW_REV = write(" <- ");
  public static final Step WILD = write("_");
  public static final Step BAR = write("| ");

  public static final Step OPEN_LIST = delimited("[ ", "[");
  public static final Step CLOSE_LIST = delimited(" ]", "]");
  public static final Step OPEN_LIST_FIXED = write("[");
  public static final Step CLOSE_LIST_FIXED = write("]");
  public static final Step OPEN_ARRAY = delimited("[| ", "[|");
  public static final Step CLOSE_ARRAY = delimited(" |]", "|]");
  public static final Step OPEN_ARRAY_FIXED = write("[|");
  public static final Step CLOSE_ARRAY_FIXED = write("|]");
  public static final Step OPEN_SEQ = delimited("{ ", "{");
  public static final Step CLOSE_SEQ = delimited(" }", "}");
  public static final Step OPEN_SEQ_FIXED = write("{");
  public static final Step CLOSE_SEQ_FIXED = write("}");
  public static final Step OPEN_ANON_RECORD = delimited("{| ", "{|");
  public static final Step CLOSE_ANON_RECORD = delimited(" |}", "|}");
  public static final Step OPEN_ANON_RECORD_FIXED = write("{|");
  public static final Step CLOSE_ANON_RECORD_FIXED = write("|}");
  public static final Step OPEN_TUPLE = write("(");
  public static final Step CLOSE_TUPLE = write(")");

  public static final Step WORD_AND = SPACE.then(write("and "));
  public static final Step WORD_AND_FIXED = write("and");
  public static final Step WORD_OR = SPACE.then(write("or "));
  public static final Step WORD_OF = SPACE.then(write("of "));

  public static final Step COLON = ctx -> {
    String spaced = ctx.config.spaceBeforeColon ? " : " : ": ";
    if (ctx.isMeasuring()) {
      return str(spaced).apply(ctx);
    }
    String last = ctx.log.lastWriteOnLastLine();
    if (last == null || last.endsWith(" ")) {
      return str(": ").apply(ctx);
    }
    return str(spaced).apply(ctx);
  };
  public static final Step COLON_FIXED = write(":");
  public static final Step COLON_WITH_SPACES_FIXED = write(" : ");

  public static final Step COMMA = ctx -> ctx.emit(Event.write(ctx.config.spaceAfterComma ? ", " : ","));
  public static final Step COMMA_FIXED = write(",");

  public static final Step SEMI = ctx -> {
    LayoutConfig config = ctx.config;
    String semi = (config.spaceBeforeSemicolon ? " ;" : ";") + (config.spaceAfterSemicolon ? " " : "");
    return ctx.emit(Event.write(semi));
  };

  public static final Step SPACE_BEFORE_CLASS_CONSTRUCTOR = ctx ->
      ctx.config.spaceBeforeClassConstructor ? SPACE.apply(ctx) : ctx;

  /** Breaks the line when a trailing comment is waiting, otherwise runs {@code fallback}. */
  public static Step nlnWhenPendingSuffix(Step fallback) {
    return ctx -> ctx.hasPendingSuffix() ? NLN.apply(ctx) : fallback.apply(ctx);
  }

  public static final Step SPACE_UNLESS_PENDING_SUFFIX = ctx ->
      ctx.hasPendingSuffix() ? ctx : SPACE.apply(ctx);

  public static Step autoIndentAndNlnWhenPendingSuffix(Step body) {
    return ctx -> ctx.hasPendingSuffix() ? Steps.indentSepNlnUnindent(body).apply(ctx) : body.apply(ctx);
  }

  private static Step delimited(String spaced, String tight) {
    return ctx -> ctx.emit(Event.write(ctx.config.spaceAroundDelimiter ? spaced : tight));
  }
}
