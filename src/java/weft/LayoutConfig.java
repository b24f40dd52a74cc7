package weft;

import clojure.lang.*;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Read-only layout options. Built from a keyword map merged over the
 * defaults, e.g. {@code {:page-width 100 :space-around-delimiter false}}.
 */
public final class LayoutConfig {
  public static final Keyword PAGE_WIDTH = Keyword.intern("page-width");
  public static final Keyword INDENT_SIZE = Keyword.intern("indent-size");
  public static final Keyword SPACE_AROUND_DELIMITER = Keyword.intern("space-around-delimiter");
  public static final Keyword SPACE_BEFORE_COLON = Keyword.intern("space-before-colon");
  public static final Keyword SPACE_AFTER_COMMA = Keyword.intern("space-after-comma");
  public static final Keyword SPACE_BEFORE_SEMICOLON = Keyword.intern("space-before-semicolon");
  public static final Keyword SPACE_AFTER_SEMICOLON = Keyword.intern("space-after-semicolon");
  public static final Keyword SPACE_BEFORE_CLASS_CONSTRUCTOR = Keyword.intern("space-before-class-constructor");
  public static final Keyword ALIGN_MULTILINE_BRACKETS = Keyword.intern("align-multiline-brackets");
  public static final Keyword BLANK_LINES_AROUND_NESTED_MULTILINE = Keyword.intern("blank-lines-around-nested-multiline");
  public static final Keyword STROUSTRUP_STYLE = Keyword.intern("stroustrup-style");
  public static final Keyword END_OF_LINE = Keyword.intern("end-of-line");
  public static final Keyword MAX_LIST_WIDTH = Keyword.intern("max-list-width");
  public static final Keyword MAX_LIST_ITEMS = Keyword.intern("max-list-items");
  public static final Keyword LIST_MULTILINE_FORMATTER = Keyword.intern("list-multiline-formatter");
  public static final Keyword MAX_RECORD_WIDTH = Keyword.intern("max-record-width");
  public static final Keyword MAX_RECORD_ITEMS = Keyword.intern("max-record-items");
  public static final Keyword RECORD_MULTILINE_FORMATTER = Keyword.intern("record-multiline-formatter");

  public static final Keyword CHARACTER_WIDTH = Keyword.intern("character-width");
  public static final Keyword NUMBER_OF_ITEMS = Keyword.intern("number-of-items");
  public static final Keyword LF = Keyword.intern("lf");
  public static final Keyword CRLF = Keyword.intern("crlf");

  private static final IPersistentMap DEFAULT_OPTIONS = PersistentHashMap.create(
      PAGE_WIDTH, 120,
      INDENT_SIZE, 4,
      SPACE_AROUND_DELIMITER, true,
      SPACE_BEFORE_COLON, false,
      SPACE_AFTER_COMMA, true,
      SPACE_BEFORE_SEMICOLON, false,
      SPACE_AFTER_SEMICOLON, true,
      SPACE_BEFORE_CLASS_CONSTRUCTOR, false,
      ALIGN_MULTILINE_BRACKETS, false,
      BLANK_LINES_AROUND_NESTED_MULTILINE, true,
      STROUSTRUP_STYLE, false,
      END_OF_LINE, LF,
      MAX_LIST_WIDTH, 40,
      MAX_LIST_ITEMS, 1,
      LIST_MULTILINE_FORMATTER, CHARACTER_WIDTH,
      MAX_RECORD_WIDTH, 40,
      MAX_RECORD_ITEMS, 1,
      RECORD_MULTILINE_FORMATTER, CHARACTER_WIDTH);

  public static final LayoutConfig DEFAULTS = create(PersistentArrayMap.EMPTY);

  public static LayoutConfig create(IPersistentMap overrides) {
    IPersistentMap options = DEFAULT_OPTIONS;
    for (ISeq s = overrides == null ? null : overrides.seq(); s != null; s = s.next()) {
      IMapEntry entry = (IMapEntry) s.first();
      if (!DEFAULT_OPTIONS.containsKey(entry.key())) {
        throw new IllegalArgumentException("Unknown layout option: " + entry.key());
      }
      options = options.assoc(entry.key(), entry.val());
    }
    return new LayoutConfig(options);
  }

  public static LayoutConfig fromEdn(String edn) {
    Object parsed = EdnReader.readString(edn, PersistentArrayMap.EMPTY);
    if (parsed != null && !(parsed instanceof IPersistentMap)) {
      throw new IllegalArgumentException("Layout options must be a map, got: " + parsed);
    }
    return create((IPersistentMap) parsed);
  }

  //
  //

  public final int pageWidth;
  public final int indentSize;
  public final boolean spaceAroundDelimiter;
  public final boolean spaceBeforeColon;
  public final boolean spaceAfterComma;
  public final boolean spaceBeforeSemicolon;
  public final boolean spaceAfterSemicolon;
  public final boolean spaceBeforeClassConstructor;
  public final boolean alignMultilineBrackets;
  public final boolean blankLinesAroundNestedMultiline;
  public final boolean stroustrupStyle;
  public final String newline;
  public final int maxListWidth;
  public final int maxListItems;
  public final Keyword listMultilineFormatter;
  public final int maxRecordWidth;
  public final int maxRecordItems;
  public final Keyword recordMultilineFormatter;

  private final IPersistentMap _options;

  private LayoutConfig(IPersistentMap options) {
    _options = options;
    pageWidth = intOption(options, PAGE_WIDTH, 1);
    indentSize = intOption(options, INDENT_SIZE, 0);
    spaceAroundDelimiter = boolOption(options, SPACE_AROUND_DELIMITER);
    spaceBeforeColon = boolOption(options, SPACE_BEFORE_COLON);
    spaceAfterComma = boolOption(options, SPACE_AFTER_COMMA);
    spaceBeforeSemicolon = boolOption(options, SPACE_BEFORE_SEMICOLON);
    spaceAfterSemicolon = boolOption(options, SPACE_AFTER_SEMICOLON);
    spaceBeforeClassConstructor = boolOption(options, SPACE_BEFORE_CLASS_CONSTRUCTOR);
    alignMultilineBrackets = boolOption(options, ALIGN_MULTILINE_BRACKETS);
    blankLinesAroundNestedMultiline = boolOption(options, BLANK_LINES_AROUND_NESTED_MULTILINE);
    stroustrupStyle = boolOption(options, STROUSTRUP_STYLE);
    newline = keywordOption(options, END_OF_LINE, LF, CRLF) == CRLF ? "\r\n" : "\n";
    maxListWidth = intOption(options, MAX_LIST_WIDTH, 0);
    maxListItems = intOption(options, MAX_LIST_ITEMS, 0);
    listMultilineFormatter = keywordOption(options, LIST_MULTILINE_FORMATTER, CHARACTER_WIDTH, NUMBER_OF_ITEMS);
    maxRecordWidth = intOption(options, MAX_RECORD_WIDTH, 0);
    maxRecordItems = intOption(options, MAX_RECORD_ITEMS, 0);
    recordMultilineFormatter = keywordOption(options, RECORD_MULTILINE_FORMATTER, CHARACTER_WIDTH, NUMBER_OF_ITEMS);
  }

  public IPersistentMap toMap() {
    return _options;
  }

  public LayoutConfig with(Keyword key, Object value) {
    return create(_options.assoc(key, value));
  }

  /** Same options with an unbounded page width, for worst-case measurements. */
  public LayoutConfig withUnlimitedPageWidth() {
    return pageWidth == Integer.MAX_VALUE ? this : with(PAGE_WIDTH, Integer.MAX_VALUE);
  }

  private static int intOption(IPersistentMap options, Keyword key, int min) {
    Object value = options.valAt(key);
    if (!isIntegral(value)) {
      throw new IllegalArgumentException("Layout option " + key + " must be an integer, got: " + value);
    }
    BigInteger n = value instanceof BigInt ? ((BigInt) value).toBigInteger()
        : value instanceof BigInteger ? (BigInteger) value
        : BigInteger.valueOf(((Number) value).longValue());
    if (n.compareTo(BigInteger.valueOf(min)) < 0 || n.compareTo(BigInteger.valueOf(Integer.MAX_VALUE)) > 0) {
      throw new IllegalArgumentException("Layout option " + key + " out of range: " + n);
    }
    return n.intValue();
  }

  private static boolean isIntegral(Object value) {
    return value instanceof Long
        || value instanceof Integer
        || value instanceof Short
        || value instanceof Byte
        || value instanceof BigInt
        || value instanceof BigInteger;
  }

  private static boolean boolOption(IPersistentMap options, Keyword key) {
    Object value = options.valAt(key);
    if (!(value instanceof Boolean)) {
      throw new IllegalArgumentException("Layout option " + key + " must be a boolean, got: " + value);
    }
    return (Boolean) value;
  }

  private static Keyword keywordOption(IPersistentMap options, Keyword key, Keyword... allowed) {
    Object value = options.valAt(key);
    for (Keyword k : allowed) {
      if (k == value) {
        return k;
      }
    }
    throw new IllegalArgumentException("Layout option " + key + " must be one of "
        + Arrays.toString(allowed) + ", got: " + value);
  }

  @Override
  public String toString() {
    return _options.toString();
  }
}
