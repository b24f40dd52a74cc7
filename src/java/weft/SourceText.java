package weft;

import clojure.lang.PersistentVector;

/**
 * Original source text, addressable by {@link Range}. Carriage returns are
 * dropped when the text is split into lines.
 */
public final class SourceText {
  private final PersistentVector _lines;

  public static SourceText of(String source) {
    return new SourceText(PersistentVector.create((Object[]) source.replace("\r", "").split("\n", -1)));
  }

  private SourceText(PersistentVector lines) {
    _lines = lines;
  }

  public int lineCount() {
    return _lines.count();
  }

  public String line(int lineNumber) {
    return (String) _lines.nth(lineNumber - 1);
  }

  public String contentAt(Range range) {
    if (range.endLine > _lines.count()) {
      throw new IndexOutOfBoundsException("Range " + range + " is outside of the source (" + _lines.count() + " lines)");
    }
    if (range.startLine == range.endLine) {
      return slice(line(range.startLine), range.startColumn, range.endColumn);
    }
    StringBuilder sb = new StringBuilder();
    String first = line(range.startLine);
    sb.append(slice(first, range.startColumn, first.length()));
    for (int i = range.startLine + 1; i < range.endLine; i++) {
      sb.append('\n').append(line(i));
    }
    sb.append('\n').append(slice(line(range.endLine), 0, range.endColumn));
    return sb.toString();
  }

  private static String slice(String line, int from, int to) {
    int start = Math.min(from, line.length());
    return line.substring(start, Math.max(start, Math.min(to, line.length())));
  }
}
