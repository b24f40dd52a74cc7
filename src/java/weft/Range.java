package weft;

/**
 * Source position span. Lines are 1-based, columns 0-based; the end position
 * is exclusive.
 */
public final class Range {
  public final int startLine;
  public final int startColumn;
  public final int endLine;
  public final int endColumn;

  public static Range of(int startLine, int startColumn, int endLine, int endColumn) {
    return new Range(startLine, startColumn, endLine, endColumn);
  }

  private Range(int startLine, int startColumn, int endLine, int endColumn) {
    if (startLine < 1 || endLine < startLine || (endLine == startLine && endColumn < startColumn)) {
      throw new IllegalArgumentException("Invalid range: " + startLine + ":" + startColumn + "-" + endLine + ":" + endColumn);
    }
    this.startLine = startLine;
    this.startColumn = startColumn;
    this.endLine = endLine;
    this.endColumn = endColumn;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Range)) {
      return false;
    }
    Range other = (Range) o;
    return startLine == other.startLine
        && startColumn == other.startColumn
        && endLine == other.endLine
        && endColumn == other.endColumn;
  }

  @Override
  public int hashCode() {
    return ((startLine * 31 + startColumn) * 31 + endLine) * 31 + endColumn;
  }

  @Override
  public String toString() {
    return "(" + startLine + "," + startColumn + "-" + endLine + "," + endColumn + ")";
  }
}
