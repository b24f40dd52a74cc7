package weft;

import clojure.lang.IPersistentMap;
import clojure.lang.PersistentArrayMap;

import java.util.Map;

/**
 * One outstanding bet that a speculative rendering fits in {@code maxWidth}
 * columns counted from {@code startColumn}, and within the page width.
 */
public final class TrialBudget {
  public final int maxWidth;
  public final int startColumn;
  public final boolean confirmedOverflow;

  public TrialBudget(int maxWidth, int startColumn, boolean confirmedOverflow) {
    this.maxWidth = maxWidth;
    this.startColumn = startColumn;
    this.confirmedOverflow = confirmedOverflow;
  }

  public boolean isTooLong(int pageWidth, int column) {
    return column - startColumn > maxWidth || column > pageWidth;
  }

  public boolean hasFailed(int pageWidth, int column) {
    return confirmedOverflow || isTooLong(pageWidth, column);
  }

  /** Once confirmed, the overflow flag stays set. */
  public TrialBudget confirm(boolean overflow) {
    if (confirmedOverflow || !overflow) {
      return this;
    }
    return new TrialBudget(maxWidth, startColumn, true);
  }

  public IPersistentMap inspect() {
    return PersistentArrayMap.create(Map.of(
        Keywords.MAX_WIDTH, maxWidth,
        Keywords.START_COLUMN, startColumn,
        Keywords.CONFIRMED_OVERFLOW, confirmedOverflow
    ));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TrialBudget)) {
      return false;
    }
    TrialBudget other = (TrialBudget) o;
    return maxWidth == other.maxWidth
        && startColumn == other.startColumn
        && confirmedOverflow == other.confirmedOverflow;
  }

  @Override
  public int hashCode() {
    return 31 * (31 * maxWidth + startColumn) + (confirmedOverflow ? 1 : 0);
  }

  @Override
  public String toString() {
    return inspect().toString();
  }
}
