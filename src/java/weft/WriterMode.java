package weft;

import clojure.lang.*;

public final class WriterMode {
  public static final WriterMode NORMAL = new WriterMode(Keywords.NORMAL, null);
  public static final WriterMode MEASUREMENT = new WriterMode(Keywords.MEASUREMENT, null);

  public static WriterMode trial(ISeq budgets) {
    if (budgets == null) {
      throw new IllegalArgumentException("Trial mode requires at least one budget");
    }
    return new WriterMode(Keywords.TRIAL, budgets);
  }

  public final Keyword kind;
  /** Innermost budget first, null unless in trial mode. */
  public final ISeq budgets;

  private WriterMode(Keyword kind, ISeq budgets) {
    this.kind = kind;
    this.budgets = budgets;
  }

  public boolean isTrial() {
    return kind == Keywords.TRIAL;
  }

  public boolean isMeasurement() {
    return kind == Keywords.MEASUREMENT;
  }

  public boolean hasConfirmedOverflow() {
    for (ISeq s = budgets; s != null; s = s.next()) {
      if (((TrialBudget) s.first()).confirmedOverflow) {
        return true;
      }
    }
    return false;
  }

  /** Any budget confirmed or exceeded at the given column. */
  public boolean hasFailed(int pageWidth, int column) {
    for (ISeq s = budgets; s != null; s = s.next()) {
      if (((TrialBudget) s.first()).hasFailed(pageWidth, column)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Pushes a new budget on top of the stack. A budget equal to one already
   * outstanding adds nothing and leaves the mode unchanged.
   */
  public WriterMode push(TrialBudget budget) {
    if (!isTrial()) {
      return trial(new Cons(budget, null));
    }
    for (ISeq s = budgets; s != null; s = s.next()) {
      if (budget.equals(s.first())) {
        return this;
      }
    }
    return trial(new Cons(budget, budgets));
  }

  /**
   * Re-evaluates every budget at the given column. Returns this same instance
   * when nothing changed.
   */
  public WriterMode confirmAll(int pageWidth, int column, boolean forcesMultiline) {
    int n = RT.count(budgets);
    TrialBudget[] updated = new TrialBudget[n];
    boolean changed = false;
    int i = 0;
    for (ISeq s = budgets; s != null; s = s.next()) {
      TrialBudget budget = (TrialBudget) s.first();
      updated[i] = budget.confirm(forcesMultiline || budget.isTooLong(pageWidth, column));
      changed |= updated[i] != budget;
      i++;
    }
    if (!changed) {
      return this;
    }
    ISeq stack = null;
    for (int j = n - 1; j >= 0; j--) {
      stack = new Cons(updated[j], stack);
    }
    return trial(stack);
  }

  public Object inspect() {
    if (!isTrial()) {
      return kind;
    }
    ITransientCollection output = PersistentVector.EMPTY.asTransient();
    for (ISeq s = budgets; s != null; s = s.next()) {
      output = output.conj(((TrialBudget) s.first()).inspect());
    }
    return PersistentVector.create(kind, output.persistent());
  }

  @Override
  public String toString() {
    return String.valueOf(inspect());
  }
}
