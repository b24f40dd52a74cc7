package weft;

/**
 * One entry for {@link MultilineItems#join}: how to lay the item out and the
 * break that separates it from its predecessor.
 */
public final class MultilineItem {
  public final Step render;
  public final Step separator;

  public MultilineItem(Step render, Step separator) {
    this.render = render;
    this.separator = separator;
  }
}
