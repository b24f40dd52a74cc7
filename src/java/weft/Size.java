package weft;

/**
 * Threshold that decides when a bracketed construct is too big for one line:
 * either a width in characters or a number of items.
 */
public final class Size {

  public static Size characterWidth(int maxWidth) {
    return new Size(maxWidth, -1, -1);
  }

  public static Size numberOfItems(int items, int maxItems) {
    return new Size(-1, items, maxItems);
  }

  public static Size forList(LayoutConfig config, int maxWidth, int itemCount) {
    return config.listMultilineFormatter == LayoutConfig.NUMBER_OF_ITEMS
        ? numberOfItems(itemCount, config.maxListItems)
        : characterWidth(maxWidth);
  }

  public static Size forRecord(LayoutConfig config, int fieldCount) {
    return config.recordMultilineFormatter == LayoutConfig.NUMBER_OF_ITEMS
        ? numberOfItems(fieldCount, config.maxRecordItems)
        : characterWidth(config.maxRecordWidth);
  }

  public final int maxWidth;
  public final int items;
  public final int maxItems;

  private Size(int maxWidth, int items, int maxItems) {
    this.maxWidth = maxWidth;
    this.items = items;
    this.maxItems = maxItems;
  }

  public boolean isCharacterWidth() {
    return maxWidth >= 0;
  }

  @Override
  public String toString() {
    return isCharacterWidth() ? "character-width " + maxWidth : "number-of-items " + items + "/" + maxItems;
  }
}
