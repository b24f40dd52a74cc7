package weft;

import java.util.ArrayList;
import java.util.List;

final class TestSupport {
  private TestSupport() {
  }

  static Context context() {
    return Context.create(LayoutConfig.DEFAULTS);
  }

  static Context context(LayoutConfig config) {
    return Context.create(config);
  }

  static LayoutConfig pageWidth(int width) {
    return LayoutConfig.DEFAULTS.with(LayoutConfig.PAGE_WIDTH, width);
  }

  static List<String> lines(Accumulator acc) {
    List<String> lines = new ArrayList<>();
    for (Object line : acc.lines) {
      lines.add((String) line);
    }
    return lines;
  }

  static List<String> lines(Context ctx) {
    return lines(ctx.accumulator);
  }

  static List<Event> events(Context ctx) {
    List<Event> events = new ArrayList<>();
    for (Object e : ctx.log.events()) {
      events.add((Event) e);
    }
    return events;
  }

  static Accumulator fold(Accumulator acc, int pageWidth, Event... events) {
    for (Event e : events) {
      acc = acc.apply(pageWidth, e);
    }
    return acc;
  }
}
