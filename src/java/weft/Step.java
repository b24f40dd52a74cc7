package weft;

/**
 * One layout step: a function from a context to the next context.
 *
 * <p>Steps handed to {@link Trials} and {@link MultilineItems} may be run
 * more than once against different contexts, so they must not depend on
 * anything but the context they are given.
 */
@FunctionalInterface
public interface Step {
  Step IDENTITY = ctx -> ctx;

  Context apply(Context ctx);

  /**
   * Runs {@code next} after this step unless this step left a trial that is
   * already known to overflow; the doomed context is then returned as is.
   */
  default Step then(Step next) {
    return ctx -> {
      Context y = apply(ctx);
      return y.hasConfirmedOverflow() ? y : next.apply(y);
    };
  }

  static Step seq(Step... steps) {
    return ctx -> {
      Context y = ctx;
      for (int i = 0; i < steps.length; i++) {
        if (i > 0 && y.hasConfirmedOverflow()) {
          return y;
        }
        y = steps[i].apply(y);
      }
      return y;
    };
  }
}
