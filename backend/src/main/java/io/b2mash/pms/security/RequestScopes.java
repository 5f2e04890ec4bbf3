package io.b2mash.pms.security;

import java.util.UUID;

/**
 * Request-bound caller identity. Bound by {@link UserFilter} for the duration of the filter chain
 * and read by controllers.
 */
public final class RequestScopes {

  private static final ThreadLocal<Caller> CALLER = new ThreadLocal<>();

  /**
   * Binds {@code caller} to the current thread until the returned binding is closed, at which point
   * the previous binding (if any) is restored.
   */
  public static Binding bind(Caller caller) {
    Caller previous = CALLER.get();
    CALLER.set(caller);
    return () -> {
      if (previous == null) {
        CALLER.remove();
      } else {
        CALLER.set(previous);
      }
    };
  }

  /** Returns the current caller. Throws if not bound by the filter chain. */
  public static Caller requireCaller() {
    Caller caller = CALLER.get();
    if (caller == null) {
      throw new CallerContextNotBoundException();
    }
    return caller;
  }

  public static UUID requireUserId() {
    return requireCaller().userId();
  }

  public static boolean isBound() {
    return CALLER.get() != null;
  }

  /** Scope handle for try-with-resources. */
  @FunctionalInterface
  public interface Binding extends AutoCloseable {
    @Override
    void close();
  }

  private RequestScopes() {}
}
