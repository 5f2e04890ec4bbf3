package io.b2mash.pms.security;

/**
 * Thrown when code that requires an authenticated caller runs outside the filter chain that binds
 * it. Indicates a wiring bug, not a client error.
 */
public class CallerContextNotBoundException extends RuntimeException {

  public CallerContextNotBoundException() {
    super("Caller context not available; UserFilter did not bind a caller for this request");
  }
}
