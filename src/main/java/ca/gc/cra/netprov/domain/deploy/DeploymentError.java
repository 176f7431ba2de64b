package ca.gc.cra.netprov.domain.deploy;

import java.util.Objects;
import java.util.Optional;

/**
 * Structured description of why an attempt failed.
 *
 * @param kind failure kind
 * @param state state the attempt had reached when it failed
 * @param message human-readable message; never contains credential material
 * @param causeType simple class name of the underlying exception, when there was one
 * @since 0.1.0
 */
public record DeploymentError(
    FailureKind kind, DeploymentState state, String message, Optional<String> causeType) {

  public DeploymentError {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(state, "state");
    message = Objects.requireNonNullElse(message, kind.name());
    causeType = Objects.requireNonNullElse(causeType, Optional.empty());
  }

  /**
   * Builds an error from an exception.
   *
   * @param kind failure kind
   * @param state state reached
   * @param cause underlying exception; its message becomes the error message
   * @return structured error
   */
  public static DeploymentError of(FailureKind kind, DeploymentState state, Throwable cause) {
    String message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    return new DeploymentError(kind, state, message, Optional.of(cause.getClass().getSimpleName()));
  }

  /**
   * Builds an error without an underlying exception.
   *
   * @param kind failure kind
   * @param state state reached
   * @param message description
   * @return structured error
   */
  public static DeploymentError of(FailureKind kind, DeploymentState state, String message) {
    return new DeploymentError(kind, state, message, Optional.empty());
  }

  /**
   * One-line rendering used in CLI output and trails.
   *
   * @return e.g. {@code COMMIT failure in COMMITTING: CommitFailureException: rejected}
   */
  public String describe() {
    return kind + " failure in " + state + ": "
        + causeType.map(type -> type + ": ").orElse("") + message;
  }
}
