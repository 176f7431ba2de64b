package ca.gc.cra.netprov.infrastructure.transport.eos;

/**
 * JSON-RPC error returned by eAPI, typically a rejected CLI command.
 *
 * @since 0.1.0
 */
final class EapiCommandException extends Exception {
  private final int code;

  EapiCommandException(int code, String message) {
    super(message);
    this.code = code;
  }

  /**
   * JSON-RPC error code (1002 for an invalid command, 1005 for a command that failed to execute).
   *
   * @return error code
   */
  int code() {
    return code;
  }
}
