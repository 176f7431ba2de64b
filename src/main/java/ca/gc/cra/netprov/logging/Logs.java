package ca.gc.cra.netprov.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Logging hygiene helpers that minimize sensitive payload exposure.
 * <p><strong>Role:</strong> Cross-cutting utility used by the credential resolver, the orchestrator trail and the
 * provisioning job.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Truncate UTF-8 payloads (diffs, device replies) to a safe byte budget.</li>
 *   <li>Preview the first lines of configuration text.</li>
 *   <li>Provide a consistent redaction placeholder for credentials.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#IGNORE} to avoid exceptions when truncating mid-codepoint.
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "<hidden>";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, appending the original length metadata.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return truncated string when the input exceeds {@code maxBytes}; otherwise the original value
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return buffer + "... (truncated, " + maxBytes + " of " + bytes.length + " bytes)";
    } catch (CharacterCodingException ex) {
      String utf16Safe = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
      return utf16Safe + "... (truncated)";
    }
  }

  /**
   * Returns the first {@code maxLines} lines of {@code text}, followed by {@code ...} when lines were dropped.
   *
   * @param text multi-line text; {@code null} results in {@code "<null>"}
   * @param maxLines number of lines to keep; must be positive
   * @return preview text
   */
  public static String preview(String text, int maxLines) {
    if (text == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxLines <= 0) {
      throw new IllegalArgumentException("maxLines must be positive");
    }
    String[] lines = text.split("\\R", -1);
    if (lines.length <= maxLines) {
      return text;
    }
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < maxLines; i++) {
      sb.append(lines[i]).append('\n');
    }
    return sb.append("...").toString();
  }

  /**
   * Returns a standard redacted placeholder for sensitive content.
   *
   * @param value ignored original value; retained for fluent API usage
   * @return the redacted placeholder string
   */
  public static String redact(String value) {
    return REDACTED_PLACEHOLDER;
  }
}
