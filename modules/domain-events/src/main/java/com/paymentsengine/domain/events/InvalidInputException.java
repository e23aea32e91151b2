package com.paymentsengine.domain.events;

/** Malformed input. Fatal to the whole run. */
public class InvalidInputException extends RuntimeException {
  private final InvalidInputReason reason;
  private final long lineNumber;

  public InvalidInputException(InvalidInputReason reason, long lineNumber, String detail) {
    this(reason, lineNumber, detail, null);
  }

  public InvalidInputException(
      InvalidInputReason reason, long lineNumber, String detail, Throwable cause) {
    super(buildMessage(reason, lineNumber, detail), cause);
    this.reason = reason;
    this.lineNumber = lineNumber;
  }

  public InvalidInputReason reason() {
    return reason;
  }

  public long lineNumber() {
    return lineNumber;
  }

  private static String buildMessage(InvalidInputReason reason, long lineNumber, String detail) {
    StringBuilder message = new StringBuilder("Invalid input");
    if (lineNumber > 0) {
      message.append(" at line ").append(lineNumber);
    }
    message.append(": ").append(reason.description());
    if (detail != null && !detail.isBlank()) {
      message.append(" (").append(detail).append(')');
    }
    return message.toString();
  }
}
