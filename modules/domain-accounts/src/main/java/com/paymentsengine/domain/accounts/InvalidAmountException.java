package com.paymentsengine.domain.accounts;

public class InvalidAmountException extends LedgerDomainException {
  private final String input;
  private final Reason reason;

  public InvalidAmountException(String input, Reason reason) {
    super(String.format("Invalid amount '%s': %s", input, reason.description()));
    this.input = input;
    this.reason = reason;
  }

  public String input() {
    return input;
  }

  public Reason reason() {
    return reason;
  }

  public enum Reason {
    NOT_A_NUMBER("not a decimal number"),
    LEADING_DECIMAL_POINT("leading decimal point not allowed"),
    NEGATIVE("negative amount"),
    TOO_MANY_DECIMAL_PLACES("more than " + Amount.SCALE + " decimal places");

    private final String description;

    Reason(String description) {
      this.description = description;
    }

    public String description() {
      return description;
    }
  }
}
