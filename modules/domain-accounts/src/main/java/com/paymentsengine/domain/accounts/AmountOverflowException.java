package com.paymentsengine.domain.accounts;

/** Raised when an amount or a balance no longer fits the tick representation. Always fatal. */
public class AmountOverflowException extends LedgerDomainException {
  public AmountOverflowException(String message) {
    super(message);
  }

  public AmountOverflowException(String message, Throwable cause) {
    super(message, cause);
  }
}
