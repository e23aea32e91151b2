package com.paymentsengine.domain.accounts;

public class LedgerDomainException extends RuntimeException {
  public LedgerDomainException(String message) {
    super(message);
  }

  public LedgerDomainException(String message, Throwable cause) {
    super(message, cause);
  }
}
