package com.paymentsengine.domain.accounts;

public enum DisputeStatus {
  ACTIVE,
  DISPUTED,
  CHARGED_BACK
}
