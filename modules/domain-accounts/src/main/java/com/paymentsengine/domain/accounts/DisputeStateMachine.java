package com.paymentsengine.domain.accounts;

import java.util.EnumSet;
import java.util.Map;

public final class DisputeStateMachine {
  private static final Map<DisputeStatus, EnumSet<DisputeStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          DisputeStatus.ACTIVE, EnumSet.of(DisputeStatus.DISPUTED),
          DisputeStatus.DISPUTED, EnumSet.of(DisputeStatus.ACTIVE, DisputeStatus.CHARGED_BACK),
          DisputeStatus.CHARGED_BACK, EnumSet.noneOf(DisputeStatus.class));

  private DisputeStateMachine() {}

  public static boolean canTransition(DisputeStatus from, DisputeStatus to) {
    if (from == null || to == null) {
      return false;
    }
    EnumSet<DisputeStatus> allowed = ALLOWED_TRANSITIONS.get(from);
    return allowed != null && allowed.contains(to);
  }

  public static void validateTransition(DisputeStatus from, DisputeStatus to) {
    if (!canTransition(from, to)) {
      throw new LedgerDomainException(
          "Invalid dispute status transition from " + from + " to " + to);
    }
  }
}
