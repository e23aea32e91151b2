package com.paymentsengine.cli;

public final class CliExitCodes {
  public static final int SUCCESS = 0;
  public static final int RUN_ABORTED = 1;
  public static final int USAGE = 2;

  private CliExitCodes() {}
}
