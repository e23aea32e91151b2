package com.paymentsengine.domain.accounts;

import java.math.BigDecimal;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fixed-point monetary value stored as a signed count of ticks, one tick being 0.0001.
 *
 * <p>Input amounts are parsed with {@link #parse(String)}, which only accepts non-negative
 * plain decimals with at most {@value #SCALE} fractional digits. Balances built from them may
 * go negative (a dispute can hold more than is available). Every arithmetic operation is exact
 * and fails with {@link AmountOverflowException} instead of wrapping.
 */
public record Amount(long ticks) implements Comparable<Amount> {
  public static final int SCALE = 4;
  public static final Amount ZERO = new Amount(0L);

  private static final Pattern PLAIN_DECIMAL = Pattern.compile("\\+?(\\d+)(?:\\.(\\d*))?");

  public static Amount ofTicks(long ticks) {
    return new Amount(ticks);
  }

  public static Amount parse(String text) {
    if (text == null) {
      throw new InvalidAmountException(null, InvalidAmountException.Reason.NOT_A_NUMBER);
    }
    String value = text.trim();
    if (value.startsWith(".")) {
      throw new InvalidAmountException(value, InvalidAmountException.Reason.LEADING_DECIMAL_POINT);
    }
    if (value.startsWith("-")) {
      InvalidAmountException.Reason reason =
          PLAIN_DECIMAL.matcher(value.substring(1)).matches()
              ? InvalidAmountException.Reason.NEGATIVE
              : InvalidAmountException.Reason.NOT_A_NUMBER;
      throw new InvalidAmountException(value, reason);
    }

    Matcher matcher = PLAIN_DECIMAL.matcher(value);
    if (!matcher.matches()) {
      throw new InvalidAmountException(value, InvalidAmountException.Reason.NOT_A_NUMBER);
    }
    String fraction = matcher.group(2) == null ? "" : matcher.group(2);
    if (fraction.length() > SCALE) {
      throw new InvalidAmountException(
          value, InvalidAmountException.Reason.TOO_MANY_DECIMAL_PLACES);
    }

    BigDecimal decimal =
        new BigDecimal(fraction.isEmpty() ? matcher.group(1) : matcher.group(1) + "." + fraction);
    try {
      return new Amount(decimal.movePointRight(SCALE).longValueExact());
    } catch (ArithmeticException ex) {
      throw new AmountOverflowException("Amount " + value + " exceeds the representable range", ex);
    }
  }

  public Amount plus(Amount other) {
    try {
      return new Amount(Math.addExact(ticks, other.ticks));
    } catch (ArithmeticException ex) {
      throw new AmountOverflowException("Overflow adding " + other + " to " + this, ex);
    }
  }

  public Amount minus(Amount other) {
    try {
      return new Amount(Math.subtractExact(ticks, other.ticks));
    } catch (ArithmeticException ex) {
      throw new AmountOverflowException("Overflow subtracting " + other + " from " + this, ex);
    }
  }

  public boolean isZero() {
    return ticks == 0L;
  }

  public boolean isPositive() {
    return ticks > 0L;
  }

  public boolean isNegative() {
    return ticks < 0L;
  }

  public BigDecimal toBigDecimal() {
    return BigDecimal.valueOf(ticks, SCALE);
  }

  /** Plain rendering with exactly four fractional digits, e.g. {@code 3.0003}. */
  public String toPlainString() {
    return toBigDecimal().toPlainString();
  }

  @Override
  public int compareTo(Amount other) {
    return Long.compare(ticks, other.ticks);
  }

  @Override
  public String toString() {
    return toPlainString();
  }
}
