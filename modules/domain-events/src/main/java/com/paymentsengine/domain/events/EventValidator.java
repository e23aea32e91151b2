package com.paymentsengine.domain.events;

import com.paymentsengine.domain.accounts.Amount;
import com.paymentsengine.domain.accounts.ClientId;
import com.paymentsengine.domain.accounts.InvalidAmountException;
import com.paymentsengine.domain.accounts.TxId;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns an untrusted {@link RawPaymentRecord} into a {@link PaymentEvent}, independently of any
 * account state. Stateless and safe to share between threads.
 *
 * <p>Checks run in a fixed order (schema, type, client, tx, amount) so the reported reason is
 * deterministic when a record has several problems.
 */
public class EventValidator {
  public static final String TYPE_FIELD = "type";
  public static final String CLIENT_FIELD = "client";
  public static final String TX_FIELD = "tx";
  public static final String AMOUNT_FIELD = "amount";
  public static final Set<String> RECOGNISED_FIELDS =
      Set.of(TYPE_FIELD, CLIENT_FIELD, TX_FIELD, AMOUNT_FIELD);

  private static final Pattern UNSIGNED_INTEGER = Pattern.compile("\\+?\\d{1,10}");

  public PaymentEvent validate(RawPaymentRecord record) {
    long line = record.lineNumber();
    for (String name : record.fields().keySet()) {
      if (!RECOGNISED_FIELDS.contains(name)) {
        throw new InvalidInputException(InvalidInputReason.UNKNOWN_FIELD, line, name);
      }
    }

    String typeValue = requireField(record, TYPE_FIELD, InvalidInputReason.MISSING_TYPE);
    EventType type =
        EventType.fromWireName(typeValue)
            .orElseThrow(
                () -> new InvalidInputException(InvalidInputReason.UNKNOWN_TYPE, line, typeValue));

    String clientValue = requireField(record, CLIENT_FIELD, InvalidInputReason.MISSING_CLIENT);
    long client = parseUnsigned(clientValue, ClientId.MAX_VALUE);
    if (client < 0L) {
      throw new InvalidInputException(InvalidInputReason.INVALID_CLIENT_ID, line, clientValue);
    }

    String txValue = requireField(record, TX_FIELD, InvalidInputReason.MISSING_TX);
    long tx = parseUnsigned(txValue, TxId.MAX_VALUE);
    if (tx < 0L) {
      throw new InvalidInputException(InvalidInputReason.INVALID_TX_ID, line, txValue);
    }

    String amountValue = record.field(AMOUNT_FIELD).map(String::trim).orElse("");
    Amount amount = null;
    if (type.requiresAmount()) {
      if (amountValue.isEmpty()) {
        throw new InvalidInputException(
            InvalidInputReason.MISSING_AMOUNT, line, type.wireName());
      }
      amount = parseAmount(amountValue, line);
    } else if (!amountValue.isEmpty()) {
      throw new InvalidInputException(
          InvalidInputReason.UNEXPECTED_AMOUNT, line, type.wireName() + " " + amountValue);
    }

    return new PaymentEvent(type, ClientId.of((int) client), TxId.of(tx), amount);
  }

  private static String requireField(
      RawPaymentRecord record, String name, InvalidInputReason missingReason) {
    String value = record.field(name).map(String::trim).orElse("");
    if (value.isEmpty()) {
      throw new InvalidInputException(missingReason, record.lineNumber(), null);
    }
    return value;
  }

  private static Amount parseAmount(String value, long line) {
    Amount amount;
    try {
      amount = Amount.parse(value);
    } catch (InvalidAmountException ex) {
      throw new InvalidInputException(
          InvalidInputReason.INVALID_AMOUNT, line, ex.getMessage(), ex);
    }
    if (amount.isZero()) {
      throw new InvalidInputException(InvalidInputReason.ZERO_AMOUNT, line, value);
    }
    return amount;
  }

  /** Returns the parsed value, or -1 when the text is not an integer in {@code [0, max]}. */
  private static long parseUnsigned(String value, long max) {
    if (!UNSIGNED_INTEGER.matcher(value).matches()) {
      return -1L;
    }
    long parsed = Long.parseLong(value.startsWith("+") ? value.substring(1) : value);
    return parsed > max ? -1L : parsed;
  }
}
