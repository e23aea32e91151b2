package com.paymentsengine.cli.io;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.paymentsengine.domain.accounts.AccountBalance;
import com.paymentsengine.domain.accounts.Amount;
import com.paymentsengine.domain.accounts.ClientId;
import com.paymentsengine.engine.snapshot.BalanceSnapshot;
import java.io.IOException;
import java.io.StringWriter;
import java.util.List;
import org.junit.jupiter.api.Test;

class BalanceCsvWriterTest {
  private final BalanceCsvWriter writer = new BalanceCsvWriter();

  @Test
  void shouldWriteHeaderAndFourDecimalAmounts() throws IOException {
    BalanceSnapshot snapshot =
        new BalanceSnapshot(
            List.of(
                balance(1, "1.5", "0", false),
                balance(2, "0", "2.0001", false),
                balance(3, "0", "0", true)));
    StringWriter out = new StringWriter();

    writer.write(snapshot, out);

    assertEquals(
        "client,available,held,total,locked\n"
            + "1,1.5000,0.0000,1.5000,false\n"
            + "2,0.0000,2.0001,2.0001,false\n"
            + "3,0.0000,0.0000,0.0000,true\n",
        out.toString());
  }

  @Test
  void shouldWriteNegativeAvailable() throws IOException {
    AccountBalance balance =
        new AccountBalance(
            ClientId.of(4),
            Amount.ofTicks(-80_000L),
            Amount.parse("10"),
            Amount.parse("2"),
            false);
    StringWriter out = new StringWriter();

    writer.write(new BalanceSnapshot(List.of(balance)), out);

    assertEquals(
        "client,available,held,total,locked\n4,-8.0000,10.0000,2.0000,false\n", out.toString());
  }

  @Test
  void shouldWriteOnlyHeaderForEmptySnapshot() throws IOException {
    StringWriter out = new StringWriter();

    writer.write(new BalanceSnapshot(List.of()), out);

    assertEquals("client,available,held,total,locked\n", out.toString());
  }

  private static AccountBalance balance(int client, String available, String held, boolean locked) {
    Amount availableAmount = Amount.parse(available);
    Amount heldAmount = Amount.parse(held);
    return new AccountBalance(
        ClientId.of(client), availableAmount, heldAmount, availableAmount.plus(heldAmount), locked);
  }
}
