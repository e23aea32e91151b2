package com.paymentsengine.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.paymentsengine.domain.accounts.AccountBalance;
import com.paymentsengine.domain.accounts.Amount;
import com.paymentsengine.domain.accounts.AmountOverflowException;
import com.paymentsengine.domain.accounts.ClientId;
import com.paymentsengine.domain.events.EventValidator;
import com.paymentsengine.domain.events.InvalidInputException;
import com.paymentsengine.domain.events.InvalidInputReason;
import com.paymentsengine.domain.events.RawPaymentRecord;
import com.paymentsengine.engine.config.EngineProperties;
import com.paymentsengine.engine.observability.MicrometerEngineTelemetry;
import com.paymentsengine.engine.observability.NoOpEngineTelemetry;
import com.paymentsengine.engine.snapshot.BalanceSnapshot;
import com.paymentsengine.engine.snapshot.SnapshotExporter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class EventDispatcherTest {

  @ParameterizedTest
  @ValueSource(ints = {1, 4})
  void shouldProcessMixedBatch(int shardCount) {
    RunResult result =
        dispatcher(shardCount)
            .run(
                rows(
                    "deposit,1,1,1.0",
                    "deposit,2,2,2.0",
                    "deposit,1,3,2.0",
                    "withdrawal,1,4,1.5",
                    "withdrawal,2,5,3.0"));

    assertTrue(result.isCompleted());
    BalanceSnapshot snapshot = result.snapshot();
    assertEquals(2, snapshot.size());
    assertBalance(snapshot, 1, "1.5", "0", "1.5", false);
    assertBalance(snapshot, 2, "2", "0", "2", false);
    assertEquals(5L, result.statistics().eventsRead());
    assertEquals(shardCount, result.statistics().shardCount());
    assertEquals(2, result.statistics().accounts());
  }

  @Test
  void shouldSumFractionalDepositsExactly() {
    List<String> lines = new ArrayList<>();
    for (int tx = 1; tx <= 1_000; tx++) {
      lines.add("deposit,7," + tx + ",0.0001");
    }

    BalanceSnapshot snapshot = dispatcher(2).run(rows(lines.toArray(new String[0]))).snapshot();

    assertBalance(snapshot, 7, "0.1", "0", "0.1", false);
  }

  @Test
  void shouldRunDisputeResolveRoundTrip() {
    BalanceSnapshot snapshot =
        dispatcher(2)
            .run(rows("deposit,1,1,10", "dispute,1,1,", "resolve,1,1,", "withdrawal,1,2,4"))
            .snapshot();

    assertBalance(snapshot, 1, "6", "0", "6", false);
  }

  @Test
  void shouldLockAccountOnChargebackForTheRestOfTheRun() {
    BalanceSnapshot snapshot =
        dispatcher(3)
            .run(
                rows(
                    "deposit,1,1,10",
                    "deposit,1,2,5",
                    "dispute,1,1,",
                    "chargeback,1,1,",
                    "deposit,1,3,100",
                    "withdrawal,1,4,1",
                    "dispute,1,2,"))
            .snapshot();

    assertBalance(snapshot, 1, "5", "0", "5", true);
  }

  @Test
  void shouldIgnorePartnerErrorsSilently() {
    RunResult result =
        dispatcher(2)
            .run(
                rows(
                    "withdrawal,1,1,5",
                    "deposit,2,2,3",
                    "dispute,2,99,",
                    "resolve,2,2,",
                    "chargeback,2,2,",
                    "dispute,1,2,"));

    assertTrue(result.isCompleted());
    assertBalance(result.snapshot(), 1, "0", "0", "0", false);
    assertBalance(result.snapshot(), 2, "3", "0", "3", false);
  }

  @Test
  void shouldNotCreateAccountsForDisputeStepsOfUnknownClients() {
    BalanceSnapshot snapshot =
        dispatcher(2).run(rows("deposit,1,1,1", "dispute,5,1,", "chargeback,6,1,")).snapshot();

    assertEquals(1, snapshot.size());
    assertTrue(snapshot.find(ClientId.of(5)).isEmpty());
  }

  @Test
  void shouldAbortOnDuplicateTransactionIdAcrossClients() {
    RunResult result = dispatcher(4).run(rows("deposit,1,1,1", "deposit,2,1,1"));

    assertFalse(result.isCompleted());
    InvalidInputException failure =
        assertInstanceOf(InvalidInputException.class, result.failure().orElseThrow());
    assertEquals(InvalidInputReason.DUPLICATE_TRANSACTION, failure.reason());
    assertEquals(3L, failure.lineNumber());
    assertThrows(IllegalStateException.class, result::snapshot);
  }

  @Test
  void shouldAbortWhenIgnoredWithdrawalIdIsReused() {
    RunResult result = dispatcher(1).run(rows("withdrawal,1,1,5", "deposit,1,1,5"));

    assertFalse(result.isCompleted());
  }

  @Test
  void shouldAbortOnAmountWithTooManyDecimals() {
    RunResult result =
        dispatcher(2).run(rows("deposit,1,1,1.0", "deposit,2,2,1.00001", "deposit,3,3,1"));

    assertFalse(result.isCompleted());
    InvalidInputException failure =
        assertInstanceOf(InvalidInputException.class, result.failure().orElseThrow());
    assertEquals(InvalidInputReason.INVALID_AMOUNT, failure.reason());
    assertEquals(2L, result.statistics().eventsRead());
    assertEquals(0, result.statistics().accounts());
  }

  @Test
  void shouldAbortWhenShardFailsWithOverflow() {
    String max = Amount.ofTicks(Long.MAX_VALUE).toPlainString();
    List<String> lines = new ArrayList<>();
    lines.add("deposit,1,1," + max);
    lines.add("deposit,1,2,0.0001");
    for (int tx = 3; tx < 200; tx++) {
      lines.add("deposit,2," + tx + ",1");
    }

    RunResult result = dispatcher(2).run(rows(lines.toArray(new String[0])));

    assertFalse(result.isCompleted());
    assertInstanceOf(AmountOverflowException.class, result.failure().orElseThrow());
  }

  @Test
  void shouldAbortWhenReaderFails() {
    Iterator<RawPaymentRecord> failing =
        new Iterator<>() {
          private int served;

          @Override
          public boolean hasNext() {
            return true;
          }

          @Override
          public RawPaymentRecord next() {
            if (served++ == 2) {
              throw new UncheckedIOException(new IOException("connection reset"));
            }
            return record(served + 1, "deposit", "1", String.valueOf(served), "1");
          }
        };

    RunResult result = dispatcher(2).run(failing);

    assertFalse(result.isCompleted());
    assertInstanceOf(UncheckedIOException.class, result.failure().orElseThrow());
  }

  @Test
  void shouldCompleteEmptyRunWithoutAccounts() {
    RunResult result = dispatcher(3).run(rows());

    assertTrue(result.isCompleted());
    assertTrue(result.snapshot().balances().isEmpty());
  }

  @Test
  void shouldProduceSameBalancesForAnyCrossClientInterleavingAndShardCount() {
    String[] grouped = {
      "deposit,1,1,10", "withdrawal,1,2,3", "dispute,1,1,", "resolve,1,1,",
      "deposit,2,3,4.5", "dispute,2,3,", "chargeback,2,3,", "deposit,2,4,1",
      "deposit,3,5,0.0001", "withdrawal,3,6,1", "deposit,3,7,2"
    };
    String[] interleaved = {
      "deposit,3,5,0.0001", "deposit,2,3,4.5", "deposit,1,1,10", "withdrawal,3,6,1",
      "dispute,2,3,", "withdrawal,1,2,3", "chargeback,2,3,", "deposit,3,7,2",
      "dispute,1,1,", "deposit,2,4,1", "resolve,1,1,"
    };

    List<AccountBalance> expected = dispatcher(1).run(rows(grouped)).snapshot().balances();

    assertEquals(expected, dispatcher(4).run(rows(grouped)).snapshot().balances());
    assertEquals(expected, dispatcher(1).run(rows(interleaved)).snapshot().balances());
    assertEquals(expected, dispatcher(3).run(rows(interleaved)).snapshot().balances());
    assertBalance(dispatcher(2).run(rows(interleaved)).snapshot(), 2, "0", "0", "0", true);
  }

  @Test
  void shouldKeepFirstSeenOrderWhenSortingIsDisabled() {
    EngineProperties properties = properties(1);
    properties.setSortedOutput(false);
    EventDispatcher dispatcher =
        new EventDispatcher(
            properties, new EventValidator(), new SnapshotExporter(), new NoOpEngineTelemetry());

    BalanceSnapshot snapshot =
        dispatcher.run(rows("deposit,9,1,1", "deposit,3,2,1", "deposit,5,3,1")).snapshot();

    assertEquals(
        List.of(ClientId.of(9), ClientId.of(3), ClientId.of(5)),
        snapshot.balances().stream().map(AccountBalance::clientId).toList());
  }

  @Test
  void shouldSurviveTinyQueues() {
    EngineProperties properties = properties(2);
    properties.setQueueCapacity(1);
    properties.setEnqueuePollMs(1L);
    EventDispatcher dispatcher =
        new EventDispatcher(
            properties, new EventValidator(), new SnapshotExporter(), new NoOpEngineTelemetry());
    List<String> lines = new ArrayList<>();
    for (int tx = 1; tx <= 500; tx++) {
      lines.add("deposit," + (tx % 5) + "," + tx + ",1");
    }

    BalanceSnapshot snapshot = dispatcher.run(rows(lines.toArray(new String[0]))).snapshot();

    assertEquals(5, snapshot.size());
    assertBalance(snapshot, 0, "100", "0", "100", false);
  }

  @Test
  void shouldReportRunOutcomeToTelemetry() {
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    EventDispatcher dispatcher =
        new EventDispatcher(
            properties(2),
            new EventValidator(),
            new SnapshotExporter(),
            new MicrometerEngineTelemetry(registry));

    dispatcher.run(rows("deposit,1,1,1", "withdrawal,1,2,5"));
    dispatcher.run(rows("deposit,1,1,1", "deposit,1,1,1"));

    assertEquals(
        1.0,
        registry
            .get("engine.events.total")
            .tags("event_type", "withdrawal", "outcome", "insufficient_funds")
            .counter()
            .count());
    assertEquals(
        1.0, registry.get("engine.run.total").tags("outcome", "completed").counter().count());
    assertEquals(
        1.0, registry.get("engine.run.total").tags("outcome", "aborted").counter().count());
  }

  private static EventDispatcher dispatcher(int shardCount) {
    return new EventDispatcher(
        properties(shardCount),
        new EventValidator(),
        new SnapshotExporter(),
        new NoOpEngineTelemetry());
  }

  private static EngineProperties properties(int shardCount) {
    EngineProperties properties = new EngineProperties();
    properties.setShardCount(shardCount);
    properties.setQueueCapacity(16);
    properties.setEnqueuePollMs(5L);
    return properties;
  }

  private static Iterator<RawPaymentRecord> rows(String... lines) {
    List<RawPaymentRecord> records = new ArrayList<>(lines.length);
    for (int i = 0; i < lines.length; i++) {
      String[] cells = lines[i].split(",", -1);
      records.add(
          record(i + 2, cells[0], cells[1], cells[2], cells.length > 3 ? cells[3] : null));
    }
    return records.iterator();
  }

  private static RawPaymentRecord record(
      long line, String type, String client, String tx, String amount) {
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put("type", type);
    fields.put("client", client);
    fields.put("tx", tx);
    if (amount != null) {
      fields.put("amount", amount);
    }
    return new RawPaymentRecord(line, fields);
  }

  private static void assertBalance(
      BalanceSnapshot snapshot,
      int client,
      String available,
      String held,
      String total,
      boolean locked) {
    AccountBalance balance = snapshot.find(ClientId.of(client)).orElseThrow();
    assertEquals(Amount.parse(available), balance.available());
    assertEquals(Amount.parse(held), balance.held());
    assertEquals(Amount.parse(total), balance.total());
    assertEquals(locked, balance.locked());
  }
}
