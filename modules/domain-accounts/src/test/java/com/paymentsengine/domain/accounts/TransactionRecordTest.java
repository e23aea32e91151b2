package com.paymentsengine.domain.accounts;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class TransactionRecordTest {
  @Test
  void shouldCreateActiveRecordAndTransition() {
    TransactionRecord record =
        TransactionRecord.accepted(
            TxId.of(7), ClientId.of(3), Amount.parse("12.5"), TransactionKind.DEPOSIT);

    assertEquals(DisputeStatus.ACTIVE, record.status());

    TransactionRecord disputed = record.transitionTo(DisputeStatus.DISPUTED);
    assertEquals(DisputeStatus.DISPUTED, disputed.status());
    assertEquals(record.amount(), disputed.amount());
    assertEquals(DisputeStatus.ACTIVE, record.status());
  }

  @Test
  void shouldRejectNonPositiveAmount() {
    assertThrows(
        LedgerDomainException.class,
        () ->
            TransactionRecord.accepted(
                TxId.of(1), ClientId.of(1), Amount.ZERO, TransactionKind.WITHDRAWAL));
  }

  @Test
  void shouldRejectTransitionFromChargedBack() {
    TransactionRecord chargedBack =
        new TransactionRecord(
            TxId.of(1),
            ClientId.of(1),
            Amount.parse("1"),
            TransactionKind.DEPOSIT,
            DisputeStatus.CHARGED_BACK);

    assertThrows(
        LedgerDomainException.class, () -> chargedBack.transitionTo(DisputeStatus.DISPUTED));
  }

  @Test
  void shouldValidateIdentifierRanges() {
    assertThrows(IllegalArgumentException.class, () -> ClientId.of(65_536));
    assertThrows(IllegalArgumentException.class, () -> ClientId.of(-1));
    assertThrows(IllegalArgumentException.class, () -> TxId.of(4_294_967_296L));
    assertEquals(4_294_967_295L, TxId.of(4_294_967_295L).value());
    assertEquals(2, ClientId.of(10).shardIndex(4));
  }
}
