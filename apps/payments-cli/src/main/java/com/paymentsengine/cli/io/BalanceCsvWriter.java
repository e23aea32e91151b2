package com.paymentsengine.cli.io;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.paymentsengine.domain.accounts.AccountBalance;
import com.paymentsengine.engine.snapshot.BalanceSnapshot;
import java.io.IOException;
import java.io.Writer;

/** Renders a completed snapshot as {@code client,available,held,total,locked} CSV. */
public class BalanceCsvWriter {
  private static final CsvMapper CSV_MAPPER =
      CsvMapper.builder().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET).build();
  private static final CsvSchema SCHEMA = CSV_MAPPER.schemaFor(BalanceCsvRow.class).withHeader();

  /** Leaves {@code out} open; the caller owns the stream. */
  public void write(BalanceSnapshot snapshot, Writer out) throws IOException {
    try (SequenceWriter sequence = CSV_MAPPER.writer(SCHEMA).writeValues(out)) {
      for (AccountBalance balance : snapshot.balances()) {
        sequence.write(BalanceCsvRow.from(balance));
      }
    }
    out.flush();
  }
}
