package com.paymentsengine.cli;

import com.paymentsengine.cli.io.BalanceCsvWriter;
import com.paymentsengine.cli.io.CsvPaymentRecordReader;
import com.paymentsengine.engine.EventDispatcher;
import com.paymentsengine.engine.RunResult;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Processes the transactions file named by the single positional argument and prints the final
 * balances to stdout. Nothing is printed unless the whole run completed.
 */
@Component
public class PaymentsRunner implements ApplicationRunner, ExitCodeGenerator {
  private static final Logger log = LoggerFactory.getLogger(PaymentsRunner.class);
  private static final String USAGE = "Usage: payments-cli <transactions.csv>";

  private final EventDispatcher dispatcher;
  private final BalanceCsvWriter balanceWriter;
  private final OutputStream out;
  private volatile int exitCode = CliExitCodes.SUCCESS;

  @Autowired
  public PaymentsRunner(EventDispatcher dispatcher, BalanceCsvWriter balanceWriter) {
    this(dispatcher, balanceWriter, System.out);
  }

  PaymentsRunner(EventDispatcher dispatcher, BalanceCsvWriter balanceWriter, OutputStream out) {
    this.dispatcher = dispatcher;
    this.balanceWriter = balanceWriter;
    this.out = out;
  }

  @Override
  public void run(ApplicationArguments args) {
    List<String> positional = args.getNonOptionArgs();
    if (positional.size() != 1) {
      log.error("{} (got {} arguments)", USAGE, positional.size());
      exitCode = CliExitCodes.USAGE;
      return;
    }
    Path input = Path.of(positional.get(0));
    if (!Files.isRegularFile(input) || !Files.isReadable(input)) {
      log.error("Cannot read input file path={}", input);
      exitCode = CliExitCodes.USAGE;
      return;
    }

    RunResult result;
    try (CsvPaymentRecordReader records = CsvPaymentRecordReader.open(input)) {
      result = dispatcher.run(records);
    } catch (IOException ex) {
      log.error("Failed to open input file path={} error={}", input, ex.getMessage());
      exitCode = CliExitCodes.RUN_ABORTED;
      return;
    }

    if (!result.isCompleted()) {
      RuntimeException failure = result.failure().orElseThrow();
      log.error("Run aborted path={} error={}", input, failure.getMessage());
      exitCode = CliExitCodes.RUN_ABORTED;
      return;
    }

    try {
      Writer writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
      balanceWriter.write(result.snapshot(), writer);
      exitCode = CliExitCodes.SUCCESS;
    } catch (IOException | UncheckedIOException ex) {
      log.error("Failed to write balances error={}", ex.getMessage());
      exitCode = CliExitCodes.RUN_ABORTED;
    }
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }
}
