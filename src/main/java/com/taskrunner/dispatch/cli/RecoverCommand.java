package com.taskrunner.dispatch.cli;

import com.taskrunner.core.model.RecoveryRecord;
import com.taskrunner.core.recovery.RecoverySweeper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: taskrunner recover
 * <p>
 * Runs one recovery sweep immediately, failing every task stuck past its threshold.
 */
@Command(name = "recover", mixinStandardHelpOptions = true, description = "Run one recovery sweep")
@Component
public class RecoverCommand implements Runnable {

    private final RecoverySweeper sweeper;

    public RecoverCommand(RecoverySweeper sweeper) {
        this.sweeper = sweeper;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        var records = sweeper.sweep();
        if (records.isEmpty()) {
            ConsoleOutput.success("No stuck tasks");
            return;
        }
        for (RecoveryRecord record : records) {
            if (record.outcome() == RecoveryRecord.Outcome.SKIPPED_OPTIMISTIC_LOCK) {
                ConsoleOutput.info(record.taskId() + ": moved on before it could be failed");
            } else {
                ConsoleOutput.error(record.taskId() + ": " + record.reason());
            }
        }
    }
}
