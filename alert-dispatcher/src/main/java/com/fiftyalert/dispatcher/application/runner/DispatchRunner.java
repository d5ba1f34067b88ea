package com.fiftyalert.dispatcher.application.runner;

import com.fiftyalert.dispatcher.domain.exceptions.LedgerCorruptedException;
import com.fiftyalert.dispatcher.domain.session.DispatchSession;
import com.fiftyalert.dispatcher.domain.session.SessionReport;
import com.fiftyalert.dispatcher.domain.session.SessionState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Runs one dispatch session per process and turns its end state into the process exit code:
 * 0 committed, 1 deferred, 2 fatal, 3 delivered but not recorded, 4 ledger corrupted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DispatchRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_COMMITTED = 0;
    static final int EXIT_DEFERRED = 1;
    static final int EXIT_FATAL = 2;
    static final int EXIT_UNRECORDED = 3;
    static final int EXIT_LEDGER_CORRUPTED = 4;

    private static final String SESSIONS_METER = "dispatch.sessions";

    private final DispatchSession session;
    private final MeterRegistry meterRegistry;
    private final Counter recipientsDeliveredCounter;
    private final Counter recipientsAlreadyDeliveredCounter;
    private final Counter recipientsFailedCounter;

    private volatile int exitCode = EXIT_COMMITTED;

    @Override
    public void run(ApplicationArguments args) {
        try {
            var report = session.run();
            record(report);
            exitCode = exitCodeFor(report.state());
        } catch (LedgerCorruptedException e) {
            log.error("dispatch.halted: ledger corrupted, nothing was sent. Repair or restore the ledger "
                    + "before the next run. {}", e.getMessage(), e);
            meterRegistry.counter(SESSIONS_METER, "outcome", "ledger_corrupted").increment();
            exitCode = EXIT_LEDGER_CORRUPTED;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    static int exitCodeFor(SessionState state) {
        return switch (state) {
            case COMMITTED -> EXIT_COMMITTED;
            case DEFERRED -> EXIT_DEFERRED;
            case UNRECORDED -> EXIT_UNRECORDED;
            default -> EXIT_FATAL;
        };
    }

    private void record(SessionReport report) {
        var tally = report.tally();
        recipientsDeliveredCounter.increment(tally.delivered());
        recipientsAlreadyDeliveredCounter.increment(tally.alreadyDelivered());
        recipientsFailedCounter.increment(tally.failed());
        meterRegistry.counter(SESSIONS_METER, "outcome", report.state().name().toLowerCase(Locale.ROOT)).increment();

        log.info("dispatch.summary: run_id={}, state={}, reason={}, candidates={}, invalid={}, duplicates={}, "
                        + "already_recorded={}, stale={}, pending={}, recipients={}, delivered={}, already_delivered={}, "
                        + "failed={}, committed={}",
                report.runId(), report.state(), report.reason(), report.candidates(), report.invalid(),
                report.duplicates(), report.alreadyRecorded(), report.stale(), report.pending(), report.recipients(),
                tally.delivered(), tally.alreadyDelivered(), tally.failed(), report.committedKeys());
    }
}
