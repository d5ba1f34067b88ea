package com.fiftyalert.dispatcher.domain.session;

import com.fiftyalert.common.event.ScoringEvent;
import com.fiftyalert.common.id.UlidGenerator;
import com.fiftyalert.dispatcher.domain.dispatch.AlertBatch;
import com.fiftyalert.dispatcher.domain.dispatch.AlertContentComposer;
import com.fiftyalert.dispatcher.domain.dispatch.DispatchDriver;
import com.fiftyalert.dispatcher.domain.dispatch.DispatchOutcome;
import com.fiftyalert.dispatcher.domain.event.ScoringEventSource;
import com.fiftyalert.dispatcher.domain.exceptions.EventSourceException;
import com.fiftyalert.dispatcher.domain.exceptions.LedgerCommitException;
import com.fiftyalert.dispatcher.domain.exceptions.LedgerCorruptedException;
import com.fiftyalert.dispatcher.domain.ledger.DeliveryLedger;
import com.fiftyalert.dispatcher.domain.policy.DispatchPolicy;
import com.fiftyalert.dispatcher.domain.recipient.Recipient;
import com.fiftyalert.dispatcher.domain.recipient.RecipientFetch;
import com.fiftyalert.dispatcher.domain.recipient.RecipientSource;
import com.fiftyalert.dispatcher.domain.validation.EventValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Semaphore;

/**
 * One end-to-end run: validate, diff against the ledger, fetch recipients, dispatch, decide.
 *
 * <p>The ledger is only written when every pending event is safe to mark as delivered: all
 * recipients were reached (or there are none), or at least {@link DispatchPolicy#successThreshold()}
 * of them were. A run that ends in any other state leaves the ledger untouched so the next run
 * re-diffs the same events.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DispatchSession {

    private final ScoringEventSource eventSource;
    private final EventValidator validator;
    private final DeliveryLedger ledger;
    private final RecipientSource recipientSource;
    private final DispatchDriver driver;
    private final AlertContentComposer composer;
    private final DispatchPolicy policy;

    /**
     * @throws LedgerCorruptedException when the persisted ledger cannot be trusted; the run halts
     */
    public SessionReport run() {
        var runId = UlidGenerator.generate();
        var report = SessionReport.builder().runId(runId);
        enter(runId, SessionState.IDLE);
        log.info("dispatch.session.started: run_id={}", runId);

        enter(runId, SessionState.VALIDATING);
        List<ScoringEvent> candidates;
        try {
            candidates = eventSource.fetchCandidates();
        } catch (EventSourceException e) {
            return defer(report, runId, "event source unavailable: " + e.getMessage());
        }
        var screened = screen(runId, candidates);
        var valid = screened.valid();
        report.candidates(candidates.size()).invalid(screened.invalid()).duplicates(screened.duplicates());

        enter(runId, SessionState.DIFFING);
        var ledgerState = ledger.load();
        var today = validator.today();
        var freshnessCutoff = today.minusDays(policy.freshnessWindowDays());
        var pending = new ArrayList<ScoringEvent>();
        int alreadyRecorded = 0;
        int stale = 0;
        for (var event : valid) {
            if (ledgerState.contains(event.alertKey())) {
                alreadyRecorded++;
            } else if (LocalDate.parse(event.date()).isBefore(freshnessCutoff)) {
                stale++;
                log.warn("dispatch.event.stale: run_id={}, alert_key={}, cutoff={}, not delivered and not recorded",
                        runId, event.alertKey(), freshnessCutoff);
            } else {
                pending.add(event);
            }
        }
        report.alreadyRecorded(alreadyRecorded).stale(stale).pending(pending.size());
        if (pending.isEmpty()) {
            log.info("dispatch.session.no_new_events: run_id={}, already_recorded={}, stale={}",
                    runId, alreadyRecorded, stale);
            return finish(report, SessionState.COMMITTED, "no new events", List.of());
        }
        pending.forEach(event -> log.info("dispatch.event.pending: run_id={}, player={}, points={}, date={}",
                runId, event.player(), event.points(), event.date()));
        var pendingKeys = pending.stream().map(ScoringEvent::alertKey).toList();

        enter(runId, SessionState.FETCHING_RECIPIENTS);
        var fetch = recipientSource.fetchAll();
        if (fetch instanceof RecipientFetch.Unavailable unavailable) {
            return defer(report, runId, "recipients unavailable: " + unavailable.reason());
        }
        var recipients = ((RecipientFetch.Available) fetch).recipients();
        report.recipients(recipients.size());
        if (recipients.isEmpty()) {
            log.info("dispatch.session.no_recipients: run_id={}, pending={}, recording as delivered", runId, pending.size());
            return commit(report, runId, pendingKeys, "no recipients, nothing left to retry", false);
        }

        enter(runId, SessionState.DISPATCHING);
        var batch = new AlertBatch(pending, composer.compose(pending));
        report.notification(batch.content());
        var tally = dispatch(runId, recipients, batch);
        report.tally(tally);

        enter(runId, SessionState.DECIDING);
        log.info("dispatch.session.tally: run_id={}, delivered={}, already_delivered={}, failed={}, effective_rate={}",
                runId, tally.delivered(), tally.alreadyDelivered(), tally.failed(), tally.effectiveRate());
        if (tally.allAlreadyDelivered()) {
            log.error("dispatch.session.fatal: run_id={}, all {} recipients reported the notification as already "
                            + "delivered on a first send; the transport is suppressing repeats, check its configuration",
                    runId, tally.alreadyDelivered());
            return finish(report, SessionState.FATAL, "every recipient reported already delivered", List.of());
        }
        if (tally.effectiveRate() < policy.successThreshold()) {
            return defer(report, runId, String.format(Locale.ROOT, "effective rate %.2f below threshold %.2f (failures: %s)",
                    tally.effectiveRate(), policy.successThreshold(), tally.failureReasons()));
        }
        return commit(report, runId, batch.alertKeys(), "delivered", true);
    }

    private Screened screen(String runId, List<ScoringEvent> candidates) {
        var byKey = new LinkedHashMap<String, ScoringEvent>();
        int invalid = 0;
        int duplicates = 0;
        for (var event : candidates) {
            var violations = validator.validate(event);
            if (!violations.isEmpty()) {
                invalid++;
                log.warn("dispatch.event.invalid: run_id={}, event={}, violations={}", runId, event, violations);
                continue;
            }
            if (byKey.putIfAbsent(event.alertKey(), event) != null) {
                duplicates++;
                log.debug("Duplicate candidate {} collapsed", event.alertKey());
            }
        }
        return new Screened(List.copyOf(byKey.values()), invalid, duplicates);
    }

    /**
     * Fans out to every recipient with at most {@code maxConcurrency} in flight and returns only
     * once every recipient has a final outcome.
     */
    private DeliveryTally dispatch(String runId, List<Recipient> recipients, AlertBatch batch) {
        var content = batch.content();
        log.info("dispatch.session.dispatching: run_id={}, recipients={}, alert_keys={}, notification={}",
                runId, recipients.size(), batch.alertKeys(), content.idempotencyKey());
        log.info("dispatch.session.content: run_id={}, subject=\"{}\"\n{}", runId, content.subject(), content.text());
        var permits = new Semaphore(policy.maxConcurrency());
        var futures = new ArrayList<CompletableFuture<DispatchOutcome>>(recipients.size());
        for (int i = 0; i < recipients.size(); i++) {
            if (i > 0 && policy.pacingEvery() > 0 && i % policy.pacingEvery() == 0) {
                pause(runId, i);
            }
            permits.acquireUninterruptibly();
            var future = driver.deliver(recipients.get(i), batch);
            future.whenComplete((outcome, error) -> permits.release());
            futures.add(future);
        }
        CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();
        return DeliveryTally.of(futures.stream().map(CompletableFuture::join).toList());
    }

    private void pause(String runId, int submitted) {
        try {
            Thread.sleep(policy.pacingPause().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Pacing pause interrupted for run {} after {} recipients", runId, submitted);
        }
    }

    /**
     * @param delivered whether notifications went out for {@code keys}; a failed write is only
     *                  {@link SessionState#UNRECORDED} when they did, otherwise the run simply defers
     */
    private SessionReport commit(SessionReport.SessionReportBuilder report, String runId, List<String> keys,
                                 String reason, boolean delivered) {
        try {
            var state = ledger.commit(keys);
            log.info("dispatch.session.committed: run_id={}, new_keys={}, ledger_size={}", runId, keys, state.size());
            return finish(report, SessionState.COMMITTED, reason, keys);
        } catch (LedgerCommitException e) {
            if (!delivered) {
                return defer(report, runId, "ledger write failed, nothing was sent: " + e.getMessage());
            }
            log.error("dispatch.session.unrecorded: run_id={}, keys={} were delivered but NOT recorded: {}. "
                    + "Add them to the ledger by hand before the next run or they will be sent again",
                    runId, keys, e.getMessage(), e);
            return finish(report, SessionState.UNRECORDED, "delivered but not recorded: " + e.getMessage(), List.of());
        }
    }

    private SessionReport defer(SessionReport.SessionReportBuilder report, String runId, String reason) {
        log.warn("dispatch.session.deferred: run_id={}, reason={}, ledger unchanged", runId, reason);
        return finish(report, SessionState.DEFERRED, reason, List.of());
    }

    private SessionReport finish(SessionReport.SessionReportBuilder report, SessionState state, String reason, List<String> keys) {
        if (!state.isTerminal()) {
            throw new IllegalArgumentException("Run cannot finish in non-terminal state " + state);
        }
        var built = report.state(state).reason(reason).committedKeys(keys).build();
        enter(built.runId(), state);
        return built;
    }

    private static void enter(String runId, SessionState state) {
        log.debug("dispatch.session.state: run_id={}, state={}", runId, state);
    }

    private record Screened(List<ScoringEvent> valid, int invalid, int duplicates) {
    }
}
