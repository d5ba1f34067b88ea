package com.fiftyalert.dispatcher.domain.session;

import com.fiftyalert.common.event.ScoringEvent;
import com.fiftyalert.dispatcher.domain.dispatch.AlertContent;
import com.fiftyalert.dispatcher.domain.dispatch.AlertContentComposer;
import com.fiftyalert.dispatcher.domain.dispatch.DispatchDriver;
import com.fiftyalert.dispatcher.domain.dispatch.NotificationTransport;
import com.fiftyalert.dispatcher.domain.dispatch.TransportOutcome;
import com.fiftyalert.dispatcher.domain.event.ScoringEventSource;
import com.fiftyalert.dispatcher.domain.exceptions.EventSourceException;
import com.fiftyalert.dispatcher.domain.exceptions.LedgerCommitException;
import com.fiftyalert.dispatcher.domain.exceptions.LedgerCorruptedException;
import com.fiftyalert.dispatcher.domain.ledger.DeliveryLedger;
import com.fiftyalert.dispatcher.domain.ledger.LedgerState;
import com.fiftyalert.dispatcher.domain.policy.DispatchPolicy;
import com.fiftyalert.dispatcher.domain.recipient.Recipient;
import com.fiftyalert.dispatcher.domain.recipient.RecipientFetch;
import com.fiftyalert.dispatcher.domain.recipient.RecipientSource;
import com.fiftyalert.dispatcher.domain.validation.EventValidator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

public abstract class DispatchSessionBaseTest {

    // noon in New York on 2024-01-11
    static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-11T17:00:00Z"), ZoneOffset.UTC);
    static final String YESTERDAY = "2024-01-10";
    static final String KEY = "2024-01-10_A. Player_50";

    InMemoryLedger ledger;
    ScriptedTransport transport;
    List<ScoringEvent> candidates;
    RecipientFetch audience;
    boolean eventSourceDown;
    DispatchPolicy policy;
    ExecutorService executor;

    @BeforeEach
    void setUp() {
        ledger = new InMemoryLedger();
        transport = new ScriptedTransport();
        candidates = new ArrayList<>();
        audience = RecipientFetch.available(recipients(3));
        eventSourceDown = false;
        policy = DispatchPolicy.defaults().toBuilder().pacingEvery(0).build();
        executor = Executors.newFixedThreadPool(policy.maxConcurrency());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    DispatchSession session() {
        ScoringEventSource events = () -> {
            if (eventSourceDown) {
                throw EventSourceException.missing(Path.of("data/50_club.json"));
            }
            return candidates;
        };
        RecipientSource recipients = () -> audience;
        var driver = new DispatchDriver(transport, attempt -> 0L, policy, executor);
        return new DispatchSession(
                events, new EventValidator(policy, CLOCK), ledger, recipients, driver, new AlertContentComposer(), policy);
    }

    static ScoringEvent event(String date, String player, int points) {
        return ScoringEvent.builder().date(date).player(player).team("LAL").points(points).opponent("BOS").build();
    }

    static List<Recipient> recipients(int count) {
        return IntStream.rangeClosed(1, count)
                .mapToObj(i -> new Recipient("contact-" + i, "fan" + i + "@example.com"))
                .toList();
    }

    static class InMemoryLedger implements DeliveryLedger {

        final Set<String> keys = new LinkedHashSet<>();
        int commits;
        boolean failCommit;
        boolean corrupted;

        @Override
        public LedgerState load() {
            if (corrupted) {
                throw LedgerCorruptedException.of(Path.of("data/emails.json"), "'sent_alerts' is not an array", null);
            }
            return new LedgerState(keys, null);
        }

        @Override
        public LedgerState commit(Collection<String> newKeys) {
            commits++;
            if (failCommit) {
                throw LedgerCommitException.of(Path.of("data/emails.json"), new IOException("No space left on device"));
            }
            keys.addAll(newKeys);
            return new LedgerState(keys, CLOCK.instant());
        }
    }

    /**
     * Answers {@link TransportOutcome.Sent} unless a recipient has a scripted outcome. Each call holds
     * for {@code latencyMillis} so overlapping calls can be observed through {@code peakInFlight}.
     */
    static class ScriptedTransport implements NotificationTransport {

        final Map<String, TransportOutcome> scripted = new ConcurrentHashMap<>();
        final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
        final AtomicInteger total = new AtomicInteger();
        final AtomicInteger inFlight = new AtomicInteger();
        final AtomicInteger peakInFlight = new AtomicInteger();
        final Set<AlertContent> contents = ConcurrentHashMap.newKeySet();
        volatile long latencyMillis;

        void answerAll(int count, TransportOutcome outcome) {
            recipients(count).forEach(recipient -> scripted.put(recipient.id(), outcome));
        }

        @Override
        public TransportOutcome send(Recipient recipient, AlertContent content) {
            peakInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            try {
                total.incrementAndGet();
                calls.computeIfAbsent(recipient.id(), id -> new AtomicInteger()).incrementAndGet();
                contents.add(content);
                if (latencyMillis > 0) {
                    Thread.sleep(latencyMillis);
                }
                return scripted.getOrDefault(recipient.id(), new TransportOutcome.Sent());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return new TransportOutcome.TransientFailure("interrupted");
            } finally {
                inFlight.decrementAndGet();
            }
        }
    }
}
