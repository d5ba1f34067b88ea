package com.fiftyalert.dispatcher.domain.session;

import com.fiftyalert.dispatcher.domain.dispatch.TransportOutcome;
import com.fiftyalert.dispatcher.domain.recipient.RecipientFetch;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DispatchSessionCommitTest extends DispatchSessionBaseTest {

    @Test
    void shouldDeliverAndRecordNewEvent() {
        // given
        candidates.add(event(YESTERDAY, "A. Player", 50));

        // when
        var report = session().run();

        // then
        assertThat(report.state()).isEqualTo(SessionState.COMMITTED);
        assertThat(report.success()).isTrue();
        assertThat(report.committedKeys()).containsExactly(KEY);
        assertThat(report.tally().delivered()).isEqualTo(3);
        assertThat(ledger.keys).containsExactly(KEY);
        assertThat(transport.total).hasValue(3);
    }

    @Test
    void shouldNotSendWhenEverythingIsAlreadyRecorded() {
        // given
        candidates.add(event(YESTERDAY, "A. Player", 50));
        ledger.keys.add(KEY);

        // when
        var report = session().run();

        // then
        assertThat(report.state()).isEqualTo(SessionState.COMMITTED);
        assertThat(report.reason()).isEqualTo("no new events");
        assertThat(report.alreadyRecorded()).isEqualTo(1);
        assertThat(report.tally().attempts()).isZero();
        assertThat(transport.total).hasValue(0);
        assertThat(ledger.commits).isZero();
    }

    @Test
    void shouldSkipStaleEventWithoutRecordingIt() {
        // given
        candidates.add(event("2024-01-06", "A. Player", 55));

        // when
        var report = session().run();

        // then
        assertThat(report.state()).isEqualTo(SessionState.COMMITTED);
        assertThat(report.stale()).isEqualTo(1);
        assertThat(transport.total).hasValue(0);
        assertThat(ledger.keys).isEmpty();
        assertThat(ledger.commits).isZero();
    }

    @Test
    void shouldBeIdempotentAcrossRuns() {
        // given
        candidates.add(event(YESTERDAY, "A. Player", 50));
        session().run();

        // when
        var second = session().run();

        // then
        assertThat(second.state()).isEqualTo(SessionState.COMMITTED);
        assertThat(second.pending()).isZero();
        assertThat(transport.total).hasValue(3);
        assertThat(ledger.keys).containsExactly(KEY);
    }

    @Test
    void shouldRecordPendingEventsWhenAudienceIsEmpty() {
        // given
        candidates.add(event(YESTERDAY, "A. Player", 50));
        audience = RecipientFetch.available(List.of());

        // when
        var report = session().run();

        // then
        assertThat(report.state()).isEqualTo(SessionState.COMMITTED);
        assertThat(report.recipients()).isZero();
        assertThat(ledger.keys).containsExactly(KEY);
        assertThat(transport.total).hasValue(0);
    }

    @Test
    void shouldDropInvalidEventsAndRecordOnlyValidOnes() {
        // given
        candidates.add(event(YESTERDAY, "A. Player", 50));
        candidates.add(event(YESTERDAY, "B. Guard", 120));
        candidates.add(event(YESTERDAY, "C. Wing", 49));

        // when
        var report = session().run();

        // then
        assertThat(report.state()).isEqualTo(SessionState.COMMITTED);
        assertThat(report.candidates()).isEqualTo(3);
        assertThat(report.invalid()).isEqualTo(2);
        assertThat(report.duplicates()).isZero();
        assertThat(ledger.keys).containsExactly(KEY);
    }

    @Test
    void shouldCollapseDuplicateCandidates() {
        // given
        candidates.add(event(YESTERDAY, "A. Player", 50));
        candidates.add(event(YESTERDAY, "A. Player", 50));

        // when
        var report = session().run();

        // then
        assertThat(report.pending()).isEqualTo(1);
        assertThat(report.invalid()).isZero();
        assertThat(report.duplicates()).isEqualTo(1);
        assertThat(report.committedKeys()).containsExactly(KEY);
        assertThat(transport.total).hasValue(3);
    }

    @Test
    void shouldSendOneNotificationPerRecipientForSeveralEvents() {
        // given
        candidates.add(event(YESTERDAY, "A. Player", 50));
        candidates.add(event("2024-01-11", "B. Guard", 63));

        // when
        var report = session().run();

        // then
        assertThat(report.state()).isEqualTo(SessionState.COMMITTED);
        assertThat(report.committedKeys()).containsExactlyInAnyOrder(KEY, "2024-01-11_B. Guard_63");
        assertThat(transport.total).hasValue(3);
        assertThat(transport.contents).containsExactly(report.notification());
        assertThat(report.notification().subject()).contains("B. Guard scored 63 points");
        assertThat(report.notification().text()).contains("A. Player: 50 points, LAL vs BOS, January 10, 2024");
    }

    @Test
    void shouldCommitAtExactlyTheThreshold() {
        // given
        candidates.add(event(YESTERDAY, "A. Player", 50));
        audience = RecipientFetch.available(recipients(20));
        transport.scripted.put("contact-20", new TransportOutcome.PermanentFailure("HTTP 400"));

        // when
        var report = session().run();

        // then
        assertThat(report.tally().effectiveRate()).isEqualTo(0.95);
        assertThat(report.state()).isEqualTo(SessionState.COMMITTED);
        assertThat(ledger.keys).containsExactly(KEY);
    }

    @Test
    void shouldCountAlreadyDeliveredTowardsSuccessWhenOthersAreNew() {
        // given
        candidates.add(event(YESTERDAY, "A. Player", 50));
        transport.scripted.put("contact-1", new TransportOutcome.AlreadyNotified());

        // when
        var report = session().run();

        // then
        assertThat(report.state()).isEqualTo(SessionState.COMMITTED);
        assertThat(report.tally().alreadyDelivered()).isEqualTo(1);
        assertThat(report.tally().delivered()).isEqualTo(2);
    }
}
