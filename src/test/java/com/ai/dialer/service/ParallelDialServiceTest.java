package com.ai.dialer.service;

import com.ai.dialer.MutableClock;
import com.ai.dialer.component.ConferenceTwimlBuilder;
import com.ai.dialer.config.DialerProperties;
import com.ai.dialer.dto.ParallelDialRequest;
import com.ai.dialer.exception.CallerIdLockedException;
import com.ai.dialer.exception.GroupNotFoundException;
import com.ai.dialer.exception.InvalidDialRequestException;
import com.ai.dialer.exception.TelephonyException;
import com.ai.dialer.model.AnsweredBy;
import com.ai.dialer.model.AttemptStatus;
import com.ai.dialer.model.NumberPool;
import com.ai.dialer.model.OutboundCall;
import com.ai.dialer.model.ParallelCallAttempt;
import com.ai.dialer.model.ParallelDialGroup;
import com.ai.dialer.model.ParallelDialRequirements;
import com.ai.dialer.model.ParallelGroupStatus;
import com.ai.dialer.model.PhoneNumberCandidate;
import com.ai.dialer.store.InMemoryCallerIdLockStore;
import com.ai.dialer.store.InMemoryParallelGroupStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ParallelDialServiceTest {

    private static final List<String> CUSTOMERS = List.of("+13105550101", "+13105550102", "+13105550103");
    private static final List<String> FROM = List.of("+12125550001", "+12125550002", "+12125550003");

    private TelephonyGateway telephony;
    private CallerIdLockService lockService;
    private InMemoryParallelGroupStore store;
    private ParallelDialService service;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        DialerProperties properties = new DialerProperties();
        properties.setBaseUrl("https://dialer.example.com/");
        properties.getParallel().setStagger(Duration.ZERO);

        telephony = mock(TelephonyGateway.class);
        lockService = new CallerIdLockService(new InMemoryCallerIdLockStore(clock), clock, properties);
        store = new InMemoryParallelGroupStore(clock, Duration.ofMinutes(5));
        service = new ParallelDialService(store, telephony, lockService, new LocalPresenceService(100, null),
                new ConferenceTwimlBuilder(), properties, clock);

        when(telephony.dial(any(OutboundCall.class))).thenReturn("CA1", "CA2", "CA3");
    }

    @Test
    void initiatePlacesOneCallPerNumberWithMachineDetection() {
        ParallelDialGroup group = service.initiateGroup(request(FROM));

        ArgumentCaptor<OutboundCall> calls = ArgumentCaptor.forClass(OutboundCall.class);
        verify(telephony, times(3)).dial(calls.capture());
        assertThat(calls.getAllValues()).extracting(OutboundCall::to).containsExactlyElementsOf(CUSTOMERS);
        assertThat(calls.getAllValues()).extracting(OutboundCall::from).containsExactlyElementsOf(FROM);
        assertThat(calls.getAllValues()).allMatch(OutboundCall::machineDetection);
        assertThat(calls.getValue().statusCallbackUrl())
                .isEqualTo("https://dialer.example.com" + ParallelDialService.STATUS_CALLBACK_PATH
                        + "?groupId=" + group.getGroupId());

        assertThat(group.getGroupId()).matches("pg_[0-9a-f]{12}");
        assertThat(group.getConferenceName()).isEqualTo(group.getGroupId() + "_queue-7");
        assertThat(group.getStatus()).isEqualTo(ParallelGroupStatus.DIALING);
        assertThat(group.getCalls()).extracting(ParallelCallAttempt::getPosition).containsExactly(1, 2, 3);
        assertThat(group.getCalls()).extracting(ParallelCallAttempt::getContactId).containsExactly("c1", "c2", "c3");
        assertThat(lockService.findByCallReference("CA2")).isPresent();
        assertThat(lockService.findByCallReference(group.getGroupId() + ":2")).isEmpty();
    }

    @Test
    void firstHumanAnswerWinsAndOthersAreHungUp() {
        ParallelDialGroup group = service.initiateGroup(request(FROM));

        service.handleStatusCallback("CA1", "ringing", null, null);
        service.handleStatusCallback("CA2", "in-progress", "human", null);

        ParallelDialGroup after = service.getGroup(group.getGroupId()).orElseThrow();
        assertThat(after.getStatus()).isEqualTo(ParallelGroupStatus.CONNECTED);
        assertThat(after.getWinnerCallReference()).isEqualTo("CA2");
        assertThat(status(after, "CA1")).isEqualTo(AttemptStatus.TERMINATED);
        assertThat(status(after, "CA3")).isEqualTo(AttemptStatus.TERMINATED);
        verify(telephony).hangup("CA1");
        verify(telephony).hangup("CA3");
        verify(telephony, never()).hangup("CA2");

        assertThat(lockService.isAvailable(FROM.get(0))).isTrue();
        assertThat(lockService.isAvailable(FROM.get(1))).isFalse();
        assertThat(lockService.isAvailable(FROM.get(2))).isTrue();
        assertThat(service.getReleasableNumbers(after)).containsExactly(FROM.get(0), FROM.get(2));
    }

    @Test
    void duplicateAndLateCallbacksHaveNoFurtherEffect() {
        ParallelDialGroup group = service.initiateGroup(request(FROM));

        service.handleStatusCallback("CA2", "in-progress", "human", null);
        service.handleStatusCallback("CA2", "in-progress", "human", null);
        service.handleStatusCallback("CA3", "in-progress", "human", null);
        service.handleStatusCallback("CA1", "ringing", null, null);

        ParallelDialGroup after = service.getGroup(group.getGroupId()).orElseThrow();
        assertThat(after.getWinnerCallReference()).isEqualTo("CA2");
        assertThat(status(after, "CA1")).isEqualTo(AttemptStatus.TERMINATED);
        verify(telephony, times(1)).hangup("CA1");
        verify(telephony, times(1)).hangup("CA3");
    }

    @Test
    void winnerCompletionCompletesGroupAndReleasesItsLock() {
        ParallelDialGroup group = service.initiateGroup(request(FROM));
        service.handleStatusCallback("CA2", "in-progress", "human", null);

        service.handleStatusCallback("CA2", "completed", null, null);

        ParallelDialGroup after = service.getGroup(group.getGroupId()).orElseThrow();
        assertThat(after.getStatus()).isEqualTo(ParallelGroupStatus.COMPLETED);
        assertThat(lockService.isAvailable(FROM.get(1))).isTrue();
        assertThat(service.getReleasableNumbers(after)).containsExactly(FROM.get(0), FROM.get(2));
    }

    @Test
    void machineAnswerIsIneligibleAndLeftUpUntilGroupResolves() {
        ParallelDialGroup group = service.initiateGroup(request(FROM));

        service.handleStatusCallback("CA1", "in-progress", "machine_start", null);

        ParallelDialGroup mid = service.getGroup(group.getGroupId()).orElseThrow();
        assertThat(status(mid, "CA1")).isEqualTo(AttemptStatus.NO_ANSWER);
        assertThat(mid.findAttempt("CA1").orElseThrow().getAnsweredBy()).isEqualTo(AnsweredBy.MACHINE);
        verify(telephony, never()).hangup(anyString());

        service.handleStatusCallback("CA3", "in-progress", "human", null);

        assertThat(service.getGroup(group.getGroupId()).orElseThrow().getWinnerCallReference()).isEqualTo("CA3");
        verify(telephony).hangup("CA1");
        verify(telephony).hangup("CA2");
    }

    @Test
    void answerWithoutClassificationWaitsForDetection() {
        ParallelDialGroup group = service.initiateGroup(request(FROM));

        service.handleStatusCallback("CA1", "in-progress", null, null);
        service.handleStatusCallback("CA1", "ringing", null, null);

        ParallelDialGroup mid = service.getGroup(group.getGroupId()).orElseThrow();
        assertThat(mid.hasWinner()).isFalse();
        assertThat(status(mid, "CA1")).isEqualTo(AttemptStatus.ANSWERED);

        service.handleStatusCallback("CA1", "in-progress", "unknown", null);

        assertThat(service.getGroup(group.getGroupId()).orElseThrow().getWinnerCallReference()).isEqualTo("CA1");
    }

    @Test
    void groupFailsWhenEveryAttemptEndsWithoutHuman() {
        ParallelDialGroup group = service.initiateGroup(request(FROM));

        service.handleStatusCallback("CA1", "busy", null, null);
        service.handleStatusCallback("CA2", "no-answer", null, null);
        service.handleStatusCallback("CA3", "failed", null, null);

        ParallelDialGroup after = service.getGroup(group.getGroupId()).orElseThrow();
        assertThat(after.getStatus()).isEqualTo(ParallelGroupStatus.FAILED);
        assertThat(after.hasWinner()).isFalse();
        assertThat(FROM).allMatch(lockService::isAvailable);
        assertThat(service.getReleasableNumbers(after)).isEmpty();
    }

    @Test
    void legEndingWhileOthersAreStillDialedKeepsGroupAlive() {
        AtomicInteger placed = new AtomicInteger();
        when(telephony.dial(any(OutboundCall.class))).thenAnswer(invocation -> {
            int n = placed.incrementAndGet();
            if (n == 2) {
                service.handleStatusCallback("CA1", "busy", null, null);
            }
            return "CA" + n;
        });

        ParallelDialGroup group = service.initiateGroup(request(FROM));

        assertThat(group.getStatus()).isEqualTo(ParallelGroupStatus.DIALING);
        assertThat(group.getCalls()).extracting(ParallelCallAttempt::getStatus)
                .containsExactly(AttemptStatus.BUSY, AttemptStatus.INITIATED, AttemptStatus.INITIATED);
        verify(telephony, never()).hangup(anyString());

        service.handleStatusCallback("CA3", "in-progress", "human", null);

        ParallelDialGroup after = service.getGroup(group.getGroupId()).orElseThrow();
        assertThat(after.getStatus()).isEqualTo(ParallelGroupStatus.CONNECTED);
        assertThat(after.getWinnerCallReference()).isEqualTo("CA3");
    }

    @Test
    void groupFailsOnlyOnceTheLastPlacedLegEnds() {
        AtomicInteger placed = new AtomicInteger();
        when(telephony.dial(any(OutboundCall.class))).thenAnswer(invocation -> {
            int n = placed.incrementAndGet();
            if (n == 3) {
                service.handleStatusCallback("CA1", "busy", null, null);
                service.handleStatusCallback("CA2", "failed", null, null);
            }
            return "CA" + n;
        });

        ParallelDialGroup group = service.initiateGroup(request(FROM));
        assertThat(group.getStatus()).isEqualTo(ParallelGroupStatus.DIALING);

        service.handleStatusCallback("CA3", "no-answer", null, null);

        assertThat(service.getGroup(group.getGroupId()).orElseThrow().getStatus())
                .isEqualTo(ParallelGroupStatus.FAILED);
        assertThat(FROM).allMatch(lockService::isAvailable);
    }

    @Test
    void legPlacedAfterWinnerIsDroppedWithoutReopeningGroup() {
        AtomicInteger placed = new AtomicInteger();
        when(telephony.dial(any(OutboundCall.class))).thenAnswer(invocation -> {
            int n = placed.incrementAndGet();
            if (n == 3) {
                service.handleStatusCallback("CA1", "in-progress", "human", null);
            }
            return "CA" + n;
        });

        ParallelDialGroup group = service.initiateGroup(request(FROM));

        assertThat(group.getStatus()).isEqualTo(ParallelGroupStatus.CONNECTED);
        assertThat(group.getWinnerCallReference()).isEqualTo("CA1");
        assertThat(status(group, "CA3")).isEqualTo(AttemptStatus.TERMINATED);
        verify(telephony).hangup("CA2");
        verify(telephony).hangup("CA3");
        assertThat(lockService.isAvailable(FROM.get(2))).isTrue();
        assertThat(lockService.isAvailable(FROM.get(0))).isFalse();
    }

    @Test
    void callbackArrivingBeforeItsLegIsRecordedIsAppliedOnceRecorded() {
        AtomicInteger placed = new AtomicInteger();
        when(telephony.dial(any(OutboundCall.class))).thenAnswer(invocation -> {
            int n = placed.incrementAndGet();
            if (n == 2) {
                OutboundCall call = invocation.getArgument(0);
                String groupId = UriComponentsBuilder.fromUriString(call.statusCallbackUrl()).build()
                        .getQueryParams().getFirst(ParallelDialService.GROUP_ID_PARAM);
                service.handleStatusCallback("CA2", "in-progress", "human", groupId);
            }
            return "CA" + n;
        });

        ParallelDialGroup group = service.initiateGroup(request(FROM));

        assertThat(group.getStatus()).isEqualTo(ParallelGroupStatus.CONNECTED);
        assertThat(group.getWinnerCallReference()).isEqualTo("CA2");
        assertThat(group.getEarlyCallbacks()).isEmpty();
        verify(telephony).hangup("CA1");
        verify(telephony).hangup("CA3");
        verify(telephony, never()).hangup("CA2");
    }

    @Test
    void callbackNamingUnknownGroupIsIgnored() {
        service.initiateGroup(request(FROM));

        service.handleStatusCallback("CA9", "in-progress", "human", "pg_missing");

        verify(telephony, never()).hangup(anyString());
    }

    @Test
    void unknownCallsAndStatusesAreIgnored() {
        service.initiateGroup(request(FROM));

        service.handleStatusCallback("CA-unknown", "in-progress", "human", null);
        service.handleStatusCallback("CA1", "exploded", "human", null);
        service.handleStatusCallback("CA1", null, null, null);

        verify(telephony, never()).hangup(anyString());
    }

    @Test
    void simultaneousAnswersProduceExactlyOneWinner() throws Exception {
        ParallelDialGroup group = service.initiateGroup(request(FROM));
        ExecutorService pool = Executors.newFixedThreadPool(3);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (String reference : List.of("CA1", "CA2", "CA3")) {
                futures.add(pool.submit(() -> {
                    start.await();
                    service.handleStatusCallback(reference, "in-progress", "human", null);
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        ParallelDialGroup after = service.getGroup(group.getGroupId()).orElseThrow();
        String winner = after.getWinnerCallReference();
        assertThat(winner).isIn("CA1", "CA2", "CA3");
        assertThat(after.getCalls()).filteredOn(c -> c.getStatus() == AttemptStatus.TERMINATED).hasSize(2);
        verify(telephony, times(2)).hangup(anyString());
        verify(telephony, never()).hangup(winner);
    }

    @Test
    void terminateHangsUpLiveLegsAndReleasesEveryLock() {
        ParallelDialGroup group = service.initiateGroup(request(FROM));
        service.handleStatusCallback("CA1", "busy", null, null);

        ParallelDialGroup terminated = service.terminateGroup(group.getGroupId());

        assertThat(terminated.getStatus()).isEqualTo(ParallelGroupStatus.TERMINATED);
        verify(telephony, never()).hangup("CA1");
        verify(telephony).hangup("CA2");
        verify(telephony).hangup("CA3");
        assertThat(FROM).allMatch(lockService::isAvailable);

        service.terminateGroup(group.getGroupId());
        service.handleStatusCallback("CA2", "in-progress", "human", null);

        verify(telephony, times(1)).hangup("CA2");
        assertThat(service.getGroup(group.getGroupId()).orElseThrow().hasWinner()).isFalse();
    }

    @Test
    void terminateUnknownGroupFails() {
        assertThatThrownBy(() -> service.terminateGroup("pg_missing"))
                .isInstanceOf(GroupNotFoundException.class);
    }

    @Test
    void busyCallerIdAbortsBeforeDialingAndReleasesTakenLocks() {
        lockService.acquire(FROM.get(1), "other-agent", "CA-other");

        assertThatThrownBy(() -> service.initiateGroup(request(FROM)))
                .isInstanceOf(CallerIdLockedException.class);

        verify(telephony, never()).dial(any());
        assertThat(lockService.isAvailable(FROM.get(0))).isTrue();
        assertThat(lockService.isAvailable(FROM.get(2))).isTrue();
        assertThat(lockService.findByCallReference("CA-other")).isPresent();
    }

    @Test
    void providerRejectionHangsUpPlacedCallsAndReleasesLocks() {
        when(telephony.dial(any(OutboundCall.class)))
                .thenReturn("CA1")
                .thenThrow(new TelephonyException("dial", "rejected"));

        assertThatThrownBy(() -> service.initiateGroup(request(FROM)))
                .isInstanceOf(TelephonyException.class);

        verify(telephony).hangup("CA1");
        assertThat(FROM).allMatch(lockService::isAvailable);
        String groupId = service.getGroupIdForCall("CA1").orElseThrow();
        assertThat(service.getGroup(groupId).orElseThrow().getStatus()).isEqualTo(ParallelGroupStatus.FAILED);
    }

    @Test
    void hangupFailureDoesNotBreakWinnerSelection() {
        ParallelDialGroup group = service.initiateGroup(request(FROM));
        doThrow(new TelephonyException("hangup", "gone")).when(telephony).hangup("CA1");

        service.handleStatusCallback("CA2", "answered", "human", null);

        verify(telephony).hangup("CA3");
        assertThat(service.getGroup(group.getGroupId()).orElseThrow().getStatus())
                .isEqualTo(ParallelGroupStatus.CONNECTED);
    }

    @Test
    void rejectsWrongBatchSizeAndMalformedNumbers() {
        assertThatThrownBy(() -> service.initiateGroup(new ParallelDialRequest(CUSTOMERS.subList(0, 2), "queue-7",
                "agent-1", null, null, null, null, null)))
                .isInstanceOf(InvalidDialRequestException.class);
        assertThatThrownBy(() -> service.initiateGroup(new ParallelDialRequest(
                List.of("+13105550101", "3105550102", "+13105550103"), "queue-7", "agent-1", FROM, null, null, null, null)))
                .isInstanceOf(InvalidDialRequestException.class)
                .hasMessageContaining("3105550102");
        assertThatThrownBy(() -> service.initiateGroup(request(List.of(FROM.get(0), FROM.get(0), FROM.get(2)))))
                .isInstanceOf(InvalidDialRequestException.class);
    }

    @Test
    void missingCallerIdsAreChosenFromPoolWithoutReuse() {
        NumberPool pool = NumberPool.of(List.of(
                new PhoneNumberCandidate("+13105550900", "310", false, true),
                new PhoneNumberCandidate("+13105550901", "310", false, true),
                new PhoneNumberCandidate("+14155550902", "415", true, true)));
        ParallelDialRequest request = new ParallelDialRequest(CUSTOMERS, "queue-7", "agent-1",
                null, null, pool, null, null);

        ParallelDialGroup group = service.initiateGroup(request);

        assertThat(group.getCalls()).extracting(ParallelCallAttempt::getFromNumber)
                .containsExactly("+13105550900", "+13105550901", "+14155550902");
    }

    @Test
    void customerMarkupJoinsConferenceUnlessLegLost() {
        ParallelDialGroup group = service.initiateGroup(request(FROM));
        service.handleStatusCallback("CA2", "in-progress", "human", null);

        assertThat(service.generateCustomerTwiml("CA2")).hasValueSatisfying(xml ->
                assertThat(xml).contains("<Conference").contains(group.getConferenceName()));
        assertThat(service.generateCustomerTwiml("CA1")).hasValueSatisfying(xml ->
                assertThat(xml).contains("<Hangup/>"));
        assertThat(service.generateCustomerTwiml("CA-unknown")).isEmpty();
    }

    @Test
    void requirementsReportShortfall() {
        ParallelDialRequirements shortfall = service.validateRequirements(2);
        ParallelDialRequirements enough = service.validateRequirements(3);

        assertThat(shortfall.valid()).isFalse();
        assertThat(shortfall.required()).isEqualTo(3);
        assertThat(shortfall.message()).isNotBlank();
        assertThat(enough.valid()).isTrue();
    }

    private static ParallelDialRequest request(List<String> fromNumbers) {
        return new ParallelDialRequest(CUSTOMERS, "queue-7", "agent-1", fromNumbers,
                List.of("c1", "c2", "c3"), null, null, null);
    }

    private static AttemptStatus status(ParallelDialGroup group, String callReference) {
        return group.findAttempt(callReference).orElseThrow().getStatus();
    }
}
