package com.ai.dialer.service;

import com.ai.dialer.MutableClock;
import com.ai.dialer.config.DialerProperties;
import com.ai.dialer.dto.DialRequest;
import com.ai.dialer.dto.DialResult;
import com.ai.dialer.exception.CallerIdLockedException;
import com.ai.dialer.exception.TelephonyException;
import com.ai.dialer.model.NumberPool;
import com.ai.dialer.model.OutboundCall;
import com.ai.dialer.model.PhoneNumberCandidate;
import com.ai.dialer.model.SelectionMethod;
import com.ai.dialer.store.InMemoryCallerIdLockStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DialServiceTest {

    private static final String AGENT_PHONE = "+17035550100";
    private static final NumberPool POOL = NumberPool.of(List.of(
            new PhoneNumberCandidate("+12125550001", "212", false, true),
            new PhoneNumberCandidate("+13105550002", "310", true, true)));

    private TelephonyGateway telephony;
    private CallerIdLockService lockService;
    private DialerProperties properties;
    private DialService service;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        properties = new DialerProperties();
        properties.setBaseUrl("https://dialer.example.com");
        telephony = mock(TelephonyGateway.class);
        lockService = new CallerIdLockService(new InMemoryCallerIdLockStore(clock), clock, properties);
        service = new DialService(telephony, lockService, new LocalPresenceService(100, null), properties);
        when(telephony.dial(any(OutboundCall.class))).thenReturn("CA1");
    }

    @Test
    void manualCallerIdOverridesLocalPresence() {
        DialResult result = service.dial(request("+12125559999", "+14155550003", POOL));

        assertThat(result.fromNumber()).isEqualTo("+14155550003");
        assertThat(result.selectionMethod()).isEqualTo(SelectionMethod.MANUAL);
    }

    @Test
    void localPresencePicksMatchingAreaCodeAndLocksIt() {
        DialResult result = service.dial(request("+12125559999", null, POOL));

        assertThat(result.callReference()).isEqualTo("CA1");
        assertThat(result.fromNumber()).isEqualTo("+12125550001");
        assertThat(result.selectionMethod()).isEqualTo(SelectionMethod.LOCAL_PRESENCE);
        assertThat(lockService.findByCallReference("CA1")).isPresent();

        ArgumentCaptor<OutboundCall> call = ArgumentCaptor.forClass(OutboundCall.class);
        verify(telephony).dial(call.capture());
        assertThat(call.getValue().to()).isEqualTo(AGENT_PHONE);
        assertThat(call.getValue().twimlUrl())
                .startsWith("https://dialer.example.com" + DialService.AGENT_TWIML_PATH)
                .contains("to=%2B12125559999");
    }

    @Test
    void noLocalMatchUsesPoolPrimary() {
        DialResult result = service.dial(request("+15125559999", null, POOL));

        assertThat(result.fromNumber()).isEqualTo("+13105550002");
        assertThat(result.selectionMethod()).isEqualTo(SelectionMethod.PRIMARY_FALLBACK);
    }

    @Test
    void fallsBackToDefaultThenAgentNumber() {
        properties.setDefaultNumber("+18005550000");
        assertThat(service.dial(request("+15125559999", null, null)).selectionMethod())
                .isEqualTo(SelectionMethod.PRIMARY);

        properties.setDefaultNumber("");
        service.hangup("CA1");
        assertThat(service.dial(request("+15125559999", null, null)))
                .extracting(DialResult::fromNumber, DialResult::selectionMethod)
                .containsExactly(AGENT_PHONE, SelectionMethod.SYSTEM_DEFAULT);
    }

    @Test
    void busyCallerIdIsRejectedWithoutDialing() {
        lockService.acquire("+12125550001", "agent-2", "CA-other");

        assertThatThrownBy(() -> service.dial(request("+12125559999", "+12125550001", POOL)))
                .isInstanceOf(CallerIdLockedException.class);
        verify(telephony, never()).dial(any());
    }

    @Test
    void providerFailureReleasesLock() {
        when(telephony.dial(any(OutboundCall.class))).thenThrow(new TelephonyException("dial", "rejected"));

        assertThatThrownBy(() -> service.dial(request("+12125559999", null, POOL)))
                .isInstanceOf(TelephonyException.class);
        assertThat(lockService.isAvailable("+12125550001")).isTrue();
    }

    @Test
    void hangupReleasesLockEvenWhenProviderFails() {
        service.dial(request("+12125559999", null, POOL));
        doThrow(new TelephonyException("hangup", "gone")).when(telephony).hangup("CA1");

        assertThatThrownBy(() -> service.hangup("CA1")).isInstanceOf(TelephonyException.class);
        assertThat(lockService.isAvailable("+12125550001")).isTrue();
    }

    @Test
    void completedCallbackReleasesLock() {
        service.dial(request("+12125559999", null, POOL));

        service.handleStatusCallback("CA1", "ringing");
        assertThat(lockService.isAvailable("+12125550001")).isFalse();

        service.handleStatusCallback("CA1", "completed");
        assertThat(lockService.isAvailable("+12125550001")).isTrue();
    }

    private static DialRequest request(String to, String callerId, NumberPool pool) {
        return new DialRequest(to, AGENT_PHONE, "agent-1", callerId, true, pool, null);
    }
}
