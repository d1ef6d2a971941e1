package com.ai.dialer.controller;

import com.ai.dialer.component.ConferenceTwimlBuilder;
import com.ai.dialer.dto.DialResult;
import com.ai.dialer.exception.TelephonyException;
import com.ai.dialer.model.SelectionMethod;
import com.ai.dialer.service.DialService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class DialControllerTest {

    private static final String BODY =
            "{\"to\":\"+14155550123\",\"agentNumber\":\"+16465550000\",\"holderId\":\"agent-1\"}";

    private DialService dialService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        dialService = mock(DialService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new DialController(dialService, new ConferenceTwimlBuilder()))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void dialReturnsCreated() throws Exception {
        when(dialService.dial(any())).thenReturn(new DialResult("CA1", "+14155550001", SelectionMethod.LOCAL_PRESENCE));

        mockMvc.perform(post("/v1/calls/dial").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.callReference").value("CA1"))
                .andExpect(jsonPath("$.selectionMethod").value("LOCAL_PRESENCE"));
    }

    @Test
    void providerRejectionIsBadGateway() throws Exception {
        when(dialService.dial(any())).thenThrow(new TelephonyException("dial", "invalid number"));

        mockMvc.perform(post("/v1/calls/dial").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.errorCode").value("TELEPHONY_ERROR"));
    }

    @Test
    void hangupReturnsNoContent() throws Exception {
        mockMvc.perform(post("/v1/calls/CA1/hangup")).andExpect(status().isNoContent());

        verify(dialService).hangup("CA1");
    }

    @Test
    void agentMarkupBridgesToCustomer() throws Exception {
        mockMvc.perform(get("/v1/calls/dial/agent-twiml")
                        .param("to", "+14155550123")
                        .param("callerId", "+14155550001"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_XML))
                .andExpect(content().string(containsString("callerId=\"+14155550001\"")))
                .andExpect(content().string(containsString("<Number>+14155550123</Number>")));
    }

    @Test
    void statusWebhookIsForwarded() throws Exception {
        mockMvc.perform(post("/v1/calls/dial/status-callback")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("CallSid", "CA1")
                        .param("CallStatus", "completed"))
                .andExpect(status().isNoContent());

        verify(dialService).handleStatusCallback("CA1", "completed");
    }
}
