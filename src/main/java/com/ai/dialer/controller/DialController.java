package com.ai.dialer.controller;

import com.ai.dialer.component.ConferenceTwimlBuilder;
import com.ai.dialer.dto.DialRequest;
import com.ai.dialer.dto.DialResult;
import com.ai.dialer.service.DialService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/calls")
public class DialController {

    private final DialService dialService;
    private final ConferenceTwimlBuilder twimlBuilder;

    public DialController(DialService dialService, ConferenceTwimlBuilder twimlBuilder) {
        this.dialService = dialService;
        this.twimlBuilder = twimlBuilder;
    }

    @PostMapping("/dial")
    public ResponseEntity<DialResult> dial(@Valid @RequestBody DialRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(dialService.dial(request));
    }

    @PostMapping("/{callReference}/hangup")
    public ResponseEntity<Void> hangup(@PathVariable String callReference) {
        dialService.hangup(callReference);
        return ResponseEntity.noContent().build();
    }

    /** Markup fetched when the agent answers: bridge to the customer. */
    @RequestMapping(value = "/dial/agent-twiml", method = {RequestMethod.GET, RequestMethod.POST},
            produces = MediaType.APPLICATION_XML_VALUE)
    public ResponseEntity<String> agentTwiml(@RequestParam String to, @RequestParam String callerId) {
        return ResponseEntity.ok(twimlBuilder.dialNumber(to, callerId));
    }

    @PostMapping(value = "/dial/status-callback", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public ResponseEntity<Void> statusCallback(@RequestParam("CallSid") String callSid,
                                               @RequestParam(value = "CallStatus", required = false) String callStatus) {
        dialService.handleStatusCallback(callSid, callStatus);
        return ResponseEntity.noContent().build();
    }
}
