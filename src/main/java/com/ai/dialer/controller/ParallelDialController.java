package com.ai.dialer.controller;

import com.ai.dialer.component.StatusCallbackDispatcher;
import com.ai.dialer.dto.ParallelDialRequest;
import com.ai.dialer.exception.GroupNotFoundException;
import com.ai.dialer.model.ParallelDialGroup;
import com.ai.dialer.model.ParallelDialRequirements;
import com.ai.dialer.service.ParallelDialService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/v1/calls/parallel")
public class ParallelDialController {

    private final ParallelDialService parallelDialService;
    private final StatusCallbackDispatcher dispatcher;

    public ParallelDialController(ParallelDialService parallelDialService, StatusCallbackDispatcher dispatcher) {
        this.parallelDialService = parallelDialService;
        this.dispatcher = dispatcher;
    }

    @PostMapping
    public ResponseEntity<GroupView> initiate(@Valid @RequestBody ParallelDialRequest request) {
        ParallelDialGroup group = parallelDialService.initiateGroup(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(view(group));
    }

    @GetMapping("/validate")
    public ParallelDialRequirements validate(@RequestParam int numberCount) {
        return parallelDialService.validateRequirements(numberCount);
    }

    @GetMapping("/{groupId}")
    public GroupView get(@PathVariable String groupId) {
        return parallelDialService.getGroup(groupId)
                .map(this::view)
                .orElseThrow(() -> new GroupNotFoundException(groupId));
    }

    @PostMapping("/{groupId}/terminate")
    public GroupView terminate(@PathVariable String groupId) {
        return view(parallelDialService.terminateGroup(groupId));
    }

    /** Provider status webhook. Always acknowledged; processing happens off this thread. */
    @PostMapping(value = "/status-callback", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public ResponseEntity<Void> statusCallback(@RequestParam("CallSid") String callSid,
                                               @RequestParam(value = "CallStatus", required = false) String callStatus,
                                               @RequestParam(value = "AnsweredBy", required = false) String answeredBy,
                                               @RequestParam(value = ParallelDialService.GROUP_ID_PARAM, required = false) String groupId) {
        dispatcher.dispatch(callSid, callStatus, answeredBy, groupId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping(value = "/customer-twiml", produces = MediaType.APPLICATION_XML_VALUE)
    public ResponseEntity<String> customerTwiml(@RequestParam("CallSid") String callSid) {
        return parallelDialService.generateCustomerTwiml(callSid)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new GroupNotFoundException(callSid));
    }

    private GroupView view(ParallelDialGroup group) {
        return new GroupView(group, parallelDialService.getReleasableNumbers(group));
    }

    public record GroupView(ParallelDialGroup group, List<String> releasableNumbers) {
    }
}
