package com.ai.dialer.controller;

import com.ai.dialer.dto.ParticipantStateRequest;
import com.ai.dialer.model.ConferenceParticipant;
import com.ai.dialer.service.ConferenceService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/v1/conferences/{conferenceName}/participants")
public class ConferenceController {

    private final ConferenceService conferenceService;

    public ConferenceController(ConferenceService conferenceService) {
        this.conferenceService = conferenceService;
    }

    @GetMapping
    public List<ConferenceParticipant> list(@PathVariable String conferenceName) {
        return conferenceService.listParticipants(conferenceName);
    }

    @PostMapping("/{callReference}/hold")
    public ResponseEntity<Void> hold(@PathVariable String conferenceName,
                                     @PathVariable String callReference,
                                     @RequestBody ParticipantStateRequest request) {
        conferenceService.holdParticipant(conferenceName, callReference, request.enabled());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{callReference}/mute")
    public ResponseEntity<Void> mute(@PathVariable String conferenceName,
                                     @PathVariable String callReference,
                                     @RequestBody ParticipantStateRequest request) {
        conferenceService.muteParticipant(conferenceName, callReference, request.enabled());
        return ResponseEntity.noContent().build();
    }
}
