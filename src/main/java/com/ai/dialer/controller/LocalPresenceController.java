package com.ai.dialer.controller;

import com.ai.dialer.dto.SelectNumberRequest;
import com.ai.dialer.model.NumberSelection;
import com.ai.dialer.service.LocalPresenceService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/local-presence")
public class LocalPresenceController {

    private final LocalPresenceService localPresenceService;

    public LocalPresenceController(LocalPresenceService localPresenceService) {
        this.localPresenceService = localPresenceService;
    }

    /** 204 when the pool has neither a local nor a primary number. */
    @PostMapping("/select")
    public ResponseEntity<NumberSelection> select(@Valid @RequestBody SelectNumberRequest request) {
        return localPresenceService.selectNumber(request.pool(), request.destinationNumber())
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }
}
