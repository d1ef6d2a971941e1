package com.ai.dialer.controller;

import com.ai.dialer.dto.LockRequest;
import com.ai.dialer.exception.CallerIdLockedException;
import com.ai.dialer.model.CallerIdLock;
import com.ai.dialer.service.CallerIdLockService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1/caller-id")
public class CallerIdLockController {

    private final CallerIdLockService lockService;

    public CallerIdLockController(CallerIdLockService lockService) {
        this.lockService = lockService;
    }

    @PostMapping("/locks")
    public CallerIdLock acquire(@Valid @RequestBody LockRequest request) {
        if (!lockService.acquire(request.phoneNumber(), request.holderId(), request.callReference())) {
            throw new CallerIdLockedException(request.phoneNumber());
        }
        return lockService.findByCallReference(request.callReference())
                .orElseThrow(() -> new CallerIdLockedException(request.phoneNumber()));
    }

    @DeleteMapping("/locks/{callReference}")
    public ResponseEntity<Void> release(@PathVariable String callReference) {
        return lockService.release(callReference)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    /** Frees a number whatever call holds it, for numbers stranded by a lost webhook. */
    @DeleteMapping("/{phoneNumber}/lock")
    public ResponseEntity<Void> releaseNumber(@PathVariable String phoneNumber) {
        return lockService.releaseByNumber(phoneNumber)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @GetMapping("/locks")
    public List<CallerIdLock> listByHolder(@RequestParam String holderId) {
        return lockService.listByHolder(holderId);
    }

    @GetMapping("/{phoneNumber}/available")
    public Map<String, Object> available(@PathVariable String phoneNumber) {
        return Map.of("phoneNumber", phoneNumber, "available", lockService.isAvailable(phoneNumber));
    }
}
