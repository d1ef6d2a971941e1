package com.ai.dialer.controller;

import com.ai.dialer.dto.TransferRequest;
import com.ai.dialer.model.TransferRecord;
import com.ai.dialer.service.TransferService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/transfers")
public class TransferController {

    private final TransferService transferService;

    public TransferController(TransferService transferService) {
        this.transferService = transferService;
    }

    @PostMapping
    public ResponseEntity<TransferRecord> initiate(@Valid @RequestBody TransferRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(transferService.initiateTransfer(request));
    }

    @GetMapping("/{transferId}")
    public TransferRecord get(@PathVariable String transferId) {
        return transferService.getTransfer(transferId);
    }

    @PostMapping("/{transferId}/complete")
    public TransferRecord complete(@PathVariable String transferId) {
        return transferService.completeTransfer(transferId);
    }

    @PostMapping("/{transferId}/cancel")
    public TransferRecord cancel(@PathVariable String transferId) {
        return transferService.cancelTransfer(transferId);
    }
}
