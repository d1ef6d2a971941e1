package com.ai.dialer.dto;

import com.ai.dialer.model.TransferType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record TransferRequest(@NotNull TransferType type,
                              @NotBlank String conferenceName,
                              @NotBlank String agentCallReference,
                              @NotBlank String recipientPhone,
                              @NotBlank String fromNumber) {
}
