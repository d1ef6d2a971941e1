package com.ai.dialer.dto;

import jakarta.validation.constraints.NotBlank;

public record LockRequest(@NotBlank String phoneNumber,
                          @NotBlank String holderId,
                          @NotBlank String callReference) {
}
