package com.ai.dialer.dto;

import com.ai.dialer.model.NumberPool;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record SelectNumberRequest(@NotNull NumberPool pool, @NotBlank String destinationNumber) {
}
