package com.ai.dialer.dto;

import com.ai.dialer.model.NumberPool;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * @param fromNumbers optional caller IDs, one per customer number; blank entries are chosen
 *                    by local presence against {@code numberPool}
 */
public record ParallelDialRequest(@NotEmpty List<String> customerNumbers,
                                  @NotBlank String queueId,
                                  String holderId,
                                  List<String> fromNumbers,
                                  List<String> contactIds,
                                  NumberPool numberPool,
                                  String statusCallbackUrl,
                                  String customerTwimlUrl) {
}
