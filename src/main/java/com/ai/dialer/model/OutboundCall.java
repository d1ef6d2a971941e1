package com.ai.dialer.model;

/**
 * Instruction for placing one outbound call.
 *
 * @param twimlUrl          URL the provider fetches call-control markup from once answered
 * @param machineDetection  request answering-machine detection on this call
 */
public record OutboundCall(String to,
                           String from,
                           String twimlUrl,
                           String statusCallbackUrl,
                           boolean machineDetection) {
}
