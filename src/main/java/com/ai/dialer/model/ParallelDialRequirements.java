package com.ai.dialer.model;

public record ParallelDialRequirements(boolean valid, int required, int current, String message) {
}
