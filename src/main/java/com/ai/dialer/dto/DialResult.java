package com.ai.dialer.dto;

import com.ai.dialer.model.SelectionMethod;

public record DialResult(String callReference, String fromNumber, SelectionMethod selectionMethod) {
}
