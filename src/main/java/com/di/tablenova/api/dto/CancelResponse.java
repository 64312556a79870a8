package com.di.tablenova.api.dto;

import lombok.Value;

@Value
public class CancelResponse {
    String workflowId;
    boolean cancelled;
    String status;
    String message;
}
