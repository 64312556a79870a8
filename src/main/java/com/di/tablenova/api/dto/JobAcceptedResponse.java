package com.di.tablenova.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobAcceptedResponse {
    String jobId;
    String workflowId;
    String status;
    String message;
}
