package com.di.tablenova.api.dto;

import com.di.tablenova.resilience.ErrorSummary;
import lombok.Value;

import java.util.List;

@Value
public class ErrorReportResponse {
    ErrorSummary summary;
    List<String> recommendations;
}
