package com.di.tablenova.exception;

import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * Structured error body for API endpoints, carrying the {@code ErrorCategory} classification of
 * the exception.
 */
@Data
public class ErrorResponse {
    private String timestamp;
    private int status;
    private String error;
    private String message;
    private String errorCategory;
    private String errorCategoryName;
    private String errorCategoryDescription;
    private String path;
    private Map<String, Object> details = new HashMap<>();

    public void addDetail(String key, Object value) {
        details.put(key, value);
    }
}
