package com.di.tablenova.resilience;

import com.di.tablenova.analysis.model.AnalysisCategory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mutable context of one guarded operation. The fault-tolerance layer updates
 * {@link #attemptNumber} and may add {@code partialResponse} to {@link #additionalInfo};
 * error records keep a {@link #snapshot()} of it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ErrorContext {

    public static final String PARTIAL_RESPONSE = "partialResponse";

    private String operationName;
    private String tableId;
    private String tableName;
    private AnalysisCategory category;
    @Builder.Default
    private int attemptNumber = 1;
    @Builder.Default
    private int maxAttempts = 3;
    @Builder.Default
    private Map<String, Object> additionalInfo = new LinkedHashMap<>();

    public ErrorContext snapshot() {
        return toBuilder().additionalInfo(new LinkedHashMap<>(additionalInfo)).build();
    }

    public static ErrorContext forCategory(String operationName, String tableId, String tableName,
                                           AnalysisCategory category, int maxAttempts) {
        return ErrorContext.builder()
                .operationName(operationName)
                .tableId(tableId)
                .tableName(tableName)
                .category(category)
                .maxAttempts(maxAttempts)
                .build();
    }
}
