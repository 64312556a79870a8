package com.di.tablenova.resilience;

/**
 * Produces an {@link AnalysisOutcome} after every attempt of a guarded operation failed.
 * Implementations are Spring beans looked up by {@link #name()}.
 */
public interface FallbackStrategy {

    String name();

    AnalysisOutcome apply(ErrorContext context, Throwable lastError);
}
