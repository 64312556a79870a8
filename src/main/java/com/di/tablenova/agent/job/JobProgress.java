package com.di.tablenova.agent.job;

import lombok.Value;

@Value
public class JobProgress {

    String phase;
    int completed;
    int total;

    public static JobProgress initial(int total) {
        return new JobProgress("pending", 0, total);
    }

    public double getPercent() {
        return total <= 0 ? 0.0 : Math.round(completed * 1000.0 / total) / 10.0;
    }
}
