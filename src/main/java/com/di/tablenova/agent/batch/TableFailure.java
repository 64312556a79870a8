package com.di.tablenova.agent.batch;

import lombok.Value;

@Value
public class TableFailure {
    String tableId;
    String tableName;
    String error;
}
