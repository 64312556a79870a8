package com.di.tablenova.analysis.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ViewDescriptor {
    String id;
    String name;
    String type;
}
