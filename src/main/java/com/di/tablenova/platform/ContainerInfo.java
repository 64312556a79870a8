package com.di.tablenova.platform;

import lombok.Value;

@Value
public class ContainerInfo {
    String id;
    String name;
}
