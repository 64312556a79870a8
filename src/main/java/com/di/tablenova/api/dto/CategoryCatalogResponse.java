package com.di.tablenova.api.dto;

import lombok.Value;

import java.util.Map;

@Value
public class CategoryCatalogResponse {

    Map<String, CategoryInfo> categories;
    int totalCount;

    @Value
    public static class CategoryInfo {
        String name;
        String description;
    }
}
