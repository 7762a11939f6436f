package com.example.ps3update.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 一次查询的结果，results 按版本号降序
 */
@Value
@Builder
public class FetchResult {
    String gameTitle;
    String cleanedTitleId;
    @Singular
    List<PackageInfo> results;
    String error;
}
