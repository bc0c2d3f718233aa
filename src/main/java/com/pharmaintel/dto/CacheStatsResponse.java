package com.pharmaintel.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CacheStatsResponse {
    int entries;
    int maxEntries;
    long hits;
    long misses;
}
