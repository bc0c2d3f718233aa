package com.pharmaintel.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class InteractionQueryResult {
    List<MatchedPair> matchedPairs;
    List<String> unmatchedInputs;
    InteractionSeverity overallRisk;
    List<ResolvedDrug> resolvedInputs;
    Map<InteractionSeverity, Integer> summary;
    boolean safe;
    String ruleBaseVersion;
}
