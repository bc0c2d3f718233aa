package com.pharmaintel.domain;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class InteractionRuleBase {

    String version;

    @Builder.Default
    List<InteractionRule> rules = List.of();

    @Builder.Default
    Map<String, List<String>> drugClasses = Map.of();

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant loadedAt;

    public static InteractionRuleBase empty() {
        return InteractionRuleBase.builder().version("empty").build();
    }

    public InteractionRuleBase withRule(InteractionRule rule) {
        List<InteractionRule> extended = new ArrayList<>(rules);
        extended.add(rule);
        return toBuilder().rules(List.copyOf(extended)).build();
    }
}
