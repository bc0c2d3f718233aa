package com.pharmaintel.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class MatchedPair {

    public enum Scope { DRUG, CLASS }

    String drugA;
    String drugB;
    InteractionSeverity severity;
    Scope scope;
    String ruleDrugA;
    String ruleDrugB;
    String description;
    String management;
    List<String> substituteSuggestions;
}
