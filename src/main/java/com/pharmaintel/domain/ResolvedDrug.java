package com.pharmaintel.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ResolvedDrug {

    public enum Resolution { EXACT, FUZZY }

    String input;
    String normalized;
    String canonical;
    Resolution resolution;
    double similarity;
}
