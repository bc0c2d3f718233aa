package com.pharmaintel.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.pharmaintel.domain.ReorderSuggestion;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReorderResponse {

    public enum Action { REORDER, NO_ACTION }

    String itemId;
    Action action;
    ReorderSuggestion suggestion;
}
