package com.pharmaintel.controller;

import com.pharmaintel.domain.InteractionQueryResult;
import com.pharmaintel.domain.InteractionRule;
import com.pharmaintel.domain.InteractionRuleBase;
import com.pharmaintel.dto.InteractionCheckRequest;
import com.pharmaintel.dto.RuleBaseReloadResponse;
import com.pharmaintel.engine.InventoryIntelligenceEngine;
import com.pharmaintel.service.InteractionRuleBaseService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/interactions")
@RequiredArgsConstructor
public class InteractionController {

    private final InventoryIntelligenceEngine engine;
    private final InteractionRuleBaseService ruleBaseService;

    @PostMapping("/check")
    public ResponseEntity<InteractionQueryResult> check(@Valid @RequestBody InteractionCheckRequest request) {
        InteractionQueryResult result = engine.checkInteractions(request.getDrugNames(), ruleBaseService.current());
        log.info("POST /interactions/check | inputs={} | pairs={} | unmatched={} | overallRisk={}",
                 request.getDrugNames().size(), result.getMatchedPairs().size(),
                 result.getUnmatchedInputs().size(), result.getOverallRisk());
        return ResponseEntity.ok(result);
    }

    @GetMapping("/rules")
    public ResponseEntity<InteractionRuleBase> rules() {
        return ResponseEntity.ok(ruleBaseService.current());
    }

    @PostMapping("/rules")
    public ResponseEntity<RuleBaseReloadResponse> addRule(@Valid @RequestBody InteractionRule rule) {
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(ruleBaseService.addRule(rule)));
    }

    @PostMapping("/rules/reload")
    public ResponseEntity<RuleBaseReloadResponse> reload() {
        return ResponseEntity.ok(toResponse(ruleBaseService.reload()));
    }

    private static RuleBaseReloadResponse toResponse(InteractionRuleBase ruleBase) {
        return RuleBaseReloadResponse.builder()
            .version(ruleBase.getVersion())
            .rules(ruleBase.getRules().size())
            .drugClasses(ruleBase.getDrugClasses().size())
            .loadedAt(ruleBase.getLoadedAt())
            .build();
    }
}
