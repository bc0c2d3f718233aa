package com.pharmaintel.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pharmaintel.domain.InteractionRule;
import com.pharmaintel.domain.InteractionRuleBase;
import com.pharmaintel.exception.InvalidEngineInputException;
import com.pharmaintel.exception.RuleBaseLoadException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

@Slf4j
@Service
public class InteractionRuleBaseService {

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final AtomicReference<InteractionRuleBase> current = new AtomicReference<>(InteractionRuleBase.empty());

    @Value("${engine.interactions.rules-location:classpath:interaction-rules.json}")
    private String rulesLocation;

    public InteractionRuleBaseService(ResourceLoader resourceLoader, ObjectMapper objectMapper, Clock clock) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @PostConstruct
    void init() {
        try {
            reload();
        } catch (RuleBaseLoadException ex) {
            log.error("Interaction rules not loaded at start-up, continuing with an empty rule base | location={}",
                      rulesLocation, ex);
        }
    }

    public InteractionRuleBase current() {
        return current.get();
    }

    public synchronized InteractionRuleBase reload() {
        InteractionRuleBase loaded = load(rulesLocation);
        current.set(loaded);
        log.info("Interaction rules loaded | version={} | rules={} | classes={} | location={}",
                 loaded.getVersion(), loaded.getRules().size(), loaded.getDrugClasses().size(), rulesLocation);
        return loaded;
    }

    public synchronized InteractionRuleBase addRule(InteractionRule rule) {
        if (rule.getSeverity() == null || rule.getDrugA() == null || rule.getDrugB() == null) {
            throw new InvalidEngineInputException("rule needs drugA, drugB and severity");
        }
        InteractionRuleBase updated = current.get().withRule(rule).toBuilder()
            .loadedAt(clock.instant())
            .build();
        current.set(updated);
        log.info("Interaction rule added | drugA={} | drugB={} | severity={} | rules={}",
                 rule.getDrugA(), rule.getDrugB(), rule.getSeverity(), updated.getRules().size());
        return updated;
    }

    private InteractionRuleBase load(String location) {
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            InteractionRuleBase parsed = objectMapper.readValue(in, InteractionRuleBase.class);
            if (parsed == null || parsed.getRules() == null || parsed.getDrugClasses() == null) {
                throw new IOException("rules and drugClasses must be present");
            }
            for (InteractionRule rule : parsed.getRules()) {
                if (rule == null || rule.getSeverity() == null || rule.getDrugA() == null || rule.getDrugB() == null) {
                    throw new IOException("rule without drugA, drugB or severity");
                }
            }
            for (Map.Entry<String, List<String>> drugClass : parsed.getDrugClasses().entrySet()) {
                if (drugClass.getValue() == null || drugClass.getValue().stream().anyMatch(Objects::isNull)) {
                    throw new IOException("drug class '" + drugClass.getKey() + "' has no member list");
                }
            }
            return parsed.toBuilder()
                .version(parsed.getVersion() != null ? parsed.getVersion() : "unversioned")
                .loadedAt(clock.instant())
                .build();
        } catch (IOException | IllegalArgumentException ex) {
            throw new RuleBaseLoadException(location, ex);
        }
    }
}
