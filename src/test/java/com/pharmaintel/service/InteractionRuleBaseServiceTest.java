package com.pharmaintel.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pharmaintel.domain.InteractionRule;
import com.pharmaintel.domain.InteractionRuleBase;
import com.pharmaintel.domain.InteractionSeverity;
import com.pharmaintel.exception.InvalidEngineInputException;
import com.pharmaintel.exception.RuleBaseLoadException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InteractionRuleBaseServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T08:00:00Z"), ZoneOffset.UTC);

    private InteractionRuleBaseService service;

    @BeforeEach
    void setUp() {
        service = new InteractionRuleBaseService(new DefaultResourceLoader(),
            new ObjectMapper().findAndRegisterModules(), CLOCK);
        ReflectionTestUtils.setField(service, "rulesLocation", "classpath:test-rules.json");
        service.init();
    }

    @Test
    void init_loadsConfiguredRules() {
        InteractionRuleBase rules = service.current();

        assertThat(rules.getVersion()).isEqualTo("test-1");
        assertThat(rules.getLoadedAt()).isEqualTo(CLOCK.instant());
        assertThat(rules.getRules()).singleElement()
            .extracting(InteractionRule::getSeverity).isEqualTo(InteractionSeverity.SEVERE);
        assertThat(rules.getDrugClasses()).containsKey("anticoagulants");
    }

    @Test
    void reload_invalidFileKeepsPreviousSnapshot() {
        InteractionRuleBase before = service.current();
        ReflectionTestUtils.setField(service, "rulesLocation", "classpath:broken-rules.json");

        assertThatThrownBy(() -> service.reload()).isInstanceOf(RuleBaseLoadException.class);
        assertThat(service.current()).isSameAs(before);
    }

    @Test
    void reload_missingFileKeepsPreviousSnapshot() {
        ReflectionTestUtils.setField(service, "rulesLocation", "classpath:no-such-rules.json");

        assertThatThrownBy(() -> service.reload()).isInstanceOf(RuleBaseLoadException.class);
        assertThat(service.current().getVersion()).isEqualTo("test-1");
    }

    @ParameterizedTest
    @ValueSource(strings = {"classpath:null-rules.json", "classpath:null-class-members.json"})
    void reload_incompleteFileKeepsPreviousSnapshot(String location) {
        InteractionRuleBase before = service.current();
        ReflectionTestUtils.setField(service, "rulesLocation", location);

        assertThatThrownBy(() -> service.reload()).isInstanceOf(RuleBaseLoadException.class);
        assertThat(service.current()).isSameAs(before);
    }

    @Test
    void init_incompleteFileStartsWithEmptyRuleBase() {
        InteractionRuleBaseService fresh = new InteractionRuleBaseService(new DefaultResourceLoader(),
            new ObjectMapper().findAndRegisterModules(), CLOCK);
        ReflectionTestUtils.setField(fresh, "rulesLocation", "classpath:null-rules.json");

        fresh.init();

        assertThat(fresh.current().getVersion()).isEqualTo("empty");
    }

    @Test
    void init_failureLeavesEmptyRuleBase() {
        InteractionRuleBaseService fresh = new InteractionRuleBaseService(new DefaultResourceLoader(),
            new ObjectMapper().findAndRegisterModules(), CLOCK);
        ReflectionTestUtils.setField(fresh, "rulesLocation", "classpath:broken-rules.json");

        fresh.init();

        assertThat(fresh.current().getVersion()).isEqualTo("empty");
        assertThat(fresh.current().getRules()).isEmpty();
    }

    @Test
    void addRule_publishesNewSnapshot() {
        InteractionRuleBase before = service.current();

        InteractionRuleBase after = service.addRule(InteractionRule.builder()
            .drugA("digoxin").drugB("furosemide").severity(InteractionSeverity.MODERATE).build());

        assertThat(after.getRules()).hasSize(2);
        assertThat(before.getRules()).hasSize(1);
        assertThat(service.current()).isSameAs(after);
    }

    @Test
    void addRule_rejectsRuleWithoutSeverity() {
        InteractionRule incomplete = InteractionRule.builder().drugA("digoxin").drugB("furosemide").build();

        assertThatThrownBy(() -> service.addRule(incomplete)).isInstanceOf(InvalidEngineInputException.class);
        assertThat(service.current().getRules()).hasSize(1);
    }
}
