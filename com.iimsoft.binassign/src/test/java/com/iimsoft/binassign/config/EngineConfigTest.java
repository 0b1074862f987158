package com.iimsoft.binassign.config;

import com.iimsoft.binassign.compat.CompatibilityRuleSet;
import com.iimsoft.binassign.compat.DefaultPolicy;
import com.iimsoft.binassign.domain.CatalogRules;
import com.iimsoft.binassign.solver.SolveStrategy;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EngineConfigTest {

    @Test
    void loadsBundledDefaults() {
        EngineConfig config = EngineConfig.loadDefault();

        assertThat(config.getAllowedCategories()).containsExactly("fragile", "hazardous", "regular");
        assertThat(config.getAllowedSlotTypes()).containsExactly("safe", "special", "regular");
        assertThat(config.getDefaultPolicy()).isEqualTo(DefaultPolicy.ALLOW);
        assertThat(config.getRules()).hasSize(2);
        assertThat(config.getSolver().getStrategy()).isEqualTo(SolveStrategy.EXACT);
        assertThat(config.getSolver().getTimeLimitSeconds()).isEqualTo(10.0);
    }

    @Test
    void defaultRulesMatchWarehouseRules() {
        CompatibilityRuleSet rules = EngineConfig.loadDefault().toRuleSet();
        CompatibilityRuleSet expected = CompatibilityRuleSet.warehouseDefaults();

        for (String category : List.of("fragile", "hazardous", "regular")) {
            for (String slotType : List.of("safe", "special", "regular")) {
                assertThat(rules.isCompatible(category, slotType))
                        .as("%s / %s", category, slotType)
                        .isEqualTo(expected.isCompatible(category, slotType));
            }
        }
    }

    @Test
    void catalogRules() {
        CatalogRules rules = EngineConfig.loadDefault().toCatalogRules();

        assertThat(rules.isAllowedCategory("hazardous")).isTrue();
        assertThat(rules.isAllowedSlotType("cold")).isFalse();
    }

    @Test
    void ruleDefinitions() {
        CompatibilityRuleSet rules = EngineConfig.toRuleSet(List.of(
                new RuleDefinition(RuleDefinition.Kind.ALLOW, "regular", List.of("regular")),
                new RuleDefinition(RuleDefinition.Kind.DENY, "fragile", List.of("regular"))),
                DefaultPolicy.DENY);

        assertThat(rules.isCompatible("regular", "regular")).isTrue();
        assertThat(rules.isCompatible("regular", "safe")).isFalse();
        assertThat(rules.isCompatible("fragile", "regular")).isFalse();
    }

    @Test
    void ruleWithoutKindIsRejected() {
        assertThatThrownBy(() -> new RuleDefinition(null, "regular", List.of()).toRules())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void missingResource() {
        assertThatThrownBy(() -> EngineConfig.fromClasspath("/no-such-config.json"))
                .isInstanceOf(IllegalStateException.class);
    }
}
