package com.iimsoft.binassign.compat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CompatibilityRuleSetTest {

    @Nested
    @DisplayName("warehouse defaults")
    class WarehouseDefaults {

        private final CompatibilityRuleSet rules = CompatibilityRuleSet.warehouseDefaults();

        @Test
        void fragileOnlyInSafe() {
            assertThat(rules.isCompatible("fragile", "safe")).isTrue();
            assertThat(rules.isCompatible("fragile", "regular")).isFalse();
            assertThat(rules.isCompatible("fragile", "special")).isFalse();
        }

        @Test
        void hazardousOnlyInSpecial() {
            assertThat(rules.isCompatible("hazardous", "special")).isTrue();
            assertThat(rules.isCompatible("hazardous", "safe")).isFalse();
            assertThat(rules.isCompatible("hazardous", "regular")).isFalse();
        }

        @Test
        void regularFallsBackToAllow() {
            assertThat(rules.isCompatible("regular", "regular")).isTrue();
            assertThat(rules.isCompatible("regular", "safe")).isTrue();
            assertThat(rules.isCompatible("regular", "special")).isTrue();
        }
    }

    @Test
    @DisplayName("default DENY policy rejects pairs no rule mentions")
    void defaultDeny() {
        CompatibilityRuleSet rules = CompatibilityRuleSet.of(DefaultPolicy.DENY,
                CompatibilityRules.allow("regular", "regular"));

        assertThat(rules.isCompatible("regular", "regular")).isTrue();
        assertThat(rules.isCompatible("regular", "safe")).isFalse();
    }

    @Test
    @DisplayName("deny wins over allow regardless of rule order")
    void denyOverridesInAnyOrder() {
        CompatibilityRule allow = CompatibilityRules.allow("regular", "safe");
        CompatibilityRule deny = CompatibilityRules.deny("regular", "safe");

        assertThat(CompatibilityRuleSet.of(DefaultPolicy.ALLOW, allow, deny).isCompatible("regular", "safe")).isFalse();
        assertThat(CompatibilityRuleSet.of(DefaultPolicy.ALLOW, deny, allow).isCompatible("regular", "safe")).isFalse();
    }

    @Test
    @DisplayName("explicit allow beats a DENY default")
    void allowBeatsDefaultDeny() {
        CompatibilityRuleSet rules = CompatibilityRuleSet.of(DefaultPolicy.DENY,
                CompatibilityRules.restrict("fragile", "safe", "regular"));

        assertThat(rules.isCompatible("fragile", "regular")).isTrue();
        assertThat(rules.isCompatible("fragile", "special")).isFalse();
        assertThat(rules.isCompatible("regular", "regular")).isFalse();
    }

    @Test
    void nullVerdictIsRejected() {
        CompatibilityRuleSet rules = CompatibilityRuleSet.of(DefaultPolicy.ALLOW, (c, t) -> null);
        assertThatThrownBy(() -> rules.isCompatible("regular", "regular"))
                .isInstanceOf(IllegalStateException.class);
    }
}
