package com.iimsoft.binassign.compat;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 不可变规则集 + 兜底策略。
 * <p>
 * 组合与顺序无关：任一规则 DENY 则不兼容；否则任一 ALLOW 则兼容；全部弃权时取 {@link DefaultPolicy}。
 */
public final class CompatibilityRuleSet {

    private final List<CompatibilityRule> rules;
    private final DefaultPolicy defaultPolicy;

    private CompatibilityRuleSet(List<CompatibilityRule> rules, DefaultPolicy defaultPolicy) {
        this.rules = rules;
        this.defaultPolicy = defaultPolicy;
    }

    public static CompatibilityRuleSet of(DefaultPolicy defaultPolicy, CompatibilityRule... rules) {
        return of(defaultPolicy, List.of(rules));
    }

    public static CompatibilityRuleSet of(DefaultPolicy defaultPolicy, Collection<CompatibilityRule> rules) {
        Objects.requireNonNull(defaultPolicy, "defaultPolicy");
        Objects.requireNonNull(rules, "rules");
        for (CompatibilityRule rule : rules) {
            Objects.requireNonNull(rule, "rule");
        }
        return new CompatibilityRuleSet(Collections.unmodifiableList(new ArrayList<>(rules)), defaultPolicy);
    }

    public static CompatibilityRuleSet warehouseDefaults() {
        return of(DefaultPolicy.ALLOW, CompatibilityRules.warehouseDefaults());
    }

    public boolean isCompatible(String category, String slotType) {
        boolean allowed = false;
        for (CompatibilityRule rule : rules) {
            RuleVerdict verdict = rule.evaluate(category, slotType);
            if (verdict == null) {
                throw new IllegalStateException("兼容规则对 (" + category + ", " + slotType + ") 返回 null");
            }
            if (verdict == RuleVerdict.DENY) {
                return false;
            }
            if (verdict == RuleVerdict.ALLOW) {
                allowed = true;
            }
        }
        return allowed || defaultPolicy == DefaultPolicy.ALLOW;
    }

    public List<CompatibilityRule> getRules() { return rules; }
    public DefaultPolicy getDefaultPolicy() { return defaultPolicy; }
}
