package com.iimsoft.binassign.compat;

import com.iimsoft.binassign.domain.CatalogRules;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 常用兼容规则工厂。
 */
public final class CompatibilityRules {

    private CompatibilityRules() {
    }

    /**
     * 该类别只能放入给定类型的库位：列表内 ALLOW，列表外 DENY，其它类别弃权。
     */
    public static CompatibilityRule restrict(String category, String... slotTypes) {
        return restrict(category, List.of(slotTypes));
    }

    public static CompatibilityRule restrict(String category, Iterable<String> slotTypes) {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(slotTypes, "slotTypes");
        Set<String> allowed = new HashSet<>();
        slotTypes.forEach(allowed::add);
        Set<String> frozen = Set.copyOf(allowed);
        return (c, t) -> {
            if (!category.equals(c)) {
                return RuleVerdict.ABSTAIN;
            }
            return frozen.contains(t) ? RuleVerdict.ALLOW : RuleVerdict.DENY;
        };
    }

    public static CompatibilityRule allow(String category, String slotType) {
        return pair(category, slotType, RuleVerdict.ALLOW);
    }

    public static CompatibilityRule deny(String category, String slotType) {
        return pair(category, slotType, RuleVerdict.DENY);
    }

    private static CompatibilityRule pair(String category, String slotType, RuleVerdict verdict) {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(slotType, "slotType");
        return (c, t) -> category.equals(c) && slotType.equals(t) ? verdict : RuleVerdict.ABSTAIN;
    }

    /**
     * 仓库默认规则：易碎品只进保险库位，危险品只进特殊库位，其余类别交给默认策略。
     */
    public static List<CompatibilityRule> warehouseDefaults() {
        return List.of(
                restrict(CatalogRules.FRAGILE, CatalogRules.SAFE),
                restrict(CatalogRules.HAZARDOUS, CatalogRules.SPECIAL));
    }
}
