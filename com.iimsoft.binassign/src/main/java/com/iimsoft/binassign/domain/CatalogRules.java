package com.iimsoft.binassign.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * 目录允许的物料类别与库位类型集合（可扩展，区分大小写）。
 */
public final class CatalogRules {

    public static final String FRAGILE = "fragile";
    public static final String HAZARDOUS = "hazardous";
    public static final String REGULAR = "regular";

    public static final String SAFE = "safe";
    public static final String SPECIAL = "special";

    private final Set<String> allowedCategories;
    private final Set<String> allowedSlotTypes;

    public CatalogRules(Collection<String> allowedCategories, Collection<String> allowedSlotTypes) {
        Objects.requireNonNull(allowedCategories, "allowedCategories");
        Objects.requireNonNull(allowedSlotTypes, "allowedSlotTypes");
        this.allowedCategories = Collections.unmodifiableSet(new LinkedHashSet<>(allowedCategories));
        this.allowedSlotTypes = Collections.unmodifiableSet(new LinkedHashSet<>(allowedSlotTypes));
    }

    /**
     * 仓库默认配置：fragile/hazardous/regular 与 safe/special/regular。
     */
    public static CatalogRules warehouseDefaults() {
        return new CatalogRules(Set.of(FRAGILE, HAZARDOUS, REGULAR), Set.of(SAFE, SPECIAL, REGULAR));
    }

    public boolean isAllowedCategory(String category) {
        return category != null && allowedCategories.contains(category);
    }

    public boolean isAllowedSlotType(String slotType) {
        return slotType != null && allowedSlotTypes.contains(slotType);
    }

    public Set<String> getAllowedCategories() { return allowedCategories; }
    public Set<String> getAllowedSlotTypes() { return allowedSlotTypes; }
}
