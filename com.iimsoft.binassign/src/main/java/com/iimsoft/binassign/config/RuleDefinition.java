package com.iimsoft.binassign.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.iimsoft.binassign.compat.CompatibilityRule;
import com.iimsoft.binassign.compat.CompatibilityRules;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON 形式的兼容规则：
 * <pre>
 * {"kind": "RESTRICT", "category": "fragile", "slotTypes": ["safe"]}
 * {"kind": "DENY", "category": "regular", "slotTypes": ["special"]}
 * </pre>
 * ALLOW/DENY 对 slotTypes 中每个类型各生成一条单对规则。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RuleDefinition {

    public enum Kind {
        RESTRICT,
        ALLOW,
        DENY
    }

    @JsonProperty("kind")
    private Kind kind;

    @JsonProperty("category")
    private String category;

    @JsonProperty("slotTypes")
    private List<String> slotTypes = new ArrayList<>();

    public RuleDefinition() {
    }

    public RuleDefinition(Kind kind, String category, List<String> slotTypes) {
        this.kind = kind;
        this.category = category;
        this.slotTypes = slotTypes;
    }

    public List<CompatibilityRule> toRules() {
        if (kind == null) {
            throw new IllegalArgumentException("规则缺少 kind");
        }
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("规则缺少 category");
        }
        List<String> types = slotTypes == null ? List.of() : slotTypes;
        List<CompatibilityRule> rules = new ArrayList<>();
        switch (kind) {
            case RESTRICT:
                rules.add(CompatibilityRules.restrict(category, types));
                break;
            case ALLOW:
                for (String type : types) {
                    rules.add(CompatibilityRules.allow(category, type));
                }
                break;
            case DENY:
                for (String type : types) {
                    rules.add(CompatibilityRules.deny(category, type));
                }
                break;
            default:
                throw new IllegalArgumentException("未知规则类型: " + kind);
        }
        return rules;
    }

    public Kind getKind() { return kind; }
    public void setKind(Kind kind) { this.kind = kind; }
    public String getCategory() { return category; }
    public void setCategory(String category) { this.category = category; }
    public List<String> getSlotTypes() { return slotTypes; }
    public void setSlotTypes(List<String> slotTypes) { this.slotTypes = slotTypes; }
}
