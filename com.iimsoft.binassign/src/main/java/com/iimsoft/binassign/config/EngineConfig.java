package com.iimsoft.binassign.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.iimsoft.binassign.compat.CompatibilityRule;
import com.iimsoft.binassign.compat.CompatibilityRuleSet;
import com.iimsoft.binassign.compat.DefaultPolicy;
import com.iimsoft.binassign.domain.CatalogRules;
import com.iimsoft.binassign.solver.SolveConfig;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 引擎级配置：允许的类别/库位类型、兼容规则与默认策略、默认求解参数。
 * 默认值在 classpath 的 {@value #DEFAULT_RESOURCE} 中。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EngineConfig {

    public static final String DEFAULT_RESOURCE = "/binassign-defaults.json";

    @JsonProperty("allowedCategories")
    private List<String> allowedCategories = new ArrayList<>();

    @JsonProperty("allowedSlotTypes")
    private List<String> allowedSlotTypes = new ArrayList<>();

    @JsonProperty("defaultPolicy")
    private DefaultPolicy defaultPolicy = DefaultPolicy.ALLOW;

    @JsonProperty("rules")
    private List<RuleDefinition> rules = new ArrayList<>();

    @JsonProperty("solver")
    private SolveConfig solver = new SolveConfig();

    public EngineConfig() {
    }

    public static EngineConfig loadDefault() {
        return fromClasspath(DEFAULT_RESOURCE);
    }

    public static EngineConfig fromClasspath(String resource) {
        try (InputStream in = EngineConfig.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("配置文件不存在: " + resource);
            }
            return new ObjectMapper().readValue(in, EngineConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("读取配置失败: " + resource, e);
        }
    }

    public CatalogRules toCatalogRules() {
        return new CatalogRules(allowedCategories, allowedSlotTypes);
    }

    public CompatibilityRuleSet toRuleSet() {
        return toRuleSet(rules, defaultPolicy);
    }

    public static CompatibilityRuleSet toRuleSet(List<RuleDefinition> definitions, DefaultPolicy policy) {
        List<CompatibilityRule> compiled = new ArrayList<>();
        for (RuleDefinition definition : definitions) {
            compiled.addAll(definition.toRules());
        }
        return CompatibilityRuleSet.of(policy, compiled);
    }

    public List<String> getAllowedCategories() { return allowedCategories; }
    public void setAllowedCategories(List<String> allowedCategories) { this.allowedCategories = allowedCategories; }
    public List<String> getAllowedSlotTypes() { return allowedSlotTypes; }
    public void setAllowedSlotTypes(List<String> allowedSlotTypes) { this.allowedSlotTypes = allowedSlotTypes; }
    public DefaultPolicy getDefaultPolicy() { return defaultPolicy; }
    public void setDefaultPolicy(DefaultPolicy defaultPolicy) { this.defaultPolicy = defaultPolicy; }
    public List<RuleDefinition> getRules() { return rules; }
    public void setRules(List<RuleDefinition> rules) { this.rules = rules; }
    public SolveConfig getSolver() { return solver; }
    public void setSolver(SolveConfig solver) { this.solver = solver; }
}
