package com.iimsoft.binassign.compat;

/**
 * 兼容规则：(物料类别, 库位类型) 上的纯函数，必须对任意输入给出判定。
 */
@FunctionalInterface
public interface CompatibilityRule {

    RuleVerdict evaluate(String category, String slotType);
}
