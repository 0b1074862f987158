package com.iimsoft.binassign.compat;

/**
 * 单条兼容规则对 (类别, 库位类型) 的判定。
 */
public enum RuleVerdict {
    /** 明确允许 */
    ALLOW,
    /** 明确禁止，优先于任何 ALLOW */
    DENY,
    /** 规则不适用于该组合 */
    ABSTAIN
}
