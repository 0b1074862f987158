package com.iimsoft.binassign.compat;

/**
 * 所有规则都弃权时的兜底策略。
 */
public enum DefaultPolicy {
    ALLOW,
    DENY
}
