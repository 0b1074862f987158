package com.iimsoft.binassign.solver;

/**
 * 求解状态。
 */
public enum SolveStatus {
    /** 搜索树完整遍历，全局最优 */
    OPTIMAL,
    /** 满足全部约束，但未证明最优（启发式或触发时间/节点上限） */
    FEASIBLE,
    /** 已证明无可行完整分配 */
    INFEASIBLE,
    /** 在上限内没有找到满足覆盖约束的解 */
    UNSOLVED
}
