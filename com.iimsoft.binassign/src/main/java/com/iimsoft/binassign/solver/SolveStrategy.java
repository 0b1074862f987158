package com.iimsoft.binassign.solver;

public enum SolveStrategy {
    /** 分支定界，保证最优（在时间/节点上限内完成时） */
    EXACT,
    /** 贪心构造 + 局部搜索 */
    HEURISTIC
}
