package com.iimsoft.binassign.solver;

import com.iimsoft.binassign.model.OptimizationModel;

/**
 * 最小化 0/1 变量上线性目标、满足线性约束的求解器。
 * <p>
 * 仅当不允许未分配且已证明不存在完整可行分配时抛出
 * {@link com.iimsoft.binassign.exception.InfeasibleException}；触发上限不是错误，
 * 返回 FEASIBLE（有在位解）或 UNSOLVED。
 */
public interface AssignmentSolver {

    default Solution solve(OptimizationModel model, SolveConfig config) {
        return solve(model, config, SearchBudget.start(config));
    }

    Solution solve(OptimizationModel model, SolveConfig config, SearchBudget budget);

    SolveStrategy strategy();

    /**
     * 模型与参数的未分配策略必须一致。
     */
    static void checkCompatible(OptimizationModel model, SolveConfig config) {
        if (model == null) {
            throw new NullPointerException("model");
        }
        if (config == null) {
            throw new NullPointerException("config");
        }
        config.validate();
        if (model.isAllowUnassigned() != config.isAllowUnassigned()) {
            throw new IllegalArgumentException("模型 allowUnassigned=" + model.isAllowUnassigned()
                    + " 与求解参数 allowUnassigned=" + config.isAllowUnassigned() + " 不一致");
        }
    }
}
