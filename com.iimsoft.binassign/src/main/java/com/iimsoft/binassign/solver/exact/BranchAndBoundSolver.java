package com.iimsoft.binassign.solver.exact;

import com.iimsoft.binassign.exception.InfeasibleException;
import com.iimsoft.binassign.model.OptimizationModel;
import com.iimsoft.binassign.solver.AssignmentSolver;
import com.iimsoft.binassign.solver.GreedyConstruction;
import com.iimsoft.binassign.solver.InfeasibilityCheck;
import com.iimsoft.binassign.solver.PlacementProblem;
import com.iimsoft.binassign.solver.SearchBudget;
import com.iimsoft.binassign.solver.Solution;
import com.iimsoft.binassign.solver.SolveConfig;
import com.iimsoft.binassign.solver.SolveStatus;
import com.iimsoft.binassign.solver.SolveStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * 深度优先分支定界，精确求解 0/1 分配模型。
 * <p>
 * 解的排序：先比未分配数，再比目标值，最后比 (物料标识升序) 上的库位标识字典序。
 * 物料按标识升序分支，库位按标识升序尝试，"未分配" 分支放在最后，
 * 因此叶子的访问顺序就是字典序，同值时先找到的解即为字典序最小。
 * <p>
 * 以贪心结果作为初始在位解。每个节点检查 {@link SearchBudget}，触发上限时返回在位解（FEASIBLE）。
 */
public class BranchAndBoundSolver implements AssignmentSolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(BranchAndBoundSolver.class);

    @Override
    public SolveStrategy strategy() {
        return SolveStrategy.EXACT;
    }

    @Override
    public Solution solve(OptimizationModel model, SolveConfig config, SearchBudget budget) {
        AssignmentSolver.checkCompatible(model, config);
        PlacementProblem problem = PlacementProblem.of(model);
        InfeasibilityCheck.check(problem);

        Search search = new Search(problem, budget);
        int[] greedy = new GreedyConstruction(problem).construct();
        if (problem.isAllowUnassigned() || PlacementProblem.unassignedCount(greedy) == 0) {
            search.offerInitial(greedy);
        }
        search.run();

        long elapsed = budget.elapsedMillis();
        if (search.aborted) {
            LOGGER.warn("Branch and bound stopped by {} after {} nodes; returning {}",
                    budget.getStopReason(), search.nodes, search.best == null ? "no incumbent" : "best incumbent");
            if (search.best == null) {
                return problem.emptySolution(SolveStatus.UNSOLVED, SolveStrategy.EXACT, search.nodes, elapsed);
            }
            return problem.toSolution(SolveStatus.FEASIBLE, SolveStrategy.EXACT, search.best,
                    problem.objectiveOf(search.best), search.nodes, elapsed);
        }
        if (search.best == null) {
            // 允许未分配时全部不放总是可行，走到这里说明必须全部放置
            throw new InfeasibleException("穷举搜索（" + search.nodes + " 个节点）未找到满足容量与兼容约束的完整分配", null);
        }
        LOGGER.debug("Branch and bound proved optimality after {} nodes", search.nodes);
        return problem.toSolution(SolveStatus.OPTIMAL, SolveStrategy.EXACT, search.best,
                problem.objectiveOf(search.best), search.nodes, elapsed);
    }

    private static final class Search {

        private static final double COST_EPSILON = 1e-9;

        private final PlacementProblem problem;
        private final SearchBudget budget;
        private final int[] order;
        private final int[] binOf;
        private final double[] remaining;

        private double cost;
        private int unassigned;
        private long nodes;
        private boolean aborted;

        private int[] best;
        private double bestCost;
        private int bestUnassigned;
        // 在位解来自本次 DFS（而非贪心）时，同值子树可直接剪掉
        private boolean incumbentInSearchOrder;

        Search(PlacementProblem problem, SearchBudget budget) {
            this.problem = problem;
            this.budget = budget;
            int n = problem.materialCount();
            this.order = IntStream.range(0, n).boxed()
                    .sorted(Comparator.comparing(problem.getMaterialIds()::get))
                    .mapToInt(Integer::intValue)
                    .toArray();
            this.binOf = new int[n];
            Arrays.fill(binOf, -1);
            this.remaining = new double[problem.binCount()];
            for (int b = 0; b < remaining.length; b++) {
                remaining[b] = problem.capacity(b);
            }
        }

        void offerInitial(int[] assignment) {
            best = assignment.clone();
            bestCost = problem.objectiveOf(assignment);
            bestUnassigned = PlacementProblem.unassignedCount(assignment);
            incumbentInSearchOrder = false;
            LOGGER.debug("Initial incumbent from greedy: objective {}, unassigned {}", bestCost, bestUnassigned);
        }

        /**
         * 显式栈深度优先搜索：第 d 层决定 order[d] 的去向。
         * cursor[d] 为下一个待试候选库位的下标，skipped[d] 表示未分配分支已走过。
         * 每进入一个节点都检查预算；回到某层时先撤销该层已应用的选择。
         */
        void run() {
            int n = order.length;
            int[] cursor = new int[n];
            boolean[] skipped = new boolean[n];
            int depth = 0;
            boolean entering = true;
            while (depth >= 0) {
                if (entering) {
                    nodes++;
                    if (budget.isExhausted(nodes)) {
                        aborted = true;
                        return;
                    }
                    if (depth == n) {
                        acceptLeaf();
                        depth--;
                        entering = false;
                        continue;
                    }
                    if (prune(depth)) {
                        depth--;
                        entering = false;
                        continue;
                    }
                    cursor[depth] = 0;
                    skipped[depth] = false;
                } else {
                    undo(depth);
                }

                if (advance(depth, cursor, skipped)) {
                    depth++;
                    entering = true;
                } else {
                    depth--;
                    entering = false;
                }
            }
        }

        /** 在第 depth 层应用下一个分支；没有剩余分支时返回 false */
        private boolean advance(int depth, int[] cursor, boolean[] skipped) {
            int i = order[depth];
            double size = problem.size(i);
            int[] candidates = problem.candidates(i);
            while (cursor[depth] < candidates.length) {
                int b = candidates[cursor[depth]++];
                if (!PlacementProblem.fits(remaining[b], size)) {
                    continue;
                }
                binOf[i] = b;
                remaining[b] -= size;
                cost += problem.placementCost(i, b);
                return true;
            }
            if (problem.isAllowUnassigned() && !skipped[depth]) {
                skipped[depth] = true;
                unassigned++;
                return true;
            }
            return false;
        }

        private void undo(int depth) {
            int i = order[depth];
            int b = binOf[i];
            if (b < 0) {
                unassigned--;
                return;
            }
            cost -= problem.placementCost(i, b);
            remaining[b] += problem.size(i);
            binOf[i] = -1;
        }

        /**
         * 下界：剩余物料里放不下的必然未分配；其余各取仍放得下的最便宜兼容库位。
         */
        private boolean prune(int depth) {
            int forced = 0;
            double bound = cost;
            for (int k = depth; k < order.length; k++) {
                int i = order[k];
                double size = problem.size(i);
                double cheapest = Double.POSITIVE_INFINITY;
                for (int b : problem.candidates(i)) {
                    if (PlacementProblem.fits(remaining[b], size)) {
                        cheapest = Math.min(cheapest, problem.placementCost(i, b));
                    }
                }
                if (cheapest == Double.POSITIVE_INFINITY) {
                    if (!problem.isAllowUnassigned()) {
                        return true;
                    }
                    forced++;
                } else {
                    bound += cheapest;
                }
            }
            if (best == null) {
                return false;
            }
            int cmp = compare(unassigned + forced, bound, bestUnassigned, bestCost);
            return incumbentInSearchOrder ? cmp >= 0 : cmp > 0;
        }

        private void acceptLeaf() {
            if (best == null) {
                record();
                return;
            }
            int cmp = compare(unassigned, cost, bestUnassigned, bestCost);
            if (cmp < 0 || (cmp == 0 && !incumbentInSearchOrder && lexicographicallySmaller(binOf, best))) {
                record();
            } else if (cmp == 0) {
                // 同值且字典序更大：之后的叶子只会更大，贪心解已确认为同值中最小
                incumbentInSearchOrder = true;
            }
        }

        private void record() {
            best = binOf.clone();
            bestCost = cost;
            bestUnassigned = unassigned;
            incumbentInSearchOrder = true;
            LOGGER.debug("New incumbent at node {}: objective {}, unassigned {}", nodes, bestCost, bestUnassigned);
        }

        private static int compare(int unassignedA, double costA, int unassignedB, double costB) {
            if (unassignedA != unassignedB) {
                return Integer.compare(unassignedA, unassignedB);
            }
            double tolerance = COST_EPSILON * Math.max(1.0, Math.abs(costB));
            if (costA < costB - tolerance) return -1;
            if (costA > costB + tolerance) return 1;
            return 0;
        }

        private boolean lexicographicallySmaller(int[] a, int[] b) {
            for (int i : order) {
                if (a[i] == b[i]) {
                    continue;
                }
                // 未分配排在所有库位之后
                if (a[i] < 0) return false;
                if (b[i] < 0) return true;
                return problem.getBinIds().get(a[i]).compareTo(problem.getBinIds().get(b[i])) < 0;
            }
            return false;
        }
    }
}
