package com.iimsoft.binassign.solver.heuristic;

import com.iimsoft.binassign.domain.Bin;
import com.iimsoft.binassign.domain.Catalog;
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
import org.optaplanner.core.api.solver.Solver;
import org.optaplanner.core.api.solver.SolverFactory;
import org.optaplanner.core.config.localsearch.LocalSearchPhaseConfig;
import org.optaplanner.core.config.localsearch.LocalSearchType;
import org.optaplanner.core.config.solver.SolverConfig;
import org.optaplanner.core.config.solver.termination.TerminationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 启发式求解：贪心构造得到初始解，再用 OptaPlanner 局部搜索（Late Acceptance，change/swap 移动）改进。
 * <p>
 * 结果不保证最优，状态为 FEASIBLE；不允许未分配却仍有物料放不下时为 UNSOLVED，并返回部分放置结果。
 * 在 REPRODUCIBLE 模式 + 固定随机种子下，只要没有触发时间上限，结果可复现。
 */
public class HeuristicAssignmentSolver implements AssignmentSolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(HeuristicAssignmentSolver.class);

    public static final String SOLVER_CONFIG = "placementSolverConfig.xml";

    @Override
    public SolveStrategy strategy() {
        return SolveStrategy.HEURISTIC;
    }

    @Override
    public Solution solve(OptimizationModel model, SolveConfig config, SearchBudget budget) {
        AssignmentSolver.checkCompatible(model, config);
        PlacementProblem problem = PlacementProblem.of(model);
        InfeasibilityCheck.check(problem);

        int[] binOf = new GreedyConstruction(problem).construct();
        LOGGER.debug("Greedy construction: objective {}, unassigned {}",
                problem.objectiveOf(binOf), PlacementProblem.unassignedCount(binOf));

        if (config.getLocalSearchStepLimit() > 0 && !budget.isExhausted(0)) {
            int[] improved = localSearch(problem, binOf, config, budget);
            if (improved != null && isBetter(problem, improved, binOf)) {
                binOf = improved;
            }
        }

        int unassigned = PlacementProblem.unassignedCount(binOf);
        SolveStatus status = (!problem.isAllowUnassigned() && unassigned > 0) ? SolveStatus.UNSOLVED : SolveStatus.FEASIBLE;
        if (status == SolveStatus.UNSOLVED) {
            LOGGER.warn("Heuristic left {} materials unplaced although unassigned materials are not allowed", unassigned);
        }
        return problem.toSolution(status, SolveStrategy.HEURISTIC, binOf, problem.objectiveOf(binOf), 0L,
                budget.elapsedMillis());
    }

    /**
     * @return 局部搜索的最好解；结果违反容量约束时返回 null
     */
    private int[] localSearch(PlacementProblem problem, int[] initial, SolveConfig config, SearchBudget budget) {
        Catalog catalog = problem.getModel().getCatalog();
        List<Bin> bins = catalog.getBins();

        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < problem.materialCount(); i++) {
            if (problem.candidates(i).length > 0) {
                order.add(i);
            }
        }
        if (order.isEmpty()) {
            return null;
        }
        order.sort(Comparator.comparing(problem.getMaterialIds()::get));

        List<MaterialPlacement> placements = new ArrayList<>(order.size());
        for (int i : order) {
            List<Bin> candidateBins = new ArrayList<>();
            for (int b : problem.candidates(i)) {
                candidateBins.add(bins.get(b));
            }
            Bin start = initial[i] < 0 ? null : bins.get(initial[i]);
            placements.add(new MaterialPlacement(catalog.getMaterials().get(i), candidateBins, start));
        }
        PlacementSolution problemSolution = new PlacementSolution(new ArrayList<>(bins), placements);

        Solver<PlacementSolution> solver = buildSolver(config, budget);
        budget.onCancel(solver::terminateEarly);
        PlacementSolution best = solver.solve(problemSolution);
        LOGGER.debug("Local search finished with score {}", best.getScore());

        int[] binOf = initial.clone();
        for (int k = 0; k < order.size(); k++) {
            Bin bin = best.getPlacementList().get(k).getBin();
            binOf[order.get(k)] = bin == null ? -1 : catalog.indexOfBin(bin.getId());
        }
        if (!respectsCapacity(problem, binOf)) {
            LOGGER.warn("Local search result {} overfills a bin, keeping the greedy placement", best.getScore());
            return null;
        }
        return binOf;
    }

    private Solver<PlacementSolution> buildSolver(SolveConfig config, SearchBudget budget) {
        SolverConfig solverConfig = SolverConfig.createFromXmlResource(SOLVER_CONFIG);
        solverConfig.setRandomSeed(config.getRandomSeed());
        solverConfig.withTerminationSpentLimit(Duration.ofMillis(Math.max(1L, budget.remainingMillis())));

        TerminationConfig phaseTermination = new TerminationConfig();
        phaseTermination.setStepCountLimit(config.getLocalSearchStepLimit());
        phaseTermination.setUnimprovedStepCountLimit(config.getUnimprovedStepLimit());
        LocalSearchPhaseConfig localSearch = new LocalSearchPhaseConfig();
        localSearch.setLocalSearchType(LocalSearchType.LATE_ACCEPTANCE);
        localSearch.setTerminationConfig(phaseTermination);
        solverConfig.setPhaseConfigList(List.of(localSearch));

        SolverFactory<PlacementSolution> solverFactory = SolverFactory.create(solverConfig);
        return solverFactory.buildSolver();
    }

    private static boolean respectsCapacity(PlacementProblem problem, int[] binOf) {
        double[] used = new double[problem.binCount()];
        for (int i = 0; i < binOf.length; i++) {
            if (binOf[i] >= 0) {
                used[binOf[i]] += problem.size(i);
            }
        }
        for (int b = 0; b < used.length; b++) {
            if (!PlacementProblem.fits(problem.capacity(b), used[b])) {
                return false;
            }
        }
        return true;
    }

    private static boolean isBetter(PlacementProblem problem, int[] candidate, int[] current) {
        int u1 = PlacementProblem.unassignedCount(candidate);
        int u2 = PlacementProblem.unassignedCount(current);
        if (u1 != u2) {
            return u1 < u2;
        }
        return problem.objectiveOf(candidate) < problem.objectiveOf(current);
    }
}
