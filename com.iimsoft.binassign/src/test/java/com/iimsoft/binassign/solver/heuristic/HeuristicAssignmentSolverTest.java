package com.iimsoft.binassign.solver.heuristic;

import com.iimsoft.binassign.domain.Bin;
import com.iimsoft.binassign.domain.Material;
import com.iimsoft.binassign.exception.InfeasibleException;
import com.iimsoft.binassign.model.OptimizationModel;
import com.iimsoft.binassign.report.ResultReporter;
import com.iimsoft.binassign.solver.SearchBudget;
import com.iimsoft.binassign.solver.SolveConfig;
import com.iimsoft.binassign.solver.SolveStatus;
import com.iimsoft.binassign.solver.SolveStrategy;
import com.iimsoft.binassign.solver.Solution;
import com.iimsoft.binassign.solver.exact.BranchAndBoundSolver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static com.iimsoft.binassign.TestCatalogs.bin;
import static com.iimsoft.binassign.TestCatalogs.material;
import static com.iimsoft.binassign.TestCatalogs.model;
import static com.iimsoft.binassign.TestCatalogs.perfectPackingBins;
import static com.iimsoft.binassign.TestCatalogs.perfectPackingMaterials;
import static com.iimsoft.binassign.TestCatalogs.regular;
import static com.iimsoft.binassign.TestCatalogs.regularBin;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class HeuristicAssignmentSolverTest {

    private final HeuristicAssignmentSolver solver = new HeuristicAssignmentSolver();

    private static SolveConfig config(boolean allowUnassigned) {
        return new SolveConfig()
                .withStrategy(SolveStrategy.HEURISTIC)
                .withTimeLimitSeconds(30)
                .withAllowUnassigned(allowUnassigned)
                .withLocalSearchStepLimit(300)
                .withUnimprovedStepLimit(100)
                .withRandomSeed(42);
    }

    private static List<Material> warehouseMaterials() {
        return List.of(
                material("M1", 3, 5, "fragile"),
                regular("M2", 5, 4),
                material("M3", 1, 6, "hazardous"),
                regular("M4", 2, 3));
    }

    private static List<Bin> warehouseBins() {
        return List.of(
                bin("B1", 15, 1, "safe"),
                bin("B2", 8, 2, "regular"),
                bin("B3", 10, 3, "special"));
    }

    @Test
    @DisplayName("places every material on a small warehouse")
    void smallWarehouse() {
        OptimizationModel model = model(warehouseMaterials(), warehouseBins(), false);

        Solution solution = solver.solve(model, config(false));

        assertThat(solution.getStatus()).isEqualTo(SolveStatus.FEASIBLE);
        assertThat(solution.getStrategy()).isEqualTo(SolveStrategy.HEURISTIC);
        assertThat(solution.getAssignments()).contains(entry("M1", "B1"), entry("M3", "B3"));
        assertThat(solution.getObjectiveValue()).isEqualTo(13.0);
        assertThat(solution.getNodesExplored()).isZero();
    }

    @Test
    @DisplayName("results respect capacity and compatibility")
    void respectsInvariants() {
        for (long seed = 1; seed <= 10; seed++) {
            OptimizationModel model = model(randomMaterials(seed), randomBins(seed), true);
            Solution heuristic = solver.solve(model, config(true));
            Solution exact = new BranchAndBoundSolver().solve(model, config(true).withStrategy(SolveStrategy.EXACT));

            assertThatCode(() -> new ResultReporter().report(heuristic, model.getCatalog(), model.getMatrix()))
                    .as("seed %d", seed)
                    .doesNotThrowAnyException();
            assertThat(heuristic.getUnassigned().size()).as("seed %d", seed)
                    .isGreaterThanOrEqualTo(exact.getUnassigned().size());
            if (heuristic.getUnassigned().size() == exact.getUnassigned().size()) {
                assertThat(heuristic.getObjectiveValue()).as("seed %d", seed)
                        .isGreaterThanOrEqualTo(exact.getObjectiveValue() - 1e-9);
            }
        }
    }

    @Test
    @DisplayName("same seed gives the same placement")
    void reproducibleWithSeed() {
        OptimizationModel model = model(randomMaterials(7), randomBins(7), true);

        Solution first = solver.solve(model, config(true));
        Solution second = solver.solve(model, config(true));

        assertThat(second.getAssignments()).isEqualTo(first.getAssignments());
        assertThat(second.getObjectiveValue()).isEqualTo(first.getObjectiveValue());
    }

    @Test
    @DisplayName("unplaceable leftovers give UNSOLVED with a partial placement")
    void unsolvedWhenLeftovers() {
        OptimizationModel model = model(
                List.of(regular("M1", 1, 6), regular("M2", 1, 6), regular("M3", 1, 6)),
                List.of(regularBin("B1", 10, 1), regularBin("B2", 10, 1)),
                false);

        Solution solution = solver.solve(model, config(false));

        assertThat(solution.getStatus()).isEqualTo(SolveStatus.UNSOLVED);
        assertThat(solution.getUnassigned()).hasSize(1);
        assertThat(solution.getAssignments()).hasSize(2);
    }

    @Test
    void aggregateInfeasibilityIsStillReported() {
        OptimizationModel model = model(
                List.of(regular("M1", 1, 6), regular("M2", 1, 6)),
                List.of(regularBin("B1", 10, 1)),
                false);

        assertThatThrownBy(() -> solver.solve(model, config(false))).isInstanceOf(InfeasibleException.class);
    }

    @Test
    @DisplayName("greedy only when local search is disabled")
    void greedyOnly() {
        OptimizationModel model = model(perfectPackingMaterials(), perfectPackingBins(), true);

        Solution solution = solver.solve(model, config(true).withLocalSearchStepLimit(0));

        assertThat(solution.getUnassigned()).containsExactly("e");
        assertThat(solution.getObjectiveValue()).isEqualTo(19.0);
    }

    @Test
    @DisplayName("cancelled budget skips local search")
    void cancelled() {
        OptimizationModel model = model(perfectPackingMaterials(), perfectPackingBins(), true);
        SolveConfig config = config(true);
        SearchBudget budget = SearchBudget.start(config);
        budget.cancel();

        Solution solution = solver.solve(model, config, budget);

        assertThat(solution.getStatus()).isEqualTo(SolveStatus.FEASIBLE);
        assertThat(solution.getUnassigned()).containsExactly("e");
    }

    private static final String[] CATEGORIES = {"regular", "regular", "fragile", "hazardous"};
    private static final String[] SLOT_TYPES = {"regular", "safe", "special"};

    private static List<Material> randomMaterials(long seed) {
        Random random = new Random(seed);
        List<Material> materials = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            materials.add(material("m" + i, 1 + random.nextInt(6), 1 + random.nextInt(5),
                    CATEGORIES[random.nextInt(CATEGORIES.length)]));
        }
        return materials;
    }

    private static List<Bin> randomBins(long seed) {
        Random random = new Random(seed * 31 + 1);
        List<Bin> bins = new ArrayList<>();
        for (int j = 0; j < 4; j++) {
            bins.add(bin("b" + j, 5 + random.nextInt(8), 1 + random.nextInt(4), SLOT_TYPES[j % SLOT_TYPES.length]));
        }
        return bins;
    }
}
