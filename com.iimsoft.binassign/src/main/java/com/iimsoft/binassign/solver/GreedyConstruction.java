package com.iimsoft.binassign.solver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * 贪心构造：
 * - 物料按 frequency 降序（同频按标识升序）
 * - 每个物料放入仍有余量的最便宜兼容库位（同价按库位标识升序）
 * - 放不下时尝试把该库位上一个已放物料挪到它的其它兼容库位，腾出空间
 * 结果满足容量与兼容约束，但可能留下未分配物料。完全确定。
 */
public final class GreedyConstruction {

    private static final Logger LOGGER = LoggerFactory.getLogger(GreedyConstruction.class);

    private final PlacementProblem problem;

    public GreedyConstruction(PlacementProblem problem) {
        this.problem = problem;
    }

    /**
     * @return 每个物料所在库位下标，-1 为未分配
     */
    public int[] construct() {
        int n = problem.materialCount();
        int[] binOf = new int[n];
        Arrays.fill(binOf, -1);
        double[] remaining = new double[problem.binCount()];
        List<List<Integer>> contents = new ArrayList<>();
        for (int b = 0; b < remaining.length; b++) {
            remaining[b] = problem.capacity(b);
            contents.add(new ArrayList<>());
        }

        List<String> ids = problem.getMaterialIds();
        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.<Integer>comparingInt(i -> -problem.frequency(i))
                .thenComparing(ids::get));

        for (int i : order) {
            int[] bins = byCost(problem.candidates(i));
            int chosen = -1;
            for (int b : bins) {
                if (PlacementProblem.fits(remaining[b], problem.size(i))) {
                    chosen = b;
                    break;
                }
            }
            if (chosen < 0) {
                chosen = relocateToFit(i, bins, binOf, remaining, contents);
            }
            if (chosen >= 0) {
                place(i, chosen, binOf, remaining, contents);
            }
        }
        return binOf;
    }

    // 腾挪：在候选库位 b 中找一个已放物料 j，移到 j 的另一个有余量的兼容库位后，i 能放进 b
    private int relocateToFit(int i, int[] bins, int[] binOf, double[] remaining, List<List<Integer>> contents) {
        double size = problem.size(i);
        for (int b : bins) {
            List<Integer> placed = new ArrayList<>(contents.get(b));
            placed.sort(Comparator.comparing(problem.getMaterialIds()::get));
            for (int j : placed) {
                if (!PlacementProblem.fits(remaining[b] + problem.size(j), size)) {
                    continue;
                }
                for (int t : byCost(problem.candidates(j))) {
                    if (t != b && PlacementProblem.fits(remaining[t], problem.size(j))) {
                        LOGGER.debug("Relocating {} from {} to {} to make room for {}",
                                problem.getMaterialIds().get(j), problem.getBinIds().get(b),
                                problem.getBinIds().get(t), problem.getMaterialIds().get(i));
                        unplace(j, binOf, remaining, contents);
                        place(j, t, binOf, remaining, contents);
                        return b;
                    }
                }
            }
        }
        return -1;
    }

    private int[] byCost(int[] candidates) {
        // candidates 已按标识升序，稳定排序后同价保持标识顺序
        Integer[] boxed = Arrays.stream(candidates).boxed().toArray(Integer[]::new);
        Arrays.sort(boxed, Comparator.comparingDouble(problem::cost));
        return Arrays.stream(boxed).mapToInt(Integer::intValue).toArray();
    }

    private void place(int i, int b, int[] binOf, double[] remaining, List<List<Integer>> contents) {
        binOf[i] = b;
        remaining[b] -= problem.size(i);
        contents.get(b).add(i);
    }

    private void unplace(int i, int[] binOf, double[] remaining, List<List<Integer>> contents) {
        int b = binOf[i];
        binOf[i] = -1;
        remaining[b] += problem.size(i);
        contents.get(b).remove(Integer.valueOf(i));
    }
}
