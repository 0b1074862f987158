package com.iimsoft.binassign.compat;

import java.util.Arrays;

/**
 * |物料| x |库位| 的兼容布尔矩阵，按目录下标寻址。构建后不可变，可在线程间共享。
 */
public final class CompatibilityMatrix {

    private final boolean[][] compatible;
    private final int binCount;

    CompatibilityMatrix(boolean[][] compatible, int binCount) {
        this.compatible = compatible;
        this.binCount = binCount;
    }

    public boolean isCompatible(int materialIndex, int binIndex) {
        return compatible[materialIndex][binIndex];
    }

    public int materialCount() {
        return compatible.length;
    }

    public int binCount() {
        return binCount;
    }

    public int compatibleBinCount(int materialIndex) {
        int count = 0;
        for (boolean c : compatible[materialIndex]) {
            if (c) count++;
        }
        return count;
    }

    public int compatiblePairCount() {
        int count = 0;
        for (int i = 0; i < compatible.length; i++) {
            count += compatibleBinCount(i);
        }
        return count;
    }

    /**
     * 兼容对占全部组合的比例，空矩阵为 0。
     */
    public double density() {
        long total = (long) compatible.length * binCount;
        return total == 0 ? 0.0 : (double) compatiblePairCount() / total;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("CompatibilityMatrix{");
        for (boolean[] row : compatible) {
            sb.append(Arrays.toString(row));
        }
        return sb.append('}').toString();
    }
}
