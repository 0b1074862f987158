package com.iimsoft.binassign.solver;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 求解参数。可由 Jackson 绑定，也可用 withXxx 链式构造。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SolveConfig {

    public static final double DEFAULT_TIME_LIMIT_SECONDS = 10.0;
    public static final long DEFAULT_NODE_LIMIT = 10_000_000L;
    public static final int DEFAULT_LOCAL_SEARCH_STEP_LIMIT = 2_000;
    public static final int DEFAULT_UNIMPROVED_STEP_LIMIT = 200;

    @JsonProperty("timeLimitSeconds")
    private double timeLimitSeconds = DEFAULT_TIME_LIMIT_SECONDS;

    @JsonProperty("allowUnassigned")
    private boolean allowUnassigned = false;

    @JsonProperty("strategy")
    private SolveStrategy strategy = SolveStrategy.EXACT;

    // 分支定界的节点上限
    @JsonProperty("nodeLimit")
    private long nodeLimit = DEFAULT_NODE_LIMIT;

    // 仅启发式使用
    @JsonProperty("randomSeed")
    private long randomSeed = 0L;

    @JsonProperty("localSearchStepLimit")
    private int localSearchStepLimit = DEFAULT_LOCAL_SEARCH_STEP_LIMIT;

    @JsonProperty("unimprovedStepLimit")
    private int unimprovedStepLimit = DEFAULT_UNIMPROVED_STEP_LIMIT;

    public SolveConfig() {
    }

    public SolveConfig copy() {
        return new SolveConfig()
                .withTimeLimitSeconds(timeLimitSeconds)
                .withAllowUnassigned(allowUnassigned)
                .withStrategy(strategy)
                .withNodeLimit(nodeLimit)
                .withRandomSeed(randomSeed)
                .withLocalSearchStepLimit(localSearchStepLimit)
                .withUnimprovedStepLimit(unimprovedStepLimit);
    }

    /**
     * 参数不合法时抛出 {@link IllegalArgumentException}。
     */
    public void validate() {
        if (!Double.isFinite(timeLimitSeconds) || timeLimitSeconds <= 0) {
            throw new IllegalArgumentException("timeLimitSeconds 必须 > 0，实际为 " + timeLimitSeconds);
        }
        if (strategy == null) {
            throw new IllegalArgumentException("strategy 不能为空");
        }
        if (nodeLimit <= 0) {
            throw new IllegalArgumentException("nodeLimit 必须 > 0，实际为 " + nodeLimit);
        }
        if (localSearchStepLimit < 0) {
            throw new IllegalArgumentException("localSearchStepLimit 不能为负数");
        }
        if (unimprovedStepLimit <= 0) {
            throw new IllegalArgumentException("unimprovedStepLimit 必须 > 0");
        }
    }

    public long timeLimitMillis() {
        return Math.max(1L, Math.round(timeLimitSeconds * 1000.0));
    }

    public double getTimeLimitSeconds() { return timeLimitSeconds; }
    public boolean isAllowUnassigned() { return allowUnassigned; }
    public SolveStrategy getStrategy() { return strategy; }
    public long getNodeLimit() { return nodeLimit; }
    public long getRandomSeed() { return randomSeed; }
    public int getLocalSearchStepLimit() { return localSearchStepLimit; }
    public int getUnimprovedStepLimit() { return unimprovedStepLimit; }

    public void setTimeLimitSeconds(double timeLimitSeconds) { this.timeLimitSeconds = timeLimitSeconds; }
    public void setAllowUnassigned(boolean allowUnassigned) { this.allowUnassigned = allowUnassigned; }
    public void setStrategy(SolveStrategy strategy) { this.strategy = strategy; }
    public void setNodeLimit(long nodeLimit) { this.nodeLimit = nodeLimit; }
    public void setRandomSeed(long randomSeed) { this.randomSeed = randomSeed; }
    public void setLocalSearchStepLimit(int localSearchStepLimit) { this.localSearchStepLimit = localSearchStepLimit; }
    public void setUnimprovedStepLimit(int unimprovedStepLimit) { this.unimprovedStepLimit = unimprovedStepLimit; }

    public SolveConfig withTimeLimitSeconds(double timeLimitSeconds) {
        this.timeLimitSeconds = timeLimitSeconds;
        return this;
    }

    public SolveConfig withAllowUnassigned(boolean allowUnassigned) {
        this.allowUnassigned = allowUnassigned;
        return this;
    }

    public SolveConfig withStrategy(SolveStrategy strategy) {
        this.strategy = strategy;
        return this;
    }

    public SolveConfig withNodeLimit(long nodeLimit) {
        this.nodeLimit = nodeLimit;
        return this;
    }

    public SolveConfig withRandomSeed(long randomSeed) {
        this.randomSeed = randomSeed;
        return this;
    }

    public SolveConfig withLocalSearchStepLimit(int localSearchStepLimit) {
        this.localSearchStepLimit = localSearchStepLimit;
        return this;
    }

    public SolveConfig withUnimprovedStepLimit(int unimprovedStepLimit) {
        this.unimprovedStepLimit = unimprovedStepLimit;
        return this;
    }

    @Override
    public String toString() {
        return "SolveConfig{strategy=" + strategy + ", timeLimitSeconds=" + timeLimitSeconds
                + ", allowUnassigned=" + allowUnassigned + ", nodeLimit=" + nodeLimit
                + ", randomSeed=" + randomSeed + "}";
    }
}
