package com.iimsoft.binassign.solver;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 协作式终止：墙钟截止时间、节点上限、外部取消。
 * <p>
 * 求解器只在搜索节点边界上检查 {@link #isExhausted(long)}，因此返回的在位解总是完整的。
 * 实例可在其它线程上 {@link #cancel()}。
 */
public final class SearchBudget {

    public enum StopReason {
        NONE,
        TIME_LIMIT,
        NODE_LIMIT,
        CANCELLED
    }

    private final long startNanos;
    private final long deadlineNanos;
    private final long nodeLimit;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> cancelHooks = new CopyOnWriteArrayList<>();
    private volatile StopReason stopReason = StopReason.NONE;

    private SearchBudget(long timeLimitMillis, long nodeLimit) {
        this.startNanos = System.nanoTime();
        this.deadlineNanos = startNanos + TimeUnit.MILLISECONDS.toNanos(timeLimitMillis);
        this.nodeLimit = nodeLimit;
    }

    public static SearchBudget start(SolveConfig config) {
        return new SearchBudget(config.timeLimitMillis(), config.getNodeLimit());
    }

    public static SearchBudget of(long timeLimitMillis, long nodeLimit) {
        return new SearchBudget(timeLimitMillis, nodeLimit);
    }

    public boolean isExhausted(long nodesExplored) {
        if (stopReason != StopReason.NONE) {
            return true;
        }
        if (cancelled.get()) {
            stopReason = StopReason.CANCELLED;
        } else if (nodesExplored >= nodeLimit) {
            stopReason = StopReason.NODE_LIMIT;
        } else if (System.nanoTime() - deadlineNanos >= 0) {
            stopReason = StopReason.TIME_LIMIT;
        }
        return stopReason != StopReason.NONE;
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            for (Runnable hook : cancelHooks) {
                hook.run();
            }
        }
    }

    /**
     * 注册取消回调（如 OptaPlanner 的 terminateEarly）。已取消时立即执行。
     */
    public void onCancel(Runnable hook) {
        cancelHooks.add(hook);
        if (cancelled.get()) {
            hook.run();
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public long remainingMillis() {
        return Math.max(0L, TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime()));
    }

    public long elapsedMillis() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    public StopReason getStopReason() {
        return stopReason;
    }
}
