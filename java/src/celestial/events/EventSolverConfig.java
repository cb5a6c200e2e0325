package celestial.events;

import java.io.Serializable;

/**
 * 事件计算配置
 *
 * 控制迭代精化和批量计算的参数
 */
public class EventSolverConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private int maxIterations = 20;                     // 精化最大迭代次数
    private double convergenceToleranceSeconds = 1.0;   // 收敛容差（秒）
    private boolean includeTwilight = true;             // 太阳是否计算晨昏蒙影
    private boolean useParallel = false;                // 批量计算是否并行
    private int parallelism = Runtime.getRuntime().availableProcessors();

    public EventSolverConfig() {
    }

    // Getters and Setters
    public int getMaxIterations() {
        return maxIterations;
    }

    public void setMaxIterations(int maxIterations) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1: " + maxIterations);
        }
        this.maxIterations = maxIterations;
    }

    public double getConvergenceToleranceSeconds() {
        return convergenceToleranceSeconds;
    }

    public void setConvergenceToleranceSeconds(double convergenceToleranceSeconds) {
        if (!(convergenceToleranceSeconds > 0.0)) {
            throw new IllegalArgumentException("convergence tolerance must be positive: "
                + convergenceToleranceSeconds);
        }
        this.convergenceToleranceSeconds = convergenceToleranceSeconds;
    }

    public boolean isIncludeTwilight() {
        return includeTwilight;
    }

    public void setIncludeTwilight(boolean includeTwilight) {
        this.includeTwilight = includeTwilight;
    }

    public boolean isUseParallel() {
        return useParallel;
    }

    public void setUseParallel(boolean useParallel) {
        this.useParallel = useParallel;
    }

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1: " + parallelism);
        }
        this.parallelism = parallelism;
    }

    @Override
    public String toString() {
        return "EventSolverConfig{" +
                "maxIterations=" + maxIterations +
                ", convergenceToleranceSeconds=" + convergenceToleranceSeconds +
                ", includeTwilight=" + includeTwilight +
                ", useParallel=" + useParallel +
                ", parallelism=" + parallelism +
                '}';
    }
}
