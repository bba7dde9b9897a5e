package ackflow.scheduler;

/**
 * Decides how many consecutive synchronous steps a producer may take on
 * the current call stack before it has to yield to its {@link Scheduler}.
 * <p>
 * Progress is measured in frames: a simple producer spends one frame per
 * element, a producer whose every step is itself a deferred computation
 * spends two (one for the computation, one for the delivery). Once
 * {@link #canRunSynchronously(int)} answers false the producer submits its
 * continuation as a fresh task, which bounds the stack depth and gives other
 * tasks of the scheduler a chance to run.
 */
public final class ExecutionModel {

    /**
     * The default batch size, taken from the {@code ackflow.batchSize} system
     * property (1024 when absent) and rounded up to a power of two.
     */
    public static final int RECOMMENDED_BATCH_SIZE =
            roundToPowerOf2(Integer.getInteger("ackflow.batchSize", 1024));

    /** Runs everything synchronously, never forcing a yield. */
    public static final ExecutionModel SYNCHRONOUS = new ExecutionModel(Kind.SYNCHRONOUS, RECOMMENDED_BATCH_SIZE);

    /** Forces an asynchronous boundary before every single step. */
    public static final ExecutionModel ALWAYS_ASYNC = new ExecutionModel(Kind.ALWAYS_ASYNC, 1);

    /** Batched execution with {@link #RECOMMENDED_BATCH_SIZE}. */
    public static final ExecutionModel DEFAULT = new ExecutionModel(Kind.BATCHED, RECOMMENDED_BATCH_SIZE);

    /**
     * The policy family.
     */
    public enum Kind {
        SYNCHRONOUS,
        ALWAYS_ASYNC,
        BATCHED
    }

    final Kind kind;

    final int recommendedBatchSize;

    ExecutionModel(Kind kind, int recommendedBatchSize) {
        this.kind = kind;
        this.recommendedBatchSize = recommendedBatchSize;
    }

    /**
     * Batched execution allowing {@code batchSize} frames per quantum.
     *
     * @param batchSize the frames per quantum, rounded up to a power of two, at least 2
     * @return the execution model
     */
    public static ExecutionModel batched(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize > 0 required but it was " + batchSize);
        }
        return new ExecutionModel(Kind.BATCHED, roundToPowerOf2(batchSize));
    }

    static int roundToPowerOf2(int x) {
        if (x <= 2) {
            return 2;
        }
        if (x > (1 << 30)) {
            return 1 << 30;
        }
        return 1 << (32 - Integer.numberOfLeadingZeros(x - 1));
    }

    public Kind kind() {
        return kind;
    }

    /**
     * @return the number of frames that fit in one synchronous quantum
     */
    public int recommendedBatchSize() {
        return recommendedBatchSize;
    }

    public boolean isAlwaysAsync() {
        return kind == Kind.ALWAYS_ASYNC;
    }

    /**
     * Is another synchronous step permitted?
     *
     * @param framesConsumed the frames already spent synchronously in the current quantum
     * @return true if the producer may continue on the current call stack
     */
    public boolean canRunSynchronously(int framesConsumed) {
        switch (kind) {
            case SYNCHRONOUS:
                return true;
            case ALWAYS_ASYNC:
                return false;
            default:
                return framesConsumed < recommendedBatchSize;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ExecutionModel)) {
            return false;
        }
        ExecutionModel other = (ExecutionModel) o;
        return kind == other.kind && recommendedBatchSize == other.recommendedBatchSize;
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + recommendedBatchSize;
    }

    @Override
    public String toString() {
        switch (kind) {
            case BATCHED:
                return "ExecutionModel.batched(" + recommendedBatchSize + ")";
            default:
                return "ExecutionModel." + kind;
        }
    }
}
