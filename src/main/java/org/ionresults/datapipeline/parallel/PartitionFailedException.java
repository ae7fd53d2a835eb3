package org.ionresults.datapipeline.parallel;

/**
 * Thrown by {@link PartitionWorkerPool#dispatch} when a partition failed on its last attempt.
 * The failure of the last attempt is the cause.
 */
public class PartitionFailedException extends RuntimeException {

    private final int partition;
    private final int attempts;

    public PartitionFailedException(int partition, int attempts, Throwable cause) {
        super("Partition " + partition + " failed after " + attempts + " attempt(s): " + cause.getMessage(), cause);
        this.partition = partition;
        this.attempts = attempts;
    }

    public int getPartition() {
        return partition;
    }

    public int getAttempts() {
        return attempts;
    }
}
