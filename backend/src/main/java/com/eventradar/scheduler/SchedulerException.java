package com.eventradar.scheduler;

/**
 * Scheduler failure tagged with its kind and reason at the point of origin.
 */
public class SchedulerException extends RuntimeException {

    public enum Reason {
        ALREADY_SCHEDULED(ErrorKind.REJECTED),
        MAX_WORKERS_REACHED(ErrorKind.REJECTED),
        UNSUPPORTED_CHAIN(ErrorKind.REJECTED),
        INVALID_CONTRACT_ADDRESS(ErrorKind.REJECTED),
        INVALID_TRIGGER_EVENT(ErrorKind.REJECTED),
        JOB_NOT_FOUND(ErrorKind.REJECTED),
        SCHEDULER_STOPPED(ErrorKind.REJECTED),
        CHAIN_UNAVAILABLE(ErrorKind.TRANSIENT),
        WORKER_START_FAILED(ErrorKind.TRANSIENT),
        NO_CHAINS_CONNECTED(ErrorKind.FATAL);

        private final ErrorKind kind;

        Reason(ErrorKind kind) {
            this.kind = kind;
        }

        public ErrorKind kind() {
            return kind;
        }
    }

    private final Reason reason;

    public SchedulerException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public SchedulerException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    public ErrorKind getKind() {
        return reason.kind();
    }

    static SchedulerException alreadyScheduled(long jobId) {
        return new SchedulerException(Reason.ALREADY_SCHEDULED, String.format("job %d is already scheduled", jobId));
    }

    static SchedulerException maxWorkersReached(int maxWorkers, long jobId) {
        return new SchedulerException(Reason.MAX_WORKERS_REACHED,
                String.format("maximum number of workers (%d) reached, cannot schedule job %d", maxWorkers, jobId));
    }

    static SchedulerException unsupportedChain(String chainId) {
        return new SchedulerException(Reason.UNSUPPORTED_CHAIN, "unsupported chain ID: " + chainId);
    }

    static SchedulerException invalidContractAddress(String address) {
        return new SchedulerException(Reason.INVALID_CONTRACT_ADDRESS, "invalid contract address: " + address);
    }

    static SchedulerException stopped(String managerId, long jobId) {
        return new SchedulerException(Reason.SCHEDULER_STOPPED,
                String.format("scheduler %s is stopped, cannot schedule job %d", managerId, jobId));
    }

    static SchedulerException notScheduled(long jobId) {
        return new SchedulerException(Reason.JOB_NOT_FOUND, String.format("job %d is not scheduled", jobId));
    }

    static SchedulerException notFound(long jobId) {
        return new SchedulerException(Reason.JOB_NOT_FOUND, String.format("job %d not found", jobId));
    }
}
