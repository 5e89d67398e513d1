package com.edge.astrometry.core.parallel;

/**
 * 工作线程返回的消息，带有原始任务 id
 */
public final class TaskResult<R> {
    private final int taskId;
    private final R value;
    private final Throwable failure;
    private final String workerName;

    private TaskResult(int taskId, R value, Throwable failure, String workerName) {
        this.taskId = taskId;
        this.value = value;
        this.failure = failure;
        this.workerName = workerName;
    }

    public static <R> TaskResult<R> success(int taskId, R value, String workerName) {
        return new TaskResult<>(taskId, value, null, workerName);
    }

    public static <R> TaskResult<R> failure(int taskId, Throwable failure, String workerName) {
        return new TaskResult<>(taskId, null, failure, workerName);
    }

    public int getTaskId() { return taskId; }
    public R getValue() { return value; }
    public Throwable getFailure() { return failure; }
    public String getWorkerName() { return workerName; }

    public boolean isSuccess() {
        return failure == null;
    }
}
