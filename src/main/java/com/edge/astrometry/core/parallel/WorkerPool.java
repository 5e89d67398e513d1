package com.edge.astrometry.core.parallel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 消息传递式工作线程池
 * <p>
 * 每批任务：
 * 1. 所有任务连同 id 放入工作队列，之后每个工作线程放一个 STOP 消息
 * 2. 工作线程不断取任务直到收到 STOP，结果（含任务 id）放入结果队列
 * 3. 调度线程取完全部结果后等待所有工作线程退出，再按 id 重组结果
 * <p>
 * 任务之间只共享只读上下文，不允许中途取消。串行模式在调用线程中按 id 顺序执行，
 * 结果与并行模式一致。
 */
public class WorkerPool {
    private static final Logger logger = LoggerFactory.getLogger(WorkerPool.class);

    private static final long JOIN_TIMEOUT_MINUTES = 10;

    private final int workerCount;
    private final boolean parallel;
    private final String name;
    private final AtomicInteger batchCounter = new AtomicInteger();

    public WorkerPool(int workerCount, boolean parallel, String name) {
        this.workerCount = workerCount > 0 ? workerCount : Runtime.getRuntime().availableProcessors();
        this.parallel = parallel;
        this.name = name;
    }

    public static WorkerPool serial(String name) {
        return new WorkerPool(1, false, name);
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public boolean isParallel() {
        return parallel;
    }

    /**
     * 串行版本，其余参数相同
     */
    public WorkerPool asSerial() {
        return parallel ? new WorkerPool(workerCount, false, name) : this;
    }

    /**
     * 执行一批任务，返回按任务 id 排序的结果
     *
     * @throws IllegalStateException 任一任务失败（在所有工作线程退出后抛出）
     */
    public <C, R> Map<Integer, R> runBatch(C context, Map<Integer, ? extends WorkerTask<C, R>> tasks) {
        if (tasks.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<Integer, TaskResult<R>> results = parallel && workerCount > 1 && tasks.size() > 1
            ? runParallel(context, tasks)
            : runSerial(context, tasks);

        Map<Integer, R> values = new TreeMap<>();
        for (TaskResult<R> result : results.values()) {
            if (!result.isSuccess()) {
                throw new IllegalStateException("Task " + result.getTaskId() + " failed on "
                    + result.getWorkerName() + ": " + result.getFailure(), result.getFailure());
            }
            values.put(result.getTaskId(), result.getValue());
        }
        return values;
    }

    private <C, R> Map<Integer, TaskResult<R>> runSerial(C context, Map<Integer, ? extends WorkerTask<C, R>> tasks) {
        String worker = Thread.currentThread().getName();
        Map<Integer, TaskResult<R>> results = new TreeMap<>();
        for (Map.Entry<Integer, ? extends WorkerTask<C, R>> entry : new TreeMap<>(tasks).entrySet()) {
            results.put(entry.getKey(), execute(entry.getKey(), entry.getValue(), context, worker));
        }
        return results;
    }

    private <C, R> Map<Integer, TaskResult<R>> runParallel(C context, Map<Integer, ? extends WorkerTask<C, R>> tasks) {
        int workers = Math.min(workerCount, tasks.size());
        int batch = batchCounter.incrementAndGet();
        BlockingQueue<WorkItem<C, R>> workQueue = new LinkedBlockingQueue<>();
        BlockingQueue<TaskResult<R>> resultQueue = new LinkedBlockingQueue<>();

        AtomicInteger threadIndex = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, name + "-" + batch + "-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        logger.debug("{} 批次 {}: {} 个任务, {} 个工作线程", name, batch, tasks.size(), workers);

        for (int i = 0; i < workers; i++) {
            executor.execute(() -> workerLoop(context, workQueue, resultQueue));
        }
        for (Map.Entry<Integer, ? extends WorkerTask<C, R>> entry : tasks.entrySet()) {
            workQueue.add(new WorkItem<>(entry.getKey(), entry.getValue()));
        }
        for (int i = 0; i < workers; i++) {
            workQueue.add(WorkItem.stop());
        }

        Map<Integer, TaskResult<R>> results = new TreeMap<>();
        try {
            for (int i = 0; i < tasks.size(); i++) {
                TaskResult<R> result = resultQueue.take();
                results.put(result.getTaskId(), result);
            }
            executor.shutdown();
            if (!executor.awaitTermination(JOIN_TIMEOUT_MINUTES, TimeUnit.MINUTES)) {
                executor.shutdownNow();
                throw new IllegalStateException(name + " workers did not terminate");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
            throw new IllegalStateException(name + " interrupted while waiting for results", e);
        }
        return results;
    }

    private <C, R> void workerLoop(C context, BlockingQueue<WorkItem<C, R>> workQueue,
                                   BlockingQueue<TaskResult<R>> resultQueue) {
        String worker = Thread.currentThread().getName();
        int processed = 0;
        try {
            while (true) {
                WorkItem<C, R> item = workQueue.take();
                if (item.isStop()) {
                    break;
                }
                resultQueue.add(execute(item.id, item.task, context, worker));
                processed++;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.trace("{} 退出, 处理了 {} 个任务", worker, processed);
    }

    private <C, R> TaskResult<R> execute(int id, WorkerTask<C, R> task, C context, String worker) {
        try {
            return TaskResult.success(id, task.execute(context), worker);
        } catch (Throwable e) {
            // Error 同样作为失败结果回传
            logger.error("任务 {} 在 {} 上失败: {}", id, worker, e.toString(), e);
            return TaskResult.failure(id, e, worker);
        }
    }

    private static final class WorkItem<C, R> {
        private final int id;
        private final WorkerTask<C, R> task;

        private WorkItem(int id, WorkerTask<C, R> task) {
            this.id = id;
            this.task = task;
        }

        static <C, R> WorkItem<C, R> stop() {
            return new WorkItem<>(-1, null);
        }

        boolean isStop() {
            return task == null;
        }
    }
}
