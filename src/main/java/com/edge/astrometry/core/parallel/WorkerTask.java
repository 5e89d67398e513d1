package com.edge.astrometry.core.parallel;

/**
 * 工作单元：只读取显式传入的上下文，产生独立的结果
 *
 * @param <C> 只读上下文
 * @param <R> 结果类型
 */
@FunctionalInterface
public interface WorkerTask<C, R> {

    R execute(C context) throws Exception;
}
