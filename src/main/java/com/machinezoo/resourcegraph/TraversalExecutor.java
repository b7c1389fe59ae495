// Part of Resourcegraph
package com.machinezoo.resourcegraph;

import java.util.concurrent.*;
import java.util.concurrent.atomic.*;
import io.micrometer.core.instrument.*;

/*
 * Traversals mostly wait for queryer and path lookups, so the pool is sized above core count.
 * Threads are daemons. Pending traversals must not keep the process alive,
 * because their only effect is a cache update that nobody would see after shutdown.
 */
/**
 * Thread pool for background graph traversals.
 */
public class TraversalExecutor extends ThreadPoolExecutor {
	private static final AtomicLong threadCounter = new AtomicLong();
	public TraversalExecutor(int parallelism, ThreadFactory threads) {
		super(parallelism, parallelism, 60, TimeUnit.SECONDS, new LinkedBlockingQueue<>(), threads);
		allowCoreThreadTimeOut(true);
	}
	public TraversalExecutor(int parallelism) {
		this(parallelism, runnable -> {
			Thread thread = new Thread(runnable);
			thread.setDaemon(true);
			thread.setName("resourcegraph-" + threadCounter.incrementAndGet());
			return thread;
		});
	}
	public TraversalExecutor() {
		this(2 * Runtime.getRuntime().availableProcessors());
	}
	private static final TraversalExecutor common = new TraversalExecutor();
	static {
		Metrics.gauge("resourcegraph.executor.threads", common, x -> x.getPoolSize());
		Metrics.gauge("resourcegraph.executor.queue", common, x -> x.getQueue().size());
	}
	/**
	 * Gets executor shared by all caches that were not given a custom one.
	 * 
	 * @return shared executor
	 */
	public static TraversalExecutor common() {
		return common;
	}
}
