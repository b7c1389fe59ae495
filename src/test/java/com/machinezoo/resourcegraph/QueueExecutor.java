// Part of Resourcegraph
package com.machinezoo.resourcegraph;

import java.util.*;
import java.util.concurrent.*;

/*
 * Holds submitted tasks until the test runs them, which makes background resolution deterministic.
 */
public class QueueExecutor implements Executor {
	private final Queue<Runnable> tasks = new ConcurrentLinkedQueue<>();
	@Override
	public void execute(Runnable task) {
		tasks.add(task);
	}
	public int pending() {
		return tasks.size();
	}
	public void runAll() {
		for (Runnable task = tasks.poll(); task != null; task = tasks.poll())
			task.run();
	}
}
