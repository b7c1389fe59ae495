// Part of Resourcegraph
package com.machinezoo.resourcegraph;

import java.util.*;
import java.util.function.*;

/*
 * Completing futures under lock would run their dependent actions under the same lock.
 * Cache code therefore posts completions here and they run after the lock is released.
 * Instances are single-use.
 */
class PostLockQueue {
	private final Object lock;
	private List<Runnable> deferred = new ArrayList<>();
	PostLockQueue(Object lock) {
		this.lock = lock;
	}
	<T> T eval(Supplier<T> section) {
		T result;
		synchronized (lock) {
			result = section.get();
		}
		drain();
		return result;
	}
	void run(Runnable section) {
		eval(() -> {
			section.run();
			return null;
		});
	}
	void post(Runnable task) {
		Objects.requireNonNull(task);
		if (deferred == null)
			throw new IllegalStateException();
		deferred.add(task);
	}
	private void drain() {
		List<Runnable> tasks = deferred;
		deferred = null;
		for (Runnable task : tasks)
			task.run();
	}
}
