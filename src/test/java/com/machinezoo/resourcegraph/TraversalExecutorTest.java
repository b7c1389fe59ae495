// Part of Resourcegraph
package com.machinezoo.resourcegraph;

import static org.junit.jupiter.api.Assertions.*;
import java.util.concurrent.*;
import org.junit.jupiter.api.*;

public class TraversalExecutorTest {
	@Test
	public void threads() throws Exception {
		// Common executor runs tasks on named daemon threads.
		CompletableFuture<Thread> thread = CompletableFuture.supplyAsync(Thread::currentThread, TraversalExecutor.common());
		Thread used = thread.get(10, TimeUnit.SECONDS);
		assertTrue(used.isDaemon());
		assertTrue(used.getName().startsWith("resourcegraph-"));
		assertSame(TraversalExecutor.common(), TraversalExecutor.common());
	}
	@Test
	public void sizing() {
		TraversalExecutor executor = new TraversalExecutor(3);
		try {
			assertEquals(3, executor.getCorePoolSize());
			assertEquals(3, executor.getMaximumPoolSize());
			assertTrue(executor.allowsCoreThreadTimeOut());
		} finally {
			executor.shutdown();
		}
	}
}
