// Part of Resourcegraph
package com.machinezoo.resourcegraph;

import static org.hamcrest.MatcherAssert.*;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import org.junit.jupiter.api.*;

public class PostLockQueueTest {
	@Test
	public void deferred() {
		Object lock = new Object();
		List<String> log = new ArrayList<>();
		PostLockQueue postlock = new PostLockQueue(lock);
		String result = postlock.eval(() -> {
			postlock.post(() -> log.add("posted " + Thread.holdsLock(lock)));
			log.add("section " + Thread.holdsLock(lock));
			return "done";
		});
		// Posted tasks run after the section, outside the lock.
		assertEquals("done", result);
		assertThat(log, contains("section true", "posted false"));
	}
	@Test
	public void singleUse() {
		PostLockQueue postlock = new PostLockQueue(new Object());
		postlock.run(() -> {
		});
		assertThrows(IllegalStateException.class, () -> postlock.post(() -> {
		}));
	}
}
