// Part of Resourcegraph
package com.machinezoo.resourcegraph.visitor;

import static org.hamcrest.MatcherAssert.*;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import org.junit.jupiter.api.*;
import com.machinezoo.resourcegraph.*;
import com.machinezoo.resourcegraph.objects.*;
import com.machinezoo.resourcegraph.view.*;

public class GraphVisitorTest {
	private final FakeViewerConfig config = new FakeViewerConfig();
	private final MapQueryer queryer = new MapQueryer();
	private final ObjectGraph graph = new ObjectGraph();
	private final GraphVisitor visitor = new GraphVisitor(config, queryer, graph);
	private final GenericObject deployment = TestObjects.deployment();
	private ResourceViewerComponent visit(ClusterObject root) {
		graph.seed(root);
		visitor.visit(TraversalContext.background(), root);
		return graph.snapshot();
	}
	@Test
	public void reservedUid() {
		GenericObject rs = TestObjects.owned("ReplicaSet", "rs", deployment);
		GenericObject odd = new GenericObject("v1", "Pod", new ObjectMetadata("odd", "").withUid("emptyID"));
		GenericObject pod = TestObjects.owned("Pod", "pod", rs);
		queryer.link(deployment, odd, rs).link(rs, pod);
		ResourceViewerComponent component = visit(deployment);
		// Object with reserved uid is keyed by identity and does not stop the traversal.
		assertThat(component.nodes().keySet(), contains("deployment", "v1:Pod:odd", "rs", "pod"));
		assertEquals("odd", component.nodes().get("v1:Pod:odd").name());
		assertThat(component.edges("deployment"), contains(new Edge("v1:Pod:odd", Edge.Type.EXPLICIT), new Edge("rs", Edge.Type.EXPLICIT)));
	}
	@Test
	public void chain() {
		GenericObject rs = TestObjects.owned("ReplicaSet", "rs", deployment);
		GenericObject pod = TestObjects.owned("Pod", "pod", rs);
		queryer.link(deployment, rs).link(rs, pod);
		ResourceViewerComponent component = visit(deployment);
		// Single children form a linear chain.
		assertThat(component.nodes().keySet(), contains("deployment", "rs", "pod"));
		assertThat(component.edges("deployment"), contains(new Edge("rs", Edge.Type.EXPLICIT)));
		assertThat(component.edges("rs"), contains(new Edge("pod", Edge.Type.EXPLICIT)));
		assertThat(component.edges("pod"), empty());
		// Every object is queried once. Only the root gets a path.
		assertThat(queryer.queried, contains(ObjectKey.of(deployment), ObjectKey.of(rs), ObjectKey.of(pod)));
		assertThat(config.paths, contains("apps/v1 Deployment deployment"));
		assertEquals("/path", component.nodes().get("deployment").path());
		assertEquals("", component.nodes().get("pod").path());
	}
	@Test
	public void order() {
		GenericObject a = TestObjects.object("Pod", "a");
		GenericObject b = TestObjects.object("Pod", "b");
		GenericObject c = TestObjects.object("Pod", "c");
		GenericObject a1 = TestObjects.object("Pod", "a1");
		queryer.link(deployment, a, b, c).link(a, a1);
		// Depth-first preorder following queryer's order.
		assertThat(visit(deployment).nodes().keySet(), contains("deployment", "a", "a1", "b", "c"));
	}
	@Test
	public void cycle() {
		GenericObject a = TestObjects.object("ConfigMap", "a");
		GenericObject b = TestObjects.object("ConfigMap", "b");
		queryer.link(a, b).link(b, a);
		ResourceViewerComponent component = visit(a);
		// Cycle terminates without duplicate nodes.
		assertThat(component.nodes().keySet(), contains("a", "b"));
		assertThat(component.edges("a"), contains(new Edge("b", Edge.Type.EXPLICIT)));
		assertThat(component.edges("b"), contains(new Edge("a", Edge.Type.EXPLICIT)));
		assertEquals(2, queryer.queried.size());
	}
	@Test
	public void diamond() {
		GenericObject left = TestObjects.object("Service", "left");
		GenericObject right = TestObjects.object("Service", "right");
		GenericObject shared = TestObjects.object("Pod", "shared");
		queryer.link(deployment, left, right).link(left, shared).link(right, shared);
		ResourceViewerComponent component = visit(deployment);
		// Shared child is expanded once, but both edges are recorded.
		assertEquals(4, component.nodes().size());
		assertThat(component.edges("left"), contains(new Edge("shared", Edge.Type.EXPLICIT)));
		assertThat(component.edges("right"), contains(new Edge("shared", Edge.Type.EXPLICIT)));
		assertEquals(1, Collections.frequency(queryer.queried, ObjectKey.of(shared)));
	}
	@Test
	public void partial() {
		GenericObject broken = TestObjects.object("ReplicaSet", "broken");
		GenericObject healthy = TestObjects.object("ReplicaSet", "healthy");
		GenericObject pod = TestObjects.object("Pod", "pod");
		ArithmeticException cause = new ArithmeticException();
		queryer.link(deployment, broken, healthy).link(healthy, pod).fail(broken, cause);
		graph.seed(deployment);
		// Failure is reported with the original cause.
		ChildLookupException ex = assertThrows(ChildLookupException.class, () -> visitor.visit(TraversalContext.background(), deployment));
		assertSame(cause, ex.getCause());
		assertEquals(ObjectKey.of(broken), ex.parent());
		// Sibling branch was still traversed and nodes recorded so far are kept.
		assertThat(graph.snapshot().nodes().keySet(), contains("deployment", "broken", "healthy", "pod"));
	}
	@Test
	public void failures() {
		GenericObject first = TestObjects.object("ReplicaSet", "first");
		GenericObject second = TestObjects.object("ReplicaSet", "second");
		queryer.link(deployment, first, second)
			.fail(first, new IllegalStateException("first"))
			.fail(second, new IllegalStateException("second"));
		graph.seed(deployment);
		// First failure is thrown, later ones are suppressed.
		ChildLookupException ex = assertThrows(ChildLookupException.class, () -> visitor.visit(TraversalContext.background(), deployment));
		assertEquals("first", ex.getCause().getMessage());
		assertEquals(1, ex.getSuppressed().length);
		assertThat(ex.getSuppressed()[0], instanceOf(ChildLookupException.class));
	}
	@Test
	public void root() {
		queryer.fail(deployment, new IllegalStateException());
		graph.seed(deployment);
		// Root failure leaves the resolved root in the graph.
		assertThrows(ChildLookupException.class, () -> visitor.visit(TraversalContext.background(), deployment));
		assertThat(graph.snapshot().nodes().keySet(), contains("deployment"));
	}
	@Test
	public void cancel() {
		TraversalContext context = TraversalContext.background().withCancel();
		GenericObject rs = TestObjects.object("ReplicaSet", "rs");
		GenericObject other = TestObjects.object("ReplicaSet", "other");
		Queryer cancelling = (c, object) -> {
			c.cancel();
			return List.of(rs, other);
		};
		GraphVisitor visitor = new GraphVisitor(config, cancelling, graph);
		// Cancellation stops traversal at the next child lookup.
		assertThrows(TraversalCancelledException.class, () -> visitor.visit(context, deployment));
		// Cancelled context is refused upfront.
		assertThrows(TraversalCancelledException.class, () -> visitor.visit(context, deployment));
	}
	@Test
	public void path() {
		config.pathFailure = new IllegalStateException();
		// Path failure aborts the whole build.
		ResourceGraphException ex = assertThrows(ResourceGraphException.class, () -> visit(deployment));
		assertThat(ex.getCause(), instanceOf(IllegalStateException.class));
		assertThat(queryer.queried, empty());
	}
	@Test
	public void invalid() {
		GenericObject nameless = new GenericObject("v1", "Pod", new ObjectMetadata("", "default"));
		GenericObject pod = TestObjects.object("Pod", "pod");
		queryer.link(deployment, nameless, pod);
		graph.seed(deployment);
		// Invalid child is reported, valid siblings are kept.
		assertThrows(InvalidObjectException.class, () -> visitor.visit(TraversalContext.background(), deployment));
		assertThat(graph.snapshot().nodes().keySet(), contains("deployment", "pod"));
	}
}
