// Part of Topostate: https://topostate.machinezoo.com
package com.machinezoo.topostate;

import static org.hamcrest.MatcherAssert.*;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;
import java.util.function.*;
import java.util.stream.*;
import org.junit.jupiter.api.*;
import org.junit.jupiter.params.*;
import org.junit.jupiter.params.provider.*;
import com.google.common.reflect.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.closeablescope.CloseableScope;
import com.machinezoo.noexception.*;

public class StateStoreTest {
	private final StateStore store = new StateStore();
	private <T> StateHandle<T> rootAt(String position, Class<T> type, Supplier<T> initializer) {
		return CallTree.supply(position, () -> store.root(type, initializer));
	}
	@Test
	public void reuse() {
		// Value is created on first visit.
		StateHandle<Integer> h = rootAt("P", Integer.class, () -> 42);
		assertEquals(42, (int)h.get());
		// Later visits return the same state and ignore the initializer.
		assertEquals(42, (int)rootAt("P", Integer.class, () -> 500).get());
		assertSame(h, rootAt("P", Integer.class, () -> 500));
	}
	@Test
	public void initializeOnce() {
		AtomicInteger calls = new AtomicInteger();
		for (int i = 0; i < 5; ++i)
			rootAt("P", Integer.class, calls::incrementAndGet);
		assertEquals(1, calls.get());
		// Null is a legitimate value. It is not mistaken for missing state.
		for (int i = 0; i < 5; ++i)
			assertNull(rootAt("Q", String.class, () -> {
				calls.incrementAndGet();
				return null;
			}).get());
		assertEquals(2, calls.get());
	}
	@Test
	public void rerootDoesNotWrite() {
		StateHandle<Integer> h = rootAt("P", Integer.class, () -> 1);
		h.set(2);
		// Rooting with a different initializer is not a way to change the value.
		assertEquals(2, (int)rootAt("P", Integer.class, () -> 3).get());
	}
	@Test
	public void lifecycle() {
		StateHandle<Integer> h = rootAt("P", Integer.class, () -> 42);
		assertEquals(42, (int)h.get());
		store.sweep();
		// Reading marks the state as accessed.
		assertEquals(42, (int)h.get());
		store.sweep();
		// No access between these two sweeps.
		store.sweep();
		assertEquals(500, (int)rootAt("P", Integer.class, () -> 500).get());
	}
	@Test
	public void survivesFirstSweep() {
		StateHandle<Integer> h = rootAt("P", Integer.class, () -> 1);
		// Creation counts as an access.
		store.sweep();
		assertTrue(store.contains(h.key()));
		store.sweep();
		assertFalse(store.contains(h.key()));
	}
	@Test
	public void visitKeepsAlive() {
		StateHandle<Integer> h = rootAt("P", Integer.class, () -> 1);
		h.set(7);
		// Merely visiting the position every cycle keeps the state alive without reading it.
		for (int i = 0; i < 10; ++i) {
			rootAt("P", Integer.class, () -> 0);
			store.sweep();
		}
		assertEquals(7, (int)rootAt("P", Integer.class, () -> 0).get());
	}
	static Stream<Arguments> accesses() {
		return Stream.of(
			Arguments.of("get", (Consumer<StateHandle<Integer>>)h -> h.get()),
			Arguments.of("read", (Consumer<StateHandle<Integer>>)h -> h.get(v -> v + 1)),
			Arguments.of("set", (Consumer<StateHandle<Integer>>)h -> h.set(7)),
			Arguments.of("mutate", (Consumer<StateHandle<Integer>>)h -> h.mutate(v -> {})),
			Arguments.of("update", (Consumer<StateHandle<Integer>>)h -> h.update(v -> v + 1)));
	}
	@ParameterizedTest
	@MethodSource("accesses")
	public void touchToSurvive(String name, Consumer<StateHandle<Integer>> access) {
		StateHandle<Integer> h = rootAt("P", Integer.class, () -> 1);
		// Clear the access flag left by creation.
		store.sweep();
		access.accept(h);
		store.sweep();
		assertTrue(store.contains(h.key()));
		store.sweep();
		assertFalse(store.contains(h.key()));
	}
	@Test
	public void positionsAreIndependent() {
		rootAt("P", Integer.class, () -> 1).set(10);
		rootAt("Q", Integer.class, () -> 2).set(20);
		assertEquals(10, (int)rootAt("P", Integer.class, () -> 0).get());
		assertEquals(20, (int)rootAt("Q", Integer.class, () -> 0).get());
	}
	@Test
	public void typesAreIndependent() {
		StateHandle<Integer> number = rootAt("P", Integer.class, () -> 1);
		StateHandle<String> text = rootAt("P", String.class, () -> "hello");
		assertEquals(1, (int)number.get());
		assertEquals("hello", text.get());
		assertEquals(2, store.size());
		// Generic parameters are part of the type.
		List<String> strings = CallTree.supply("P", () -> store.root(new TypeToken<List<String>>() {}, ArrayList::new)).get();
		List<Integer> integers = CallTree.supply("P", () -> store.root(new TypeToken<List<Integer>>() {}, ArrayList::new)).get();
		assertNotSame(strings, integers);
		assertEquals(4, store.size());
	}
	@Test
	public void primitivesAreBoxed() {
		rootAt("P", int.class, () -> 1);
		// Primitive class and its wrapper are the same key.
		assertEquals(1, (int)rootAt("P", Integer.class, () -> 2).get());
		assertEquals(1, store.size());
	}
	@Test
	public void primitiveTokensAreBoxed() {
		CallTree.root(() -> {
			store.root(TypeToken.of(int.class), () -> 1);
			// Primitive token and wrapper class are the same key too.
			assertEquals(1, (int)store.root(Integer.class, () -> 2).get());
			assertEquals(1, (int)store.root(new TypeToken<Integer>() {}, () -> 3).get());
		});
		assertEquals(1, store.size());
	}
	@Test
	public void rootIsPerScope() {
		CallTree.run("component", () -> {
			StateHandle<Integer> first = store.root(Integer.class, () -> 0);
			// Same type in the same scope is the same state.
			assertSame(first, store.root(Integer.class, () -> 10));
		});
	}
	private List<StateHandle<Integer>> component() {
		return CallTree.supply("component", () -> {
			StateHandle<Integer> count = store.use(Integer.class, () -> 0);
			StateHandle<Integer> limit = store.use(Integer.class, () -> 10);
			return List.of(count, limit);
		});
	}
	private List<StateHandle<Integer>> render() {
		try (CloseableScope scope = CallTree.root()) {
			return component();
		}
	}
	@Test
	public void hooks() {
		List<StateHandle<Integer>> first = render();
		// Every hook call has its own state even if types are the same.
		assertNotSame(first.get(0), first.get(1));
		assertEquals(0, (int)first.get(0).get());
		assertEquals(10, (int)first.get(1).get());
		first.get(0).set(5);
		// Hooks find their state again in the next traversal.
		List<StateHandle<Integer>> second = render();
		assertSame(first.get(0), second.get(0));
		assertSame(first.get(1), second.get(1));
		assertEquals(5, (int)second.get(0).get());
		assertEquals(2, store.size());
		// Hook's scope is identified by the calling code, not by the store.
		CallSite site = (CallSite)first.get(0).key().position().callsite();
		assertEquals(StateStoreTest.class.getName(), site.className());
		assertEquals("component", first.get(0).key().position().parent().callsite());
	}
	@Test
	public void hooksInLoop() {
		List<StateHandle<Integer>> handles = new ArrayList<>();
		CallTree.root(() -> {
			for (int i = 0; i < 3; ++i) {
				int index = i;
				handles.add(store.use(Integer.class, () -> index));
			}
		});
		// Repeated calls from the same line are numbered.
		assertEquals(3, new HashSet<>(handles).size());
		assertEquals(2, (int)handles.get(2).get());
	}
	@Test
	public void sweepIsSelective() {
		StateHandle<Integer> kept = rootAt("kept", Integer.class, () -> 1);
		StateHandle<Integer> dropped = rootAt("dropped", Integer.class, () -> 2);
		store.sweep();
		kept.get();
		store.sweep();
		assertThat(store.keys(), contains(kept.key()));
		assertFalse(store.contains(dropped.key()));
	}
	@Test
	public void handleOutlivesEviction() {
		StateHandle<Integer> h = rootAt("P", Integer.class, () -> 1);
		store.sweep();
		store.sweep();
		assertFalse(store.contains(h.key()));
		// Evicted state is still accessible through the handle that was obtained earlier.
		h.set(5);
		assertEquals(5, (int)h.get());
		// But it is detached from the store, so rooting creates new state.
		StateHandle<Integer> fresh = rootAt("P", Integer.class, () -> 9);
		assertNotSame(h, fresh);
		assertEquals(9, (int)fresh.get());
		assertEquals(5, (int)h.get());
	}
	@Test
	public void nestedInitializer() {
		// Initializer can root state of its own.
		StateHandle<String> outer = CallTree.supply("outer", () -> store.root(String.class, () -> {
			int inner = CallTree.supply("inner", () -> store.root(Integer.class, () -> 3)).get();
			return "inner " + inner;
		}));
		assertEquals("inner 3", outer.get());
		assertEquals(2, store.size());
	}
	@Test
	public void mutation() {
		StateHandle<List<String>> h = CallTree.supply("P", () -> store.root(new TypeToken<List<String>>() {}, ArrayList::new));
		h.mutate(l -> l.add("a"));
		h.mutate(l -> l.add("b"));
		assertThat(h.get(), contains("a", "b"));
		assertEquals(2, (int)h.get(List::size));
		StateHandle<Integer> counter = rootAt("Q", Integer.class, () -> 0);
		assertEquals(1, (int)counter.update(v -> v + 1));
		assertEquals(2, (int)counter.update(v -> v + 1));
		assertEquals(2, (int)counter.get());
	}
	@Test
	public void evictionListeners() {
		List<StateKey> evicted = new ArrayList<>();
		// Failing listener doesn't prevent notification of other listeners.
		store.onEviction(k -> {
			throw new IllegalStateException();
		});
		store.onEviction(evicted::add);
		StateHandle<Integer> kept = rootAt("kept", Integer.class, () -> 1);
		StateHandle<Integer> dropped = rootAt("dropped", Integer.class, () -> 2);
		store.sweep();
		assertThat(evicted, is(empty()));
		kept.get();
		store.sweep();
		assertThat(evicted, contains(dropped.key()));
	}
	@Test
	public void concurrentDisjointKeys() {
		ExecutorService executor = Executors.newFixedThreadPool(8);
		try {
			List<Future<?>> futures = new ArrayList<>();
			for (int t = 0; t < 8; ++t) {
				int thread = t;
				futures.add(executor.submit(() -> CallTree.root(() -> {
					try (var scope = CallTree.slot("thread", thread)) {
						for (int i = 0; i < 100; ++i) {
							int index = i;
							CallTree.run("item", () -> store.root(Integer.class, () -> index));
						}
					}
				})));
			}
			for (Future<?> future : futures)
				Exceptions.sneak().get(future::get);
		} finally {
			executor.shutdown();
		}
		// Every thread rooted 100 distinct keys under its own keyed scope.
		assertEquals(800, store.size());
		store.sweep();
		assertEquals(800, store.size());
		store.sweep();
		assertEquals(0, store.size());
	}
	@Test
	public void nulls() {
		assertThrows(NullPointerException.class, () -> store.root((Class<Integer>)null, () -> 1));
		assertThrows(NullPointerException.class, () -> store.root(Integer.class, null));
		assertThrows(NullPointerException.class, () -> store.use(Integer.class, null));
		assertThrows(NullPointerException.class, () -> new StateStore(null));
		assertThrows(NullPointerException.class, () -> store.onEviction(null));
	}
	@Test
	public void customPositions() {
		AtomicReference<CallPosition> position = new AtomicReference<>(CallPosition.ROOT.child("custom", 1));
		StateStore custom = new StateStore(position::get);
		custom.root(String.class, () -> "first");
		position.set(CallPosition.ROOT.child("custom", 2));
		assertEquals("second", custom.root(String.class, () -> "second").get());
		position.set(CallPosition.ROOT.child("custom", 1));
		assertEquals("first", custom.root(String.class, () -> "third").get());
	}
	@Test
	public void common() {
		assertSame(StateStore.common(), StateStore.common());
		assertThat(StateStore.common().toString(), containsString("common"));
	}
	@Test
	public void printable() {
		StateHandle<Integer> h = rootAt("P", Integer.class, () -> 1);
		assertThat(h.toString(), startsWith("StateHandle"));
		assertThat(h.toString(), containsString("store.id"));
		assertThat(h.key().toString(), containsString("/P#0"));
	}
}
