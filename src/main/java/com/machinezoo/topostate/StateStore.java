// Part of Topostate: https://topostate.machinezoo.com
package com.machinezoo.topostate;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;
import java.util.function.*;
import org.slf4j.*;
import com.google.common.reflect.*;
import com.machinezoo.noexception.*;
import com.machinezoo.stagean.*;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.Timer;
import io.opentracing.*;
import io.opentracing.util.*;

/*
 * Registry of rooted state. Slots are keyed by position and type. Contexts are keyed by type alone.
 *
 * Lifetime of slots is generational. Every slot has a touched flag that is set by rooting and by every access via handle.
 * Sweep, which the host runs once per cycle, evicts untouched slots and clears the flag on the rest.
 * Slot that is not visited during a whole cycle is therefore gone after the next sweep.
 *
 * Locking is coarse. Lookups, insertions, and sweep synchronize on the store, which makes sweep atomic
 * from the point of view of rooting code. Touched flags are atomic and handles set them without the store lock.
 * Initializers run outside of the lock, so that they can root nested state and so that slow initializers
 * don't stall other threads working on unrelated keys.
 *
 * Rooting the same key concurrently from two threads is not supported. If it happens anyway,
 * both initializers run and the slot inserted first wins. Rooting is supposed to happen from a single traversal thread.
 */
/**
 * Position-keyed state for code that runs repeatedly along the same path in the call tree.
 * Call {@link #root(Class, Supplier)} to create state on first visit of a position and to reuse it on subsequent visits.
 * Call {@link #sweep()} once per cycle, between traversals, to evict state of positions that were not visited.
 * <p>
 * Positions are supplied by {@link PositionSource}, which defaults to {@link CallTree#position()}.
 * Applications can use the {@link #common()} store or create their own instances and pass them around.
 *
 * @see StateHandle
 * @see ContextHandle
 * @see CallTree
 */
@DraftDocs("render loop example, explanation of touch-to-survive")
public class StateStore {
	private static final Logger logger = LoggerFactory.getLogger(StateStore.class);
	private static final Timer timer = Metrics.timer("topostate.sweeps");
	private static final Counter evictionCount = Metrics.counter("topostate.evictions");
	private final PositionSource positions;
	/*
	 * Identifies the store in logs, spans, and toString() of its handles. Applications often have one store per window or session.
	 */
	private static final AtomicLong ids = new AtomicLong();
	private final long id = ids.incrementAndGet();
	private volatile boolean common;
	private final Map<StateKey, StateSlot<?>> slots = new HashMap<>();
	private final Map<TypeToken<?>, ContextSlot<?>> contexts = new HashMap<>();
	/*
	 * Listeners are invoked outside of the lock, so copy-on-write list spares us from copying during sweep.
	 */
	private final List<Consumer<StateKey>> listeners = new CopyOnWriteArrayList<>();
	public StateStore(PositionSource positions) {
		Objects.requireNonNull(positions);
		this.positions = positions;
	}
	public StateStore() {
		this(CallTree::position);
	}
	/*
	 * Process-wide store. Created when the class is first used, lives as long as the process.
	 * Its sweep() should be called by a single host loop. Code running in other loops should use its own store.
	 */
	private static final StateStore shared = new StateStore();
	static {
		shared.common = true;
		Metrics.gauge("topostate.slots", shared, StateStore::size);
	}
	public static StateStore common() {
		return shared;
	}
	public <T> StateHandle<T> root(Class<T> type, Supplier<T> initializer) {
		Objects.requireNonNull(type);
		return root(TypeToken.of(type), initializer);
	}
	/**
	 * Creates state at current position or returns existing state.
	 * If state of given type already exists at current position, it is marked as accessed and its handle is returned.
	 * The {@code initializer} is not called and the stored value is left unchanged in that case.
	 * Otherwise {@code initializer} is called once and its result is stored as a new slot.
	 * <p>
	 * Rooting counts as an access even if the returned handle is not used.
	 * <p>
	 * Key consists of current position and {@code type}, so two calls with the same type in the same scope return the same state.
	 * Use {@link #use(TypeToken, Supplier)} to give every call its own state.
	 * Positions are stable only within {@link CallTree#root()}. Outside of it, repeated entries of the same top-level scope
	 * (for example iterations of a loop that is not wrapped in any scope) all get the same position and share state.
	 *
	 * @param <T>
	 *            type of the state
	 * @param type
	 *            type of the state, which is part of the key
	 * @param initializer
	 *            supplier of the initial value, which may return {@code null}
	 * @return handle of the state, the same one for every call with the same key while the state exists
	 * @throws NullPointerException
	 *             if {@code type} or {@code initializer} is {@code null}
	 */
	public <T> StateHandle<T> root(TypeToken<T> type, Supplier<T> initializer) {
		Objects.requireNonNull(type);
		Objects.requireNonNull(initializer);
		/*
		 * Primitive type and its wrapper denote the same key. Values are boxed anyway.
		 */
		type = type.wrap();
		StateKey key = new StateKey(positions.position(), type);
		StateSlot<T> slot = lookup(key);
		if (slot != null)
			return slot.handle();
		T value = initializer.get();
		synchronized (this) {
			slot = lookup(key);
			if (slot != null)
				return slot.handle();
			slot = new StateSlot<>(this, key, value);
			slots.put(key, slot);
		}
		return slot.handle();
	}
	public <T> StateHandle<T> use(Class<T> type, Supplier<T> initializer) {
		Objects.requireNonNull(type);
		return use(TypeToken.of(type), initializer);
	}
	/*
	 * Hook-style rooting. Every call enters its own child scope identified by caller's source location,
	 * so several calls in one component get separate state even if they have the same type.
	 * Callsite must be captured here, before any frames of the initializer or CallTree get on the stack.
	 */
	/**
	 * Creates or reuses state in a nested scope specific to this call.
	 * This is equivalent to {@link #root(TypeToken, Supplier)} wrapped in {@link CallTree#enter()}.
	 * Distinct calls (on distinct source lines) in one component have independent state.
	 * Repeated calls from the same source line (in a loop) are numbered like any other scope.
	 * <p>
	 * This method is meaningful only for stores that take positions from {@link CallTree}, which is the default.
	 *
	 * @param <T>
	 *            type of the state
	 * @param type
	 *            type of the state
	 * @param initializer
	 *            supplier of the initial value, which may return {@code null}
	 * @return handle of the state
	 * @throws NullPointerException
	 *             if {@code type} or {@code initializer} is {@code null}
	 */
	public <T> StateHandle<T> use(TypeToken<T> type, Supplier<T> initializer) {
		Objects.requireNonNull(type);
		Objects.requireNonNull(initializer);
		return CallTree.supply(CallSite.caller(), () -> root(type, initializer));
	}
	/*
	 * Unchecked cast is safe, because the type is part of the key.
	 */
	@SuppressWarnings("unchecked")
	private synchronized <T> StateSlot<T> lookup(StateKey key) {
		StateSlot<?> slot = slots.get(key);
		if (slot == null)
			return null;
		slot.touch();
		return (StateSlot<T>)slot;
	}
	public <T> ContextHandle<T> createContext(Class<T> type, T initial) {
		Objects.requireNonNull(type);
		return createContext(TypeToken.of(type), initial);
	}
	/**
	 * Creates context of given type or returns existing one.
	 * If the context already exists, it is marked as accessed and its value is left unchanged.
	 * Returned handle remembers the {@code initial} value and uses it to re-create the context if it is later evicted.
	 *
	 * @param <T>
	 *            type of the context
	 * @param type
	 *            type of the context, which serves as its key
	 * @param initial
	 *            initial value of the context
	 * @return handle of the context
	 */
	public <T> ContextHandle<T> createContext(TypeToken<T> type, T initial) {
		Objects.requireNonNull(type);
		type = type.wrap();
		contextSlot(type, true, initial);
		return new ContextHandle<>(this, type, true, initial);
	}
	public <T> ContextHandle<T> context(Class<T> type) {
		Objects.requireNonNull(type);
		return context(TypeToken.of(type));
	}
	/**
	 * Returns handle for context of given type without creating the context.
	 * Accessing the context through the returned handle throws if the context does not exist at that time.
	 *
	 * @param <T>
	 *            type of the context
	 * @param type
	 *            type of the context
	 * @return handle of the context
	 */
	public <T> ContextHandle<T> context(TypeToken<T> type) {
		Objects.requireNonNull(type);
		return new ContextHandle<>(this, type.wrap(), false, null);
	}
	@SuppressWarnings("unchecked")
	synchronized <T> ContextSlot<T> contextSlot(TypeToken<T> type, boolean initialized, T initial) {
		ContextSlot<?> slot = contexts.get(type);
		if (slot != null) {
			slot.touch();
			return (ContextSlot<T>)slot;
		}
		if (!initialized)
			throw new IllegalStateException("Context " + type + " was never set.");
		ContextSlot<T> created = new ContextSlot<>(StateKey.context(type), initial);
		contexts.put(type, created);
		return created;
	}
	/**
	 * Registers listener that is notified about every evicted slot or context.
	 * Listeners run after the sweep completes, outside of any lock. Exceptions thrown by listeners are logged.
	 *
	 * @param listener
	 *            callback receiving keys of evicted state
	 * @return {@code this} (fluent method)
	 */
	public StateStore onEviction(Consumer<StateKey> listener) {
		Objects.requireNonNull(listener);
		listeners.add(listener);
		return this;
	}
	/**
	 * Evicts state that was not accessed since the previous sweep.
	 * Slots and contexts that were accessed are kept and their access flag is cleared.
	 * Sweep runs as single atomic pass with respect to rooting and context lookup.
	 * <p>
	 * This should be called once per cycle, between traversals, never concurrently with rooting for the same cycle.
	 */
	public void sweep() {
		Span span = GlobalTracer.get().buildSpan("topostate.sweep")
			.withTag("component", "topostate")
			.start();
		if (common)
			span.setTag("store.common", true);
		else
			span.setTag("store.id", id);
		Timer.Sample sample = Timer.start();
		List<StateKey> evicted = new ArrayList<>();
		int kept = 0;
		try (Scope trace = GlobalTracer.get().activateSpan(span)) {
			synchronized (this) {
				for (Iterator<StateSlot<?>> iterator = slots.values().iterator(); iterator.hasNext();) {
					StateSlot<?> slot = iterator.next();
					if (slot.survive())
						++kept;
					else {
						iterator.remove();
						evicted.add(slot.key);
					}
				}
				for (Iterator<ContextSlot<?>> iterator = contexts.values().iterator(); iterator.hasNext();) {
					ContextSlot<?> slot = iterator.next();
					if (slot.survive())
						++kept;
					else {
						iterator.remove();
						evicted.add(slot.key);
					}
				}
			}
			span.setTag("kept", kept);
			span.setTag("evicted", evicted.size());
			evictionCount.increment(evicted.size());
			logger.debug("Sweep of {} kept {} and evicted {} slots.", this, kept, evicted.size());
			/*
			 * Eviction listeners are application code. Don't let their exceptions escape from sweep,
			 * because that would skip notification of the remaining listeners.
			 */
			for (StateKey key : evicted)
				for (Consumer<StateKey> listener : listeners)
					Exceptions.log(logger).run(() -> listener.accept(key));
		} finally {
			sample.stop(timer);
			span.finish();
		}
	}
	/**
	 * Returns number of live slots and contexts.
	 *
	 * @return number of live slots and contexts
	 */
	public synchronized int size() {
		return slots.size() + contexts.size();
	}
	/*
	 * Snapshot. Context keys are included and they have null position.
	 */
	public synchronized Set<StateKey> keys() {
		Set<StateKey> keys = new HashSet<>(slots.keySet());
		for (ContextSlot<?> slot : contexts.values())
			keys.add(slot.key);
		return keys;
	}
	/*
	 * Does not count as an access.
	 */
	public synchronized boolean contains(StateKey key) {
		Objects.requireNonNull(key);
		if (key.context())
			return contexts.containsKey(key.type());
		return slots.containsKey(key);
	}
	/*
	 * Appears in toString() of handles too, so that it is clear which store they came from.
	 */
	String label() {
		return common ? "common" : "id=" + id;
	}
	@Override
	public String toString() {
		return "StateStore[" + label() + "]";
	}
}
