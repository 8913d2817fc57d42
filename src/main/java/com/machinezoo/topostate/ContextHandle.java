// Part of Topostate: https://topostate.machinezoo.com
package com.machinezoo.topostate;

import java.util.*;
import java.util.function.*;
import com.google.common.reflect.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.stagean.*;

/*
 * Contrary to StateHandle, context handle does not hold reference to storage.
 * It looks up the context by type on every access. Context is reachable from anywhere by its type
 * and there may be any number of handles for it, all of them seeing the same value.
 *
 * Handle created with an initial value re-creates the context from that value if the context was evicted meantime.
 * Handle obtained by mere lookup has no initial value and it throws when the context does not exist.
 */
/**
 * Access to a value keyed by type alone, independent of position in the call tree.
 * Contexts are created by {@link StateStore#createContext(Class, Object)} and looked up by {@link StateStore#context(Class)}.
 * They are subject to the same access tracking and {@link StateStore#sweep()} as position-keyed state.
 * <p>
 * Context value can be temporarily overridden for the duration of a scope via {@link #override(Object)}.
 *
 * @param <T>
 *            type of the context value
 */
@StubDocs
public class ContextHandle<T> {
	private final StateStore store;
	private final TypeToken<T> type;
	private final boolean initialized;
	private final T initial;
	ContextHandle(StateStore store, TypeToken<T> type, boolean initialized, T initial) {
		this.store = store;
		this.type = type;
		this.initialized = initialized;
		this.initial = initial;
	}
	public StateKey key() {
		return StateKey.context(type);
	}
	private ContextSlot<T> slot() {
		return store.contextSlot(type, initialized, initial);
	}
	/**
	 * Returns current value of the context, which is the innermost override if there is any.
	 *
	 * @return current value
	 * @throws IllegalStateException
	 *             if the context does not exist and this handle has no initial value to re-create it with
	 */
	public T get() {
		return slot().get();
	}
	public <R> R get(Function<? super T, R> reader) {
		Objects.requireNonNull(reader);
		return slot().read(reader);
	}
	/**
	 * Sets current value of the context. If an override is active, the innermost override is replaced.
	 *
	 * @param value
	 *            new value
	 * @throws IllegalStateException
	 *             if the context does not exist and this handle has no initial value to re-create it with
	 */
	public void set(T value) {
		slot().set(value);
	}
	/**
	 * Overrides context value until the returned scope is closed.
	 * Overrides nest. Closing the scope restores previous value.
	 *
	 * @param value
	 *            temporary value of the context
	 * @return scope that removes the override when closed
	 */
	public CloseableScope override(T value) {
		return slot().push(value);
	}
	public void run(T value, Runnable body) {
		Objects.requireNonNull(body);
		try (CloseableScope scope = override(value)) {
			body.run();
		}
	}
	public <R> R supply(T value, Supplier<R> body) {
		Objects.requireNonNull(body);
		try (CloseableScope scope = override(value)) {
			return body.get();
		}
	}
	@Override
	public String toString() {
		return "ContextHandle[" + type + ", store." + store.label() + "]";
	}
}
