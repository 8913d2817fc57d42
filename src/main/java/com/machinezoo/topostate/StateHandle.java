// Part of Topostate: https://topostate.machinezoo.com
package com.machinezoo.topostate;

import java.util.*;
import java.util.function.*;
import com.machinezoo.stagean.*;

/**
 * Access to state rooted at particular position.
 * Handles are returned by {@link StateStore#root(Class, Supplier)}.
 * Every read and write through the handle counts as an access, which keeps the state alive through the next {@link StateStore#sweep()}.
 * <p>
 * There is exactly one handle per rooted value. Rooting the same key again returns the same handle.
 * Handle holds direct reference to value storage. It remains usable even after the state is evicted,
 * but evicted state is no longer reachable through {@link StateStore#root(Class, Supplier)}.
 * <p>
 * {@link StateHandle} is thread-safe. Methods {@link #mutate(Consumer)} and {@link #update(UnaryOperator)} are atomic.
 *
 * @param <T>
 *            type of the stored value
 */
@DraftDocs("example of a render loop")
public class StateHandle<T> {
	private final StateStore store;
	private final StateSlot<T> slot;
	StateHandle(StateStore store, StateSlot<T> slot) {
		this.store = store;
		this.slot = slot;
	}
	public StateKey key() {
		return slot.key;
	}
	/**
	 * Returns the stored value.
	 * Mutable values can be modified in place, but {@link #mutate(Consumer)} is safer when the handle is shared across threads.
	 *
	 * @return current value, which may be {@code null}
	 */
	public T get() {
		return slot.get();
	}
	/**
	 * Reads the value via projection.
	 *
	 * @param <R>
	 *            type of the projection
	 * @param reader
	 *            function that extracts the result from current value
	 * @return value returned by {@code reader}
	 * @throws NullPointerException
	 *             if {@code reader} is {@code null}
	 */
	public <R> R get(Function<? super T, R> reader) {
		Objects.requireNonNull(reader);
		return slot.read(reader);
	}
	/*
	 * This is the way to change state. Rooting again with different initializer does not change anything.
	 */
	/**
	 * Replaces the stored value.
	 *
	 * @param value
	 *            new value, may be {@code null}
	 */
	public void set(T value) {
		slot.set(value);
	}
	/**
	 * Modifies mutable value in place.
	 *
	 * @param mutator
	 *            callback that receives current value
	 * @throws NullPointerException
	 *             if {@code mutator} is {@code null}
	 */
	public void mutate(Consumer<? super T> mutator) {
		Objects.requireNonNull(mutator);
		slot.mutate(mutator);
	}
	/**
	 * Replaces the value with a function of the current value. Useful for immutable values.
	 *
	 * @param operator
	 *            function computing new value from the current one
	 * @return the new value
	 * @throws NullPointerException
	 *             if {@code operator} is {@code null}
	 */
	public T update(UnaryOperator<T> operator) {
		Objects.requireNonNull(operator);
		return slot.update(operator);
	}
	@Override
	public String toString() {
		return "StateHandle[" + slot.key + ", store." + store.label() + "]";
	}
}
