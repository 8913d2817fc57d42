// Part of Topostate: https://topostate.machinezoo.com
package com.machinezoo.topostate;

import java.util.concurrent.atomic.*;
import java.util.function.*;

/*
 * Storage for one rooted value. Store's map points here and so does the handle.
 * Eviction only removes the map entry. Handles obtained earlier keep working on this now detached container.
 *
 * Touched flag is atomic, so that handles can mark the slot without taking the store lock.
 * Slots are born touched, because creation counts as an access.
 *
 * Value access is synchronized on the slot. Store lock is never held while taking slot lock,
 * so callbacks running under slot lock (readers, mutators) are free to root nested state.
 */
class StateSlot<T> {
	final StateKey key;
	private T value;
	private final AtomicBoolean touched = new AtomicBoolean(true);
	private final StateHandle<T> handle;
	StateSlot(StateStore store, StateKey key, T value) {
		this.key = key;
		this.value = value;
		handle = new StateHandle<>(store, this);
	}
	StateHandle<T> handle() {
		return handle;
	}
	void touch() {
		/*
		 * Plain read first. Hot slots are read many times per cycle and unconditional writes would bounce the cache line.
		 */
		if (!touched.get())
			touched.set(true);
	}
	/*
	 * Sweep's evict-or-reset step. Returns true if the slot was touched since last sweep and should be kept.
	 */
	boolean survive() {
		return touched.getAndSet(false);
	}
	synchronized T get() {
		touch();
		return value;
	}
	synchronized <R> R read(Function<? super T, R> reader) {
		touch();
		return reader.apply(value);
	}
	synchronized void set(T value) {
		touch();
		this.value = value;
	}
	synchronized void mutate(Consumer<? super T> mutator) {
		touch();
		mutator.accept(value);
	}
	synchronized T update(UnaryOperator<T> operator) {
		touch();
		value = operator.apply(value);
		return value;
	}
}
