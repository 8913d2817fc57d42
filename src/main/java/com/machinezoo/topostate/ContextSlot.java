// Part of Topostate: https://topostate.machinezoo.com
package com.machinezoo.topostate;

import java.util.*;
import java.util.concurrent.atomic.*;
import java.util.function.*;
import com.machinezoo.closeablescope.*;

/*
 * Storage for a context. It has a base value and an explicit stack of overrides.
 * Reads and writes go to the top of the stack, which is the base value when there are no overrides.
 *
 * Override stack lives here rather than in a thread-local, so that overrides are visible to all threads
 * that read the context while the override scope is open. That is consistent with the base value,
 * which is shared by all threads too.
 *
 * Only the base value is subject to sweep. Overrides are scoped and they are gone by the time sweep runs.
 */
class ContextSlot<T> {
	final StateKey key;
	private T base;
	/*
	 * Mutable holder, so that set() can modify the top override and close() can find its own layer by identity.
	 */
	private static class Layer<T> {
		T value;
		Layer(T value) {
			this.value = value;
		}
	}
	private final Deque<Layer<T>> overrides = new ArrayDeque<>();
	private final AtomicBoolean touched = new AtomicBoolean(true);
	ContextSlot(StateKey key, T base) {
		this.key = key;
		this.base = base;
	}
	void touch() {
		if (!touched.get())
			touched.set(true);
	}
	boolean survive() {
		return touched.getAndSet(false);
	}
	synchronized T get() {
		touch();
		Layer<T> top = overrides.peekLast();
		return top != null ? top.value : base;
	}
	synchronized <R> R read(Function<? super T, R> reader) {
		return reader.apply(get());
	}
	synchronized void set(T value) {
		touch();
		Layer<T> top = overrides.peekLast();
		if (top != null)
			top.value = value;
		else
			base = value;
	}
	synchronized CloseableScope push(T value) {
		touch();
		Layer<T> layer = new Layer<>(value);
		overrides.addLast(layer);
		return () -> {
			synchronized (this) {
				/*
				 * Tolerate double closing and out-of-order closing like call tree scopes do.
				 */
				if (overrides.peekLast() == layer)
					overrides.removeLast();
				else
					overrides.removeLastOccurrence(layer);
			}
		};
	}
}
