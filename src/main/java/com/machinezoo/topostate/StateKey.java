// Part of Topostate: https://topostate.machinezoo.com
package com.machinezoo.topostate;

import java.util.*;
import com.google.common.reflect.*;

/*
 * Type is part of the key, so that two pieces of state of different types rooted at the same position never collide.
 * Guava's TypeToken keeps generic parameters, so List<String> and List<Integer> are distinct keys.
 *
 * Contexts are keyed by type alone. Their keys have null position.
 * We could have used CallPosition.ROOT instead, but then context keys reported to eviction listeners
 * would be indistinguishable from keys of state rooted outside of any scope.
 */
/**
 * Identity of a slot in {@link StateStore}, consisting of {@link CallPosition} and value type.
 *
 * @see StateStore#root(TypeToken, java.util.function.Supplier)
 * @see StateStore#createContext(TypeToken, Object)
 */
public final class StateKey {
	private final CallPosition position;
	/**
	 * Returns position part of the key.
	 *
	 * @return position or {@code null} if this is a key of a context
	 */
	public CallPosition position() {
		return position;
	}
	private final TypeToken<?> type;
	public TypeToken<?> type() {
		return type;
	}
	public StateKey(CallPosition position, TypeToken<?> type) {
		Objects.requireNonNull(position);
		Objects.requireNonNull(type);
		this.position = position;
		this.type = type;
	}
	private StateKey(TypeToken<?> type) {
		Objects.requireNonNull(type);
		position = null;
		this.type = type;
	}
	public static StateKey context(TypeToken<?> type) {
		return new StateKey(type);
	}
	public boolean context() {
		return position == null;
	}
	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof StateKey))
			return false;
		StateKey other = (StateKey)obj;
		return Objects.equals(position, other.position) && type.equals(other.type);
	}
	@Override
	public int hashCode() {
		return 31 * Objects.hashCode(position) + type.hashCode();
	}
	@Override
	public String toString() {
		return (position != null ? position.toString() : "context") + ":" + type;
	}
}
