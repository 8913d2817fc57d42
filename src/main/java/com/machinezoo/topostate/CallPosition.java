// Part of Topostate: https://topostate.machinezoo.com
package com.machinezoo.topostate;

import java.util.*;
import com.machinezoo.stagean.*;

/*
 * Position is a path from the root of the call tree. Every component of the path consists of callsite token
 * and discriminator that tells apart repeated entries of the same callsite under one parent.
 * Discriminator is either a counter assigned by CallTree or a key supplied by the caller.
 *
 * We keep the whole chain instead of hashing it into a single number. Hash collisions would silently merge state
 * of unrelated positions and that kind of bug is nearly impossible to track down.
 * Equality is then structural and it costs a walk up the chain, which is cheap for realistic nesting depths.
 * Hash is computed once in the constructor, so map lookups stay fast.
 */
/**
 * Immutable identity of a position in the call tree.
 * Positions compare equal if they were produced by the same sequence of scopes entered from the root.
 *
 * @see CallTree
 */
@StubDocs
public final class CallPosition {
	/**
	 * Empty path. This is the position outside of any scope.
	 */
	public static final CallPosition ROOT = new CallPosition();
	private final CallPosition parent;
	private final Object callsite;
	private final Object discriminator;
	private final int depth;
	private final int hashCode;
	private CallPosition() {
		parent = null;
		callsite = null;
		discriminator = null;
		depth = 0;
		hashCode = 0;
	}
	private CallPosition(CallPosition parent, Object callsite, Object discriminator) {
		this.parent = parent;
		this.callsite = callsite;
		this.discriminator = discriminator;
		depth = parent.depth + 1;
		hashCode = 31 * (31 * parent.hashCode + callsite.hashCode()) + discriminator.hashCode();
	}
	public CallPosition child(Object callsite, Object discriminator) {
		Objects.requireNonNull(callsite);
		Objects.requireNonNull(discriminator);
		return new CallPosition(this, callsite, discriminator);
	}
	/*
	 * Null for root.
	 */
	public CallPosition parent() {
		return parent;
	}
	public Object callsite() {
		return callsite;
	}
	public Object discriminator() {
		return discriminator;
	}
	public int depth() {
		return depth;
	}
	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof CallPosition))
			return false;
		CallPosition other = (CallPosition)obj;
		if (hashCode != other.hashCode || depth != other.depth)
			return false;
		/*
		 * Iterate instead of recursing. Deeply recursive application code would otherwise overflow the stack here.
		 */
		for (CallPosition a = this, b = other; a != b; a = a.parent, b = b.parent) {
			if (!a.callsite.equals(b.callsite) || !a.discriminator.equals(b.discriminator))
				return false;
		}
		return true;
	}
	@Override
	public int hashCode() {
		return hashCode;
	}
	@Override
	public String toString() {
		if (parent == null)
			return "/";
		Deque<CallPosition> path = new ArrayDeque<>();
		for (CallPosition position = this; position.parent != null; position = position.parent)
			path.addFirst(position);
		StringBuilder builder = new StringBuilder();
		for (CallPosition position : path)
			builder.append('/').append(position.callsite).append('#').append(position.discriminator);
		return builder.toString();
	}
}
