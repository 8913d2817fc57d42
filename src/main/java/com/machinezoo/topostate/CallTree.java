// Part of Topostate: https://topostate.machinezoo.com
package com.machinezoo.topostate;

import java.util.*;
import java.util.function.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.stagean.*;
import it.unimi.dsi.fastutil.objects.*;

/*
 * Thread-local stack of scopes that computes CallPosition for code that runs repeatedly along the same path.
 *
 * Every entered scope is a frame. Frame remembers its position and counts how many times each callsite was entered
 * directly under it. The count becomes the discriminator of the child position. Loop iterations and sibling calls
 * of the same callsite thus get distinct positions and the numbering restarts whenever the parent frame is entered again,
 * which makes positions stable across repeated traversals.
 *
 * When no frame is active, entering a scope behaves as if a fresh root frame was active.
 * Top-level scopes then get identical positions in every cycle even if the host never calls root().
 * The price is that two top-level entries of the same callsite within one cycle collide.
 * Hosts that need to tell them apart should wrap the whole traversal in root().
 *
 * Frames live in a deque rather than a linked list of parents, so that we can tolerate closing scopes out of order.
 * That can happen when scopes are closed explicitly rather than via try-with-resources.
 *
 * The stack is deliberately per-thread. Traversals are expected to run single-threaded.
 * Parallel traversal would need a separate root per thread anyway to produce deterministic positions.
 */
/**
 * Thread-local call tree that produces {@link CallPosition} for the currently executing code.
 * Scopes are entered with try-with-resources or via {@link #run(Object, Runnable)} and {@link #supply(Object, Supplier)}.
 *
 * @see CallPosition
 * @see StateStore
 */
@DraftDocs("examples of loops, recursion, and keyed children")
public class CallTree {
	private static class Frame {
		final CallPosition position;
		/*
		 * Most frames are leaves that never have children. Counters are lazily allocated.
		 */
		Object2IntOpenHashMap<Object> counters;
		Frame(CallPosition position) {
			this.position = position;
		}
		int next(Object callsite) {
			if (counters == null)
				counters = new Object2IntOpenHashMap<>();
			/*
			 * Returns the previous count, which is exactly the zero-based index of this entry.
			 */
			return counters.addTo(callsite, 1);
		}
		@Override
		public String toString() {
			return "Frame" + position;
		}
	}
	private static final ThreadLocal<Deque<Frame>> current = ThreadLocal.withInitial(ArrayDeque::new);
	/**
	 * Returns position of the innermost active scope on this thread.
	 * If no scope is active, {@link CallPosition#ROOT} is returned.
	 *
	 * @return current position, never {@code null}
	 */
	public static CallPosition position() {
		Frame top = current.get().peekLast();
		return top != null ? top.position : CallPosition.ROOT;
	}
	/**
	 * Starts new traversal at {@link CallPosition#ROOT} with fresh callsite counters.
	 * Any scopes already active on this thread are shadowed until the returned scope is closed.
	 *
	 * @return scope that restores previous state when closed
	 */
	public static CloseableScope root() {
		return push(new Frame(CallPosition.ROOT));
	}
	public static void root(Runnable body) {
		Objects.requireNonNull(body);
		try (CloseableScope scope = root()) {
			body.run();
		}
	}
	public static <T> T root(Supplier<T> body) {
		Objects.requireNonNull(body);
		try (CloseableScope scope = root()) {
			return body.get();
		}
	}
	/**
	 * Enters nested scope identified by {@code callsite}.
	 * Repeated entries of the same callsite under the same parent scope get consecutive indexes.
	 * <p>
	 * Numbering is tracked only while some scope is active. Without enclosing {@link #root()},
	 * every top-level entry starts from index zero, so repeated top-level entries of the same callsite,
	 * for example loop iterations, share one position and therefore share state rooted there.
	 * Wrap the traversal in {@link #root()} to number them.
	 *
	 * @param callsite
	 *            token identifying the call, which implements {@link Object#equals(Object)} and {@link Object#hashCode()}
	 * @return scope that restores previous position when closed
	 * @throws NullPointerException
	 *             if {@code callsite} is {@code null}
	 */
	public static CloseableScope enter(Object callsite) {
		Objects.requireNonNull(callsite);
		Frame parent = parent();
		return push(new Frame(parent.position.child(callsite, parent.next(callsite))));
	}
	/**
	 * Enters nested scope identified by source location of the caller.
	 *
	 * @return scope that restores previous position when closed
	 * @see CallSite#caller()
	 */
	public static CloseableScope enter() {
		return enter(CallSite.caller());
	}
	/*
	 * Keyed variant. Discriminator is supplied by the caller instead of the counter,
	 * so children keep their positions when siblings are added, removed, or reordered.
	 * Counters of the parent frame are not affected.
	 */
	/**
	 * Enters nested scope identified by {@code callsite} and explicit {@code key}.
	 * Unlike {@link #enter(Object)}, position does not depend on how many times the callsite was entered before.
	 *
	 * @param callsite
	 *            token identifying the call
	 * @param key
	 *            discriminator that distinguishes entries of the same callsite
	 * @return scope that restores previous position when closed
	 */
	public static CloseableScope slot(Object callsite, Object key) {
		Objects.requireNonNull(callsite);
		Objects.requireNonNull(key);
		return push(new Frame(parent().position.child(callsite, new ExplicitKey(key))));
	}
	/*
	 * Wrapped, so that explicit keys never collide with indexes assigned by counters.
	 */
	private static final class ExplicitKey {
		final Object key;
		ExplicitKey(Object key) {
			this.key = key;
		}
		@Override
		public boolean equals(Object obj) {
			return obj instanceof ExplicitKey && key.equals(((ExplicitKey)obj).key);
		}
		@Override
		public int hashCode() {
			return key.hashCode();
		}
		@Override
		public String toString() {
			return "[" + key + "]";
		}
	}
	public static void run(Object callsite, Runnable body) {
		Objects.requireNonNull(body);
		try (CloseableScope scope = enter(callsite)) {
			body.run();
		}
	}
	public static <T> T supply(Object callsite, Supplier<T> body) {
		Objects.requireNonNull(body);
		try (CloseableScope scope = enter(callsite)) {
			return body.get();
		}
	}
	private static Frame parent() {
		Frame top = current.get().peekLast();
		return top != null ? top : new Frame(CallPosition.ROOT);
	}
	private static CloseableScope push(Frame frame) {
		Deque<Frame> stack = current.get();
		stack.addLast(frame);
		return () -> {
			/*
			 * Fast path first. Otherwise tolerate double closing and out-of-order closing.
			 */
			if (stack.peekLast() == frame)
				stack.removeLast();
			else
				stack.removeLastOccurrence(frame);
		};
	}
}
