// Part of Topostate: https://topostate.machinezoo.com
package com.machinezoo.topostate;

/*
 * Stores don't talk to CallTree directly. Applications with their own notion of "where we are"
 * (for example a UI framework that already tracks component paths) can plug it in here.
 */
/**
 * Supplier of the current {@link CallPosition}.
 * Default implementation is {@link CallTree#position()}.
 *
 * @see StateStore#StateStore(PositionSource)
 */
@FunctionalInterface
public interface PositionSource {
	/**
	 * Returns identity of the current position.
	 * Repeated traversals of the same path must return equal positions.
	 *
	 * @return current position, never {@code null}
	 */
	CallPosition position();
}
