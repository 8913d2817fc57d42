// Part of Topostate: https://topostate.machinezoo.com
/*
 * Conventions followed by all classes in this package:
 * - Null check is performed on method parameters where appropriate. Stored values may be null.
 * - Exceptions from application callbacks (initializers, readers, mutators) propagate to the caller.
 *   The only exception are eviction listeners, which run after sweep and have their exceptions logged.
 * - Stores and handles define toString() that identifies the store they belong to.
 * - Metrics and tracing spans are produced only by sweep. Rooting and handle access are hot paths and stay uninstrumented.
 */
/**
 * State that is rooted at a position in the call tree and reclaimed when the position stops being visited.
 * Start with {@link com.machinezoo.topostate.StateStore} and {@link com.machinezoo.topostate.CallTree}.
 */
package com.machinezoo.topostate;
