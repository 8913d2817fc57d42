// Part of Topostate: https://topostate.machinezoo.com
/**
 * Topostate keeps state rooted at positions in the call tree of repeatedly executed code
 * and reclaims it when the position stops being visited.
 * <p>
 * Everything is in the main package {@link com.machinezoo.topostate}.
 * Start with {@link com.machinezoo.topostate.StateStore} and {@link com.machinezoo.topostate.CallTree}.
 */
module com.machinezoo.topostate {
	exports com.machinezoo.topostate;
	requires com.machinezoo.stagean;
	/*
	 * Scopes returned by CallTree and ContextHandle are part of the API.
	 */
	requires transitive com.machinezoo.closeablescope;
	/*
	 * TypeToken is part of the API.
	 */
	requires transitive com.google.common;
	requires com.machinezoo.noexception;
	requires org.slf4j;
	requires io.opentracing.api;
	requires io.opentracing.util;
	requires it.unimi.dsi.fastutil;
	requires micrometer.core;
}
