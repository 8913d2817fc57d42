// Part of Topostate: https://topostate.machinezoo.com
package com.machinezoo.topostate;

import java.util.*;

/*
 * Source location used as callsite token when the caller doesn't supply one.
 * Line number is part of the identity, so two calls on different lines of one method are different callsites.
 * Two calls on the same line cannot be told apart. Callers have to supply explicit tokens in that case.
 */
/**
 * Source code location of a call into {@link CallTree}.
 */
public final class CallSite {
	private final String className;
	public String className() {
		return className;
	}
	private final String methodName;
	public String methodName() {
		return methodName;
	}
	private final int line;
	public int line() {
		return line;
	}
	public CallSite(String className, String methodName, int line) {
		Objects.requireNonNull(className);
		Objects.requireNonNull(methodName);
		this.className = className;
		this.methodName = methodName;
		this.line = line;
	}
	private static final StackWalker walker = StackWalker.getInstance();
	private static boolean member(String name, Class<?> clazz) {
		return name.equals(clazz.getName()) || name.startsWith(clazz.getName() + "$");
	}
	private static boolean internal(String name) {
		return member(name, CallSite.class) || member(name, CallTree.class) || member(name, StateStore.class);
	}
	/*
	 * Skips frames of this class, CallTree, and StateStore (including their lambdas and nested classes).
	 * Frames of application code in the same package are kept, which matters for tests.
	 */
	public static CallSite caller() {
		return walker.walk(frames -> frames
			.filter(f -> !internal(f.getClassName()))
			.findFirst()
			.map(f -> new CallSite(f.getClassName(), f.getMethodName(), f.getLineNumber()))
			.orElseThrow(() -> new IllegalStateException("No caller frame on the stack.")));
	}
	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof CallSite))
			return false;
		CallSite other = (CallSite)obj;
		return line == other.line && className.equals(other.className) && methodName.equals(other.methodName);
	}
	@Override
	public int hashCode() {
		return Objects.hash(className, methodName, line);
	}
	@Override
	public String toString() {
		return className + "." + methodName + ":" + line;
	}
}
