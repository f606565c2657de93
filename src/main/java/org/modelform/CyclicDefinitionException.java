package org.modelform;

import java.util.List;

import com.google.common.collect.ImmutableList;

/** Thrown when the composition of class definitions contains itself */
public class CyclicDefinitionException extends ModelLoadException {
	private final List<String> theCycle;

	/** @param cycle The definition paths making up the cycle, the first and last being the same */
	public CyclicDefinitionException(List<String> cycle) {
		super(ErrorKind.CYCLIC_DEFINITION, cycle.get(0), "Definition composition is cyclic: " + String.join(" -> ", cycle));
		theCycle = ImmutableList.copyOf(cycle);
	}

	/** @return The definition paths making up the cycle, the first and last being the same */
	public List<String> getCycle() {
		return theCycle;
	}
}
