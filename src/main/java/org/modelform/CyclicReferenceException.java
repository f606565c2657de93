package org.modelform;

import java.util.List;

import com.google.common.collect.ImmutableList;

/** Thrown when the value of an instance path depends on itself */
public class CyclicReferenceException extends ModelEvaluationException {
	private final List<String> theCycle;

	/** @param cycle The instance paths making up the dependency cycle, the first and last being the same */
	public CyclicReferenceException(List<String> cycle) {
		super(ErrorKind.CYCLIC_REFERENCE, cycle.get(0), "Value depends on itself: " + String.join(" -> ", cycle));
		theCycle = ImmutableList.copyOf(cycle);
	}

	/** @return The instance paths making up the dependency cycle, the first and last being the same */
	public List<String> getCycle() {
		return theCycle;
	}
}
