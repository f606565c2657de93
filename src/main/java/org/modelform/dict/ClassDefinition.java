package org.modelform.dict;

import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

/** A class definition: a type whose members are flattened into its children, including inherited ones */
public final class ClassDefinition extends Definition {
	private final String thePrefix;
	private final List<String> theChildren;
	private final List<String> theBaseClasses;

	/**
	 * @param path The absolute dotted path of the class
	 * @param prefix The class prefix (model, block, record, ...)
	 * @param description The label text for the class, or null
	 * @param children The paths of the class's members, inherited ones included, in declaration order
	 * @param baseClasses The paths of the classes this class extends
	 */
	public ClassDefinition(String path, String prefix, String description, List<String> children, List<String> baseClasses) {
		super(path, description);
		thePrefix = prefix;
		theChildren = ImmutableList.copyOf(children);
		theBaseClasses = ImmutableList.copyOf(baseClasses);
	}

	@Override
	public DefinitionKind getKind() {
		return DefinitionKind.CLASS_DEFINITION;
	}

	/** @return The class prefix (model, block, record, ...), or null */
	public String getPrefix() {
		return thePrefix;
	}

	@Override
	public List<String> getChildren() {
		return theChildren;
	}

	/** @return The paths of the classes this class extends */
	public List<String> getBaseClasses() {
		return theBaseClasses;
	}

	@Override
	public boolean equals(Object obj) {
		if (!super.equals(obj))
			return false;
		ClassDefinition other = (ClassDefinition) obj;
		return Objects.equals(thePrefix, other.thePrefix) && theChildren.equals(other.theChildren)
			&& theBaseClasses.equals(other.theBaseClasses);
	}

	@Override
	public int hashCode() {
		return super.hashCode();
	}
}
