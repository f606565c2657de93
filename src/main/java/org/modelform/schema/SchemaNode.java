package org.modelform.schema;

import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

/** One entry of a {@link FormSchema}: an instance with its type, value, enablement and label */
public final class SchemaNode {
	private final String thePath;
	private final String theType;
	private final Object theValue;
	private final Object theEnable;
	private final String theDescription;
	private final List<SchemaNode> theChildNodes;

	/**
	 * @param path The instance path of the node
	 * @param type The name of the node's type: a primitive name or a class path
	 * @param value The resolved value of the node, or null if it has none
	 * @param enable Whether the node is enabled, as a {@link Boolean} if evaluated or as expression text if left to the consumer
	 * @param description The label text of the node, or null
	 * @param childNodes The nodes of the instance's members
	 */
	public SchemaNode(String path, String type, Object value, Object enable, String description, List<SchemaNode> childNodes) {
		thePath = path;
		theType = type;
		theValue = value;
		theEnable = Objects.requireNonNull(enable, "enable");
		theDescription = description;
		theChildNodes = ImmutableList.copyOf(childNodes);
	}

	public String getPath() {
		return thePath;
	}

	public String getType() {
		return theType;
	}

	/** @return The resolved value of the node, or null if it has none */
	public Object getValue() {
		return theValue;
	}

	/** @return Whether the node is enabled, as a {@link Boolean} if evaluated or as expression text if left to the consumer */
	public Object getEnable() {
		return theEnable;
	}

	/** @return Whether the node's enablement was evaluated and is true */
	public boolean isEnabled() {
		return Boolean.TRUE.equals(theEnable);
	}

	public String getDescription() {
		return theDescription;
	}

	public List<SchemaNode> getChildNodes() {
		return theChildNodes;
	}

	@Override
	public int hashCode() {
		return Objects.hash(thePath, theType, theValue, theEnable, theDescription, theChildNodes);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof SchemaNode))
			return false;
		SchemaNode other = (SchemaNode) obj;
		return thePath.equals(other.thePath) && theType.equals(other.theType) && Objects.equals(theValue, other.theValue)
			&& theEnable.equals(other.theEnable) && Objects.equals(theDescription, other.theDescription)
			&& theChildNodes.equals(other.theChildNodes);
	}

	@Override
	public String toString() {
		StringBuilder str = new StringBuilder(thePath).append(": ").append(theType);
		if (theValue != null)
			str.append('=').append(theValue);
		if (!Boolean.TRUE.equals(theEnable))
			str.append(" enable=").append(theEnable);
		if (!theChildNodes.isEmpty())
			str.append(theChildNodes);
		return str.toString();
	}
}
