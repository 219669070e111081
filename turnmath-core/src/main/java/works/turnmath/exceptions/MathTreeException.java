package works.turnmath.exceptions;

import org.jetbrains.annotations.Nullable;

/**
 * Base of the problems that can arise when checking, serializing, or deserializing
 * an expression tree. Each is scoped to one node, identified by {@link #nodeId()},
 * and leaves sibling subtrees unaffected.
 */
public sealed abstract class MathTreeException extends RuntimeException permits
	MalformedTreeException,
	UnmappedVariantException,
	DepthExceededException,
	InterchangeFormatException
{
	@Nullable
	private final String nodeId;

	protected MathTreeException(@Nullable String nodeId, String message) {
		super(message);
		this.nodeId = nodeId;
	}

	protected MathTreeException(@Nullable String nodeId, String message, Throwable cause) {
		super(message, cause);
		this.nodeId = nodeId;
	}

	/**
	 * @return the {@link works.turnmath.MathNode#id() id} of the offending node,
	 * or null if no node could be identified (for instance, when the interchange
	 * input is too damaged to contain one).
	 */
	@Nullable
	public String nodeId() {
		return nodeId;
	}
}
