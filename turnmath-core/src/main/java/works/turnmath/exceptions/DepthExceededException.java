package works.turnmath.exceptions;

import org.jetbrains.annotations.Nullable;

/**
 * The tree is nested more deeply than the configured limit allows.
 * <p>
 * The caller may retry with a higher limit, or reject the input as adversarial.
 */
public final class DepthExceededException extends MathTreeException {
	private final int limit;

	public DepthExceededException(String nodeId, int limit) {
		super(nodeId, "Node \"" + nodeId + "\" is nested deeper than the limit of " + limit);
		this.limit = limit;
	}

	public DepthExceededException(@Nullable String nodeId, int limit, String message, Throwable cause) {
		super(nodeId, message, cause);
		this.limit = limit;
	}

	public int limit() {
		return limit;
	}
}
