package works.turnmath.exceptions;

import org.jetbrains.annotations.Nullable;

/**
 * The interchange input does not describe a valid tree:
 * a member is missing or has the wrong type, or a tag is not recognized.
 */
public final class InterchangeFormatException extends MathTreeException {
	public InterchangeFormatException(@Nullable String nodeId, String message) {
		super(nodeId, message);
	}

	public InterchangeFormatException(@Nullable String nodeId, String message, Throwable cause) {
		super(nodeId, message, cause);
	}
}
