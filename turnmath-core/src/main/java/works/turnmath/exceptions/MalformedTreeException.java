package works.turnmath.exceptions;

import works.turnmath.validation.Constraint;

/**
 * A node violates a structural {@link Constraint}, like a variable definition
 * whose name isn't an identifier.
 * <p>
 * Callers can reject or repair the offending subtree.
 */
public final class MalformedTreeException extends MathTreeException {
	private final Constraint constraint;

	public MalformedTreeException(String nodeId, Constraint constraint, String detail) {
		super(nodeId, fullMessage(nodeId, constraint, detail));
		this.constraint = constraint;
	}

	public Constraint constraint() {
		return constraint;
	}

	private static String fullMessage(String nodeId, Constraint constraint, String detail) {
		return "Malformed node \"" + nodeId + "\" violates " + constraint + ": " + detail;
	}
}
