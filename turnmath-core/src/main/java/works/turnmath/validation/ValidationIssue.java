package works.turnmath.validation;

import works.turnmath.exceptions.MalformedTreeException;

import static java.util.Objects.requireNonNull;

public record ValidationIssue(String nodeId, Constraint constraint, String detail) {
	public ValidationIssue {
		requireNonNull(nodeId);
		requireNonNull(constraint);
		requireNonNull(detail);
	}

	public Severity severity() {
		return constraint.severity();
	}

	public MalformedTreeException asException() {
		return new MalformedTreeException(nodeId, constraint, detail);
	}

	@Override
	public String toString() {
		return severity() + " " + constraint + " at \"" + nodeId + "\": " + detail;
	}
}
