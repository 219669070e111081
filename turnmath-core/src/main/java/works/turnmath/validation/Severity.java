package works.turnmath.validation;

public enum Severity {
	/**
	 * The tree can't be serialized faithfully.
	 */
	ERROR,

	/**
	 * The tree is representable, but a consumer is likely to render it wrongly.
	 */
	WARNING,
}
