package works.turnmath.vocabulary;

public enum QuantifierKind {
	/** ∀ */
	UNIVERSAL,

	/** ∃ */
	EXISTENTIAL,

	/** ∃! */
	UNIQUE_EXISTENTIAL,

	/** An object defined in terms of others */
	DEFINED,

	/** An arbitrary but fixed object */
	FIXED,
}
