package works.turnmath.vocabulary;

public enum DifferentialStyle {
	/** ∂ */
	PARTIAL,
	/** d */
	TOTAL,
}
