package works.turnmath.vocabulary;

public enum ScientificNotationStyle {
	/** 1.5e10 */
	LOWER_CASE_E,
	/** 1.5E10 */
	UPPER_CASE_E,
	/** 1.5 × 10¹⁰ */
	TIMES_TEN_POWER,
}
