package works.turnmath.vocabulary;

public enum DivisionStyle {
	/** Stacked numerator over denominator */
	FRACTION,
	/** a/b */
	INLINE,
	/** a÷b */
	DIVISION,
}
