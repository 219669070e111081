package works.turnmath.vocabulary;

/**
 * The delimiters drawn around a {@link works.turnmath.MathNodeContent.Bracketed Bracketed} expression.
 */
public enum BracketStyle {
	/** ( ) */
	ROUND,
	/** [ ] */
	SQUARE,
	/** { } */
	CURLY,
	/** ⟨ ⟩ */
	ANGLE,
	/** | | */
	VERTICAL,
	/** ∥ ∥ */
	DOUBLE_VERTICAL,
	/** ⌈ ⌉ */
	CEILING,
	/** ⌊ ⌋ */
	FLOOR,
	/**
	 * Invisible grouping. Only controls precedence and associativity in the tree;
	 * nothing is drawn.
	 */
	NONE,
}
