package works.turnmath.vocabulary;

public enum MulSymbol {
	/** × between numbers */
	TIMES,
	/** ⋅ between symbols */
	DOT,
	/** Thin space, typically before a bracketed factor */
	LITTLE_SPACE,
}
