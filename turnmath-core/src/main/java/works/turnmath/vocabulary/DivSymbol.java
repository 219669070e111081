package works.turnmath.vocabulary;

public enum DivSymbol {
	/** / */
	SLASH,
	/** ÷ */
	DIVIDE,
}
