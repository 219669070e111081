package works.turnmath.vocabulary;

/**
 * The sign in front of one term of an {@link works.turnmath.MathNodeContent.Additions Additions} node.
 * The first term conventionally carries {@link #NONE}, but consumers must not rely on that.
 */
public enum AddOrSubOperator {
	ADDITION,
	SUBTRACTION,
	NONE,
}
