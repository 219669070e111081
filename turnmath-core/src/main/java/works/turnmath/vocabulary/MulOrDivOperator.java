package works.turnmath.vocabulary;

import static java.util.Objects.requireNonNull;

/**
 * The operator in front of one factor of a
 * {@link works.turnmath.MathNodeContent.Multiplications Multiplications} node.
 * <p>
 * Multiplication and division share a single n-ary node so that
 * <code>a⋅b/c</code> stays flat; each factor records which of the two
 * joins it to its predecessor, and with which symbol.
 */
public sealed interface MulOrDivOperator permits
	MulOrDivOperator.Multiplication,
	MulOrDivOperator.Division,
	MulOrDivOperator.Implicit
{
	static Multiplication times(MulSymbol symbol) {
		return new Multiplication(symbol);
	}

	static Division dividedBy(DivSymbol symbol) {
		return new Division(symbol);
	}

	static MulOrDivOperator none() {
		return Implicit.NONE;
	}

	record Multiplication(MulSymbol symbol) implements MulOrDivOperator {
		public Multiplication {
			requireNonNull(symbol);
		}
	}

	record Division(DivSymbol symbol) implements MulOrDivOperator {
		public Division {
			requireNonNull(symbol);
		}
	}

	/**
	 * No operator; used for the leading factor.
	 */
	enum Implicit implements MulOrDivOperator {
		NONE
	}
}
