package works.turnmath;

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * A named symbol such as <code>x</code>, <code>G</code>, <code>∇f</code>, or <code>x₁′</code>.
 * <p>
 * Scripts are full sub-expressions, so <code>x_{i+1}</code> is an identifier
 * whose post-script subscript is an {@link MathNodeContent.Additions Additions} node.
 * <p>
 * Two identifiers are equal when all their components are equal.
 *
 * @param body the base glyph or name. Should not be empty; an empty body is
 *             reported by {@link works.turnmath.validation.NodeConstraints NodeConstraints}.
 * @param preScript scripts drawn before the body, as in isotope notation
 * @param midScript diacritics drawn directly over or under the body
 * @param postScript the usual trailing subscripts and superscripts
 * @param primes number of trailing prime marks
 * @param isFunction whether this names something callable. Only affects spacing.
 */
public record Identifier(
	@NotNull String body,
	@Nullable ScriptGroup preScript,
	@Nullable MidScriptGroup midScript,
	@Nullable ScriptGroup postScript,
	int primes,
	boolean isFunction
) {
	public Identifier {
		requireNonNull(body);
		if (primes < 0) {
			throw new IllegalArgumentException("Identifier can't have a negative number of primes: " + primes);
		}
	}

	public static Identifier simple(String body) {
		return new Identifier(body, null, null, null, 0, false);
	}

	public static Identifier withStringSubscript(String body, String subscript) {
		return simple(body).withPostScript(ScriptGroup.subscript(MathNode.string(subscript)));
	}

	public static Identifier withTextSubscript(String body, String subscript) {
		return simple(body).withPostScript(ScriptGroup.subscript(MathNode.text(subscript)));
	}

	public static Identifier withIdentifierSubscript(String body, Identifier subscript) {
		return simple(body).withPostScript(ScriptGroup.subscript(MathNode.identifier(subscript)));
	}

	public Identifier withPreScript(@Nullable ScriptGroup preScript) {
		return new Identifier(body, preScript, midScript, postScript, primes, isFunction);
	}

	public Identifier withMidScript(@Nullable MidScriptGroup midScript) {
		return new Identifier(body, preScript, midScript, postScript, primes, isFunction);
	}

	public Identifier withPostScript(@Nullable ScriptGroup postScript) {
		return new Identifier(body, preScript, midScript, postScript, primes, isFunction);
	}

	public Identifier withPrimes(int primes) {
		return new Identifier(body, preScript, midScript, postScript, primes, isFunction);
	}

	public Identifier asFunction() {
		return new Identifier(body, preScript, midScript, postScript, primes, true);
	}

	/**
	 * @return every node appearing in this identifier's scripts:
	 * pre-script subscripts and superscripts, then post-script subscripts and superscripts.
	 */
	public List<MathNode> scriptNodes() {
		if (preScript == null && postScript == null) {
			return List.of();
		}
		List<MathNode> result = new ArrayList<>();
		if (preScript != null) {
			result.addAll(preScript.subscripts());
			result.addAll(preScript.superscripts());
		}
		if (postScript != null) {
			result.addAll(postScript.subscripts());
			result.addAll(postScript.superscripts());
		}
		return List.copyOf(result);
	}

	@Override
	public String toString() {
		return body;
	}
}
