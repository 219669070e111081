package works.turnmath;

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import works.turnmath.vocabulary.AddOrSubOperator;
import works.turnmath.vocabulary.BracketSize;
import works.turnmath.vocabulary.BracketStyle;
import works.turnmath.vocabulary.DifferentialStyle;
import works.turnmath.vocabulary.DivisionStyle;
import works.turnmath.vocabulary.MulOrDivOperator;
import works.turnmath.vocabulary.QuantifierKind;
import works.turnmath.vocabulary.RelationOperator;
import works.turnmath.vocabulary.ScientificNotationStyle;
import works.turnmath.vocabulary.UnaryRelationOperator;

import static java.util.Objects.requireNonNull;

/**
 * The payload of a {@link MathNode}: one case of a closed set of variants.
 * <p>
 * Every variant is an immutable record. Child nodes are held directly
 * (or in unmodifiable lists); optional children are {@code null} when absent.
 * <p>
 * Some variants carry structural requirements that the type system can't express,
 * such as {@link VariableDefinition#name()} having to be an identifier.
 * The records accept any node there, so that trees from external producers
 * can always be represented; violations are reported by
 * {@link works.turnmath.validation.NodeConstraints NodeConstraints}.
 * Use {@link MathNodes} to construct these variants with checking.
 * <p>
 * Operations over all variants should implement {@link Visitor} rather than
 * testing {@code instanceof}, so that a new variant can't be silently missed.
 */
public sealed interface MathNodeContent {
	Empty EMPTY = new Empty();
	True TRUE = new True();
	False FALSE = new False();

	<R> R accept(Visitor<R> visitor);

	/**
	 * @return the direct children of this content, in the order they are serialized.
	 * Nodes inside an {@link Identifier}'s scripts are included.
	 */
	List<MathNode> children();

	interface Visitor<R> {
		R visit(Empty content);
		R visit(Text content);
		R visit(StringLiteral content);
		R visit(Bracketed content);
		R visit(Matrix content);
		R visit(Multiplications content);
		R visit(Additions content);
		R visit(Division content);
		R visit(Fraction content);
		R visit(SumNotation content);
		R visit(ProductNotation content);
		R visit(Power content);
		R visit(UnaryPrefixOperation content);
		R visit(UnaryPostfixOperation content);
		R visit(Abs content);
		R visit(FunctionCall content);
		R visit(Quantity content);
		R visit(ScientificNotation content);
		R visit(IdentifierContent content);
		R visit(Unit content);
		R visit(Relationship content);
		R visit(UnaryRelationship content);
		R visit(VariableDefinition content);
		R visit(FunctionDefinition content);
		R visit(Limit content);
		R visit(Differential content);
		R visit(Integration content);
		R visit(QuantifiedExpression content);
		R visit(And content);
		R visit(Or content);
		R visit(Not content);
		R visit(True content);
		R visit(False content);
		R visit(Unknown content);
	}

	//
	// Literals
	//

	/**
	 * Placeholder for a slot that is structurally required but semantically absent.
	 */
	record Empty() implements MathNodeContent {
		@Override public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
		@Override public List<MathNode> children() { return List.of(); }
	}

	/**
	 * Prose, set in the text font. Not evaluated.
	 */
	record Text(String text) implements MathNodeContent {
		public Text {
			requireNonNull(text);
		}

		@Override public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
		@Override public List<MathNode> children() { return List.of(); }
	}

	/**
	 * An atomic string set in the math font, such as an opaque token.
	 */
	record StringLiteral(String text) implements MathNodeContent {
		public StringLiteral {
			requireNonNull(text);
		}

		@Override public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
		@Override public List<MathNode> children() { return List.of(); }
	}

	//
	// Grouping
	//

	/**
	 * @param style {@link BracketStyle#NONE} is an invisible grouping that only affects tree structure.
	 */
	record Bracketed(MathNode inner, BracketStyle style, BracketSize size) implements MathNodeContent {
		public Bracketed {
			requireNonNull(inner);
			requireNonNull(style);
			requireNonNull(size);
		}

		@Override public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
		@Override public List<MathNode> children() { return List.of(inner); }
	}

	/**
	 * Rows should all have the same length. Ragged rows are representable,
	 * but are reported by validation.
	 */
	record Matrix(List<List<MathNode>> rows) implements MathNodeContent {
		public Matrix {
			rows = rows.stream().map(List::copyOf).toList();
		}

		public boolean isRagged() {
			return rows.stream().mapToInt(List::size).distinct().count() > 1;
		}

		@Override public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }

		@Override
		public List<MathNode> children() {
			return rows.stream().flatMap(List::stream).toList();
		}
	}

	//
	// Arithmetic
	//

	record Multiplications(List<Term> terms) implements MathNodeContent {
		public Multiplications {
			terms = List.copyOf(terms);
		}

		public record Term(MulOrDivOperator operator, MathNode node) {
			public Term {
				requireNonNull(operator);
				requireNonNull(node);
			}
		}

		@Override public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }

		@Override
		public List<MathNode> children() {
			return terms.stream().map(Term::node).toList();
		}
	}

	record Additions(List<Term> terms) implements MathNodeContent {
		public Additions {
			terms = List.copyOf(terms);
		}

		public record Term(AddOrSubOperator operator, MathNode node) {
			public Term {
				requireNonNull(operator);
				requireNonNull(node);
			}
		}

		@Override public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }

		@Override
		public List<MathNode> children() {
			return terms.stream().map(Term::node).toList();
		}
	}

	record Division(MathNode numerator, MathNode denominator, DivisionStyle style) implements MathNodeContent {
		public Division {
			requireNonNull(numerator);
			requireNonNull(denominator);
			requireNonNull(style);
		}

		@Override public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
		@Override public List<MathNode> children() { return List.of(numerator, denominator); }
	}

	/**
	 * Historically distinct from a {@link Division} with {@link DivisionStyle#FRACTION} style,
	 * and kept distinct on the wire.
	 */
	record Fraction(MathNode numerator, MathNode denominator) implements MathNodeContent {
		public Fraction {
			requireNonNull(numerator);
			requireNonNull(denominator);
		}

		@Override public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
		@Override public List<MathNode> children() { return List.of(numerator, denominator); }
	}

	/**
	 * ∑ with optional index variable and limits.
	 */
	record SumNotation(
		MathNode summand,
		@Nullable MathNode variable,
		@Nullable MathNode lowerLimit,
		@Nullable MathNode upperLimit
	) implements MathNodeContent {
		public SumNotation {
			requireNonNull(summand);
		}

		@Override public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
		@Override public List<MathNode> children() { return present(summand, variable, lowerLimit, upperLimit); }
	}

	/**
	 * ∏ with optional index variable and limits.
	 */
	record ProductNotation(
		MathNode multiplicand,
		@Nullable MathNode variable,
		@Nullable MathNode lowerLimit,
		@Nullable MathNode upperLimit
	) implements MathNodeContent {
		public ProductNotation {
			requireNonNull(multiplicand);
		}

		@Override public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
		@Override public List<MathNode> children() { return present(multiplicand, variable, lowerLimit, upperLimit); }
	}

	record Power(MathNode base, MathNode exponent) implements MathNodeContent {
		public Power {
			requireNonNull(base);
			requireNonNull(exponent);
		}

		@Override public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
		@Override public List<MathNode> children() { return List.of(base, exponent); }
	}

	/**
	 * @param operator such as "-", "∇", "∇²"
	 */
	record UnaryPrefixOperation(MathNode parameter, MathNode operator) implements MathNodeContent {
		public UnaryPrefixOperation {
			requireNonNull(parameter);
			requireNonNull(operator);
		}

		@Override public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
		@Override public List<MathNode> children() { return List.of(parameter, operator); }
	}

	/**
	 * @param operator such as "!", "T", "%"
	 */
	record UnaryPostfixOperation(MathNode parameter, MathNode operator) implements MathNodeContent {
		public UnaryPostfixOperation {
			requireNonNull(parameter);
			requireNonNull(operator);
		}

		@Override public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
		@Override public List<MathNode> children() { return List.of(parameter, operator); }
	}

	/**
	 * Drawn as <code>|x|</code>, as opposed to a {@link FunctionCall} named <code>abs</code>.
	 */
	record Abs(MathNode parameter) implements MathNodeContent {
		public Abs {
			requireNonNull(parameter);
		}

		@Override public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
		@Override public List<MathNode> children() { return List.of(parameter); }
	}

	record FunctionCall(MathNode name, List<MathNode> parameters) implements MathNodeContent {
		public FunctionCall {
			requireNonNull(name);
			parameters = List.copyOf(parameters);
		}

		@Override public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }

		@Override
		public List<MathNode> children() {
			List<MathNode> result = new ArrayList<>(1 + parameters.size());
			result.add(name);
			result.addAll(parameters);
			return List.copyOf(result);
		}
	}

	//
	// Quantities and units
	//

	/**
	 * @param number kept as written, never parsed, so that
	 *               arbitrary-precision and symbolic values like "10^100" or "π" survive.
	 */
	record Quantity(
		String number,
		@Nullable MathNode scientificNotation,
		@Nullable MathNode unit
	) implements MathNodeContent {
		public Quantity {
			requireNonNull(number);
		}

		@Override public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
		@Override public List<MathNode> children() { return present(scientificNotation, unit); }
	}

	record ScientificNotation(MathNode magnitude, ScientificNotationStyle style) implements MathNodeContent {
		public ScientificNotation {
			requireNonNull(magnitude);
			requireNonNull(style);
		}

		@Override public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
		@Override public List<MathNode> children() { return List.of(magnitude); }
	}

	/**
	 * Both forms should be {@link Multiplications}.
	 *
	 * @param flattenedForm the fully SI-reduced equivalent of {@code originalForm}.
	 *                      The producer keeps it consistent; nothing here recomputes it.
	 */
	record Unit(MathNode originalForm, MathNode flattenedForm) implements MathNodeContent {
		public Unit {
			requireNonNull(originalForm);
			requireNonNull(flattenedForm);
		}

		@Override public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
		@Override public List<MathNode> children() { return List.of(originalForm, flattenedForm); }
	}

	//
	// Identifiers
	//

	record IdentifierContent(Identifier identifier) implements MathNodeContent {
		public IdentifierContent {
			requireNonNull(identifier);
		}

		@Override public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
		@Override public List<MathNode> children() { return identifier.scriptNodes(); }
	}

	//
	// Relations
	//

	record Relationship(MathNode lhs, MathNode rhs, RelationOperator operator) implements MathNodeContent {
		public Relationship {
			requireNonNull(lhs);
			requireNonNull(rhs);
			requireNonNull(operator);
		}

		@Override public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
		@Override public List<MathNode> children() { return List.of(lhs, rhs); }
	}

	record UnaryRelationship(MathNode subject, UnaryRelationOperator predicate) implements MathNodeContent {
		public UnaryRelationship {
			requireNonNull(subject);
			requireNonNull(predicate);
		}

		@Override public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
		@Override public List<MathNode> children() { return List.of(subject); }
	}

	//
	// Definitions
	//

	/**
	 * @param name must have {@link IdentifierContent}
	 */
	record VariableDefinition(MathNode name, @Nullable MathNode definition) implements MathNodeContent {
		public VariableDefinition {
			requireNonNull(name);
		}

		@Override public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
		@Override public List<MathNode> children() { return present(name, definition); }
	}

	/**
	 * @param customFunction must have {@link FunctionCall} content
	 */
	record FunctionDefinition(MathNode customFunction, @Nullable MathNode definition) implements MathNodeContent {
		public FunctionDefinition {
			requireNonNull(customFunction);
		}

		@Override public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
		@Override public List<MathNode> children() { return present(customFunction, definition); }
	}

	//
	// Calculus
	//

	record Limit(MathNode function, String variable, MathNode approachingValue) implements MathNodeContent {
		public Limit {
			requireNonNull(function);
			requireNonNull(variable);
			requireNonNull(approachingValue);
		}

		@Override public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
		@Override public List<MathNode> children() { return List.of(function, approachingValue); }
	}

	record Differential(MathNode target, MathNode order, DifferentialStyle style) implements MathNodeContent {
		public Differential {
			requireNonNull(target);
			requireNonNull(order);
			requireNonNull(style);
		}

		@Override public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
		@Override public List<MathNode> children() { return List.of(target, order); }
	}

	/**
	 * One integral sign per entry of {@code differentials}, so ∫∫∫ has three.
	 *
	 * @param domain optional region drawn beneath the integral signs
	 */
	record Integration(
		MathNode integrand,
		List<IntegralDifferential> differentials,
		@Nullable MathNode domain
	) implements MathNodeContent {
		public Integration {
			requireNonNull(integrand);
			differentials = List.copyOf(differentials);
		}

		public record IntegralDifferential(
			MathNode differential,
			@Nullable MathNode lowerBound,
			@Nullable MathNode upperBound
		) {
			public IntegralDifferential {
				requireNonNull(differential);
			}
		}

		@Override public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }

		@Override
		public List<MathNode> children() {
			List<MathNode> result = new ArrayList<>();
			result.add(integrand);
			for (IntegralDifferential d : differentials) {
				result.addAll(present(d.differential(), d.lowerBound(), d.upperBound()));
			}
			if (domain != null) {
				result.add(domain);
			}
			return List.copyOf(result);
		}
	}

	//
	// Quantification
	//

	/**
	 * Like "∀ x ∈ S : P(x)".
	 *
	 * @param domain the "∈ S" part
	 * @param predicate the ": P(x)" part
	 */
	record QuantifiedExpression(
		QuantifierKind quantifier,
		List<MathNode> variables,
		@Nullable MathNode domain,
		@Nullable MathNode predicate
	) implements MathNodeContent {
		public QuantifiedExpression {
			requireNonNull(quantifier);
			variables = List.copyOf(variables);
		}

		@Override public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }

		@Override
		public List<MathNode> children() {
			List<MathNode> result = new ArrayList<>(variables);
			result.addAll(present(domain, predicate));
			return List.copyOf(result);
		}
	}

	//
	// Logic
	//

	record And(List<MathNode> operands) implements MathNodeContent {
		public And {
			operands = List.copyOf(operands);
		}

		@Override public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
		@Override public List<MathNode> children() { return operands; }
	}

	record Or(List<MathNode> operands) implements MathNodeContent {
		public Or {
			operands = List.copyOf(operands);
		}

		@Override public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
		@Override public List<MathNode> children() { return operands; }
	}

	record Not(MathNode operand) implements MathNodeContent {
		public Not {
			requireNonNull(operand);
		}

		@Override public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
		@Override public List<MathNode> children() { return List.of(operand); }
	}

	record True() implements MathNodeContent {
		@Override public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
		@Override public List<MathNode> children() { return List.of(); }
	}

	record False() implements MathNodeContent {
		@Override public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
		@Override public List<MathNode> children() { return List.of(); }
	}

	//
	// Forward compatibility
	//

	/**
	 * A variant written by a newer producer that this version doesn't recognize.
	 * It is opaque: it has no children, and its serialized form is re-emitted verbatim.
	 *
	 * @param type the type tag it was serialized with
	 * @param payload the complete serialized object, as JSON text
	 */
	record Unknown(String type, String payload) implements MathNodeContent {
		public Unknown {
			requireNonNull(type);
			requireNonNull(payload);
		}

		@Override public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
		@Override public List<MathNode> children() { return List.of(); }
	}

	private static List<MathNode> present(@Nullable MathNode... nodes) {
		List<MathNode> result = new ArrayList<>(nodes.length);
		for (MathNode node : nodes) {
			if (node != null) {
				result.add(node);
			}
		}
		return List.copyOf(result);
	}
}
