package works.turnmath.testing;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import works.turnmath.Identifier;
import works.turnmath.MathNode;
import works.turnmath.MathNodeContent;
import works.turnmath.MathNodeContent.Abs;
import works.turnmath.MathNodeContent.Additions;
import works.turnmath.MathNodeContent.And;
import works.turnmath.MathNodeContent.Bracketed;
import works.turnmath.MathNodeContent.Differential;
import works.turnmath.MathNodeContent.Division;
import works.turnmath.MathNodeContent.Fraction;
import works.turnmath.MathNodeContent.FunctionCall;
import works.turnmath.MathNodeContent.FunctionDefinition;
import works.turnmath.MathNodeContent.Integration;
import works.turnmath.MathNodeContent.Integration.IntegralDifferential;
import works.turnmath.MathNodeContent.Limit;
import works.turnmath.MathNodeContent.Matrix;
import works.turnmath.MathNodeContent.Multiplications;
import works.turnmath.MathNodeContent.Not;
import works.turnmath.MathNodeContent.Or;
import works.turnmath.MathNodeContent.Power;
import works.turnmath.MathNodeContent.ProductNotation;
import works.turnmath.MathNodeContent.QuantifiedExpression;
import works.turnmath.MathNodeContent.Quantity;
import works.turnmath.MathNodeContent.Relationship;
import works.turnmath.MathNodeContent.ScientificNotation;
import works.turnmath.MathNodeContent.SumNotation;
import works.turnmath.MathNodeContent.UnaryPostfixOperation;
import works.turnmath.MathNodeContent.UnaryPrefixOperation;
import works.turnmath.MathNodeContent.UnaryRelationship;
import works.turnmath.MathNodeContent.Unit;
import works.turnmath.MathNodeContent.Unknown;
import works.turnmath.MathNodeContent.VariableDefinition;
import works.turnmath.MidScriptGroup;
import works.turnmath.MidScriptMark;
import works.turnmath.ScriptGroup;
import works.turnmath.vocabulary.AddOrSubOperator;
import works.turnmath.vocabulary.BracketSize;
import works.turnmath.vocabulary.BracketStyle;
import works.turnmath.vocabulary.DifferentialStyle;
import works.turnmath.vocabulary.DivSymbol;
import works.turnmath.vocabulary.DivisionStyle;
import works.turnmath.vocabulary.MulOrDivOperator;
import works.turnmath.vocabulary.MulSymbol;
import works.turnmath.vocabulary.QuantifierKind;
import works.turnmath.vocabulary.RelationOperator;
import works.turnmath.vocabulary.ScientificNotationStyle;
import works.turnmath.vocabulary.UnaryRelationOperator;

/**
 * Well-formed example trees, with at least one instance of every
 * {@link MathNodeContent} variant, for exercising serializers.
 * <p>
 * Ids are assigned from the notation each node stands for, which is
 * the way real producers tend to do it, so they are not unique.
 */
public final class SampleTrees {
	private SampleTrees() { }

	public static MathNode x() {
		return MathNode.identifier("x");
	}

	public static MathNode y() {
		return MathNode.identifier("y");
	}

	public static MathNode n() {
		return MathNode.identifier("n");
	}

	public static MathNode number(String digits) {
		return new MathNode(digits, new Quantity(digits, null, null));
	}

	/**
	 * <code>(x)</code>
	 */
	public static MathNode roundBracketedX() {
		return new MathNode("(x)", new Bracketed(x(), BracketStyle.ROUND, BracketSize.NORMAL));
	}

	/**
	 * <code>a - b</code>, whose first term has no operator
	 */
	public static MathNode aMinusB() {
		return new MathNode("a-b", new Additions(List.of(
			new Additions.Term(AddOrSubOperator.NONE, MathNode.identifier("a")),
			new Additions.Term(AddOrSubOperator.SUBTRACTION, MathNode.identifier("b")))));
	}

	/**
	 * <code>x = y</code>
	 */
	public static MathNode xEqualsY() {
		return new MathNode("x=y", new Relationship(x(), y(), RelationOperator.Standard.EQUAL));
	}

	/**
	 * <code>kg⋅m/s²</code> as a unit
	 */
	public static MathNode metersPerSecondSquaredKilograms() {
		MathNode secondsSquared = new MathNode("s^2", new Power(MathNode.identifier("s"), number("2")));
		MathNode form = new MathNode("kg*m/s^2", new Multiplications(List.of(
			new Multiplications.Term(MulOrDivOperator.none(), MathNode.identifier("kg")),
			new Multiplications.Term(MulOrDivOperator.times(MulSymbol.DOT), MathNode.identifier("m")),
			new Multiplications.Term(MulOrDivOperator.dividedBy(DivSymbol.SLASH), secondsSquared))));
		return new MathNode("N", new Unit(form, form));
	}

	/**
	 * <code>f(x) := x²</code>
	 */
	public static MathNode functionDefinition() {
		MathNode f = MathNode.identifier(Identifier.simple("f").asFunction());
		MathNode call = new MathNode("f(x)", new FunctionCall(f, List.of(x())));
		MathNode square = new MathNode("x^2", new Power(x(), number("2")));
		return new MathNode("f(x):=x^2", new FunctionDefinition(call, square));
	}

	/**
	 * An identifier that uses every part: <code>²x̂ᵢ''</code> with a dot underneath.
	 */
	public static MathNode decoratedIdentifier() {
		Identifier identifier = Identifier.simple("x")
			.withPreScript(ScriptGroup.superscript(number("2")))
			.withMidScript(new MidScriptGroup(List.of(MidScriptMark.HAT), List.of(MidScriptMark.dots(1))))
			.withPostScript(new ScriptGroup(List.of(MathNode.identifier("i")), List.of(MathNode.text("max"))))
			.withPrimes(2);
		return MathNode.identifier(identifier);
	}

	/**
	 * One well-formed instance of each variant, keyed by a descriptive name.
	 * Iteration order is stable.
	 */
	public static Map<String, MathNode> oneOfEach() {
		Map<String, MathNode> result = new LinkedHashMap<>();
		result.put("empty", MathNode.empty());
		result.put("text", MathNode.text("for all"));
		result.put("string", MathNode.string("NaN"));
		result.put("bracketed", roundBracketedX());
		result.put("bracketedSized", new MathNode("[x]", new Bracketed(x(), BracketStyle.SQUARE, BracketSize.sized(2))));
		result.put("matrix", new MathNode("I", new Matrix(List.of(
			List.of(number("1"), number("0")),
			List.of(number("0"), number("1"))))));
		result.put("multiplications", new MathNode("2x", new Multiplications(List.of(
			new Multiplications.Term(MulOrDivOperator.none(), number("2")),
			new Multiplications.Term(MulOrDivOperator.none(), x())))));
		result.put("additions", aMinusB());
		result.put("division", new MathNode("x/y", new Division(x(), y(), DivisionStyle.INLINE)));
		result.put("divisionAsFraction", new MathNode("x/y", new Division(x(), y(), DivisionStyle.FRACTION)));
		result.put("fraction", new MathNode("x/y", new Fraction(x(), y())));
		result.put("sumNotation", new MathNode("sum", new SumNotation(
			MathNode.identifier(Identifier.withIdentifierSubscript("x", Identifier.simple("n"))),
			n(), number("1"), MathNode.identifier("N"))));
		result.put("productNotation", new MathNode("prod", new ProductNotation(n(), null, null, null)));
		result.put("power", new MathNode("x^2", new Power(x(), number("2"))));
		result.put("unaryPrefixOperation", new MathNode("-x", new UnaryPrefixOperation(x(), MathNode.string("-"))));
		result.put("unaryPostfixOperation", new MathNode("n!", new UnaryPostfixOperation(n(), MathNode.string("!"))));
		result.put("abs", new MathNode("|x|", new Abs(x())));
		result.put("functionCall", new MathNode("max(x,y)", new FunctionCall(
			MathNode.identifier(Identifier.simple("max").asFunction()), List.of(x(), y()))));
		result.put("quantity", new MathNode("9.81N", new Quantity("9.81", null, metersPerSecondSquaredKilograms())));
		result.put("quantityWithScientificNotation", new MathNode("6.02e23", new Quantity("6.02",
			new MathNode("e23", new ScientificNotation(number("23"), ScientificNotationStyle.LOWER_CASE_E)),
			null)));
		result.put("scientificNotation", new MathNode("x10^3", new ScientificNotation(number("3"), ScientificNotationStyle.TIMES_TEN_POWER)));
		result.put("identifier", x());
		result.put("decoratedIdentifier", decoratedIdentifier());
		result.put("unit", metersPerSecondSquaredKilograms());
		result.put("relationship", xEqualsY());
		result.put("customRelationship", new MathNode("x~y", new Relationship(x(), y(), RelationOperator.custom("≍"))));
		result.put("unaryRelationship", new MathNode("p prime", new UnaryRelationship(
			MathNode.identifier("p"), UnaryRelationOperator.Standard.IS_PRIME)));
		result.put("customUnaryRelationship", new MathNode("G simple", new UnaryRelationship(
			MathNode.identifier("G"), UnaryRelationOperator.custom("is simple"))));
		result.put("variableDefinition", new MathNode("x:=2", new VariableDefinition(x(), number("2"))));
		result.put("variableDeclaration", new MathNode("x", new VariableDefinition(x(), null)));
		result.put("functionDefinition", functionDefinition());
		result.put("limit", new MathNode("lim", new Limit(
			new MathNode("1/n", new Fraction(number("1"), n())), "n", MathNode.string("∞"))));
		result.put("differential", new MathNode("dx", new Differential(x(), number("1"), DifferentialStyle.TOTAL)));
		result.put("integration", new MathNode("int", new Integration(
			new MathNode("xy", new Multiplications(List.of(
				new Multiplications.Term(MulOrDivOperator.none(), x()),
				new Multiplications.Term(MulOrDivOperator.none(), y())))),
			List.of(
				new IntegralDifferential(
					new MathNode("dx", new Differential(x(), number("1"), DifferentialStyle.TOTAL)),
					number("0"), number("1")),
				new IntegralDifferential(
					new MathNode("dy", new Differential(y(), number("1"), DifferentialStyle.TOTAL)),
					null, null)),
			MathNode.identifier("D"))));
		result.put("quantifiedExpression", new MathNode("forall", new QuantifiedExpression(
			QuantifierKind.UNIVERSAL,
			List.of(x()),
			MathNode.identifier("S"),
			new MathNode("x>0", new Relationship(x(), number("0"), RelationOperator.Standard.GREATER)))));
		result.put("and", new MathNode("T&F", new And(List.of(
			new MathNode("T", MathNodeContent.TRUE),
			new MathNode("F", MathNodeContent.FALSE)))));
		result.put("or", new MathNode("a|b", new Or(List.of(MathNode.identifier("a"), MathNode.identifier("b")))));
		result.put("not", new MathNode("!a", new Not(MathNode.identifier("a"))));
		result.put("true", new MathNode("T", MathNodeContent.TRUE));
		result.put("false", new MathNode("F", MathNodeContent.FALSE));
		return result;
	}

	/**
	 * A variant this version doesn't know, as a newer producer might write it.
	 */
	public static MathNode unknownVariant() {
		return new MathNode("h", new Unknown("hologram", "{\"type\":\"hologram\",\"id\":\"h\",\"glow\":3}"));
	}

	/**
	 * Additions nested {@code depth} levels deep along the right-hand side,
	 * like <code>a + (a + (a + ...))</code>.
	 */
	public static MathNode rightNestedSum(int depth) {
		MathNode result = MathNode.identifier("a");
		for (int i = 1; i < depth; i++) {
			result = new MathNode("s" + i, new Additions(List.of(
				new Additions.Term(AddOrSubOperator.NONE, MathNode.identifier("a")),
				new Additions.Term(AddOrSubOperator.ADDITION, result))));
		}
		return result;
	}

	/**
	 * <code>[[a, b], [c]]</code>
	 */
	public static MathNode raggedMatrix() {
		return new MathNode("M", new Matrix(List.of(
			List.of(MathNode.identifier("a"), MathNode.identifier("b")),
			List.of(MathNode.identifier("c")))));
	}

	/**
	 * A variable definition whose name is a quantity rather than an identifier.
	 */
	public static MathNode malformedVariableDefinition() {
		return new MathNode("bad-def", new VariableDefinition(number("3.14"), null));
	}

	/**
	 * Every sample from {@link #oneOfEach()} in a single list, in order.
	 */
	public static List<MathNode> all() {
		return new ArrayList<>(oneOfEach().values());
	}
}
