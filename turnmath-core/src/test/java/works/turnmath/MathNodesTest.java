package works.turnmath;

import java.util.List;
import org.junit.jupiter.api.Test;
import works.turnmath.MathNodeContent.Additions;
import works.turnmath.MathNodeContent.Multiplications;
import works.turnmath.MathNodeContent.VariableDefinition;
import works.turnmath.exceptions.MalformedTreeException;
import works.turnmath.validation.Constraint;
import works.turnmath.vocabulary.AddOrSubOperator;
import works.turnmath.vocabulary.BracketSize;
import works.turnmath.vocabulary.BracketStyle;
import works.turnmath.vocabulary.MulOrDivOperator;
import works.turnmath.vocabulary.MulSymbol;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MathNodesTest {
	static final MathNode X = MathNode.identifier("x");

	@Test
	void variableDefinition_checked() {
		MathNode good = MathNodes.variableDefinition("def", X, MathNodes.quantity("2", "2"));
		assertInstanceOf(VariableDefinition.class, good.content());

		MalformedTreeException e = assertThrows(MalformedTreeException.class,
			() -> MathNodes.variableDefinition("bad", MathNodes.quantity("2", "2"), null));
		assertEquals("bad", e.nodeId());
		assertEquals(Constraint.VARIABLE_NAME_NOT_IDENTIFIER, e.constraint());
	}

	@Test
	void functionDefinition_checked() {
		MathNode call = MathNodes.functionCall("f(x)", MathNode.identifier(Identifier.simple("f").asFunction()), X);
		MathNodes.functionDefinition("def", call, X);

		MalformedTreeException e = assertThrows(MalformedTreeException.class,
			() -> MathNodes.functionDefinition("bad", X, X));
		assertEquals(Constraint.FUNCTION_DEFINITION_NOT_CALL, e.constraint());
	}

	@Test
	void unit_checked() {
		MathNode meters = MathNodes.product("m", MulOrDivOperator.times(MulSymbol.DOT), MathNode.identifier("m"));
		MathNodes.unit("unit", meters, meters);
		assertThrows(MalformedTreeException.class, () -> MathNodes.unit("unit", X, meters));
	}

	@Test
	void sum_leadingTermHasNoOperator() {
		MathNode sum = MathNodes.sum("s", X, MathNode.identifier("y"), MathNode.identifier("z"));
		var terms = ((Additions) sum.content()).terms();
		assertThat(terms.stream().map(Additions.Term::operator).toList(),
			contains(AddOrSubOperator.NONE, AddOrSubOperator.ADDITION, AddOrSubOperator.ADDITION));
	}

	@Test
	void product_leadingFactorHasNoOperator() {
		MathNode product = MathNodes.product("p", MulOrDivOperator.times(MulSymbol.TIMES), X, X);
		var terms = ((Multiplications) product.content()).terms();
		assertEquals(MulOrDivOperator.none(), terms.get(0).operator());
		assertEquals(MulOrDivOperator.times(MulSymbol.TIMES), terms.get(1).operator());
	}

	@Test
	void nodeHelpers() {
		MathNode bracketed = MathNodes.bracketed("(x)", X, BracketStyle.ROUND, BracketSize.AUTO);
		assertTrue(bracketed.isBracketed());
		assertTrue(bracketed.isRoundBracketed());
		assertFalse(MathNodes.bracketed("[x]", X, BracketStyle.SQUARE, BracketSize.NORMAL).isRoundBracketed());
		assertTrue(MathNodes.quantity("q", "1").isQuantity());
		assertFalse(X.isQuantity());
		assertEquals(List.of(X), bracketed.children());
	}

	@Test
	void factories_assignIds() {
		assertEquals("x", X.id());
		assertEquals("hello", MathNode.text("hello").id());
		assertEquals("NaN", MathNode.string("NaN").id());
		assertEquals("", MathNode.empty().id());
		assertEquals("renamed", X.withId("renamed").id());
		assertEquals(X.content(), X.withId("renamed").content());
	}
}
