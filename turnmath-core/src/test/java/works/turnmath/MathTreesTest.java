package works.turnmath;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import works.turnmath.MathNodeContent.Differential;
import works.turnmath.MathNodeContent.Integration;
import works.turnmath.MathNodeContent.Integration.IntegralDifferential;
import works.turnmath.MathNodeContent.Not;
import works.turnmath.MathNodeContent.Power;
import works.turnmath.MathNodeContent.Quantity;
import works.turnmath.MathNodeContent.Relationship;
import works.turnmath.vocabulary.DifferentialStyle;
import works.turnmath.vocabulary.RelationOperator;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;

class MathTreesTest {
	static MathNode number(String digits) {
		return new MathNode(digits, new Quantity(digits, null, null));
	}

	@Test
	void preOrder_parentsFirst() {
		MathNode square = new MathNode("x^2", new Power(MathNode.identifier("x"), number("2")));
		MathNode tree = new MathNode("eq", new Relationship(square, MathNode.identifier("y"), RelationOperator.Standard.EQUAL));
		List<String> ids = new ArrayList<>();
		for (MathNode node : MathTrees.preOrder(tree)) {
			ids.add(node.id());
		}
		assertThat(ids, contains("eq", "x^2", "x", "2", "y"));
		assertEquals(5, MathTrees.size(tree));
		assertEquals(3, MathTrees.depth(tree));
	}

	@Test
	void preOrder_includesIdentifierScripts() {
		Identifier identifier = Identifier.simple("x")
			.withPreScript(ScriptGroup.superscript(number("14")))
			.withPostScript(new ScriptGroup(List.of(MathNode.identifier("i")), List.of(number("2"))));
		List<String> ids = MathTrees.stream(MathNode.identifier(identifier)).map(MathNode::id).toList();
		assertThat(ids, contains("x", "14", "i", "2"));
	}

	@Test
	void preOrder_skipsAbsentOptionals() {
		MathNode dx = new MathNode("dx", new Differential(MathNode.identifier("x"), number("1"), DifferentialStyle.TOTAL));
		MathNode integral = new MathNode("int", new Integration(
			MathNode.identifier("f"),
			List.of(new IntegralDifferential(dx, number("0"), null)),
			null));
		List<String> ids = MathTrees.stream(integral).map(MathNode::id).toList();
		assertThat(ids, contains("int", "f", "dx", "x", "1", "0"));
	}

	@Test
	void sharedSubtree_visitedPerOccurrence() {
		MathNode x = MathNode.identifier("x");
		MathNode tree = new MathNode("x=x", new Relationship(x, x, RelationOperator.Standard.EQUAL));
		assertEquals(3, MathTrees.size(tree));
	}

	@Test
	void leaf_depthOne() {
		assertEquals(1, MathTrees.depth(MathNode.empty()));
		assertEquals(1, MathTrees.size(MathNode.empty()));
	}

	@Test
	void deepTree_noStackOverflow() {
		MathNode tree = MathNode.identifier("p");
		for (int i = 0; i < 200_000; i++) {
			tree = new MathNode("not", new Not(tree));
		}
		assertEquals(200_001, MathTrees.size(tree));
		assertEquals(200_001, MathTrees.depth(tree));
	}
}
