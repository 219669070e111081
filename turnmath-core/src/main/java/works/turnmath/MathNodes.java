package works.turnmath;

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import works.turnmath.MathNodeContent.Additions;
import works.turnmath.MathNodeContent.Bracketed;
import works.turnmath.MathNodeContent.FunctionCall;
import works.turnmath.MathNodeContent.FunctionDefinition;
import works.turnmath.MathNodeContent.Multiplications;
import works.turnmath.MathNodeContent.Quantity;
import works.turnmath.MathNodeContent.Relationship;
import works.turnmath.MathNodeContent.Unit;
import works.turnmath.MathNodeContent.VariableDefinition;
import works.turnmath.validation.NodeConstraints;
import works.turnmath.validation.ValidationIssue;
import works.turnmath.vocabulary.AddOrSubOperator;
import works.turnmath.vocabulary.BracketSize;
import works.turnmath.vocabulary.BracketStyle;
import works.turnmath.vocabulary.MulOrDivOperator;
import works.turnmath.vocabulary.RelationOperator;

/**
 * Convenience constructors for common node shapes.
 * <p>
 * The ones for variants with structural constraints
 * ({@link #variableDefinition}, {@link #functionDefinition}, {@link #unit})
 * check them immediately and throw
 * {@link works.turnmath.exceptions.MalformedTreeException MalformedTreeException}
 * rather than building a malformed node.
 */
public final class MathNodes {
	private MathNodes() { }

	public static MathNode variableDefinition(String id, MathNode name, @Nullable MathNode definition) {
		return checked(new MathNode(id, new VariableDefinition(name, definition)));
	}

	public static MathNode functionDefinition(String id, MathNode customFunction, @Nullable MathNode definition) {
		return checked(new MathNode(id, new FunctionDefinition(customFunction, definition)));
	}

	public static MathNode unit(String id, MathNode originalForm, MathNode flattenedForm) {
		return checked(new MathNode(id, new Unit(originalForm, flattenedForm)));
	}

	public static MathNode functionCall(String id, MathNode name, MathNode... parameters) {
		return new MathNode(id, new FunctionCall(name, List.of(parameters)));
	}

	public static MathNode bracketed(String id, MathNode inner, BracketStyle style, BracketSize size) {
		return new MathNode(id, new Bracketed(inner, style, size));
	}

	public static MathNode relationship(String id, MathNode lhs, RelationOperator operator, MathNode rhs) {
		return new MathNode(id, new Relationship(lhs, rhs, operator));
	}

	public static MathNode quantity(String id, String number) {
		return new MathNode(id, new Quantity(number, null, null));
	}

	/**
	 * @return the sum of the given terms, the first with no operator and the rest added
	 */
	public static MathNode sum(String id, MathNode first, MathNode... rest) {
		var terms = new ArrayList<Additions.Term>(1 + rest.length);
		terms.add(new Additions.Term(AddOrSubOperator.NONE, first));
		for (MathNode term : rest) {
			terms.add(new Additions.Term(AddOrSubOperator.ADDITION, term));
		}
		return new MathNode(id, new Additions(terms));
	}

	/**
	 * @return the product of the given factors, the first with no operator
	 * and the rest joined by {@code operator}
	 */
	public static MathNode product(String id, MulOrDivOperator operator, MathNode first, MathNode... rest) {
		var terms = new ArrayList<Multiplications.Term>(1 + rest.length);
		terms.add(new Multiplications.Term(MulOrDivOperator.none(), first));
		for (MathNode factor : rest) {
			terms.add(new Multiplications.Term(operator, factor));
		}
		return new MathNode(id, new Multiplications(terms));
	}

	private static MathNode checked(MathNode node) {
		List<ValidationIssue> issues = NodeConstraints.check(node);
		if (!issues.isEmpty()) {
			throw issues.get(0).asException();
		}
		return node;
	}
}
