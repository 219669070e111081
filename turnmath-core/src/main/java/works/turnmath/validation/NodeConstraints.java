package works.turnmath.validation;

import java.util.ArrayList;
import java.util.List;
import works.turnmath.MathNode;
import works.turnmath.MathNodeContent.FunctionCall;
import works.turnmath.MathNodeContent.FunctionDefinition;
import works.turnmath.MathNodeContent.IdentifierContent;
import works.turnmath.MathNodeContent.Matrix;
import works.turnmath.MathNodeContent.Multiplications;
import works.turnmath.MathNodeContent.Unit;
import works.turnmath.MathNodeContent.VariableDefinition;

import static works.turnmath.validation.Constraint.EMPTY_IDENTIFIER_BODY;
import static works.turnmath.validation.Constraint.FUNCTION_DEFINITION_NOT_CALL;
import static works.turnmath.validation.Constraint.RAGGED_MATRIX;
import static works.turnmath.validation.Constraint.UNIT_FORM_NOT_MULTIPLICATIONS;
import static works.turnmath.validation.Constraint.VARIABLE_NAME_NOT_IDENTIFIER;

/**
 * Checks the {@link Constraint}s that apply to a single node, without descending into its children.
 * <p>
 * Only a handful of variants have constraints, so this tests for them directly
 * instead of implementing a full {@link works.turnmath.MathNodeContent.Visitor Visitor}.
 *
 * @see TreeValidator
 */
public final class NodeConstraints {
	private NodeConstraints() { }

	public static List<ValidationIssue> check(MathNode node) {
		List<ValidationIssue> issues = new ArrayList<>(0);
		var content = node.content();
		if (content instanceof IdentifierContent c) {
			if (c.identifier().body().isEmpty()) {
				issues.add(new ValidationIssue(node.id(), EMPTY_IDENTIFIER_BODY, "body is empty"));
			}
		} else if (content instanceof VariableDefinition c) {
			if (!(c.name().content() instanceof IdentifierContent)) {
				issues.add(new ValidationIssue(node.id(), VARIABLE_NAME_NOT_IDENTIFIER,
					"name \"" + c.name().id() + "\" is " + kind(c.name())));
			}
		} else if (content instanceof FunctionDefinition c) {
			if (!(c.customFunction().content() instanceof FunctionCall)) {
				issues.add(new ValidationIssue(node.id(), FUNCTION_DEFINITION_NOT_CALL,
					"custom function \"" + c.customFunction().id() + "\" is " + kind(c.customFunction())));
			}
		} else if (content instanceof Unit c) {
			if (!(c.originalForm().content() instanceof Multiplications)) {
				issues.add(new ValidationIssue(node.id(), UNIT_FORM_NOT_MULTIPLICATIONS,
					"original form is " + kind(c.originalForm())));
			}
			if (!(c.flattenedForm().content() instanceof Multiplications)) {
				issues.add(new ValidationIssue(node.id(), UNIT_FORM_NOT_MULTIPLICATIONS,
					"flattened form is " + kind(c.flattenedForm())));
			}
		} else if (content instanceof Matrix c) {
			if (c.isRagged()) {
				issues.add(new ValidationIssue(node.id(), RAGGED_MATRIX,
					"row lengths are " + c.rows().stream().map(List::size).toList()));
			}
		}
		return issues;
	}

	private static String kind(MathNode node) {
		return node.content().getClass().getSimpleName();
	}
}
