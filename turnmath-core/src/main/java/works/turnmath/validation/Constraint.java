package works.turnmath.validation;

import static works.turnmath.validation.Severity.ERROR;
import static works.turnmath.validation.Severity.WARNING;

/**
 * Structural rules that the type system doesn't enforce.
 */
public enum Constraint {
	EMPTY_IDENTIFIER_BODY(ERROR, "identifier body must not be empty"),
	VARIABLE_NAME_NOT_IDENTIFIER(ERROR, "variable definition name must be an identifier"),
	FUNCTION_DEFINITION_NOT_CALL(ERROR, "function definition must define a function call"),
	UNIT_FORM_NOT_MULTIPLICATIONS(ERROR, "unit forms must be multiplications"),
	RAGGED_MATRIX(WARNING, "matrix rows should all have the same length"),
	;

	private final Severity severity;
	private final String description;

	Constraint(Severity severity, String description) {
		this.severity = severity;
		this.description = description;
	}

	public Severity severity() {
		return severity;
	}

	public String description() {
		return description;
	}
}
