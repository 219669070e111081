package works.turnmath.validation;

import java.util.List;

import static works.turnmath.validation.Severity.ERROR;
import static works.turnmath.validation.Severity.WARNING;

/**
 * Every {@link ValidationIssue} found in a tree, in pre-order.
 */
public record ValidationReport(List<ValidationIssue> issues) {
	public ValidationReport {
		issues = List.copyOf(issues);
	}

	public List<ValidationIssue> errors() {
		return issues.stream().filter(i -> i.severity() == ERROR).toList();
	}

	public List<ValidationIssue> warnings() {
		return issues.stream().filter(i -> i.severity() == WARNING).toList();
	}

	/**
	 * @return true if there are no {@link Severity#ERROR errors}. Warnings are allowed.
	 */
	public boolean isValid() {
		return issues.stream().noneMatch(i -> i.severity() == ERROR);
	}

	/**
	 * @throws works.turnmath.exceptions.MalformedTreeException for the first error, if any
	 */
	public void throwIfInvalid() {
		for (ValidationIssue issue : issues) {
			if (issue.severity() == ERROR) {
				throw issue.asException();
			}
		}
	}
}
