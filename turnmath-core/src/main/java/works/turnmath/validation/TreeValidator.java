package works.turnmath.validation;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.turnmath.MathNode;
import works.turnmath.MathTrees;

/**
 * Checks every node of a tree against {@link NodeConstraints}.
 * <p>
 * Meant to be run before rendering. Unlike serialization, this walks the tree
 * with an explicit stack, so it works on trees of any depth.
 */
public final class TreeValidator {
	private TreeValidator() { }

	public static ValidationReport validate(MathNode root) {
		List<ValidationIssue> issues = new ArrayList<>();
		int nodeCount = 0;
		for (MathNode node : MathTrees.preOrder(root)) {
			issues.addAll(NodeConstraints.check(node));
			++nodeCount;
		}
		ValidationReport report = new ValidationReport(issues);
		if (LOGGER.isDebugEnabled()) {
			LOGGER.debug("Validated \"{}\": {} nodes, {} errors, {} warnings",
				root.id(), nodeCount, report.errors().size(), report.warnings().size());
		}
		return report;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TreeValidator.class);
}
