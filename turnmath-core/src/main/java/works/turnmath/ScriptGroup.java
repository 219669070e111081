package works.turnmath;

import java.util.List;

/**
 * Subscripts and superscripts attached to one side of an {@link Identifier}.
 * Each entry is a complete expression.
 */
public record ScriptGroup(List<MathNode> subscripts, List<MathNode> superscripts) {
	public ScriptGroup {
		subscripts = List.copyOf(subscripts);
		superscripts = List.copyOf(superscripts);
	}

	public static ScriptGroup subscript(MathNode subscript) {
		return new ScriptGroup(List.of(subscript), List.of());
	}

	public static ScriptGroup superscript(MathNode superscript) {
		return new ScriptGroup(List.of(), List.of(superscript));
	}

	public boolean isEmpty() {
		return subscripts.isEmpty() && superscripts.isEmpty();
	}
}
