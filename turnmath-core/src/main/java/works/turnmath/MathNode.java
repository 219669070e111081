package works.turnmath;

import java.util.List;
import org.jetbrains.annotations.NotNull;
import works.turnmath.MathNodeContent.Bracketed;
import works.turnmath.MathNodeContent.IdentifierContent;
import works.turnmath.MathNodeContent.Quantity;
import works.turnmath.MathNodeContent.StringLiteral;
import works.turnmath.MathNodeContent.Text;
import works.turnmath.vocabulary.BracketStyle;

import static java.util.Objects.requireNonNull;

/**
 * One vertex of an expression tree.
 * <p>
 * Nodes are immutable, so a subtree can be shared by several parents
 * (say, a document embedding a copy of a node in a tooltip)
 * and read from any number of threads.
 *
 * @param id key used by renderers to refer to this node.
 *           It need not be unique, but whoever builds the tree
 *           must assign it the same way every time.
 */
public record MathNode(@NotNull String id, @NotNull MathNodeContent content) {
	public MathNode {
		requireNonNull(id);
		requireNonNull(content);
	}

	private static final MathNode EMPTY = new MathNode("", MathNodeContent.EMPTY);

	public static MathNode empty() {
		return EMPTY;
	}

	public static MathNode identifier(Identifier identifier) {
		return new MathNode(identifier.body(), new IdentifierContent(identifier));
	}

	public static MathNode identifier(String body) {
		return identifier(Identifier.simple(body));
	}

	public static MathNode string(String text) {
		return new MathNode(text, new StringLiteral(text));
	}

	public static MathNode text(String text) {
		return new MathNode(text, new Text(text));
	}

	public MathNode withId(String id) {
		return new MathNode(id, content);
	}

	public boolean isQuantity() {
		return content instanceof Quantity;
	}

	public boolean isBracketed() {
		return content instanceof Bracketed;
	}

	public boolean isRoundBracketed() {
		return content instanceof Bracketed b && b.style() == BracketStyle.ROUND;
	}

	/**
	 * @see MathNodeContent#children()
	 */
	public List<MathNode> children() {
		return content.children();
	}
}
