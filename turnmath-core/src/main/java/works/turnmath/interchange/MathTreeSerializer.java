package works.turnmath.interchange;

import java.util.List;
import works.turnmath.MathNode;
import works.turnmath.exceptions.MathTreeException;

import static java.util.Objects.requireNonNull;

/**
 * Converts expression trees to and from an interchange representation
 * using the format defined by {@link WireTags}.
 * <p>
 * Serialization is deterministic: the same tree always produces an equal value.
 * It proceeds depth-first, writing each node's {@code "type"} tag before any of its children.
 * Implementations must be stateless, or at least thread-safe, so that independent
 * trees can be serialized concurrently.
 *
 * @param <V> the interchange value type
 */
public interface MathTreeSerializer<V> {
	/**
	 * @throws works.turnmath.exceptions.MalformedTreeException if a node violates a constraint
	 * @throws works.turnmath.exceptions.UnmappedVariantException if a vocabulary case has no mapping
	 * @throws works.turnmath.exceptions.DepthExceededException if the tree is too deep
	 */
	V serialize(MathNode node);

	/**
	 * Inverse of {@link #serialize}: for every well-formed tree <code>t</code>,
	 * <code>deserialize(serialize(t)).equals(t)</code>.
	 *
	 * @throws works.turnmath.exceptions.InterchangeFormatException if {@code value} doesn't describe a tree
	 * @throws works.turnmath.exceptions.DepthExceededException if the tree is too deep
	 */
	MathNode deserialize(V value);

	/**
	 * Like {@link #serialize}, but returns errors as a value instead of throwing them.
	 */
	default SerializationResult<V> trySerialize(MathNode node) {
		requireNonNull(node);
		try {
			return new SerializationResult.Success<>(node.id(), serialize(node));
		} catch (MathTreeException e) {
			return new SerializationResult.Failure<>(node.id(), e);
		}
	}

	/**
	 * Serializes each tree independently. A failure affects only the tree that caused it;
	 * the rest are still serialized.
	 *
	 * @return one result per input tree, in the same order
	 * @throws NullPointerException if {@code nodes} contains null, before any tree is serialized
	 */
	default List<SerializationResult<V>> serializeAll(List<MathNode> nodes) {
		return Batches.serializeAll(this, nodes);
	}
}
