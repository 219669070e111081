package works.turnmath.interchange;

import works.turnmath.exceptions.MathTreeException;

import static java.util.Objects.requireNonNull;

/**
 * The outcome of serializing one tree: either its interchange value,
 * or the error that prevented serialization. Never a partial value.
 *
 * @param <V> the interchange value type
 */
public sealed interface SerializationResult<V> permits SerializationResult.Success, SerializationResult.Failure {
	/**
	 * @return the {@link works.turnmath.MathNode#id() id} of the root of the tree
	 */
	String rootId();

	boolean isSuccess();

	/**
	 * @throws MathTreeException if this is a {@link Failure}
	 */
	V valueOrThrow();

	record Success<V>(String rootId, V value) implements SerializationResult<V> {
		public Success {
			requireNonNull(rootId);
			requireNonNull(value);
		}

		@Override public boolean isSuccess() { return true; }
		@Override public V valueOrThrow() { return value; }
	}

	record Failure<V>(String rootId, MathTreeException error) implements SerializationResult<V> {
		public Failure {
			requireNonNull(rootId);
			requireNonNull(error);
		}

		@Override public boolean isSuccess() { return false; }
		@Override public V valueOrThrow() { throw error; }
	}
}
