package works.turnmath.jackson;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

import static works.turnmath.jackson.MathSerializerSettings.RaggedMatrixPolicy.WARN;

@Value
@Builder(toBuilder = true)
public class MathSerializerSettings {
	/**
	 * The deepest nesting that {@link JacksonMathSerializer} will process, counting the root as 1.
	 * Deeper trees fail with {@link works.turnmath.exceptions.DepthExceededException DepthExceededException}
	 * instead of risking a {@link StackOverflowError}.
	 * <p>
	 * The default comfortably fits the default thread stack size.
	 * If you raise it a lot, you may need to give the serializing thread a bigger stack.
	 */
	@Default int maxDepth = 1000;

	/**
	 * What to do with a matrix whose rows differ in length.
	 */
	@Default RaggedMatrixPolicy raggedMatrixPolicy = WARN;

	/**
	 * If true, deserializing a node whose {@code "type"} isn't recognized produces
	 * an {@link works.turnmath.MathNodeContent.Unknown Unknown} node that carries it
	 * through unchanged; if false, it's an
	 * {@link works.turnmath.exceptions.InterchangeFormatException InterchangeFormatException}.
	 * <p>
	 * Leave this on if trees might come from a newer producer.
	 */
	@Default boolean preserveUnknownVariants = true;

	public static MathSerializerSettings defaultSettings() {
		return builder().build();
	}

	public enum RaggedMatrixPolicy {
		/**
		 * Log a warning and serialize every row as it is.
		 */
		WARN,

		/**
		 * Fail with {@link works.turnmath.exceptions.MalformedTreeException MalformedTreeException}.
		 */
		REJECT,
	}
}
