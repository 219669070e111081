package works.turnmath.exceptions;

import org.jetbrains.annotations.Nullable;

/**
 * The in-memory model has a case with no interchange mapping.
 * <p>
 * This indicates the vocabulary was extended without updating the serializer.
 * A correctly built system never throws this; the exhaustiveness tests are meant to catch it first.
 */
public final class UnmappedVariantException extends MathTreeException {
	private final Object variant;

	public UnmappedVariantException(@Nullable String nodeId, Object variant) {
		super(nodeId, "No interchange mapping for " + describe(variant)
			+ (nodeId == null ? "" : " in node \"" + nodeId + "\""));
		this.variant = variant;
	}

	public Object variant() {
		return variant;
	}

	private static String describe(Object variant) {
		if (variant instanceof Class<?> c) {
			return "variant " + c.getSimpleName();
		} else if (variant instanceof Enum<?> e) {
			return e.getDeclaringClass().getSimpleName() + "." + e.name();
		} else {
			return String.valueOf(variant);
		}
	}
}
