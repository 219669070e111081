package works.turnmath.interchange;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import works.turnmath.exceptions.UnmappedVariantException;

import static java.util.Objects.requireNonNull;

/**
 * A two-way table between the constants of an enum and their interchange strings.
 * <p>
 * Every constant must be given its string explicitly.
 * A constant added to the enum without a corresponding entry here
 * makes {@link #tagFor} fail with {@link UnmappedVariantException}
 * rather than inventing a string, and shows up in {@link #unmapped()},
 * which the tests check is empty.
 */
public final class TagVocabulary<E extends Enum<E>> {
	private final Class<E> enumType;
	private final Map<E, String> tagsByValue;
	private final Map<String, E> valuesByTag;

	private TagVocabulary(Class<E> enumType, Map<E, String> tagsByValue, Map<String, E> valuesByTag) {
		this.enumType = enumType;
		this.tagsByValue = Collections.unmodifiableMap(tagsByValue);
		this.valuesByTag = Collections.unmodifiableMap(valuesByTag);
	}

	public static <E extends Enum<E>> Builder<E> builder(Class<E> enumType) {
		return new Builder<>(enumType);
	}

	public Class<E> enumType() {
		return enumType;
	}

	/**
	 * @param nodeId the node being serialized, for the error message
	 * @throws UnmappedVariantException if {@code value} has no string
	 */
	public String tagFor(E value, @Nullable String nodeId) {
		String result = tagsByValue.get(requireNonNull(value));
		if (result == null) {
			throw new UnmappedVariantException(nodeId, value);
		}
		return result;
	}

	public Optional<E> valueFor(String tag) {
		return Optional.ofNullable(valuesByTag.get(tag));
	}

	/**
	 * @return the interchange strings, in the order they were declared
	 */
	public Collection<String> tags() {
		return valuesByTag.keySet();
	}

	/**
	 * @return the constants of {@link #enumType()} with no interchange string.
	 * Should always be empty.
	 */
	public Set<E> unmapped() {
		EnumSet<E> result = EnumSet.allOf(enumType);
		result.removeAll(tagsByValue.keySet());
		return result;
	}

	@Override
	public String toString() {
		return "TagVocabulary(" + enumType.getSimpleName() + ")";
	}

	public static final class Builder<E extends Enum<E>> {
		private final Class<E> enumType;
		private final EnumMap<E, String> tagsByValue;
		private final LinkedHashMap<String, E> valuesByTag = new LinkedHashMap<>();

		Builder(Class<E> enumType) {
			this.enumType = requireNonNull(enumType);
			this.tagsByValue = new EnumMap<>(enumType);
		}

		public Builder<E> put(E value, String tag) {
			if (tagsByValue.containsKey(value)) {
				throw new IllegalArgumentException("Duplicate mapping for " + value + " in " + enumType.getSimpleName());
			}
			E existing = valuesByTag.get(tag);
			if (existing != null) {
				throw new IllegalArgumentException("Tag \"" + tag + "\" already used by " + existing + " in " + enumType.getSimpleName());
			}
			tagsByValue.put(value, requireNonNull(tag));
			valuesByTag.put(tag, value);
			return this;
		}

		public TagVocabulary<E> build() {
			return new TagVocabulary<>(enumType, new EnumMap<>(tagsByValue), new LinkedHashMap<>(valuesByTag));
		}
	}
}
