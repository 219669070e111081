package works.turnmath.interchange;

import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;
import works.turnmath.MathNodeContent;
import works.turnmath.MidScriptMark;
import works.turnmath.exceptions.InterchangeFormatException;
import works.turnmath.exceptions.UnmappedVariantException;
import works.turnmath.vocabulary.BracketSize;
import works.turnmath.vocabulary.DivSymbol;
import works.turnmath.vocabulary.MulOrDivOperator;
import works.turnmath.vocabulary.MulSymbol;
import works.turnmath.vocabulary.RelationOperator;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.matchesPattern;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WireTagsTest {

	/**
	 * Every {@link TagVocabulary} declared in {@link WireTags}, found reflectively
	 * so that a new one can't be left out of these tests.
	 */
	static Stream<TagVocabulary<?>> vocabularies() throws IllegalAccessException {
		List<TagVocabulary<?>> result = new ArrayList<>();
		for (var field : WireTags.class.getFields()) {
			if (Modifier.isStatic(field.getModifiers()) && field.getType() == TagVocabulary.class) {
				result.add((TagVocabulary<?>) field.get(null));
			}
		}
		return result.stream();
	}

	@ParameterizedTest
	@MethodSource("vocabularies")
	void vocabulary_total(TagVocabulary<?> vocabulary) {
		assertThat("Unmapped constants in " + vocabulary, vocabulary.unmapped(), empty());
		assertEquals(vocabulary.enumType().getEnumConstants().length, vocabulary.tags().size());
	}

	@ParameterizedTest
	@MethodSource("vocabularies")
	void vocabulary_snakeCase(TagVocabulary<?> vocabulary) {
		for (String tag : vocabulary.tags()) {
			assertThat(tag, matchesPattern("[a-z][a-z0-9_]*"));
		}
	}

	@ParameterizedTest
	@MethodSource("vocabularies")
	void vocabulary_inverse(TagVocabulary<?> vocabulary) {
		assertInverse(vocabulary);
	}

	private static <E extends Enum<E>> void assertInverse(TagVocabulary<E> vocabulary) {
		for (E value : vocabulary.enumType().getEnumConstants()) {
			assertEquals(value, vocabulary.valueFor(vocabulary.tagFor(value, null)).orElseThrow());
		}
	}

	@Test
	void typeTags_everyVariantButUnknown() {
		for (Class<?> variant : MathNodeContent.class.getPermittedSubclasses()) {
			if (variant == MathNodeContent.Unknown.class) {
				assertFalse(WireTags.typeTags().containsKey(variant), "Unknown reuses the tag it was read with");
			} else {
				assertTrue(WireTags.typeTags().containsKey(variant), "No type tag for " + variant.getSimpleName());
			}
		}
	}

	@Test
	void typeTags_unique() {
		var tags = WireTags.typeTags().values();
		assertEquals(tags.size(), new HashSet<>(tags).size());
		for (var entry : WireTags.typeTags().entrySet()) {
			assertEquals(entry.getKey(), WireTags.contentTypeFor(entry.getValue()).orElseThrow());
		}
	}

	@Test
	void typeTagFor_examples() {
		assertEquals("quantity", WireTags.typeTagFor(new MathNodeContent.Quantity("1", null, null), "q"));
		assertEquals("unary_prefix_operation", WireTags.typeTags().get(MathNodeContent.UnaryPrefixOperation.class));
		assertEquals("identifier", WireTags.typeTags().get(MathNodeContent.IdentifierContent.class));
		assertEquals("string", WireTags.typeTags().get(MathNodeContent.StringLiteral.class));
		assertEquals("hologram", WireTags.typeTagFor(new MathNodeContent.Unknown("hologram", "{}"), "h"));
	}

	@ParameterizedTest
	@ValueSource(strings = {"power", "identifier", "", "  "})
	void typeTagFor_unknownWithReservedOrBlankTag_rejected(String tag) {
		var content = new MathNodeContent.Unknown(tag, "{}");
		InterchangeFormatException e = assertThrows(InterchangeFormatException.class, () -> WireTags.typeTagFor(content, "u"));
		assertEquals("u", e.nodeId());
	}

	@Test
	void relationOperator_examples() {
		assertEquals("is_equal", WireTags.RELATION_OPERATORS.tagFor(RelationOperator.Standard.IS_EQUAL, null));
		assertEquals("element_of", WireTags.RELATION_OPERATORS.tagFor(RelationOperator.Standard.ELEMENT_OF, null));
	}

	@Test
	void bracketSize_tags() {
		assertEquals("normal", WireTags.bracketSizeTagFor(BracketSize.NORMAL, null));
		assertEquals("auto", WireTags.bracketSizeTagFor(BracketSize.AUTO, null));
		assertEquals("sized_2", WireTags.bracketSizeTagFor(BracketSize.sized(2), null));
		assertEquals(BracketSize.sized(4), WireTags.bracketSizeFor("sized_4").orElseThrow());
		assertEquals(BracketSize.AUTO, WireTags.bracketSizeFor("auto").orElseThrow());
	}

	@ParameterizedTest
	@ValueSource(strings = {"sized_0", "sized_5", "sized_", "sized_x", "sized_99999999999999", "big", ""})
	void bracketSize_rejected(String tag) {
		assertTrue(WireTags.bracketSizeFor(tag).isEmpty());
	}

	@Test
	void midScriptMark_tags() {
		assertEquals("dot_3", WireTags.midScriptMarkTagFor(MidScriptMark.dots(3), null));
		assertEquals("tilde", WireTags.midScriptMarkTagFor(MidScriptMark.TILDE, null));
		assertEquals(MidScriptMark.dots(2), WireTags.midScriptMarkFor("dot_2").orElseThrow());
		assertTrue(WireTags.midScriptMarkFor("dot_0").isEmpty());
		assertTrue(WireTags.midScriptMarkFor("ring").isEmpty());
	}

	@Test
	void mulOrDivOperator_tags() {
		MulOrDivOperator times = MulOrDivOperator.times(MulSymbol.LITTLE_SPACE);
		assertEquals("multiply", WireTags.operatorKindFor(times, null));
		assertEquals("little_space", WireTags.operatorSymbolFor(times, null));
		assertEquals(times, WireTags.operatorFor("multiply", "little_space").orElseThrow());

		MulOrDivOperator divide = MulOrDivOperator.dividedBy(DivSymbol.DIVIDE);
		assertEquals("divide", WireTags.operatorKindFor(divide, null));
		assertEquals("divide", WireTags.operatorSymbolFor(divide, null));
		assertEquals(divide, WireTags.operatorFor("divide", "divide").orElseThrow());

		assertEquals("none", WireTags.operatorKindFor(MulOrDivOperator.none(), null));
		assertNull(WireTags.operatorSymbolFor(MulOrDivOperator.none(), null));
		assertEquals(MulOrDivOperator.none(), WireTags.operatorFor("none", null).orElseThrow());
	}

	@Test
	void mulOrDivOperator_mismatchRejected() {
		assertTrue(WireTags.operatorFor("multiply", null).isEmpty());
		assertTrue(WireTags.operatorFor("multiply", "slash").isEmpty());
		assertTrue(WireTags.operatorFor("none", "dot").isEmpty());
		assertTrue(WireTags.operatorFor("modulo", null).isEmpty());
	}

	@Test
	void incompleteVocabulary_failsClosed() {
		TagVocabulary<MulSymbol> partial = TagVocabulary.builder(MulSymbol.class)
			.put(MulSymbol.TIMES, "times")
			.build();
		UnmappedVariantException e = assertThrows(UnmappedVariantException.class,
			() -> partial.tagFor(MulSymbol.DOT, "node-7"));
		assertEquals("node-7", e.nodeId());
		assertEquals(MulSymbol.DOT, e.variant());
	}
}
