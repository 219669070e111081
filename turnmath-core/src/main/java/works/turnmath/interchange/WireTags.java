package works.turnmath.interchange;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;
import works.turnmath.MathNodeContent;
import works.turnmath.MidScriptMark;
import works.turnmath.exceptions.InterchangeFormatException;
import works.turnmath.exceptions.UnmappedVariantException;
import works.turnmath.vocabulary.AddOrSubOperator;
import works.turnmath.vocabulary.BracketSize;
import works.turnmath.vocabulary.BracketStyle;
import works.turnmath.vocabulary.DifferentialStyle;
import works.turnmath.vocabulary.DivSymbol;
import works.turnmath.vocabulary.DivisionStyle;
import works.turnmath.vocabulary.MulOrDivOperator;
import works.turnmath.vocabulary.MulSymbol;
import works.turnmath.vocabulary.QuantifierKind;
import works.turnmath.vocabulary.RelationOperator;
import works.turnmath.vocabulary.ScientificNotationStyle;
import works.turnmath.vocabulary.UnaryRelationOperator;

/**
 * The strings of the interchange format: the {@code "type"} tag of each
 * {@link MathNodeContent} variant, and the string for every vocabulary case.
 * <p>
 * These are part of the wire contract. Changing any of them requires bumping
 * {@link #FORMAT_VERSION} and telling consumers.
 * <p>
 * Cases that carry data ({@link BracketSize.Sized}, {@link MidScriptMark.Dots})
 * get computed strings like {@code "sized_2"} and {@code "dot_3"},
 * so that all the cases of one vocabulary share a single string namespace.
 */
public final class WireTags {
	private WireTags() { }

	public static final int FORMAT_VERSION = 1;

	//
	// Variant type tags
	//

	private static final Map<Class<? extends MathNodeContent>, String> TYPE_TAGS;
	private static final Map<String, Class<? extends MathNodeContent>> TYPES_BY_TAG;

	static {
		var tags = new LinkedHashMap<Class<? extends MathNodeContent>, String>();
		tags.put(MathNodeContent.Empty.class, "empty");
		tags.put(MathNodeContent.Text.class, "text");
		tags.put(MathNodeContent.StringLiteral.class, "string");
		tags.put(MathNodeContent.Bracketed.class, "bracketed");
		tags.put(MathNodeContent.Matrix.class, "matrix");
		tags.put(MathNodeContent.Multiplications.class, "multiplications");
		tags.put(MathNodeContent.Additions.class, "additions");
		tags.put(MathNodeContent.Division.class, "division");
		tags.put(MathNodeContent.Fraction.class, "fraction");
		tags.put(MathNodeContent.SumNotation.class, "sum_notation");
		tags.put(MathNodeContent.ProductNotation.class, "product_notation");
		tags.put(MathNodeContent.Power.class, "power");
		tags.put(MathNodeContent.UnaryPrefixOperation.class, "unary_prefix_operation");
		tags.put(MathNodeContent.UnaryPostfixOperation.class, "unary_postfix_operation");
		tags.put(MathNodeContent.Abs.class, "abs");
		tags.put(MathNodeContent.FunctionCall.class, "function_call");
		tags.put(MathNodeContent.Quantity.class, "quantity");
		tags.put(MathNodeContent.ScientificNotation.class, "scientific_notation");
		tags.put(MathNodeContent.IdentifierContent.class, "identifier");
		tags.put(MathNodeContent.Unit.class, "unit");
		tags.put(MathNodeContent.Relationship.class, "relationship");
		tags.put(MathNodeContent.UnaryRelationship.class, "unary_relationship");
		tags.put(MathNodeContent.VariableDefinition.class, "variable_definition");
		tags.put(MathNodeContent.FunctionDefinition.class, "function_definition");
		tags.put(MathNodeContent.Limit.class, "limit");
		tags.put(MathNodeContent.Differential.class, "differential");
		tags.put(MathNodeContent.Integration.class, "integration");
		tags.put(MathNodeContent.QuantifiedExpression.class, "quantified_expression");
		tags.put(MathNodeContent.And.class, "and");
		tags.put(MathNodeContent.Or.class, "or");
		tags.put(MathNodeContent.Not.class, "not");
		tags.put(MathNodeContent.True.class, "true");
		tags.put(MathNodeContent.False.class, "false");
		// Unknown has no tag of its own; it re-emits the one it was read with

		var byTag = new LinkedHashMap<String, Class<? extends MathNodeContent>>();
		tags.forEach((type, tag) -> {
			var existing = byTag.put(tag, type);
			assert existing == null: "Duplicate type tag \"" + tag + "\"";
		});
		TYPE_TAGS = Collections.unmodifiableMap(tags);
		TYPES_BY_TAG = Collections.unmodifiableMap(byTag);
	}

	/**
	 * @throws UnmappedVariantException if the variant has no tag
	 * @throws InterchangeFormatException if an {@link MathNodeContent.Unknown Unknown}
	 * carries a blank tag or the tag of a known variant
	 */
	public static String typeTagFor(MathNodeContent content, @Nullable String nodeId) {
		if (content instanceof MathNodeContent.Unknown u) {
			if (u.type().isBlank()) {
				throw new InterchangeFormatException(nodeId, "Unknown variant has a blank type tag");
			}
			if (TYPES_BY_TAG.containsKey(u.type())) {
				throw new InterchangeFormatException(nodeId, "Unknown variant claims the tag of known variant \"" + u.type() + "\"");
			}
			return u.type();
		}
		String result = TYPE_TAGS.get(content.getClass());
		if (result == null) {
			throw new UnmappedVariantException(nodeId, content.getClass());
		}
		return result;
	}

	/**
	 * @return the variant with the given tag, or empty if it is unrecognized
	 */
	public static Optional<Class<? extends MathNodeContent>> contentTypeFor(String tag) {
		return Optional.ofNullable(TYPES_BY_TAG.get(tag));
	}

	/**
	 * @return every variant type tag, keyed by the variant's class
	 */
	public static Map<Class<? extends MathNodeContent>, String> typeTags() {
		return TYPE_TAGS;
	}

	//
	// Plain enums
	//

	public static final TagVocabulary<BracketStyle> BRACKET_STYLES = TagVocabulary.builder(BracketStyle.class)
		.put(BracketStyle.ROUND, "round")
		.put(BracketStyle.SQUARE, "square")
		.put(BracketStyle.CURLY, "curly")
		.put(BracketStyle.ANGLE, "angle")
		.put(BracketStyle.VERTICAL, "vertical")
		.put(BracketStyle.DOUBLE_VERTICAL, "double_vertical")
		.put(BracketStyle.CEILING, "ceiling")
		.put(BracketStyle.FLOOR, "floor")
		.put(BracketStyle.NONE, "none")
		.build();

	public static final TagVocabulary<BracketSize.Fixed> FIXED_BRACKET_SIZES = TagVocabulary.builder(BracketSize.Fixed.class)
		.put(BracketSize.Fixed.NORMAL, "normal")
		.put(BracketSize.Fixed.AUTO, "auto")
		.build();

	public static final TagVocabulary<MulSymbol> MUL_SYMBOLS = TagVocabulary.builder(MulSymbol.class)
		.put(MulSymbol.TIMES, "times")
		.put(MulSymbol.DOT, "dot")
		.put(MulSymbol.LITTLE_SPACE, "little_space")
		.build();

	public static final TagVocabulary<DivSymbol> DIV_SYMBOLS = TagVocabulary.builder(DivSymbol.class)
		.put(DivSymbol.SLASH, "slash")
		.put(DivSymbol.DIVIDE, "divide")
		.build();

	public static final TagVocabulary<DivisionStyle> DIVISION_STYLES = TagVocabulary.builder(DivisionStyle.class)
		.put(DivisionStyle.FRACTION, "fraction")
		.put(DivisionStyle.INLINE, "inline")
		.put(DivisionStyle.DIVISION, "division")
		.build();

	public static final TagVocabulary<AddOrSubOperator> ADD_OR_SUB_OPERATORS = TagVocabulary.builder(AddOrSubOperator.class)
		.put(AddOrSubOperator.ADDITION, "plus")
		.put(AddOrSubOperator.SUBTRACTION, "minus")
		.put(AddOrSubOperator.NONE, "none")
		.build();

	public static final TagVocabulary<ScientificNotationStyle> SCIENTIFIC_NOTATION_STYLES = TagVocabulary.builder(ScientificNotationStyle.class)
		.put(ScientificNotationStyle.LOWER_CASE_E, "lower_case_e")
		.put(ScientificNotationStyle.UPPER_CASE_E, "upper_case_e")
		.put(ScientificNotationStyle.TIMES_TEN_POWER, "times_ten_power")
		.build();

	public static final TagVocabulary<QuantifierKind> QUANTIFIERS = TagVocabulary.builder(QuantifierKind.class)
		.put(QuantifierKind.UNIVERSAL, "universal")
		.put(QuantifierKind.EXISTENTIAL, "existential")
		.put(QuantifierKind.UNIQUE_EXISTENTIAL, "unique_existential")
		.put(QuantifierKind.DEFINED, "defined")
		.put(QuantifierKind.FIXED, "fixed")
		.build();

	public static final TagVocabulary<DifferentialStyle> DIFFERENTIAL_STYLES = TagVocabulary.builder(DifferentialStyle.class)
		.put(DifferentialStyle.PARTIAL, "partial")
		.put(DifferentialStyle.TOTAL, "total")
		.build();

	public static final TagVocabulary<MidScriptMark.Accent> ACCENTS = TagVocabulary.builder(MidScriptMark.Accent.class)
		.put(MidScriptMark.Accent.HAT, "hat")
		.put(MidScriptMark.Accent.TILDE, "tilde")
		.put(MidScriptMark.Accent.BAR, "bar")
		.build();

	public static final TagVocabulary<RelationOperator.Standard> RELATION_OPERATORS = TagVocabulary.builder(RelationOperator.Standard.class)
		.put(RelationOperator.Standard.IS_EQUAL, "is_equal")
		.put(RelationOperator.Standard.EQUAL, "equal")
		.put(RelationOperator.Standard.NOT_EQUAL, "not_equal")
		.put(RelationOperator.Standard.GREATER, "greater")
		.put(RelationOperator.Standard.LESS, "less")
		.put(RelationOperator.Standard.GREATER_EQUAL, "greater_equal")
		.put(RelationOperator.Standard.LESS_EQUAL, "less_equal")
		.put(RelationOperator.Standard.COLLINEAR, "collinear")
		.put(RelationOperator.Standard.PERPENDICULAR, "perpendicular")
		.put(RelationOperator.Standard.EQUIVALENT, "equivalent")
		.put(RelationOperator.Standard.SIMILAR, "similar")
		.put(RelationOperator.Standard.CONGRUENT, "congruent")
		.put(RelationOperator.Standard.ELEMENT_OF, "element_of")
		.put(RelationOperator.Standard.NOT_ELEMENT_OF, "not_element_of")
		.put(RelationOperator.Standard.SUBSET_OF, "subset_of")
		.put(RelationOperator.Standard.PROPER_SUBSET_OF, "proper_subset_of")
		.put(RelationOperator.Standard.SUPERSET_OF, "superset_of")
		.put(RelationOperator.Standard.PROPER_SUPERSET_OF, "proper_superset_of")
		.put(RelationOperator.Standard.DISJOINT, "disjoint")
		.put(RelationOperator.Standard.UNION, "union")
		.put(RelationOperator.Standard.INTERSECTION, "intersection")
		.put(RelationOperator.Standard.CARTESIAN_PRODUCT, "cartesian_product")
		.put(RelationOperator.Standard.SAME_CARDINALITY, "same_cardinality")
		.put(RelationOperator.Standard.DIVIDES, "divides")
		.put(RelationOperator.Standard.NOT_DIVIDES, "not_divides")
		.put(RelationOperator.Standard.CONGRUENT_MOD, "congruent_mod")
		.put(RelationOperator.Standard.NOT_CONGRUENT_MOD, "not_congruent_mod")
		.put(RelationOperator.Standard.ARE_COPRIME, "are_coprime")
		.put(RelationOperator.Standard.IS_SUBGROUP_OF, "is_subgroup_of")
		.put(RelationOperator.Standard.IS_NORMAL_SUBGROUP_OF, "is_normal_subgroup_of")
		.put(RelationOperator.Standard.IS_ISOMORPHIC_TO, "is_isomorphic_to")
		.put(RelationOperator.Standard.IS_HOMOMORPHIC_TO, "is_homomorphic_to")
		.put(RelationOperator.Standard.IS_QUOTIENT_OF, "is_quotient_of")
		.put(RelationOperator.Standard.IS_IN_CENTER_OF, "is_in_center_of")
		.put(RelationOperator.Standard.ARE_CONJUGATE_IN, "are_conjugate_in")
		.put(RelationOperator.Standard.IS_SUBRING_OF, "is_subring_of")
		.put(RelationOperator.Standard.IS_IDEAL_OF, "is_ideal_of")
		.put(RelationOperator.Standard.IS_OPEN_IN, "is_open_in")
		.put(RelationOperator.Standard.IS_CLOSED_IN, "is_closed_in")
		.put(RelationOperator.Standard.IS_HOMEOMORPHIC_TO, "is_homeomorphic_to")
		.put(RelationOperator.Standard.IS_DENSE, "is_dense")
		.put(RelationOperator.Standard.IS_MORPHISM_BETWEEN, "is_morphism_between")
		.put(RelationOperator.Standard.IS_ISOMORPHISM_IN, "is_isomorphism_in")
		.put(RelationOperator.Standard.IS_MONOMORPHISM_IN, "is_monomorphism_in")
		.put(RelationOperator.Standard.IS_EPIMORPHISM_IN, "is_epimorphism_in")
		.put(RelationOperator.Standard.IS_NATURAL_TRANSFORMATION_BETWEEN, "is_natural_transformation_between")
		.put(RelationOperator.Standard.IS_ADJUNCTION_BETWEEN, "is_adjunction_between")
		.put(RelationOperator.Standard.COMPOSES_TO, "composes_to")
		.put(RelationOperator.Standard.IMPLIES, "implies")
		.put(RelationOperator.Standard.IFF, "iff")
		.build();

	public static final TagVocabulary<UnaryRelationOperator.Standard> UNARY_RELATION_OPERATORS = TagVocabulary.builder(UnaryRelationOperator.Standard.class)
		.put(UnaryRelationOperator.Standard.IS_PRIME, "is_prime")
		.put(UnaryRelationOperator.Standard.IS_COMPOSITE, "is_composite")
		.put(UnaryRelationOperator.Standard.HAS_ORDER_IN_GROUP, "has_order_in_group")
		.put(UnaryRelationOperator.Standard.HAS_UNIQUE_INVERSE, "has_unique_inverse")
		.put(UnaryRelationOperator.Standard.IS_PRIME_IDEAL, "is_prime_ideal")
		.put(UnaryRelationOperator.Standard.IS_MAXIMAL_IDEAL, "is_maximal_ideal")
		.put(UnaryRelationOperator.Standard.IS_PRINCIPAL_IDEAL, "is_principal_ideal")
		.put(UnaryRelationOperator.Standard.IS_UNIT, "is_unit")
		.put(UnaryRelationOperator.Standard.IS_IRREDUCIBLE, "is_irreducible")
		.put(UnaryRelationOperator.Standard.IS_PRIME_ELEMENT, "is_prime_element")
		.put(UnaryRelationOperator.Standard.IS_FIELD, "is_field")
		.put(UnaryRelationOperator.Standard.IS_INTEGRAL_DOMAIN, "is_integral_domain")
		.put(UnaryRelationOperator.Standard.IS_UFD, "is_ufd")
		.put(UnaryRelationOperator.Standard.IS_PID, "is_pid")
		.put(UnaryRelationOperator.Standard.IS_COMPACT, "is_compact")
		.put(UnaryRelationOperator.Standard.IS_CONNECTED, "is_connected")
		.put(UnaryRelationOperator.Standard.IS_CONTINUOUS, "is_continuous")
		.put(UnaryRelationOperator.Standard.CONVERGES, "converges")
		.put(UnaryRelationOperator.Standard.IS_HAUSDORFF, "is_hausdorff")
		.put(UnaryRelationOperator.Standard.IS_OBJECT_IN, "is_object_in")
		.put(UnaryRelationOperator.Standard.IS_ENDOMORPHISM_IN, "is_endomorphism_in")
		.put(UnaryRelationOperator.Standard.IS_AUTOMORPHISM_IN, "is_automorphism_in")
		.put(UnaryRelationOperator.Standard.COMPLEMENT, "complement")
		.put(UnaryRelationOperator.Standard.POWER_SET, "power_set")
		.build();

	//
	// Sealed vocabularies
	//

	public static final String MULTIPLY = "multiply";
	public static final String DIVIDE = "divide";
	public static final String NO_OPERATOR = "none";

	/**
	 * @return {@link #MULTIPLY}, {@link #DIVIDE}, or {@link #NO_OPERATOR}
	 */
	public static String operatorKindFor(MulOrDivOperator operator, @Nullable String nodeId) {
		if (operator instanceof MulOrDivOperator.Multiplication) {
			return MULTIPLY;
		} else if (operator instanceof MulOrDivOperator.Division) {
			return DIVIDE;
		} else if (operator == MulOrDivOperator.Implicit.NONE) {
			return NO_OPERATOR;
		} else {
			throw new UnmappedVariantException(nodeId, operator);
		}
	}

	/**
	 * @return the symbol string, or null for {@link MulOrDivOperator.Implicit#NONE}
	 */
	@Nullable
	public static String operatorSymbolFor(MulOrDivOperator operator, @Nullable String nodeId) {
		if (operator instanceof MulOrDivOperator.Multiplication m) {
			return MUL_SYMBOLS.tagFor(m.symbol(), nodeId);
		} else if (operator instanceof MulOrDivOperator.Division d) {
			return DIV_SYMBOLS.tagFor(d.symbol(), nodeId);
		} else if (operator == MulOrDivOperator.Implicit.NONE) {
			return null;
		} else {
			throw new UnmappedVariantException(nodeId, operator);
		}
	}

	/**
	 * Inverse of {@link #operatorKindFor} and {@link #operatorSymbolFor}.
	 */
	public static Optional<MulOrDivOperator> operatorFor(String kind, @Nullable String symbol) {
		switch (kind) {
			case MULTIPLY:
				return symbol == null ? Optional.empty() : MUL_SYMBOLS.valueFor(symbol).map(MulOrDivOperator::times);
			case DIVIDE:
				return symbol == null ? Optional.empty() : DIV_SYMBOLS.valueFor(symbol).map(MulOrDivOperator::dividedBy);
			case NO_OPERATOR:
				return symbol == null ? Optional.of(MulOrDivOperator.none()) : Optional.empty();
			default:
				return Optional.empty();
		}
	}

	private static final String SIZED_PREFIX = "sized_";
	private static final Pattern SIZED_PATTERN = Pattern.compile(SIZED_PREFIX + "([0-9]+)");

	public static String bracketSizeTagFor(BracketSize size, @Nullable String nodeId) {
		if (size instanceof BracketSize.Fixed f) {
			return FIXED_BRACKET_SIZES.tagFor(f, nodeId);
		} else if (size instanceof BracketSize.Sized s) {
			return SIZED_PREFIX + s.level();
		} else {
			throw new UnmappedVariantException(nodeId, size);
		}
	}

	/**
	 * @return empty if {@code tag} is unrecognized, including {@code "sized_n"} with an out-of-range {@code n}
	 */
	public static Optional<BracketSize> bracketSizeFor(String tag) {
		Matcher matcher = SIZED_PATTERN.matcher(tag);
		if (matcher.matches()) {
			return parseLevel(matcher.group(1))
				.filter(n -> BracketSize.Sized.MIN_LEVEL <= n && n <= BracketSize.Sized.MAX_LEVEL)
				.map(BracketSize::sized);
		}
		return FIXED_BRACKET_SIZES.valueFor(tag).map(f -> f);
	}

	private static final String DOT_PREFIX = "dot_";
	private static final Pattern DOT_PATTERN = Pattern.compile(DOT_PREFIX + "([0-9]+)");

	public static String midScriptMarkTagFor(MidScriptMark mark, @Nullable String nodeId) {
		if (mark instanceof MidScriptMark.Accent a) {
			return ACCENTS.tagFor(a, nodeId);
		} else if (mark instanceof MidScriptMark.Dots d) {
			return DOT_PREFIX + d.count();
		} else {
			throw new UnmappedVariantException(nodeId, mark);
		}
	}

	public static Optional<MidScriptMark> midScriptMarkFor(String tag) {
		Matcher matcher = DOT_PATTERN.matcher(tag);
		if (matcher.matches()) {
			return parseLevel(matcher.group(1))
				.filter(n -> n >= 1)
				.map(MidScriptMark::dots);
		}
		return ACCENTS.valueFor(tag).map(a -> a);
	}

	private static Optional<Integer> parseLevel(String digits) {
		try {
			return Optional.of(Integer.parseInt(digits));
		} catch (NumberFormatException e) {
			// Too many digits to be a level we'd accept anyway
			return Optional.empty();
		}
	}
}
