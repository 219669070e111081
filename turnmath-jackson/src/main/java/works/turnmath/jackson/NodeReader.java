package works.turnmath.jackson;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import works.turnmath.Identifier;
import works.turnmath.MathNode;
import works.turnmath.MathNodeContent;
import works.turnmath.MathNodeContent.Abs;
import works.turnmath.MathNodeContent.Additions;
import works.turnmath.MathNodeContent.And;
import works.turnmath.MathNodeContent.Bracketed;
import works.turnmath.MathNodeContent.Differential;
import works.turnmath.MathNodeContent.Division;
import works.turnmath.MathNodeContent.Empty;
import works.turnmath.MathNodeContent.False;
import works.turnmath.MathNodeContent.Fraction;
import works.turnmath.MathNodeContent.FunctionCall;
import works.turnmath.MathNodeContent.FunctionDefinition;
import works.turnmath.MathNodeContent.IdentifierContent;
import works.turnmath.MathNodeContent.Integration;
import works.turnmath.MathNodeContent.Limit;
import works.turnmath.MathNodeContent.Matrix;
import works.turnmath.MathNodeContent.Multiplications;
import works.turnmath.MathNodeContent.Not;
import works.turnmath.MathNodeContent.Or;
import works.turnmath.MathNodeContent.Power;
import works.turnmath.MathNodeContent.ProductNotation;
import works.turnmath.MathNodeContent.QuantifiedExpression;
import works.turnmath.MathNodeContent.Quantity;
import works.turnmath.MathNodeContent.Relationship;
import works.turnmath.MathNodeContent.ScientificNotation;
import works.turnmath.MathNodeContent.StringLiteral;
import works.turnmath.MathNodeContent.SumNotation;
import works.turnmath.MathNodeContent.Text;
import works.turnmath.MathNodeContent.True;
import works.turnmath.MathNodeContent.UnaryPostfixOperation;
import works.turnmath.MathNodeContent.UnaryPrefixOperation;
import works.turnmath.MathNodeContent.UnaryRelationship;
import works.turnmath.MathNodeContent.Unit;
import works.turnmath.MathNodeContent.Unknown;
import works.turnmath.MathNodeContent.VariableDefinition;
import works.turnmath.MidScriptGroup;
import works.turnmath.MidScriptMark;
import works.turnmath.ScriptGroup;
import works.turnmath.exceptions.DepthExceededException;
import works.turnmath.exceptions.InterchangeFormatException;
import works.turnmath.exceptions.UnmappedVariantException;
import works.turnmath.interchange.TagVocabulary;
import works.turnmath.interchange.WireTags;
import works.turnmath.vocabulary.BracketSize;
import works.turnmath.vocabulary.MulOrDivOperator;
import works.turnmath.vocabulary.RelationOperator;
import works.turnmath.vocabulary.UnaryRelationOperator;

import static works.turnmath.interchange.WireTags.ADD_OR_SUB_OPERATORS;
import static works.turnmath.interchange.WireTags.BRACKET_STYLES;
import static works.turnmath.interchange.WireTags.DIFFERENTIAL_STYLES;
import static works.turnmath.interchange.WireTags.DIVISION_STYLES;
import static works.turnmath.interchange.WireTags.QUANTIFIERS;
import static works.turnmath.interchange.WireTags.RELATION_OPERATORS;
import static works.turnmath.interchange.WireTags.SCIENTIFIC_NOTATION_STYLES;
import static works.turnmath.interchange.WireTags.UNARY_RELATION_OPERATORS;

/**
 * The deserializing half of {@link JacksonMathSerializer}.
 * <p>
 * Optional members may be absent or {@code null}; required members must be present.
 * Members that the variant doesn't define are ignored.
 */
final class NodeReader {
	private final MathSerializerSettings settings;
	private final ObjectMapper mapper;
	private final Map<Class<? extends MathNodeContent>, Function<Members, MathNodeContent>> contentReaders;

	NodeReader(MathSerializerSettings settings, ObjectMapper mapper) {
		this.settings = settings;
		this.mapper = mapper;
		this.contentReaders = contentReaders();
		for (var type : WireTags.typeTags().keySet()) {
			if (!contentReaders.containsKey(type)) {
				throw new UnmappedVariantException(null, type);
			}
		}
	}

	MathNode read(JsonNode json) {
		return read(json, null, 1);
	}

	private MathNode read(JsonNode json, @Nullable String parentId, int depth) {
		if (!json.isObject()) {
			throw new InterchangeFormatException(parentId, "Expected node object; found " + json.getNodeType());
		}
		Members members = new Members(json, parentId, depth);
		String id = members.string("id");
		members = new Members(json, id, depth);
		if (depth > settings.maxDepth()) {
			throw new DepthExceededException(id, settings.maxDepth());
		}
		String type = members.string("type");
		Optional<Class<? extends MathNodeContent>> contentType = WireTags.contentTypeFor(type);
		MathNodeContent content;
		if (contentType.isPresent()) {
			LOGGER.trace("Reading {} \"{}\" at depth {}", type, id, depth);
			content = contentReaders.get(contentType.get()).apply(members);
		} else if (settings.preserveUnknownVariants()) {
			LOGGER.warn("Preserving unrecognized variant \"{}\" in node \"{}\"", type, id);
			content = new Unknown(type, mapper.writeValueAsString(json));
		} else {
			throw new InterchangeFormatException(id, "Unrecognized type tag \"" + type + "\"");
		}
		return new MathNode(id, content);
	}

	private Map<Class<? extends MathNodeContent>, Function<Members, MathNodeContent>> contentReaders() {
		Map<Class<? extends MathNodeContent>, Function<Members, MathNodeContent>> result = new HashMap<>();
		result.put(Empty.class, m -> MathNodeContent.EMPTY);
		result.put(Text.class, m -> new Text(m.string("text")));
		result.put(StringLiteral.class, m -> new StringLiteral(m.string("text")));
		result.put(Bracketed.class, m -> new Bracketed(
			m.node("inner"),
			m.tag("style", BRACKET_STYLES),
			m.bracketSize("size")));
		result.put(Matrix.class, m -> {
			List<List<MathNode>> rows = new ArrayList<>();
			for (JsonNode row : m.array("rows")) {
				rows.add(m.nodesIn(row, "rows"));
			}
			return new Matrix(rows);
		});
		result.put(Multiplications.class, m -> {
			List<Multiplications.Term> terms = new ArrayList<>();
			for (JsonNode term : m.array("terms")) {
				Members t = m.nested(term, "terms");
				terms.add(new Multiplications.Term(t.mulOrDivOperator(), t.node("node")));
			}
			return new Multiplications(terms);
		});
		result.put(Additions.class, m -> {
			List<Additions.Term> terms = new ArrayList<>();
			for (JsonNode term : m.array("terms")) {
				Members t = m.nested(term, "terms");
				terms.add(new Additions.Term(t.tag("operator", ADD_OR_SUB_OPERATORS), t.node("node")));
			}
			return new Additions(terms);
		});
		result.put(Division.class, m -> new Division(
			m.node("numerator"),
			m.node("denominator"),
			m.tag("style", DIVISION_STYLES)));
		result.put(Fraction.class, m -> new Fraction(m.node("numerator"), m.node("denominator")));
		result.put(SumNotation.class, m -> new SumNotation(
			m.node("summand"),
			m.optionalNode("variable"),
			m.optionalNode("lower_limit"),
			m.optionalNode("upper_limit")));
		result.put(ProductNotation.class, m -> new ProductNotation(
			m.node("multiplicand"),
			m.optionalNode("variable"),
			m.optionalNode("lower_limit"),
			m.optionalNode("upper_limit")));
		result.put(Power.class, m -> new Power(m.node("base"), m.node("exponent")));
		result.put(UnaryPrefixOperation.class, m -> new UnaryPrefixOperation(m.node("parameter"), m.node("operator")));
		result.put(UnaryPostfixOperation.class, m -> new UnaryPostfixOperation(m.node("parameter"), m.node("operator")));
		result.put(Abs.class, m -> new Abs(m.node("parameter")));
		result.put(FunctionCall.class, m -> new FunctionCall(m.node("name"), m.nodes("parameters")));
		result.put(Quantity.class, m -> new Quantity(
			m.string("number"),
			m.optionalNode("scientific_notation"),
			m.optionalNode("unit")));
		result.put(ScientificNotation.class, m -> new ScientificNotation(
			m.node("magnitude"),
			m.tag("style", SCIENTIFIC_NOTATION_STYLES)));
		result.put(IdentifierContent.class, m -> new IdentifierContent(new Identifier(
			m.string("body"),
			m.scriptGroup("pre_script"),
			m.midScriptGroup("mid_script"),
			m.scriptGroup("post_script"),
			m.nonNegativeInt("primes"),
			m.bool("is_function"))));
		result.put(Unit.class, m -> new Unit(m.node("original_form"), m.node("flattened_form")));
		result.put(Relationship.class, m -> new Relationship(
			m.node("lhs"),
			m.node("rhs"),
			m.relationOperator("operator")));
		result.put(UnaryRelationship.class, m -> new UnaryRelationship(
			m.node("subject"),
			m.unaryRelationOperator("predicate")));
		result.put(VariableDefinition.class, m -> new VariableDefinition(m.node("name"), m.optionalNode("definition")));
		result.put(FunctionDefinition.class, m -> new FunctionDefinition(m.node("custom_function"), m.optionalNode("definition")));
		result.put(Limit.class, m -> new Limit(
			m.node("function"),
			m.string("variable"),
			m.node("approaching_value")));
		result.put(Differential.class, m -> new Differential(
			m.node("target"),
			m.node("order"),
			m.tag("diff_style", DIFFERENTIAL_STYLES)));
		result.put(Integration.class, m -> {
			MathNode integrand = m.node("integrand");
			List<Integration.IntegralDifferential> differentials = new ArrayList<>();
			for (JsonNode entry : m.array("differentials")) {
				Members d = m.nested(entry, "differentials");
				differentials.add(new Integration.IntegralDifferential(
					d.node("differential"),
					d.optionalNode("lower_bound"),
					d.optionalNode("upper_bound")));
			}
			return new Integration(integrand, differentials, m.optionalNode("domain"));
		});
		result.put(QuantifiedExpression.class, m -> new QuantifiedExpression(
			m.tag("quantifier", QUANTIFIERS),
			m.nodes("variables"),
			m.optionalNode("domain"),
			m.optionalNode("predicate")));
		result.put(And.class, m -> new And(m.nodes("operands")));
		result.put(Or.class, m -> new Or(m.nodes("operands")));
		result.put(Not.class, m -> new Not(m.node("operand")));
		result.put(True.class, m -> MathNodeContent.TRUE);
		result.put(False.class, m -> MathNodeContent.FALSE);
		return Map.copyOf(result);
	}

	/**
	 * Typed access to the members of one JSON object.
	 * Every failure is reported against {@link #nodeId}.
	 */
	private final class Members {
		final JsonNode json;
		final @Nullable String nodeId;
		final int depth;

		Members(JsonNode json, @Nullable String nodeId, int depth) {
			this.json = json;
			this.nodeId = nodeId;
			this.depth = depth;
		}

		Members nested(JsonNode object, String context) {
			if (!object.isObject()) {
				throw error("Expected objects in \"" + context + "\"; found " + object.getNodeType());
			}
			return new Members(object, nodeId, depth);
		}

		JsonNode required(String name) {
			JsonNode value = json.get(name);
			if (value == null || value.isNull()) {
				throw error("Missing required member \"" + name + "\"");
			}
			return value;
		}

		@Nullable JsonNode optional(String name) {
			JsonNode value = json.get(name);
			return (value == null || value.isNull()) ? null : value;
		}

		String string(String name) {
			JsonNode value = required(name);
			if (!value.isString()) {
				throw error("Member \"" + name + "\" must be a string; found " + value.getNodeType());
			}
			return value.asString();
		}

		@Nullable String optionalString(String name) {
			return (optional(name) == null) ? null : string(name);
		}

		int nonNegativeInt(String name) {
			JsonNode value = required(name);
			if (!value.isInt() || value.intValue() < 0) {
				throw error("Member \"" + name + "\" must be a non-negative integer; found " + value);
			}
			return value.intValue();
		}

		boolean bool(String name) {
			JsonNode value = required(name);
			if (!value.isBoolean()) {
				throw error("Member \"" + name + "\" must be a boolean; found " + value.getNodeType());
			}
			return value.booleanValue();
		}

		JsonNode array(String name) {
			JsonNode value = required(name);
			if (!value.isArray()) {
				throw error("Member \"" + name + "\" must be an array; found " + value.getNodeType());
			}
			return value;
		}

		MathNode node(String name) {
			return child(required(name));
		}

		@Nullable MathNode optionalNode(String name) {
			JsonNode value = optional(name);
			return (value == null) ? null : child(value);
		}

		List<MathNode> nodes(String name) {
			return nodesIn(array(name), name);
		}

		List<MathNode> nodesIn(JsonNode array, String context) {
			if (!array.isArray()) {
				throw error("Expected arrays in \"" + context + "\"; found " + array.getNodeType());
			}
			List<MathNode> result = new ArrayList<>(array.size());
			for (JsonNode element : array) {
				result.add(child(element));
			}
			return result;
		}

		<E extends Enum<E>> E tag(String name, TagVocabulary<E> vocabulary) {
			String tag = string(name);
			return vocabulary.valueFor(tag).orElseThrow(() ->
				error("Unrecognized " + vocabulary.enumType().getSimpleName() + " \"" + tag + "\" in member \"" + name + "\""));
		}

		BracketSize bracketSize(String name) {
			String tag = string(name);
			return WireTags.bracketSizeFor(tag).orElseThrow(() ->
				error("Unrecognized bracket size \"" + tag + "\""));
		}

		MulOrDivOperator mulOrDivOperator() {
			String kind = string("operator");
			String symbol = optionalString("symbol");
			return WireTags.operatorFor(kind, symbol).orElseThrow(() ->
				error("Unrecognized operator \"" + kind + "\" with symbol " + (symbol == null ? "null" : "\"" + symbol + "\"")));
		}

		/**
		 * Reads either a standard operator tag, or an object like <code>{"custom": text}</code>.
		 */
		RelationOperator relationOperator(String name) {
			JsonNode value = required(name);
			if (value.isObject()) {
				return RelationOperator.custom(nested(value, name).string("custom"));
			}
			return tag(name, RELATION_OPERATORS);
		}

		UnaryRelationOperator unaryRelationOperator(String name) {
			JsonNode value = required(name);
			if (value.isObject()) {
				return UnaryRelationOperator.custom(nested(value, name).string("custom"));
			}
			return tag(name, UNARY_RELATION_OPERATORS);
		}

		@Nullable ScriptGroup scriptGroup(String name) {
			JsonNode value = optional(name);
			if (value == null) {
				return null;
			}
			Members group = nested(value, name);
			return new ScriptGroup(group.nodes("subscripts"), group.nodes("superscripts"));
		}

		@Nullable MidScriptGroup midScriptGroup(String name) {
			JsonNode value = optional(name);
			if (value == null) {
				return null;
			}
			Members group = nested(value, name);
			return new MidScriptGroup(group.marks("super_script"), group.marks("sub_script"));
		}

		List<MidScriptMark> marks(String name) {
			List<MidScriptMark> result = new ArrayList<>();
			for (JsonNode element : array(name)) {
				if (!element.isString()) {
					throw error("Expected strings in \"" + name + "\"; found " + element.getNodeType());
				}
				String tag = element.asString();
				result.add(WireTags.midScriptMarkFor(tag).orElseThrow(() ->
					error("Unrecognized mid-script mark \"" + tag + "\"")));
			}
			return result;
		}

		private MathNode child(JsonNode value) {
			return read(value, nodeId, depth + 1);
		}

		private InterchangeFormatException error(String message) {
			return new InterchangeFormatException(nodeId, message);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(NodeReader.class);
}
