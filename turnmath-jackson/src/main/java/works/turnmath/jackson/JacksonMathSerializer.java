package works.turnmath.jackson;

import java.util.List;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.core.StreamReadConstraints;
import tools.jackson.core.StreamWriteConstraints;
import tools.jackson.core.json.JsonFactory;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.ObjectNode;
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
import works.turnmath.interchange.MathTreeSerializer;
import works.turnmath.interchange.WireTags;
import works.turnmath.validation.NodeConstraints;
import works.turnmath.validation.Severity;
import works.turnmath.validation.ValidationIssue;
import works.turnmath.vocabulary.RelationOperator;
import works.turnmath.vocabulary.UnaryRelationOperator;

import static java.util.Objects.requireNonNull;
import static works.turnmath.interchange.WireTags.ADD_OR_SUB_OPERATORS;
import static works.turnmath.interchange.WireTags.BRACKET_STYLES;
import static works.turnmath.interchange.WireTags.DIFFERENTIAL_STYLES;
import static works.turnmath.interchange.WireTags.DIVISION_STYLES;
import static works.turnmath.interchange.WireTags.QUANTIFIERS;
import static works.turnmath.interchange.WireTags.RELATION_OPERATORS;
import static works.turnmath.interchange.WireTags.SCIENTIFIC_NOTATION_STYLES;
import static works.turnmath.interchange.WireTags.UNARY_RELATION_OPERATORS;
import static works.turnmath.jackson.MathSerializerSettings.RaggedMatrixPolicy.REJECT;
import static works.turnmath.validation.Constraint.RAGGED_MATRIX;

/**
 * Converts expression trees to and from Jackson {@link JsonNode} trees
 * in the canonical interchange format.
 * <p>
 * Each {@link MathNode} becomes a JSON object whose first two members are
 * {@code "type"} (see {@link WireTags#typeTags()}) and {@code "id"},
 * followed by the variant's fields in declaration order, in snake_case.
 * Optional fields are always written, as {@code null} when absent.
 * <p>
 * Every node is checked against {@link NodeConstraints} as it is written,
 * and the first error aborts the whole call, so a malformed tree never yields partial output.
 * <p>
 * Instances are immutable and thread-safe.
 *
 * @see MathJacksonModule
 */
public final class JacksonMathSerializer implements MathTreeSerializer<JsonNode> {
	private final MathSerializerSettings settings;
	private final ObjectMapper mapper;
	private final NodeReader reader;

	public JacksonMathSerializer() {
		this(MathSerializerSettings.defaultSettings());
	}

	public JacksonMathSerializer(MathSerializerSettings settings) {
		if (settings.maxDepth() < 1) {
			throw new IllegalArgumentException("maxDepth must be positive: " + settings.maxDepth());
		}
		this.settings = settings;
		this.mapper = JsonMapper.builder(jsonFactory(settings)).build();
		this.reader = new NodeReader(settings, mapper);
		LOGGER.debug("New serializer with {}", settings);
	}

	public MathSerializerSettings settings() {
		return settings;
	}

	/**
	 * A {@link JsonFactory} whose nesting limits admit any tree within {@code settings.maxDepth()}.
	 * Jackson's default limits are far lower, so an {@link ObjectMapper} that uses
	 * {@link MathJacksonModule} should be built on one of these:
	 *
	 * <pre>
	 * JsonMapper.builder(JacksonMathSerializer.jsonFactory(settings))
	 *     .addModule(new MathJacksonModule(new JacksonMathSerializer(settings)))
	 *     .build();
	 * </pre>
	 */
	public static JsonFactory jsonFactory(MathSerializerSettings settings) {
		int jsonDepth = jsonNestingDepth(settings.maxDepth());
		return JsonFactory.builder()
			.streamReadConstraints(StreamReadConstraints.builder().maxNestingDepth(jsonDepth).build())
			.streamWriteConstraints(StreamWriteConstraints.builder().maxNestingDepth(jsonDepth).build())
			.build();
	}

	static int jsonNestingDepth(int maxDepth) {
		// Each tree level can take up to three levels of JSON nesting
		return (int) Math.min(Integer.MAX_VALUE, 3L * maxDepth + 10);
	}

	@Override
	public ObjectNode serialize(MathNode node) {
		return write(requireNonNull(node), 1);
	}

	@Override
	public MathNode deserialize(JsonNode value) {
		return reader.read(requireNonNull(value));
	}

	/**
	 * Convenience method that produces JSON text.
	 */
	public String serializeToString(MathNode node) {
		return mapper.writeValueAsString(serialize(node));
	}

	/**
	 * Convenience method that consumes JSON text.
	 *
	 * @throws InterchangeFormatException if {@code json} isn't valid JSON, or doesn't describe a tree
	 */
	public MathNode deserializeFromString(String json) {
		JsonNode tree;
		try {
			tree = mapper.readTree(json);
		} catch (JacksonException e) {
			throw new InterchangeFormatException(null, "Unable to parse JSON: " + e.getOriginalMessage(), e);
		}
		return deserialize(tree);
	}

	private ObjectNode write(MathNode node, int depth) {
		if (depth > settings.maxDepth()) {
			throw new DepthExceededException(node.id(), settings.maxDepth());
		}
		checkConstraints(node);
		LOGGER.trace("Writing {} \"{}\" at depth {}", node.content().getClass().getSimpleName(), node.id(), depth);
		return node.content().accept(new NodeWriter(node, depth));
	}

	private void checkConstraints(MathNode node) {
		for (ValidationIssue issue : NodeConstraints.check(node)) {
			if (issue.severity() == Severity.ERROR) {
				throw issue.asException();
			} else if (issue.constraint() == RAGGED_MATRIX && settings.raggedMatrixPolicy() == REJECT) {
				throw issue.asException();
			} else {
				LOGGER.warn("Serializing despite {}", issue);
			}
		}
	}

	/**
	 * Produces the object for one node. The {@code "type"} and {@code "id"} members
	 * are written on construction, so they always precede the variant's fields.
	 */
	private final class NodeWriter implements MathNodeContent.Visitor<ObjectNode> {
		final String nodeId;
		final int depth;
		final ObjectNode out;

		NodeWriter(MathNode node, int depth) {
			this.nodeId = node.id();
			this.depth = depth;
			this.out = mapper.createObjectNode();
			out.put("type", WireTags.typeTagFor(node.content(), nodeId));
			out.put("id", nodeId);
		}

		@Override
		public ObjectNode visit(Empty content) {
			return out;
		}

		@Override
		public ObjectNode visit(Text content) {
			out.put("text", content.text());
			return out;
		}

		@Override
		public ObjectNode visit(StringLiteral content) {
			out.put("text", content.text());
			return out;
		}

		@Override
		public ObjectNode visit(Bracketed content) {
			putNode("inner", content.inner());
			out.put("style", BRACKET_STYLES.tagFor(content.style(), nodeId));
			out.put("size", WireTags.bracketSizeTagFor(content.size(), nodeId));
			return out;
		}

		@Override
		public ObjectNode visit(Matrix content) {
			ArrayNode rows = out.putArray("rows");
			for (List<MathNode> row : content.rows()) {
				ArrayNode rowArray = rows.addArray();
				for (MathNode cell : row) {
					rowArray.add(child(cell));
				}
			}
			return out;
		}

		@Override
		public ObjectNode visit(Multiplications content) {
			ArrayNode terms = out.putArray("terms");
			for (Multiplications.Term term : content.terms()) {
				ObjectNode termObject = terms.addObject();
				termObject.put("operator", WireTags.operatorKindFor(term.operator(), nodeId));
				termObject.put("symbol", WireTags.operatorSymbolFor(term.operator(), nodeId));
				termObject.set("node", child(term.node()));
			}
			return out;
		}

		@Override
		public ObjectNode visit(Additions content) {
			ArrayNode terms = out.putArray("terms");
			for (Additions.Term term : content.terms()) {
				ObjectNode termObject = terms.addObject();
				termObject.put("operator", ADD_OR_SUB_OPERATORS.tagFor(term.operator(), nodeId));
				termObject.set("node", child(term.node()));
			}
			return out;
		}

		@Override
		public ObjectNode visit(Division content) {
			putNode("numerator", content.numerator());
			putNode("denominator", content.denominator());
			out.put("style", DIVISION_STYLES.tagFor(content.style(), nodeId));
			return out;
		}

		@Override
		public ObjectNode visit(Fraction content) {
			putNode("numerator", content.numerator());
			putNode("denominator", content.denominator());
			return out;
		}

		@Override
		public ObjectNode visit(SumNotation content) {
			putNode("summand", content.summand());
			putNode("variable", content.variable());
			putNode("lower_limit", content.lowerLimit());
			putNode("upper_limit", content.upperLimit());
			return out;
		}

		@Override
		public ObjectNode visit(ProductNotation content) {
			putNode("multiplicand", content.multiplicand());
			putNode("variable", content.variable());
			putNode("lower_limit", content.lowerLimit());
			putNode("upper_limit", content.upperLimit());
			return out;
		}

		@Override
		public ObjectNode visit(Power content) {
			putNode("base", content.base());
			putNode("exponent", content.exponent());
			return out;
		}

		@Override
		public ObjectNode visit(UnaryPrefixOperation content) {
			putNode("parameter", content.parameter());
			putNode("operator", content.operator());
			return out;
		}

		@Override
		public ObjectNode visit(UnaryPostfixOperation content) {
			putNode("parameter", content.parameter());
			putNode("operator", content.operator());
			return out;
		}

		@Override
		public ObjectNode visit(Abs content) {
			putNode("parameter", content.parameter());
			return out;
		}

		@Override
		public ObjectNode visit(FunctionCall content) {
			putNode("name", content.name());
			putNodes("parameters", content.parameters());
			return out;
		}

		@Override
		public ObjectNode visit(Quantity content) {
			out.put("number", content.number());
			putNode("scientific_notation", content.scientificNotation());
			putNode("unit", content.unit());
			return out;
		}

		@Override
		public ObjectNode visit(ScientificNotation content) {
			putNode("magnitude", content.magnitude());
			out.put("style", SCIENTIFIC_NOTATION_STYLES.tagFor(content.style(), nodeId));
			return out;
		}

		@Override
		public ObjectNode visit(IdentifierContent content) {
			Identifier identifier = content.identifier();
			out.put("body", identifier.body());
			putScriptGroup("pre_script", identifier.preScript());
			putMidScriptGroup(identifier.midScript());
			putScriptGroup("post_script", identifier.postScript());
			out.put("primes", identifier.primes());
			out.put("is_function", identifier.isFunction());
			return out;
		}

		@Override
		public ObjectNode visit(Unit content) {
			putNode("original_form", content.originalForm());
			putNode("flattened_form", content.flattenedForm());
			return out;
		}

		@Override
		public ObjectNode visit(Relationship content) {
			putNode("lhs", content.lhs());
			putNode("rhs", content.rhs());
			RelationOperator operator = content.operator();
			if (operator instanceof RelationOperator.Standard s) {
				out.put("operator", RELATION_OPERATORS.tagFor(s, nodeId));
			} else if (operator instanceof RelationOperator.Custom c) {
				out.putObject("operator").put("custom", c.text());
			} else {
				throw new UnmappedVariantException(nodeId, operator);
			}
			return out;
		}

		@Override
		public ObjectNode visit(UnaryRelationship content) {
			putNode("subject", content.subject());
			UnaryRelationOperator predicate = content.predicate();
			if (predicate instanceof UnaryRelationOperator.Standard s) {
				out.put("predicate", UNARY_RELATION_OPERATORS.tagFor(s, nodeId));
			} else if (predicate instanceof UnaryRelationOperator.Custom c) {
				out.putObject("predicate").put("custom", c.text());
			} else {
				throw new UnmappedVariantException(nodeId, predicate);
			}
			return out;
		}

		@Override
		public ObjectNode visit(VariableDefinition content) {
			putNode("name", content.name());
			putNode("definition", content.definition());
			return out;
		}

		@Override
		public ObjectNode visit(FunctionDefinition content) {
			putNode("custom_function", content.customFunction());
			putNode("definition", content.definition());
			return out;
		}

		@Override
		public ObjectNode visit(Limit content) {
			putNode("function", content.function());
			out.put("variable", content.variable());
			putNode("approaching_value", content.approachingValue());
			return out;
		}

		@Override
		public ObjectNode visit(Differential content) {
			putNode("target", content.target());
			putNode("order", content.order());
			out.put("diff_style", DIFFERENTIAL_STYLES.tagFor(content.style(), nodeId));
			return out;
		}

		@Override
		public ObjectNode visit(Integration content) {
			putNode("integrand", content.integrand());
			ArrayNode differentials = out.putArray("differentials");
			for (Integration.IntegralDifferential d : content.differentials()) {
				ObjectNode entry = differentials.addObject();
				entry.set("differential", child(d.differential()));
				entry.set("lower_bound", optionalChild(d.lowerBound()));
				entry.set("upper_bound", optionalChild(d.upperBound()));
			}
			putNode("domain", content.domain());
			return out;
		}

		@Override
		public ObjectNode visit(QuantifiedExpression content) {
			out.put("quantifier", QUANTIFIERS.tagFor(content.quantifier(), nodeId));
			putNodes("variables", content.variables());
			putNode("domain", content.domain());
			putNode("predicate", content.predicate());
			return out;
		}

		@Override
		public ObjectNode visit(And content) {
			putNodes("operands", content.operands());
			return out;
		}

		@Override
		public ObjectNode visit(Or content) {
			putNodes("operands", content.operands());
			return out;
		}

		@Override
		public ObjectNode visit(Not content) {
			putNode("operand", content.operand());
			return out;
		}

		@Override
		public ObjectNode visit(True content) {
			return out;
		}

		@Override
		public ObjectNode visit(False content) {
			return out;
		}

		@Override
		public ObjectNode visit(Unknown content) {
			JsonNode payload;
			try {
				payload = mapper.readTree(content.payload());
			} catch (JacksonException e) {
				throw new InterchangeFormatException(nodeId, "Payload of unknown variant \"" + content.type() + "\" is not valid JSON", e);
			}
			if (!payload.isObject()) {
				throw new InterchangeFormatException(nodeId, "Payload of unknown variant \"" + content.type() + "\" is not a JSON object");
			}
			// Our type and id take precedence over any in the payload
			for (var member : payload.properties()) {
				if (!out.has(member.getKey())) {
					out.set(member.getKey(), member.getValue());
				}
			}
			LOGGER.debug("Re-emitting unknown variant \"{}\" in node \"{}\"", content.type(), nodeId);
			return out;
		}

		private ObjectNode child(MathNode node) {
			return write(node, depth + 1);
		}

		private JsonNode optionalChild(@Nullable MathNode node) {
			return (node == null) ? out.nullNode() : child(node);
		}

		private void putNode(String name, @Nullable MathNode node) {
			out.set(name, optionalChild(node));
		}

		private void putNodes(String name, List<MathNode> nodes) {
			ArrayNode array = out.putArray(name);
			for (MathNode node : nodes) {
				array.add(child(node));
			}
		}

		private void putScriptGroup(String name, @Nullable ScriptGroup group) {
			if (group == null) {
				out.putNull(name);
			} else {
				ObjectNode groupObject = out.putObject(name);
				ArrayNode subscripts = groupObject.putArray("subscripts");
				for (MathNode node : group.subscripts()) {
					subscripts.add(child(node));
				}
				ArrayNode superscripts = groupObject.putArray("superscripts");
				for (MathNode node : group.superscripts()) {
					superscripts.add(child(node));
				}
			}
		}

		private void putMidScriptGroup(@Nullable MidScriptGroup group) {
			if (group == null) {
				out.putNull("mid_script");
			} else {
				ObjectNode groupObject = out.putObject("mid_script");
				ArrayNode over = groupObject.putArray("super_script");
				for (MidScriptMark mark : group.superScript()) {
					over.add(WireTags.midScriptMarkTagFor(mark, nodeId));
				}
				ArrayNode under = groupObject.putArray("sub_script");
				for (MidScriptMark mark : group.subScript()) {
					under.add(WireTags.midScriptMarkTagFor(mark, nodeId));
				}
			}
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JacksonMathSerializer.class);
}
