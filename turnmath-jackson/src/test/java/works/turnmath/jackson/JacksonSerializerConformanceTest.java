package works.turnmath.jackson;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.params.ParameterizedClass;
import org.junit.jupiter.params.provider.MethodSource;
import tools.jackson.databind.JsonNode;
import works.turnmath.testing.SerializerConformanceTest;

import static works.turnmath.jackson.MathSerializerSettings.RaggedMatrixPolicy.REJECT;

@ParameterizedClass
@MethodSource("settings")
public class JacksonSerializerConformanceTest extends SerializerConformanceTest<JsonNode> {
	JacksonSerializerConformanceTest(MathSerializerSettings settings) {
		serializer = new JacksonMathSerializer(settings);
	}

	static List<MathSerializerSettings> settings() {
		return List.of(
			MathSerializerSettings.defaultSettings(),
			MathSerializerSettings.builder()
				.maxDepth(50)
				.raggedMatrixPolicy(REJECT)
				.build()
		);
	}

	@Override
	protected List<String> idsInWrittenOrder(JsonNode value) {
		List<String> result = new ArrayList<>();
		collectIds(value, result);
		return result;
	}

	private static void collectIds(JsonNode json, List<String> ids) {
		if (json.isObject()) {
			if (json.has("type") && json.has("id")) {
				ids.add(json.get("id").asString());
			}
			for (var member : json.properties()) {
				if (!member.getKey().equals("id")) {
					collectIds(member.getValue(), ids);
				}
			}
		} else if (json.isArray()) {
			for (JsonNode element : json) {
				collectIds(element, ids);
			}
		}
	}
}
