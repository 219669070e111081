package works.turnmath.interchange;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.turnmath.MathNode;

final class Batches {
	private Batches() { }

	static <V> List<SerializationResult<V>> serializeAll(MathTreeSerializer<V> serializer, List<MathNode> nodes) {
		List<MathNode> trees = List.copyOf(nodes); // Rejects null elements up front
		List<SerializationResult<V>> results = new ArrayList<>(trees.size());
		int failures = 0;
		for (MathNode node : trees) {
			SerializationResult<V> result = serializer.trySerialize(node);
			if (result instanceof SerializationResult.Failure<V> f) {
				++failures;
				LOGGER.debug("Failed to serialize tree \"{}\": {}", node.id(), f.error().getMessage());
			}
			results.add(result);
		}
		LOGGER.debug("{} serialized {} trees with {} failures", serializer.getClass().getSimpleName(), trees.size(), failures);
		return results;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Batches.class);
}
