package works.turnmath.vocabulary;

import static java.util.Objects.requireNonNull;

/**
 * The predicate of a {@link works.turnmath.MathNodeContent.UnaryRelationship UnaryRelationship}.
 *
 * @see RelationOperator
 */
public sealed interface UnaryRelationOperator permits UnaryRelationOperator.Standard, UnaryRelationOperator.Custom {

	static Custom custom(String text) {
		return new Custom(text);
	}

	enum Standard implements UnaryRelationOperator {
		// Number theory
		IS_PRIME,
		IS_COMPOSITE,

		// Group theory
		HAS_ORDER_IN_GROUP,
		HAS_UNIQUE_INVERSE,

		// Ring theory
		IS_PRIME_IDEAL,
		IS_MAXIMAL_IDEAL,
		IS_PRINCIPAL_IDEAL,
		IS_UNIT,
		IS_IRREDUCIBLE,
		IS_PRIME_ELEMENT,
		IS_FIELD,
		IS_INTEGRAL_DOMAIN,
		/** Unique factorization domain */
		IS_UFD,
		/** Principal ideal domain */
		IS_PID,

		// Topology
		IS_COMPACT,
		IS_CONNECTED,
		IS_CONTINUOUS,
		CONVERGES,
		IS_HAUSDORFF,

		// Category theory
		IS_OBJECT_IN,
		IS_ENDOMORPHISM_IN,
		IS_AUTOMORPHISM_IN,

		// Set theory
		/** Aᶜ */
		COMPLEMENT,
		/** 𝒫(A) */
		POWER_SET,
	}

	record Custom(String text) implements UnaryRelationOperator {
		public Custom {
			requireNonNull(text);
		}
	}
}
