package works.turnmath.vocabulary;

import static java.util.Objects.requireNonNull;

/**
 * The operator of a binary {@link works.turnmath.MathNodeContent.Relationship Relationship}.
 * <p>
 * The built-in vocabulary is {@link Standard}. Notation it doesn't cover
 * is expressed with {@link Custom}, whose text is carried through serialization verbatim.
 */
public sealed interface RelationOperator permits RelationOperator.Standard, RelationOperator.Custom {

	static Custom custom(String text) {
		return new Custom(text);
	}

	enum Standard implements RelationOperator {
		// Equality and order
		IS_EQUAL,
		EQUAL,
		NOT_EQUAL,
		GREATER,
		LESS,
		GREATER_EQUAL,
		LESS_EQUAL,

		// Geometry
		COLLINEAR,
		PERPENDICULAR,
		/** Expression equivalence */
		EQUIVALENT,
		SIMILAR,
		CONGRUENT,

		// Set theory
		/** ∈ */
		ELEMENT_OF,
		/** ∉ */
		NOT_ELEMENT_OF,
		/** ⊆ */
		SUBSET_OF,
		/** ⊂ */
		PROPER_SUBSET_OF,
		/** ⊇ */
		SUPERSET_OF,
		/** ⊃ */
		PROPER_SUPERSET_OF,
		DISJOINT,
		/** ∪ */
		UNION,
		/** ∩ */
		INTERSECTION,
		/** × */
		CARTESIAN_PRODUCT,
		/** |A| = |B| */
		SAME_CARDINALITY,

		// Number theory
		/** | */
		DIVIDES,
		/** ∤ */
		NOT_DIVIDES,
		/** ≡ (mod n) */
		CONGRUENT_MOD,
		/** ≢ (mod n) */
		NOT_CONGRUENT_MOD,
		ARE_COPRIME,

		// Group theory
		IS_SUBGROUP_OF,
		IS_NORMAL_SUBGROUP_OF,
		/** ≅ */
		IS_ISOMORPHIC_TO,
		IS_HOMOMORPHIC_TO,
		IS_QUOTIENT_OF,
		IS_IN_CENTER_OF,
		ARE_CONJUGATE_IN,

		// Ring theory
		IS_SUBRING_OF,
		IS_IDEAL_OF,

		// Topology
		IS_OPEN_IN,
		IS_CLOSED_IN,
		IS_HOMEOMORPHIC_TO,
		IS_DENSE,

		// Category theory
		IS_MORPHISM_BETWEEN,
		IS_ISOMORPHISM_IN,
		IS_MONOMORPHISM_IN,
		IS_EPIMORPHISM_IN,
		IS_NATURAL_TRANSFORMATION_BETWEEN,
		IS_ADJUNCTION_BETWEEN,
		COMPOSES_TO,

		// Logic
		/** → */
		IMPLIES,
		/** ↔ */
		IFF,
	}

	record Custom(String text) implements RelationOperator {
		public Custom {
			requireNonNull(text);
		}
	}
}
