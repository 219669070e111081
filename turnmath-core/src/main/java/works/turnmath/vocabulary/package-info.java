/**
 * Fixed vocabularies used by {@link works.turnmath.MathNodeContent} variants:
 * bracket styles and sizes, arithmetic operator symbols, relation operators,
 * quantifiers, and so on.
 * <p>
 * Where a vocabulary is open-ended, it is a sealed interface with a
 * {@code Standard} enum of built-in cases and a {@code Custom} record
 * carrying free-form text, so that exhaustiveness checks still see every structural case.
 */
package works.turnmath.vocabulary;
