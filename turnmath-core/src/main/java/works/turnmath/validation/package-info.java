/**
 * Structural checks that the type system can't express.
 * <p>
 * {@link works.turnmath.validation.NodeConstraints} checks one node;
 * {@link works.turnmath.validation.TreeValidator} checks a whole tree.
 * Serializers apply the node checks as they go.
 */
package works.turnmath.validation;
