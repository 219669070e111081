/**
 * The seam between expression trees and their interchange representation.
 * <p>
 * {@link works.turnmath.interchange.MathTreeSerializer} is implemented by each
 * serialization technology; {@link works.turnmath.interchange.WireTags} holds the
 * strings they all share, so that every implementation writes the same format.
 */
package works.turnmath.interchange;
