/**
 * Exceptions thrown by tree checking and serialization.
 * All extend {@link works.turnmath.exceptions.MathTreeException}.
 */
package works.turnmath.exceptions;
