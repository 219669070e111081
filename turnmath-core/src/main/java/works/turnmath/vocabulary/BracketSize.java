package works.turnmath.vocabulary;

/**
 * How tall the delimiters of a bracketed expression are drawn.
 */
public sealed interface BracketSize permits BracketSize.Fixed, BracketSize.Sized {
	BracketSize NORMAL = Fixed.NORMAL;
	BracketSize AUTO = Fixed.AUTO;

	static Sized sized(int level) {
		return new Sized(level);
	}

	enum Fixed implements BracketSize {
		NORMAL,

		/**
		 * Grows to fit the contents, like <code>\left</code> and <code>\right</code>.
		 */
		AUTO,
	}

	/**
	 * An explicit size step: 1 through 4 correspond to
	 * <code>\big</code>, <code>\Big</code>, <code>\bigg</code>, and <code>\Bigg</code>.
	 */
	record Sized(int level) implements BracketSize {
		public static final int MIN_LEVEL = 1;
		public static final int MAX_LEVEL = 4;

		public Sized {
			if (level < MIN_LEVEL || level > MAX_LEVEL) {
				throw new IllegalArgumentException("Bracket size level must be between " + MIN_LEVEL + " and " + MAX_LEVEL + ": " + level);
			}
		}
	}
}
