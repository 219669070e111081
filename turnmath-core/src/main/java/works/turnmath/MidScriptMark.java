package works.turnmath;

/**
 * One diacritic of a {@link MidScriptGroup}.
 */
public sealed interface MidScriptMark permits MidScriptMark.Accent, MidScriptMark.Dots {
	MidScriptMark HAT = Accent.HAT;
	MidScriptMark TILDE = Accent.TILDE;
	MidScriptMark BAR = Accent.BAR;

	static Dots dots(int count) {
		return new Dots(count);
	}

	enum Accent implements MidScriptMark {
		/** x̂ */
		HAT,
		/** x̃ */
		TILDE,
		/** x̄ */
		BAR,
	}

	/**
	 * One or more dots, as in Newton's notation: ẋ, ẍ.
	 */
	record Dots(int count) implements MidScriptMark {
		public Dots {
			if (count < 1) {
				throw new IllegalArgumentException("Dot count must be positive: " + count);
			}
		}
	}
}
