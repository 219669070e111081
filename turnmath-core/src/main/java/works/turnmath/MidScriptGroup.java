package works.turnmath;

import java.util.List;

/**
 * Diacritics drawn directly above ({@code superScript}) or below ({@code subScript})
 * an identifier's body, innermost first.
 */
public record MidScriptGroup(List<MidScriptMark> superScript, List<MidScriptMark> subScript) {
	public MidScriptGroup {
		superScript = List.copyOf(superScript);
		subScript = List.copyOf(subScript);
	}

	public static MidScriptGroup over(MidScriptMark... marks) {
		return new MidScriptGroup(List.of(marks), List.of());
	}

	public static MidScriptGroup under(MidScriptMark... marks) {
		return new MidScriptGroup(List.of(), List.of(marks));
	}
}
