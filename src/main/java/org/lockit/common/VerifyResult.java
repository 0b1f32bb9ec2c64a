package org.lockit.common;

/**
 * Outcome of a window search. {@code delta} is the counter offset of the match and is
 * only meaningful when {@code matched} is true.
 */
public record VerifyResult(boolean matched, int delta) {
	public static final VerifyResult NO_MATCH = new VerifyResult(false, 0);

	public static VerifyResult at(int delta) {
		return new VerifyResult(true, delta);
	}

	/** Matched without any clock drift. */
	public boolean isExact() {
		return matched && delta == 0;
	}
}
