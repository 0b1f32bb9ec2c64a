package org.lockit.common;

/**
 * Counter steps accepted on either side of the current one, and the length of a step.
 * <p>
 * The default of 6 steps of 30 seconds tolerates about three minutes of drift between
 * server and device. Narrow it where replay exposure matters more than lockouts.
 */
public record VerificationWindow(int windowSize, int timeStep) {
	public static final int DEFAULT_WINDOW_SIZE = 6;
	public static final int DEFAULT_TIME_STEP = 30;
	public static final int MAX_WINDOW_SIZE = 1_000;
	public static final VerificationWindow DEFAULT = new VerificationWindow(DEFAULT_WINDOW_SIZE, DEFAULT_TIME_STEP);

	public VerificationWindow {
		if (windowSize < 0 || windowSize > MAX_WINDOW_SIZE)
			throw new IllegalArgumentException("windowSize must be between 0 and " + MAX_WINDOW_SIZE + ", got " + windowSize);
		if (timeStep <= 0)
			throw new IllegalArgumentException("timeStep must be > 0, got " + timeStep);
	}
}
