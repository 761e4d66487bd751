package org.snek.cli.commands;

import org.snek.runtime.GameController;
import org.snek.runtime.model.Direction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A scripted sequence of player input and elapsed time.
 * <p>
 * The textual form is a comma- or whitespace-separated list of tokens: a direction
 * ({@code L}, {@code R}, {@code U}, {@code D} or the full name) requests a turn,
 * {@code t<seconds>} advances the clock, e.g. {@code "R, t0.25, t0.25, D, t1"}.
 * A token may carry a repeat count suffix, {@code t0.25*8}, of at most
 * {@value #MAX_REPEAT}.
 */
public final class ReplayScript {

    static final int MAX_REPEAT = 100_000;

    /**
     * One scripted event: either a direction request or a time advance.
     *
     * @param direction The requested direction, or {@code null} for a time advance.
     * @param seconds The time to advance, ignored for direction requests.
     */
    public record Step(Direction direction, double seconds) {
        public boolean isTurn() {
            return direction != null;
        }
    }

    private final List<Step> steps;

    private ReplayScript(List<Step> steps) {
        this.steps = Collections.unmodifiableList(steps);
    }

    /**
     * Parses the textual form.
     *
     * @param text The script.
     * @return The parsed script.
     * @throws IllegalArgumentException if a token cannot be parsed.
     */
    public static ReplayScript parse(String text) {
        List<Step> steps = new ArrayList<>();
        if (text == null) {
            return new ReplayScript(steps);
        }
        for (String raw : text.split("[,\\s]+")) {
            if (raw.isEmpty()) {
                continue;
            }
            String token = raw;
            int repeat = 1;
            int star = raw.indexOf('*');
            if (star >= 0) {
                token = raw.substring(0, star);
                repeat = parseRepeat(raw, raw.substring(star + 1));
            }
            Step step = parseStep(token);
            for (int i = 0; i < repeat; i++) {
                steps.add(step);
            }
        }
        return new ReplayScript(steps);
    }

    private static int parseRepeat(String raw, String count) {
        try {
            int n = Integer.parseInt(count);
            if (n < 1 || n > MAX_REPEAT) {
                throw new IllegalArgumentException(
                    "Repeat count must be between 1 and " + MAX_REPEAT + " in token '" + raw + "'");
            }
            return n;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid repeat count in token '" + raw + "'", e);
        }
    }

    private static Step parseStep(String token) {
        if (token.length() > 1 && (token.charAt(0) == 't' || token.charAt(0) == 'T')) {
            try {
                double seconds = Double.parseDouble(token.substring(1));
                if (!(seconds >= 0) || Double.isInfinite(seconds)) {
                    throw new IllegalArgumentException("Time advance must be non-negative in token '" + token + "'");
                }
                return new Step(null, seconds);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid time advance '" + token + "'", e);
            }
        }
        return new Step(Direction.fromToken(token), 0.0);
    }

    public List<Step> steps() {
        return steps;
    }

    /**
     * Feeds every step into the controller in order.
     *
     * @param controller The game to drive.
     * @return The number of refused direction requests.
     */
    public int playOn(GameController controller) {
        int refused = 0;
        for (Step step : steps) {
            if (step.isTurn()) {
                if (!controller.requestDirection(step.direction()).isAccepted()) {
                    refused++;
                }
            } else {
                controller.advance(step.seconds());
            }
        }
        return refused;
    }
}
