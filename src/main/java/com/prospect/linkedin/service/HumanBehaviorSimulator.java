package com.prospect.linkedin.service;

import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Mouse;
import com.microsoft.playwright.Page;
import com.prospect.linkedin.config.RateLimitConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Randomized, bounded interaction timing.
 * <p>
 * The generators are pure functions of the injected {@link Random}. The effectful helpers only add
 * wall-clock time through the {@link Sleeper} and drive the page they are given.
 */
@Slf4j
@Component
public class HumanBehaviorSimulator {

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis);

        Sleeper THREAD = millis -> {
            try {
                Thread.sleep(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
    }

    public record MousePoint(int x, int y, int steps, Duration dwell) {
    }

    public record ScrollStep(int deltaY, Duration pause) {
    }

    private static final String[] KEYBOARD_ROWS = {"qwertyuiop", "asdfghjkl", "zxcvbnm"};

    private final RateLimitConfig rateLimitConfig;
    private final Random random;
    private final Sleeper sleeper;

    @Autowired
    public HumanBehaviorSimulator(RateLimitConfig rateLimitConfig) {
        this(rateLimitConfig, new Random(), Sleeper.THREAD);
    }

    public HumanBehaviorSimulator(RateLimitConfig rateLimitConfig, Random random, Sleeper sleeper) {
        this.rateLimitConfig = rateLimitConfig;
        this.random = random;
        this.sleeper = sleeper;
    }

    // ==================== GENERATORS ====================

    public Duration nextRequestDelay() {
        return Duration.ofMillis(between(rateLimitConfig.getMinDelayBetweenRequestsMs(),
                rateLimitConfig.getMaxDelayBetweenRequestsMs()));
    }

    /**
     * Zero 70% of the time, otherwise 200-1000ms.
     */
    public Duration nextHesitation() {
        if (random.nextDouble() < 0.7) {
            return Duration.ZERO;
        }
        return Duration.ofMillis(between(200, 1000));
    }

    /**
     * 40-60ms per character, clamped to [1s, 5s].
     */
    public Duration readingTime(int textLength) {
        long perChar = between(40, 60);
        long ms = Math.max(0, textLength) * perChar;
        return Duration.ofMillis(Math.min(5000, Math.max(1000, ms)));
    }

    /**
     * One delay per character: 40-120ms, with a 10% chance of an extra 200-500ms pause.
     */
    public List<Duration> keystrokeDelays(String text) {
        List<Duration> delays = new ArrayList<>();
        if (text == null) {
            return delays;
        }
        for (int i = 0; i < text.length(); i++) {
            long ms = between(40, 120);
            if (random.nextDouble() < 0.1) {
                ms += between(200, 500);
            }
            delays.add(Duration.ofMillis(ms));
        }
        return delays;
    }

    public List<MousePoint> mouseMovements(int count) {
        int points = Math.max(0, count) + random.nextInt(3);
        List<MousePoint> moves = new ArrayList<>(points);
        for (int i = 0; i < points; i++) {
            moves.add(new MousePoint(
                    (int) between(100, 900),
                    (int) between(100, 700),
                    10,
                    Duration.ofMillis(between(100, 300))));
        }
        return moves;
    }

    /**
     * 2-4 downward scrolls, sometimes followed by a small scroll back up.
     */
    public List<ScrollStep> scrollSequence() {
        int scrolls = (int) between(2, 4);
        List<ScrollStep> steps = new ArrayList<>(scrolls + 1);
        for (int i = 0; i < scrolls; i++) {
            steps.add(new ScrollStep((int) between(200, 500), Duration.ofMillis(between(300, 800))));
        }
        if (random.nextBoolean()) {
            steps.add(new ScrollStep(-150, Duration.ofMillis(between(300, 800))));
        }
        return steps;
    }

    // ==================== EFFECTS ====================

    public void pause(Duration duration) {
        if (duration != null && !duration.isZero() && !duration.isNegative()) {
            sleeper.sleep(duration.toMillis());
        }
    }

    public void pause(long minMs, long maxMs) {
        pause(Duration.ofMillis(between(minMs, maxMs)));
    }

    public void hesitate() {
        pause(nextHesitation());
    }

    public void read(int textLength) {
        pause(readingTime(textLength));
    }

    /**
     * Type character by character. Letters get a 5% chance of an adjacent-key typo that is corrected
     * with a backspace.
     */
    public void typeHumanLike(Locator locator, String text) {
        if (text == null || text.isEmpty()) {
            return;
        }

        List<Duration> delays = keystrokeDelays(text);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);

            if (Character.isLetter(c) && random.nextInt(100) < 5) {
                locator.pressSequentially(String.valueOf(adjacentKey(c)));
                pause(100, 300);
                locator.press("Backspace");
                pause(50, 150);
            }

            locator.pressSequentially(String.valueOf(c));
            pause(delays.get(i));
        }
        log.debug("Typed {} characters", text.length());
    }

    public void moveMouse(Page page, int count) {
        for (MousePoint point : mouseMovements(count)) {
            page.mouse().move(point.x(), point.y(), new Mouse.MoveOptions().setSteps(point.steps()));
            pause(point.dwell());
        }
    }

    public void scroll(Page page) {
        for (ScrollStep step : scrollSequence()) {
            page.mouse().wheel(0, step.deltaY());
            pause(step.pause());
        }
    }

    char adjacentKey(char correct) {
        char lower = Character.toLowerCase(correct);
        for (String row : KEYBOARD_ROWS) {
            int col = row.indexOf(lower);
            if (col >= 0) {
                int neighbour = col == 0 ? 1 : (col == row.length() - 1 ? col - 1 : col + (random.nextBoolean() ? 1 : -1));
                char wrong = row.charAt(neighbour);
                return Character.isUpperCase(correct) ? Character.toUpperCase(wrong) : wrong;
            }
        }
        return correct;
    }

    /**
     * Uniform in [min, max], inclusive.
     */
    private long between(long min, long max) {
        if (max <= min) {
            return min;
        }
        return min + (long) (random.nextDouble() * (max - min + 1));
    }
}
