package dev.pekelund.medinterp.pipeline;

import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Produces identifiers of the form {@code report_<epochMillis>_<9 base-36 characters>}.
 */
public class ReportIdGenerator implements Supplier<String> {

    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int SUFFIX_LENGTH = 9;

    private final Clock clock;

    public ReportIdGenerator(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String get() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder id = new StringBuilder("report_").append(clock.millis()).append('_');
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            id.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return id.toString();
    }
}
