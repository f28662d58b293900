package de.upb.sse.casegen.configuration;

import lombok.*;

@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class CaseGenConfiguration {
    public static final int MIN_RANDOM_CASES = 1;
    public static final int MAX_RANDOM_CASES = 10;

    private int numRandomCases = 5;
    private int perCallDeadlineSeconds = 3;
    private boolean preemptiveDeadline = true;

    // null draws a fresh seed per run
    private Long randomSeed = null;

    public CaseGenConfiguration(int numRandomCases, Long randomSeed) {
        setNumRandomCases(numRandomCases);
        this.randomSeed = randomSeed;
    }

    public void setNumRandomCases(int numRandomCases) {
        if (numRandomCases < MIN_RANDOM_CASES || numRandomCases > MAX_RANDOM_CASES) {
            throw new IllegalArgumentException("numRandomCases must be within [" + MIN_RANDOM_CASES + ", "
                    + MAX_RANDOM_CASES + "], got " + numRandomCases);
        }
        this.numRandomCases = numRandomCases;
    }

    public void setPerCallDeadlineSeconds(int perCallDeadlineSeconds) {
        if (perCallDeadlineSeconds <= 0) {
            throw new IllegalArgumentException("perCallDeadlineSeconds must be positive, got " + perCallDeadlineSeconds);
        }
        this.perCallDeadlineSeconds = perCallDeadlineSeconds;
    }
}
