package io.chronolayout.core.distribution;

public record DensityAnalysis(Level level, double eventsPerDay) {

    public enum Level { LOW, MEDIUM, HIGH }

    static DensityAnalysis of(double eventsPerDay) {
        Level level;
        if (eventsPerDay > 2) level = Level.HIGH;
        else if (eventsPerDay > 0.5) level = Level.MEDIUM;
        else level = Level.LOW;
        return new DensityAnalysis(level, eventsPerDay);
    }
}
