package io.github.manjago.tidepool.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Aging constants ({@code tidepool.lifecycle}).
 *
 * Stage thresholds are exclusive upper ages: a fish is a baby while
 * {@code age < babyMaxAge}, a juvenile while {@code age < juvenileMaxAge},
 * an adult while {@code age < adultMaxAge}, an elder afterwards.
 */
public record LifecycleSettings(
    int babyMaxAge,
    int juvenileMaxAge,
    int adultMaxAge,
    int baseMaxAge,
    double babySize,
    double adultSize,
    int predatorEncounterWindow,
    boolean trackHistory,
    int historySize
) {

    public LifecycleSettings {
        if (!(0 < babyMaxAge && babyMaxAge < juvenileMaxAge && juvenileMaxAge < adultMaxAge)) {
            throw new IllegalArgumentException(String.format(
                    "Stage thresholds must be strictly increasing and positive: baby=%d, juvenile=%d, adult=%d",
                    babyMaxAge, juvenileMaxAge, adultMaxAge));
        }
        if (babySize <= 0 || adultSize <= 0) {
            throw new IllegalArgumentException("Sizes must be positive");
        }
        if (historySize <= 0) {
            throw new IllegalArgumentException("lifecycle.history-size must be positive: " + historySize);
        }
    }

    public static LifecycleSettings defaults() {
        return fromConfig(ConfigFactory.load().getConfig("tidepool.lifecycle"));
    }

    public static LifecycleSettings fromConfig(Config c) {
        return new LifecycleSettings(
            c.getInt("baby-max-age"),
            c.getInt("juvenile-max-age"),
            c.getInt("adult-max-age"),
            c.getInt("base-max-age"),
            c.getDouble("baby-size"),
            c.getDouble("adult-size"),
            c.getInt("predator-encounter-window"),
            c.getBoolean("track-history"),
            c.getInt("history-size")
        );
    }

    public LifecycleSettings withTrackHistory(boolean value) {
        return new LifecycleSettings(babyMaxAge, juvenileMaxAge, adultMaxAge, baseMaxAge,
                babySize, adultSize, predatorEncounterWindow, value, historySize);
    }
}
