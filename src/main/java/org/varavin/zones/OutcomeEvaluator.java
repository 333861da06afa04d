package org.varavin.zones;

import org.varavin.zones.entity.Candle;
import org.varavin.zones.entity.Direction;
import org.varavin.zones.entity.Outcome;
import org.varavin.zones.entity.Signal;
import org.varavin.zones.series.CandleSeries;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Оценка сигнала по правилу G0/G1: сначала своя свеча, при неудаче - ещё одна через шаг.
 */
public final class OutcomeEvaluator {

    private OutcomeEvaluator() {
    }

    public static Outcome evaluate(CandleSeries series, Instant time, Direction direction, Duration step) {
        Optional<Candle> g0 = series.at(time);
        if (g0.isEmpty()) {
            return Outcome.NO_DATA;
        }
        if (direction.favours(g0.get())) {
            return Outcome.WIN_G0;
        }
        Optional<Candle> g1 = series.at(time.plus(step));
        if (g1.isEmpty()) {
            return Outcome.LOSS;
        }
        return direction.favours(g1.get()) ? Outcome.WIN_G1 : Outcome.LOSS;
    }

    public static Outcome evaluate(CandleSeries series, Signal signal, Duration step) {
        return evaluate(series, signal.time(), signal.direction(), step);
    }

    public static double accuracy(int wins, int losses) {
        int evaluated = wins + losses;
        return evaluated == 0 ? 0.0 : (double) wins / evaluated;
    }
}
