package org.varavin.zones;

import org.junit.jupiter.api.Test;
import org.varavin.zones.entity.Level;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class LevelClustererTest {

    @Test
    void mergesNearbyPricesIntoMeanLevels() {
        List<Level> levels = LevelClusterer.cluster(List.of(101.01, 100.0, 100.04, 101.0, 100.02), 0.05);

        assertEquals(2, levels.size());
        assertEquals(100.02, levels.get(0).price(), 1e-9);
        assertEquals(3, levels.get(0).strength());
        assertEquals(101.005, levels.get(1).price(), 1e-9);
        assertEquals(2, levels.get(1).strength());
    }

    @Test
    void comparesAgainstRunningMeanNotLastPrice() {
        // Каждая цена в пределах допуска от предыдущей, но 100.08 уже далеко от среднего 100.02
        List<Level> levels = LevelClusterer.cluster(List.of(100.0, 100.04, 100.08, 100.12), 0.05);

        assertEquals(2, levels.size());
        assertEquals(2, levels.get(0).strength());
        assertEquals(2, levels.get(1).strength());
    }

    @Test
    void resultDoesNotDependOnInputOrder() {
        Random random = new Random(7);
        List<Double> prices = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            prices.add(100 + random.nextInt(20) * 0.05 + random.nextDouble() * 0.01);
        }
        List<Level> expected = LevelClusterer.cluster(prices, 0.04);

        for (int round = 0; round < 10; round++) {
            List<Double> shuffled = new ArrayList<>(prices);
            Collections.shuffle(shuffled, random);
            assertEquals(expected, LevelClusterer.cluster(shuffled, 0.04));
        }
    }

    @Test
    void emptyInputGivesNoLevels() {
        assertTrue(LevelClusterer.cluster(List.of(), 0.05).isEmpty());
    }

    @Test
    void singlePriceIsOneLevelOfStrengthOne() {
        assertEquals(List.of(new Level(42.0, 1)), LevelClusterer.cluster(List.of(42.0), 0.05));
    }
}
