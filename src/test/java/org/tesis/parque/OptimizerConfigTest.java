package org.tesis.parque;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class OptimizerConfigTest {

    @Test
    @DisplayName("Defaults")
    void defaults() {
        OptimizerConfig c = OptimizerConfig.defaults();
        assertEquals(24, c.getPopulationSize());
        assertEquals(40, c.getMaxGenerations());
        assertEquals(0.9, c.getCrossoverRate());
        assertEquals(0.2, c.getMutationRate());
        assertEquals(2, c.getTournamentSize());
        assertEquals(8, c.getStagnationWindow());
        assertEquals(1e-4, c.getStagnationEpsilon());
        assertEquals(42L, c.getSeed());
        assertEquals(0L, c.getBudgetMillis());
        assertTrue(c.getThreads() >= 1);
    }

    @Test
    @DisplayName("optimizer.* properties override defaults, blanks are ignored")
    void fromProperties() {
        Properties p = new Properties();
        p.setProperty("optimizer.population", "16");
        p.setProperty("optimizer.generations", " 10 ");
        p.setProperty("optimizer.threads", "4");
        p.setProperty("optimizer.seed", "7");
        p.setProperty("optimizer.budgetMillis", "");
        p.setProperty("unrelated.key", "x");
        OptimizerConfig c = OptimizerConfig.fromProperties(p);
        assertEquals(16, c.getPopulationSize());
        assertEquals(10, c.getMaxGenerations());
        assertEquals(4, c.getThreads());
        assertEquals(7L, c.getSeed());
        assertEquals(0L, c.getBudgetMillis());
    }

    @Test
    @DisplayName("Out-of-range settings are rejected")
    void validation() {
        assertThrows(IllegalArgumentException.class, () -> OptimizerConfig.builder().populationSize(1).build());
        assertThrows(IllegalArgumentException.class, () -> OptimizerConfig.builder().crossoverRate(1.5).build());
        assertThrows(IllegalArgumentException.class, () -> OptimizerConfig.builder().tournamentSize(100).build());
        assertThrows(IllegalArgumentException.class, () -> OptimizerConfig.builder().threads(0).build());
        Properties p = new Properties();
        p.setProperty("optimizer.population", "many");
        assertThrows(NumberFormatException.class, () -> OptimizerConfig.fromProperties(p));
    }
}
