package io.github.yok.vqe.core.solver;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.vqe.core.ConstructionException;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class InitialPointGeneratorTest {

    @Test
    void explicitPointIsUsedAsIs() {
        OptimizerConfig config = OptimizerConfig.builder().initialPoint(List.of(0.1, -0.2, 0.3)).build();
        assertArrayEquals(new double[] {0.1, -0.2, 0.3}, InitialPointGenerator.generate(config, 3));
    }

    @Test
    void seededPointIsReproducibleAndInRange() {
        OptimizerConfig config = OptimizerConfig.builder().initialPointSeed(42L).build();
        double[] first = InitialPointGenerator.generate(config, 16);
        double[] second = InitialPointGenerator.generate(config, 16);

        assertArrayEquals(first, second);
        for (double v : first) {
            assertTrue(v >= InitialPointGenerator.LOWER && v <= InitialPointGenerator.UPPER);
        }

        double[] other = InitialPointGenerator.generate(
                OptimizerConfig.builder().initialPointSeed(43L).build(), 16);
        assertFalse(Arrays.equals(first, other));
    }

    @Test
    void explicitPointMustMatchParameterCount() {
        OptimizerConfig config = OptimizerConfig.builder().initialPoint(List.of(0.1)).build();
        assertThrows(ConstructionException.class, () -> InitialPointGenerator.generate(config, 2));
    }
}
