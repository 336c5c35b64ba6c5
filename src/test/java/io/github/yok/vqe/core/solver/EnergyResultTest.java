package io.github.yok.vqe.core.solver;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class EnergyResultTest {

    @Test
    void inputsAreCopiedOnCreation() {
        double[] params = {1.0, 2.0};
        List<Double> history = new ArrayList<>(List.of(1.0));

        EnergyResult result = EnergyResult.of(1.0, 1, true, params, 3,
                OptimizerConfig.Strategy.DETERMINISTIC, history);
        params[0] = 99.0;
        history.add(5.0);

        assertArrayEquals(new double[] {1.0, 2.0}, result.getOptimalParameters());
        assertEquals(List.of(1.0), result.getEnergyHistory());
    }

    @Test
    void accessorsDoNotExposeInternalState() {
        EnergyResult result = EnergyResult.of(1.0, 1, true, new double[] {1.0}, 3,
                OptimizerConfig.Strategy.DETERMINISTIC, List.of(1.0));

        result.getOptimalParameters()[0] = 42.0;

        assertEquals(1.0, result.getOptimalParameters()[0]);
        assertThrows(UnsupportedOperationException.class,
                () -> result.getEnergyHistory().add(2.0));
    }
}
