package io.github.yok.vqe.app;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.vqe.core.affinity.AffinityThreshold;
import io.github.yok.vqe.core.affinity.AffinityVerdict;
import io.github.yok.vqe.core.solver.OptimizerConfig;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest(properties = {"vqe.optimizer.max-iterations=2",
        "vqe.optimizer.stochastic.calibration-steps=2",
        "vqe.reference.exact-diagonalization=false"})
@ActiveProfiles("spsa")
class VqePropertiesTest {

    @Autowired
    private VqeProperties properties;

    @Test
    void spsaProfileOverridesDefaults() {
        assertEquals(3, properties.getAnsatz().getRepetitions());
        assertEquals(OptimizerConfig.Strategy.STOCHASTIC_PERTURBATION,
                properties.getOptimizer().getStrategy());

        OptimizerConfig config = properties.getOptimizer().toConfig();
        assertEquals(2, config.getMaxIterations());
        assertEquals(2, config.getCalibrationSteps());
        assertNull(config.getInitialPoint());
    }

    @Test
    void thresholdsEndWithOtherwise() {
        List<AffinityThreshold> thresholds = properties.getAffinity().toThresholds();

        assertEquals(3, thresholds.size());
        assertEquals(AffinityThreshold.of(-3.0, AffinityVerdict.EXTREME), thresholds.get(0));
        assertEquals(AffinityThreshold.of(-2.5, AffinityVerdict.HIGH), thresholds.get(1));
        assertEquals(Double.POSITIVE_INFINITY, thresholds.get(2).getBound());
        assertEquals(AffinityVerdict.MODERATE, thresholds.get(2).getVerdict());
    }

    @Test
    void summaryListsSections() {
        String summary = properties.toMultilineString();
        assertTrue(summary.contains("hamiltonian"), summary);
        assertTrue(summary.contains("optimizer"), summary);
    }
}
