package io.github.yok.vqe.core.solver;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.vqe.core.ConstructionException;
import io.github.yok.vqe.core.NumericException;
import io.github.yok.vqe.core.ansatz.AnsatzSpec;
import io.github.yok.vqe.core.evaluator.EnergyEvaluator;
import io.github.yok.vqe.core.evaluator.StatevectorEnergyEvaluator;
import io.github.yok.vqe.core.linearalgebra.EjmlStateVectorBackend;
import io.github.yok.vqe.core.linearalgebra.EjmlSymmetricEigenDecompositionBackend;
import io.github.yok.vqe.core.operator.PauliOperator;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class VariationalEnergyOptimizerTest {

    private static final PauliOperator MPRO = PauliOperator.build(
            List.of("IIII", "ZIII", "IZII", "IIZI", "IIIZ", "ZZII", "ZIZI", "ZIIZ", "IZZI", "IZIZ",
                    "IIZZ", "XXXX", "YYYY"),
            List.of(-2.1, 0.5, 0.4, 0.5, 0.4, -0.1, -0.05, -0.05, -0.1, -0.05, -0.1, 0.05, 0.05));

    private static final PauliOperator SINGLE_Z = PauliOperator.build(List.of("Z"), List.of(1.0));

    private final EjmlStateVectorBackend backend = new EjmlStateVectorBackend();

    private final StatevectorEnergyEvaluator evaluator = new StatevectorEnergyEvaluator(backend);

    private final VariationalEnergyOptimizer optimizer = new VariationalEnergyOptimizer(evaluator);

    @Test
    void identityOnlyOperatorConvergesImmediately() {
        PauliOperator identity = PauliOperator.build(List.of("IIII"), List.of(-2.1));
        EnergyResult result = optimizer.minimize(identity, AnsatzSpec.of(4, "ry", "cx", 2),
                OptimizerConfig.builder().build());

        assertEquals(-2.1, result.getValue());
        assertTrue(result.isConverged());
        assertEquals(1, result.getIterationsUsed());
        assertEquals(12, result.getOptimalParameters().length);
    }

    @Test
    void deterministicFindsMinimumOfSingleQubit() {
        OptimizerConfig config = OptimizerConfig.builder().initialPoint(List.of(0.5)).build();
        EnergyResult result = optimizer.minimize(SINGLE_Z, AnsatzSpec.of(1, "ry", "cx", 0), config);

        assertEquals(-1.0, result.getValue(), 1e-9);
        assertTrue(result.isConverged());
        assertEquals(Math.PI, result.getOptimalParameters()[0], 1e-4);
        assertEquals(OptimizerConfig.Strategy.DETERMINISTIC, result.getStrategy());
    }

    @Test
    void deterministicIsReproducible() {
        AnsatzSpec ansatz = AnsatzSpec.of(4, "ry", "cx", 2);
        OptimizerConfig config = OptimizerConfig.builder().build();

        EnergyResult first = optimizer.minimize(MPRO, ansatz, config);
        EnergyResult second = optimizer.minimize(MPRO, ansatz, config);

        assertEquals(first, second);
    }

    @Test
    void deterministicStaysAboveExactGroundEnergy() {
        AnsatzSpec ansatz = AnsatzSpec.of(4, "ry", "cx", 2);
        OptimizerConfig config = OptimizerConfig.builder().build();
        double[] start = InitialPointGenerator.generate(config, ansatz.parameterCount());
        double startEnergy = evaluator.evaluate(MPRO, ansatz, start);

        EnergyResult result = optimizer.minimize(MPRO, ansatz, config);
        double exact = new ExactGroundStateSolver(backend,
                new EjmlSymmetricEigenDecompositionBackend()).groundStateEnergy(MPRO);

        assertTrue(result.getValue() >= exact - 1e-9, "value=" + result.getValue());
        assertTrue(result.getValue() <= startEnergy);
        assertTrue(result.getIterationsUsed() <= config.getMaxIterations());
        assertEquals(result.getValue(),
                evaluator.evaluate(MPRO, ansatz, result.getOptimalParameters()));
    }

    @Test
    void spsaIsReproducibleForSameSeed() {
        AnsatzSpec ansatz = AnsatzSpec.of(4, "ry", "cx", 3);
        OptimizerConfig config = spsa(30).build();

        EnergyResult first = optimizer.minimize(MPRO, ansatz, config);
        EnergyResult second = optimizer.minimize(MPRO, ansatz, config);

        assertEquals(first, second);
    }

    @Test
    void spsaRunsAllIterationsAndReturnsBestSeen() {
        AnsatzSpec ansatz = AnsatzSpec.of(4, "ry", "cx", 3);
        double exact = new ExactGroundStateSolver(backend,
                new EjmlSymmetricEigenDecompositionBackend()).groundStateEnergy(MPRO);

        for (long seed : new long[] {1L, 2L}) {
            EnergyResult result = optimizer.minimize(MPRO, ansatz, spsa(40).seed(seed).build());

            assertFalse(result.isConverged());
            assertEquals(40, result.getIterationsUsed());
            assertEquals(40, result.getEnergyHistory().size());
            assertTrue(result.getValue() <= Collections.min(result.getEnergyHistory()));
            assertTrue(Math.abs(result.getValue()) <= MPRO.coefficientBound() + 1e-12);
            assertTrue(result.getValue() >= exact - 1e-9);
        }
    }

    @Test
    void spsaSeedsChangeTheTrajectory() {
        AnsatzSpec ansatz = AnsatzSpec.of(4, "ry", "cx", 3);
        EnergyResult a = optimizer.minimize(MPRO, ansatz, spsa(20).seed(1L).build());
        EnergyResult b = optimizer.minimize(MPRO, ansatz, spsa(20).seed(2L).build());

        assertNotEquals(a.getEnergyHistory(), b.getEnergyHistory());
    }

    @Test
    void spsaApproachesMinimumOfSingleQubit() {
        OptimizerConfig config = spsa(200).initialPoint(List.of(0.5)).learningRate(0.5)
                .perturbation(0.1).build();
        EnergyResult result = optimizer.minimize(SINGLE_Z, AnsatzSpec.of(1, "ry", "cx", 0), config);

        assertTrue(result.getValue() < -0.999, "value=" + result.getValue());
        assertEquals(OptimizerConfig.Strategy.STOCHASTIC_PERTURBATION, result.getStrategy());
    }

    @Test
    void blockingNeverAcceptsAnIncrease() {
        AnsatzSpec ansatz = AnsatzSpec.of(4, "ry", "cx", 2);
        EnergyResult result = optimizer.minimize(MPRO, ansatz, spsa(30).blocking(true).build());

        List<Double> history = result.getEnergyHistory();
        for (int i = 1; i < history.size(); i++) {
            assertTrue(history.get(i) <= history.get(i - 1), "iteration " + i);
        }
    }

    @Test
    void numericFailurePropagates() {
        EnergyEvaluator failing = (operator, ansatz, parameters) -> {
            throw new NumericException("broken");
        };
        VariationalEnergyOptimizer broken = new VariationalEnergyOptimizer(failing);

        assertThrows(NumericException.class, () -> broken.minimize(MPRO,
                AnsatzSpec.of(4, "ry", "cx", 2), OptimizerConfig.builder().build()));
    }

    @Test
    void invalidConfigurationIsRejectedBeforeEvaluation() {
        AtomicInteger calls = new AtomicInteger();
        EnergyEvaluator counting = (operator, ansatz, parameters) -> {
            calls.incrementAndGet();
            return 0.0;
        };
        VariationalEnergyOptimizer counted = new VariationalEnergyOptimizer(counting);
        AnsatzSpec ansatz = AnsatzSpec.of(4, "ry", "cx", 2);

        assertThrows(ConstructionException.class, () -> counted.minimize(MPRO, ansatz,
                OptimizerConfig.builder().maxIterations(0).build()));
        assertThrows(ConstructionException.class, () -> counted.minimize(MPRO, ansatz,
                OptimizerConfig.builder().initialPoint(List.of(0.1, 0.2)).build()));
        assertThrows(ConstructionException.class, () -> counted.minimize(MPRO,
                AnsatzSpec.of(3, "ry", "cx", 2), OptimizerConfig.builder().build()));
        assertThrows(ConstructionException.class,
                () -> counted.minimize(MPRO, ansatz, spsa(10).perturbation(-1.0).build()));
        assertEquals(0, calls.get());
    }

    private static OptimizerConfig.OptimizerConfigBuilder spsa(int iterations) {
        return OptimizerConfig.builder()
                .strategy(OptimizerConfig.Strategy.STOCHASTIC_PERTURBATION)
                .maxIterations(iterations)
                .calibrationSteps(10);
    }
}
