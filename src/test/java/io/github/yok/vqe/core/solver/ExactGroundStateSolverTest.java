package io.github.yok.vqe.core.solver;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.yok.vqe.core.ConstructionException;
import io.github.yok.vqe.core.linearalgebra.EjmlStateVectorBackend;
import io.github.yok.vqe.core.linearalgebra.EjmlSymmetricEigenDecompositionBackend;
import io.github.yok.vqe.core.operator.PauliOperator;
import java.util.List;
import org.junit.jupiter.api.Test;

class ExactGroundStateSolverTest {

    private final ExactGroundStateSolver solver = new ExactGroundStateSolver(
            new EjmlStateVectorBackend(), new EjmlSymmetricEigenDecompositionBackend());

    @Test
    void singleQubitPaulis() {
        assertEquals(-1.0, solver.groundStateEnergy(op(List.of("Z"), List.of(1.0))), 1e-10);
        assertEquals(-1.0, solver.groundStateEnergy(op(List.of("Y"), List.of(1.0))), 1e-10);
        assertEquals(-2.0, solver.groundStateEnergy(op(List.of("X"), List.of(-2.0))), 1e-10);
    }

    @Test
    void exchangeCoupling() {
        // (XX + YY)/2 の固有値は ±1 と 0（2 重）
        assertEquals(-1.0,
                solver.groundStateEnergy(op(List.of("XX", "YY"), List.of(0.5, 0.5))), 1e-10);
    }

    @Test
    void mproHamiltonian() {
        PauliOperator mpro = op(
                List.of("IIII", "ZIII", "IZII", "IIZI", "IIIZ", "ZZII", "ZIZI", "ZIIZ", "IZZI",
                        "IZIZ", "IIZZ", "XXXX", "YYYY"),
                List.of(-2.1, 0.5, 0.4, 0.5, 0.4, -0.1, -0.05, -0.05, -0.1, -0.05, -0.1, 0.05,
                        0.05));

        // |0000⟩(-0.75) と |1111⟩(-4.35) が 0.1 で結合するブロックの最小固有値
        double expected = -2.55 - Math.sqrt(1.8 * 1.8 + 0.01);
        assertEquals(expected, solver.groundStateEnergy(mpro), 1e-9);
    }

    @Test
    void rejectsTooManyQubits() {
        assertThrows(ConstructionException.class,
                () -> solver.groundStateEnergy(op(List.of("IIIIIIIIIII"), List.of(1.0))));
    }

    private static PauliOperator op(List<String> paulis, List<Double> coefficients) {
        return PauliOperator.build(paulis, coefficients);
    }
}
