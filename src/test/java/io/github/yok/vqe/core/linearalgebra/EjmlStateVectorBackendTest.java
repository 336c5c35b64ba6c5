package io.github.yok.vqe.core.linearalgebra;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.yok.vqe.core.ConstructionException;
import io.github.yok.vqe.core.ansatz.AnsatzSpec;
import io.github.yok.vqe.core.ansatz.EntanglementLayout;
import io.github.yok.vqe.core.operator.PauliTerm;
import org.ejml.data.Complex_F64;
import org.ejml.data.ZMatrixRMaj;
import org.junit.jupiter.api.Test;

class EjmlStateVectorBackendTest {

    private static final double EPS = 1e-12;

    private final EjmlStateVectorBackend backend = new EjmlStateVectorBackend();

    @Test
    void zeroParametersLeaveGroundBasisState() {
        AnsatzSpec spec = AnsatzSpec.of(4, "ry", "cx", 2);
        ZMatrixRMaj state = backend.prepareState(spec, new double[12]);

        assertEquals(16, state.getNumRows());
        assertEquals(1.0, state.getReal(0, 0), EPS);
        for (int i = 1; i < 16; i++) {
            assertEquals(0.0, state.getReal(i, 0), EPS);
            assertEquals(0.0, state.getImag(i, 0), EPS);
        }
    }

    @Test
    void singleQubitRotationsGiveBlochExpectations() {
        double theta = 0.7;
        double[] params = {theta};

        ZMatrixRMaj ry = backend.prepareState(AnsatzSpec.of(1, "ry", "cx", 0), params);
        assertEquals(Math.cos(theta), backend.expectation(ry, new PauliTerm("Z", 1.0)).real, EPS);
        assertEquals(Math.sin(theta), backend.expectation(ry, new PauliTerm("X", 1.0)).real, EPS);

        ZMatrixRMaj rx = backend.prepareState(AnsatzSpec.of(1, "rx", "cx", 0), params);
        assertEquals(Math.cos(theta), backend.expectation(rx, new PauliTerm("Z", 1.0)).real, EPS);
        assertEquals(-Math.sin(theta), backend.expectation(rx, new PauliTerm("Y", 1.0)).real,
                EPS);

        ZMatrixRMaj rz = backend.prepareState(AnsatzSpec.of(1, "rz", "cx", 0), params);
        assertEquals(1.0, backend.expectation(rz, new PauliTerm("Z", 1.0)).real, EPS);
        assertEquals(0.0, backend.expectation(rz, new PauliTerm("X", 1.0)).real, EPS);
    }

    @Test
    void cxPreparesBellState() {
        // RY(π/2) を量子ビット 0 に作用させてから CX(0,1)
        double[] params = {Math.PI / 2, 0.0, 0.0, 0.0};
        ZMatrixRMaj bell = backend.prepareState(AnsatzSpec.of(2, "ry", "cx", 1), params);

        assertEquals(1.0, backend.expectation(bell, new PauliTerm("ZZ", 1.0)).real, EPS);
        assertEquals(1.0, backend.expectation(bell, new PauliTerm("XX", 1.0)).real, EPS);
        assertEquals(-1.0, backend.expectation(bell, new PauliTerm("YY", 1.0)).real, EPS);
        assertEquals(0.0, backend.expectation(bell, new PauliTerm("IZ", 1.0)).real, EPS);
    }

    @Test
    void czPreparesGraphState() {
        double[] params = {Math.PI / 2, Math.PI / 2, 0.0, 0.0};
        ZMatrixRMaj graph = backend.prepareState(
                AnsatzSpec.of(2, "ry", "cz", 1, EntanglementLayout.LINEAR), params);

        assertEquals(1.0, backend.expectation(graph, new PauliTerm("XZ", 1.0)).real, EPS);
        assertEquals(1.0, backend.expectation(graph, new PauliTerm("ZX", 1.0)).real, EPS);
        assertEquals(0.0, backend.expectation(graph, new PauliTerm("XX", 1.0)).real, EPS);
    }

    @Test
    void applyPauliFlipsAndPhases() {
        ZMatrixRMaj zero = new ZMatrixRMaj(2, 1);
        zero.set(0, 0, 1.0, 0.0);

        ZMatrixRMaj x = backend.applyPauli(new PauliTerm("X", 1.0), zero);
        assertEquals(1.0, x.getReal(1, 0), EPS);

        // Y|0⟩ = i|1⟩
        ZMatrixRMaj y = backend.applyPauli(new PauliTerm("Y", 1.0), zero);
        assertEquals(0.0, y.getReal(1, 0), EPS);
        assertEquals(1.0, y.getImag(1, 0), EPS);
        assertEquals(0.0, y.getImag(0, 0), EPS);
    }

    @Test
    void statesStayNormalized() {
        AnsatzSpec spec = AnsatzSpec.of(4, "rx", "cx", 3, EntanglementLayout.CIRCULAR);
        double[] params = new double[spec.parameterCount()];
        for (int i = 0; i < params.length; i++) {
            params[i] = 0.37 * (i + 1);
        }
        ZMatrixRMaj state = backend.prepareState(spec, params);

        Complex_F64 norm = backend.expectation(state, new PauliTerm("IIII", 1.0));
        assertEquals(1.0, norm.real, EPS);
        assertEquals(0.0, norm.imaginary, EPS);
    }

    @Test
    void rejectsParameterCountMismatch() {
        AnsatzSpec spec = AnsatzSpec.of(4, "ry", "cx", 2);
        assertThrows(ConstructionException.class, () -> backend.prepareState(spec, new double[11]));
    }
}
