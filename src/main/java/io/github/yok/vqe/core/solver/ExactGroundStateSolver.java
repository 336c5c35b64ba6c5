package io.github.yok.vqe.core.solver;

import io.github.yok.vqe.core.ConstructionException;
import io.github.yok.vqe.core.linearalgebra.EigenDecompositionBackend;
import io.github.yok.vqe.core.linearalgebra.StateVectorBackend;
import io.github.yok.vqe.core.operator.PauliOperator;
import io.github.yok.vqe.core.operator.PauliTerm;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;
import org.ejml.data.ZMatrixRMaj;

/**
 * ハミルトニアンを厳密対角化して、参照用の基底エネルギー（最小固有値）を求めるクラスです。
 *
 * <p>
 * エルミート行列 H = A + iB を実対称行列 [[A, −B], [B, A]] に埋め込んで固有値を求めます。 埋め込み後の固有値は H の固有値がそれぞれ 2 重に並んだものです。
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public final class ExactGroundStateSolver {

    /**
     * 厳密対角化を許す最大量子ビット数です。
     */
    public static final int MAX_QUBITS = 10;

    /**
     * Pauli 文字列の作用を計算するバックエンドです。
     */
    private final StateVectorBackend stateBackend;

    /**
     * 実対称行列の固有値バックエンドです。
     */
    private final EigenDecompositionBackend eigenBackend;

    /**
     * 最小固有値を返します。
     *
     * @param operator ハミルトニアンです
     * @return 最小固有値です
     * @throws ConstructionException 量子ビット数が上限を超える場合に発生します
     */
    public double groundStateEnergy(PauliOperator operator) {
        if (operator == null) {
            throw new IllegalArgumentException("operator は null 不可です");
        }
        int n = operator.getQubitCount();
        if (n > MAX_QUBITS) {
            throw new ConstructionException("厳密対角化は " + MAX_QUBITS + " 量子ビットまでです: " + n);
        }

        int dim = 1 << n;
        DMatrixRMaj embedded = new DMatrixRMaj(2 * dim, 2 * dim);

        // 列 j = Σ c_k P_k |j⟩ を足し込みます。
        for (int col = 0; col < dim; col++) {
            ZMatrixRMaj basis = new ZMatrixRMaj(dim, 1);
            basis.set(col, 0, 1.0, 0.0);
            for (PauliTerm term : operator.getTerms()) {
                ZMatrixRMaj applied = stateBackend.applyPauli(term, basis);
                double c = term.getCoefficient();
                for (int row = 0; row < dim; row++) {
                    double re = c * applied.getReal(row, 0);
                    double im = c * applied.getImag(row, 0);
                    embedded.add(row, col, re);
                    embedded.add(row + dim, col + dim, re);
                    embedded.add(row, col + dim, -im);
                    embedded.add(row + dim, col, im);
                }
            }
        }

        double[] eigenvalues = eigenBackend.symmetricEigenvaluesAscending(embedded);
        double ground = eigenvalues[0];
        log.debug("厳密対角化が完了しました。次元={}、最小固有値={}", dim, ground);
        return ground;
    }
}
