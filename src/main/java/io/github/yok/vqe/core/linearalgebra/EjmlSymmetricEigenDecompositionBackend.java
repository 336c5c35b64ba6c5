package io.github.yok.vqe.core.linearalgebra;

import java.util.Arrays;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.EigenDecomposition_F64;

/**
 * EJML を用いて、実対称行列の固有値を計算するクラスです。
 *
 * <p>
 * 固有ベクトルは計算せず、固有値のみを昇順に並べて返します。
 * </p>
 */
public final class EjmlSymmetricEigenDecompositionBackend implements EigenDecompositionBackend {

    /**
     * 実対称行列の固有値を昇順で返します。
     *
     * @param symmetricMatrix 実対称行列です
     * @return 昇順の固有値配列です
     * @throws IllegalArgumentException symmetricMatrix が null または正方でない場合に発生します
     * @throws IllegalStateException 固有分解に失敗した場合に発生します
     */
    @Override
    public double[] symmetricEigenvaluesAscending(DMatrixRMaj symmetricMatrix) {
        if (symmetricMatrix == null) {
            throw new IllegalArgumentException("symmetricMatrix は null 不可です");
        }
        if (symmetricMatrix.numRows != symmetricMatrix.numCols) {
            throw new IllegalArgumentException("正方行列が必要です: " + symmetricMatrix.numRows + "x"
                    + symmetricMatrix.numCols);
        }

        int dim = symmetricMatrix.numRows;

        // 対称行列用の分解器（固有ベクトルは不要）
        EigenDecomposition_F64<DMatrixRMaj> decomposition =
                DecompositionFactory_DDRM.eig(dim, false, true);

        // decompose は入力を書き換える場合があるため複製を渡します。
        if (!decomposition.decompose(symmetricMatrix.copy())) {
            throw new IllegalStateException("固有分解に失敗しました（EJML）");
        }

        double[] eigenvalues = new double[dim];
        for (int i = 0; i < dim; i++) {
            // 実対称を想定しているため、固有値は実数部のみを使います。
            eigenvalues[i] = decomposition.getEigenvalue(i).getReal();
        }
        Arrays.sort(eigenvalues);
        return eigenvalues;
    }
}
