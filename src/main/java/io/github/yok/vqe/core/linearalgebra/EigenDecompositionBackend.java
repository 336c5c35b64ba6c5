package io.github.yok.vqe.core.linearalgebra;

import org.ejml.data.DMatrixRMaj;

/**
 * 実対称行列の固有値計算を提供するバックエンドを表すインタフェースです。
 *
 * <p>
 * 参照用の厳密対角化で使用します。ライブラリを差し替えやすくするための境界です。
 * </p>
 */
public interface EigenDecompositionBackend {

    /**
     * 実対称行列の固有値を昇順で返します。
     *
     * @param symmetricMatrix 実対称行列です
     * @return 昇順の固有値配列です
     * @throws IllegalStateException 固有分解に失敗した場合に発生します
     */
    double[] symmetricEigenvaluesAscending(DMatrixRMaj symmetricMatrix);
}
