package io.github.yok.vqe.core.linearalgebra;

import io.github.yok.vqe.core.ansatz.AnsatzSpec;
import io.github.yok.vqe.core.operator.PauliTerm;
import org.ejml.data.Complex_F64;
import org.ejml.data.ZMatrixRMaj;

/**
 * 量子状態ベクトルのシミュレーションを提供するバックエンドを表すインタフェースです。
 *
 * <p>
 * 状態は 2^n×1 の複素列ベクトルで表し、添字のビット q が量子ビット q の値に対応します。
 * </p>
 */
public interface StateVectorBackend {

    /**
     * |0…0⟩ にアンザッツ回路を作用させた状態を返します。
     *
     * @param ansatz アンザッツ定義です
     * @param parameters 回転角の配列です（長さはパラメータ数と一致、変更しません）
     * @return 状態ベクトルです
     */
    ZMatrixRMaj prepareState(AnsatzSpec ansatz, double[] parameters);

    /**
     * Pauli 文字列 P を作用させた新しい状態 P|ψ⟩ を返します（係数は掛けません）。
     *
     * @param term Pauli 項です
     * @param state 状態ベクトルです（変更しません）
     * @return P|ψ⟩ です
     */
    ZMatrixRMaj applyPauli(PauliTerm term, ZMatrixRMaj state);

    /**
     * 期待値 ⟨ψ|P|ψ⟩ を複素数で返します（係数は掛けません）。
     *
     * @param state 状態ベクトルです
     * @param term Pauli 項です
     * @return 期待値です（エルミート演算子なので虚部は丸め誤差程度）
     */
    Complex_F64 expectation(ZMatrixRMaj state, PauliTerm term);
}
