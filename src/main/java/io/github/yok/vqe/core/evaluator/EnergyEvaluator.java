package io.github.yok.vqe.core.evaluator;

import io.github.yok.vqe.core.ansatz.AnsatzSpec;
import io.github.yok.vqe.core.operator.PauliOperator;

/**
 * アンザッツが生成する状態に対するハミルトニアンの期待値（エネルギー）を計算するインタフェースです。
 *
 * <p>
 * 実装は副作用を持たず、同じ入力には同じ値を返す必要があります。
 * </p>
 */
public interface EnergyEvaluator {

    /**
     * エネルギー期待値を計算します。
     *
     * @param operator ハミルトニアンです
     * @param ansatz アンザッツ定義です
     * @param parameters パラメータ配列です（長さはパラメータ数と一致、変更しません）
     * @return エネルギー期待値（実数）です
     * @throws io.github.yok.vqe.core.ConstructionException パラメータ数や量子ビット数が一致しない場合に発生します
     * @throws io.github.yok.vqe.core.NumericException 結果が非有限、または虚部が無視できない場合に発生します
     */
    double evaluate(PauliOperator operator, AnsatzSpec ansatz, double[] parameters);
}
