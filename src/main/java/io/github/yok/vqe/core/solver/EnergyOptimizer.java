package io.github.yok.vqe.core.solver;

import io.github.yok.vqe.core.ansatz.AnsatzSpec;
import io.github.yok.vqe.core.operator.PauliOperator;

/**
 * アンザッツのパラメータを探索し、ハミルトニアンのエネルギー期待値を最小化するインタフェースです。
 */
public interface EnergyOptimizer {

    /**
     * エネルギー期待値を最小化します。
     *
     * @param operator ハミルトニアンです
     * @param ansatz アンザッツ定義です
     * @param config 最適化設定です
     * @return 最適化結果です
     * @throws io.github.yok.vqe.core.ConstructionException 入力や設定が不正な場合に発生します
     * @throws io.github.yok.vqe.core.NumericException エネルギー評価が数値的に破綻した場合に発生します
     */
    EnergyResult minimize(PauliOperator operator, AnsatzSpec ansatz, OptimizerConfig config);
}
