package io.github.yok.vqe.core.solver;

/**
 * {@link OptimizerConfig.Strategy} の各値に対応する探索手順です。
 */
interface MinimizationStrategy {

    /**
     * 初期点から探索して結果を返します。
     *
     * @param objective 目的関数です
     * @param initialPoint 初期点です（変更しません）
     * @return 最適化結果です
     */
    EnergyResult minimize(Objective objective, double[] initialPoint);
}
