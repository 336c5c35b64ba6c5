package io.github.yok.vqe.core.solver;

import java.util.List;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * 最適化の最終結果です（不変）。
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EnergyResult {

    /**
     * 最終エネルギーです。
     */
    double value;

    /**
     * 実行した反復回数です。
     */
    int iterationsUsed;

    /**
     * 収束判定を満たして終了したかどうかです（SPSA では常に false）。
     */
    boolean converged;

    /**
     * value を与えるパラメータです。
     */
    double[] optimalParameters;

    /**
     * エネルギー評価の回数です。
     */
    int evaluationCount;

    /**
     * 使用した戦略です。
     */
    OptimizerConfig.Strategy strategy;

    /**
     * 反復ごとの現在エネルギーの履歴です。
     */
    List<Double> energyHistory;

    /**
     * 配列と一覧を複製して結果を生成します。
     *
     * @param value 最終エネルギーです
     * @param iterationsUsed 反復回数です
     * @param converged 収束したかどうかです
     * @param optimalParameters 最適パラメータです
     * @param evaluationCount 評価回数です
     * @param strategy 戦略です
     * @param energyHistory エネルギー履歴です
     * @return 結果です
     */
    public static EnergyResult of(double value, int iterationsUsed, boolean converged,
            double[] optimalParameters, int evaluationCount, OptimizerConfig.Strategy strategy,
            List<Double> energyHistory) {
        return new EnergyResult(value, iterationsUsed, converged, optimalParameters.clone(),
                evaluationCount, strategy, List.copyOf(energyHistory));
    }

    /**
     * 最適パラメータの複製を返します。
     *
     * @return 最適パラメータです
     */
    public double[] getOptimalParameters() {
        return optimalParameters.clone();
    }
}
