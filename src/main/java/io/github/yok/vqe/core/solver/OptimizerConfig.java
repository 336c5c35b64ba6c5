package io.github.yok.vqe.core.solver;

import io.github.yok.vqe.core.ConstructionException;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * パラメータ最適化の設定です。
 *
 * <p>
 * 戦略は {@link Strategy} の閉じた列挙で選択します。 戦略ごとの調整値はそれぞれの戦略でのみ参照されます。
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class OptimizerConfig {

    /**
     * 最適化戦略の種類です。
     */
    public enum Strategy {

        /**
         * 有限差分勾配と準ニュートン曲率モデルによる逐次二次近似（SLSQP 型、制約なし）です。
         */
        DETERMINISTIC,

        /**
         * 同時摂動確率近似（SPSA）です。
         */
        STOCHASTIC_PERTURBATION
    }

    /**
     * 最適化戦略です。
     */
    @Builder.Default
    Strategy strategy = Strategy.DETERMINISTIC;

    /**
     * 最大反復回数です（1 以上）。
     */
    @Builder.Default
    int maxIterations = 100;

    /**
     * 初期点です。null の場合は initialPointSeed から一様乱数で生成します。
     */
    List<Double> initialPoint;

    /**
     * 初期点生成に用いる乱数シードです。
     */
    @Builder.Default
    long initialPointSeed = 42L;

    // --- DETERMINISTIC ---

    /**
     * 更新量ノルムの収束判定閾値です。
     */
    @Builder.Default
    double convergenceTolerance = 1e-6;

    /**
     * 前進差分の刻み幅です。
     */
    @Builder.Default
    double finiteDifferenceStep = 1.4901161193847656e-8;

    /**
     * Armijo 条件（十分減少条件）の係数です。
     */
    @Builder.Default
    double armijoCoefficient = 1e-4;

    /**
     * 直線探索でステップ幅を半減させる最大回数です。
     */
    @Builder.Default
    int maxLineSearchSteps = 30;

    // --- STOCHASTIC_PERTURBATION ---

    /**
     * 摂動方向の生成に用いる乱数シードです。
     */
    @Builder.Default
    long seed = 7L;

    /**
     * 学習率の係数 a です。null の場合は較正で決めます。
     */
    Double learningRate;

    /**
     * 摂動幅の係数 c です。
     */
    @Builder.Default
    double perturbation = 0.2;

    /**
     * 学習率の減衰指数 α です。
     */
    @Builder.Default
    double learningRateExponent = 0.602;

    /**
     * 摂動幅の減衰指数 γ です。
     */
    @Builder.Default
    double perturbationExponent = 0.101;

    /**
     * 学習率の安定化定数 A です。
     */
    @Builder.Default
    double stabilityConstant = 0.0;

    /**
     * 学習率の較正に用いる摂動対の数です。
     */
    @Builder.Default
    int calibrationSteps = 50;

    /**
     * 較正で狙う初回ステップの大きさです。
     */
    @Builder.Default
    double targetMagnitude = 2.0 * Math.PI / 10.0;

    /**
     * エネルギーが allowedIncrease を超えて増える更新を棄却するかどうかです。
     */
    @Builder.Default
    boolean blocking = false;

    /**
     * blocking 時に許容するエネルギー増加量です。
     */
    @Builder.Default
    double allowedIncrease = 0.0;

    /**
     * 設定値を検証します。
     *
     * @throws ConstructionException 設定値が不正な場合に発生します
     */
    public void validate() {
        if (strategy == null) {
            throw new ConstructionException("optimizer.strategy は必須です");
        }
        if (maxIterations <= 0) {
            throw new ConstructionException("optimizer.maxIterations は 1 以上が必要です: " + maxIterations);
        }
        if (initialPoint != null) {
            for (Double v : initialPoint) {
                if (v == null || !Double.isFinite(v)) {
                    throw new ConstructionException("initialPoint は有限値のみ指定できます: " + initialPoint);
                }
            }
        }
        switch (strategy) {
            case DETERMINISTIC:
                requirePositive("convergenceTolerance", convergenceTolerance);
                requirePositive("finiteDifferenceStep", finiteDifferenceStep);
                if (!(armijoCoefficient > 0.0 && armijoCoefficient < 1.0)) {
                    throw new ConstructionException(
                            "armijoCoefficient は (0, 1) が必要です: " + armijoCoefficient);
                }
                if (maxLineSearchSteps <= 0) {
                    throw new ConstructionException(
                            "maxLineSearchSteps は 1 以上が必要です: " + maxLineSearchSteps);
                }
                break;
            case STOCHASTIC_PERTURBATION:
            default:
                requirePositive("perturbation", perturbation);
                requirePositive("learningRateExponent", learningRateExponent);
                requirePositive("perturbationExponent", perturbationExponent);
                if (!(stabilityConstant >= 0.0)) {
                    throw new ConstructionException(
                            "stabilityConstant は 0 以上が必要です: " + stabilityConstant);
                }
                if (learningRate != null) {
                    requirePositive("learningRate", learningRate);
                } else {
                    if (calibrationSteps <= 0) {
                        throw new ConstructionException(
                                "learningRate 未指定時は calibrationSteps が 1 以上必要です: "
                                        + calibrationSteps);
                    }
                    requirePositive("targetMagnitude", targetMagnitude);
                }
                if (!(allowedIncrease >= 0.0)) {
                    throw new ConstructionException(
                            "allowedIncrease は 0 以上が必要です: " + allowedIncrease);
                }
                break;
        }
    }

    private static void requirePositive(String name, double value) {
        if (!(value > 0.0) || Double.isInfinite(value)) {
            throw new ConstructionException(name + " は正の有限値が必要です: " + value);
        }
    }
}
