package io.github.yok.vqe.core.solver;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.rng.UniformRandomProvider;

/**
 * 同時摂動確率近似（SPSA）による最小化戦略です。
 *
 * <p>
 * 反復 k（0 始まり）で摂動幅 c_k = c/(k+1)^γ、学習率 a_k = a/(k+1+A)^α を用い、 各成分が ±1 の乱数方向 Δ について f(x+c_kΔ) と
 * f(x−c_kΔ) の差から勾配を推定して更新します。 推定が雑音を含むため早期終了はせず、常に最大反復回数まで実行し、評価した反復点の中で最良のエネルギーを返します。
 * </p>
 *
 * <p>
 * 乱数生成器はこのインスタンス専用で、他のコンポーネントからは参照しません。
 * </p>
 */
@Slf4j
final class SpsaStrategy implements MinimizationStrategy {

    /**
     * 最適化設定です。
     */
    private final OptimizerConfig config;

    /**
     * 摂動方向の乱数生成器です。
     */
    private final UniformRandomProvider rng;

    SpsaStrategy(OptimizerConfig config, UniformRandomProvider rng) {
        this.config = config;
        this.rng = rng;
    }

    /**
     * 初期点から探索して結果を返します。
     *
     * @param objective 目的関数です
     * @param initialPoint 初期点です
     * @return 最適化結果です（converged は常に false）
     */
    @Override
    public EnergyResult minimize(Objective objective, double[] initialPoint) {
        final int n = initialPoint.length;
        final int maxIterations = config.getMaxIterations();
        final double c = config.getPerturbation();
        final double alpha = config.getLearningRateExponent();
        final double gamma = config.getPerturbationExponent();
        final double stability = config.getStabilityConstant();

        double[] x = initialPoint.clone();
        double fx = objective.value(x);

        double a = (config.getLearningRate() != null) ? config.getLearningRate()
                : calibrateLearningRate(objective, x);

        log.info("SPSA を開始します。パラメータ数={}、反復回数={}、a={}、c={}、α={}、γ={}、A={}、初期エネルギー={}", n,
                maxIterations, fmt6(a), fmt6(c), alpha, gamma, stability, fmt6(fx));

        double bestValue = fx;
        double[] bestX = x.clone();
        List<Double> history = new ArrayList<>(maxIterations);
        int rejected = 0;

        double[] plus = new double[n];
        double[] minus = new double[n];
        double[] delta = new double[n];

        for (int k = 0; k < maxIterations; k++) {
            double ck = c / Math.pow(k + 1, gamma);
            double ak = a / Math.pow(k + 1 + stability, alpha);

            fillRandomSigns(delta);
            for (int i = 0; i < n; i++) {
                plus[i] = x[i] + ck * delta[i];
                minus[i] = x[i] - ck * delta[i];
            }
            double fPlus = objective.value(plus);
            double fMinus = objective.value(minus);
            double scaledDiff = (fPlus - fMinus) / (2.0 * ck);

            double[] candidate = new double[n];
            for (int i = 0; i < n; i++) {
                // Δ_i = ±1 なので 1/Δ_i = Δ_i です。
                candidate[i] = x[i] - ak * scaledDiff * delta[i];
            }
            double fCandidate = objective.value(candidate);

            if (config.isBlocking() && fCandidate > fx + config.getAllowedIncrease()) {
                rejected++;
                log.debug("SPSA 反復 {} / {}：エネルギー増加のため更新を棄却しました（候補={}、現在={}）", k + 1,
                        maxIterations, fmt6(fCandidate), fmt6(fx));
            } else {
                x = candidate;
                fx = fCandidate;
            }

            if (fx < bestValue) {
                bestValue = fx;
                bestX = x.clone();
            }
            history.add(fx);

            log.debug("SPSA 反復 {} / {}：エネルギー={}、最良={}、a_k={}、c_k={}", k + 1, maxIterations, fmt6(fx),
                    fmt6(bestValue), fmt6(ak), fmt6(ck));
        }

        log.info("SPSA を終了します。反復回数={}、最良エネルギー={}、最終エネルギー={}、棄却数={}、評価回数={}", maxIterations,
                fmt6(bestValue), fmt6(fx), rejected, objective.evaluations());

        return EnergyResult.of(bestValue, maxIterations, false, bestX, objective.evaluations(),
                OptimizerConfig.Strategy.STOCHASTIC_PERTURBATION, history);
    }

    /**
     * 初回ステップの大きさが targetMagnitude になるように学習率 a を較正します。
     *
     * <p>
     * a = target / mean(|f(x+cΔ) − f(x−cΔ)| / (2c)) × (A+1)^α です。 差が全て 0（平坦）の場合は平均勾配を 1 とみなします。
     * </p>
     *
     * @param objective 目的関数です
     * @param x 初期点です
     * @return 学習率の係数 a です
     */
    private double calibrateLearningRate(Objective objective, double[] x) {
        int n = x.length;
        int steps = config.getCalibrationSteps();
        double c = config.getPerturbation();

        double[] delta = new double[n];
        double[] plus = new double[n];
        double[] minus = new double[n];
        double sum = 0.0;
        for (int s = 0; s < steps; s++) {
            fillRandomSigns(delta);
            for (int i = 0; i < n; i++) {
                plus[i] = x[i] + c * delta[i];
                minus[i] = x[i] - c * delta[i];
            }
            sum += Math.abs(objective.value(plus) - objective.value(minus));
        }

        double avgMagnitude = sum / steps / (2.0 * c);
        if (avgMagnitude == 0.0) {
            log.warn("学習率の較正で勾配の大きさが 0 でした。平均勾配を 1 とみなします。");
            avgMagnitude = 1.0;
        }
        double a = config.getTargetMagnitude() / avgMagnitude
                * Math.pow(config.getStabilityConstant() + 1.0, config.getLearningRateExponent());

        log.info("学習率を較正しました。a={}（平均勾配={}、較正回数={}）", fmt6(a), fmt6(avgMagnitude), steps);
        return a;
    }

    /**
     * 各成分を一様な確率で +1 または -1 にします。
     *
     * @param delta 出力先です
     */
    private void fillRandomSigns(double[] delta) {
        for (int i = 0; i < delta.length; i++) {
            delta[i] = rng.nextBoolean() ? 1.0 : -1.0;
        }
    }

    private static String fmt6(double v) {
        return String.format(Locale.ROOT, "%.6f", v);
    }
}
