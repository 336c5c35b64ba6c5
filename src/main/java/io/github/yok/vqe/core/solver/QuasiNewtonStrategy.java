package io.github.yok.vqe.core.solver;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.NormOps_DDRM;
import org.ejml.dense.row.mult.VectorVectorMult_DDRM;

/**
 * 決定的な最小化戦略です（制約なしの逐次二次計画法、SLSQP 型）。
 *
 * <p>
 * 各反復で、前進差分の勾配と BFGS で更新する逆ヘッセ行列近似から二次モデルの最小点方向を求め、 Armijo 条件を満たすまでステップ幅を半減する直線探索で更新します。
 * エネルギーを増やす更新は採用しません。 更新量のノルムが閾値を下回った時点で収束とします。
 * </p>
 */
@Slf4j
final class QuasiNewtonStrategy implements MinimizationStrategy {

    /**
     * BFGS 更新を行う曲率条件 s・y の下限です。
     */
    private static final double CURVATURE_EPS = 1e-12;

    /**
     * 最適化設定です。
     */
    private final OptimizerConfig config;

    QuasiNewtonStrategy(OptimizerConfig config) {
        this.config = config;
    }

    /**
     * 初期点から探索して結果を返します。
     *
     * @param objective 目的関数です
     * @param initialPoint 初期点です
     * @return 最適化結果です
     */
    @Override
    public EnergyResult minimize(Objective objective, double[] initialPoint) {
        final int n = initialPoint.length;
        final int maxIterations = config.getMaxIterations();
        final double tolerance = config.getConvergenceTolerance();

        DMatrixRMaj x = column(initialPoint);
        double fx = objective.value(x.data.clone());
        DMatrixRMaj g = gradient(objective, x, fx);

        // 逆ヘッセ行列の近似（初期値は単位行列）
        DMatrixRMaj inverseHessian = CommonOps_DDRM.identity(n);
        boolean identityModel = true;

        log.info("決定的最適化を開始します。パラメータ数={}、最大反復={}、収束閾値={}、初期エネルギー={}", n, maxIterations,
                tolerance, fmt6(fx));

        List<Double> history = new ArrayList<>();
        boolean converged = false;
        int iterations = 0;

        DMatrixRMaj direction = new DMatrixRMaj(n, 1);
        DMatrixRMaj trial = new DMatrixRMaj(n, 1);

        for (int iter = 1; iter <= maxIterations; iter++) {
            iterations = iter;

            // 1) 二次モデルの最小点方向 p = -H g
            CommonOps_DDRM.mult(inverseHessian, g, direction);
            CommonOps_DDRM.scale(-1.0, direction);

            double slope = VectorVectorMult_DDRM.innerProd(g, direction);
            if (slope >= 0.0 && !identityModel) {
                // 曲率モデルが降下方向を与えない場合は最急降下に戻します。
                CommonOps_DDRM.setIdentity(inverseHessian);
                identityModel = true;
                CommonOps_DDRM.scale(-1.0, g, direction);
                slope = VectorVectorMult_DDRM.innerProd(g, direction);
            }

            double proposedNorm = NormOps_DDRM.normF(direction);
            if (proposedNorm < tolerance) {
                history.add(fx);
                converged = true;
                log.info("更新量が収束閾値を下回りました。反復回数={}、更新量={}、エネルギー={}", iter,
                        String.format(Locale.ROOT, "%.3e", proposedNorm), fmt6(fx));
                break;
            }

            // 2) 直線探索（Armijo 条件）
            double alpha = 1.0;
            double fTrial = Double.NaN;
            boolean accepted = false;
            for (int ls = 0; ls < config.getMaxLineSearchSteps(); ls++) {
                CommonOps_DDRM.add(x, alpha, direction, trial);
                fTrial = objective.value(trial.data.clone());
                if (fTrial <= fx + config.getArmijoCoefficient() * alpha * slope) {
                    accepted = true;
                    break;
                }
                alpha *= 0.5;
            }

            if (!accepted) {
                history.add(fx);
                if (identityModel) {
                    log.warn("最急降下方向でもエネルギーが減少しないため終了します。反復回数={}、エネルギー={}", iter,
                            fmt6(fx));
                    break;
                }
                log.debug("直線探索に失敗したため曲率モデルを初期化します。反復={}", iter);
                CommonOps_DDRM.setIdentity(inverseHessian);
                identityModel = true;
                continue;
            }

            // 3) 勾配を更新して BFGS で逆ヘッセ行列を更新
            DMatrixRMaj gNew = gradient(objective, trial, fTrial);
            DMatrixRMaj s = new DMatrixRMaj(n, 1);
            DMatrixRMaj y = new DMatrixRMaj(n, 1);
            CommonOps_DDRM.subtract(trial, x, s);
            CommonOps_DDRM.subtract(gNew, g, y);
            if (updateInverseHessian(inverseHessian, s, y)) {
                identityModel = false;
            }

            double stepNorm = NormOps_DDRM.normF(s);
            double previous = fx;

            System.arraycopy(trial.data, 0, x.data, 0, n);
            fx = fTrial;
            g = gNew;
            history.add(fx);

            log.debug("決定的最適化 反復 {} / {}：エネルギー={}（変化={}）、ステップ幅={}、更新量={}", iter, maxIterations,
                    fmt6(fx), fmt6(fx - previous), fmt6(alpha),
                    String.format(Locale.ROOT, "%.3e", stepNorm));

            if (stepNorm < tolerance) {
                converged = true;
                log.info("更新量が収束閾値を下回りました。反復回数={}、更新量={}、エネルギー={}", iter,
                        String.format(Locale.ROOT, "%.3e", stepNorm), fmt6(fx));
                break;
            }
        }

        if (!converged) {
            log.warn("決定的最適化が未収束で終了しました。反復回数={}、エネルギー={}、評価回数={}", iterations, fmt6(fx),
                    objective.evaluations());
        }

        return EnergyResult.of(fx, iterations, converged, x.data, objective.evaluations(),
                OptimizerConfig.Strategy.DETERMINISTIC, history);
    }

    /**
     * 前進差分で勾配を計算します。
     *
     * @param objective 目的関数です
     * @param x 評価点です
     * @param fx 評価点でのエネルギーです
     * @return 勾配（列ベクトル）です
     */
    private DMatrixRMaj gradient(Objective objective, DMatrixRMaj x, double fx) {
        int n = x.getNumRows();
        double h = config.getFiniteDifferenceStep();
        DMatrixRMaj g = new DMatrixRMaj(n, 1);
        for (int i = 0; i < n; i++) {
            double[] shifted = x.data.clone();
            shifted[i] += h;
            g.data[i] = (objective.value(shifted) - fx) / h;
        }
        return g;
    }

    /**
     * BFGS の逆ヘッセ行列更新を行います。
     *
     * <p>
     * H ← H + ((s・y + yᵀHy)/(s・y)²) ssᵀ − (Hy sᵀ + s (Hy)ᵀ)/(s・y)
     * </p>
     *
     * @param h 逆ヘッセ行列の近似です（更新対象）
     * @param s パラメータの変化です
     * @param y 勾配の変化です
     * @return 曲率条件を満たして更新した場合は true です
     */
    private static boolean updateInverseHessian(DMatrixRMaj h, DMatrixRMaj s, DMatrixRMaj y) {
        double sy = VectorVectorMult_DDRM.innerProd(s, y);
        if (!(sy > CURVATURE_EPS)) {
            return false;
        }
        int n = s.getNumRows();
        DMatrixRMaj hy = new DMatrixRMaj(n, 1);
        CommonOps_DDRM.mult(h, y, hy);
        double yhy = VectorVectorMult_DDRM.innerProd(y, hy);

        DMatrixRMaj outer = new DMatrixRMaj(n, n);
        VectorVectorMult_DDRM.outerProd(s, s, outer);
        CommonOps_DDRM.addEquals(h, (sy + yhy) / (sy * sy), outer);

        VectorVectorMult_DDRM.outerProd(hy, s, outer);
        CommonOps_DDRM.addEquals(h, -1.0 / sy, outer);
        VectorVectorMult_DDRM.outerProd(s, hy, outer);
        CommonOps_DDRM.addEquals(h, -1.0 / sy, outer);
        return true;
    }

    private static DMatrixRMaj column(double[] values) {
        DMatrixRMaj v = new DMatrixRMaj(values.length, 1);
        System.arraycopy(values, 0, v.data, 0, values.length);
        return v;
    }

    private static String fmt6(double v) {
        return String.format(Locale.ROOT, "%.6f", v);
    }
}
