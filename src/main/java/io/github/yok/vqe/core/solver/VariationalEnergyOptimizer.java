package io.github.yok.vqe.core.solver;

import com.google.common.base.Preconditions;
import io.github.yok.vqe.core.ConstructionException;
import io.github.yok.vqe.core.ansatz.AnsatzSpec;
import io.github.yok.vqe.core.evaluator.EnergyEvaluator;
import io.github.yok.vqe.core.operator.PauliOperator;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.rng.simple.RandomSource;

/**
 * 変分原理に基づき、アンザッツのパラメータを最適化してエネルギーを最小化するクラスです。
 *
 * <p>
 * 設定の戦略（{@link OptimizerConfig.Strategy}）に応じて、決定的な準ニュートン探索か SPSA を実行します。 戦略インスタンスは実行ごとに生成し、実行間で状態を共有しません。
 * </p>
 */
@Slf4j
@Getter
@RequiredArgsConstructor
public final class VariationalEnergyOptimizer implements EnergyOptimizer {

    /**
     * エネルギー評価器です。
     */
    private final EnergyEvaluator evaluator;

    /**
     * エネルギー期待値を最小化します。
     *
     * @param operator ハミルトニアンです
     * @param ansatz アンザッツ定義です
     * @param config 最適化設定です
     * @return 最適化結果です
     * @throws NullPointerException 引数が null の場合に発生します
     * @throws ConstructionException 入力や設定が不正な場合に発生します（評価を始める前に検出します）
     */
    @Override
    public EnergyResult minimize(PauliOperator operator, AnsatzSpec ansatz,
            OptimizerConfig config) {
        Preconditions.checkNotNull(operator, "ハミルトニアンが null です。");
        Preconditions.checkNotNull(ansatz, "アンザッツが null です。");
        Preconditions.checkNotNull(config, "最適化設定が null です。");

        config.validate();
        if (operator.getQubitCount() != ansatz.getQubitCount()) {
            throw new ConstructionException("ハミルトニアンとアンザッツの量子ビット数が一致しません: operator="
                    + operator.getQubitCount() + ", ansatz=" + ansatz.getQubitCount());
        }

        double[] initialPoint = InitialPointGenerator.generate(config, ansatz.parameterCount());
        Objective objective = new Objective(evaluator, operator, ansatz);

        log.info("VQE 最適化を開始します。戦略={}、量子ビット数={}、項数={}、パラメータ数={}", config.getStrategy(),
                ansatz.getQubitCount(), operator.getTerms().size(), ansatz.parameterCount());

        MinimizationStrategy strategy;
        switch (config.getStrategy()) {
            case STOCHASTIC_PERTURBATION:
                strategy = new SpsaStrategy(config, RandomSource.XO_SHI_RO_256_PP.create(config.getSeed()));
                break;
            case DETERMINISTIC:
            default:
                strategy = new QuasiNewtonStrategy(config);
                break;
        }
        return strategy.minimize(objective, initialPoint);
    }
}
