package io.github.yok.vqe.core.simulation;

import io.github.yok.vqe.core.ConstructionException;
import io.github.yok.vqe.core.NumericException;
import io.github.yok.vqe.core.affinity.AffinityClassifier;
import io.github.yok.vqe.core.affinity.AffinityThreshold;
import io.github.yok.vqe.core.affinity.AffinityVerdict;
import io.github.yok.vqe.core.affinity.ThresholdTable;
import io.github.yok.vqe.core.ansatz.AnsatzSpec;
import io.github.yok.vqe.core.ansatz.EntanglementLayout;
import io.github.yok.vqe.core.operator.PauliOperator;
import io.github.yok.vqe.core.solver.EnergyOptimizer;
import io.github.yok.vqe.core.solver.EnergyResult;
import io.github.yok.vqe.core.solver.OptimizerConfig;
import java.util.List;
import java.util.Locale;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 「構築 → 最適化 → 分類」を 1 回実行するシミュレーションの入口です。
 *
 * <p>
 * 入力（ハミルトニアン・アンザッツ・判定表・最適化設定）は最適化を始める前に全て検証します。 インスタンスは実行間で状態を持たないため、別スレッドから並行に呼び出しても干渉しません。
 * </p>
 */
@Slf4j
@Getter
@RequiredArgsConstructor
public final class BindingAffinitySimulation {

    /**
     * エネルギー最適化器です。
     */
    private final EnergyOptimizer optimizer;

    /**
     * 親和性の分類器です。
     */
    private final AffinityClassifier classifier;

    /**
     * シミュレーションを実行し、例外はそのまま伝播させます。
     *
     * @param operatorDefinition ハミルトニアンの入力値です
     * @param ansatzDefinition アンザッツの入力値です
     * @param optimizerConfig 最適化設定です
     * @param thresholds 判定規則の一覧です
     * @return 結果です
     * @throws ConstructionException 入力が不正な場合に発生します
     * @throws NumericException エネルギー評価が数値的に破綻した場合に発生します
     */
    public SimulationReport simulate(OperatorDefinition operatorDefinition,
            AnsatzDefinition ansatzDefinition, OptimizerConfig optimizerConfig,
            List<AffinityThreshold> thresholds) {
        if (operatorDefinition == null || ansatzDefinition == null || optimizerConfig == null) {
            throw new ConstructionException("operator/ansatz/optimizer の定義は必須です");
        }

        // 1) 入力の検証と構築（最適化前）
        PauliOperator operator = PauliOperator.build(operatorDefinition.getPaulis(),
                operatorDefinition.getCoefficients());
        EntanglementLayout layout = (ansatzDefinition.getLayout() != null)
                ? ansatzDefinition.getLayout()
                : EntanglementLayout.FULL;
        AnsatzSpec ansatz = AnsatzSpec.of(ansatzDefinition.getQubitCount(),
                ansatzDefinition.getRotation(), ansatzDefinition.getEntanglement(),
                ansatzDefinition.getRepetitions(), layout);
        ThresholdTable table = ThresholdTable.of(thresholds);
        optimizerConfig.validate();

        // 2) 最適化
        EnergyResult result = optimizer.minimize(operator, ansatz, optimizerConfig);

        // 3) 分類
        AffinityVerdict verdict = classifier.classify(result.getValue(), table);

        log.info("シミュレーションが完了しました。エネルギー={}、判定={}、反復回数={}、収束={}",
                String.format(Locale.ROOT, "%.6f", result.getValue()), verdict,
                result.getIterationsUsed(), result.isConverged());

        return new SimulationReport(result, verdict);
    }

    /**
     * シミュレーションを実行し、成功または失敗を値として返します。
     *
     * <p>
     * {@link ConstructionException} と {@link NumericException} は失敗として返します。 それ以外の例外はそのまま伝播します。
     * </p>
     *
     * @param operatorDefinition ハミルトニアンの入力値です
     * @param ansatzDefinition アンザッツの入力値です
     * @param optimizerConfig 最適化設定です
     * @param thresholds 判定規則の一覧です
     * @return 成功または失敗です
     */
    public SimulationOutcome run(OperatorDefinition operatorDefinition,
            AnsatzDefinition ansatzDefinition, OptimizerConfig optimizerConfig,
            List<AffinityThreshold> thresholds) {
        try {
            return SimulationOutcome.success(
                    simulate(operatorDefinition, ansatzDefinition, optimizerConfig, thresholds));
        } catch (ConstructionException | NumericException e) {
            log.warn("シミュレーションが失敗しました: {}", e.getMessage());
            return SimulationOutcome.failure(e);
        }
    }
}
