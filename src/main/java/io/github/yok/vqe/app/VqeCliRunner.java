package io.github.yok.vqe.app;

import io.github.yok.vqe.core.affinity.AffinityVerdict;
import io.github.yok.vqe.core.operator.PauliOperator;
import io.github.yok.vqe.core.simulation.BindingAffinitySimulation;
import io.github.yok.vqe.core.simulation.OperatorDefinition;
import io.github.yok.vqe.core.simulation.SimulationOutcome;
import io.github.yok.vqe.core.simulation.SimulationReport;
import io.github.yok.vqe.core.solver.EnergyResult;
import io.github.yok.vqe.core.solver.ExactGroundStateSolver;
import io.github.yok.vqe.out.ResultWriter;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI で vqe-binding-solver を実行するクラスです。
 *
 * <p>
 * 設定のハミルトニアン（Mpro 結合ポケットのモデル）に対して VQE を実行し、 得られた結合エネルギーと親和性の判定を表示します。 失敗してもプロセスは落とさず、メッセージを表示して終了します。
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VqeCliRunner implements CommandLineRunner {

    /**
     * vqe-binding-solver の設定値（vqe.*）です。
     */
    private final VqeProperties properties;

    /**
     * シミュレーションの入口です。
     */
    private final BindingAffinitySimulation simulation;

    /**
     * 参照エネルギーの厳密対角化ソルバです。
     */
    private final ExactGroundStateSolver exactSolver;

    /**
     * 結果出力ロジックです。
     */
    private final ResultWriter resultWriter;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     */
    @Override
    public void run(String... args) {
        System.out.println("=== vqe-binding-solver start: SARS-CoV-2 Mpro binding simulation ===");
        System.out.println("目的: 候補分子の最も安定な結合配置を探索します。");
        System.out.print(properties.toMultilineString());

        OperatorDefinition operatorDefinition = properties.getHamiltonian().toDefinition();

        System.out.println("VQE で薬剤とプロテアーゼの相互作用を最適化しています（戦略="
                + properties.getOptimizer().getStrategy() + "）...");

        SimulationOutcome outcome = simulation.run(operatorDefinition,
                properties.getAnsatz().toDefinition(), properties.getOptimizer().toConfig(),
                properties.getAffinity().toThresholds());

        if (!outcome.isSuccess()) {
            System.out.println("シミュレーションエラー: " + outcome.getError().getMessage());
            log.error("シミュレーションを完了できませんでした。", outcome.getError());
            return;
        }

        SimulationReport report = outcome.getReport();
        EnergyResult result = report.getEnergyResult();
        AffinityVerdict verdict = report.getVerdict();

        System.out.println();
        System.out.println("=== シミュレーション結果 ===");
        System.out.println("結合エネルギー: " + fmt6(result.getValue()) + " Hartree");
        System.out.println("反復回数=" + result.getIterationsUsed() + "、収束=" + result.isConverged()
                + "、評価回数=" + result.getEvaluationCount());

        Double reference = null;
        if (properties.getReference().isExactDiagonalization()) {
            // 入力は simulation.run で検証済みです。
            PauliOperator operator = PauliOperator.build(operatorDefinition.getPaulis(),
                    operatorDefinition.getCoefficients());
            reference = exactSolver.groundStateEnergy(operator);
            System.out.println("参照（厳密対角化）: " + fmt6(reference) + " Hartree（差="
                    + fmt6(result.getValue() - reference) + "）");
        }

        System.out.println("RESULT: " + verdict.getLabel() + ". " + verdict.getRecommendation());

        if (properties.getOutput().isHistoryEnabled()) {
            resultWriter.write(report, reference);
            System.out.println("エネルギー履歴を出力しました: " + properties.getOutput().getDir());
        }
        System.out.println("----------------------------------------------------------");
    }

    /**
     * 数値を小数点以下6桁までの文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt6(double v) {
        return String.format(Locale.ROOT, "%.6f", v);
    }
}
