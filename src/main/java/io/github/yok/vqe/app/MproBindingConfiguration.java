package io.github.yok.vqe.app;

import io.github.yok.vqe.core.affinity.AffinityClassifier;
import io.github.yok.vqe.core.evaluator.EnergyEvaluator;
import io.github.yok.vqe.core.evaluator.StatevectorEnergyEvaluator;
import io.github.yok.vqe.core.linearalgebra.EigenDecompositionBackend;
import io.github.yok.vqe.core.linearalgebra.EjmlStateVectorBackend;
import io.github.yok.vqe.core.linearalgebra.EjmlSymmetricEigenDecompositionBackend;
import io.github.yok.vqe.core.linearalgebra.StateVectorBackend;
import io.github.yok.vqe.core.simulation.BindingAffinitySimulation;
import io.github.yok.vqe.core.solver.EnergyOptimizer;
import io.github.yok.vqe.core.solver.ExactGroundStateSolver;
import io.github.yok.vqe.core.solver.VariationalEnergyOptimizer;
import io.github.yok.vqe.out.CsvResultWriter;
import io.github.yok.vqe.out.ResultWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 状態ベクトル VQE + 親和性判定の Bean 定義を行う設定クラスです。
 *
 * <p>
 * コアのコンポーネントは状態を持たないため、Bean として共有しても実行間で干渉しません。
 * </p>
 */
@Configuration
@RequiredArgsConstructor
public class MproBindingConfiguration {

    /**
     * vqe-binding-solver の設定値（vqe.*）です。
     */
    private final VqeProperties p;

    /**
     * 状態ベクトルのバックエンドを生成します。
     *
     * @return 状態ベクトルのバックエンドです
     */
    @Bean
    public StateVectorBackend stateVectorBackend() {
        return new EjmlStateVectorBackend();
    }

    /**
     * 固有値バックエンドを生成します。
     *
     * @return 固有値バックエンドです
     */
    @Bean
    public EigenDecompositionBackend eigenDecompositionBackend() {
        return new EjmlSymmetricEigenDecompositionBackend();
    }

    /**
     * エネルギー評価器を生成します。
     *
     * @param backend 状態ベクトルのバックエンドです
     * @return エネルギー評価器です
     */
    @Bean
    public EnergyEvaluator energyEvaluator(StateVectorBackend backend) {
        return new StatevectorEnergyEvaluator(backend);
    }

    /**
     * エネルギー最適化器を生成します。
     *
     * @param evaluator エネルギー評価器です
     * @return エネルギー最適化器です
     */
    @Bean
    public EnergyOptimizer energyOptimizer(EnergyEvaluator evaluator) {
        return new VariationalEnergyOptimizer(evaluator);
    }

    /**
     * 親和性の分類器を生成します。
     *
     * @return 分類器です
     */
    @Bean
    public AffinityClassifier affinityClassifier() {
        return new AffinityClassifier();
    }

    /**
     * シミュレーションの入口を生成します。
     *
     * @param optimizer エネルギー最適化器です
     * @param classifier 分類器です
     * @return シミュレーションの入口です
     */
    @Bean
    public BindingAffinitySimulation bindingAffinitySimulation(EnergyOptimizer optimizer,
            AffinityClassifier classifier) {
        return new BindingAffinitySimulation(optimizer, classifier);
    }

    /**
     * 厳密対角化ソルバを生成します。
     *
     * @param stateBackend 状態ベクトルのバックエンドです
     * @param eigenBackend 固有値バックエンドです
     * @return 厳密対角化ソルバです
     */
    @Bean
    public ExactGroundStateSolver exactGroundStateSolver(StateVectorBackend stateBackend,
            EigenDecompositionBackend eigenBackend) {
        return new ExactGroundStateSolver(stateBackend, eigenBackend);
    }

    /**
     * 結果出力ロジックを生成します。
     *
     * @return 結果出力ロジックです
     */
    @Bean
    public ResultWriter resultWriter() {
        return new CsvResultWriter(p.getOutput().getDir());
    }
}
