package io.github.yok.vqe.app;

import io.github.yok.vqe.core.affinity.AffinityThreshold;
import io.github.yok.vqe.core.affinity.AffinityVerdict;
import io.github.yok.vqe.core.ansatz.EntanglementLayout;
import io.github.yok.vqe.core.simulation.AnsatzDefinition;
import io.github.yok.vqe.core.simulation.OperatorDefinition;
import io.github.yok.vqe.core.solver.OptimizerConfig;
import java.util.ArrayList;
import java.util.List;
import javax.validation.Valid;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * vqe-binding-solver の設定値（vqe.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、CLI 実行時にコアの入力値へ変換します。 値の整合性（長さ不一致など）はコア側で検証します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "vqe")
public class VqeProperties {

    /**
     * ハミルトニアン設定です。
     */
    @Valid
    private Hamiltonian hamiltonian = new Hamiltonian();

    /**
     * アンザッツ設定です。
     */
    @Valid
    private Ansatz ansatz = new Ansatz();

    /**
     * 最適化設定です。
     */
    @Valid
    private Optimizer optimizer = new Optimizer();

    /**
     * 結合親和性の判定設定です。
     */
    @Valid
    private Affinity affinity = new Affinity();

    /**
     * 参照計算（厳密対角化）の設定です。
     */
    @Valid
    private Reference reference = new Reference();

    /**
     * 出力設定です。
     */
    @Valid
    private Output output = new Output();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "vqe")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        Hamiltonian h = getHamiltonian();
        Ansatz a = getAnsatz();
        Optimizer o = getOptimizer();
        Affinity af = getAffinity();

        // 先頭改行を入れて、ログの可読性を上げます。
        StringBuilder sb = new StringBuilder(256).append(nl);

        appendSection(sb, nl, "hamiltonian",
                // paulis: Pauli 文字列の一覧
                "paulis", h.getPaulis(),
                // coefficients: 各項の係数
                "coefficients", h.getCoefficients());

        appendSection(sb, nl, "ansatz", "qubitCount", a.getQubitCount(), "rotation",
                a.getRotation(), "entanglement", a.getEntanglement(), "repetitions",
                a.getRepetitions(), "layout", a.getLayout());

        appendSection(sb, nl, "optimizer",
                // strategy: DETERMINISTIC（SLSQP 型）/ STOCHASTIC_PERTURBATION（SPSA）
                "strategy", o.getStrategy(),
                // maxIterations: 最大反復回数
                "maxIterations", o.getMaxIterations(),
                // initialPoint.values: 初期点（未指定なら乱数）
                "initialPoint.values", o.getInitialPoint().getValues(),
                // initialPoint.seed: 初期点の乱数シード
                "initialPoint.seed", o.getInitialPoint().getSeed(),
                "deterministic.convergenceTolerance",
                o.getDeterministic().getConvergenceTolerance(),
                "deterministic.finiteDifferenceStep",
                o.getDeterministic().getFiniteDifferenceStep(),
                "stochastic.seed", o.getStochastic().getSeed(),
                // stochastic.learningRate: 未指定なら較正で決定
                "stochastic.learningRate", o.getStochastic().getLearningRate(),
                "stochastic.perturbation", o.getStochastic().getPerturbation(),
                "stochastic.blocking", o.getStochastic().isBlocking());

        appendSection(sb, nl, "affinity", "thresholds", af.getThresholds(), "otherwise",
                af.getOtherwise());

        appendSection(sb, nl, "reference", "exactDiagonalization",
                getReference().isExactDiagonalization());

        appendSection(sb, nl, "output", "historyEnabled", getOutput().isHistoryEnabled(), "dir",
                getOutput().getDir());

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int i = 0; i < kvPairs.length; i += 2) {
            String key = String.valueOf(kvPairs[i]);
            Object val = (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    @Data
    public static class Hamiltonian {

        /**
         * Pauli 文字列の一覧です。
         */
        @NotEmpty
        private List<String> paulis = new ArrayList<>();

        /**
         * 係数の一覧です（paulis と同じ順序）。
         */
        @NotEmpty
        private List<Double> coefficients = new ArrayList<>();

        /**
         * コアの入力値に変換します。
         *
         * @return ハミルトニアンの入力値です
         */
        public OperatorDefinition toDefinition() {
            return new OperatorDefinition(new ArrayList<>(paulis), new ArrayList<>(coefficients));
        }
    }

    @Data
    public static class Ansatz {

        /**
         * 量子ビット数です。
         */
        private int qubitCount = 4;

        /**
         * 回転ゲート名です。
         */
        private String rotation = "ry";

        /**
         * エンタングルゲート名です。
         */
        private String entanglement = "cx";

        /**
         * 繰り返し回数です。
         */
        private int repetitions = 2;

        /**
         * 結合パターンです。
         */
        private EntanglementLayout layout = EntanglementLayout.FULL;

        /**
         * コアの入力値に変換します。
         *
         * @return アンザッツの入力値です
         */
        public AnsatzDefinition toDefinition() {
            return new AnsatzDefinition(qubitCount, rotation, entanglement, repetitions, layout);
        }
    }

    @Data
    public static class Optimizer {

        /**
         * 最適化戦略です。
         */
        private OptimizerConfig.Strategy strategy = OptimizerConfig.Strategy.DETERMINISTIC;

        /**
         * 最大反復回数です。
         */
        private int maxIterations = 100;

        /**
         * 初期点の設定です。
         */
        @Valid
        private InitialPoint initialPoint = new InitialPoint();

        /**
         * 決定的戦略の調整値です。
         */
        @Valid
        private Deterministic deterministic = new Deterministic();

        /**
         * SPSA の調整値です。
         */
        @Valid
        private Stochastic stochastic = new Stochastic();

        /**
         * コアの最適化設定に変換します。
         *
         * @return 最適化設定です
         */
        public OptimizerConfig toConfig() {
            List<Double> values = initialPoint.getValues();
            return OptimizerConfig.builder()
                    .strategy(strategy)
                    .maxIterations(maxIterations)
                    .initialPoint(values == null || values.isEmpty() ? null : new ArrayList<>(values))
                    .initialPointSeed(initialPoint.getSeed())
                    .convergenceTolerance(deterministic.getConvergenceTolerance())
                    .finiteDifferenceStep(deterministic.getFiniteDifferenceStep())
                    .armijoCoefficient(deterministic.getArmijoCoefficient())
                    .maxLineSearchSteps(deterministic.getMaxLineSearchSteps())
                    .seed(stochastic.getSeed())
                    .learningRate(stochastic.getLearningRate())
                    .perturbation(stochastic.getPerturbation())
                    .learningRateExponent(stochastic.getLearningRateExponent())
                    .perturbationExponent(stochastic.getPerturbationExponent())
                    .stabilityConstant(stochastic.getStabilityConstant())
                    .calibrationSteps(stochastic.getCalibrationSteps())
                    .targetMagnitude(stochastic.getTargetMagnitude())
                    .blocking(stochastic.isBlocking())
                    .allowedIncrease(stochastic.getAllowedIncrease())
                    .build();
        }

        @Data
        public static class InitialPoint {

            /**
             * 初期点です。空の場合は乱数で生成します。
             */
            private List<Double> values = new ArrayList<>();

            /**
             * 初期点の乱数シードです。
             */
            private long seed = 42L;
        }

        @Data
        public static class Deterministic {

            /**
             * 更新量ノルムの収束判定閾値です。
             */
            private double convergenceTolerance = 1e-6;

            /**
             * 前進差分の刻み幅です。
             */
            private double finiteDifferenceStep = 1.4901161193847656e-8;

            /**
             * Armijo 条件の係数です。
             */
            private double armijoCoefficient = 1e-4;

            /**
             * 直線探索の最大半減回数です。
             */
            private int maxLineSearchSteps = 30;
        }

        @Data
        public static class Stochastic {

            /**
             * 摂動方向の乱数シードです。
             */
            private long seed = 7L;

            /**
             * 学習率の係数 a です。未指定の場合は較正します。
             */
            private Double learningRate;

            /**
             * 摂動幅の係数 c です。
             */
            private double perturbation = 0.2;

            /**
             * 学習率の減衰指数 α です。
             */
            private double learningRateExponent = 0.602;

            /**
             * 摂動幅の減衰指数 γ です。
             */
            private double perturbationExponent = 0.101;

            /**
             * 学習率の安定化定数 A です。
             */
            private double stabilityConstant = 0.0;

            /**
             * 較正に用いる摂動対の数です。
             */
            private int calibrationSteps = 50;

            /**
             * 較正で狙う初回ステップの大きさです。
             */
            private double targetMagnitude = 2.0 * Math.PI / 10.0;

            /**
             * エネルギーが増える更新を棄却するかどうかです。
             */
            private boolean blocking = false;

            /**
             * blocking 時に許容するエネルギー増加量です。
             */
            private double allowedIncrease = 0.0;
        }
    }

    @Data
    public static class Affinity {

        /**
         * 判定規則の一覧です（最も極端なものから順に、上限は増加順）。
         */
        @Valid
        private List<Threshold> thresholds = new ArrayList<>();

        /**
         * どの規則にも当てはまらない場合の判定です。
         */
        private AffinityVerdict otherwise = AffinityVerdict.WEAK;

        /**
         * コアの判定規則一覧に変換します（末尾に +∞ の規則を加えます）。
         *
         * @return 判定規則の一覧です
         */
        public List<AffinityThreshold> toThresholds() {
            List<AffinityThreshold> out = new ArrayList<>(thresholds.size() + 1);
            for (Threshold t : thresholds) {
                double bound = (t.getBelow() != null) ? t.getBelow() : Double.NaN;
                out.add(AffinityThreshold.of(bound, t.getVerdict()));
            }
            out.add(AffinityThreshold.otherwise(otherwise));
            return out;
        }

        @Data
        public static class Threshold {

            /**
             * 上限（この値を含みません）です。
             */
            private Double below;

            /**
             * 判定ラベルです。
             */
            @NotNull
            private AffinityVerdict verdict;
        }
    }

    @Data
    public static class Reference {

        /**
         * 厳密対角化による参照エネルギーを計算するかどうかです。
         */
        private boolean exactDiagonalization = true;
    }

    @Data
    public static class Output {

        /**
         * エネルギー履歴を CSV に出力するかどうかです。
         */
        private boolean historyEnabled = false;

        /**
         * 出力先ディレクトリです。
         */
        private String dir = "./out";
    }
}
