package io.github.yok.vqe.core.solver;

import io.github.yok.vqe.core.ansatz.AnsatzSpec;
import io.github.yok.vqe.core.evaluator.EnergyEvaluator;
import io.github.yok.vqe.core.operator.PauliOperator;

/**
 * 1 回の最適化で使う目的関数です（ハミルトニアンとアンザッツを固定し、評価回数を数えます）。
 */
final class Objective {

    private final EnergyEvaluator evaluator;

    private final PauliOperator operator;

    private final AnsatzSpec ansatz;

    private int evaluations;

    Objective(EnergyEvaluator evaluator, PauliOperator operator, AnsatzSpec ansatz) {
        this.evaluator = evaluator;
        this.operator = operator;
        this.ansatz = ansatz;
    }

    /**
     * エネルギーを評価します。NumericException はそのまま伝播します。
     *
     * @param parameters パラメータです
     * @return エネルギーです
     */
    double value(double[] parameters) {
        evaluations++;
        return evaluator.evaluate(operator, ansatz, parameters);
    }

    int evaluations() {
        return evaluations;
    }
}
