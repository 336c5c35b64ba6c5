package io.github.yok.vqe.core.simulation;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * シミュレーションの成功（結果）または失敗（発生した例外）のどちらか一方を保持するクラスです。
 *
 * <p>
 * 失敗時は発生した例外インスタンスをそのまま保持します。 報告方法は呼び出し側が決めます。
 * </p>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SimulationOutcome {

    /**
     * 成功時の結果です（失敗時は null）。
     */
    SimulationReport report;

    /**
     * 失敗時の例外です（成功時は null）。
     */
    RuntimeException error;

    /**
     * 成功を表す値を生成します。
     *
     * @param report 結果です
     * @return 成功を表す値です
     */
    public static SimulationOutcome success(SimulationReport report) {
        if (report == null) {
            throw new IllegalArgumentException("report は null 不可です");
        }
        return new SimulationOutcome(report, null);
    }

    /**
     * 失敗を表す値を生成します。
     *
     * @param error 発生した例外です
     * @return 失敗を表す値です
     */
    public static SimulationOutcome failure(RuntimeException error) {
        if (error == null) {
            throw new IllegalArgumentException("error は null 不可です");
        }
        return new SimulationOutcome(null, error);
    }

    /**
     * 成功したかどうかを返します。
     *
     * @return 成功なら true です
     */
    public boolean isSuccess() {
        return report != null;
    }
}
