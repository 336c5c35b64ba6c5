package io.github.yok.vqe.core.simulation;

import io.github.yok.vqe.core.affinity.AffinityVerdict;
import io.github.yok.vqe.core.solver.EnergyResult;
import lombok.Value;

/**
 * 1 回のシミュレーションの結果（エネルギーと判定）です。
 */
@Value
public class SimulationReport {

    /**
     * 最適化結果です。
     */
    EnergyResult energyResult;

    /**
     * 結合親和性の判定です。
     */
    AffinityVerdict verdict;
}
