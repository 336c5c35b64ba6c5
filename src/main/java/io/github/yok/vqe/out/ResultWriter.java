package io.github.yok.vqe.out;

import io.github.yok.vqe.core.simulation.SimulationReport;

/**
 * シミュレーション結果を出力する処理のインタフェースです。
 */
public interface ResultWriter {

    /**
     * 結果（エネルギー履歴とメタ情報）を出力します。
     *
     * @param report シミュレーション結果です
     * @param referenceEnergy 厳密対角化による参照エネルギーです（未計算なら null）
     */
    void write(SimulationReport report, Double referenceEnergy);
}
