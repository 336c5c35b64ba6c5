package io.github.yok.vqe.core.simulation;

import io.github.yok.vqe.core.ansatz.EntanglementLayout;
import lombok.Value;

/**
 * アンザッツの入力値（未検証）です。
 */
@Value
public class AnsatzDefinition {

    /**
     * 量子ビット数です。
     */
    int qubitCount;

    /**
     * 回転ゲート名です（例: {@code "ry"}）。
     */
    String rotation;

    /**
     * エンタングルゲート名です（例: {@code "cx"}）。
     */
    String entanglement;

    /**
     * 繰り返し回数です。
     */
    int repetitions;

    /**
     * 結合パターンです。
     */
    EntanglementLayout layout;
}
