package io.github.yok.vqe.core.ansatz;

import io.github.yok.vqe.core.ConstructionException;
import lombok.Value;

/**
 * 回転層とエンタングル層を交互に重ねる 2 局所（two-local）アンザッツの定義です。
 *
 * <p>
 * 回路は「回転層 → エンタングル層」を repetitions 回繰り返し、最後に回転層を 1 つ置きます。 回転層は量子ビットごとに 1 つのパラメータを持つため、パラメータ数は
 * {@code qubitCount × (repetitions + 1)} です。
 * </p>
 */
@Value
public class AnsatzSpec {

    /**
     * 量子ビット数です。
     */
    int qubitCount;

    /**
     * 回転ゲートの種類です。
     */
    RotationKind rotationKind;

    /**
     * エンタングルゲートの種類です。
     */
    EntanglementKind entanglementKind;

    /**
     * 繰り返し回数（エンタングル層の数）です。
     */
    int repetitions;

    /**
     * エンタングル層の結合パターンです。
     */
    EntanglementLayout entanglementLayout;

    /**
     * 定義を検証して生成します。
     *
     * @param qubitCount 量子ビット数です（1 以上）
     * @param rotationKind 回転ゲートです（null 不可）
     * @param entanglementKind エンタングルゲートです（null 不可）
     * @param repetitions 繰り返し回数です（0 以上）
     * @param entanglementLayout 結合パターンです（null 不可）
     * @throws ConstructionException 値が不正、またはパラメータ数が int の範囲を超える場合に発生します
     */
    public AnsatzSpec(int qubitCount, RotationKind rotationKind,
            EntanglementKind entanglementKind, int repetitions,
            EntanglementLayout entanglementLayout) {
        if (qubitCount <= 0) {
            throw new ConstructionException("qubitCount は 1 以上が必要です: " + qubitCount);
        }
        if (repetitions < 0) {
            throw new ConstructionException("repetitions は 0 以上が必要です: " + repetitions);
        }
        if (rotationKind == null || entanglementKind == null || entanglementLayout == null) {
            throw new ConstructionException("rotation/entanglement/layout は null 不可です");
        }
        try {
            Math.multiplyExact(qubitCount, Math.addExact(repetitions, 1));
        } catch (ArithmeticException e) {
            throw new ConstructionException("パラメータ数が int の範囲を超えます: qubitCount=" + qubitCount
                    + ", repetitions=" + repetitions, e);
        }
        this.qubitCount = qubitCount;
        this.rotationKind = rotationKind;
        this.entanglementKind = entanglementKind;
        this.repetitions = repetitions;
        this.entanglementLayout = entanglementLayout;
    }

    /**
     * 名前指定でアンザッツを生成します（結合パターンは FULL）。
     *
     * @param qubitCount 量子ビット数です
     * @param rotation 回転ゲート名です（例: {@code "ry"}）
     * @param entanglement エンタングルゲート名です（例: {@code "cx"}）
     * @param repetitions 繰り返し回数です
     * @return アンザッツです
     */
    public static AnsatzSpec of(int qubitCount, String rotation, String entanglement,
            int repetitions) {
        return of(qubitCount, rotation, entanglement, repetitions, EntanglementLayout.FULL);
    }

    /**
     * 名前指定でアンザッツを生成します。
     *
     * @param qubitCount 量子ビット数です
     * @param rotation 回転ゲート名です
     * @param entanglement エンタングルゲート名です
     * @param repetitions 繰り返し回数です
     * @param layout 結合パターンです
     * @return アンザッツです
     */
    public static AnsatzSpec of(int qubitCount, String rotation, String entanglement,
            int repetitions, EntanglementLayout layout) {
        return new AnsatzSpec(qubitCount, RotationKind.parse(rotation),
                EntanglementKind.parse(entanglement), repetitions, layout);
    }

    /**
     * 必要なパラメータ数を返します。
     *
     * @return {@code qubitCount × (repetitions + 1)} です
     */
    public int parameterCount() {
        return qubitCount * (repetitions + 1);
    }
}
