package io.github.yok.vqe.core.affinity;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 結合親和性の判定ラベルです（結合が強い順）。
 */
@Getter
@RequiredArgsConstructor
public enum AffinityVerdict {

    /**
     * 極めて強い結合です。
     */
    EXTREME("EXTREME AFFINITY", "より深いエネルギー井戸が見つかりました。統計的に極めて起こりやすい配置です。"),

    /**
     * 強い結合です。
     */
    HIGH("HIGH AFFINITY", "候補分子は Mpro に強く結合します。仮想合成と実験検証に進んでください。"),

    /**
     * 中程度の結合です。
     */
    MODERATE("MODERATE AFFINITY", "中程度の結合です。追加の検討が必要です。"),

    /**
     * 弱い結合です。
     */
    WEAK("WEAK AFFINITY", "候補分子は Mpro を十分に阻害しない可能性があります。");

    /**
     * 表示用ラベルです。
     */
    private final String label;

    /**
     * 推奨事項です。
     */
    private final String recommendation;
}
