package io.github.yok.vqe.core.affinity;

/**
 * エネルギーを判定表に照らして結合親和性ラベルに分類するクラスです。
 *
 * <p>
 * 規則は先頭から順に評価し、{@code energy < bound} を最初に満たした規則のラベルを返します。 境界値ちょうどのエネルギーは次の規則へ進みます。
 * </p>
 */
public final class AffinityClassifier {

    /**
     * エネルギーを分類します。
     *
     * @param energy エネルギーです（有限値）
     * @param table 判定表です
     * @return 判定ラベルです
     * @throws IllegalArgumentException energy が有限値でない、または table が null の場合に発生します
     */
    public AffinityVerdict classify(double energy, ThresholdTable table) {
        if (table == null) {
            throw new IllegalArgumentException("table は null 不可です");
        }
        if (!Double.isFinite(energy)) {
            throw new IllegalArgumentException("エネルギーは有限値が必要です: " + energy);
        }
        for (AffinityThreshold t : table.getThresholds()) {
            if (energy < t.getBound()) {
                return t.getVerdict();
            }
        }
        // 最後の上限が +∞ のためここには到達しません。
        throw new IllegalStateException("判定表が実数全体を覆っていません: " + table);
    }
}
