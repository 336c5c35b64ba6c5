package io.github.yok.vqe.core.affinity;

import io.github.yok.vqe.core.ConstructionException;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 判定規則の順序付き一覧です（不変）。
 *
 * <p>
 * 上限は厳密に増加し、最後の上限は +∞ でなければなりません。 これにより実数全体で判定が必ず 1 つに決まります。
 * </p>
 */
@Getter
@EqualsAndHashCode
@ToString
public final class ThresholdTable {

    /**
     * 判定規則です（最も極端なものが先頭）。
     */
    private final List<AffinityThreshold> thresholds;

    private ThresholdTable(List<AffinityThreshold> thresholds) {
        this.thresholds = thresholds;
    }

    /**
     * 規則一覧を検証して表を生成します。
     *
     * @param thresholds 規則一覧です
     * @return 判定表です
     * @throws ConstructionException 空、null を含む、上限が増加しない、または最後が +∞ でない場合に発生します
     */
    public static ThresholdTable of(List<AffinityThreshold> thresholds) {
        if (thresholds == null || thresholds.isEmpty()) {
            throw new ConstructionException("判定表には 1 つ以上の規則が必要です");
        }
        double previous = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < thresholds.size(); i++) {
            AffinityThreshold t = thresholds.get(i);
            if (t == null || t.getVerdict() == null) {
                throw new ConstructionException("判定表に null の規則があります: index=" + i);
            }
            double bound = t.getBound();
            if (Double.isNaN(bound) || !(bound > previous)) {
                throw new ConstructionException("判定表の上限は厳密に増加する必要があります: " + thresholds);
            }
            previous = bound;
        }
        if (previous != Double.POSITIVE_INFINITY) {
            throw new ConstructionException("判定表の最後の上限は +∞ が必要です: " + thresholds);
        }
        return new ThresholdTable(List.copyOf(thresholds));
    }
}
