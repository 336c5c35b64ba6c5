package io.github.yok.vqe.core.affinity;

import lombok.Value;

/**
 * 「エネルギーが bound 未満なら verdict」という判定規則の 1 行です。
 */
@Value(staticConstructor = "of")
public class AffinityThreshold {

    /**
     * 上限（この値を含みません）です。
     */
    double bound;

    /**
     * 判定ラベルです。
     */
    AffinityVerdict verdict;

    /**
     * 残り全てを受ける規則（上限 +∞）を生成します。
     *
     * @param verdict 判定ラベルです
     * @return 規則です
     */
    public static AffinityThreshold otherwise(AffinityVerdict verdict) {
        return of(Double.POSITIVE_INFINITY, verdict);
    }
}
