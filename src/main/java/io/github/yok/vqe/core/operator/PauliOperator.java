package io.github.yok.vqe.core.operator;

import io.github.yok.vqe.core.ConstructionException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Pauli 項の重み付き和で表されるハミルトニアン（不変）です。
 *
 * <p>
 * 全ての項のラベル長は等しく、その長さが計算全体の量子ビット数になります。
 * </p>
 */
@Getter
@EqualsAndHashCode
@ToString
public final class PauliOperator {

    /**
     * 項の一覧です（入力順、変更不可）。
     */
    private final List<PauliTerm> terms;

    /**
     * 量子ビット数です。
     */
    private final int qubitCount;

    private PauliOperator(List<PauliTerm> terms, int qubitCount) {
        this.terms = terms;
        this.qubitCount = qubitCount;
    }

    /**
     * ラベル列と係数列からハミルトニアンを構築します。
     *
     * @param labels Pauli 文字列の一覧です
     * @param coefficients 係数の一覧です（labels と同じ長さ）
     * @return ハミルトニアンです
     * @throws ConstructionException 長さ不一致、空、ラベル長の不一致、不正な文字や係数の場合に発生します
     */
    public static PauliOperator build(List<String> labels, List<Double> coefficients) {
        if (labels == null || coefficients == null) {
            throw new ConstructionException("labels と coefficients は null 不可です");
        }
        if (labels.size() != coefficients.size()) {
            throw new ConstructionException("項の数と係数の数が一致しません: labels=" + labels.size()
                    + ", coefficients=" + coefficients.size());
        }
        if (labels.isEmpty()) {
            throw new ConstructionException("ハミルトニアンには 1 つ以上の項が必要です");
        }

        List<PauliTerm> terms = new ArrayList<>(labels.size());
        int qubitCount = -1;
        for (int i = 0; i < labels.size(); i++) {
            Double c = coefficients.get(i);
            if (c == null) {
                throw new ConstructionException("係数に null が含まれています: index=" + i);
            }
            PauliTerm term = new PauliTerm(labels.get(i), c.doubleValue());
            if (qubitCount < 0) {
                qubitCount = term.getQubitCount();
            } else if (term.getQubitCount() != qubitCount) {
                throw new ConstructionException("Pauli 文字列の長さが揃っていません: " + labels.get(0)
                        + " と " + term.getLabel());
            }
            terms.add(term);
        }
        return new PauliOperator(Collections.unmodifiableList(terms), qubitCount);
    }

    /**
     * 係数の絶対値の総和 Σ|c| を返します。
     *
     * <p>
     * 任意の規格化状態に対する期待値は [-Σ|c|, Σ|c|] に収まります。
     * </p>
     *
     * @return 係数の絶対値の総和です
     */
    public double coefficientBound() {
        double s = 0.0;
        for (PauliTerm t : terms) {
            s += Math.abs(t.getCoefficient());
        }
        return s;
    }
}
