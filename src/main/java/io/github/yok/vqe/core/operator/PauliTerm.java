package io.github.yok.vqe.core.operator;

import io.github.yok.vqe.core.ConstructionException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Pauli 文字列（I, X, Y, Z のテンソル積）と実係数の組を表すクラスです。
 *
 * <p>
 * ラベルの k 文字目は量子ビット {@code n-1-k} に作用します（右端が量子ビット 0 です）。 状態ベクトルへの作用を高速に計算するため、ビットマスク表現も保持します。
 * </p>
 */
@Getter
@EqualsAndHashCode(of = {"label", "coefficient"})
@ToString(of = {"label", "coefficient"})
public final class PauliTerm {

    /**
     * Pauli 文字列です（例: {@code "ZIIZ"}）。
     */
    private final String label;

    /**
     * 係数です。
     */
    private final double coefficient;

    /**
     * 量子ビット数（ラベル長）です。
     */
    private final int qubitCount;

    /**
     * ビットを反転させる量子ビット（X または Y）のマスクです。
     */
    private final int flipMask;

    /**
     * 符号 (-1)^b を与える量子ビット（Z または Y）のマスクです。
     */
    private final int phaseMask;

    /**
     * Y の個数です（位相 i^{yCount} を与えます）。
     */
    private final int yCount;

    /**
     * 項を生成します。
     *
     * @param label Pauli 文字列です
     * @param coefficient 係数です（有限値）
     * @throws ConstructionException ラベルまたは係数が不正な場合に発生します
     */
    public PauliTerm(String label, double coefficient) {
        if (label == null || label.isEmpty()) {
            throw new ConstructionException("Pauli 文字列は空にできません");
        }
        if (label.length() > 30) {
            throw new ConstructionException("Pauli 文字列が長すぎます（30 量子ビットまで）: " + label);
        }
        if (!Double.isFinite(coefficient)) {
            throw new ConstructionException("係数は有限値が必要です: " + label + "=" + coefficient);
        }

        int n = label.length();
        int flip = 0;
        int phase = 0;
        int ys = 0;
        for (int k = 0; k < n; k++) {
            int bit = 1 << (n - 1 - k);
            char c = label.charAt(k);
            switch (c) {
                case 'I':
                    break;
                case 'X':
                    flip |= bit;
                    break;
                case 'Y':
                    flip |= bit;
                    phase |= bit;
                    ys++;
                    break;
                case 'Z':
                    phase |= bit;
                    break;
                default:
                    throw new ConstructionException(
                            "Pauli 文字列に使用できない文字が含まれています: '" + c + "' in " + label);
            }
        }

        this.label = label;
        this.coefficient = coefficient;
        this.qubitCount = n;
        this.flipMask = flip;
        this.phaseMask = phase;
        this.yCount = ys;
    }

    /**
     * 恒等演算子（全て I）かどうかを返します。
     *
     * @return 恒等演算子なら true です
     */
    public boolean isIdentity() {
        return flipMask == 0 && phaseMask == 0;
    }
}
