package io.github.yok.vqe.core;

/**
 * エネルギー評価の結果が数値として不正（非有限、または虚部が無視できない）な場合に発生する例外です。
 *
 * <p>
 * 実行中の最適化はこの例外で打ち切られ、再試行はしません。
 * </p>
 */
public class NumericException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     */
    public NumericException(String message) {
        super(message);
    }
}
