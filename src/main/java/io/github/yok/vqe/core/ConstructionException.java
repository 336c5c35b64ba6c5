package io.github.yok.vqe.core;

/**
 * 演算子・アンザッツ・設定値などの入力が不正な場合に発生する例外です。
 *
 * <p>
 * 最適化を開始する前（構築時・検証時）に検出されます。
 * </p>
 */
public class ConstructionException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     */
    public ConstructionException(String message) {
        super(message);
    }

    /**
     * 原因付きで例外を生成します。
     *
     * @param message メッセージです
     * @param cause 原因です
     */
    public ConstructionException(String message, Throwable cause) {
        super(message, cause);
    }
}
