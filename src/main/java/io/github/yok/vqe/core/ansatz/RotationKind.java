package io.github.yok.vqe.core.ansatz;

import io.github.yok.vqe.core.ConstructionException;
import java.util.Locale;

/**
 * 1 量子ビット回転ゲートの種類です。
 */
public enum RotationKind {

    /**
     * X 軸回りの回転 RX(θ) です。
     */
    RX,

    /**
     * Y 軸回りの回転 RY(θ) です。
     */
    RY,

    /**
     * Z 軸回りの回転 RZ(θ) です。
     */
    RZ;

    /**
     * 名前（{@code "ry"} など、大文字小文字を区別しない）から種類を解決します。
     *
     * @param name 名前です
     * @return 回転の種類です
     * @throws ConstructionException 未知の名前の場合に発生します
     */
    public static RotationKind parse(String name) {
        if (name == null) {
            throw new ConstructionException("rotation は null 不可です");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConstructionException("未知の回転ゲートです: " + name);
        }
    }
}
