package io.github.yok.vqe.core.ansatz;

import io.github.yok.vqe.core.ConstructionException;
import java.util.Locale;

/**
 * 2 量子ビットのエンタングルゲートの種類です。
 */
public enum EntanglementKind {

    /**
     * 制御 NOT ゲートです。
     */
    CX,

    /**
     * 制御 Z ゲートです。
     */
    CZ;

    /**
     * 名前（{@code "cx"} など、大文字小文字を区別しない）から種類を解決します。
     *
     * @param name 名前です
     * @return エンタングルゲートの種類です
     * @throws ConstructionException 未知の名前の場合に発生します
     */
    public static EntanglementKind parse(String name) {
        if (name == null) {
            throw new ConstructionException("entanglement は null 不可です");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConstructionException("未知のエンタングルゲートです: " + name);
        }
    }
}
