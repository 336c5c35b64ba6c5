package io.github.yok.vqe.core.ansatz;

import java.util.ArrayList;
import java.util.List;

/**
 * エンタングル層で結合する量子ビット対の並べ方です。
 */
public enum EntanglementLayout {

    /**
     * 全ての対 (i, j), i &lt; j を辞書順に結合します。
     */
    FULL,

    /**
     * 隣接対 (i, i+1) を結合します。
     */
    LINEAR,

    /**
     * (n-1, 0) を先頭に、隣接対 (i, i+1) を結合します。
     */
    CIRCULAR;

    /**
     * (制御, 標的) の対の一覧を返します。
     *
     * @param qubitCount 量子ビット数です
     * @return 対の一覧です（各要素は長さ 2 の配列）
     */
    public List<int[]> pairs(int qubitCount) {
        List<int[]> out = new ArrayList<>();
        if (qubitCount < 2) {
            return out;
        }
        switch (this) {
            case FULL:
                for (int i = 0; i < qubitCount; i++) {
                    for (int j = i + 1; j < qubitCount; j++) {
                        out.add(new int[] {i, j});
                    }
                }
                break;
            case CIRCULAR:
                // 2 量子ビットでは (1, 0) が (0, 1) と重複するため追加しません
                if (qubitCount > 2) {
                    out.add(new int[] {qubitCount - 1, 0});
                }
                addLinear(out, qubitCount);
                break;
            case LINEAR:
            default:
                addLinear(out, qubitCount);
                break;
        }
        return out;
    }

    private static void addLinear(List<int[]> out, int qubitCount) {
        for (int i = 0; i + 1 < qubitCount; i++) {
            out.add(new int[] {i, i + 1});
        }
    }
}
