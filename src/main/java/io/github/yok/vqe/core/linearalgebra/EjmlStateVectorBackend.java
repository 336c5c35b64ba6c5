package io.github.yok.vqe.core.linearalgebra;

import io.github.yok.vqe.core.ConstructionException;
import io.github.yok.vqe.core.ansatz.AnsatzSpec;
import io.github.yok.vqe.core.ansatz.EntanglementKind;
import io.github.yok.vqe.core.ansatz.RotationKind;
import io.github.yok.vqe.core.operator.PauliTerm;
import java.util.List;
import org.ejml.data.Complex_F64;
import org.ejml.data.ZMatrixRMaj;
import org.ejml.dense.row.CommonOps_ZDRM;

/**
 * EJML の複素行列（{@link ZMatrixRMaj}）を用いて、状態ベクトルを厳密にシミュレーションするクラスです。
 *
 * <p>
 * ゲートは 2^n×2^n 行列を作らず、振幅の添字操作で直接作用させます。 期待値の内積 ⟨ψ|Pψ⟩ は EJML の共役転置と行列積で計算します。
 * </p>
 */
public final class EjmlStateVectorBackend implements StateVectorBackend {

    /**
     * シミュレーション可能な最大量子ビット数です。
     */
    public static final int MAX_QUBITS = 20;

    /**
     * |0…0⟩ にアンザッツ回路を作用させた状態を返します。
     *
     * @param ansatz アンザッツ定義です
     * @param parameters 回転角の配列です
     * @return 状態ベクトルです
     * @throws IllegalArgumentException 引数が null の場合に発生します
     * @throws ConstructionException パラメータ数が一致しない、または量子ビット数が大きすぎる場合に発生します
     */
    @Override
    public ZMatrixRMaj prepareState(AnsatzSpec ansatz, double[] parameters) {
        if (ansatz == null || parameters == null) {
            throw new IllegalArgumentException("ansatz/parameters は null 不可です");
        }
        if (parameters.length != ansatz.parameterCount()) {
            throw new ConstructionException("パラメータ数が一致しません: expected="
                    + ansatz.parameterCount() + ", actual=" + parameters.length);
        }
        int n = ansatz.getQubitCount();
        if (n > MAX_QUBITS) {
            throw new ConstructionException("量子ビット数が大きすぎます: " + n + " > " + MAX_QUBITS);
        }

        ZMatrixRMaj state = new ZMatrixRMaj(1 << n, 1);
        state.set(0, 0, 1.0, 0.0);

        List<int[]> pairs = ansatz.getEntanglementLayout().pairs(n);
        int p = 0;
        for (int rep = 0; rep < ansatz.getRepetitions(); rep++) {
            for (int q = 0; q < n; q++) {
                applyRotation(state, q, ansatz.getRotationKind(), parameters[p++]);
            }
            for (int[] pair : pairs) {
                applyEntangler(state, pair[0], pair[1], ansatz.getEntanglementKind());
            }
        }
        // 最終回転層
        for (int q = 0; q < n; q++) {
            applyRotation(state, q, ansatz.getRotationKind(), parameters[p++]);
        }
        return state;
    }

    /**
     * Pauli 文字列 P を作用させた新しい状態 P|ψ⟩ を返します。
     *
     * <p>
     * P|b⟩ = i^{#Y} (-1)^{popcount(b &amp; phaseMask)} |b ⊕ flipMask⟩ を用います。
     * </p>
     *
     * @param term Pauli 項です
     * @param state 状態ベクトルです
     * @return P|ψ⟩ です
     */
    @Override
    public ZMatrixRMaj applyPauli(PauliTerm term, ZMatrixRMaj state) {
        int dim = state.getNumRows();
        if (dim != (1 << term.getQubitCount())) {
            throw new ConstructionException("Pauli 項と状態の量子ビット数が一致しません: " + term.getLabel());
        }

        int flip = term.getFlipMask();
        int phaseMask = term.getPhaseMask();

        // i^{yCount} を (re, im) で表します。
        double globalRe;
        double globalIm;
        switch (term.getYCount() & 3) {
            case 0:
                globalRe = 1.0;
                globalIm = 0.0;
                break;
            case 1:
                globalRe = 0.0;
                globalIm = 1.0;
                break;
            case 2:
                globalRe = -1.0;
                globalIm = 0.0;
                break;
            default:
                globalRe = 0.0;
                globalIm = -1.0;
                break;
        }

        ZMatrixRMaj out = new ZMatrixRMaj(dim, 1);
        for (int b = 0; b < dim; b++) {
            double sign = (Integer.bitCount(b & phaseMask) & 1) == 0 ? 1.0 : -1.0;
            double re = state.getReal(b, 0);
            double im = state.getImag(b, 0);
            double fr = sign * globalRe;
            double fi = sign * globalIm;
            out.set(b ^ flip, 0, fr * re - fi * im, fr * im + fi * re);
        }
        return out;
    }

    /**
     * 期待値 ⟨ψ|P|ψ⟩ を複素数で返します。
     *
     * @param state 状態ベクトルです
     * @param term Pauli 項です
     * @return 期待値です
     */
    @Override
    public Complex_F64 expectation(ZMatrixRMaj state, PauliTerm term) {
        ZMatrixRMaj applied = applyPauli(term, state);
        ZMatrixRMaj bra = new ZMatrixRMaj(1, state.getNumRows());
        CommonOps_ZDRM.transposeConjugate(state, bra);
        ZMatrixRMaj scalar = new ZMatrixRMaj(1, 1);
        CommonOps_ZDRM.mult(bra, applied, scalar);
        return new Complex_F64(scalar.getReal(0, 0), scalar.getImag(0, 0));
    }

    /**
     * 1 量子ビット回転を作用させます。
     *
     * @param state 状態ベクトルです（更新対象）
     * @param qubit 対象量子ビットです
     * @param kind 回転の種類です
     * @param theta 回転角です
     */
    private static void applyRotation(ZMatrixRMaj state, int qubit, RotationKind kind,
            double theta) {
        double c = Math.cos(0.5 * theta);
        double s = Math.sin(0.5 * theta);

        // u = [[u00, u01], [u10, u11]] の (re, im)
        double[] u;
        switch (kind) {
            case RX:
                u = new double[] {c, 0.0, 0.0, -s, 0.0, -s, c, 0.0};
                break;
            case RZ:
                u = new double[] {c, -s, 0.0, 0.0, 0.0, 0.0, c, s};
                break;
            case RY:
            default:
                u = new double[] {c, 0.0, -s, 0.0, s, 0.0, c, 0.0};
                break;
        }
        applySingleQubit(state, qubit, u);
    }

    /**
     * 2×2 ユニタリを 1 量子ビットに作用させます。
     *
     * @param state 状態ベクトルです（更新対象）
     * @param qubit 対象量子ビットです
     * @param u 行列要素 (u00, u01, u10, u11) の (re, im) を並べた長さ 8 の配列です
     */
    private static void applySingleQubit(ZMatrixRMaj state, int qubit, double[] u) {
        int dim = state.getNumRows();
        int bit = 1 << qubit;
        for (int i0 = 0; i0 < dim; i0++) {
            if ((i0 & bit) != 0) {
                continue;
            }
            int i1 = i0 | bit;

            double a0r = state.getReal(i0, 0);
            double a0i = state.getImag(i0, 0);
            double a1r = state.getReal(i1, 0);
            double a1i = state.getImag(i1, 0);

            double b0r = u[0] * a0r - u[1] * a0i + u[2] * a1r - u[3] * a1i;
            double b0i = u[0] * a0i + u[1] * a0r + u[2] * a1i + u[3] * a1r;
            double b1r = u[4] * a0r - u[5] * a0i + u[6] * a1r - u[7] * a1i;
            double b1i = u[4] * a0i + u[5] * a0r + u[6] * a1i + u[7] * a1r;

            state.set(i0, 0, b0r, b0i);
            state.set(i1, 0, b1r, b1i);
        }
    }

    /**
     * 2 量子ビットのエンタングルゲートを作用させます。
     *
     * @param state 状態ベクトルです（更新対象）
     * @param control 制御量子ビットです
     * @param target 標的量子ビットです
     * @param kind ゲートの種類です
     */
    private static void applyEntangler(ZMatrixRMaj state, int control, int target,
            EntanglementKind kind) {
        int dim = state.getNumRows();
        int cBit = 1 << control;
        int tBit = 1 << target;

        for (int i = 0; i < dim; i++) {
            if ((i & cBit) == 0) {
                continue;
            }
            if (kind == EntanglementKind.CZ) {
                if ((i & tBit) != 0) {
                    state.set(i, 0, -state.getReal(i, 0), -state.getImag(i, 0));
                }
            } else if ((i & tBit) == 0) {
                // CX: 制御=1 の部分空間で標的ビットを反転（対ごとに 1 回だけ交換）
                int j = i | tBit;
                double re = state.getReal(i, 0);
                double im = state.getImag(i, 0);
                state.set(i, 0, state.getReal(j, 0), state.getImag(j, 0));
                state.set(j, 0, re, im);
            }
        }
    }
}
