package io.github.yok.vqe.core.evaluator;

import io.github.yok.vqe.core.ConstructionException;
import io.github.yok.vqe.core.NumericException;
import io.github.yok.vqe.core.ansatz.AnsatzSpec;
import io.github.yok.vqe.core.linearalgebra.StateVectorBackend;
import io.github.yok.vqe.core.operator.PauliOperator;
import io.github.yok.vqe.core.operator.PauliTerm;
import lombok.Getter;
import org.ejml.data.Complex_F64;
import org.ejml.data.ZMatrixRMaj;

/**
 * 厳密な状態ベクトルからエネルギー期待値 Σ c_k ⟨ψ|P_k|ψ⟩ を計算するクラスです。
 *
 * <p>
 * 恒等項は状態に依らず係数そのものを寄与させます。 複素数の総和の虚部は許容誤差以下であることを確認してから捨てます。
 * </p>
 */
@Getter
public final class StatevectorEnergyEvaluator implements EnergyEvaluator {

    /**
     * 虚部の既定の許容誤差です。
     */
    public static final double DEFAULT_IMAGINARY_TOLERANCE = 1e-10;

    /**
     * 状態ベクトルのバックエンドです。
     */
    private final StateVectorBackend backend;

    /**
     * 虚部の許容誤差（絶対値）です。
     */
    private final double imaginaryTolerance;

    /**
     * 既定の許容誤差で生成します。
     *
     * @param backend 状態ベクトルのバックエンドです（null 不可）
     */
    public StatevectorEnergyEvaluator(StateVectorBackend backend) {
        this(backend, DEFAULT_IMAGINARY_TOLERANCE);
    }

    /**
     * 生成します。
     *
     * @param backend 状態ベクトルのバックエンドです（null 不可）
     * @param imaginaryTolerance 虚部の許容誤差です（0 より大きい）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public StatevectorEnergyEvaluator(StateVectorBackend backend, double imaginaryTolerance) {
        if (backend == null) {
            throw new IllegalArgumentException("backend は null 不可です");
        }
        if (!(imaginaryTolerance > 0.0)) {
            throw new IllegalArgumentException(
                    "imaginaryTolerance は 0 より大きい必要があります: " + imaginaryTolerance);
        }
        this.backend = backend;
        this.imaginaryTolerance = imaginaryTolerance;
    }

    /**
     * エネルギー期待値を計算します。
     *
     * @param operator ハミルトニアンです
     * @param ansatz アンザッツ定義です
     * @param parameters パラメータ配列です
     * @return エネルギー期待値です
     * @throws ConstructionException 入力が整合しない場合に発生します
     * @throws NumericException 結果が数値として不正な場合に発生します
     */
    @Override
    public double evaluate(PauliOperator operator, AnsatzSpec ansatz, double[] parameters) {
        if (operator == null || ansatz == null || parameters == null) {
            throw new IllegalArgumentException("operator/ansatz/parameters は null 不可です");
        }
        if (operator.getQubitCount() != ansatz.getQubitCount()) {
            throw new ConstructionException("ハミルトニアンとアンザッツの量子ビット数が一致しません: operator="
                    + operator.getQubitCount() + ", ansatz=" + ansatz.getQubitCount());
        }
        if (parameters.length != ansatz.parameterCount()) {
            throw new ConstructionException("パラメータ数が一致しません: expected="
                    + ansatz.parameterCount() + ", actual=" + parameters.length);
        }

        ZMatrixRMaj state = backend.prepareState(ansatz, parameters);

        double real = 0.0;
        double imag = 0.0;
        for (PauliTerm term : operator.getTerms()) {
            if (term.isIdentity()) {
                real += term.getCoefficient();
                continue;
            }
            Complex_F64 e = backend.expectation(state, term);
            real += term.getCoefficient() * e.real;
            imag += term.getCoefficient() * e.imaginary;
        }

        if (!Double.isFinite(real) || !Double.isFinite(imag)) {
            throw new NumericException("エネルギーが有限値になりません: re=" + real + ", im=" + imag);
        }
        if (Math.abs(imag) > imaginaryTolerance) {
            throw new NumericException(
                    "エネルギーの虚部が無視できません: im=" + imag + " (許容=" + imaginaryTolerance + ")");
        }
        return real;
    }
}
