package io.github.yok.vqe.core.simulation;

import java.util.List;
import lombok.Value;

/**
 * ハミルトニアンの入力値（未検証）です。
 */
@Value
public class OperatorDefinition {

    /**
     * Pauli 文字列の一覧です。
     */
    List<String> paulis;

    /**
     * 係数の一覧です。
     */
    List<Double> coefficients;
}
