package io.github.yok.vqe.core.solver;

import io.github.yok.vqe.core.ConstructionException;
import java.util.List;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.ContinuousSampler;
import org.apache.commons.rng.sampling.distribution.ContinuousUniformSampler;
import org.apache.commons.rng.simple.RandomSource;

/**
 * 最適化の初期点を生成するクラスです。
 *
 * <p>
 * 明示指定があればそれを使い、なければシード付き乱数で [-2π, 2π] の一様分布から生成します。 同じシードからは同じ初期点が得られます。
 * </p>
 */
final class InitialPointGenerator {

    /**
     * 一様分布の下限です。
     */
    static final double LOWER = -2.0 * Math.PI;

    /**
     * 一様分布の上限です。
     */
    static final double UPPER = 2.0 * Math.PI;

    private InitialPointGenerator() {}

    /**
     * 初期点を生成します。
     *
     * @param config 最適化設定です
     * @param parameterCount パラメータ数です
     * @return 初期点です
     * @throws ConstructionException 明示指定の長さがパラメータ数と一致しない場合に発生します
     */
    static double[] generate(OptimizerConfig config, int parameterCount) {
        List<Double> explicit = config.getInitialPoint();
        if (explicit != null) {
            if (explicit.size() != parameterCount) {
                throw new ConstructionException("initialPoint の長さがパラメータ数と一致しません: expected="
                        + parameterCount + ", actual=" + explicit.size());
            }
            double[] x = new double[parameterCount];
            for (int i = 0; i < parameterCount; i++) {
                x[i] = explicit.get(i);
            }
            return x;
        }

        UniformRandomProvider rng = RandomSource.XO_SHI_RO_256_PP.create(config.getInitialPointSeed());
        ContinuousSampler sampler = ContinuousUniformSampler.of(rng, LOWER, UPPER);
        double[] x = new double[parameterCount];
        for (int i = 0; i < parameterCount; i++) {
            x[i] = sampler.sample();
        }
        return x;
    }
}
