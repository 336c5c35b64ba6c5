package io.github.yok.vqe.out;

import io.github.yok.vqe.core.simulation.SimulationReport;
import io.github.yok.vqe.core.solver.EnergyResult;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * シミュレーション結果を CSV に出力するクラスです。
 *
 * <p>
 * 出力ファイル名は戦略名を含みます（例: {@code vqe_history_deterministic.csv}, {@code vqe_meta_deterministic.csv}）。
 * </p>
 */
public final class CsvResultWriter implements ResultWriter {

    /**
     * ファイル名の先頭固定文字列です。
     */
    private static final String FILE_HEAD = "vqe";

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @throws IllegalArgumentException outputDir が空の場合に発生します
     */
    public CsvResultWriter(String outputDir) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        this.outputDir = Paths.get(outputDir);
    }

    /**
     * 結果を出力します。
     *
     * @param report シミュレーション結果です
     * @param referenceEnergy 参照エネルギーです（null 可）
     * @throws IllegalArgumentException report が null の場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void write(SimulationReport report, Double referenceEnergy) {
        if (report == null) {
            throw new IllegalArgumentException("report は null 不可です");
        }
        String kind = report.getEnergyResult().getStrategy().name().toLowerCase(Locale.ROOT);
        try {
            Files.createDirectories(outputDir);

            // 1) 反復ごとのエネルギー
            writeHistoryCsv(report.getEnergyResult(), kind);

            // 2) メタ（最終エネルギー、判定、最適パラメータなど）
            writeMetaCsv(report, referenceEnergy, kind);

        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + outputDir, e);
        }
    }

    /**
     * エネルギー履歴を出力します。
     *
     * @param result 最適化結果です
     * @param kind 戦略名（小文字）です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeHistoryCsv(EnergyResult result, String kind) throws IOException {
        Path file = outputDir.resolve(buildFileName("history", kind));
        List<Double> history = result.getEnergyHistory();

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("iteration", "energy").build().print(w)) {
            for (int i = 0; i < history.size(); i++) {
                pr.printRecord(i + 1, history.get(i));
            }
        }
    }

    /**
     * メタ情報を出力します。
     *
     * @param report シミュレーション結果です
     * @param referenceEnergy 参照エネルギーです（null 可）
     * @param kind 戦略名（小文字）です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeMetaCsv(SimulationReport report, Double referenceEnergy, String kind)
            throws IOException {
        Path file = outputDir.resolve(buildFileName("meta", kind));
        EnergyResult r = report.getEnergyResult();

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("key", "value").build().print(w)) {

            pr.printRecord("strategy", r.getStrategy());
            pr.printRecord("energy", r.getValue());
            pr.printRecord("verdict", report.getVerdict());
            pr.printRecord("iterations", r.getIterationsUsed());
            pr.printRecord("converged", r.isConverged());
            pr.printRecord("evaluations", r.getEvaluationCount());
            if (referenceEnergy != null) {
                pr.printRecord("reference.energy", referenceEnergy);
                pr.printRecord("reference.gap", r.getValue() - referenceEnergy);
            }

            double[] theta = r.getOptimalParameters();
            for (int i = 0; i < theta.length; i++) {
                pr.printRecord("theta[" + i + "]", theta[i]);
            }
        }
    }

    /**
     * 命名規約に従ってファイル名を作成します。
     *
     * @param content 内容の識別子（history/meta）です
     * @param kind 戦略名です
     * @return ファイル名です
     */
    private static String buildFileName(String content, String kind) {
        return FILE_HEAD + "_" + content + "_" + kind + ".csv";
    }
}
