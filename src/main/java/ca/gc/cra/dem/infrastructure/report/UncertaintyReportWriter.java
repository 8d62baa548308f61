package ca.gc.cra.dem.infrastructure.report;

import ca.gc.cra.dem.application.port.RasterIoPort;
import ca.gc.cra.dem.application.uncertainty.UncertaintyResult;
import ca.gc.cra.dem.domain.uncertainty.ErrorModel;
import ca.gc.cra.dem.domain.uncertainty.ErrorSample;
import ca.gc.cra.dem.domain.uncertainty.RegionAnalysis;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.ToDoubleFunction;

/**
 * <strong>What:</strong> Persists an {@link UncertaintyResult} next to the DEM it describes.
 * <p>Files, for base name {@code n}: {@code n_prox_unc} and {@code n_slp_unc} rasters, {@code n_unc} when a
 * combined layer exists, {@code n_prox.err} and {@code n_slp.err} sample tables ({@code error value} per line)
 * and the {@code n_unc.json} summary with the fitted coefficients.</p>
 *
 * @since 0.1.0
 */
public final class UncertaintyReportWriter {
  private final RasterIoPort rasterIo;
  private final String rasterExtension;
  private final JsonFactory jsonFactory = new JsonFactory();

  /**
   * Creates a writer.
   *
   * @param rasterIo raster writer
   * @param rasterExtension raster file extension without the dot
   */
  public UncertaintyReportWriter(RasterIoPort rasterIo, String rasterExtension) {
    this.rasterIo = Objects.requireNonNull(rasterIo, "rasterIo");
    this.rasterExtension = Objects.requireNonNull(rasterExtension, "rasterExtension");
  }

  /**
   * Writes every output file.
   *
   * @param result estimation result
   * @param directory output directory
   * @param name output base name
   * @return written files
   * @throws IOException when a file cannot be written
   */
  public List<Path> write(UncertaintyResult result, Path directory, String name) throws IOException {
    Objects.requireNonNull(result, "result");
    Files.createDirectories(directory);
    List<Path> written = new ArrayList<>();
    written.add(rasterIo.write(result.distanceUncertainty(), directory.resolve(name + "_prox_unc." + rasterExtension)));
    written.add(rasterIo.write(result.slopeUncertainty(), directory.resolve(name + "_slp_unc." + rasterExtension)));
    if (result.combined().isPresent()) {
      written.add(rasterIo.write(result.combined().get(), directory.resolve(name + "_unc." + rasterExtension)));
    }
    written.add(writeSamples(result.samples(), ErrorSample::distance, directory.resolve(name + "_prox.err")));
    written.add(writeSamples(result.samples(), ErrorSample::slope, directory.resolve(name + "_slp.err")));
    written.add(writeSummary(result, name, directory.resolve(name + "_unc.json")));
    return written;
  }

  private static Path writeSamples(List<ErrorSample> samples, ToDoubleFunction<ErrorSample> axis, Path target)
      throws IOException {
    try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
      for (ErrorSample sample : samples) {
        writer.write(sample.error() + " " + axis.applyAsDouble(sample));
        writer.newLine();
      }
    }
    return target;
  }

  private Path writeSummary(UncertaintyResult result, String name, Path target) throws IOException {
    try (JsonGenerator gen = jsonFactory.createGenerator(target.toFile(), JsonEncoding.UTF8)) {
      gen.useDefaultPrettyPrinter();
      gen.writeStartObject();
      gen.writeStringField("name", name);
      RegionAnalysis analysis = result.analysis();
      gen.writeObjectFieldStart("analysis");
      gen.writeNumberField("cellCount", analysis.cellCount());
      gen.writeNumberField("dataCells", analysis.dataCells());
      gen.writeNumberField("densityPercent", analysis.densityPercent());
      gen.writeNumberField("proximity90", analysis.proximity90());
      gen.writeNumberField("proximity95", analysis.proximity95());
      gen.writeNumberField("proximityTarget", analysis.proximityTarget());
      gen.writeEndObject();
      gen.writeNumberField("tiles", result.tileCount());
      gen.writeNumberField("classifiedTiles", result.classifiedTiles());
      gen.writeNumberField("samplingTarget", result.samplingTarget());
      gen.writeObjectFieldStart("trials");
      gen.writeNumberField("completed", result.trialsCompleted());
      gen.writeNumberField("failed", result.trialsFailed());
      gen.writeEndObject();
      gen.writeNumberField("samples", result.samples().size());
      gen.writeObjectFieldStart("models");
      writeModel(gen, "distance", result.distanceModel());
      writeModel(gen, "slope", result.slopeModel());
      gen.writeEndObject();
      gen.writeEndObject();
    }
    return target;
  }

  private static void writeModel(JsonGenerator gen, String field, ErrorModel model) throws IOException {
    gen.writeArrayFieldStart(field);
    for (double coefficient : model.toArray()) {
      gen.writeNumber(coefficient);
    }
    gen.writeEndArray();
  }
}
