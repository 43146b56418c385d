package dev.papernotes.gateway;

import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import dev.langchain4j.data.embedding.Embedding;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.nio.FloatBuffer;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Image encoder running an ONNX model in-process. Preprocessing is letterbox resize to a square
 * input, NCHW layout with per-channel mean/std normalisation; the output is pooled to one vector
 * and L2-normalized.
 *
 * <p>{@link OrtSession#run} is safe for concurrent calls, so one instance serves all pipeline
 * threads.
 */
public class OnnxImageEmbeddingModel implements ImageEmbeddingModel, AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(OnnxImageEmbeddingModel.class);

  private final String name;
  private final OrtEnvironment environment;
  private final OrtSession session;
  private final String inputName;
  private final Settings settings;

  /**
   * Preprocessing and output settings of one model.
   *
   * @param inputSize side of the square model input
   * @param dimension expected output dimension
   * @param mean per-channel RGB mean
   * @param std per-channel RGB standard deviation
   * @param padding letterbox fill colour
   * @param pooling output reduction
   */
  public record Settings(
      int inputSize,
      int dimension,
      float[] mean,
      float[] std,
      Color padding,
      ImageTensors.Pooling pooling) {}

  OnnxImageEmbeddingModel(
      String name, OrtEnvironment environment, OrtSession session, Settings settings) {
    this.name = name;
    this.environment = environment;
    this.session = session;
    this.inputName = session.getInputNames().iterator().next();
    this.settings = settings;
  }

  /**
   * Loads a model from disk.
   *
   * @param name label used in logs
   * @param modelPath path to the {@code .onnx} file
   * @param settings preprocessing and output settings
   */
  public static OnnxImageEmbeddingModel load(String name, String modelPath, Settings settings) {
    try {
      OrtEnvironment env = OrtEnvironment.getEnvironment();
      OrtSession session = env.createSession(modelPath, new OrtSession.SessionOptions());
      log.info("Loaded {} image model from {} ({} dims)", name, modelPath, settings.dimension());
      return new OnnxImageEmbeddingModel(name, env, session, settings);
    } catch (OrtException e) {
      throw new IllegalStateException("Failed to load " + name + " model from " + modelPath, e);
    }
  }

  @Override
  public Embedding embed(BufferedImage image) {
    int size = settings.inputSize();
    BufferedImage square = ImageTensors.letterbox(image, size, settings.padding());
    float[] input = ImageTensors.toNchw(square, settings.mean(), settings.std());

    try (OnnxTensor tensor =
            OnnxTensor.createTensor(
                environment, FloatBuffer.wrap(input), new long[] {1, 3, size, size});
        OrtSession.Result result = session.run(Map.of(inputName, tensor))) {
      OnnxTensor output = (OnnxTensor) result.get(0);
      long[] shape = output.getInfo().getShape();
      FloatBuffer buffer = output.getFloatBuffer();
      float[] raw = new float[buffer.remaining()];
      buffer.get(raw);
      float[] pooled = ImageTensors.pool(raw, shape, settings.pooling());
      if (pooled.length != settings.dimension()) {
        throw new FieldDerivationException(
            name + " produced " + pooled.length + " dims, expected " + settings.dimension());
      }
      return Vectors.normalized(pooled);
    } catch (OrtException e) {
      throw new FieldDerivationException(name + " inference failed: " + e.getMessage(), e);
    }
  }

  @Override
  public int dimension() {
    return settings.dimension();
  }

  @Override
  public void close() {
    try {
      session.close();
    } catch (OrtException e) {
      log.warn("Failed to close {} session: {}", name, e.getMessage());
    }
  }
}
