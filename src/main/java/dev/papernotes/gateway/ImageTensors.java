package dev.papernotes.gateway;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Pure image-to-tensor helpers shared by the ONNX image encoders: aspect-preserving letterbox
 * resize, NCHW float layout with per-channel normalisation, and output pooling.
 */
public final class ImageTensors {

  /** How a model's output tensor is reduced to a single vector. */
  public enum Pooling {
    /** Output is already {@code [1, D]}; use it as-is. */
    FLAT,
    /** Output is {@code [1, T, D]}; take the first (CLS) token. */
    CLS,
    /** Output is {@code [1, T, D]}; average over tokens. */
    MEAN
  }

  private ImageTensors() {
    // utility class
  }

  /**
   * Scales {@code source} to fit a {@code size x size} square preserving aspect ratio and centres
   * it on a {@code padding}-filled canvas.
   */
  public static BufferedImage letterbox(BufferedImage source, int size, Color padding) {
    int srcW = source.getWidth();
    int srcH = source.getHeight();
    double ratio = (double) srcW / srcH;
    int newW;
    int newH;
    if (srcW > srcH) {
      newW = size;
      newH = Math.max(1, (int) (size / ratio));
    } else {
      newH = size;
      newW = Math.max(1, (int) (size * ratio));
    }

    BufferedImage out = new BufferedImage(size, size, BufferedImage.TYPE_INT_RGB);
    Graphics2D g = out.createGraphics();
    try {
      g.setRenderingHint(
          RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
      g.setColor(padding);
      g.fillRect(0, 0, size, size);
      g.drawImage(source, (size - newW) / 2, (size - newH) / 2, newW, newH, null);
    } finally {
      g.dispose();
    }
    return out;
  }

  /**
   * Converts an RGB image to a {@code [1, 3, H, W]} float tensor, scaling to [0, 1] and applying
   * {@code (x - mean) / std} per channel.
   */
  public static float[] toNchw(BufferedImage image, float[] mean, float[] std) {
    int w = image.getWidth();
    int h = image.getHeight();
    int plane = w * h;
    int[] pixels = image.getRGB(0, 0, w, h, null, 0, w);
    float[] data = new float[3 * plane];
    for (int i = 0; i < plane; i++) {
      int p = pixels[i];
      float r = ((p >> 16) & 0xFF) / 255f;
      float g = ((p >> 8) & 0xFF) / 255f;
      float b = (p & 0xFF) / 255f;
      data[i] = (r - mean[0]) / std[0];
      data[plane + i] = (g - mean[1]) / std[1];
      data[2 * plane + i] = (b - mean[2]) / std[2];
    }
    return data;
  }

  /**
   * Reduces a flat output tensor to one vector.
   *
   * @param output row-major tensor data
   * @param shape tensor shape, {@code [1, D]} or {@code [1, T, D]}
   * @param pooling reduction to apply
   */
  public static float[] pool(float[] output, long[] shape, Pooling pooling) {
    int dim = (int) shape[shape.length - 1];
    if (pooling == Pooling.FLAT || shape.length < 3) {
      float[] flat = new float[dim];
      System.arraycopy(output, 0, flat, 0, dim);
      return flat;
    }
    int tokens = (int) shape[shape.length - 2];
    float[] pooled = new float[dim];
    if (pooling == Pooling.CLS) {
      System.arraycopy(output, 0, pooled, 0, dim);
      return pooled;
    }
    for (int t = 0; t < tokens; t++) {
      for (int d = 0; d < dim; d++) {
        pooled[d] += output[t * dim + d];
      }
    }
    for (int d = 0; d < dim; d++) {
      pooled[d] /= tokens;
    }
    return pooled;
  }
}
