package com.notelinker.engine.service.similarity;

import java.util.List;

/** Vector arithmetic over embedding vectors. */
public final class VectorMath {

  private VectorMath() {}

  /**
   * Cosine similarity clamped to [0, 1]. A zero vector is treated as maximally dissimilar.
   *
   * @throws IllegalArgumentException if the vectors are empty or differ in length
   */
  public static double cosineSimilarity(float[] a, float[] b) {
    requireNonEmpty(a);
    requireNonEmpty(b);
    if (a.length != b.length) {
      throw new IllegalArgumentException(
          "Vector dimension mismatch: " + a.length + " vs " + b.length);
    }

    double dot = 0.0;
    double normA = 0.0;
    double normB = 0.0;
    for (int i = 0; i < a.length; i++) {
      dot += (double) a[i] * b[i];
      normA += (double) a[i] * a[i];
      normB += (double) b[i] * b[i];
    }

    if (normA == 0.0 || normB == 0.0) {
      return 0.0;
    }
    double similarity = dot / (Math.sqrt(normA) * Math.sqrt(normB));
    return Math.max(0.0, Math.min(1.0, similarity));
  }

  /** Symmetric similarity matrix with an exact diagonal of 1. */
  public static double[][] pairwiseSimilarities(List<float[]> vectors) {
    int n = vectors.size();
    double[][] matrix = new double[n][n];
    for (int i = 0; i < n; i++) {
      matrix[i][i] = 1.0;
      for (int j = i + 1; j < n; j++) {
        double similarity = cosineSimilarity(vectors.get(i), vectors.get(j));
        matrix[i][j] = similarity;
        matrix[j][i] = similarity;
      }
    }
    return matrix;
  }

  public static double dotProduct(float[] a, float[] b) {
    if (a.length != b.length) {
      throw new IllegalArgumentException(
          "Vector dimension mismatch: " + a.length + " vs " + b.length);
    }
    double sum = 0.0;
    for (int i = 0; i < a.length; i++) {
      sum += (double) a[i] * b[i];
    }
    return sum;
  }

  public static double magnitude(float[] vector) {
    double sum = 0.0;
    for (float value : vector) {
      sum += (double) value * value;
    }
    return Math.sqrt(sum);
  }

  /** Unit-length copy of {@code vector}; a zero vector is returned unchanged. */
  public static float[] normalize(float[] vector) {
    double length = magnitude(vector);
    float[] result = new float[vector.length];
    for (int i = 0; i < vector.length; i++) {
      result[i] = length == 0.0 ? vector[i] : (float) (vector[i] / length);
    }
    return result;
  }

  private static void requireNonEmpty(float[] vector) {
    if (vector == null || vector.length == 0) {
      throw new IllegalArgumentException("Vector must not be empty");
    }
  }
}
