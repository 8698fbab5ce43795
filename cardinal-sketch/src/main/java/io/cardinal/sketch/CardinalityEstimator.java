package io.cardinal.sketch;

public interface CardinalityEstimator<T>
{
  void add(byte[] value);
  void add(long value);
  void addHash(long hash);

  void merge(T that);
  long count();
  long memoryFootprint();

  String name();
}
