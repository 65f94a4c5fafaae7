/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.calcite.adapter.profiler.statistics;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * Bounded min-heap of the most frequent values seen so far.
 *
 * <p>Counts come from a {@link FrequencySketch}. A value that is not tracked
 * enters only when its estimate exceeds the smallest tracked count, which it
 * then evicts.
 */
public class TopKTracker {
  /** Heap order: smallest count first; among equal counts the largest value goes first. */
  private static final Comparator<Entry> EVICTION_ORDER =
      Comparator.comparingLong(Entry::getCount)
          .thenComparing(Entry::getValue, Comparator.reverseOrder());

  /** Report order: largest count first, then value ascending. */
  public static final Comparator<Entry> REPORT_ORDER =
      Comparator.comparingLong(Entry::getCount).reversed()
          .thenComparing(Entry::getValue);

  private final int capacity;
  private final PriorityQueue<Entry> heap;
  private final Map<String, Entry> members;

  public TopKTracker(int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.capacity = capacity;
    this.heap = new PriorityQueue<>(capacity, EVICTION_ORDER);
    this.members = new HashMap<>(capacity * 2);
  }

  /**
   * Offers a value with its current estimated count.
   */
  public void offer(String value, long estimate) {
    Entry existing = members.get(value);
    if (existing != null) {
      heap.remove(existing);
      existing.count = estimate;
      heap.add(existing);
      return;
    }
    if (heap.size() < capacity) {
      Entry entry = new Entry(value, estimate);
      heap.add(entry);
      members.put(value, entry);
      return;
    }
    Entry minimum = heap.peek();
    if (minimum != null && estimate > minimum.count) {
      heap.poll();
      members.remove(minimum.value);
      Entry entry = new Entry(value, estimate);
      heap.add(entry);
      members.put(value, entry);
    }
  }

  /**
   * Returns the tracked values, most frequent first.
   */
  public List<Entry> getTop() {
    List<Entry> entries = new ArrayList<>();
    for (Entry entry : heap) {
      entries.add(new Entry(entry.value, entry.count));
    }
    entries.sort(REPORT_ORDER);
    return ImmutableList.copyOf(entries);
  }

  public int size() {
    return heap.size();
  }

  public int getCapacity() {
    return capacity;
  }

  /** A tracked value and its estimated count. */
  public static final class Entry {
    private final String value;
    private long count;

    Entry(String value, long count) {
      this.value = value;
      this.count = count;
    }

    public String getValue() {
      return value;
    }

    public long getCount() {
      return count;
    }

    @Override public String toString() {
      return value + "=" + count;
    }
  }
}
