/*
Copyright 2016 Luke Blanshard

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

     http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package us.blanshard.einstein.gen;

import static com.google.common.base.Preconditions.checkNotNull;

import us.blanshard.einstein.clue.ClueCatalog;
import us.blanshard.einstein.core.ConfigurationException;
import us.blanshard.einstein.core.Geometry;
import us.blanshard.einstein.solver.Solver;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * The knobs of a puzzle generation run.  Use {@link #builder} to make one.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class GeneratorOptions {

  /** The names {@link Builder#set} accepts. */
  public static final ImmutableList<String> KEYS = ImmutableList.of(
      "theme", "size", "categories", "geometry", "difficulty", "minPathLen",
      "maxIterations", "maxRetries", "timeoutMillis", "catalogCap", "seed");

  public final String themeName;
  public final int size;
  public final int numCategories;
  public final Geometry geometry;
  public final Difficulty difficulty;
  public final int minPathLen;
  public final int maxIterations;
  public final int maxRetries;
  public final long timeoutMillis;
  public final int catalogCap;
  @Nullable public final Long seed;

  private GeneratorOptions(Builder b) {
    this.themeName = b.themeName;
    this.size = b.size;
    this.numCategories = b.numCategories;
    this.geometry = b.geometry;
    this.difficulty = b.difficulty;
    this.minPathLen = b.minPathLen;
    this.maxIterations = b.maxIterations;
    this.maxRetries = b.maxRetries;
    this.timeoutMillis = b.timeoutMillis;
    this.catalogCap = b.catalogCap;
    this.seed = b.seed;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    Builder b = new Builder();
    b.themeName = themeName;
    b.size = size;
    b.numCategories = numCategories;
    b.geometry = geometry;
    b.difficulty = difficulty;
    b.minPathLen = minPathLen;
    b.maxIterations = maxIterations;
    b.maxRetries = maxRetries;
    b.timeoutMillis = timeoutMillis;
    b.catalogCap = catalogCap;
    b.seed = seed;
    return b;
  }

  @Override public String toString() {
    return Joiner.on(' ').join(
        "theme=" + themeName, "size=" + size, "categories=" + numCategories,
        "geometry=" + geometry, "difficulty=" + difficulty, "minPathLen=" + minPathLen,
        "maxIterations=" + maxIterations, "maxRetries=" + maxRetries,
        "timeoutMillis=" + timeoutMillis, "catalogCap=" + catalogCap, "seed=" + seed);
  }

  @NotThreadSafe
  public static final class Builder {
    private String themeName = "street";
    private int size = 4;
    private int numCategories = 4;
    private Geometry geometry = Geometry.LINEAR;
    private Difficulty difficulty = Difficulty.MEDIUM;
    private int minPathLen = DifficultyAuditor.DEFAULT_MIN_PATH_LEN;
    private int maxIterations = PuzzleAssembler.DEFAULT_MAX_ITERATIONS;
    private int maxRetries = CoreGenerator.DEFAULT_MAX_RETRIES;
    private long timeoutMillis = Solver.DEFAULT_TIMEOUT_MILLIS;
    private int catalogCap = ClueCatalog.DEFAULT_CAP;
    @Nullable private Long seed;

    private Builder() {}

    public Builder setThemeName(String themeName) {
      this.themeName = checkNotNull(themeName);
      return this;
    }

    public Builder setSize(int size) {
      this.size = size;
      return this;
    }

    public Builder setNumCategories(int numCategories) {
      this.numCategories = numCategories;
      return this;
    }

    public Builder setGeometry(Geometry geometry) {
      this.geometry = checkNotNull(geometry);
      return this;
    }

    public Builder setDifficulty(Difficulty difficulty) {
      this.difficulty = checkNotNull(difficulty);
      return this;
    }

    public Builder setMinPathLen(int minPathLen) {
      this.minPathLen = minPathLen;
      return this;
    }

    public Builder setMaxIterations(int maxIterations) {
      this.maxIterations = maxIterations;
      return this;
    }

    public Builder setMaxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    public Builder setTimeoutMillis(long timeoutMillis) {
      this.timeoutMillis = timeoutMillis;
      return this;
    }

    public Builder setCatalogCap(int catalogCap) {
      this.catalogCap = catalogCap;
      return this;
    }

    public Builder setSeed(@Nullable Long seed) {
      this.seed = seed;
      return this;
    }

    /**
     * Sets the option with the given name from its string form, as given on a
     * command line.  Throws {@link ConfigurationException} for unknown names
     * and malformed values.
     */
    public Builder set(String key, String value) {
      try {
        if (key.equals("theme")) return setThemeName(value);
        if (key.equals("size")) return setSize(Integer.parseInt(value));
        if (key.equals("categories")) return setNumCategories(Integer.parseInt(value));
        if (key.equals("geometry")) return setGeometry(Geometry.valueOf(value.toUpperCase()));
        if (key.equals("difficulty")) return setDifficulty(Difficulty.valueOf(value.toUpperCase()));
        if (key.equals("minPathLen")) return setMinPathLen(Integer.parseInt(value));
        if (key.equals("maxIterations")) return setMaxIterations(Integer.parseInt(value));
        if (key.equals("maxRetries")) return setMaxRetries(Integer.parseInt(value));
        if (key.equals("timeoutMillis")) return setTimeoutMillis(Long.parseLong(value));
        if (key.equals("catalogCap")) return setCatalogCap(Integer.parseInt(value));
        if (key.equals("seed")) return setSeed(Long.valueOf(value));
      } catch (IllegalArgumentException e) {
        throw new ConfigurationException("Bad value for " + key + ": " + value, e);
      }
      throw new ConfigurationException("Unknown option " + key + "; expected one of " + KEYS);
    }

    /**
     * Builds the options.  Throws {@link ConfigurationException} if any is out
     * of range.
     */
    public GeneratorOptions build() {
      if (numCategories < 2)
        throw new ConfigurationException("Need at least 2 categories, got " + numCategories);
      if (minPathLen < 1)
        throw new ConfigurationException("minPathLen must be positive, got " + minPathLen);
      if (maxIterations < 1 || maxRetries < 1 || timeoutMillis < 1 || catalogCap < 1)
        throw new ConfigurationException("Limits must be positive: " + this);
      return new GeneratorOptions(this);
    }

    @Override public String toString() {
      return "maxIterations=" + maxIterations + " maxRetries=" + maxRetries
          + " timeoutMillis=" + timeoutMillis + " catalogCap=" + catalogCap;
    }
  }
}
