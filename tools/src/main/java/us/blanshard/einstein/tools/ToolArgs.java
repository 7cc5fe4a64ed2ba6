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
package us.blanshard.einstein.tools;

import us.blanshard.einstein.core.ConfigurationException;
import us.blanshard.einstein.gen.GeneratorOptions;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.LogManager;

import javax.annotation.Nullable;

/**
 * Command-line arguments of the form {@code key=value}.  Generator option names
 * go to {@link GeneratorOptions.Builder#set}; each tool names the extra keys it
 * takes.
 *
 * @author Luke Blanshard
 */
public final class ToolArgs {
  private static final Splitter EQUALS = Splitter.on('=').limit(2).trimResults();

  private final Map<String, String> extras = Maps.newLinkedHashMap();
  private final GeneratorOptions.Builder options = GeneratorOptions.builder();

  private ToolArgs() {}

  /**
   * Parses the given arguments.  Throws {@link ConfigurationException} for
   * malformed ones and for unknown keys.
   */
  public static ToolArgs parse(String[] args, Set<String> extraKeys) {
    ToolArgs answer = new ToolArgs();
    for (String arg : args) {
      List<String> parts = EQUALS.splitToList(arg);
      if (parts.size() != 2 || parts.get(0).isEmpty())
        throw new ConfigurationException("Expected key=value, got " + arg);
      String key = parts.get(0);
      if (extraKeys.contains(key))
        answer.extras.put(key, parts.get(1));
      else
        answer.options.set(key, parts.get(1));
    }
    return answer;
  }

  public static ToolArgs parse(String[] args, String... extraKeys) {
    return parse(args, ImmutableSet.copyOf(extraKeys));
  }

  public GeneratorOptions.Builder options() {
    return options;
  }

  @Nullable public String get(String key) {
    return extras.get(key);
  }

  public String get(String key, String defaultValue) {
    String value = extras.get(key);
    return value == null ? defaultValue : value;
  }

  public int getInt(String key, int defaultValue) {
    String value = extras.get(key);
    try {
      return value == null ? defaultValue : Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new ConfigurationException("Bad number for " + key + ": " + value, e);
    }
  }

  @Nullable public File getFile(String key) {
    String value = extras.get(key);
    return value == null ? null : new File(value);
  }

  /** Installs the logging setup bundled with the tools. */
  public static void configureLogging() throws IOException {
    InputStream in = ToolArgs.class.getResourceAsStream("/logging.properties");
    if (in == null) return;
    try {
      LogManager.getLogManager().readConfiguration(in);
    } finally {
      in.close();
    }
  }
}
