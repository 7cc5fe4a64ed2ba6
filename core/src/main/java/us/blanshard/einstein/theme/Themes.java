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
package us.blanshard.einstein.theme;

import us.blanshard.einstein.core.ConfigurationException;

import com.google.common.base.Charsets;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;
import com.google.gson.stream.MalformedJsonException;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

/**
 * Static methods that read themes from json.  The json is an object with a
 * "themes" array; each theme has a name, a scenario, the singular and plural
 * words for a position, and an array of categories, each with a name, a label
 * and an array of items.
 *
 * @author Luke Blanshard
 */
public class Themes {

  /** The name of the classpath resource holding the built-in themes. */
  public static final String DEFAULT_RESOURCE = "themes.json";

  public static final TypeAdapter<Theme> THEME_ADAPTER = new TypeAdapter<Theme>() {
    @Override public void write(JsonWriter out, Theme value) throws IOException {
      out.beginObject();
      out.name("name").value(value.name);
      out.name("scenario").value(value.scenario);
      out.name("position").value(value.position);
      out.name("positions").value(value.positions);
      out.name("categories").beginArray();
      for (Theme.Topic topic : value.topics()) {
        out.beginObject();
        out.name("name").value(topic.name);
        out.name("label").value(topic.label);
        out.name("items").beginArray();
        for (String item : topic.items)
          out.value(item);
        out.endArray();
        out.endObject();
      }
      out.endArray();
      out.endObject();
    }

    @Override public Theme read(JsonReader in) throws IOException {
      String name = null;
      String scenario = "";
      String position = "position";
      String positions = null;
      List<Theme.Topic> topics = Lists.newArrayList();
      in.beginObject();
      while (in.hasNext()) {
        String key = in.nextName();
        if (key.equals("name")) {
          name = in.nextString();
        } else if (key.equals("scenario")) {
          scenario = in.nextString();
        } else if (key.equals("position")) {
          position = in.nextString();
        } else if (key.equals("positions")) {
          positions = in.nextString();
        } else if (key.equals("categories")) {
          in.beginArray();
          while (in.hasNext())
            topics.add(readTopic(in));
          in.endArray();
        } else {
          in.skipValue();
        }
      }
      in.endObject();
      if (name == null)
        throw new JsonParseException("Theme without a name");
      return new Theme(name, scenario, position, positions == null ? position + "s" : positions, topics);
    }

    private Theme.Topic readTopic(JsonReader in) throws IOException {
      String name = null;
      String label = null;
      List<String> items = Lists.newArrayList();
      in.beginObject();
      while (in.hasNext()) {
        String key = in.nextName();
        if (key.equals("name")) {
          name = in.nextString();
        } else if (key.equals("label")) {
          label = in.nextString();
        } else if (key.equals("items")) {
          in.beginArray();
          while (in.hasNext())
            items.add(in.nextString());
          in.endArray();
        } else {
          in.skipValue();
        }
      }
      in.endObject();
      if (name == null)
        throw new JsonParseException("Category without a name");
      return new Theme.Topic(name, label == null ? name.toLowerCase() : label, items);
    }
  };

  /**
   * Reads the themes in the given json, keyed by name in file order.  Throws
   * {@link ConfigurationException} if the json is malformed.
   */
  public static ImmutableMap<String, Theme> read(Reader reader) throws IOException {
    Map<String, Theme> themes = Maps.newLinkedHashMap();
    try {
      JsonReader in = new JsonReader(reader);
      in.beginObject();
      while (in.hasNext()) {
        if (in.nextName().equals("themes")) {
          in.beginArray();
          while (in.hasNext()) {
            Theme theme = THEME_ADAPTER.read(in);
            if (themes.put(theme.name, theme) != null)
              throw new ConfigurationException("Duplicate theme " + theme.name);
          }
          in.endArray();
        } else {
          in.skipValue();
        }
      }
      in.endObject();
      return ImmutableMap.copyOf(themes);
    } catch (IllegalStateException e) {
      // JsonReader reports unexpected tokens this way.
      throw new ConfigurationException("Malformed themes: " + e.getMessage(), e);
    } catch (JsonParseException e) {
      throw new ConfigurationException("Malformed themes: " + e.getMessage(), e);
    } catch (MalformedJsonException e) {
      throw new ConfigurationException("Malformed themes: " + e.getMessage(), e);
    }
  }

  /** Reads the themes in the given file. */
  public static ImmutableMap<String, Theme> read(File file) throws IOException {
    InputStream stream = new FileInputStream(file);
    try {
      return read(new InputStreamReader(stream, Charsets.UTF_8));
    } finally {
      stream.close();
    }
  }

  /** Reads the built-in themes. */
  public static ImmutableMap<String, Theme> builtIn() throws IOException {
    InputStream stream = Themes.class.getResourceAsStream(DEFAULT_RESOURCE);
    if (stream == null)
      throw new IOException("Missing resource " + DEFAULT_RESOURCE);
    try {
      return read(new InputStreamReader(stream, Charsets.UTF_8));
    } finally {
      stream.close();
    }
  }

  /**
   * Returns the named theme from the given file, or from the built-in themes
   * if the file is null.  Throws {@link ConfigurationException} if there is no
   * such theme.
   */
  public static Theme load(@Nullable File file, String name) throws IOException {
    ImmutableMap<String, Theme> themes = file == null ? builtIn() : read(file);
    Theme theme = themes.get(name);
    if (theme == null)
      throw new ConfigurationException("No theme " + name + " among " + themes.keySet());
    return theme;
  }
}
