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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import us.blanshard.einstein.core.Board;
import us.blanshard.einstein.core.Category;
import us.blanshard.einstein.core.ConfigurationException;
import us.blanshard.einstein.core.Geometry;

import com.google.common.base.Charsets;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.Files;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.List;
import java.util.Random;

public class ThemesTest {
  @Rule public TemporaryFolder folder = new TemporaryFolder();

  private static final String SMALL =
      "{\"themes\": [{\"name\": \"farm\", \"position\": \"field\", \"ignored\": [1, 2],"
      + " \"categories\": ["
      + "  {\"name\": \"Farmer\", \"items\": [\"Ann\", \"Bob\", \"Cy\"]},"
      + "  {\"name\": \"Crop\", \"label\": \"crop\", \"items\": [\"corn\", \"oats\", \"rye\"]},"
      + "  {\"name\": \"Animal\", \"items\": [\"cow\", \"pig\"]}]}]}";

  private static void assertMalformed(String json) throws IOException {
    try {
      Themes.read(new StringReader(json));
      fail(json);
    } catch (ConfigurationException expected) {}
  }

  @Test public void builtIn() throws IOException {
    ImmutableMap<String, Theme> themes = Themes.builtIn();
    assertEquals(ImmutableList.of("street", "round table"), themes.keySet().asList());
    Theme street = themes.get("street");
    assertEquals("house", street.position);
    assertEquals("3 houses", street.countPositions(3));
    assertEquals("1 house", street.countPositions(1));
    assertEquals(6, street.topics().size());
    for (Theme.Topic topic : street.topics()) {
      assertEquals(12, topic.items.size());
      assertTrue(topic.name, street.scenario.contains(topic.name.toLowerCase()));
    }
    assertEquals("home city", themes.get("round table").topics().get(1).label);
  }

  @Test public void readsDefaults() throws IOException {
    Theme farm = Themes.read(new StringReader(SMALL)).get("farm");
    assertEquals("", farm.scenario);
    assertEquals("fields", farm.positions);
    assertEquals("farmer", farm.topics().get(0).label);
    assertEquals(ImmutableList.of("corn", "oats", "rye"), farm.topics().get(1).items);
  }

  @Test public void adapterRoundTrip() throws IOException {
    Theme farm = Themes.read(new StringReader(SMALL)).get("farm");
    StringWriter json = new StringWriter();
    json.write("{\"themes\": [");
    json.write(Themes.THEME_ADAPTER.toJson(farm));
    json.write("]}");
    Theme copy = Themes.read(new StringReader(json.toString())).get("farm");
    assertEquals(farm.toString(), copy.toString());
    assertEquals(farm.positions, copy.positions);
  }

  @Test public void loadFromFile() throws IOException {
    File file = folder.newFile("themes.json");
    Files.asCharSink(file, Charsets.UTF_8).write(SMALL);
    assertEquals("farm", Themes.load(file, "farm").name);
    assertEquals("street", Themes.load(null, "street").name);
    try {
      Themes.load(file, "street");
      fail();
    } catch (ConfigurationException expected) {
      assertTrue(expected.getMessage().contains("farm"));
    }
  }

  @Test public void malformed() throws IOException {
    assertMalformed("{\"themes\": {}}");
    assertMalformed("{\"themes\": [{\"position\": \"spot\"}]}");
    assertMalformed("{\"themes\": [{\"name\": \"x\", \"categories\": [{\"items\": []}]}]}");
    assertMalformed("{\"themes\": [{\"name\": \"x\",, }]}");
    assertMalformed("[]");
  }

  @Test public void duplicateCategoryNames() throws IOException {
    assertMalformed("{\"themes\": [{\"name\": \"x\", \"categories\": ["
        + " {\"name\": \"Name\", \"items\": [\"a\", \"b\"]},"
        + " {\"name\": \"Pet\", \"items\": [\"c\", \"d\"]},"
        + " {\"name\": \"Pet\", \"items\": [\"e\", \"f\"]}]}]}");
    try {
      new Theme("x", "", "spot", "spots", ImmutableList.of(
          new Theme.Topic("Name", "name", ImmutableList.of("a", "b")),
          new Theme.Topic("Pet", "pet", ImmutableList.of("c", "d")),
          new Theme.Topic("Pet", "pet", ImmutableList.of("e", "f"))));
      fail();
    } catch (ConfigurationException expected) {
      assertTrue(expected.getMessage().contains("Pet"));
    }
  }

  @Test public void duplicateThemeNames() throws IOException {
    String farm = SMALL.substring(SMALL.indexOf('[') + 1, SMALL.lastIndexOf(']'));
    assertMalformed("{\"themes\": [" + farm + ", " + farm + "]}");
  }

  @Test public void select() throws IOException {
    Theme street = Themes.builtIn().get("street");
    for (int seed = 0; seed < 20; ++seed) {
      Board board = street.select(new Random(seed), 5, 4, Geometry.CIRCULAR);
      assertEquals(5, board.size);
      assertEquals(Geometry.CIRCULAR, board.geometry);
      List<Category> categories = board.categories();
      assertEquals(4, categories.size());
      assertEquals("Name", categories.get(0).name);
      int last = -1;
      for (Category category : categories) {
        int index = indexOf(street, category.name);
        assertTrue(index > last);
        last = index;
        assertEquals(5, category.size());
      }
    }
  }

  @Test public void selectIsRepeatable() throws IOException {
    Theme street = Themes.builtIn().get("street");
    assertEquals(street.select(new Random(4), 6, 3, Geometry.LINEAR),
        street.select(new Random(4), 6, 3, Geometry.LINEAR));
  }

  @Test public void selectTooMuch() throws IOException {
    Theme farm = Themes.read(new StringReader(SMALL)).get("farm");
    try {
      farm.select(new Random(1), 3, 4, Geometry.LINEAR);
      fail();
    } catch (ConfigurationException expected) {}
    try {
      farm.select(new Random(1), 4, 2, Geometry.LINEAR);
      fail();
    } catch (ConfigurationException expected) {}
    try {
      farm.select(new Random(1), 3, 3, Geometry.LINEAR);
      fail();
    } catch (ConfigurationException expected) {}
  }

  @Test public void plainLabels() {
    Board board = Board.of(2, Geometry.LINEAR, ImmutableMap.of(
        "Name", ImmutableList.of("a", "b"), "Color", ImmutableList.of("c", "d")));
    Theme plain = Theme.plain();
    assertEquals("color", plain.label(board.category(1)));
    assertEquals("name", plain.label(board.category(0).get(1)));
  }

  private static int indexOf(Theme theme, String name) {
    for (int i = 0; i < theme.topics().size(); ++i)
      if (theme.topics().get(i).name.equals(name))
        return i;
    throw new AssertionError(name);
  }
}
