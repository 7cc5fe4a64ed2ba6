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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;

import us.blanshard.einstein.gen.GeneratorOptions;
import us.blanshard.einstein.theme.Theme;
import us.blanshard.einstein.theme.Themes;

import org.junit.Test;

import java.util.List;

public class GenStatsTest {

  @Test public void outcomesComeBackInSeedOrder() throws Exception {
    Theme theme = Themes.builtIn().get("street");
    GeneratorOptions options = GeneratorOptions.builder().setNumCategories(3).build();

    List<GenStats.Outcome> first = GenStats.generate(theme, options, 4, 123L, 3);
    List<GenStats.Outcome> second = GenStats.generate(theme, options, 4, 123L, 1);

    assertEquals(4, first.size());
    for (int i = 0; i < first.size(); ++i) {
      GenStats.Outcome a = first.get(i);
      GenStats.Outcome b = second.get(i);
      assertEquals(a.seed, b.seed);
      assertNotNull(a.puzzle);
      assertEquals(a.puzzle.solution, b.puzzle.solution);
      assertEquals(a.puzzle.clues, b.puzzle.clues);
    }
  }
}
