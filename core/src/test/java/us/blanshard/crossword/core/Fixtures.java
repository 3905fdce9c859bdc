/*
Copyright 2013 Luke Blanshard

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
package us.blanshard.crossword.core;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import com.google.common.io.Resources;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fixtures and independent checks shared by the core tests.
 */
public class Fixtures {

  /** Three across, five down, four across, four down; one solution. */
  public static final String STRUCTURE_0 = resource("structure0.txt");
  public static final String WORDS_0 = resource("words0.txt");

  public static final Variable ACROSS_3 = Variable.across(0, 1, 3);
  public static final Variable DOWN_5 = Variable.down(0, 1, 5);
  public static final Variable DOWN_4 = Variable.down(1, 4, 4);
  public static final Variable ACROSS_4 = Variable.across(4, 1, 4);

  /** An across and a down of length 3 sharing the corner at (0, 2). */
  public static final String CORNER = "___\n##_\n##_\n";

  /** Two across variables with no shared cell. */
  public static final String APART = "___\n###\n___\n";

  /** An across and a down of length 2 sharing their first cell. */
  public static final String SHARED_START = "__\n_#\n";

  public static Crossword crossword0() {
    return Crossword.parse(STRUCTURE_0, WORDS_0);
  }

  public static Crossword crossword(String structure, String... words) {
    return Crossword.of(Crossword.parseStructure(structure), ImmutableList.copyOf(words));
  }

  static String resource(String name) {
    try {
      return Resources.toString(Resources.getResource(name), UTF_8);
    } catch (IOException e) {
      throw new AssertionError(e);
    }
  }

  /**
   * Checks a complete solution from first principles: every variable has a
   * word of the right length from the word list, crossing words agree, and no
   * word repeats.
   */
  public static boolean isSolution(Crossword crossword, Map<Variable, String> solution) {
    if (!solution.keySet().equals(crossword.variables())) return false;
    Set<String> used = Sets.newHashSet();
    for (Variable x : crossword.variables()) {
      String word = solution.get(x);
      if (word.length() != x.length) return false;
      if (!crossword.words().contains(word)) return false;
      if (!used.add(word)) return false;
      for (Variable y : crossword.variables()) {
        if (x.equals(y)) continue;
        Overlap overlap = crossword.overlap(x, y);
        if (overlap != null
            && solution.get(x).charAt(overlap.xIndex) != solution.get(y).charAt(overlap.yIndex))
          return false;
      }
    }
    return true;
  }

  /**
   * Tries every combination of words from the given domains, returns true if
   * any of them is a solution.
   */
  public static boolean anySolution(Crossword crossword, Map<Variable, ? extends Set<String>> domains) {
    List<Variable> vars = ImmutableList.copyOf(crossword.variables());
    return anySolution(crossword, domains, vars, 0, Maps.<Variable, String>newHashMap());
  }

  private static boolean anySolution(Crossword crossword, Map<Variable, ? extends Set<String>> domains,
                                     List<Variable> vars, int index, Map<Variable, String> partial) {
    if (index == vars.size()) return isSolution(crossword, partial);
    Variable var = vars.get(index);
    for (String word : domains.get(var)) {
      if (!fits(crossword, var, word, partial)) continue;
      partial.put(var, word);
      if (anySolution(crossword, domains, vars, index + 1, partial)) return true;
      partial.remove(var);
    }
    return false;
  }

  /** Prunes the exhaustive search: checks one new word against those already placed. */
  private static boolean fits(Crossword crossword, Variable var, String word,
                              Map<Variable, String> partial) {
    if (word.length() != var.length || partial.containsValue(word)) return false;
    for (Map.Entry<Variable, String> entry : partial.entrySet()) {
      Overlap overlap = crossword.overlap(var, entry.getKey());
      if (overlap != null && word.charAt(overlap.xIndex) != entry.getValue().charAt(overlap.yIndex))
        return false;
    }
    return true;
  }
}
