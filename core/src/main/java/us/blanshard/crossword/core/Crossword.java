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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;
import static java.nio.charset.StandardCharsets.UTF_8;

import us.blanshard.crossword.core.Variable.Cell;
import us.blanshard.crossword.core.Variable.Direction;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.io.Files;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * The structure of a crossword puzzle plus the words available to fill it:
 * the grid's open and blocked cells, the variables (slots) they form, and the
 * overlaps between crossing variables.
 *
 * <p> A structure is given as text, one line per row, with {@code _} marking
 * an open cell and any other character a blocked one.  Every maximal run of
 * two or more open cells, across or down, is a variable.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Crossword {

  /** The character that marks an open cell in structure text. */
  public static final char OPEN = '_';

  private static final Splitter LINES = Splitter.onPattern("\r?\n");
  private static final Splitter WORDS = LINES.trimResults().omitEmptyStrings();

  public final int height;
  public final int width;

  private final boolean[][] open;
  private final ImmutableSet<String> words;
  private final ImmutableSortedSet<Variable> variables;
  private final ImmutableMap<Variable, ImmutableMap<Variable, Overlap>> overlaps;

  /**
   * Reads a structure file and a words file, both UTF-8.
   */
  public static Crossword load(File structureFile, File wordsFile) throws IOException {
    return parse(Files.asCharSource(structureFile, UTF_8).read(),
                 Files.asCharSource(wordsFile, UTF_8).read());
  }

  /**
   * Parses structure text and a newline-separated word list.  Words are
   * trimmed and upper-cased; duplicates and blank lines are dropped.
   */
  public static Crossword parse(String structure, String words) {
    return of(parseStructure(structure), parseWords(words));
  }

  /**
   * Makes a crossword from a rectangular grid of open (true) and blocked
   * (false) cells.
   */
  public static Crossword of(boolean[][] open, Iterable<String> words) {
    return new Crossword(open, ImmutableSet.copyOf(words));
  }

  static boolean[][] parseStructure(String structure) {
    List<String> lines = Lists.newArrayList(LINES.split(checkNotNull(structure)));
    while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty())
      lines.remove(lines.size() - 1);
    checkArgument(!lines.isEmpty(), "Crossword structure has no rows");

    int width = 0;
    for (String line : lines)
      width = Math.max(width, line.length());

    boolean[][] open = new boolean[lines.size()][width];
    for (int i = 0; i < lines.size(); ++i) {
      String line = lines.get(i);
      for (int j = 0; j < line.length(); ++j)
        open[i][j] = line.charAt(j) == OPEN;
    }
    return open;
  }

  static ImmutableSet<String> parseWords(String words) {
    ImmutableSet.Builder<String> builder = ImmutableSet.builder();
    for (String word : WORDS.split(checkNotNull(words)))
      builder.add(word.toUpperCase(Locale.ROOT));
    return builder.build();
  }

  private Crossword(boolean[][] open, ImmutableSet<String> words) {
    checkArgument(open.length > 0, "Crossword structure has no rows");
    this.height = open.length;
    this.width = open[0].length;
    this.open = new boolean[height][];
    for (int i = 0; i < height; ++i) {
      checkArgument(open[i].length == width, "Row %s has %s cells, expected %s",
                    i, open[i].length, width);
      this.open[i] = open[i].clone();
    }
    this.words = words;
    this.variables = findVariables();
    this.overlaps = findOverlaps(variables);
  }

  private ImmutableSortedSet<Variable> findVariables() {
    ImmutableSortedSet.Builder<Variable> builder = ImmutableSortedSet.naturalOrder();
    for (int i = 0; i < height; ++i) {
      for (int j = 0; j < width; ++j) {
        if (!open[i][j]) continue;

        boolean startsAcross = j == 0 || !open[i][j - 1];
        if (startsAcross) {
          int length = 1;
          while (j + length < width && open[i][j + length]) ++length;
          if (length > 1) builder.add(Variable.of(i, j, Direction.ACROSS, length));
        }

        boolean startsDown = i == 0 || !open[i - 1][j];
        if (startsDown) {
          int length = 1;
          while (i + length < height && open[i + length][j]) ++length;
          if (length > 1) builder.add(Variable.of(i, j, Direction.DOWN, length));
        }
      }
    }
    return builder.build();
  }

  private static ImmutableMap<Variable, ImmutableMap<Variable, Overlap>> findOverlaps(
      ImmutableSortedSet<Variable> variables) {
    Map<Cell, Variable> acrossCells = Maps.newHashMap();
    for (Variable var : variables)
      if (var.direction == Direction.ACROSS)
        for (Cell cell : var.cells())
          acrossCells.put(cell, var);

    Map<Variable, Map<Variable, Overlap>> found = Maps.newHashMap();
    for (Variable var : variables)
      found.put(var, Maps.<Variable, Overlap>newTreeMap());

    for (Variable down : variables) {
      if (down.direction != Direction.DOWN) continue;
      List<Cell> cells = down.cells();
      for (int i = 0; i < cells.size(); ++i) {
        Variable across = acrossCells.get(cells.get(i));
        if (across == null) continue;
        Overlap overlap = Overlap.of(across.indexOf(cells.get(i)), i);
        found.get(across).put(down, overlap);
        found.get(down).put(across, overlap.reverse());
      }
    }

    ImmutableMap.Builder<Variable, ImmutableMap<Variable, Overlap>> builder = ImmutableMap.builder();
    for (Variable var : variables)
      builder.put(var, ImmutableMap.copyOf(found.get(var)));
    return builder.build();
  }

  /** Tells whether the given cell is open, ie part of some word. */
  public boolean isOpen(int row, int column) {
    checkElementIndex(row, height, "row");
    checkElementIndex(column, width, "column");
    return open[row][column];
  }

  /** The available words, in the order first given. */
  public ImmutableSet<String> words() {
    return words;
  }

  /** All the variables, in their natural order. */
  public ImmutableSortedSet<Variable> variables() {
    return variables;
  }

  /**
   * Returns the overlap between two distinct variables of this puzzle, or
   * null if they don't share a cell.
   */
  @Nullable public Overlap overlap(Variable x, Variable y) {
    checkArgument(!x.equals(y), "No overlap of %s with itself", x);
    checkArgument(overlaps.containsKey(y), "%s is not part of this crossword", y);
    return neighborOverlaps(x).get(y);
  }

  /** Returns the variables that share a cell with the given one. */
  public ImmutableSet<Variable> neighbors(Variable x) {
    return neighborOverlaps(x).keySet();
  }

  /** Returns the given variable's neighbors with their overlaps. */
  public ImmutableMap<Variable, Overlap> neighborOverlaps(Variable x) {
    ImmutableMap<Variable, Overlap> answer = overlaps.get(checkNotNull(x));
    checkArgument(answer != null, "%s is not part of this crossword", x);
    return answer;
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    for (boolean[] row : open) {
      for (boolean cell : row)
        sb.append(cell ? OPEN : '#');
      sb.append('\n');
    }
    return sb.toString();
  }
}
