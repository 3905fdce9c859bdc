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
package us.blanshard.crossword.output;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

import us.blanshard.crossword.core.Crossword;
import us.blanshard.crossword.core.Variable;

import java.util.Map;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * The letters an assignment puts in each cell of a crossword.  Prints as the
 * filled-in grid, with blocked cells shown as solid blocks.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class LetterGrid {

  public static final char BLOCK = '█';

  private final Crossword crossword;
  private final char[][] letters;  // 0 for an empty cell

  /**
   * Lays out the given words.  Where two words cross, the later one wins;
   * the solver never produces words that disagree there.
   */
  public static LetterGrid of(Crossword crossword, Map<Variable, String> assignment) {
    char[][] letters = new char[crossword.height][crossword.width];
    for (Map.Entry<Variable, String> entry : assignment.entrySet()) {
      Variable var = entry.getKey();
      String word = entry.getValue();
      checkArgument(word.length() <= var.length, "%s does not fit %s", word, var);
      for (int k = 0; k < word.length(); ++k)
        letters[var.rowAt(k)][var.columnAt(k)] = word.charAt(k);
    }
    return new LetterGrid(crossword, letters);
  }

  private LetterGrid(Crossword crossword, char[][] letters) {
    this.crossword = crossword;
    this.letters = letters;
  }

  /** Returns the letter at the given cell, or null if there isn't one. */
  @Nullable public Character get(int row, int column) {
    checkElementIndex(row, crossword.height, "row");
    checkElementIndex(column, crossword.width, "column");
    char c = letters[row][column];
    return c == 0 ? null : c;
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < crossword.height; ++i) {
      for (int j = 0; j < crossword.width; ++j) {
        if (!crossword.isOpen(i, j)) sb.append(BLOCK);
        else sb.append(letters[i][j] == 0 ? ' ' : letters[i][j]);
      }
      sb.append('\n');
    }
    return sb.toString();
  }
}
