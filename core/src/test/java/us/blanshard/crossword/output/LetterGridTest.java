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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static us.blanshard.crossword.core.Fixtures.ACROSS_3;
import static us.blanshard.crossword.core.Fixtures.ACROSS_4;
import static us.blanshard.crossword.core.Fixtures.DOWN_4;
import static us.blanshard.crossword.core.Fixtures.DOWN_5;
import static us.blanshard.crossword.core.Fixtures.crossword0;

import us.blanshard.crossword.core.Crossword;
import us.blanshard.crossword.core.Solver;
import us.blanshard.crossword.core.Variable;

import com.google.common.collect.ImmutableMap;

import org.junit.Test;

public class LetterGridTest {
  Crossword crossword = crossword0();

  @Test public void solvedGrid() {
    LetterGrid grid = LetterGrid.of(crossword, Solver.solve(crossword).getSolution());
    assertEquals(
        "█SIX█\n"
      + "█E██F\n"
      + "█V██I\n"
      + "█E██V\n"
      + "█NINE\n", grid.toString());
    assertEquals(Character.valueOf('N'), grid.get(4, 1));
    assertNull(grid.get(0, 0));
  }

  @Test public void partialGridLeavesBlanks() {
    LetterGrid grid = LetterGrid.of(crossword, ImmutableMap.of(ACROSS_3, "SIX"));
    assertEquals(
        "█SIX█\n"
      + "█ ██ \n"
      + "█ ██ \n"
      + "█ ██ \n"
      + "█    \n", grid.toString());
    assertNull(grid.get(4, 4));
  }

  @Test public void crossingWordsShareCells() {
    LetterGrid grid = LetterGrid.of(crossword, ImmutableMap.of(ACROSS_4, "NINE", DOWN_4, "FIVE"));
    assertEquals(Character.valueOf('E'), grid.get(4, 4));
    assertEquals(Character.valueOf('F'), grid.get(1, 4));
  }

  @Test(expected = IllegalArgumentException.class)
  public void overlongWordRejected() {
    LetterGrid.of(crossword, ImmutableMap.of(DOWN_4, "SEVEN"));
  }

  @Test(expected = IndexOutOfBoundsException.class)
  public void outOfRange() {
    LetterGrid.of(crossword, ImmutableMap.<Variable, String>of()).get(0, 5);
  }

  @Test public void downWordRunsDownward() {
    LetterGrid grid = LetterGrid.of(crossword, ImmutableMap.of(DOWN_5, "SEVEN"));
    assertEquals(Character.valueOf('V'), grid.get(2, 1));
  }
}
