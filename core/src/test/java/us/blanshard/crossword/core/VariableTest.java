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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import us.blanshard.crossword.core.Variable.Cell;
import us.blanshard.crossword.core.Variable.Direction;

import com.google.common.collect.Ordering;

import org.junit.Test;

import java.util.Arrays;
import java.util.List;

public class VariableTest {

  @Test public void structuralEquality() {
    Variable v = Variable.of(2, 3, Direction.DOWN, 4);
    assertEquals(v, Variable.down(2, 3, 4));
    assertEquals(v.hashCode(), Variable.down(2, 3, 4).hashCode());
    assertFalse(v.equals(Variable.across(2, 3, 4)));
    assertFalse(v.equals(Variable.down(2, 3, 5)));
    assertFalse(v.equals(Variable.down(2, 4, 4)));
  }

  @Test public void naturalOrder() {
    List<Variable> sorted = Arrays.asList(
        Variable.across(0, 0, 3),
        Variable.down(0, 0, 2),
        Variable.down(0, 0, 3),
        Variable.across(0, 2, 2),
        Variable.across(1, 0, 5));
    assertTrue(Ordering.natural().isStrictlyOrdered(sorted));
  }

  @Test public void cells() {
    assertThat(Variable.across(1, 2, 3).cells())
        .containsExactly(new Cell(1, 2), new Cell(1, 3), new Cell(1, 4)).inOrder();
    assertThat(Variable.down(1, 2, 2).cells())
        .containsExactly(new Cell(1, 2), new Cell(2, 2)).inOrder();
  }

  @Test public void indexOf() {
    Variable across = Variable.across(1, 2, 3);
    assertEquals(0, across.indexOf(new Cell(1, 2)));
    assertEquals(2, across.indexOf(new Cell(1, 4)));
    assertEquals(-1, across.indexOf(new Cell(1, 5)));
    assertEquals(-1, across.indexOf(new Cell(2, 3)));

    Variable down = Variable.down(1, 2, 3);
    assertEquals(1, down.indexOf(new Cell(2, 2)));
    assertEquals(-1, down.indexOf(new Cell(0, 2)));
    assertEquals(-1, down.indexOf(new Cell(2, 3)));
  }

  @Test(expected = IllegalArgumentException.class)
  public void zeroLengthRejected() {
    Variable.across(0, 0, 0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void negativePositionRejected() {
    Variable.down(-1, 0, 2);
  }
}
