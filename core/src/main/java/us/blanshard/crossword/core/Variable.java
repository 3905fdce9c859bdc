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
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableList;

import java.util.Objects;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;

/**
 * A slot in a crossword: a run of cells, starting at a given row and column
 * and heading across or down, that must be filled with a single word.
 *
 * <p> Variables are compared structurally, so they work as map keys.  Their
 * natural order (row, column, direction, length) is the tie-breaker of last
 * resort for the solver's variable selection.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Variable implements Comparable<Variable> {

  public enum Direction {
    ACROSS, DOWN
  }

  /** The zero-based row of the first cell. */
  public final int row;

  /** The zero-based column of the first cell. */
  public final int column;

  public final Direction direction;

  /** The number of cells, also the length of any word that fits. */
  public final int length;

  public static Variable of(int row, int column, Direction direction, int length) {
    return new Variable(row, column, direction, length);
  }

  public static Variable across(int row, int column, int length) {
    return of(row, column, Direction.ACROSS, length);
  }

  public static Variable down(int row, int column, int length) {
    return of(row, column, Direction.DOWN, length);
  }

  private Variable(int row, int column, Direction direction, int length) {
    checkArgument(row >= 0 && column >= 0, "Negative position (%s, %s)", row, column);
    checkArgument(length > 0, "Length must be positive, got %s", length);
    this.row = row;
    this.column = column;
    this.direction = checkNotNull(direction);
    this.length = length;
  }

  /** Returns the row of the cell at the given index within this variable's word. */
  public int rowAt(int index) {
    return direction == Direction.DOWN ? row + index : row;
  }

  /** Returns the column of the cell at the given index within this variable's word. */
  public int columnAt(int index) {
    return direction == Direction.ACROSS ? column + index : column;
  }

  /** Returns this variable's cells, in word order. */
  public ImmutableList<Cell> cells() {
    ImmutableList.Builder<Cell> builder = ImmutableList.builder();
    for (int i = 0; i < length; ++i)
      builder.add(new Cell(rowAt(i), columnAt(i)));
    return builder.build();
  }

  /**
   * Returns the index of the given cell within this variable's word, or -1
   * if the variable does not cover it.
   */
  public int indexOf(Cell cell) {
    int index = direction == Direction.ACROSS ? cell.column - column : cell.row - row;
    if (index < 0 || index >= length) return -1;
    return rowAt(index) == cell.row && columnAt(index) == cell.column ? index : -1;
  }

  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Variable)) return false;
    Variable that = (Variable) o;
    return this.row == that.row
        && this.column == that.column
        && this.direction == that.direction
        && this.length == that.length;
  }

  @Override public int hashCode() {
    return Objects.hash(row, column, direction, length);
  }

  @Override public int compareTo(@Nonnull Variable that) {
    return ComparisonChain.start()
        .compare(this.row, that.row)
        .compare(this.column, that.column)
        .compare(this.direction, that.direction)
        .compare(this.length, that.length)
        .result();
  }

  @Override public String toString() {
    return String.format("(%d, %d) %s %d", row, column, direction, length);
  }

  /** A single square of the grid. */
  @Immutable
  public static final class Cell {
    public final int row;
    public final int column;

    public Cell(int row, int column) {
      this.row = row;
      this.column = column;
    }

    @Override public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof Cell)) return false;
      Cell that = (Cell) o;
      return this.row == that.row && this.column == that.column;
    }

    @Override public int hashCode() {
      return row * 31 + column;
    }

    @Override public String toString() {
      return String.format("(%d, %d)", row, column);
    }
  }
}
