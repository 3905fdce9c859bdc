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

import javax.annotation.concurrent.Immutable;

/**
 * The shared cell of two crossing variables, expressed as an index into each
 * one's word: the letter at {@link #xIndex} of the first variable's word must
 * equal the letter at {@link #yIndex} of the second's.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Overlap {

  public final int xIndex;
  public final int yIndex;

  public static Overlap of(int xIndex, int yIndex) {
    return new Overlap(xIndex, yIndex);
  }

  private Overlap(int xIndex, int yIndex) {
    checkArgument(xIndex >= 0 && yIndex >= 0, "Negative overlap index");
    this.xIndex = xIndex;
    this.yIndex = yIndex;
  }

  /** Returns the same overlap seen from the other variable. */
  public Overlap reverse() {
    return new Overlap(yIndex, xIndex);
  }

  /** Tells whether the two words agree at this overlap. */
  public boolean matches(String x, String y) {
    return xIndex < x.length() && yIndex < y.length()
        && x.charAt(xIndex) == y.charAt(yIndex);
  }

  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Overlap)) return false;
    Overlap that = (Overlap) o;
    return this.xIndex == that.xIndex && this.yIndex == that.yIndex;
  }

  @Override public int hashCode() {
    return xIndex * 31 + yIndex;
  }

  @Override public String toString() {
    return "(" + xIndex + ", " + yIndex + ")";
  }
}
