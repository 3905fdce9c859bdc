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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * The outcome of a search: either a complete, consistent assignment or an
 * explicit failure, plus a summary of the work done.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Result {

  public enum Outcome {
    SOLVED,
    NO_SOLUTION;
  }

  public final Outcome outcome;
  public final int numSteps;  // Tentative assignments tried
  public final int numBacktracks;  // Tentative assignments undone
  @Nullable private final ImmutableMap<Variable, String> solution;  // Not null when SOLVED

  static Result solved(ImmutableMap<Variable, String> solution, int numSteps, int numBacktracks) {
    return new Result(Outcome.SOLVED, checkNotNull(solution), numSteps, numBacktracks);
  }

  static Result failed(int numSteps, int numBacktracks) {
    return new Result(Outcome.NO_SOLUTION, null, numSteps, numBacktracks);
  }

  private Result(Outcome outcome, @Nullable ImmutableMap<Variable, String> solution,
                 int numSteps, int numBacktracks) {
    this.outcome = outcome;
    this.solution = solution;
    this.numSteps = numSteps;
    this.numBacktracks = numBacktracks;
  }

  public boolean isSolved() {
    return outcome == Outcome.SOLVED;
  }

  /**
   * Returns the solution.  Only valid when {@link #isSolved}; an empty map is
   * a legitimate solution for a crossword with no variables.
   */
  public ImmutableMap<Variable, String> getSolution() {
    checkState(isSolved(), "No solution was found");
    return solution;
  }

  @Override public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("outcome", outcome)
        .add("numSteps", numSteps)
        .add("numBacktracks", numBacktracks)
        .toString();
  }
}
