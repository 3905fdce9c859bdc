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
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.logging.Level.FINE;
import static java.util.logging.Level.INFO;

import com.google.common.base.Functions;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Ordering;
import com.google.common.collect.Sets;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * Fills a crossword by treating it as a constraint satisfaction problem.
 * Each variable's domain starts as the whole word list; node consistency
 * trims it to words of the right length, arc consistency (AC-3) trims it to
 * words compatible with some word of every crossing variable, and then a
 * depth-first backtracking search looks for a complete assignment.
 *
 * <p> The search picks the unassigned variable with the fewest remaining
 * values, breaking ties by most neighbors and then by the variables' natural
 * order, and tries its words in least-constraining-value order.  No word may
 * be used twice in one puzzle.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class Solver {
  private static final Logger logger = Logger.getLogger(Solver.class.getName());

  /**
   * Fills the given crossword, returns a summary of the result.
   */
  public static Result solve(Crossword crossword) {
    return new Solver(crossword).solve();
  }

  private final Crossword crossword;
  private final Domains domains;

  public Solver(Crossword crossword) {
    this.crossword = checkNotNull(crossword);
    this.domains = Domains.initialize(crossword.variables(), crossword.words());
  }

  public Crossword getCrossword() {
    return crossword;
  }

  /** The solver's domains, which shrink as consistency is enforced. */
  public Domains getDomains() {
    return domains;
  }

  /**
   * Enforces node and arc consistency, then searches.  An emptied domain does
   * not stop the search; it just makes it fail.
   */
  public Result solve() {
    Stopwatch stopwatch = Stopwatch.createStarted();
    enforceNodeConsistency();
    if (!ac3()) {
      logger.info("Arc consistency emptied a domain, no solution is possible");
    }
    Result result = backtrack(new Assignment());
    logger.log(INFO, "{0} after {1} steps and {2} backtracks in {3}ms", new Object[] {
        result.outcome, result.numSteps, result.numBacktracks, stopwatch.elapsed(MILLISECONDS)});
    return result;
  }

  /**
   * Removes from each domain the words whose length differs from the
   * variable's.
   */
  public void enforceNodeConsistency() {
    int before = domains.totalSize();
    for (Variable var : crossword.variables()) {
      for (String word : ImmutableList.copyOf(domains.get(var))) {
        if (word.length() != var.length)
          domains.remove(var, word);
      }
    }
    logger.log(FINE, "Node consistency removed {0} of {1} candidates",
               new Object[] {before - domains.totalSize(), before});
  }

  /**
   * Makes x arc consistent with y: removes each word from x's domain that has
   * no different word in y's domain agreeing with it at their overlap.
   * Returns true if x's domain changed.
   */
  public boolean revise(Variable x, Variable y) {
    Overlap overlap = crossword.overlap(x, y);
    if (overlap == null) return false;

    boolean revised = false;
    for (String word : ImmutableList.copyOf(domains.get(x))) {
      if (!isSupported(word, y, overlap)) {
        domains.remove(x, word);
        revised = true;
      }
    }
    return revised;
  }

  private boolean isSupported(String word, Variable y, Overlap overlap) {
    for (String other : domains.get(y)) {
      if (!word.equals(other) && overlap.matches(word, other))
        return true;
    }
    return false;
  }

  /**
   * Runs AC-3 starting from every arc in the puzzle.
   */
  public boolean ac3() {
    return ac3(allArcs());
  }

  /**
   * Runs AC-3 starting from the given arcs.  Returns false as soon as some
   * domain becomes empty, true if the worklist drains without that.
   */
  public boolean ac3(Iterable<Arc> arcs) {
    ArrayDeque<Arc> queue = new ArrayDeque<Arc>();
    for (Arc arc : arcs)
      queue.addLast(arc);

    int revisions = 0;
    while (!queue.isEmpty()) {
      Arc arc = queue.removeFirst();
      if (revise(arc.x, arc.y)) {
        ++revisions;
        if (domains.isEmpty(arc.x)) {
          logger.log(FINE, "Domain of {0} emptied after {1} revisions", new Object[] {arc.x, revisions});
          return false;
        }
        for (Variable z : crossword.neighbors(arc.x)) {
          if (!z.equals(arc.y))
            queue.addLast(Arc.of(z, arc.x));
        }
      }
    }
    logger.log(FINE, "Arc consistency reached after {0} revisions", revisions);
    return true;
  }

  /** Returns every arc of the puzzle: both directions of each overlap. */
  public ImmutableList<Arc> allArcs() {
    ImmutableList.Builder<Arc> builder = ImmutableList.builder();
    for (Variable x : crossword.variables())
      for (Variable y : crossword.neighbors(x))
        builder.add(Arc.of(x, y));
    return builder.build();
  }

  /** Tells whether every variable of the puzzle has a word. */
  public boolean assignmentComplete(Assignment assignment) {
    return assignment.size() == crossword.variables().size()
        && assignment.variables().containsAll(crossword.variables());
  }

  /**
   * Tells whether the assignment breaks no constraint: each word fits its
   * variable's length, crossing assigned words agree on their shared letter,
   * and no word appears twice.  Unassigned neighbors are ignored.
   */
  public boolean consistent(Assignment assignment) {
    Set<String> used = Sets.newHashSet();
    for (Variable var : assignment.variables()) {
      String word = assignment.get(var);
      if (word.length() != var.length) return false;
      if (!used.add(word)) return false;

      for (Map.Entry<Variable, Overlap> entry : crossword.neighborOverlaps(var).entrySet()) {
        String other = assignment.get(entry.getKey());
        if (other != null && !entry.getValue().matches(word, other))
          return false;
      }
    }
    return true;
  }

  /**
   * Chooses the unassigned variable with the smallest domain; among those, the
   * one with the most neighbors; among those, the first in natural order.
   */
  public Variable selectUnassignedVariable(Assignment assignment) {
    Variable best = null;
    int bestSize = 0;
    int bestDegree = 0;
    for (Variable var : crossword.variables()) {
      if (assignment.containsKey(var)) continue;
      int size = domains.size(var);
      int degree = crossword.neighbors(var).size();
      if (best == null || size < bestSize || (size == bestSize && degree > bestDegree)) {
        best = var;
        bestSize = size;
        bestDegree = degree;
      }
    }
    checkState(best != null, "Every variable is assigned");
    return best;
  }

  /**
   * Returns the variable's domain ordered by how many words each choice would
   * rule out of the unassigned neighbors' domains, fewest first.  Ties keep
   * domain order.  A neighbor's word counts as ruled out if it is the same
   * word or disagrees at the overlap.
   */
  public ImmutableList<String> orderDomainValues(Variable var, Assignment assignment) {
    List<String> values = Lists.newArrayList(domains.get(var));
    Map<String, Integer> ruledOut = Maps.newHashMap();
    for (String value : values)
      ruledOut.put(value, countRuledOut(var, value, assignment));

    Collections.sort(values, Ordering.<Integer>natural().onResultOf(Functions.forMap(ruledOut)));
    return ImmutableList.copyOf(values);
  }

  private int countRuledOut(Variable var, String value, Assignment assignment) {
    int count = 0;
    for (Map.Entry<Variable, Overlap> entry : crossword.neighborOverlaps(var).entrySet()) {
      Variable neighbor = entry.getKey();
      if (assignment.containsKey(neighbor)) continue;
      Overlap overlap = entry.getValue();
      if (value.length() <= overlap.xIndex) continue;
      for (String choice : domains.get(neighbor)) {
        if (choice.equals(value) || !overlap.matches(value, choice))
          ++count;
      }
    }
    return count;
  }

  /**
   * Searches depth-first for a complete, consistent extension of the given
   * assignment.  On success the assignment holds the solution; on failure it
   * is restored to what it was on entry.
   *
   * <p> Frames are kept on an explicit stack rather than the call stack, but
   * the order of exploration is that of the plain recursive search.
   */
  public Result backtrack(Assignment assignment) {
    if (assignmentComplete(assignment))
      return Result.solved(assignment.toMap(), 0, 0);

    int numSteps = 0;
    int numBacktracks = 0;
    ArrayDeque<Frame> stack = new ArrayDeque<Frame>();
    stack.push(nextFrame(assignment));

    while (!stack.isEmpty()) {
      Frame frame = stack.peek();
      if (frame.bound) {
        assignment.remove(frame.variable);
        frame.bound = false;
        ++numBacktracks;
      }
      if (!frame.values.hasNext()) {
        stack.pop();
        continue;
      }

      assignment.put(frame.variable, frame.values.next());
      frame.bound = true;
      ++numSteps;

      // Inconsistent bindings are undone at the top of the next pass.
      if (!consistent(assignment)) continue;
      if (assignmentComplete(assignment))
        return Result.solved(assignment.toMap(), numSteps, numBacktracks);
      stack.push(nextFrame(assignment));
    }
    return Result.failed(numSteps, numBacktracks);
  }

  private Frame nextFrame(Assignment assignment) {
    Variable var = selectUnassignedVariable(assignment);
    return new Frame(var, orderDomainValues(var, assignment).iterator());
  }

  /** One level of the search: a variable and the words left to try for it. */
  private static final class Frame {
    final Variable variable;
    final Iterator<String> values;
    boolean bound;

    Frame(Variable variable, Iterator<String> values) {
      this.variable = variable;
      this.values = values;
    }
  }

  /** A directed constraint: x must be made consistent with y. */
  @Immutable
  public static final class Arc {
    public final Variable x;
    public final Variable y;

    public static Arc of(Variable x, Variable y) {
      return new Arc(x, y);
    }

    private Arc(Variable x, Variable y) {
      this.x = checkNotNull(x);
      this.y = checkNotNull(y);
    }

    @Override public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof Arc)) return false;
      Arc that = (Arc) o;
      return this.x.equals(that.x) && this.y.equals(that.y);
    }

    @Override public int hashCode() {
      return x.hashCode() * 31 + y.hashCode();
    }

    @Override public String toString() {
      return x + " -> " + y;
    }
  }
}
