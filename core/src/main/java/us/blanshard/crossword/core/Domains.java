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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * The candidate words still possible for each variable.  Domains only ever
 * shrink: words are removed, never added back.  Each domain iterates in the
 * order of the word list it was seeded from.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class Domains {

  private final Map<Variable, Set<String>> domains;

  /**
   * Gives every variable its own copy of the full word list.
   */
  public static Domains initialize(Iterable<Variable> variables, Iterable<String> words) {
    Map<Variable, Set<String>> domains = Maps.newLinkedHashMap();
    for (Variable var : variables)
      domains.put(var, Sets.newLinkedHashSet(words));
    return new Domains(domains);
  }

  private Domains(Map<Variable, Set<String>> domains) {
    this.domains = domains;
  }

  /** The variables with domains here. */
  public Set<Variable> variables() {
    return Collections.unmodifiableSet(domains.keySet());
  }

  /** Returns a read-only view of the given variable's current domain. */
  public Set<String> get(Variable var) {
    return Collections.unmodifiableSet(domain(var));
  }

  public int size(Variable var) {
    return domain(var).size();
  }

  public boolean isEmpty(Variable var) {
    return domain(var).isEmpty();
  }

  public boolean contains(Variable var, String word) {
    return domain(var).contains(word);
  }

  /** Removes a word from a variable's domain; returns true if it was there. */
  public boolean remove(Variable var, String word) {
    return domain(var).remove(word);
  }

  /** Tells whether any variable's domain has been emptied. */
  public boolean anyEmpty() {
    for (Set<String> domain : domains.values())
      if (domain.isEmpty()) return true;
    return false;
  }

  /** The total number of candidate words across all variables. */
  public int totalSize() {
    int total = 0;
    for (Set<String> domain : domains.values())
      total += domain.size();
    return total;
  }

  /** Returns an immutable copy of the current domains. */
  public ImmutableMap<Variable, ImmutableSet<String>> snapshot() {
    ImmutableMap.Builder<Variable, ImmutableSet<String>> builder = ImmutableMap.builder();
    for (Map.Entry<Variable, Set<String>> entry : domains.entrySet())
      builder.put(entry.getKey(), ImmutableSet.copyOf(entry.getValue()));
    return builder.build();
  }

  private Set<String> domain(Variable var) {
    Set<String> domain = domains.get(checkNotNull(var));
    checkArgument(domain != null, "No domain for %s", var);
    return domain;
  }

  @Override public String toString() {
    return domains.toString();
  }
}
