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
import com.google.common.collect.Maps;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * A partial mapping from variables to the words chosen for them, grown and
 * shrunk as the search advances and backtracks.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class Assignment {

  private final Map<Variable, String> words = Maps.newLinkedHashMap();

  public Assignment() {}

  /** Makes an assignment holding the given mappings. */
  public static Assignment of(Map<Variable, String> words) {
    Assignment answer = new Assignment();
    for (Map.Entry<Variable, String> entry : words.entrySet())
      answer.put(entry.getKey(), entry.getValue());
    return answer;
  }

  /** Binds the given variable, which must not already be bound. */
  public Assignment put(Variable var, String word) {
    checkArgument(!words.containsKey(var), "%s is already assigned", var);
    words.put(checkNotNull(var), checkNotNull(word));
    return this;
  }

  /** Unbinds the given variable, returning the word it had. */
  public String remove(Variable var) {
    String word = words.remove(var);
    checkArgument(word != null, "%s is not assigned", var);
    return word;
  }

  @Nullable public String get(Variable var) {
    return words.get(var);
  }

  public boolean containsKey(Variable var) {
    return words.containsKey(var);
  }

  public int size() {
    return words.size();
  }

  public boolean isEmpty() {
    return words.isEmpty();
  }

  /** The bound variables, in the order they were bound. */
  public Set<Variable> variables() {
    return Collections.unmodifiableSet(words.keySet());
  }

  /** Returns a read-only view of the bindings. */
  public Map<Variable, String> asMap() {
    return Collections.unmodifiableMap(words);
  }

  /** Returns an immutable snapshot of the bindings. */
  public ImmutableMap<Variable, String> toMap() {
    return ImmutableMap.copyOf(words);
  }

  @Override public String toString() {
    return words.toString();
  }
}
