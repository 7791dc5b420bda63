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
package us.blanshard.deduce.solve;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import us.blanshard.deduce.core.Marks;
import us.blanshard.deduce.rules.Rule;

import com.google.common.collect.EnumMultiset;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.Multiset;

import java.util.logging.Level;
import java.util.logging.Logger;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Applies the deduction {@linkplain Rule rules} to a set of marks over and
 * over until a full pass removes nothing, then says what state the marks
 * ended up in.
 *
 * <p> Every pass that makes progress shrinks the total candidate count, which
 * can't drop below 81 without some location going empty, so propagation
 * always terminates.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class Propagator {
  private static final Logger logger = Logger.getLogger(Propagator.class.getName());

  /** The outcome of propagating to a fixpoint. */
  public enum State {
    IN_PROGRESS,    // Nothing broken, but some location still has several candidates.
    SOLVED,         // Every location has exactly one candidate.
    CONTRADICTION;  // Some location has no candidates left.
  }

  /** Decides which rules get to run during a pass. */
  public enum Schedule {
    /**
     * The two single-location rules run on every pass; each more expensive
     * rule runs only when nothing before it in the pass removed anything.
     */
    CHEAPEST_FIRST {
      @Override boolean shouldRun(Rule rule, int removedThisPass) {
        return rule.compareTo(Rule.UNIQUE_CELL) <= 0 || removedThisPass == 0;
      }
    },
    /** Every rule runs on every pass. */
    EXHAUSTIVE {
      @Override boolean shouldRun(Rule rule, int removedThisPass) {
        return true;
      }
    };

    abstract boolean shouldRun(Rule rule, int removedThisPass);
  }

  /**
   * Observes propagation.  The marks handed to a listener are snapshots; the
   * listener can't disturb the work in progress.
   */
  public interface Listener {
    void ruleApplied(Rule rule, int removed, Marks marks);
    void passCompleted(int pass, int removed, Marks marks);
  }

  /** A listener that ignores everything. */
  public static final Listener SILENT = new Listener() {
    @Override public void ruleApplied(Rule rule, int removed, Marks marks) {}
    @Override public void passCompleted(int pass, int removed, Marks marks) {}
  };

  private final Schedule schedule;
  private final Listener listener;
  private final Multiset<Rule> eliminations = EnumMultiset.create(Rule.class);
  private int passes;

  public Propagator() {
    this(Schedule.CHEAPEST_FIRST, SILENT);
  }

  public Propagator(Schedule schedule, Listener listener) {
    this.schedule = checkNotNull(schedule);
    this.listener = checkNotNull(listener);
  }

  /**
   * Runs the rules against the given marks until they stop making progress,
   * returns the resulting state.
   */
  public State propagate(Marks.Builder marks) {
    int candidates = marks.candidateCount();
    int pass = 0;
    while (true) {
      ++pass;
      int removed = 0;
      for (Rule rule : Rule.values()) {
        if (!schedule.shouldRun(rule, removed)) continue;
        int count = rule.apply(marks);
        removed += count;
        eliminations.add(rule, count);
        if (listener != SILENT) listener.ruleApplied(rule, count, marks.build());
      }
      ++passes;

      int remaining = marks.candidateCount();
      checkState(remaining == candidates - removed,
          "Candidate count went from %s to %s, but %s were removed", candidates, remaining, removed);
      candidates = remaining;
      if (listener != SILENT) listener.passCompleted(pass, removed, marks.build());
      if (removed == 0) break;
    }

    State state = classify(marks.build());
    if (logger.isLoggable(Level.FINER))
      logger.finer(String.format("Fixpoint after %d pass(es): %s, %d candidates", pass, state, candidates));
    return state;
  }

  /** Says what state the given marks are in. */
  public static State classify(Marks marks) {
    if (marks.hasEmptyLocation()) return State.CONTRADICTION;
    if (marks.isFullyDetermined()) return State.SOLVED;
    return State.IN_PROGRESS;
  }

  /** The total number of passes run by this propagator. */
  public int getPassCount() {
    return passes;
  }

  /** The number of candidates each rule has eliminated so far. */
  public ImmutableMultiset<Rule> getEliminations() {
    return ImmutableMultiset.copyOf(eliminations);
  }
}
