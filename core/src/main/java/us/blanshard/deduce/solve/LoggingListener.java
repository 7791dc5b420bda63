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

import us.blanshard.deduce.core.Marks;
import us.blanshard.deduce.rules.Rule;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A propagation listener that writes what happens to a logger: pass summaries
 * at FINE, each rule that made progress at FINER, and grid dumps at FINEST.
 *
 * @author Luke Blanshard
 */
public class LoggingListener implements Propagator.Listener {
  private final Logger logger;

  public LoggingListener() {
    this(Logger.getLogger(LoggingListener.class.getName()));
  }

  public LoggingListener(Logger logger) {
    this.logger = logger;
  }

  @Override public void ruleApplied(Rule rule, int removed, Marks marks) {
    if (removed > 0 && logger.isLoggable(Level.FINER)) {
      logger.finer(String.format("Rule %s complete - total of %d candidate(s) removed",
                                 rule.displayName(), removed));
    }
  }

  @Override public void passCompleted(int pass, int removed, Marks marks) {
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(String.format("Done pass #%d [%d candidate(s)], %d remain",
                                pass, removed, marks.candidateCount()));
    }
    if (logger.isLoggable(Level.FINEST)) {
      logger.finest("\n" + marks.toCountString() + "\n" + marks.toCandidateString());
    }
  }
}
