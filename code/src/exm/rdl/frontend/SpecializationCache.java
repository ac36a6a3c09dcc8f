/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */

package exm.rdl.frontend;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.log4j.Logger;

import exm.rdl.common.Logging;
import exm.rdl.common.exceptions.InstantiationCycleException;
import exm.rdl.common.exceptions.RDLRuntimeError;
import exm.rdl.common.exceptions.UserException;
import exm.rdl.common.util.Pair;

/**
 * Cache of specialized components, keyed by template and parameter values.
 *
 * Safe for use from multiple threads.  Each key is built at most once: the
 * first thread to miss builds it, and other threads asking for the same key
 * block until the build finishes.  A failed build is cached too, so every
 * request for that key reports the same error, except for instantiation
 * cycles, which are detected again on the next request.
 */
public class SpecializationCache {
  private static final Logger logger = Logging.getRDLLogger();

  private final ConcurrentMap<Pair<ComponentTemplate, ParameterEnvironment>,
                              InFlight> entries =
    new ConcurrentHashMap<Pair<ComponentTemplate, ParameterEnvironment>,
                          InFlight>();

  /**
   * Which build each blocked thread is waiting for.  Used to detect
   * templates that instantiate each other across threads.
   */
  private final Map<Thread, InFlight> waitingFor =
                                      new HashMap<Thread, InFlight>();

  private final AtomicLong hits = new AtomicLong();
  private final AtomicLong misses = new AtomicLong();

  private static class InFlight {
    final ComponentTemplate template;
    final FutureTask<SpecializedComponent> task;
    final Thread owner;

    InFlight(ComponentTemplate template,
             FutureTask<SpecializedComponent> task, Thread owner) {
      this.template = template;
      this.task = task;
      this.owner = owner;
    }
  }

  /**
   * Lookup the specialization of template under env, building it with
   * builder if not present.
   * @param context for error reporting
   */
  public SpecializedComponent get(Context context, ComponentTemplate template,
      ParameterEnvironment env, Callable<SpecializedComponent> builder)
          throws UserException {
    Pair<ComponentTemplate, ParameterEnvironment> key =
                                          Pair.create(template, env);
    Thread self = Thread.currentThread();
    InFlight entry = entries.get(key);
    if (entry == null) {
      InFlight created = new InFlight(template,
                new FutureTask<SpecializedComponent>(builder), self);
      entry = entries.putIfAbsent(key, created);
      if (entry == null) {
        misses.incrementAndGet();
        logger.trace("specialization cache miss: " + template + env);
        return build(key, created);
      }
    }

    hits.incrementAndGet();
    logger.trace("specialization cache hit: " + template + env);
    if (!entry.task.isDone()) {
      if (entry.owner == self) {
        // Only possible if the build asked for its own result
        List<String> chain = new ArrayList<String>();
        chain.add(template.name());
        chain.add(template.name());
        throw new InstantiationCycleException(context, chain);
      }
      if (startWait(context, self, entry)) {
        try {
          return result(entry);
        } finally {
          endWait(self);
        }
      }
    }
    return result(entry);
  }

  /**
   * Run a build this thread claimed.  A cycle error is not kept, since it
   * depends on what other threads were building at the time.
   */
  private SpecializedComponent build(
      Pair<ComponentTemplate, ParameterEnvironment> key, InFlight created)
          throws UserException {
    created.task.run();
    try {
      return result(created);
    } catch (InstantiationCycleException e) {
      entries.remove(key, created);
      throw e;
    }
  }

  /**
   * Record that self waits for entry, failing if that would deadlock.
   * Builds that already finished can't be part of a deadlock, even if
   * the thread that waited for them has not yet moved on.
   * @return false if entry finished and there is nothing to wait for
   */
  private boolean startWait(Context context, Thread self, InFlight entry)
      throws InstantiationCycleException {
    synchronized (waitingFor) {
      if (entry.task.isDone()) {
        return false;
      }
      List<String> chain = new ArrayList<String>();
      InFlight curr = entry;
      while (curr != null && !curr.task.isDone()) {
        chain.add(curr.template.name());
        if (curr.owner == self) {
          chain.add(entry.template.name());
          throw new InstantiationCycleException(context, chain);
        }
        curr = waitingFor.get(curr.owner);
      }
      waitingFor.put(self, entry);
      return true;
    }
  }

  private void endWait(Thread self) {
    synchronized (waitingFor) {
      waitingFor.remove(self);
    }
  }

  private SpecializedComponent result(InFlight entry) throws UserException {
    try {
      return entry.task.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RDLRuntimeError("Interrupted while waiting for " +
                                "specialization of " + entry.template, e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof UserException) {
        throw (UserException)cause;
      } else if (cause instanceof RuntimeException) {
        throw (RuntimeException)cause;
      } else if (cause instanceof Error) {
        throw (Error)cause;
      } else {
        throw new RDLRuntimeError("Unexpected error specializing " +
                                  entry.template, cause);
      }
    }
  }

  public long hits() {
    return hits.get();
  }

  public long misses() {
    return misses.get();
  }

  /**
   * @return number of distinct keys requested so far
   */
  public int size() {
    return entries.size();
  }
}
