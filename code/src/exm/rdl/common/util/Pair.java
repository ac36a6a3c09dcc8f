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
package exm.rdl.common.util;

import java.util.Objects;

/**
 * Immutable pair of values with value equality, for use as a composite key
 * of hash maps.  Components should themselves be immutable.
 */
public class Pair<T1, T2> {
  public final T1 val1;
  public final T2 val2;

  /** Computed once: pairs are looked up repeatedly as cache keys */
  private final int hashCode;

  public Pair(T1 val1, T2 val2) {
    this.val1 = val1;
    this.val2 = val2;
    this.hashCode = Objects.hash(val1, val2);
  }

  public static <T1, T2> Pair<T1, T2> create(T1 val1, T2 val2) {
    return new Pair<T1, T2>(val1, val2);
  }

  @Override
  public int hashCode() {
    return hashCode;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Pair)) {
      return false;
    }
    Pair<?, ?> other = (Pair<?, ?>) obj;
    return hashCode == other.hashCode &&
           Objects.equals(val1, other.val1) &&
           Objects.equals(val2, other.val2);
  }

  @Override
  public String toString() {
    return "<" + val1 + ", " + val2 + ">";
  }
}
