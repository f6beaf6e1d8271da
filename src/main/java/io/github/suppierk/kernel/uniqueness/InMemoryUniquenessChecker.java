/*
 * Copyright 2024 Roman Khlebnov
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
 * limitations under the License.
 */

package io.github.suppierk.kernel.uniqueness;

import static io.github.suppierk.kernel.Suspicious.throwIllegalArgumentIfNull;

import io.github.suppierk.kernel.outcome.Outcome;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link UniquenessChecker} keeping known candidates in memory.
 *
 * <p>Answers with check-then-reserve semantics: a {@code false} answer atomically reserves the
 * candidate, so concurrent claims for the same candidate get {@code false} at most once until the
 * candidate is {@link #release(UniquenessClaim) released}.
 */
public final class InMemoryUniquenessChecker implements UniquenessChecker {
  private static final Logger LOG = LoggerFactory.getLogger(InMemoryUniquenessChecker.class);

  private final Set<Key> taken;

  public InMemoryUniquenessChecker() {
    this.taken = ConcurrentHashMap.newKeySet();
  }

  /**
   * Registers a candidate which already exists, typically while seeding from a data set.
   *
   * @param claim describing the existing candidate
   * @return this instance
   */
  public InMemoryUniquenessChecker register(UniquenessClaim claim) {
    taken.add(Key.of(throwIllegalArgumentIfNull(claim, "Claim")));
    return this;
  }

  /**
   * @param claim to look up
   * @return {@code true} if the candidate is registered or reserved, without reserving it
   */
  public boolean contains(UniquenessClaim claim) {
    return taken.contains(Key.of(throwIllegalArgumentIfNull(claim, "Claim")));
  }

  @Override
  public Outcome<Boolean> exists(UniquenessClaim claim) {
    final Key key = Key.of(throwIllegalArgumentIfNull(claim, "Claim"));
    final boolean reserved = taken.add(key);
    LOG.debug("Candidate {} is {}", key, reserved ? "reserved" : "already taken");
    return Outcome.success(!reserved);
  }

  @Override
  public void release(UniquenessClaim claim) {
    final Key key = Key.of(throwIllegalArgumentIfNull(claim, "Claim"));
    if (taken.remove(key)) {
      LOG.debug("Candidate {} is released", key);
    }
  }

  private record Key(String scope, String field, String candidate) {
    static Key of(UniquenessClaim claim) {
      return new Key(claim.scope(), claim.field(), claim.candidateKey());
    }
  }
}
