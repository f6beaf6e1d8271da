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

package io.github.suppierk.kernel.aggregate;

/**
 * Phases of a single {@link AggregateRoot#mutate(Mutation)} call.
 *
 * <p>{@code IDLE -> VALIDATING -> (COMMITTED | ROLLED_BACK) -> IDLE}. Both terminal phases return
 * to {@link #IDLE} before the call completes.
 */
public enum MutationPhase {
  IDLE,
  VALIDATING,
  COMMITTED,
  ROLLED_BACK
}
