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

/**
 * Defines the building blocks of a rich domain model.
 *
 * <p>Here is an example to help explain how the building blocks relate to each other - let's assume
 * that we run a service where people pick user names:
 *
 * <ul>
 *   <li>A user name is a {@link io.github.suppierk.kernel.value.ValueObject} - two names with the
 *       same letters are the same name, and picking another name means building a new value.
 *   <li>A user ID is an {@link io.github.suppierk.kernel.entity.Identity} - it never changes and
 *       it is the only thing telling two accounts apart.
 *   <li>A user account is an {@link io.github.suppierk.kernel.aggregate.AggregateRoot}:
 *       <ul>
 *         <li>It guards its own rules, for example that a user name never contains a banned term,
 *             through {@link io.github.suppierk.kernel.aggregate.Invariant}s.
 *         <li>Each accepted change records a {@link
 *             io.github.suppierk.kernel.aggregate.DomainEvent} and moves the account version
 *             forward.
 *       </ul>
 *   <li>Whether some other account already uses the name cannot be answered by the account itself
 *       - a {@link io.github.suppierk.kernel.uniqueness.UniquenessChecker} answers it, and a {@link
 *       io.github.suppierk.kernel.coordination.UniqueValueClaim} asks the checker before letting
 *       the account change.
 *   <li>Every expected failure along the way comes back as an {@link
 *       io.github.suppierk.kernel.outcome.Outcome} carrying a {@link
 *       io.github.suppierk.kernel.outcome.DomainError}.
 * </ul>
 */
package io.github.suppierk.kernel;
