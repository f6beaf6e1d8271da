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

package io.github.suppierk.kernel.jooq;

import static io.github.suppierk.kernel.Suspicious.throwIllegalArgumentIfBlank;
import static io.github.suppierk.kernel.Suspicious.throwIllegalArgumentIfNull;
import static io.github.suppierk.kernel.Suspicious.throwIllegalStateIfNull;

import io.github.suppierk.kernel.aggregate.DomainEvent;
import io.github.suppierk.kernel.coordination.AggregateStore;
import io.github.suppierk.kernel.entity.Identity;
import io.github.suppierk.kernel.outcome.ConcurrencyConflictError;
import io.github.suppierk.kernel.outcome.Outcome;
import io.github.suppierk.kernel.outcome.StorageError;
import io.github.suppierk.kernel.outcome.Unit;
import java.util.List;
import java.util.function.Function;
import org.jooq.Condition;
import org.jooq.Configuration;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.InsertValuesStep6;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.exception.DataAccessException;
import org.jooq.exception.SQLStateClass;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link AggregateStore} recording aggregate versions and their events with jOOQ.
 *
 * <p>Expected table layout:
 *
 * <pre>{@code
 * CREATE TABLE aggregate_versions (
 *   aggregate_kind VARCHAR(255) NOT NULL,
 *   aggregate_id   VARCHAR(255) NOT NULL,
 *   stored_version BIGINT NOT NULL,
 *   PRIMARY KEY (aggregate_kind, aggregate_id)
 * );
 *
 * CREATE TABLE domain_events (
 *   aggregate_kind    VARCHAR(255) NOT NULL,
 *   aggregate_id      VARCHAR(255) NOT NULL,
 *   aggregate_version BIGINT NOT NULL,
 *   event_position    INT NOT NULL,
 *   event_type        VARCHAR(255) NOT NULL,
 *   payload           VARCHAR(4096) NOT NULL,
 *   PRIMARY KEY (aggregate_kind, aggregate_id, aggregate_version, event_position)
 * );
 * }</pre>
 *
 * <p>The aggregate kind is the simple name of the identity class. The version check, the version
 * update and the event inserts run in one transaction; this is not an event store, events are
 * appended for downstream consumers and never read back to rebuild aggregates.
 */
public final class JooqAggregateStore implements AggregateStore {
  public static final String DEFAULT_VERSIONS_TABLE_NAME = "aggregate_versions";
  public static final String DEFAULT_EVENTS_TABLE_NAME = "domain_events";

  private static final Logger LOG = LoggerFactory.getLogger(JooqAggregateStore.class);

  private static final Field<String> AGGREGATE_KIND =
      DSL.field(DSL.name("aggregate_kind"), SQLDataType.VARCHAR);
  private static final Field<String> AGGREGATE_ID =
      DSL.field(DSL.name("aggregate_id"), SQLDataType.VARCHAR);
  private static final Field<Long> STORED_VERSION =
      DSL.field(DSL.name("stored_version"), SQLDataType.BIGINT);
  private static final Field<Long> AGGREGATE_VERSION =
      DSL.field(DSL.name("aggregate_version"), SQLDataType.BIGINT);
  private static final Field<Integer> EVENT_POSITION =
      DSL.field(DSL.name("event_position"), SQLDataType.INTEGER);
  private static final Field<String> EVENT_TYPE =
      DSL.field(DSL.name("event_type"), SQLDataType.VARCHAR);
  private static final Field<String> PAYLOAD = DSL.field(DSL.name("payload"), SQLDataType.VARCHAR);

  private final DslContextProvider dslContextProvider;
  private final Table<Record> versionsTable;
  private final Table<Record> eventsTable;
  private final Function<DomainEvent, String> payloadSerializer;

  /**
   * Uses default table names and stores payloads as their {@link Object#toString()}.
   *
   * @param dslContextProvider routing aggregate kinds to databases
   */
  public JooqAggregateStore(final DslContextProvider dslContextProvider) {
    this(
        dslContextProvider,
        DEFAULT_VERSIONS_TABLE_NAME,
        DEFAULT_EVENTS_TABLE_NAME,
        event -> event.payload().toString());
  }

  /**
   * @param dslContextProvider routing aggregate kinds to databases
   * @param versionsTableName of the table holding one version row per aggregate
   * @param eventsTableName of the table receiving the events
   * @param payloadSerializer rendering event payloads as text
   */
  public JooqAggregateStore(
      final DslContextProvider dslContextProvider,
      final String versionsTableName,
      final String eventsTableName,
      final Function<DomainEvent, String> payloadSerializer) {
    this.dslContextProvider = throwIllegalArgumentIfNull(dslContextProvider, "DSL provider");
    this.versionsTable =
        DSL.table(DSL.name(throwIllegalArgumentIfBlank(versionsTableName, "Versions table name")));
    this.eventsTable =
        DSL.table(DSL.name(throwIllegalArgumentIfBlank(eventsTableName, "Events table name")));
    this.payloadSerializer = throwIllegalArgumentIfNull(payloadSerializer, "Payload serializer");
  }

  @Override
  public Outcome<Unit> commit(
      final Identity<?> identity,
      final long expectedVersion,
      final long newVersion,
      final List<DomainEvent> events) {
    final Identity<?> nonNullIdentity = throwIllegalArgumentIfNull(identity, "Identity");
    final List<DomainEvent> nonNullEvents = throwIllegalArgumentIfNull(events, "Events");
    if (newVersion < expectedVersion) {
      throw new IllegalArgumentException(
          "New version %d cannot precede expected version %d"
              .formatted(newVersion, expectedVersion));
    }

    final String kind = kindOf(nonNullIdentity);
    final String id = nonNullIdentity.asString();
    final DSLContext dsl = dslFor(kind);

    try {
      return dsl.transactionResult(
          (final Configuration trx) -> {
            final DSLContext trxDsl = trx.dsl();
            final Long stored =
                trxDsl
                    .select(STORED_VERSION)
                    .from(versionsTable)
                    .where(matching(kind, id))
                    .forUpdate()
                    .fetchOne(STORED_VERSION);

            final long actualVersion = stored == null ? 0L : stored;
            if (actualVersion != expectedVersion) {
              return Outcome.failure(
                  new ConcurrencyConflictError(id, expectedVersion, actualVersion));
            }

            if (stored == null) {
              trxDsl
                  .insertInto(versionsTable, AGGREGATE_KIND, AGGREGATE_ID, STORED_VERSION)
                  .values(kind, id, newVersion)
                  .execute();
            } else {
              final int updated =
                  trxDsl
                      .update(versionsTable)
                      .set(STORED_VERSION, newVersion)
                      .where(matching(kind, id).and(STORED_VERSION.eq(expectedVersion)))
                      .execute();
              if (updated != 1) {
                final long current = readVersion(trxDsl, kind, id);
                return Outcome.failure(new ConcurrencyConflictError(id, expectedVersion, current));
              }
            }

            appendEvents(trxDsl, kind, id, nonNullEvents);
            return Outcome.unit();
          });
    } catch (DataAccessException e) {
      if (e.sqlStateClass() == SQLStateClass.C23_INTEGRITY_CONSTRAINT_VIOLATION) {
        LOG.debug("{} {} was created concurrently", kind, id);
        return concurrentlyCreated(dsl, kind, id, expectedVersion);
      }

      LOG.warn("Cannot commit {} {}", kind, id, e);
      return Outcome.failure(storageError(id, e));
    }
  }

  private Outcome<Unit> concurrentlyCreated(
      final DSLContext dsl, final String kind, final String id, final long expectedVersion) {
    try {
      return Outcome.failure(
          new ConcurrencyConflictError(id, expectedVersion, readVersion(dsl, kind, id)));
    } catch (DataAccessException e) {
      LOG.warn("Cannot read the version of concurrently created {} {}", kind, id, e);
      return Outcome.failure(storageError(id, e));
    }
  }

  /**
   * @param identity of the aggregate
   * @return stored version, {@code 0} if the aggregate was never committed
   */
  public long storedVersion(final Identity<?> identity) {
    final Identity<?> nonNullIdentity = throwIllegalArgumentIfNull(identity, "Identity");
    final String kind = kindOf(nonNullIdentity);
    return readVersion(dslFor(kind), kind, nonNullIdentity.asString());
  }

  private void appendEvents(
      final DSLContext trxDsl, final String kind, final String id, final List<DomainEvent> events) {
    if (events.isEmpty()) {
      return;
    }

    InsertValuesStep6<Record, String, String, Long, Integer, String, String> insert =
        trxDsl.insertInto(
            eventsTable,
            AGGREGATE_KIND,
            AGGREGATE_ID,
            AGGREGATE_VERSION,
            EVENT_POSITION,
            EVENT_TYPE,
            PAYLOAD);

    for (DomainEvent event : events) {
      insert =
          insert.values(
              kind,
              id,
              event.aggregateVersion(),
              event.position(),
              event.type(),
              throwIllegalStateIfNull(payloadSerializer.apply(event), "Serialized payload"));
    }

    insert.execute();
  }

  private long readVersion(final DSLContext dsl, final String kind, final String id) {
    final Long stored =
        dsl.select(STORED_VERSION)
            .from(versionsTable)
            .where(matching(kind, id))
            .fetchOne(STORED_VERSION);
    return stored == null ? 0L : stored;
  }

  private static StorageError storageError(final String id, final DataAccessException e) {
    return new StorageError(
        id, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
  }

  private DSLContext dslFor(final String kind) {
    return throwIllegalStateIfNull(dslContextProvider.apply(kind), "DSL context");
  }

  private static String kindOf(final Identity<?> identity) {
    return identity.getClass().getSimpleName();
  }

  private static Condition matching(final String kind, final String id) {
    return AGGREGATE_KIND.eq(kind).and(AGGREGATE_ID.eq(id));
  }
}
