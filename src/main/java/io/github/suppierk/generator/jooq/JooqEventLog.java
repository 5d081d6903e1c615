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

package io.github.suppierk.generator.jooq;

import static io.github.suppierk.generator.jooq.EventTable.ACTOR;
import static io.github.suppierk.generator.jooq.EventTable.AGGREGATE_ID;
import static io.github.suppierk.generator.jooq.EventTable.AGGREGATE_TYPE;
import static io.github.suppierk.generator.jooq.EventTable.AGGREGATE_VERSION;
import static io.github.suppierk.generator.jooq.EventTable.DOMAIN_EVENT;
import static io.github.suppierk.generator.jooq.EventTable.DOMAIN_EVENT_HEAD;
import static io.github.suppierk.generator.jooq.EventTable.EVENT_DATA;
import static io.github.suppierk.generator.jooq.EventTable.EVENT_TIMESTAMP;
import static io.github.suppierk.generator.jooq.EventTable.EVENT_TYPE;
import static io.github.suppierk.generator.jooq.EventTable.EVENT_TYPE_VERSION;
import static io.github.suppierk.generator.jooq.EventTable.HEAD_ID;
import static io.github.suppierk.generator.jooq.EventTable.HEAD_ROW;
import static io.github.suppierk.generator.jooq.EventTable.LAST_SEQUENCE;
import static io.github.suppierk.generator.jooq.EventTable.SEQUENCE_NUMBER;

import io.github.suppierk.generator.event.DomainEvent;
import io.github.suppierk.generator.event.EventLog;
import io.github.suppierk.generator.event.EventSerializer;
import io.github.suppierk.generator.event.StoredEvent;
import java.time.Instant;
import java.util.List;
import org.jooq.Configuration;
import org.jooq.DSLContext;
import org.jooq.Record;
import org.jooq.impl.DSL;

/**
 * {@link EventLog} stored in the {@code domain_event} table.
 *
 * <p>Every append bumps the single {@code domain_event_head} row and takes its sequence from it.
 * The row lock is held until the caller's transaction ends, so appends are serialized and
 * sequences become visible in commit order without gaps: a reader that has seen sequence {@code n}
 * will never find a committed event below {@code n} later. This is what makes the last replayed
 * sequence a safe checkpoint.
 *
 * <p>The next aggregate version is read and written under the same lock, the unique {@code
 * (aggregate_id, aggregate_version)} constraint backs it up.
 */
public final class JooqEventLog implements EventLog {
  private final DSLContext readDsl;

  /**
   * @param readDsl used for reads, appends use the context passed by the caller
   */
  public JooqEventLog(final DSLContext readDsl) {
    if (readDsl == null) {
      throw new IllegalArgumentException("DSLContext is null");
    }

    this.readDsl = readDsl;
  }

  /** {@inheritDoc} */
  @Override
  public void append(final DSLContext dsl, final DomainEvent event) {
    if (dsl == null) {
      throw new IllegalArgumentException("DSLContext is null");
    }

    if (event == null) {
      throw new IllegalArgumentException("Event cannot be null");
    }

    // A savepoint inside the caller's transaction, a transaction of its own otherwise
    dsl.transaction((final Configuration trx) -> insert(trx.dsl(), event));
  }

  private static void insert(final DSLContext dsl, final DomainEvent event) {
    dsl.update(DOMAIN_EVENT_HEAD)
        .set(LAST_SEQUENCE, LAST_SEQUENCE.plus(1L))
        .where(HEAD_ID.eq(HEAD_ROW))
        .execute();

    final Long sequence =
        dsl.select(LAST_SEQUENCE)
            .from(DOMAIN_EVENT_HEAD)
            .where(HEAD_ID.eq(HEAD_ROW))
            .fetchOne(LAST_SEQUENCE);

    if (sequence == null) {
      throw new IllegalStateException("domain_event_head is not initialized");
    }

    final Long lastVersion =
        dsl.select(DSL.coalesce(DSL.max(AGGREGATE_VERSION), 0L))
            .from(DOMAIN_EVENT)
            .where(AGGREGATE_ID.eq(event.aggregateId()))
            .fetchOne(0, Long.class);

    dsl.insertInto(DOMAIN_EVENT)
        .set(SEQUENCE_NUMBER, sequence)
        .set(EVENT_TYPE, event.eventType())
        .set(EVENT_TYPE_VERSION, event.eventTypeVersion())
        .set(AGGREGATE_TYPE, event.aggregateType())
        .set(AGGREGATE_ID, event.aggregateId())
        .set(AGGREGATE_VERSION, (lastVersion == null ? 0L : lastVersion) + 1L)
        .set(EVENT_DATA, EventSerializer.write(event.data()))
        .set(ACTOR, event.actor())
        .set(EVENT_TIMESTAMP, event.timestamp().toEpochMilli())
        .execute();
  }

  /** {@inheritDoc} */
  @Override
  public List<StoredEvent> readAfter(final long afterSequence, final int limit) {
    if (limit < 1) {
      throw new IllegalArgumentException("Limit must be positive");
    }

    return readDsl
        .selectFrom(DOMAIN_EVENT)
        .where(SEQUENCE_NUMBER.gt(afterSequence))
        .orderBy(SEQUENCE_NUMBER.asc())
        .limit(limit)
        .fetch(JooqEventLog::toStoredEvent);
  }

  /** {@inheritDoc} */
  @Override
  public List<StoredEvent> readAggregate(final String aggregateId) {
    if (aggregateId == null) {
      throw new IllegalArgumentException("Aggregate id cannot be null");
    }

    return readDsl
        .selectFrom(DOMAIN_EVENT)
        .where(AGGREGATE_ID.eq(aggregateId))
        .orderBy(AGGREGATE_VERSION.asc())
        .fetch(JooqEventLog::toStoredEvent);
  }

  private static StoredEvent toStoredEvent(final Record dbRecord) {
    final var event =
        new DomainEvent(
            dbRecord.get(EVENT_TYPE),
            dbRecord.get(EVENT_TYPE_VERSION),
            dbRecord.get(AGGREGATE_TYPE),
            dbRecord.get(AGGREGATE_ID),
            EventSerializer.readData(dbRecord.get(EVENT_DATA)),
            dbRecord.get(ACTOR),
            Instant.ofEpochMilli(dbRecord.get(EVENT_TIMESTAMP)));

    return new StoredEvent(
        dbRecord.get(SEQUENCE_NUMBER), dbRecord.get(AGGREGATE_VERSION), event);
  }
}
