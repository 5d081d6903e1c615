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

import static org.jooq.impl.DSL.field;
import static org.jooq.impl.DSL.name;
import static org.jooq.impl.DSL.table;

import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.impl.SQLDataType;

/** Columns of the {@code domain_event} tables, see {@code db/schema.sql}. */
final class EventTable {
  static final Table<Record> DOMAIN_EVENT = table(name("domain_event"));

  static final Field<Long> SEQUENCE_NUMBER = field(name("sequence_number"), SQLDataType.BIGINT);
  static final Field<String> EVENT_TYPE = field(name("event_type"), SQLDataType.VARCHAR(128));
  static final Field<Integer> EVENT_TYPE_VERSION =
      field(name("event_type_version"), SQLDataType.INTEGER);
  static final Field<String> AGGREGATE_TYPE =
      field(name("aggregate_type"), SQLDataType.VARCHAR(128));
  static final Field<String> AGGREGATE_ID = field(name("aggregate_id"), SQLDataType.VARCHAR(64));
  static final Field<Long> AGGREGATE_VERSION = field(name("aggregate_version"), SQLDataType.BIGINT);
  static final Field<String> EVENT_DATA = field(name("event_data"), SQLDataType.CLOB);
  static final Field<String> ACTOR = field(name("actor"), SQLDataType.VARCHAR(256));
  static final Field<Long> EVENT_TIMESTAMP = field(name("event_timestamp"), SQLDataType.BIGINT);

  /** Single row holding the last assigned sequence, locked by every append until commit. */
  static final Table<Record> DOMAIN_EVENT_HEAD = table(name("domain_event_head"));

  static final Field<Integer> HEAD_ID = field(name("id"), SQLDataType.INTEGER);
  static final Field<Long> LAST_SEQUENCE = field(name("last_sequence"), SQLDataType.BIGINT);
  static final int HEAD_ROW = 1;

  private EventTable() {
    // Constants
  }
}
