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

package io.github.suppierk.generator.vehicle.store;

import static org.jooq.impl.DSL.field;
import static org.jooq.impl.DSL.name;
import static org.jooq.impl.DSL.table;

import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.impl.SQLDataType;

/** Columns of the {@code vehicle} table, see {@code db/schema.sql}. */
final class VehicleTable {
  static final Table<Record> VEHICLE = table(name("vehicle"));

  static final Field<String> ID = field(name("id"), SQLDataType.VARCHAR(64));
  static final Field<String> ORGANIZATION_ID =
      field(name("organization_id"), SQLDataType.VARCHAR(64));
  static final Field<String> NAME = field(name("name"), SQLDataType.VARCHAR(256));
  static final Field<String> DESCRIPTION = field(name("description"), SQLDataType.VARCHAR(1024));
  static final Field<Boolean> ACTIVE = field(name("active"), SQLDataType.BOOLEAN);
  static final Field<String> CREATED_BY = field(name("created_by"), SQLDataType.VARCHAR(256));
  static final Field<Long> CREATED_AT = field(name("created_at"), SQLDataType.BIGINT);
  static final Field<String> UPDATED_BY = field(name("updated_by"), SQLDataType.VARCHAR(256));
  static final Field<Long> UPDATED_AT = field(name("updated_at"), SQLDataType.BIGINT);
  static final Field<Long> EVENT_VERSION = field(name("event_version"), SQLDataType.BIGINT);

  private VehicleTable() {
    // Constants
  }
}
