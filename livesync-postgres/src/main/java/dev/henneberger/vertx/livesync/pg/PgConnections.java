/*
 * Copyright (C) 2026 Daniel Henneberger
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.henneberger.vertx.livesync.pg;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;
import org.postgresql.PGProperty;

final class PgConnections {

  private PgConnections() {
  }

  static Connection open(PostgresTenantOptions options) throws SQLException {
    return DriverManager.getConnection(options.jdbcUrl(), properties(options));
  }

  static Properties properties(PostgresTenantOptions options) {
    Properties props = new Properties();
    PGProperty.USER.set(props, options.getUser());

    String password = options.resolvePassword();
    if (password != null && !password.isBlank()) {
      PGProperty.PASSWORD.set(props, password);
    }

    if (Boolean.TRUE.equals(options.getSsl())) {
      props.setProperty("ssl", "true");
    }
    return props;
  }

  /**
   * Quotes a possibly schema-qualified identifier.
   */
  static String quoteIdentifier(String name) {
    StringBuilder out = new StringBuilder();
    String[] parts = name.split("\\.", -1);
    for (int i = 0; i < parts.length; i++) {
      if (parts[i].isEmpty()) {
        throw new IllegalArgumentException("invalid identifier: " + name);
      }
      if (i > 0) {
        out.append('.');
      }
      out.append('"').append(parts[i].replace("\"", "\"\"")).append('"');
    }
    return out.toString();
  }
}
