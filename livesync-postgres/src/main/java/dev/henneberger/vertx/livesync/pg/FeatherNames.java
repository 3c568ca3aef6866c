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

import java.util.Locale;

/**
 * Maps between feather names ({@code SalesOrder}) and the snake_case tables that store them
 * ({@code sales_order}).
 */
final class FeatherNames {

  private FeatherNames() {
  }

  static String fromTable(String table) {
    StringBuilder out = new StringBuilder(table.length());
    boolean upperNext = true;
    for (int i = 0; i < table.length(); i++) {
      char c = table.charAt(i);
      if (c == '_' || c == '-' || c == ' ') {
        upperNext = true;
      } else if (upperNext) {
        out.append(Character.toUpperCase(c));
        upperNext = false;
      } else {
        out.append(c);
      }
    }
    return out.toString();
  }

  static String toTable(String feather) {
    StringBuilder out = new StringBuilder(feather.length() + 4);
    for (int i = 0; i < feather.length(); i++) {
      char c = feather.charAt(i);
      if (Character.isUpperCase(c) && i > 0 && !Character.isUpperCase(feather.charAt(i - 1))
          && feather.charAt(i - 1) != '_') {
        out.append('_');
      }
      out.append(c);
    }
    return out.toString().toLowerCase(Locale.ROOT);
  }
}
