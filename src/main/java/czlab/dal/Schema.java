/**
 * Copyright (c) 2013-2017, Kenneth Leung. All rights reserved.
 * The use and distribution terms for this software are covered by the
 * Eclipse Public License 1.0 (http://opensource.org/licenses/eclipse-1.0.php)
 * which can be found in the file epl-v10.html at the root of this distribution.
 * By using this software in any fashion, you are agreeing to be bound by
 * the terms of this license.
 * You must not remove this notice, or any other, from this software.
 */

package czlab.dal;

import static java.lang.invoke.MethodHandles.*;
import static org.slf4j.LoggerFactory.*;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;

/**
 * Tables and their columns as currently known to SQLite.
 * Names are matched ignoring case, the way SQLite resolves identifiers.
 *
 * @author Kenneth Leung
 */
public final class Schema {

  public static final Logger TLOG= getLogger(lookup().lookupClass());

  private static final String TABLES_SQL=
    "SELECT name FROM sqlite_master WHERE type='table'";

  // table -> columns in declared order
  private final Map<String,List<String>> _tables;

  private Schema(Map<String,List<String>> tables) {
    _tables= tables;
  }

  /**/
  public static Schema empty() {
    return new Schema(new TreeMap<String,List<String>>(String.CASE_INSENSITIVE_ORDER));
  }

  /**
   * Reads sqlite_master, then asks table_info for each table.
   */
  public static Schema load(Connection conn) throws SQLException {
    Map<String,List<String>> m=
      new TreeMap<String,List<String>>(String.CASE_INSENSITIVE_ORDER);
    List<String> names= new ArrayList<String>();

    try (Statement stmt= conn.createStatement()) {
      try (ResultSet rs= stmt.executeQuery(TABLES_SQL)) {
        while (rs.next()) {
          names.add(rs.getString(1));
        }
      }
      for (String t : names) {
        List<String> cols= new ArrayList<String>();
        try (ResultSet rs= stmt.executeQuery("PRAGMA table_info(" + SQLs.fmtId(t) + ")")) {
          while (rs.next()) {
            cols.add(rs.getString("name"));
          }
        }
        m.put(t, Collections.unmodifiableList(cols));
      }
    }

    TLOG.debug("schema loaded: {} table(s) {}", m.size(), m.keySet());
    return new Schema(m);
  }

  /**/
  public boolean hasTable(String table) {
    return table != null && _tables.containsKey(table);
  }

  /**
   * The name as SQLite declared it, or null.
   */
  public String tableName(String table) {
    if (!hasTable(table)) { return null; }
    for (String t : _tables.keySet()) {
      if (t.equalsIgnoreCase(table)) {
        return t;
      }
    }
    return null;
  }

  /**
   * Empty if the table is unknown.
   */
  public List<String> columns(String table) {
    List<String> cols= table == null ? null : _tables.get(table);
    return cols == null ? Collections.<String>emptyList() : cols;
  }

  /**
   * The column as SQLite declared it, or null.
   */
  public String columnName(String table, String column) {
    if (column != null) {
      for (String c : columns(table)) {
        if (c.equalsIgnoreCase(column)) {
          return c;
        }
      }
    }
    return null;
  }

  /**/
  public boolean hasColumn(String table, String column) {
    return columnName(table, column) != null;
  }

  /**/
  public Set<String> tables() {
    return Collections.unmodifiableSet(_tables.keySet());
  }

  /**/
  public boolean isEmpty() {
    return _tables.isEmpty();
  }

  @Override
  public String toString() {
    return _tables.toString();
  }

}


