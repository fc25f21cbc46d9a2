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

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;

/**
 * Checks table and column names against the schema, builds the
 * statement and runs it on the shared connection.
 *
 * @author Kenneth Leung
 */
class SimpleSQLr implements SQLr {

  private static final Logger TLOG= getLogger(lookup().lookupClass());

  private final SQLiteDb _db;

  SimpleSQLr(SQLiteDb db) {
    _db= db;
  }

  @Override
  public int insert(String table, List<?> values) throws SQLException {
    synchronized (_db.lock()) {
      String t= table(table);
      int n= metas().columns(t).size();
      if (values == null || values.size() != n) {
        throw new DbioError("Table " + t + " has " + n + " columns. " +
                            (values == null ? 0 : values.size()) + " values specified.");
      }
      return execute(SQLs.insert(t, values));
    }
  }

  @Override
  public int insert(String table, Map<String,?> record) throws SQLException {
    synchronized (_db.lock()) {
      String t= table(table);
      if (record == null || record.isEmpty()) {
        throw new DbioError("No values to insert into " + t + ".");
      }
      List<String> cols= columns(t, record.keySet(), true);
      return execute(SQLs.insert(t, cols, new ArrayList<Object>(record.values())));
    }
  }

  @Override
  public List<Map<String,Object>> get(String table, Object id) throws SQLException {
    return get(table, id, DEFAULT_ID, null);
  }

  @Override
  public List<Map<String,Object>> get(String table, Object id,
                                      String idField, List<String> fields) throws SQLException {
    String f= idField == null ? DEFAULT_ID : idField;
    return search(table, Collections.singletonList(Criterion.eq(f, id)), fields);
  }

  @Override
  public List<Map<String,Object>> search(String table,
                                         List<Criterion> criteria,
                                         List<String> fields) throws SQLException {
    synchronized (_db.lock()) {
      String t= table(table);
      List<String> cols= fields == null ? null : columns(t, fields, false);
      return query(SQLs.select(t, cols, criteria(t, criteria)));
    }
  }

  @Override
  public List<Map<String,Object>> search(String table, List<Criterion> criteria) throws SQLException {
    return search(table, criteria, null);
  }

  @Override
  public int update(String table, Map<String,?> values, List<Criterion> criteria) throws SQLException {
    synchronized (_db.lock()) {
      String t= table(table);
      if (values == null || values.isEmpty()) {
        throw new DbioError("No values to update in " + t + ".");
      }
      if (criteria == null || criteria.isEmpty()) {
        throw new DbioError("criteria not specified.  Dangerous update aborted.");
      }
      List<String> cols= columns(t, values.keySet(), true);
      Map<String,Object> m= new LinkedHashMap<String,Object>();
      int i=0;
      for (Object v : values.values()) {
        m.put(cols.get(i++), v);
      }
      return execute(SQLs.update(t, m, criteria(t, criteria)));
    }
  }

  @Override
  public int delete(String table, List<Criterion> criteria) throws SQLException {
    synchronized (_db.lock()) {
      String t= table(table);
      if (criteria == null || criteria.isEmpty()) {
        throw new DbioError("criteria missing, delete from " + t + " aborted.");
      }
      return execute(SQLs.delete(t, criteria(t, criteria)));
    }
  }

  @Override
  public void createTable(String table, List<ColumnDef> columns) throws SQLException {
    synchronized (_db.lock()) {
      if (metas().hasTable(table)) {
        throw new DbioError("Table name specified " + table + " is already in DB.");
      }
      if (columns == null || columns.isEmpty()) {
        throw new DbioError("No columns specified for table " + table + ".");
      }
      execute(SQLs.createTable(table, columns));
      _db.reloadSchema();
    }
  }

  @Override
  public void dropTable(String table) throws SQLException {
    synchronized (_db.lock()) {
      String t= metas().tableName(table);
      execute(SQLs.dropTable(t == null ? table : t));
      _db.reloadSchema();
    }
  }

  @Override
  public List<Map<String,Object>> select(String sql, List<?> params) throws SQLException {
    synchronized (_db.lock()) {
      return query(new SQLs.Stmt(sql, copy(params)));
    }
  }

  @Override
  public int exec(String sql, List<?> params) throws SQLException {
    synchronized (_db.lock()) {
      int n= execute(new SQLs.Stmt(sql, copy(params)));
      // may have been ddl
      _db.reloadSchema();
      return n;
    }
  }

  @Override
  public int countAll(String table) throws SQLException {
    synchronized (_db.lock()) {
      SQLs.Stmt s= SQLs.count(table(table));
      TLOG.debug("SQL: {}", s.sql());
      try (PreparedStatement ps= _db.conn().prepareStatement(s.sql());
           ResultSet rs= ps.executeQuery()) {
        return rs.next() ? rs.getInt(1) : 0;
      }
    }
  }

  @Override
  public Schema metas() {
    return _db.schema();
  }

  @Override
  public String fmtId(String s) {
    return SQLs.fmtId(s);
  }

  ////

  private String table(String table) throws DbioError {
    String t= metas().tableName(table);
    if (t == null) {
      throw new DbioError("Table name specified " + table + " does not exist in DB.");
    }
    return t;
  }

  // all unknown (or, when unique, repeated) columns are reported together
  private List<String> columns(String table,
                               Collection<String> names, boolean unique) throws DbioError {
    List<String> errors= new ArrayList<String>();
    List<String> rc= new ArrayList<String>();
    Schema s= metas();
    for (String n : names) {
      String c= s.columnName(table, n);
      if (c == null) {
        errors.add("Column " + n + " not in table " + table);
      } else if (unique && rc.contains(c)) {
        errors.add("Column " + c + " specified more than once");
      } else {
        rc.add(c);
      }
    }
    if (!errors.isEmpty()) {
      throw new DbioError(errors.toString());
    }
    return rc;
  }

  private List<Criterion> criteria(String table, List<Criterion> criteria) throws DbioError {
    List<Criterion> rc= new ArrayList<Criterion>();
    if (criteria == null) { return rc; }
    List<String> names= new ArrayList<String>();
    for (Criterion c : criteria) {
      names.add(c.column());
    }
    List<String> cols= columns(table, names, false);
    for (int i=0; i < criteria.size(); ++i) {
      rc.add(criteria.get(i).withColumn(cols.get(i)));
    }
    return rc;
  }

  private int execute(SQLs.Stmt s) throws SQLException {
    TLOG.debug("SQL: {} ({} param(s))", s.sql(), s.params().size());
    try (PreparedStatement ps= _db.conn().prepareStatement(s.sql())) {
      bind(ps, s.params());
      return ps.executeUpdate();
    }
  }

  private List<Map<String,Object>> query(SQLs.Stmt s) throws SQLException {
    TLOG.debug("SQL: {} ({} param(s))", s.sql(), s.params().size());
    try (PreparedStatement ps= _db.conn().prepareStatement(s.sql())) {
      bind(ps, s.params());
      try (ResultSet rs= ps.executeQuery()) {
        return rows(rs);
      }
    }
  }

  private static void bind(PreparedStatement ps, List<Object> params) throws SQLException {
    for (int i=0; i < params.size(); ++i) {
      ps.setObject(i+1, params.get(i));
    }
  }

  private static List<Map<String,Object>> rows(ResultSet rs) throws SQLException {
    List<Map<String,Object>> rc= new ArrayList<Map<String,Object>>();
    ResultSetMetaData m= rs.getMetaData();
    int n= m.getColumnCount();
    while (rs.next()) {
      Map<String,Object> row= new LinkedHashMap<String,Object>();
      for (int i=1; i <= n; ++i) {
        row.put(m.getColumnLabel(i), rs.getObject(i));
      }
      rc.add(row);
    }
    return rc;
  }

  private static List<Object> copy(List<?> params) {
    return params == null ? new ArrayList<Object>() : new ArrayList<Object>(params);
  }

}


