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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Builds the SQL text and bind parameters for each CRUD statement.
 * Identifiers are quoted, values are always bound.
 *
 * @author Kenneth Leung
 */
public enum SQLs {
;

  /**
   * SQL text plus its parameters in bind order.
   */
  public static final class Stmt {

    private final String sql;
    private final List<Object> params;

    Stmt(String sql, List<Object> params) {
      this.sql = sql;
      this.params = Collections.unmodifiableList(params);
    }

    /**/
    public String sql() { return sql; }

    /**/
    public List<Object> params() { return params; }

    @Override
    public String toString() {
      return sql + " " + params;
    }
  }

  /**
   * Double-quote an identifier, doubling any embedded quote.
   */
  public static String fmtId(String s) {
    return "\"" + s.replace("\"", "\"\"") + "\"";
  }

  /**/
  public static Stmt createTable(String table, List<ColumnDef> cols) {
    StringBuilder b= new StringBuilder("CREATE TABLE ").append(fmtId(table)).append(" (");
    int i=0;
    for (ColumnDef c : cols) {
      if (i++ > 0) { b.append(", "); }
      b.append(fmtId(c.name())).append(" ").append(c.type());
      if (!c.options().isEmpty()) {
        b.append(" ").append(c.options());
      }
    }
    return new Stmt(b.append(")").toString(), new ArrayList<Object>());
  }

  /**/
  public static Stmt dropTable(String table) {
    return new Stmt("DROP TABLE " + fmtId(table), new ArrayList<Object>());
  }

  /**
   * Positional insert, one value per column in declared order.
   */
  public static Stmt insert(String table, List<?> values) {
    return new Stmt("INSERT INTO " + fmtId(table) +
                    " VALUES (" + marks(values.size()) + ")",
                    new ArrayList<Object>(values));
  }

  /**/
  public static Stmt insert(String table, List<String> cols, List<?> values) {
    if (cols.size() != values.size()) {
      throw new IllegalArgumentException(cols.size() + " columns specified. " +
                                         values.size() + " values specified. Length must match");
    }
    return new Stmt("INSERT INTO " + fmtId(table) +
                    " (" + idList(cols) + ") VALUES (" + marks(values.size()) + ")",
                    new ArrayList<Object>(values));
  }

  /**
   * An empty field list selects every column, no criteria every row.
   */
  public static Stmt select(String table, List<String> fields, List<Criterion> criteria) {
    List<Object> params= new ArrayList<Object>();
    String cols= (fields == null || fields.isEmpty()) ? "*" : idList(fields);
    String sql= "SELECT " + cols + " FROM " + fmtId(table) + where(criteria, params);
    return new Stmt(sql, params);
  }

  /**/
  public static Stmt update(String table, Map<String,?> values, List<Criterion> criteria) {
    List<Object> params= new ArrayList<Object>();
    StringBuilder b= new StringBuilder("UPDATE ").append(fmtId(table)).append(" SET ");
    int i=0;
    for (Map.Entry<String,?> en : values.entrySet()) {
      if (i++ > 0) { b.append(", "); }
      b.append(fmtId(en.getKey())).append(" = ?");
      params.add(en.getValue());
    }
    b.append(where(criteria, params));
    return new Stmt(b.toString(), params);
  }

  /**/
  public static Stmt delete(String table, List<Criterion> criteria) {
    List<Object> params= new ArrayList<Object>();
    return new Stmt("DELETE FROM " + fmtId(table) + where(criteria, params), params);
  }

  /**/
  public static Stmt count(String table) {
    return new Stmt("SELECT COUNT(*) FROM " + fmtId(table), new ArrayList<Object>());
  }

  /**
   * Criteria joined by AND, values appended to params.
   */
  static String where(List<Criterion> criteria, List<Object> params) {
    if (criteria == null || criteria.isEmpty()) {
      return "";
    }
    StringBuilder b= new StringBuilder(" WHERE ");
    int i=0;
    for (Criterion c : criteria) {
      if (i++ > 0) { b.append(" AND "); }
      b.append(fmtId(c.column())).append(" ").append(c.op().token()).append(" ?");
      params.add(c.value());
    }
    return b.toString();
  }

  private static String idList(List<String> ids) {
    StringBuilder b= new StringBuilder();
    for (String s : ids) {
      if (b.length() > 0) { b.append(", "); }
      b.append(fmtId(s));
    }
    return b.toString();
  }

  private static String marks(int n) {
    StringBuilder b= new StringBuilder();
    for (int i=0; i < n; ++i) {
      if (i > 0) { b.append(", "); }
      b.append("?");
    }
    return b.toString();
  }

}


