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

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * CRUD against the tables of one database.
 * Rows come back as maps of column label to value, in column order.
 *
 * @author Kenneth Leung
 */
public interface SQLr {

  /**
   * Column matched by {@link #get(String, Object)}.
   */
  public static final String DEFAULT_ID = "id";

  /**
   * One value per column, in the order the table declares them.
   *
   * @return rows affected
   */
  public int insert(String table, List<?> values) throws SQLException;

  /**
   * Only the given columns are written, all must exist in the table.
   *
   * @return rows affected
   */
  public int insert(String table, Map<String,?> record) throws SQLException;

  /**
   * Rows whose "id" column equals id.
   */
  public List<Map<String,Object>> get(String table, Object id) throws SQLException;

  /**
   * Rows whose idField equals id, restricted to fields (all if empty).
   */
  public List<Map<String,Object>> get(String table, Object id,
                                      String idField, List<String> fields) throws SQLException;

  /**
   * Rows matching all criteria, restricted to fields (all if empty).
   * No criteria returns every row.
   */
  public List<Map<String,Object>> search(String table,
                                         List<Criterion> criteria, List<String> fields) throws SQLException;

  /**/
  public List<Map<String,Object>> search(String table, List<Criterion> criteria) throws SQLException;

  /**
   * Criteria are required, pass e.g. (id &gt; 0) to touch every row.
   *
   * @return rows affected
   */
  public int update(String table, Map<String,?> values, List<Criterion> criteria) throws SQLException;

  /**
   * Criteria are required.
   *
   * @return rows affected
   */
  public int delete(String table, List<Criterion> criteria) throws SQLException;

  /**
   * Not for web facing code, column types and options go into the SQL verbatim.
   */
  public void createTable(String table, List<ColumnDef> columns) throws SQLException;

  /**/
  public void dropTable(String table) throws SQLException;

  /**/
  public List<Map<String,Object>> select(String sql, List<?> params) throws SQLException;

  /**
   * The schema is re-read afterwards, so tables created here are usable at once.
   */
  public int exec(String sql, List<?> params) throws SQLException;

  /**/
  public int countAll(String table) throws SQLException;

  /**/
  public Schema metas();

  /**/
  public String fmtId(String s);

}


