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

import java.io.IOException;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;

/**
 * One connection to one SQLite database file.
 *
 * Statements issued through {@link #simpleSQLr()} and
 * {@link #compositeSQLr()} are serialized on this object, so it can be
 * shared between threads.
 *
 * @author Kenneth Leung
 */
public class SQLiteDb implements DbApi {

  public static final Logger TLOG= getLogger(lookup().lookupClass());

  private final Object _lock= new Object();
  private final JdbcInfo _info;
  private final SQLr _simple;
  private final Transactable _composite;
  private volatile Connection _conn;
  private volatile Schema _schema;

  private SQLiteDb(JdbcInfo info, Connection conn) throws SQLException {
    _info= info;
    _conn= conn;
    _schema= Schema.load(conn);
    _simple= new SimpleSQLr(this);
    _composite= new CompositeSQLr(this);
  }

  /**
   * Uses {@value JdbcInfo#RESOURCE} if found, else {@value JdbcInfo#DEFAULT_FILE}.
   */
  public static SQLiteDb connect() throws SQLException {
    JdbcInfo info;
    try {
      info= JdbcInfo.load();
    } catch (IOException e) {
      throw new DbioError("Failed to read " + JdbcInfo.RESOURCE, e);
    }
    return connect(info);
  }

  /**/
  public static SQLiteDb connect(String file) throws SQLException {
    return connect(JdbcInfo.of(file));
  }

  /**/
  public static SQLiteDb connect(JdbcInfo info) throws SQLException {
    TLOG.info("opening database: {}", info.url());
    Connection c= DriverManager.getConnection(info.url());
    try {
      return new SQLiteDb(info, c);
    } catch (SQLException e) {
      try {
        c.close();
      } catch (SQLException x) {
        e.addSuppressed(x);
      }
      throw e;
    }
  }

  @Override
  public Transactable compositeSQLr() {
    return _composite;
  }

  @Override
  public SQLr simpleSQLr() {
    return _simple;
  }

  @Override
  public Schema schema() {
    return _schema;
  }

  @Override
  public Schema reloadSchema() throws SQLException {
    synchronized (_lock) {
      Schema s= Schema.load(conn());
      _schema= s;
      return s;
    }
  }

  @Override
  public Map<String,Object> vendor() throws SQLException {
    synchronized (_lock) {
      DatabaseMetaData m= conn().getMetaData();
      Map<String,Object> rc= new LinkedHashMap<String,Object>();
      rc.put("name", m.getDatabaseProductName());
      rc.put("version", m.getDatabaseProductVersion());
      rc.put("driver", m.getDriverName());
      rc.put("driver-version", m.getDriverVersion());
      rc.put("url", _info.url());
      return rc;
    }
  }

  @Override
  public Connection connection() throws SQLException {
    return conn();
  }

  @Override
  public JdbcInfo info() {
    return _info;
  }

  /**/
  public boolean isOpen() {
    return _conn != null;
  }

  @Override
  public void close() throws SQLException {
    synchronized (_lock) {
      Connection c= _conn;
      if (c != null) {
        _conn= null;
        _schema= Schema.empty();
        TLOG.info("closing database: {}", _info.url());
        c.close();
      }
    }
  }

  ////

  Object lock() {
    return _lock;
  }

  Connection conn() throws DbioError {
    Connection c= _conn;
    if (c == null) {
      throw new DbioError("Database " + _info.url() + " is closed.");
    }
    return c;
  }


  @Override
  public String toString() {
    return "SQLiteDb[" + _info.url() + "]";
  }

}


