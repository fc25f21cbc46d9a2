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
import java.sql.SQLException;
import org.slf4j.Logger;

/**
 * Runs a unit of work in a single SQLite transaction.
 * A nested call joins the transaction already in progress.
 *
 * @author Kenneth Leung
 */
class CompositeSQLr implements Transactable {

  private static final Logger TLOG= getLogger(lookup().lookupClass());

  private final SQLiteDb _db;
  private final SQLr _tx;

  CompositeSQLr(SQLiteDb db) {
    _db= db;
    _tx= new SimpleSQLr(db);
  }

  @Override
  public <T> T execWith(Work<T> fn) throws SQLException {
    synchronized (_db.lock()) {
      Connection c= _db.conn();
      if (!c.getAutoCommit()) {
        return fn.run(_tx);
      }
      c.setAutoCommit(false);
      TLOG.debug("transaction begin");
      T rc;
      try {
        rc= fn.run(_tx);
        c.commit();
      } catch (SQLException | RuntimeException | Error e) {
        TLOG.warn("transaction rolled back: {}", e.getMessage());
        try {
          c.rollback();
        } catch (SQLException x) {
          e.addSuppressed(x);
        }
        try {
          restore(c);
        } catch (SQLException x) {
          e.addSuppressed(x);
        }
        throw e;
      }
      TLOG.debug("transaction committed");
      try {
        restore(c);
      } catch (SQLException x) {
        throw new DbioError("Transaction committed, but the connection could not be reset.", x);
      }
      return rc;
    }
  }

  // ddl may have been undone
  private void restore(Connection c) throws SQLException {
    c.setAutoCommit(true);
    _db.reloadSchema();
  }

}


