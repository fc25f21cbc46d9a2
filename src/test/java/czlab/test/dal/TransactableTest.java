/**
 * Copyright (c) 2013-2017, Kenneth Leung. All rights reserved.
 * The use and distribution terms for this software are covered by the
 * Eclipse Public License 1.0 (http://opensource.org/licenses/eclipse-1.0.php)
 * which can be found in the file epl-v10.html at the root of this distribution.
 * By using this software in any fashion, you are agreeing to be bound by
 * the terms of this license.
 * You must not remove this notice, or any other, from this software.
 */

package czlab.test.dal;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import czlab.dal.ColumnDef;
import czlab.dal.Criterion;
import czlab.dal.DbioError;
import czlab.dal.JdbcInfo;
import czlab.dal.SQLiteDb;
import czlab.dal.SQLr;
import czlab.dal.Transactable;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.Collections;
import junit.framework.JUnit4TestAdapter;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

/**
 * @author Kenneth Leung
 */
public class TransactableTest {

  public static junit.framework.Test suite() {
    return new JUnit4TestAdapter(TransactableTest.class);
  }

  private SQLiteDb db;

  @Before
  public void open() throws Exception {
    db= SQLiteDb.connect(JdbcInfo.MEMORY);
    db.simpleSQLr().createTable("acct",
                                Arrays.asList(ColumnDef.of("id", "INTEGER", "PRIMARY KEY"),
                                              ColumnDef.of("balance", "INTEGER", "NOT NULL")));
  }

  @After
  public void close() throws Exception {
    db.close();
  }

  @Test
  public void testCommit() throws Exception {
    Integer n= db.compositeSQLr().execWith(new Transactable.Work<Integer>() {
      public Integer run(SQLr tx) throws SQLException {
        tx.insert("acct", Arrays.asList(1, 100));
        tx.insert("acct", Arrays.asList(2, 50));
        return tx.countAll("acct");
      }
    });
    assertEquals(Integer.valueOf(2), n);
    assertEquals(2, db.simpleSQLr().countAll("acct"));
    assertTrue(db.connection().getAutoCommit());
  }

  @Test
  public void testRollbackOnError() throws Exception {
    db.simpleSQLr().insert("acct", Arrays.asList(1, 100));
    try {
      db.compositeSQLr().execWith(new Transactable.Work<Object>() {
        public Object run(SQLr tx) throws SQLException {
          tx.update("acct",
                    Collections.singletonMap("balance", 0),
                    Collections.singletonList(Criterion.eq("id", 1)));
          // balance is NOT NULL
          tx.insert("acct", Arrays.asList(2, null));
          return null;
        }
      });
      fail("constraint violation ignored");
    } catch (SQLException e) {
      assertFalse(e instanceof DbioError);
    }
    assertEquals(1, db.simpleSQLr().countAll("acct"));
    assertEquals(100L, ((Number) db.simpleSQLr().get("acct", 1).get(0).get("balance")).longValue());
    assertTrue(db.connection().getAutoCommit());
  }

  @Test
  public void testRollbackUndoesCreateTable() throws Exception {
    try {
      db.compositeSQLr().execWith(new Transactable.Work<Object>() {
        public Object run(SQLr tx) throws SQLException {
          tx.createTable("audit", Arrays.asList(ColumnDef.of("msg", "TEXT")));
          assertTrue(tx.metas().hasTable("audit"));
          throw new IllegalStateException("boom");
        }
      });
      fail("exception swallowed");
    } catch (IllegalStateException e) {
      assertEquals("boom", e.getMessage());
    }
    assertFalse(db.schema().hasTable("audit"));
  }

  @Test
  public void testNestedJoinsOuter() throws Exception {
    final Transactable t= db.compositeSQLr();
    try {
      t.execWith(new Transactable.Work<Object>() {
        public Object run(SQLr tx) throws SQLException {
          t.execWith(new Transactable.Work<Object>() {
            public Object run(SQLr inner) throws SQLException {
              return inner.insert("acct", Arrays.asList(7, 7));
            }
          });
          throw new DbioError("abort");
        }
      });
      fail("exception swallowed");
    } catch (DbioError e) {
      assertEquals("abort", e.getMessage());
    }
    assertEquals(0, db.simpleSQLr().countAll("acct"));
  }

  @Test
  public void testCleanupFailureKeepsOriginalError() throws Exception {
    try {
      db.compositeSQLr().execWith(new Transactable.Work<Object>() {
        public Object run(SQLr tx) throws SQLException {
          tx.insert("acct", Arrays.asList(1, 10));
          db.close();
          throw new IllegalStateException("boom");
        }
      });
      fail("exception swallowed");
    } catch (IllegalStateException e) {
      assertEquals("boom", e.getMessage());
      // rollback and reset on the closed connection fail too
      assertTrue(e.getSuppressed().length > 0);
    }
    assertFalse(db.isOpen());
  }

}


