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
import static org.junit.Assert.assertNull;

import czlab.dal.ColumnDef;
import czlab.dal.Criterion;
import czlab.dal.Criterion.Op;
import czlab.dal.DbioError;
import junit.framework.JUnit4TestAdapter;
import org.junit.Test;

/**
 * @author Kenneth Leung
 */
public class CriterionTest {

  public static junit.framework.Test suite() {
    return new JUnit4TestAdapter(CriterionTest.class);
  }

  @Test
  public void testParseSymbols() throws Exception {
    assertEquals(Op.EQ, Op.parse("="));
    assertEquals(Op.EQEQ, Op.parse("=="));
    assertEquals(Op.NE, Op.parse("!="));
    assertEquals(Op.LTGT, Op.parse("<>"));
    assertEquals(Op.LTE, Op.parse(" <= "));
    assertEquals(Op.GT, Op.parse(">"));
  }

  @Test
  public void testParseWords() throws Exception {
    assertEquals(Op.LIKE, Op.parse("like"));
    assertEquals(Op.NOT_LIKE, Op.parse("not   Like"));
    assertEquals(Op.IS_NOT, Op.parse("is not"));
    assertEquals(Op.GLOB, Op.parse("GLOB"));
  }

  @Test(expected = DbioError.class)
  public void testParseInjection() throws Exception {
    Op.parse("= 1 OR 1 =");
  }

  @Test(expected = DbioError.class)
  public void testParseNull() throws Exception {
    Op.parse(null);
  }

  @Test
  public void testOf() throws Exception {
    Criterion c= Criterion.of("age", ">=", 18);
    assertEquals("age", c.column());
    assertEquals(Op.GTE, c.op());
    assertEquals(18, c.value());
    assertNull(Criterion.eq("name", null).value());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNoColumn() throws Exception {
    Criterion.of("", Op.EQ, 1);
  }

  @Test
  public void testColumnDef() throws Exception {
    assertEquals("id INTEGER PRIMARY KEY", ColumnDef.of("id", "INTEGER", " PRIMARY KEY ").toString());
    assertEquals("", ColumnDef.of("name", "TEXT").options());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testColumnDefNoType() throws Exception {
    ColumnDef.of("name", " ");
  }

}


