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

import czlab.dal.JdbcInfo;
import java.util.Properties;
import junit.framework.JUnit4TestAdapter;
import org.junit.Test;

/**
 * @author Kenneth Leung
 */
public class JdbcInfoTest {

  public static junit.framework.Test suite() {
    return new JUnit4TestAdapter(JdbcInfoTest.class);
  }

  @Test
  public void testDefault() throws Exception {
    JdbcInfo i= new JdbcInfo();
    assertEquals("sqlite.db", i.file());
    assertEquals("jdbc:sqlite:sqlite.db", i.url());
    assertFalse(i.inMemory());
  }

  @Test
  public void testMemory() throws Exception {
    JdbcInfo i= JdbcInfo.of(JdbcInfo.MEMORY);
    assertTrue(i.inMemory());
    assertEquals("jdbc:sqlite::memory:", i.url());
  }

  @Test
  public void testFromProperties() throws Exception {
    Properties p= new Properties();
    assertEquals(new JdbcInfo(), JdbcInfo.fromProperties(p));
    p.setProperty(JdbcInfo.FILE_KEY, " data/app.db ");
    assertEquals("data/app.db", JdbcInfo.fromProperties(p).file());
  }

  @Test
  public void testLoadResource() throws Exception {
    assertEquals("target/dal-test.db", JdbcInfo.load().file());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testBlank() throws Exception {
    JdbcInfo.of("  ");
  }

}


