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

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Where the database lives.
 *
 * The file is created by SQLite on first connect if it does not exist.
 * Use {@link #MEMORY} for a private in-memory database.
 *
 * @author Kenneth Leung
 */
public final class JdbcInfo {

  public static final String DEFAULT_FILE = "sqlite.db";
  public static final String MEMORY = ":memory:";
  public static final String URL_PREFIX = "jdbc:sqlite:";

  /**
   * Classpath resource consulted by {@link #load()}.
   */
  public static final String RESOURCE = "dal.properties";
  public static final String FILE_KEY = "dal.file";

  private final String file;

  /**/
  public JdbcInfo(String file) {
    if (file == null || file.trim().isEmpty()) {
      throw new IllegalArgumentException("Database file must not be blank.");
    }
    this.file = file.trim();
  }

  /**/
  public JdbcInfo() {
    this(DEFAULT_FILE);
  }

  /**/
  public static JdbcInfo of(String file) {
    return new JdbcInfo(file);
  }

  /**
   * Reads {@value #FILE_KEY}, falling back to {@value #DEFAULT_FILE}.
   */
  public static JdbcInfo fromProperties(Properties props) {
    String f= props == null ? null : props.getProperty(FILE_KEY);
    return (f == null || f.trim().isEmpty())
      ? new JdbcInfo() : new JdbcInfo(f);
  }

  /**
   * Looks for {@value #RESOURCE} on the classpath.
   */
  public static JdbcInfo load() throws IOException {
    ClassLoader cl= Thread.currentThread().getContextClassLoader();
    if (cl == null) {
      cl= JdbcInfo.class.getClassLoader();
    }
    try (InputStream inp= cl.getResourceAsStream(RESOURCE)) {
      if (inp == null) {
        return new JdbcInfo();
      }
      Properties props= new Properties();
      props.load(inp);
      return fromProperties(props);
    }
  }

  /**/
  public String file() { return file; }

  /**/
  public String url() { return URL_PREFIX + file; }

  /**/
  public boolean inMemory() { return MEMORY.equals(file); }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof JdbcInfo && file.equals(((JdbcInfo) obj).file);
  }

  @Override
  public int hashCode() {
    return file.hashCode();
  }

  @Override
  public String toString() {
    return url();
  }

}


