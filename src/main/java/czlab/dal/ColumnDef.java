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

/**
 * A column in a CREATE TABLE statement, e.g. ("id", "INTEGER", "PRIMARY KEY").
 * Type and options are passed to SQLite as is, so never build them from
 * untrusted input.
 *
 * @author Kenneth Leung
 */
public final class ColumnDef {

  private final String name;
  private final String type;
  private final String options;

  /**/
  public ColumnDef(String name, String type, String options) {
    if (name == null || name.trim().isEmpty()) {
      throw new IllegalArgumentException("Column name must not be blank.");
    }
    if (type == null || type.trim().isEmpty()) {
      throw new IllegalArgumentException("Column " + name + " needs a type.");
    }
    this.name = name;
    this.type = type.trim();
    this.options = options == null ? "" : options.trim();
  }

  /**/
  public static ColumnDef of(String name, String type) {
    return new ColumnDef(name, type, null);
  }

  /**/
  public static ColumnDef of(String name, String type, String options) {
    return new ColumnDef(name, type, options);
  }

  /**/
  public String name() { return name; }

  /**/
  public String type() { return type; }

  /**
   * Empty when there are none.
   */
  public String options() { return options; }

  @Override
  public String toString() {
    return options.isEmpty()
      ? name + " " + type : name + " " + type + " " + options;
  }

}


