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

import java.util.Locale;

/**
 * A single predicate of a WHERE clause: column, comparator, value.
 * The value is always bound as a parameter.
 *
 * @author Kenneth Leung
 */
public final class Criterion {

  /**
   * Comparators allowed in a criterion.
   */
  public enum Op {
    EQ("="),
    EQEQ("=="),
    NE("!="),
    LTGT("<>"),
    LT("<"),
    LTE("<="),
    GT(">"),
    GTE(">="),
    LIKE("LIKE"),
    NOT_LIKE("NOT LIKE"),
    GLOB("GLOB"),
    IS("IS"),
    IS_NOT("IS NOT");

    private final String token;

    private Op(String token) {
      this.token = token;
    }

    /**/
    public String token() { return token; }

    /**
     * Case and spacing of word operators do not matter, e.g. "not  like".
     */
    public static Op parse(String s) throws DbioError {
      if (s != null) {
        String t= s.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
        for (Op op : values()) {
          if (op.token.equals(t)) {
            return op;
          }
        }
      }
      throw new DbioError("Unsupported comparator: " + s);
    }

    @Override
    public String toString() {
      return token;
    }
  }

  private final String column;
  private final Op op;
  private final Object value;

  /**/
  public Criterion(String column, Op op, Object value) {
    if (column == null || column.isEmpty()) {
      throw new IllegalArgumentException("Criterion needs a column.");
    }
    if (op == null) {
      throw new IllegalArgumentException("Criterion needs a comparator.");
    }
    this.column = column;
    this.op = op;
    this.value = value;
  }

  /**/
  public static Criterion of(String column, Op op, Object value) {
    return new Criterion(column, op, value);
  }

  /**/
  public static Criterion of(String column, String op, Object value) throws DbioError {
    return new Criterion(column, Op.parse(op), value);
  }

  /**/
  public static Criterion eq(String column, Object value) {
    return new Criterion(column, Op.EQ, value);
  }

  /**/
  public String column() { return column; }

  /**/
  public Op op() { return op; }

  /**/
  public Object value() { return value; }

  /**
   * Same criterion against another spelling of the column.
   */
  Criterion withColumn(String col) {
    return col.equals(column) ? this : new Criterion(col, op, value);
  }

  @Override
  public String toString() {
    return "(" + column + " " + op + " " + value + ")";
  }

}


