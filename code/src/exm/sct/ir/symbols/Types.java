/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.sct.ir.symbols;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;

/**
 * Semantic types of data symbols.
 *
 * Scalars are described by an intrinsic and an optional precision (kind).
 * Arrays have a scalar element type and a shape made of extents; an extent
 * can be a literal, a scalar integer symbol, or deferred (assumed shape).
 * Unresolved types use {@link #DEFERRED}; declarations the IR does not model
 * are kept verbatim in an {@link UnknownType}.
 */
public class Types {

  public enum Intrinsic {
    INTEGER,
    REAL,
    BOOLEAN,
    CHARACTER;
  }

  /** Use the default precision of the intrinsic */
  public static final int DEFAULT_PRECISION = 0;

  public static final ScalarType INTEGER_TYPE =
                          new ScalarType(Intrinsic.INTEGER, DEFAULT_PRECISION);
  public static final ScalarType REAL_TYPE =
                          new ScalarType(Intrinsic.REAL, DEFAULT_PRECISION);
  public static final ScalarType DOUBLE_TYPE = new ScalarType(Intrinsic.REAL, 8);
  public static final ScalarType BOOLEAN_TYPE =
                          new ScalarType(Intrinsic.BOOLEAN, DEFAULT_PRECISION);
  public static final ScalarType CHARACTER_TYPE =
                          new ScalarType(Intrinsic.CHARACTER, DEFAULT_PRECISION);

  public static final DeferredType DEFERRED = new DeferredType();

  public static abstract class Type {
    public abstract String typeName();

    @Override
    public String toString() {
      return typeName();
    }
  }

  public static class ScalarType extends Type {
    private final Intrinsic intrinsic;
    private final int precision;

    public ScalarType(Intrinsic intrinsic, int precision) {
      Preconditions.checkNotNull(intrinsic);
      Preconditions.checkArgument(precision >= 0, "negative precision");
      this.intrinsic = intrinsic;
      this.precision = precision;
    }

    public Intrinsic intrinsic() {
      return intrinsic;
    }

    public int precision() {
      return precision;
    }

    public boolean isInteger() {
      return intrinsic == Intrinsic.INTEGER;
    }

    public boolean isReal() {
      return intrinsic == Intrinsic.REAL;
    }

    @Override
    public String typeName() {
      String name = intrinsic.name().toLowerCase();
      if (precision != DEFAULT_PRECISION) {
        name += "(" + precision + ")";
      }
      return name;
    }

    @Override
    public int hashCode() {
      return intrinsic.hashCode() * 31 + precision;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof ScalarType)) {
        return false;
      }
      ScalarType other = (ScalarType)obj;
      return intrinsic == other.intrinsic && precision == other.precision;
    }
  }

  /**
   * Upper extent of one array dimension; lower bounds are always 1
   */
  public static class Extent {
    private final Integer literal;
    private final DataSymbol symbol;

    private static final Extent DEFERRED_EXTENT = new Extent(null, null);

    private Extent(Integer literal, DataSymbol symbol) {
      this.literal = literal;
      this.symbol = symbol;
    }

    public static Extent of(int upper) {
      Preconditions.checkArgument(upper >= 0,
                          "Array extent must not be negative: " + upper);
      return new Extent(upper, null);
    }

    /**
     * Only scalar integer symbols may bound an array
     */
    public static Extent of(DataSymbol upper) {
      Preconditions.checkNotNull(upper);
      Type t = upper.getDatatype();
      boolean ok = t instanceof DeferredType ||
          (t instanceof ScalarType && ((ScalarType)t).isInteger());
      Preconditions.checkArgument(ok, "Array extent symbol '" +
          upper.getName() + "' must be a scalar integer but is " + t);
      return new Extent(null, upper);
    }

    public static Extent deferred() {
      return DEFERRED_EXTENT;
    }

    public boolean isLiteral() {
      return literal != null;
    }

    public boolean isSymbol() {
      return symbol != null;
    }

    public boolean isDeferred() {
      return literal == null && symbol == null;
    }

    public int literal() {
      Preconditions.checkState(literal != null, "Not a literal extent");
      return literal;
    }

    public DataSymbol symbol() {
      return symbol;
    }

    @Override
    public String toString() {
      if (literal != null) {
        return literal.toString();
      } else if (symbol != null) {
        return symbol.getName();
      } else {
        return ":";
      }
    }
  }

  public static class ArrayType extends Type {
    private final ScalarType elementType;
    private final List<Extent> shape;

    public ArrayType(ScalarType elementType, List<Extent> shape) {
      Preconditions.checkNotNull(elementType);
      Preconditions.checkArgument(!shape.isEmpty(),
                                  "Array must have at least one dimension");
      this.elementType = elementType;
      this.shape = Collections.unmodifiableList(new ArrayList<Extent>(shape));
    }

    public ScalarType elementType() {
      return elementType;
    }

    public List<Extent> shape() {
      return shape;
    }

    public int rank() {
      return shape.size();
    }

    /**
     * @return equivalent type with extent symbols replaced per the map
     */
    public ArrayType rebind(Map<Symbol, Symbol> renames) {
      List<Extent> newShape = new ArrayList<Extent>(shape.size());
      boolean changed = false;
      for (Extent e: shape) {
        if (e.isSymbol() && renames.containsKey(e.symbol())) {
          newShape.add(Extent.of((DataSymbol)renames.get(e.symbol())));
          changed = true;
        } else {
          newShape.add(e);
        }
      }
      return changed ? new ArrayType(elementType, newShape) : this;
    }

    public boolean usesSymbol(Symbol sym) {
      for (Extent e: shape) {
        if (e.isSymbol() && e.symbol() == sym) {
          return true;
        }
      }
      return false;
    }

    @Override
    public String typeName() {
      return elementType.typeName() + shape.toString();
    }
  }

  /**
   * Type not known yet, e.g. a symbol imported with a wildcard use
   */
  public static class DeferredType extends Type {
    private DeferredType() {
    }

    @Override
    public String typeName() {
      return "deferred";
    }
  }

  /**
   * A declaration the IR does not model, kept as text
   */
  public static class UnknownType extends Type {
    private final String declaration;

    public UnknownType(String declaration) {
      this.declaration = declaration;
    }

    public String declaration() {
      return declaration;
    }

    @Override
    public String typeName() {
      return "unknown(" + declaration + ")";
    }
  }

  /**
   * @return scalar type of elements if array, the type itself if scalar,
   *          otherwise null
   */
  public static ScalarType scalarOf(Type t) {
    if (t instanceof ScalarType) {
      return (ScalarType)t;
    } else if (t instanceof ArrayType) {
      return ((ArrayType)t).elementType();
    } else {
      return null;
    }
  }
}
