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
package exm.sct.ir.maths;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import org.apache.commons.lang3.math.Fraction;

/**
 * Polynomial with exact rational coefficients over named atoms.
 * Immutable.  Arithmetic throws ArithmeticException on overflow.
 */
class Polynomial {

  /**
   * Product of atoms with positive exponents.  The empty monomial is 1.
   */
  static class Monomial implements Comparable<Monomial> {
    private final TreeMap<String, Integer> powers;
    private final String key;

    static final Monomial ONE = new Monomial(new TreeMap<String, Integer>());

    private Monomial(TreeMap<String, Integer> powers) {
      this.powers = powers;
      StringBuilder sb = new StringBuilder();
      for (Map.Entry<String, Integer> e: powers.entrySet()) {
        if (sb.length() > 0) {
          sb.append("*");
        }
        sb.append(e.getKey());
        if (e.getValue() != 1) {
          sb.append("^");
          sb.append(e.getValue());
        }
      }
      this.key = sb.toString();
    }

    static Monomial atom(String atom) {
      TreeMap<String, Integer> powers = new TreeMap<String, Integer>();
      powers.put(atom, 1);
      return new Monomial(powers);
    }

    Monomial times(Monomial other) {
      TreeMap<String, Integer> result = new TreeMap<String, Integer>(powers);
      for (Map.Entry<String, Integer> e: other.powers.entrySet()) {
        Integer prev = result.get(e.getKey());
        result.put(e.getKey(), prev == null ? e.getValue()
                                            : prev + e.getValue());
      }
      return new Monomial(result);
    }

    Set<String> atoms() {
      return Collections.unmodifiableSet(powers.keySet());
    }

    boolean isOne() {
      return powers.isEmpty();
    }

    @Override
    public int compareTo(Monomial o) {
      return key.compareTo(o.key);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Monomial && key.equals(((Monomial)obj).key);
    }

    @Override
    public int hashCode() {
      return key.hashCode();
    }

    @Override
    public String toString() {
      return key;
    }
  }

  private final TreeMap<Monomial, Fraction> terms;

  private Polynomial(TreeMap<Monomial, Fraction> terms) {
    this.terms = terms;
  }

  static Polynomial constant(Fraction value) {
    TreeMap<Monomial, Fraction> terms = new TreeMap<Monomial, Fraction>();
    addTerm(terms, Monomial.ONE, value);
    return new Polynomial(terms);
  }

  static Polynomial atom(String atom) {
    TreeMap<Monomial, Fraction> terms = new TreeMap<Monomial, Fraction>();
    terms.put(Monomial.atom(atom), Fraction.ONE);
    return new Polynomial(terms);
  }

  private static void addTerm(TreeMap<Monomial, Fraction> terms, Monomial m,
                              Fraction coeff) {
    Fraction prev = terms.get(m);
    Fraction sum = prev == null ? coeff : prev.add(coeff);
    if (sum.getNumerator() == 0) {
      terms.remove(m);
    } else {
      terms.put(m, sum.reduce());
    }
  }

  Polynomial plus(Polynomial other) {
    TreeMap<Monomial, Fraction> result =
                          new TreeMap<Monomial, Fraction>(terms);
    for (Map.Entry<Monomial, Fraction> e: other.terms.entrySet()) {
      addTerm(result, e.getKey(), e.getValue());
    }
    return new Polynomial(result);
  }

  Polynomial negate() {
    TreeMap<Monomial, Fraction> result = new TreeMap<Monomial, Fraction>();
    for (Map.Entry<Monomial, Fraction> e: terms.entrySet()) {
      result.put(e.getKey(), e.getValue().negate());
    }
    return new Polynomial(result);
  }

  Polynomial minus(Polynomial other) {
    return plus(other.negate());
  }

  Polynomial times(Polynomial other) {
    TreeMap<Monomial, Fraction> result = new TreeMap<Monomial, Fraction>();
    for (Map.Entry<Monomial, Fraction> a: terms.entrySet()) {
      for (Map.Entry<Monomial, Fraction> b: other.terms.entrySet()) {
        addTerm(result, a.getKey().times(b.getKey()),
                a.getValue().multiplyBy(b.getValue()));
      }
    }
    return new Polynomial(result);
  }

  boolean isZero() {
    return terms.isEmpty();
  }

  boolean isConstant() {
    return terms.isEmpty() ||
        (terms.size() == 1 && terms.firstKey().isOne());
  }

  /**
   * @return value of a constant polynomial
   */
  Fraction constantValue() {
    if (!isConstant()) {
      throw new IllegalStateException("Not constant: " + this);
    }
    return terms.isEmpty() ? Fraction.ZERO : terms.firstEntry().getValue();
  }

  Set<String> atoms() {
    Set<String> result = new TreeSet<String>();
    for (Monomial m: terms.keySet()) {
      result.addAll(m.atoms());
    }
    return result;
  }

  /**
   * Canonical text: equal polynomials have equal text
   */
  @Override
  public String toString() {
    if (terms.isEmpty()) {
      return "0";
    }
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<Monomial, Fraction> e: terms.entrySet()) {
      if (sb.length() > 0) {
        sb.append(" + ");
      }
      Fraction c = e.getValue();
      if (e.getKey().isOne()) {
        sb.append(c);
      } else if (c.equals(Fraction.ONE)) {
        sb.append(e.getKey());
      } else {
        sb.append(c);
        sb.append("*");
        sb.append(e.getKey());
      }
    }
    return sb.toString();
  }
}
