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
package exm.sct.ir.analysis;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import com.google.common.base.Preconditions;

import exm.sct.ir.tree.Member;
import exm.sct.ir.tree.NodeKind;
import exm.sct.ir.tree.Reference;
import exm.sct.ir.tree.StructureReference;

/**
 * Identifies the variable or structure component an access touches,
 * independent of subscripts, e.g. "a" or "a%b%c".  Case-insensitive.
 */
public class Signature {
  private final List<String> parts;

  public Signature(String... parts) {
    this(Arrays.asList(parts));
  }

  public Signature(List<String> parts) {
    Preconditions.checkArgument(!parts.isEmpty(), "Empty signature");
    List<String> lower = new ArrayList<String>(parts.size());
    for (String p: parts) {
      lower.add(p.toLowerCase());
    }
    this.parts = Collections.unmodifiableList(lower);
  }

  public static Signature of(Reference ref) {
    List<String> parts = new ArrayList<String>();
    parts.add(ref.getName());
    if (ref.kind() == NodeKind.STRUCTURE_REFERENCE) {
      Member m = ((StructureReference)ref).getMember();
      while (m != null) {
        parts.add(m.getName());
        m = m.getNext();
      }
    }
    return new Signature(parts);
  }

  /**
   * @return name of the variable, without member path
   */
  public String getVarName() {
    return parts.get(0);
  }

  public List<String> getParts() {
    return parts;
  }

  public boolean isStructure() {
    return parts.size() > 1;
  }

  /**
   * @return true if one of the signatures is a prefix of the other, so
   *         that an access to one may touch the other: "g" overlaps "g%n"
   */
  public boolean overlaps(Signature other) {
    int n = Math.min(parts.size(), other.parts.size());
    return parts.subList(0, n).equals(other.parts.subList(0, n));
  }

  @Override
  public int hashCode() {
    return parts.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Signature)) {
      return false;
    }
    return parts.equals(((Signature)obj).parts);
  }

  @Override
  public String toString() {
    return StringUtils.join(parts, "%");
  }
}
