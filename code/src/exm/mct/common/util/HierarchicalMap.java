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

package exm.mct.common.util;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;

import com.google.common.base.Preconditions;

/**
 * Map that forms a tree of scopes: lookups fall through to the parent map,
 * insertions only touch the current level.  Parents are never modified
 * through a child.
 */
public class HierarchicalMap<K, V> {
  private final Map<K, V> map;
  private final HierarchicalMap<K, V> parent;

  public HierarchicalMap() {
    this(null);
  }

  private HierarchicalMap(HierarchicalMap<K, V> parent) {
    this.map = new LinkedHashMap<K, V>();
    this.parent = parent;
  }

  public HierarchicalMap<K, V> makeChildMap() {
    return new HierarchicalMap<K,V>(this);
  }

  /**
   * @return true if the key is defined at this level, ignoring parents
   */
  public boolean containsKeyLocally(Object key) {
    return map.containsKey(key);
  }

  public V get(Object key) {
    if (map.containsKey(key)) {
      return map.get(key);
    } else if (parent != null) {
      return parent.get(key);
    } else {
      return null;
    }
  }

  public V put(K key, V value) {
    Preconditions.checkNotNull(key);
    return map.put(key, value);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("{");
    int written = writeContents(sb, true);
    if (parent != null) {
      sb.append(written == 0 ? "" : " ");
      sb.append("^");
      sb.append(parent.toString());
    }
    sb.append("}");
    return sb.toString();
  }

  private int writeContents(StringBuilder sb, boolean first) {
    for (Entry<K, V> e: this.map.entrySet()) {
      if (first) {
        first = false;
      } else {
        sb.append(",");
      }
      sb.append(e.getKey());
      sb.append(":");
      sb.append(e.getValue());
    }
    return map.size();
  }
}
