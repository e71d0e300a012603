package exm.mct.common.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class HierarchicalMapTest {

  @Test
  public void testPutGet() {
    HierarchicalMap<String, Integer> m = new HierarchicalMap<String, Integer>();
    assertNull(m.put("a", 1));
    assertEquals(Integer.valueOf(1), m.get("a"));
    assertNull(m.get("b"));
    assertEquals(Integer.valueOf(1), m.put("a", 2));
    assertEquals(Integer.valueOf(2), m.get("a"));
  }

  @Test
  public void testChildFallsThrough() {
    HierarchicalMap<String, Integer> root = new HierarchicalMap<String, Integer>();
    root.put("a", 1);
    HierarchicalMap<String, Integer> child = root.makeChildMap();
    assertFalse(child.containsKeyLocally("a"));
    assertEquals(Integer.valueOf(1), child.get("a"));

    child.put("b", 2);
    assertTrue(child.containsKeyLocally("b"));
    assertNull("Parent not touched by child", root.get("b"));
  }

  @Test
  public void testShadowing() {
    HierarchicalMap<String, Integer> root = new HierarchicalMap<String, Integer>();
    root.put("x", 1);
    root.put("y", 2);
    HierarchicalMap<String, Integer> child = root.makeChildMap();
    child.put("x", 10);
    HierarchicalMap<String, Integer> grandchild = child.makeChildMap();

    assertEquals(Integer.valueOf(10), grandchild.get("x"));
    assertEquals(Integer.valueOf(2), grandchild.get("y"));
    assertEquals(Integer.valueOf(1), root.get("x"));
    assertEquals("{x:10 ^{x:1,y:2}}", child.toString());
  }

  @Test(expected=NullPointerException.class)
  public void testNullKey() {
    new HierarchicalMap<String, Integer>().put(null, 1);
  }
}
