package TableFill.Partition;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class UnionFindTest {
  @Test
  void testUnion() {
    UnionFind uf = new UnionFind(6);
    Assertions.assertEquals(6, uf.size());
    Assertions.assertEquals(6, uf.count());
    Assertions.assertFalse(uf.connected(0, 1));

    Assertions.assertTrue(uf.union(0, 1));
    Assertions.assertTrue(uf.union(2, 3));
    Assertions.assertTrue(uf.union(1, 3));
    Assertions.assertFalse(uf.union(0, 2)); // already joined through 1 and 3
    Assertions.assertEquals(3, uf.count());
    Assertions.assertTrue(uf.connected(0, 3));
    Assertions.assertFalse(uf.connected(0, 4));
    Assertions.assertEquals(uf.find(2), uf.find(0));
  }

  @Test
  void testLongChain() {
    int n = 100000;
    UnionFind uf = new UnionFind(n);
    for (int i = 1; i < n; i++) {
      uf.union(i - 1, i);
    }
    Assertions.assertEquals(1, uf.count());
    Assertions.assertTrue(uf.connected(0, n - 1));
  }
}
