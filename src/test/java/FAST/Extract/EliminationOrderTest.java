package FAST.Extract;

import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class EliminationOrderTest {
  // state:       0  1  2  3
  private static final int[] IN = {2, 1, 3, 1};
  private static final int[] OUT = {1, 3, 1, 2};

  private static int select(EliminationOrder order, int... remaining) {
    IntSortedSet set = new IntRBTreeSet(remaining);
    return order.select(set, s -> IN[s], s -> OUT[s]);
  }

  @Test
  void testCreationOrder() {
    Assertions.assertEquals(0, select(EliminationOrder.creationOrder(), 0, 1, 2, 3));
    Assertions.assertEquals(2, select(EliminationOrder.creationOrder(), 3, 2));
  }

  @Test
  void testDegreeOrders() {
    // ties go to the oldest state
    Assertions.assertEquals(0, select(EliminationOrder.outDegreeAscending(), 0, 1, 2, 3));
    Assertions.assertEquals(2, select(EliminationOrder.outDegreeAscending(), 1, 2, 3));
    Assertions.assertEquals(1, select(EliminationOrder.inDegreeAscending(), 0, 1, 2, 3));
    Assertions.assertEquals(3, select(EliminationOrder.inDegreeAscending(), 0, 2, 3));
    // products: 2, 3, 3, 2
    Assertions.assertEquals(0, select(EliminationOrder.degreeProductAscending(), 0, 1, 2, 3));
    Assertions.assertEquals(3, select(EliminationOrder.degreeProductAscending(), 1, 2, 3));
  }

  @Test
  void testNames() {
    Assertions.assertEquals("creation", EliminationOrder.creationOrder().getName());
    Assertions.assertEquals("outDegree", EliminationOrder.outDegreeAscending().getName());
    Assertions.assertEquals("inDegree", EliminationOrder.inDegreeAscending().getName());
    Assertions.assertEquals("degreeProduct", EliminationOrder.degreeProductAscending().getName());
  }
}
