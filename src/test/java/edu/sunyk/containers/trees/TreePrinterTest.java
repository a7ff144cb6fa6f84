package edu.sunyk.containers.trees;

import static edu.sunyk.containers.trees.TreeShapes.tree;
import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class TreePrinterTest {

    @Test
    public void testEmptyTreeRendersNothing() {
        assertEquals("", new RedBlackTree<Integer, String>().render());
    }

    @Test
    public void testThreeNodes() {
        assertEquals("20B:Root\n"
                   + "├── 10R:L\n"
                   + "└── 30R:R\n", tree(10, 20, 30).render());
    }

    @Test
    public void testNestedPadding() {
        assertEquals("8B:Root\n"
                   + "├── 4B:L\n"
                   + "│   ├── 2R:L\n"
                   + "│   └── 6R:R\n"
                   + "└── 12B:R\n"
                   + "    ├── 10R:L\n"
                   + "    └── 14R:R\n", tree(8, 4, 12, 2, 6, 10, 14).render());
    }

    @Test
    public void testLoneLeftChildUsesLastPointer() {
        assertEquals("10B:Root\n"
                   + "└── 5R:L\n", tree(10, 5).render());
    }
}
