package edu.sunyk.containers.trees;

import static edu.sunyk.containers.trees.TreeShapes.keys;
import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.RepetitionInfo;

/**
 * Random insert/delete sequences checked against {@link TreeMap} after every call.
 */
public class RedBlackTreePropertyTest {

    private static final int OPERATIONS = 2000;
    private static final int KEY_RANGE = 400;

    @RepeatedTest(20)
    public void matchesTreeMapWithReplace(RepetitionInfo info) {
        Random random = new Random(info.getCurrentRepetition());
        RedBlackTree<Integer, Integer> tree = new RedBlackTree<>(DuplicatePolicy.REPLACE);
        TreeMap<Integer, Integer> model = new TreeMap<>();

        for(int i = 0; i < OPERATIONS; i++) {
            int key = random.nextInt(KEY_RANGE);
            if(random.nextInt(3) < 2) {
                assertEquals(model.put(key, i), tree.insert(key, i));
            }
            else {
                Integer expected = model.remove(key);
                Entry<Integer, Integer> removed = tree.delete(key);
                if(expected == null)
                    assertNull(removed);
                else
                    assertEquals(expected, removed.value());
            }
            checkAgainst(model, tree);
        }

        for(Map.Entry<Integer, Integer> e : model.entrySet())
            assertEquals(e.getValue(), tree.find(e.getKey()));
    }

    @RepeatedTest(10)
    public void matchesMultimapWithAppend(RepetitionInfo info) {
        Random random = new Random(1000 + info.getCurrentRepetition());
        RedBlackTree<Integer, Integer> tree = new RedBlackTree<>(DuplicatePolicy.APPEND);
        TreeMap<Integer, Deque<Integer>> model = new TreeMap<>();
        int modelSize = 0;

        for(int i = 0; i < OPERATIONS; i++) {
            //few keys so that duplicates are common
            int key = random.nextInt(KEY_RANGE / 8);
            int op = random.nextInt(5);
            if(op < 3) {
                assertNull(tree.insert(key, i));
                model.computeIfAbsent(key, k -> new ArrayDeque<>()).addLast(i);
                modelSize++;
            }
            else if(op == 3) {
                Deque<Integer> values = model.get(key);
                Entry<Integer, Integer> removed = tree.delete(key);
                if(values == null) {
                    assertNull(removed);
                }
                else {
                    assertEquals(values.removeLast(), removed.value());
                    if(values.isEmpty())
                        model.remove(key);
                    modelSize--;
                }
            }
            else if(modelSize > 0) {
                Map.Entry<Integer, Deque<Integer>> first = model.firstEntry();
                Entry<Integer, Integer> polled = tree.pollFirst();
                assertEquals(first.getKey(), polled.key());
                assertEquals(first.getValue().removeFirst(), polled.value());
                if(first.getValue().isEmpty())
                    model.remove(first.getKey());
                modelSize--;
            }

            ValidationResult result = tree.validate();
            assertTrue(result.isValid(), result.toString());
            assertEquals(modelSize, tree.size());
            Deque<Integer> values = model.get(key);
            assertEquals(values == null ? null : values.peekLast(), tree.find(key));
        }

        List<Integer> expectedValues = new ArrayList<>();
        model.values().forEach(expectedValues::addAll);
        List<Integer> actualValues = new ArrayList<>();
        tree.inorder().forEach(e -> actualValues.add(e.value()));
        assertEquals(expectedValues, actualValues);
    }

    @RepeatedTest(5)
    public void blackHeightIsLogarithmic(RepetitionInfo info) {
        Random random = new Random(77 * info.getCurrentRepetition());
        RedBlackTree<Integer, Integer> tree = new RedBlackTree<>();
        for(int n = 1; n <= 4096; n++) {
            tree.insert(random.nextInt(), n);
            if(Integer.bitCount(n) == 1) {
                double bound = 2 * Math.log(n + 1) / Math.log(2);
                ValidationResult result = tree.validate();
                assertTrue(result.isValid());
                assertTrue(result.blackHeight() <= bound, "black height " + result.blackHeight() + " for " + n);
                assertTrue(tree.height() <= bound, "height " + tree.height() + " for " + n);
            }
        }
    }

    private static void checkAgainst(TreeMap<Integer, Integer> model, RedBlackTree<Integer, Integer> tree) {
        ValidationResult result = tree.validate();
        assertTrue(result.isValid(), result.toString());
        assertEquals(model.size(), tree.size());
        List<Integer> inorder = keys(tree.inorder());
        assertEquals(tree.size(), inorder.size());
        assertEquals(new ArrayList<>(model.keySet()), inorder);
    }
}
