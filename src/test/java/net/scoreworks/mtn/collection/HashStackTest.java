package net.scoreworks.mtn.collection;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class HashStackTest {
    HashStack<String, Integer> stacks;

    @BeforeEach
    public void createStacks() {
        stacks = new HashStack<>();
        stacks.pushValue("a", 1);
        stacks.pushValue("a", 2);
        stacks.pushValue("b", 3);
    }

    @Test
    public void stacksPerKey() {
        Assertions.assertEquals(2, stacks.getStackTop("a"));
        Assertions.assertEquals(1, stacks.getStackBottom("a"));
        Assertions.assertEquals(3, stacks.getStackTop("b"));
        Assertions.assertEquals(2, stacks.getStackSize("a"));
        Assertions.assertNull(stacks.getStackTop("c"));
        Assertions.assertEquals(0, stacks.getStackSize("c"));
    }

    @Test
    public void popping() {
        Assertions.assertEquals(2, stacks.popValue("a"));
        Assertions.assertEquals(1, stacks.popValue("a"));
        Assertions.assertNull(stacks.popValue("a"));
        Assertions.assertTrue(stacks.isStackEmpty("a"));
        Assertions.assertFalse(stacks.isEmpty());
        stacks.popValue("b");
        Assertions.assertTrue(stacks.isEmpty());
    }

    @Test
    public void clearing() {
        stacks.clearStack("a");
        Assertions.assertTrue(stacks.isStackEmpty("a"));
        Assertions.assertEquals(3, stacks.getStackTop("b"));
    }
}
