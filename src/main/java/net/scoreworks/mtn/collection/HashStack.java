/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.collection;

import java.util.ArrayList;
import java.util.HashMap;

/**
 * Independent stacks addressed by a key. Missing stacks behave like empty ones
 */
public class HashStack<K, V> extends HashMap<K, ArrayList<V>> {

    public V getStackTop(K key) {
        ArrayList<V> stack = get(key);
        if (stack == null || stack.isEmpty())
            return null;
        return stack.get(stack.size()-1);
    }

    public V getStackBottom(K key) {
        ArrayList<V> stack = get(key);
        if (stack == null || stack.isEmpty())
            return null;
        return stack.get(0);
    }

    public int pushValue(K key, V value) {
        ArrayList<V> stack = computeIfAbsent(key, k -> new ArrayList<>());
        stack.add(value);
        return stack.size()-1;
    }

    /**
     * @return the removed top of the stack or null if it was empty
     */
    public V popValue(K key) {
        ArrayList<V> stack = get(key);
        if (stack == null || stack.isEmpty())
            return null;
        return stack.remove(stack.size()-1);
    }

    public int getStackSize(K key) {
        ArrayList<V> stack = get(key);
        return stack == null ? 0 : stack.size();
    }

    public boolean isStackEmpty(K key) {
        return getStackSize(key) == 0;
    }

    public void clearStack(K key) {
        remove(key);
    }

    @Override
    public boolean isEmpty() {
        for (ArrayList<V> stack : values()) {
            if (!stack.isEmpty())
                return false;
        }
        return true;
    }
}
