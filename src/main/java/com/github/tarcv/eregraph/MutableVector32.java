// New code and changes are © 2024 TarCV
// © 2016 and later: Unicode, Inc. and others.
// License & terms of use: http://www.unicode.org/copyright.html
/*
 *******************************************************************************
 * Copyright (C) 2014, International Business Machines Corporation and
 * others. All Rights Reserved.
 *******************************************************************************
 *
 * created on: 2014feb10
 * created by: Markus W. Scherer
 */
package com.github.tarcv.eregraph;

import java.util.Arrays;

// Growable array of ints without auto-boxing to Integer.
// Used for state and transition indices while an automaton is built.
final class MutableVector32 {
    private int[] buffer;
    private int length = 0;

    public MutableVector32() {
        this(-1);
    }

    public MutableVector32(final int initialCapacity) {
        int fixedCapacity = initialCapacity;
        if (fixedCapacity < 1) {
            fixedCapacity = 4;
        }
        buffer = new int[fixedCapacity];
    }

    public boolean isEmpty() { return length == 0; }
    public int size() { return length; }
    public int elementAti(final int i) {
        if (i < 0 || i >= length) {
            throw new IndexOutOfBoundsException("Index " + i + ", size " + length);
        }
        return buffer[i];
    }
    public void addElement(final int e) {
        ensureCapacity(length + 1);
        buffer[length++] = e;
    }

    void ensureCapacity(final int minimumCapacity) {
        if (minimumCapacity < 0) {
            throw new IllegalArgumentException();
        }
        if (buffer.length < minimumCapacity) {
            expandCapacity(minimumCapacity);
        }
    }

    private void expandCapacity(final int minimumCapacity) {
        int newCap = buffer.length <= 0xffff ? 4 * buffer.length : 2 * buffer.length;
        if (newCap < minimumCapacity) {
            newCap = minimumCapacity;
        }
        buffer = Arrays.copyOf(buffer, newCap);
    }

    public int popi() {
        int result = 0;
        if (length > 0) {
            length--;
            result = buffer[length];
        }
        return result;
    }

    public int push(final int i) {
        addElement(i);
        return i;
    }

    public int[] toArray() {
        return Arrays.copyOf(buffer, length);
    }
}
