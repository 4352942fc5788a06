package com.hellohttp.internal.microhttp;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates byte arrays and concatenates them into a single array on demand.
 */
class ByteMerger {

    private final List<byte[]> arrays = new ArrayList<>();

    void add(byte[] array) {
        arrays.add(array);
    }

    byte[] merge() {
        int size = 0;
        for (byte[] array : arrays) {
            size += array.length;
        }
        byte[] result = new byte[size];
        int offset = 0;
        for (byte[] array : arrays) {
            System.arraycopy(array, 0, result, offset, array.length);
            offset += array.length;
        }
        return result;
    }

}
