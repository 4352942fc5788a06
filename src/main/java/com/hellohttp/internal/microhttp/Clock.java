package com.hellohttp.internal.microhttp;

interface Clock {
    long nanoTime();
}
