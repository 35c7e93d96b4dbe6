package com.example.agentdemo.Variant;

import java.util.Random;

/**
 * 항상 같은 값을 내는 난수원 (확률 게이트 고정용)
 */
public class StubRandom extends Random {

    private final double nextDouble;
    private final int nextInt;

    public StubRandom(double nextDouble, int nextInt) {
        this.nextDouble = nextDouble;
        this.nextInt = nextInt;
    }

    @Override
    public double nextDouble() {
        return nextDouble;
    }

    @Override
    public int nextInt(int bound) {
        return Math.min(nextInt, bound - 1);
    }
}
