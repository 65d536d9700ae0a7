package io.github.eutro.jvmjit.test;

/**
 * Methods compiled by javac, read back from their class file in {@link FixturesTest}.
 */
@SuppressWarnings("unused")
public class Fixtures {
    public static int fib(int n) {
        int a = 0;
        int b = 1;
        for (int i = 0; i < n; i++) {
            int t = a + b;
            a = b;
            b = t;
        }
        return a;
    }

    public static long gcd(long a, long b) {
        while (b != 0) {
            long t = a % b;
            a = b;
            b = t;
        }
        return a;
    }

    public static int collatz(int n) {
        int steps = 0;
        while (n != 1) {
            n = (n & 1) == 0 ? n / 2 : 3 * n + 1;
            steps++;
        }
        return steps;
    }

    public static boolean isPrime(int n) {
        if (n < 2) return false;
        for (int i = 2; i * i <= n; i++) {
            if (n % i == 0) return false;
        }
        return true;
    }

    public static long factorial(int n) {
        long result = 1;
        for (int i = 2; i <= n; i++) {
            result *= i;
        }
        return result;
    }

    public static int classify(int x) {
        switch (x) {
            case 1:
                return 10;
            case 2:
                return 20;
            case 3:
                return 30;
            case 100:
                return 1000;
            default:
                return -1;
        }
    }

    public static int dense(int x) {
        switch (x) {
            case 0:
                return 5;
            case 1:
                return 4;
            case 2:
            case 3:
                return 3;
            case 4:
                return 1;
            default:
                return 0;
        }
    }

    public static float clamp(float x, float lo, float hi) {
        return x < lo ? lo : x > hi ? hi : x;
    }

    public static int compare(double a, double b) {
        return a < b ? -1 : a > b ? 1 : 0;
    }

    public static int sumOfSquares(int n) {
        int[] squares = new int[n];
        for (int i = 0; i < n; i++) {
            squares[i] = i * i;
        }
        int sum = 0;
        for (int square : squares) {
            sum += square;
        }
        return sum;
    }

    public static int sum(int[] values) {
        int sum = 0;
        for (int value : values) {
            sum += value;
        }
        return sum;
    }

    public static double mean(double[] values) {
        double sum = 0;
        for (int i = 0; i < values.length; i++) {
            sum += values[i];
        }
        return values.length == 0 ? 0 : sum / values.length;
    }

    public static char upper(char c) {
        return c >= 'a' && c <= 'z' ? (char) (c - 32) : c;
    }

    public static long mix(long x, int shift) {
        x ^= x >>> shift;
        x *= 0x9E3779B97F4A7C15L;
        return x ^ (x >>> 31);
    }

    public static void nothing() {
    }

    public static int length(String s) {
        return s.length();
    }

    public static int callsOther(int x) {
        return fib(x) + 1;
    }

    public static int guarded(int x) {
        try {
            return 10 / x;
        } catch (ArithmeticException e) {
            return 0;
        }
    }

    public int instance() {
        return 0;
    }
}
