package ca.gc.cra.clipstitch.domain.media;

import java.math.BigInteger;

/**
 * Integer timestamp arithmetic for converting between timescales without floating point.
 *
 * <p>Products are computed in {@code long} and fall back to {@link BigInteger} only when they
 * overflow, so the per-sample path stays allocation free for realistic inputs.</p>
 *
 * @since 0.1.0
 */
public final class TickMath {
  /** Nanoseconds per second; the common unit for segment lengths. */
  public static final long NANOS_PER_SECOND = 1_000_000_000L;

  private TickMath() {
    // Utility
  }

  /**
   * Computes {@code floor(value * multiplier / divisor)}.
   *
   * @param value signed value
   * @param multiplier non-negative multiplier
   * @param divisor positive divisor
   * @return floored quotient
   * @throws IllegalArgumentException if {@code divisor} is not positive
   * @throws ArithmeticException if the quotient does not fit in a {@code long}
   */
  public static long mulDivFloor(long value, long multiplier, long divisor) {
    requirePositive(divisor);
    try {
      return Math.floorDiv(Math.multiplyExact(value, multiplier), divisor);
    } catch (ArithmeticException overflow) {
      BigInteger product = BigInteger.valueOf(value).multiply(BigInteger.valueOf(multiplier));
      return floorDiv(product, BigInteger.valueOf(divisor)).longValueExact();
    }
  }

  /**
   * Computes {@code ceil(value * multiplier / divisor)}.
   *
   * @param value signed value
   * @param multiplier non-negative multiplier
   * @param divisor positive divisor
   * @return ceiling quotient
   * @throws IllegalArgumentException if {@code divisor} is not positive
   * @throws ArithmeticException if the quotient does not fit in a {@code long}
   */
  public static long mulDivCeil(long value, long multiplier, long divisor) {
    requirePositive(divisor);
    try {
      return -Math.floorDiv(Math.negateExact(Math.multiplyExact(value, multiplier)), divisor);
    } catch (ArithmeticException overflow) {
      BigInteger product = BigInteger.valueOf(value).multiply(BigInteger.valueOf(multiplier));
      return floorDiv(product.negate(), BigInteger.valueOf(divisor)).negate().longValueExact();
    }
  }

  /**
   * Rescales a tick count from one timescale into another, rounding down.
   *
   * @param ticks tick count in {@code fromTimescale}
   * @param fromTimescale source ticks per second; positive
   * @param toTimescale destination ticks per second; positive
   * @return tick count in {@code toTimescale}
   */
  public static long rescale(long ticks, long fromTimescale, long toTimescale) {
    if (fromTimescale == toTimescale) {
      return ticks;
    }
    return mulDivFloor(ticks, toTimescale, fromTimescale);
  }

  /**
   * Greatest common divisor of two non-negative values.
   *
   * @param a first value
   * @param b second value
   * @return gcd, {@code a} when {@code b == 0}
   */
  public static long gcd(long a, long b) {
    long x = Math.abs(a);
    long y = Math.abs(b);
    while (y != 0) {
      long t = x % y;
      x = y;
      y = t;
    }
    return x;
  }

  private static BigInteger floorDiv(BigInteger numerator, BigInteger divisor) {
    BigInteger[] qr = numerator.divideAndRemainder(divisor);
    if (qr[1].signum() < 0) {
      return qr[0].subtract(BigInteger.ONE);
    }
    return qr[0];
  }

  private static void requirePositive(long divisor) {
    if (divisor <= 0) {
      throw new IllegalArgumentException("divisor must be positive (was " + divisor + ")");
    }
  }
}
