package com.onthegomap.tilefetch.util;

import java.math.BigDecimal;
import java.text.NumberFormat;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;
import java.util.stream.DoubleStream;

/**
 * Utilities for formatting values as strings.
 */
public class Format {

  public static final Locale DEFAULT_LOCALE = Locale.getDefault(Locale.Category.FORMAT);

  private static final ConcurrentMap<Locale, Format> instances = new ConcurrentHashMap<>();
  private static final NavigableMap<Long, String> STORAGE_SUFFIXES = new TreeMap<>(Map.ofEntries(
    Map.entry(1_000L, "k"),
    Map.entry(1_000_000L, "M"),
    Map.entry(1_000_000_000L, "G"),
    Map.entry(1_000_000_000_000L, "T"),
    Map.entry(1_000_000_000_000_000L, "P")
  ));

  // `NumberFormat` instances are not thread safe, so we need to wrap them inside a `ThreadLocal`.
  @SuppressWarnings("java:S5164")
  private final ThreadLocal<NumberFormat> pf;
  @SuppressWarnings("java:S5164")
  private final ThreadLocal<NumberFormat> nf;
  @SuppressWarnings("java:S5164")
  private final ThreadLocal<NumberFormat> intF;

  private Format(Locale locale) {
    pf = ThreadLocal.withInitial(() -> {
      var f = NumberFormat.getPercentInstance(locale);
      f.setMaximumFractionDigits(0);
      return f;
    });
    nf = ThreadLocal.withInitial(() -> {
      var f = NumberFormat.getNumberInstance(locale);
      f.setMaximumFractionDigits(1);
      return f;
    });
    intF = ThreadLocal.withInitial(() -> {
      var f = NumberFormat.getNumberInstance(locale);
      f.setMaximumFractionDigits(0);
      return f;
    });
  }

  /**
   * Returns {@code items} joined with a comma, each at full precision in plain notation with no trailing zeros so
   * whole numbers print as integers.
   */
  public static String joinCoordinates(double... items) {
    return DoubleStream.of(items)
      .mapToObj(d -> BigDecimal.valueOf(d).stripTrailingZeros().toPlainString())
      .collect(Collectors.joining(","));
  }

  public static Format forLocale(Locale locale) {
    return instances.computeIfAbsent(locale, Format::new);
  }

  public static Format defaultInstance() {
    return forLocale(DEFAULT_LOCALE);
  }

  /** Returns a number of bytes formatted like "123" "1.2k" "240M", etc. */
  public String storage(Number num) {
    long value = num.longValue();
    if (value < 0) {
      return "-";
    } else if (value < 1000) {
      return Long.toString(value);
    }
    Map.Entry<Long, String> e = STORAGE_SUFFIXES.floorEntry(value);
    long truncated = value / (e.getKey() / 10);
    boolean hasDecimal = truncated < 100 && (truncated % 10 != 0);
    return (hasDecimal ? decimal(truncated / 10d) : Long.toString(truncated / 10)) + e.getValue();
  }

  /** Returns 0.0-1.0 as a "0%" - "100%" with no decimal points. */
  public String percent(double value) {
    return pf.get().format(value);
  }

  /** Returns a number formatted with 1 decimal point. */
  public String decimal(double value) {
    return nf.get().format(value);
  }

  /** Returns a number formatted with 0 decimal points. */
  public String integer(Number value) {
    return intF.get().format(value);
  }

  /** Returns a duration formatted like "1h2m" or "2m3s". */
  public String duration(Duration duration) {
    double seconds = duration.toNanos() * 1d / Duration.ofSeconds(1).toNanos();
    if (seconds < 1) {
      return decimal(seconds) + "s";
    }
    return Duration.ofSeconds(Math.round(seconds)).toString().replace("PT", "").toLowerCase(Locale.ROOT);
  }
}
